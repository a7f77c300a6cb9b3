package mergington.activities.infrastructure.executor.strategy;

import mergington.activities.error.exception.ActivitySeedException;
import mergington.activities.error.exception.InternalSystemException;
import mergington.activities.error.exception.base.BaseException;
import mergington.activities.infrastructure.executor.TaskContext;

/**
 * 작업 중 발생한 Throwable을 프로젝트 예외 계층으로 규격화하는 전략
 *
 * <p>모든 전략의 공통 규칙:
 *
 * <ol>
 *   <li>Error는 변환하지 않고 그대로 throw
 *   <li>BaseException은 그대로 전파
 *   <li>관리되지 않은 예외는 InternalSystemException (cause 보존)
 * </ol>
 */
@FunctionalInterface
public interface ExceptionTranslator {

  RuntimeException translate(Throwable e, TaskContext context);

  static ExceptionTranslator defaultTranslator() {
    return (e, context) -> {
      if (e instanceof Error error) {
        throw error;
      }
      if (e instanceof BaseException base) {
        return base;
      }
      if (e instanceof InterruptedException) {
        Thread.currentThread().interrupt();
      }
      return new InternalSystemException(context.toTaskName(), e);
    };
  }

  /** 시드 검증 실패(IllegalArgumentException)를 ActivitySeedException으로 변환 */
  static ExceptionTranslator forSeed() {
    return (e, context) -> {
      if (e instanceof Error error) {
        throw error;
      }
      if (e instanceof IllegalArgumentException iae) {
        return new ActivitySeedException(iae.getMessage(), iae);
      }
      return defaultTranslator().translate(e, context);
    };
  }
}
