package mergington.activities.infrastructure.executor;

import mergington.activities.common.function.ThrowingRunnable;
import mergington.activities.common.function.ThrowingSupplier;
import mergington.activities.infrastructure.executor.strategy.ExceptionTranslator;

/**
 * try-catch-finally 보일러플레이트를 템플릿으로 중앙화한 실행기
 *
 * <h3>사용 패턴</h3>
 *
 * <pre>{@code
 * // 락/자원 해제 보장
 * return executor.executeWithFinally(
 *     () -> doWorkUnderLock(),
 *     lock::unlock,
 *     TaskContext.of("RosterLock", "Guard", activityName));
 *
 * // 예외 변환 전략 지정
 * ActivityDirectory directory = executor.executeWithTranslation(
 *     () -> ActivityDirectory.create(seeds, lockPort, policy),
 *     ExceptionTranslator.forSeed(),
 *     TaskContext.of("Directory", "Seed"));
 * }</pre>
 *
 * <h3>핵심 계약</h3>
 *
 * <ul>
 *   <li><b>Error 즉시 전파</b>: VirtualMachineError 등은 번역 없이 throw
 *   <li><b>BaseException 통과</b>: 비즈니스 예외는 그대로 전파
 *   <li><b>finally 정확히 1회</b>: task 성공/실패와 무관하며, 정리 중 예외는 primary의 suppressed로 합류
 * </ul>
 */
public interface LogicExecutor {

  /** 작업 실행, 실패 시 기본 translator로 변환된 예외를 throw */
  <T> T execute(ThrowingSupplier<T> task, TaskContext context);

  /** 작업 실행, 실패 시 defaultValue 반환 */
  <T> T executeOrDefault(ThrowingSupplier<T> task, T defaultValue, TaskContext context);

  void executeVoid(ThrowingRunnable task, TaskContext context);

  /**
   * finallyBlock 실행을 보장하며 작업 실행
   *
   * @param task 실행할 작업
   * @param finallyBlock 반드시 실행할 정리 작업 (락 해제, MDC 정리 등)
   * @param context 작업 컨텍스트
   * @return 작업 결과
   */
  <T> T executeWithFinally(ThrowingSupplier<T> task, Runnable finallyBlock, TaskContext context);

  /** 호출별 translator를 지정하여 작업 실행 */
  <T> T executeWithTranslation(
      ThrowingSupplier<T> task, ExceptionTranslator translator, TaskContext context);
}
