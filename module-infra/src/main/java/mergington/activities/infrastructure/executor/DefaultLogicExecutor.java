package mergington.activities.infrastructure.executor;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import mergington.activities.common.function.ThrowingRunnable;
import mergington.activities.common.function.ThrowingSupplier;
import mergington.activities.infrastructure.executor.strategy.ExceptionTranslator;

/**
 * LogicExecutor 기본 구현체
 *
 * <ul>
 *   <li><b>Error 즉시 rethrow</b>: 번역하지 않는다
 *   <li><b>translator 실패 방어</b>: translator가 던진 RuntimeException/Error는 그 자체가 primary가 된다
 *   <li><b>finally 1회 보장</b>: 정리 예외는 primary를 덮지 않고 suppressed로만 합류
 * </ul>
 */
@Slf4j
@RequiredArgsConstructor
public class DefaultLogicExecutor implements LogicExecutor {

  private static final String UNEXPECTED_TRANSLATOR_FAILURE =
      "Translator failed with unexpected Throwable";

  private final ExceptionTranslator translator;

  @Override
  public <T> T execute(ThrowingSupplier<T> task, TaskContext context) {
    return executeWithTranslation(task, translator, context);
  }

  @Override
  public <T> T executeOrDefault(ThrowingSupplier<T> task, T defaultValue, TaskContext context) {
    Objects.requireNonNull(task, "task");
    Objects.requireNonNull(context, "context");

    try {
      return task.get();
    } catch (Error e) {
      throw e;
    } catch (Throwable t) {
      log.debug("[{}] 기본값으로 대체: {}", context.toTaskName(), t.toString());
      return defaultValue;
    }
  }

  @Override
  public void executeVoid(ThrowingRunnable task, TaskContext context) {
    Objects.requireNonNull(task, "task");
    execute(
        () -> {
          task.run();
          return null;
        },
        context);
  }

  @Override
  public <T> T executeWithFinally(
      ThrowingSupplier<T> task, Runnable finallyBlock, TaskContext context) {
    Objects.requireNonNull(task, "task");
    Objects.requireNonNull(finallyBlock, "finallyBlock");
    Objects.requireNonNull(context, "context");

    final AtomicBoolean ran = new AtomicBoolean(false);
    Runnable onceFinally =
        () -> {
          if (ran.compareAndSet(false, true)) {
            finallyBlock.run();
          }
        };

    T result;
    try {
      result = task.get();
    } catch (Error e) {
      // Error도 가능하면 정리는 시도하되, Error를 덮어쓰지 않는다.
      runCleanupSuppressing(e, onceFinally);
      throw e;
    } catch (Throwable t) {
      Throwable primary = translatePrimary(translator, t, context);
      runCleanupSuppressing(primary, onceFinally);
      throwAsUnchecked(primary);
      return unreachable();
    }

    // task 성공 + finalizer 예외 → finalizer 예외가 primary
    onceFinally.run();
    return result;
  }

  @Override
  public <T> T executeWithTranslation(
      ThrowingSupplier<T> task, ExceptionTranslator customTranslator, TaskContext context) {
    Objects.requireNonNull(task, "task");
    Objects.requireNonNull(customTranslator, "customTranslator");
    Objects.requireNonNull(context, "context");

    try {
      return task.get();
    } catch (Error e) {
      throw e;
    } catch (Throwable t) {
      Throwable primary = translatePrimary(customTranslator, t, context);
      throwAsUnchecked(primary);
      return unreachable();
    }
  }

  private static Throwable translatePrimary(
      ExceptionTranslator translator, Throwable t, TaskContext context) {
    try {
      return translator.translate(t, context);
    } catch (RuntimeException | Error ex) {
      return ex;
    } catch (Throwable unexpected) {
      return new IllegalStateException(UNEXPECTED_TRANSLATOR_FAILURE, unexpected);
    }
  }

  /** 정리 작업을 1회만 실행하고, 정리 중 예외가 나와도 primary를 덮지 않고 suppressed로만 합류시킨다. */
  private static void runCleanupSuppressing(Throwable primary, Runnable onceFinally) {
    try {
      onceFinally.run();
    } catch (Throwable cleanupEx) {
      if (primary != cleanupEx) {
        primary.addSuppressed(cleanupEx);
      }
    }
  }

  private static void throwAsUnchecked(Throwable t) {
    if (t instanceof Error e) throw e;
    if (t instanceof RuntimeException re) throw re;
    throw new IllegalStateException("Unexpected checked throwable", t);
  }

  private static <T> T unreachable() {
    return null;
  }
}
