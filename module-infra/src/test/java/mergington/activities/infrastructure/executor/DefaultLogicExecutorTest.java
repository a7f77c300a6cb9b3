package mergington.activities.infrastructure.executor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicInteger;
import mergington.activities.error.exception.ActivityNotFoundException;
import mergington.activities.error.exception.ActivitySeedException;
import mergington.activities.error.exception.InternalSystemException;
import mergington.activities.infrastructure.executor.strategy.ExceptionTranslator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("DefaultLogicExecutor")
class DefaultLogicExecutorTest {

  private static final TaskContext CONTEXT = TaskContext.of("Test", "Run", "value");

  private LogicExecutor executor;

  @BeforeEach
  void setUp() {
    executor = new DefaultLogicExecutor(ExceptionTranslator.defaultTranslator());
  }

  @Nested
  @DisplayName("execute()")
  class ExecuteTests {

    @Test
    @DisplayName("성공 시 결과를 그대로 반환한다")
    void returnsResult() {
      assertThat(executor.execute(() -> 42, CONTEXT)).isEqualTo(42);
    }

    @Test
    @DisplayName("BaseException은 변환 없이 전파된다")
    void baseExceptionPassesThrough() {
      ActivityNotFoundException original = new ActivityNotFoundException("Chess Club");

      assertThatThrownBy(
              () ->
                  executor.execute(
                      () -> {
                        throw original;
                      },
                      CONTEXT))
          .isSameAs(original);
    }

    @Test
    @DisplayName("checked 예외는 InternalSystemException으로 규격화되고 cause를 보존한다")
    void checkedExceptionIsTranslated() {
      IOException io = new IOException("disk");

      assertThatThrownBy(
              () ->
                  executor.execute(
                      () -> {
                        throw io;
                      },
                      CONTEXT))
          .isInstanceOf(InternalSystemException.class)
          .hasCause(io)
          .satisfies(
              e -> assertThat(((InternalSystemException) e).getOperation()).isEqualTo("Test:Run:value"));
    }

    @Test
    @DisplayName("Error는 번역하지 않고 그대로 throw")
    void errorPropagates() {
      assertThatThrownBy(
              () ->
                  executor.execute(
                      () -> {
                        throw new AssertionError("boom");
                      },
                      CONTEXT))
          .isInstanceOf(AssertionError.class);
    }
  }

  @Nested
  @DisplayName("executeWithFinally()")
  class FinallyTests {

    @Test
    @DisplayName("성공 시 finally가 정확히 1회 실행된다")
    void finallyRunsOnceOnSuccess() {
      AtomicInteger runs = new AtomicInteger();

      String result = executor.executeWithFinally(() -> "ok", runs::incrementAndGet, CONTEXT);

      assertThat(result).isEqualTo("ok");
      assertThat(runs).hasValue(1);
    }

    @Test
    @DisplayName("실패 시에도 finally가 정확히 1회 실행된다")
    void finallyRunsOnceOnFailure() {
      AtomicInteger runs = new AtomicInteger();

      assertThatThrownBy(
              () ->
                  executor.executeWithFinally(
                      () -> {
                        throw new IllegalStateException("task");
                      },
                      runs::incrementAndGet,
                      CONTEXT))
          .isInstanceOf(InternalSystemException.class);
      assertThat(runs).hasValue(1);
    }

    @Test
    @DisplayName("task와 finally가 모두 실패하면 finally 예외는 suppressed로 합류한다")
    void cleanupFailureIsSuppressed() {
      ActivityNotFoundException primary = new ActivityNotFoundException("Chess Club");
      IllegalStateException cleanup = new IllegalStateException("cleanup");

      assertThatThrownBy(
              () ->
                  executor.executeWithFinally(
                      () -> {
                        throw primary;
                      },
                      () -> {
                        throw cleanup;
                      },
                      CONTEXT))
          .isSameAs(primary)
          .satisfies(e -> assertThat(e.getSuppressed()).containsExactly(cleanup));
    }

    @Test
    @DisplayName("task 성공 후 finally 실패 시 finally 예외가 전파된다")
    void cleanupFailureAfterSuccessPropagates() {
      assertThatThrownBy(
              () ->
                  executor.executeWithFinally(
                      () -> "ok",
                      () -> {
                        throw new IllegalStateException("cleanup");
                      },
                      CONTEXT))
          .isInstanceOf(IllegalStateException.class)
          .hasMessage("cleanup");
    }
  }

  @Nested
  @DisplayName("executeWithTranslation() / executeOrDefault()")
  class TranslationTests {

    @Test
    @DisplayName("forSeed: IllegalArgumentException은 ActivitySeedException으로 변환된다")
    void seedTranslator() {
      assertThatThrownBy(
              () ->
                  executor.executeWithTranslation(
                      () -> {
                        throw new IllegalArgumentException("duplicate activity name: Chess Club");
                      },
                      ExceptionTranslator.forSeed(),
                      CONTEXT))
          .isInstanceOf(ActivitySeedException.class)
          .hasMessageContaining("duplicate activity name: Chess Club");
    }

    @Test
    @DisplayName("실패 시 기본값을 반환한다")
    void defaultOnFailure() {
      String value =
          executor.executeOrDefault(
              () -> {
                throw new IOException("x");
              },
              "fallback",
              CONTEXT);

      assertThat(value).isEqualTo("fallback");
    }

    @Test
    @DisplayName("executeVoid는 작업을 실행한다")
    void executeVoidRunsTask() {
      AtomicInteger runs = new AtomicInteger();

      executor.executeVoid(runs::incrementAndGet, CONTEXT);

      assertThat(runs).hasValue(1);
    }
  }
}
