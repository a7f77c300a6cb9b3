package mergington.activities.common.function;

@FunctionalInterface
public interface ThrowingRunnable {
  void run() throws Throwable;
}
