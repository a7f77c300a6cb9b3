package mergington.activities.infrastructure.lock;

import com.google.common.util.concurrent.Striped;
import java.util.Objects;
import java.util.concurrent.locks.Lock;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import mergington.activities.core.port.out.RosterLockPort;
import mergington.activities.infrastructure.executor.LogicExecutor;
import mergington.activities.infrastructure.executor.TaskContext;

/**
 * Guava Striped Lock 기반 명단 락
 *
 * <p>활동 이름을 키로 stripe를 선택합니다. 서로 다른 활동이 같은 stripe에 매핑될 수 있으나 이는 직렬화 범위가 넓어질 뿐 정합성에는
 * 영향이 없습니다. 타임아웃 없이 획득하며, 해제는 {@link LogicExecutor#executeWithFinally}가 보장합니다.
 */
@Slf4j
public class StripedRosterLock implements RosterLockPort {

  private final Striped<Lock> locks;
  private final LogicExecutor executor;

  public StripedRosterLock(int stripes, LogicExecutor executor) {
    if (stripes <= 0) {
      throw new IllegalArgumentException("stripes must be positive, got: " + stripes);
    }
    this.locks = Striped.lock(stripes);
    this.executor = Objects.requireNonNull(executor, "executor");
  }

  @Override
  public <T> T withinRoster(String activityName, Supplier<T> action) {
    Objects.requireNonNull(action, "action");
    Lock lock = locks.get(activityName);
    lock.lock();
    log.trace("[Roster Lock] '{}' 획득", activityName);

    return executor.executeWithFinally(
        action::get, lock::unlock, TaskContext.of("RosterLock", "Guard", activityName));
  }

  /** 구성된 stripe 수 */
  public int stripes() {
    return locks.size();
  }
}
