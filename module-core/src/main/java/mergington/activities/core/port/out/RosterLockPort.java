package mergington.activities.core.port.out;

import java.util.function.Supplier;

/**
 * 활동 단위 상호 배제 포트
 *
 * <p>같은 활동 이름에 대한 {@code action}들은 직렬화되어 실행되며, 락은 정상 반환과 예외 전파를 포함한 모든 경로에서 해제되어야 합니다.
 * 서로 다른 활동은 병렬로 실행될 수 있습니다.
 *
 * <h3>Implementations</h3>
 *
 * <ul>
 *   <li>mergington.activities.infrastructure.lock.StripedRosterLock - Guava Striped
 * </ul>
 */
public interface RosterLockPort {

  /**
   * 활동 락을 잡은 상태로 작업 실행
   *
   * @param activityName 락 키 (활동 이름)
   * @param action 임계 구역에서 실행할 작업
   * @return action 결과
   */
  <T> T withinRoster(String activityName, Supplier<T> action);
}
