package mergington.activities.core.domain.directory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import mergington.activities.core.domain.model.ActivitySeed;
import mergington.activities.core.domain.model.ActivitySnapshot;
import mergington.activities.core.domain.model.CapacityPolicy;
import mergington.activities.core.domain.model.RosterOutcome;
import mergington.activities.core.domain.model.RosterStatus;
import mergington.activities.core.port.out.RosterLockPort;

/**
 * 활동 디렉터리 (활동 이름 → 활동 레코드)
 *
 * <p>순수 도메인 - 프레임워크 의존 없음. 활동 집합은 생성 시점에 고정되며, 이후 변경되는 것은 각 활동의 참가자 명단뿐입니다.
 *
 * <h3>불변식</h3>
 *
 * <ul>
 *   <li>활동 이름은 유일하며 생성 후 변하지 않는다
 *   <li>한 활동의 명단에 같은 참가자는 최대 1회 등장한다
 *   <li>{@link CapacityPolicy#ENFORCE}이면 명단 크기는 정원을 넘지 않는다
 * </ul>
 *
 * <h3>동시성</h3>
 *
 * <p>활동 맵 자체는 생성 후 불변이므로 조회에 락이 필요 없습니다. 명단의 확인-후-변경과 스냅샷 복사는 {@link RosterLockPort}를 통해 활동
 * 단위로 직렬화됩니다.
 *
 * <h3>에러 처리</h3>
 *
 * <p>존재하지 않는 활동, 중복 신청, 미등록 참가자, 정원 초과는 예외가 아닌 {@link RosterOutcome}으로 반환합니다. 실패한 연산은 상태를
 * 변경하지 않습니다.
 */
public final class ActivityDirectory {

  private final Map<String, Activity> activities;
  private final RosterLockPort lockPort;
  private final CapacityPolicy capacityPolicy;

  private ActivityDirectory(
      Map<String, Activity> activities, RosterLockPort lockPort, CapacityPolicy capacityPolicy) {
    this.activities = activities;
    this.lockPort = lockPort;
    this.capacityPolicy = capacityPolicy;
  }

  /**
   * 시드로부터 디렉터리 생성
   *
   * @param seeds 활동 초기값 (순서가 목록 순서가 됨)
   * @param lockPort 활동 단위 상호 배제
   * @param capacityPolicy 정원 정책
   * @throws IllegalArgumentException 활동 이름 중복, 또는 ENFORCE 정책에서 초기 명단이 정원 초과
   */
  public static ActivityDirectory create(
      List<ActivitySeed> seeds, RosterLockPort lockPort, CapacityPolicy capacityPolicy) {
    Objects.requireNonNull(seeds, "seeds");
    Objects.requireNonNull(lockPort, "lockPort");
    Objects.requireNonNull(capacityPolicy, "capacityPolicy");

    Map<String, Activity> activities = new LinkedHashMap<>();
    for (ActivitySeed seed : seeds) {
      if (activities.containsKey(seed.name())) {
        throw new IllegalArgumentException("duplicate activity name: " + seed.name());
      }
      if (capacityPolicy == CapacityPolicy.ENFORCE
          && seed.participants().size() > seed.maxParticipants()) {
        throw new IllegalArgumentException(
            "seed for '"
                + seed.name()
                + "' has "
                + seed.participants().size()
                + " participants, over capacity "
                + seed.maxParticipants());
      }
      activities.put(seed.name(), Activity.from(seed));
    }
    return new ActivityDirectory(
        Collections.unmodifiableMap(activities), lockPort, capacityPolicy);
  }

  /**
   * 전체 활동 스냅샷
   *
   * <p>시드 순서를 유지하는 불변 맵을 반환합니다. 각 활동은 자신의 락 안에서 복사되므로 반쯤 변경된 명단이 보이지 않습니다.
   */
  public Map<String, ActivitySnapshot> list() {
    Map<String, ActivitySnapshot> snapshot = new LinkedHashMap<>();
    for (Activity activity : activities.values()) {
      snapshot.put(activity.name(), lockPort.withinRoster(activity.name(), activity::snapshot));
    }
    return Collections.unmodifiableMap(snapshot);
  }

  /** 단일 활동 스냅샷 */
  public Optional<ActivitySnapshot> find(String activityName) {
    Objects.requireNonNull(activityName, "activityName");
    Activity activity = activities.get(activityName);
    if (activity == null) {
      return Optional.empty();
    }
    return Optional.of(lockPort.withinRoster(activityName, activity::snapshot));
  }

  /** 시드 순서의 활동 이름 */
  public List<String> activityNames() {
    return List.copyOf(activities.keySet());
  }

  public CapacityPolicy capacityPolicy() {
    return capacityPolicy;
  }

  /**
   * 참가 신청
   *
   * @return SIGNED_UP, ACTIVITY_NOT_FOUND, ALREADY_REGISTERED, ACTIVITY_FULL 중 하나
   */
  public RosterOutcome signUp(String activityName, String participantId) {
    Objects.requireNonNull(activityName, "activityName");
    Objects.requireNonNull(participantId, "participantId");

    Activity activity = activities.get(activityName);
    if (activity == null) {
      return RosterOutcome.of(RosterStatus.ACTIVITY_NOT_FOUND, activityName, participantId);
    }
    return lockPort.withinRoster(
        activityName,
        () -> RosterOutcome.of(enrollLocked(activity, participantId), activityName, participantId));
  }

  /**
   * 참가 취소
   *
   * @return UNREGISTERED, ACTIVITY_NOT_FOUND, PARTICIPANT_NOT_FOUND 중 하나
   */
  public RosterOutcome unregister(String activityName, String participantId) {
    Objects.requireNonNull(activityName, "activityName");
    Objects.requireNonNull(participantId, "participantId");

    Activity activity = activities.get(activityName);
    if (activity == null) {
      return RosterOutcome.of(RosterStatus.ACTIVITY_NOT_FOUND, activityName, participantId);
    }
    return lockPort.withinRoster(
        activityName,
        () ->
            RosterOutcome.of(
                activity.withdraw(participantId)
                    ? RosterStatus.UNREGISTERED
                    : RosterStatus.PARTICIPANT_NOT_FOUND,
                activityName,
                participantId));
  }

  // 호출 시점에 activity 락을 보유하고 있어야 함
  private RosterStatus enrollLocked(Activity activity, String participantId) {
    if (activity.has(participantId)) {
      return RosterStatus.ALREADY_REGISTERED;
    }
    if (capacityPolicy.rejectsAt(activity.size(), activity.maxParticipants())) {
      return RosterStatus.ACTIVITY_FULL;
    }
    activity.enroll(participantId);
    return RosterStatus.SIGNED_UP;
  }
}
