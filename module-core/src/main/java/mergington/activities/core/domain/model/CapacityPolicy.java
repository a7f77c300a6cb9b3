package mergington.activities.core.domain.model;

/**
 * 정원(max participants) 적용 정책
 *
 * <ul>
 *   <li>{@link #ENFORCE}: 정원이 찬 활동의 신청을 {@link RosterStatus#ACTIVITY_FULL}로 거절
 *   <li>{@link #INFORMATIONAL}: 정원은 표시용이며 신청을 막지 않음
 * </ul>
 */
public enum CapacityPolicy {
  ENFORCE,
  INFORMATIONAL;

  public boolean rejectsAt(int rosterSize, int maxParticipants) {
    return this == ENFORCE && rosterSize >= maxParticipants;
  }
}
