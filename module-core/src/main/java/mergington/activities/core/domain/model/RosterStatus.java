package mergington.activities.core.domain.model;

/** 명단 변경 연산의 결과 상태 */
public enum RosterStatus {
  SIGNED_UP(true),
  UNREGISTERED(true),
  ACTIVITY_NOT_FOUND(false),
  ALREADY_REGISTERED(false),
  PARTICIPANT_NOT_FOUND(false),
  ACTIVITY_FULL(false);

  private final boolean success;

  RosterStatus(boolean success) {
    this.success = success;
  }

  public boolean isSuccess() {
    return success;
  }
}
