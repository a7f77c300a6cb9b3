package mergington.activities.core.domain.model;

import java.util.Objects;

/**
 * 명단 변경 결과 (Immutable Record)
 *
 * <p>디렉터리는 비즈니스 실패를 예외로 던지지 않고 이 타입으로 반환합니다. HTTP 상태 코드 변환은 호출자의 책임입니다.
 *
 * <pre>{@code
 * RosterOutcome outcome = directory.signUp("Chess Club", "a@mergington.edu");
 * if (!outcome.isSuccess()) {
 *     // outcome.status() 로 분기
 * }
 * }</pre>
 *
 * @param status 결과 상태
 * @param activityName 대상 활동 이름
 * @param participantId 대상 참가자 식별자 (이메일)
 */
public record RosterOutcome(RosterStatus status, String activityName, String participantId) {

  public RosterOutcome {
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(activityName, "activityName");
    Objects.requireNonNull(participantId, "participantId");
  }

  public static RosterOutcome of(RosterStatus status, String activityName, String participantId) {
    return new RosterOutcome(status, activityName, participantId);
  }

  public boolean isSuccess() {
    return status.isSuccess();
  }
}
