package mergington.activities.controller.dto;

/** 명단 변경 성공 응답 */
public record MessageResponse(String message) {

  public static MessageResponse signedUp(String email, String activityName) {
    return new MessageResponse("Signed up " + email + " for " + activityName);
  }

  public static MessageResponse unregistered(String email, String activityName) {
    return new MessageResponse("Unregistered " + email + " from " + activityName);
  }
}
