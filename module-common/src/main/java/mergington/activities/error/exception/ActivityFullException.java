package mergington.activities.error.exception;

import mergington.activities.error.CommonErrorCode;
import mergington.activities.error.exception.base.ClientBaseException;

public class ActivityFullException extends ClientBaseException {
  public ActivityFullException(String activityName, int maxParticipants) {
    super(CommonErrorCode.ACTIVITY_FULL, activityName, maxParticipants);
  }
}
