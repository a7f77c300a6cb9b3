package mergington.activities.error.exception;

import mergington.activities.error.CommonErrorCode;
import mergington.activities.error.exception.base.ClientBaseException;

public class ActivityNotFoundException extends ClientBaseException {
  public ActivityNotFoundException(String activityName) {
    super(CommonErrorCode.ACTIVITY_NOT_FOUND, activityName);
  }
}
