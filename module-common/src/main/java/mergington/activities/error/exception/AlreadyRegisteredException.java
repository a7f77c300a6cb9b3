package mergington.activities.error.exception;

import mergington.activities.error.CommonErrorCode;
import mergington.activities.error.exception.base.ClientBaseException;

public class AlreadyRegisteredException extends ClientBaseException {
  public AlreadyRegisteredException(String activityName, String participantId) {
    super(CommonErrorCode.ALREADY_REGISTERED, participantId, activityName);
  }
}
