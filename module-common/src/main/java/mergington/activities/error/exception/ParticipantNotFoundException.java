package mergington.activities.error.exception;

import mergington.activities.error.CommonErrorCode;
import mergington.activities.error.exception.base.ClientBaseException;

public class ParticipantNotFoundException extends ClientBaseException {
  public ParticipantNotFoundException(String activityName, String participantId) {
    super(CommonErrorCode.PARTICIPANT_NOT_FOUND, activityName, participantId);
  }
}
