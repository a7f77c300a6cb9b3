package mergington.activities.error.exception;

import mergington.activities.error.CommonErrorCode;
import mergington.activities.error.exception.base.ServerBaseException;

/** 시드 설정이 디렉터리 불변식을 위반할 때 기동을 중단시키는 예외 */
public class ActivitySeedException extends ServerBaseException {
  public ActivitySeedException(String reason, Throwable cause) {
    super(CommonErrorCode.SEED_INITIALIZATION_FAILED, cause, reason);
  }
}
