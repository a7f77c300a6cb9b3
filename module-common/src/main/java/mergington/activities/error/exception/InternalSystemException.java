package mergington.activities.error.exception;

import lombok.Getter;
import mergington.activities.error.CommonErrorCode;
import mergington.activities.error.exception.base.ServerBaseException;

/** 관리되지 않은 예외를 규격화한 서버 예외 (cause 보존) */
@Getter
public class InternalSystemException extends ServerBaseException {

  /** 실패한 작업 이름 (로그 전용, 응답에는 노출하지 않음) */
  private final String operation;

  public InternalSystemException(String operation, Throwable cause) {
    super(CommonErrorCode.INTERNAL_SERVER_ERROR, cause);
    this.operation = operation;
  }
}
