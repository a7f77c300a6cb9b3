package mergington.activities.error.exception.base;

import mergington.activities.error.ErrorCode;

/**
 * ClientBaseException: 요청이 디렉터리 상태와 맞지 않을 때 발생하는 '비즈니스 예외' 4xx 계열의 에러를 처리하며, 호출자에게 구체적인 실패
 * 원인을 전달하는 것이 목적입니다.
 */
public abstract class ClientBaseException extends BaseException {

  // 기본 생성자: 고정된 에러 메시지를 사용할 때
  protected ClientBaseException(ErrorCode errorCode) {
    super(errorCode);
  }

  // "Activity not found: %s" 처럼 동적 인자로 메시지를 완성할 때
  protected ClientBaseException(ErrorCode errorCode, Object... args) {
    super(errorCode, args);
  }
}
