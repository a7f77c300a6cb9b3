package mergington.activities.global.error;

import lombok.extern.slf4j.Slf4j;
import mergington.activities.error.CommonErrorCode;
import mergington.activities.error.dto.ErrorResponse;
import mergington.activities.error.exception.base.ClientBaseException;
import mergington.activities.error.exception.base.ServerBaseException;
import org.springframework.http.ResponseEntity;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

  /**
   * [1순위] 비즈니스 예외 처리 (동적 메시지 포함)
   *
   * <p>예외 객체의 가공된 메시지(예: 활동 이름 포함)를 그대로 detail로 전달합니다.
   */
  @ExceptionHandler(ClientBaseException.class)
  protected ResponseEntity<ErrorResponse> handleClientException(ClientBaseException e) {
    log.warn("Business Exception: {} | Message: {}", e.getErrorCode().getCode(), e.getMessage());
    return ErrorResponse.toResponseEntity(e);
  }

  /** 서버 예외: 원인은 로그에만 남기고 응답은 규격화된 메시지만 전달 */
  @ExceptionHandler(ServerBaseException.class)
  protected ResponseEntity<ErrorResponse> handleServerException(ServerBaseException e) {
    log.error("Server Exception: {} | Message: {}", e.getErrorCode().getCode(), e.getMessage(), e);
    return ErrorResponse.toResponseEntity(e.getErrorCode());
  }

  @ExceptionHandler(MissingServletRequestParameterException.class)
  protected ResponseEntity<ErrorResponse> handleMissingParameter(
      MissingServletRequestParameterException e) {
    log.warn("Missing request parameter: {}", e.getParameterName());
    return ErrorResponse.toResponseEntity(
        CommonErrorCode.INVALID_INPUT_VALUE,
        String.format(
            CommonErrorCode.INVALID_INPUT_VALUE.getMessage(),
            "'" + e.getParameterName() + "' parameter is required"));
  }

  @ExceptionHandler(NoResourceFoundException.class)
  protected ResponseEntity<ErrorResponse> handleNoResource(NoResourceFoundException e) {
    return ErrorResponse.toResponseEntity(
        CommonErrorCode.RESOURCE_NOT_FOUND,
        String.format(CommonErrorCode.RESOURCE_NOT_FOUND.getMessage(), e.getResourcePath()));
  }

  @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
  protected ResponseEntity<ErrorResponse> handleMethodNotSupported(
      HttpRequestMethodNotSupportedException e) {
    return ErrorResponse.toResponseEntity(
        CommonErrorCode.METHOD_NOT_ALLOWED,
        String.format(CommonErrorCode.METHOD_NOT_ALLOWED.getMessage(), e.getMethod()));
  }

  /** [재앙 방지] 예측하지 못한 시스템 예외 처리 */
  @ExceptionHandler(Exception.class)
  protected ResponseEntity<ErrorResponse> handleException(Exception e) {
    // 장애 회고를 위해 스택 트레이스를 상세히 남깁니다.
    log.error("Unexpected System Failure: ", e);

    // 500 에러는 상세 메시지를 숨기고 규격화된 공통 코드를 넘깁니다.
    return ErrorResponse.toResponseEntity(CommonErrorCode.INTERNAL_SERVER_ERROR);
  }
}
