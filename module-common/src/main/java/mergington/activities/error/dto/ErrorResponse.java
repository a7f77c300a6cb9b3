package mergington.activities.error.dto;

import java.time.LocalDateTime;
import mergington.activities.error.ErrorCode;
import mergington.activities.error.exception.base.BaseException;
import org.springframework.http.ResponseEntity;

/**
 * 에러 응답 포맷
 *
 * <p>{@code detail} 필드 이름은 기존 프론트엔드(app.js)가 읽는 키와 맞춘 것입니다.
 */
public record ErrorResponse(int status, String code, String detail, LocalDateTime timestamp) {

  public static ErrorResponseBuilder builder() {
    return new ErrorResponseBuilder();
  }

  public static class ErrorResponseBuilder {
    private Integer status;
    private String code;
    private String detail;
    private LocalDateTime timestamp;

    public ErrorResponseBuilder status(int status) {
      this.status = status;
      return this;
    }

    public ErrorResponseBuilder code(String code) {
      this.code = code;
      return this;
    }

    public ErrorResponseBuilder detail(String detail) {
      this.detail = detail;
      return this;
    }

    public ErrorResponseBuilder timestamp(LocalDateTime timestamp) {
      this.timestamp = timestamp;
      return this;
    }

    public ErrorResponse build() {
      return new ErrorResponse(
          status != null ? status : 500,
          code != null ? code : "S001",
          detail != null ? detail : "Unknown error",
          timestamp != null ? timestamp : LocalDateTime.now());
    }
  }

  /**
   * [방법 1] BaseException을 받는 경우 (비즈니스 예외)
   *
   * <p>e.getMessage()를 통해 동적으로 가공된 메시지(예: 어떤 활동이 없는지)를 전달합니다.
   */
  public static ResponseEntity<ErrorResponse> toResponseEntity(BaseException e) {
    ErrorCode errorCode = e.getErrorCode();
    return ResponseEntity.status(errorCode.getStatus())
        .body(
            ErrorResponse.builder()
                .status(errorCode.getStatus().value())
                .code(errorCode.getCode())
                .detail(e.getMessage())
                .timestamp(LocalDateTime.now())
                .build());
  }

  /**
   * [방법 2] ErrorCode를 직접 받는 경우 (예상치 못한 서버 예외)
   *
   * <p>Enum에 정의된 기본 메시지를 사용하며, 상세한 에러 내용은 보안을 위해 숨깁니다.
   */
  public static ResponseEntity<ErrorResponse> toResponseEntity(ErrorCode errorCode) {
    return toResponseEntity(errorCode, errorCode.getMessage());
  }

  /** [방법 3] ErrorCode + 이미 완성된 메시지 (프레임워크 예외 변환용) */
  public static ResponseEntity<ErrorResponse> toResponseEntity(ErrorCode errorCode, String detail) {
    return ResponseEntity.status(errorCode.getStatus())
        .body(
            ErrorResponse.builder()
                .status(errorCode.getStatus().value())
                .code(errorCode.getCode())
                .detail(detail)
                .timestamp(LocalDateTime.now())
                .build());
  }
}
