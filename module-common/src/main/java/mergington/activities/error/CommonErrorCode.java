package mergington.activities.error;

import lombok.AllArgsConstructor;
import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * 공통 에러 코드
 *
 * <p>메시지는 {@link String#format} 형식이며, 클라이언트(4xx) 메시지는 그대로 응답의 {@code detail}로 노출됩니다.
 */
@Getter
@AllArgsConstructor
public enum CommonErrorCode implements ErrorCode {
  // === Client Errors (4xx) ===
  INVALID_INPUT_VALUE("C001", "Invalid input value: %s", HttpStatus.BAD_REQUEST),
  ACTIVITY_NOT_FOUND("C002", "Activity not found: %s", HttpStatus.NOT_FOUND),
  ALREADY_REGISTERED(
      "C003", "Student %s is already signed up for %s", HttpStatus.BAD_REQUEST),
  PARTICIPANT_NOT_FOUND("C004", "Participant not found in %s: %s", HttpStatus.NOT_FOUND),
  ACTIVITY_FULL("C005", "Activity is full: %s (max participants: %s)", HttpStatus.BAD_REQUEST),
  RESOURCE_NOT_FOUND("C006", "Resource not found: %s", HttpStatus.NOT_FOUND),
  METHOD_NOT_ALLOWED("C007", "Method not allowed: %s", HttpStatus.METHOD_NOT_ALLOWED),

  // === Server Errors (5xx) ===
  INTERNAL_SERVER_ERROR("S001", "Internal server error.", HttpStatus.INTERNAL_SERVER_ERROR),
  SEED_INITIALIZATION_FAILED(
      "S002", "Activity seed initialization failed (%s)", HttpStatus.INTERNAL_SERVER_ERROR);

  private final String code;
  private final String message;
  private final HttpStatus status;
}
