package mergington.activities.error;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Arrays;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

class CommonErrorCodeTest {

  @Test
  @DisplayName("코드는 중복되지 않는다")
  void codesAreUnique() {
    assertThat(Arrays.stream(CommonErrorCode.values()).map(CommonErrorCode::getCode))
        .doesNotHaveDuplicates();
  }

  @Test
  @DisplayName("C 코드는 4xx, S 코드는 5xx")
  void codePrefixMatchesStatusFamily() {
    for (CommonErrorCode code : CommonErrorCode.values()) {
      if (code.getCode().startsWith("C")) {
        assertThat(code.getStatus().is4xxClientError()).as(code.name()).isTrue();
      } else {
        assertThat(code.getStatus().is5xxServerError()).as(code.name()).isTrue();
      }
    }
  }

  @Test
  @DisplayName("명단 관련 에러는 계약된 상태 코드를 가진다")
  void rosterStatuses() {
    assertThat(CommonErrorCode.ACTIVITY_NOT_FOUND.getStatus()).isEqualTo(HttpStatus.NOT_FOUND);
    assertThat(CommonErrorCode.ALREADY_REGISTERED.getStatus()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(CommonErrorCode.PARTICIPANT_NOT_FOUND.getStatus()).isEqualTo(HttpStatus.NOT_FOUND);
    assertThat(CommonErrorCode.ACTIVITY_FULL.getStatus()).isEqualTo(HttpStatus.BAD_REQUEST);
  }
}
