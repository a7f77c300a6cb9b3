package mergington.activities;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.not;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.web.servlet.MockMvc;

/**
 * 전체 컨텍스트 기반 API 테스트
 *
 * <p>컨텍스트(디렉터리)가 테스트 간에 공유되므로 각 테스트는 고유한 이메일을 사용합니다.
 */
@SpringBootTest
@AutoConfigureMockMvc
@DisplayName("Activities API 통합 테스트")
class ActivitiesApplicationTest {

  private static final String CHESS = "Chess Club";

  @Autowired private MockMvc mockMvc;

  @Test
  @DisplayName("루트 요청은 정적 페이지로 리다이렉트된다")
  void rootRedirects() throws Exception {
    mockMvc
        .perform(get("/"))
        .andExpect(status().isTemporaryRedirect())
        .andExpect(header().string("Location", "/static/index.html"));
  }

  @Test
  @DisplayName("정적 페이지가 제공된다")
  void staticIndexServed() throws Exception {
    mockMvc.perform(get("/static/index.html")).andExpect(status().isOk());
  }

  @Test
  @DisplayName("시드된 9개 활동이 snake_case 필드로 조회된다")
  void listSeededActivities() throws Exception {
    mockMvc
        .perform(get("/activities"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.length()").value(9))
        .andExpect(jsonPath("$['Chess Club'].max_participants").value(12))
        .andExpect(jsonPath("$['Programming Class'].participants", hasItem("emma@mergington.edu")))
        .andExpect(jsonPath("$['Science Club'].schedule").exists());
  }

  @Test
  @DisplayName("신청 → 중복 신청 → 취소 → 재취소 흐름")
  void signUpAndUnregisterFlow() throws Exception {
    String email = "flow@mergington.edu";

    mockMvc
        .perform(post("/activities/{name}/signup", CHESS).param("email", email))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.message").value("Signed up " + email + " for " + CHESS));
    mockMvc
        .perform(get("/activities"))
        .andExpect(jsonPath("$['Chess Club'].participants", hasItem(email)));

    mockMvc
        .perform(post("/activities/{name}/signup", CHESS).param("email", email))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.detail").value(containsString("already signed up")));

    mockMvc
        .perform(delete("/activities/{name}/unregister", CHESS).param("email", email))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.message").value("Unregistered " + email + " from " + CHESS));
    mockMvc
        .perform(get("/activities"))
        .andExpect(jsonPath("$['Chess Club'].participants", not(hasItem(email))));

    mockMvc
        .perform(delete("/activities/{name}/unregister", CHESS).param("email", email))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.detail").value(containsString("Participant not found")));
  }

  @Test
  @DisplayName("없는 활동에 대한 신청/취소는 404")
  void unknownActivity() throws Exception {
    mockMvc
        .perform(
            post("/activities/{name}/signup", "Nonexistent Activity")
                .param("email", "nobody@mergington.edu"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.detail").value(containsString("Activity not found")));
    mockMvc
        .perform(
            delete("/activities/{name}/unregister", "Nonexistent Activity")
                .param("email", "nobody@mergington.edu"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.detail").value(containsString("Activity not found")));
  }

  @Test
  @DisplayName("email 누락은 400 + C001")
  void missingEmail() throws Exception {
    mockMvc
        .perform(post("/activities/{name}/signup", CHESS))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("C001"));
  }

  @Test
  @DisplayName("Correlation ID가 응답 헤더로 되돌아온다")
  void correlationIdEchoed() throws Exception {
    mockMvc
        .perform(get("/activities").header("X-Correlation-ID", "trace-42"))
        .andExpect(header().string("X-Correlation-ID", "trace-42"));
  }
}
