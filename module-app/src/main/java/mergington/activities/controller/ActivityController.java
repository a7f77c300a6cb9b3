package mergington.activities.controller;

import java.util.Map;
import lombok.RequiredArgsConstructor;
import mergington.activities.controller.dto.ActivityResponse;
import mergington.activities.controller.dto.MessageResponse;
import mergington.activities.service.ActivityRosterService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * 활동 API 컨트롤러
 *
 * <p>API 목록:
 *
 * <ul>
 *   <li>GET /activities - 전체 활동 조회
 *   <li>POST /activities/{activityName}/signup?email= - 참가 신청
 *   <li>DELETE /activities/{activityName}/unregister?email= - 참가 취소
 * </ul>
 *
 * <p>실패 응답(404/400)은 GlobalExceptionHandler가 생성합니다.
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/activities")
public class ActivityController {

  private final ActivityRosterService activityRosterService;

  @GetMapping
  public ResponseEntity<Map<String, ActivityResponse>> getActivities() {
    return ResponseEntity.ok(activityRosterService.getActivities());
  }

  @PostMapping("/{activityName}/signup")
  public ResponseEntity<MessageResponse> signUp(
      @PathVariable String activityName, @RequestParam String email) {
    return ResponseEntity.ok(activityRosterService.signUp(activityName, email));
  }

  @DeleteMapping("/{activityName}/unregister")
  public ResponseEntity<MessageResponse> unregister(
      @PathVariable String activityName, @RequestParam String email) {
    return ResponseEntity.ok(activityRosterService.unregister(activityName, email));
  }
}
