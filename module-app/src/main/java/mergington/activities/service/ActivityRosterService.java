package mergington.activities.service;

import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import mergington.activities.controller.dto.ActivityResponse;
import mergington.activities.controller.dto.MessageResponse;
import mergington.activities.core.domain.directory.ActivityDirectory;
import mergington.activities.core.domain.model.ActivitySnapshot;
import mergington.activities.core.domain.model.RosterOutcome;
import mergington.activities.error.exception.ActivityFullException;
import mergington.activities.error.exception.ActivityNotFoundException;
import mergington.activities.error.exception.AlreadyRegisteredException;
import mergington.activities.error.exception.ParticipantNotFoundException;
import mergington.activities.error.exception.base.ClientBaseException;
import mergington.activities.monitoring.RosterMetrics;
import org.springframework.stereotype.Service;

/**
 * 활동 명단 서비스
 *
 * <p>디렉터리가 반환한 {@link RosterOutcome}을 응답 DTO 또는 {@link ClientBaseException}으로 변환합니다. HTTP 상태 코드 매핑은
 * GlobalExceptionHandler가 ErrorCode를 통해 수행합니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ActivityRosterService {

  private final ActivityDirectory directory;
  private final RosterMetrics rosterMetrics;

  /** 전체 활동 (시드 순서 유지) */
  public Map<String, ActivityResponse> getActivities() {
    Map<String, ActivityResponse> response = new LinkedHashMap<>();
    directory.list().forEach((name, snapshot) -> response.put(name, ActivityResponse.from(snapshot)));
    return response;
  }

  public MessageResponse signUp(String activityName, String email) {
    RosterOutcome outcome = directory.signUp(activityName, email);
    rosterMetrics.record("signup", outcome);

    if (!outcome.isSuccess()) {
      throw toException(outcome);
    }
    log.info("[Roster] 신청 완료: {} → {}", email, activityName);
    return MessageResponse.signedUp(email, activityName);
  }

  public MessageResponse unregister(String activityName, String email) {
    RosterOutcome outcome = directory.unregister(activityName, email);
    rosterMetrics.record("unregister", outcome);

    if (!outcome.isSuccess()) {
      throw toException(outcome);
    }
    log.info("[Roster] 취소 완료: {} ← {}", email, activityName);
    return MessageResponse.unregistered(email, activityName);
  }

  private ClientBaseException toException(RosterOutcome outcome) {
    String activityName = outcome.activityName();
    String participantId = outcome.participantId();
    return switch (outcome.status()) {
      case ACTIVITY_NOT_FOUND -> new ActivityNotFoundException(activityName);
      case ALREADY_REGISTERED -> new AlreadyRegisteredException(activityName, participantId);
      case PARTICIPANT_NOT_FOUND -> new ParticipantNotFoundException(activityName, participantId);
      case ACTIVITY_FULL -> new ActivityFullException(activityName, capacityOf(activityName));
      default -> throw new IllegalStateException("not a rejection: " + outcome.status());
    };
  }

  private int capacityOf(String activityName) {
    return directory.find(activityName).map(ActivitySnapshot::maxParticipants).orElse(0);
  }
}
