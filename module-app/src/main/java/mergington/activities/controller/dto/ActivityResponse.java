package mergington.activities.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import mergington.activities.core.domain.model.ActivitySnapshot;

/** 활동 목록 응답 항목 (키는 활동 이름이므로 name은 포함하지 않음) */
public record ActivityResponse(
    String description,
    String schedule,
    @JsonProperty("max_participants") int maxParticipants,
    List<String> participants) {

  public static ActivityResponse from(ActivitySnapshot snapshot) {
    return new ActivityResponse(
        snapshot.description(),
        snapshot.schedule(),
        snapshot.maxParticipants(),
        snapshot.participants());
  }
}
