package mergington.activities.core.domain.model;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * 기동 시 디렉터리를 채우는 활동 초기값
 *
 * <p>설정 파일, 하드코딩 테이블 등 출처와 무관하게 이 record로 변환되어 디렉터리에 전달됩니다. 생성 시점에 불변식을 검증하며, 위반 시
 * {@link IllegalArgumentException}을 던집니다.
 */
public record ActivitySeed(
    String name,
    String description,
    String schedule,
    int maxParticipants,
    List<String> participants) {

  public ActivitySeed {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("activity name must not be blank");
    }
    Objects.requireNonNull(description, "description");
    Objects.requireNonNull(schedule, "schedule");
    if (maxParticipants <= 0) {
      throw new IllegalArgumentException(
          "max participants must be positive for '" + name + "', got: " + maxParticipants);
    }
    if (participants == null) {
      participants = List.of();
    }

    Set<String> seen = new HashSet<>();
    for (String participant : participants) {
      if (participant == null) {
        throw new IllegalArgumentException("null participant in seed for '" + name + "'");
      }
      if (!seen.add(participant)) {
        throw new IllegalArgumentException(
            "duplicate participant '" + participant + "' in seed for '" + name + "'");
      }
    }
    participants = List.copyOf(participants);
  }

  /** 초기 참가자 없이 생성 */
  public static ActivitySeed of(
      String name, String description, String schedule, int maxParticipants) {
    return new ActivitySeed(name, description, schedule, maxParticipants, List.of());
  }
}
