package mergington.activities.core.domain.model;

import java.util.List;

/**
 * 활동의 특정 시점 스냅샷
 *
 * <p>participants는 복사된 불변 리스트이므로 호출자가 수정해도 디렉터리 상태에 영향이 없습니다.
 */
public record ActivitySnapshot(
    String name,
    String description,
    String schedule,
    int maxParticipants,
    List<String> participants) {

  public ActivitySnapshot {
    participants = List.copyOf(participants);
  }

  /** 남은 자리 수 (정원 초과 상태면 0) */
  public int spotsLeft() {
    return Math.max(0, maxParticipants - participants.size());
  }

  public boolean contains(String participantId) {
    return participants.contains(participantId);
  }
}
