package mergington.activities.core.domain.directory;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import mergington.activities.core.domain.model.ActivitySeed;
import mergington.activities.core.domain.model.ActivitySnapshot;

/**
 * 디렉터리 내부의 가변 활동 레코드
 *
 * <p>스레드 안전하지 않습니다. 모든 접근은 {@link ActivityDirectory}가 해당 활동의 락 안에서 수행합니다.
 */
final class Activity {

  private final String name;
  private final String description;
  private final String schedule;
  private final int maxParticipants;

  // 삽입 순서는 표시용으로만 유지
  private final Set<String> participants;

  private Activity(ActivitySeed seed) {
    this.name = seed.name();
    this.description = seed.description();
    this.schedule = seed.schedule();
    this.maxParticipants = seed.maxParticipants();
    this.participants = new LinkedHashSet<>(seed.participants());
  }

  static Activity from(ActivitySeed seed) {
    return new Activity(seed);
  }

  String name() {
    return name;
  }

  int maxParticipants() {
    return maxParticipants;
  }

  int size() {
    return participants.size();
  }

  boolean has(String participantId) {
    return participants.contains(participantId);
  }

  /** @return 새로 추가되었으면 true */
  boolean enroll(String participantId) {
    return participants.add(participantId);
  }

  /** @return 제거되었으면 true */
  boolean withdraw(String participantId) {
    return participants.remove(participantId);
  }

  ActivitySnapshot snapshot() {
    return new ActivitySnapshot(
        name, description, schedule, maxParticipants, List.copyOf(participants));
  }
}
