package mergington.activities.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.util.List;
import mergington.activities.core.domain.model.ActivitySeed;
import mergington.activities.core.domain.model.CapacityPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * 활동 디렉터리 설정
 *
 * <h2>설정</h2>
 *
 * <pre>{@code
 * activities:
 *   capacity-policy: enforce   # enforce | informational (기본값: enforce)
 *   lock-stripes: 16           # 기본값: 16
 *   seed:
 *     - name: Chess Club
 *       description: Learn strategies and compete in chess tournaments
 *       schedule: Fridays, 3:30 PM - 5:00 PM
 *       max-participants: 12
 *       participants: [michael@mergington.edu]
 * }</pre>
 *
 * @see ActivityDirectoryConfig
 */
@Validated
@ConfigurationProperties(prefix = "activities")
public record ActivityProperties(
    @DefaultValue("ENFORCE") CapacityPolicy capacityPolicy,
    @DefaultValue("16") @Positive int lockStripes,
    @Valid List<SeedActivity> seed) {

  public ActivityProperties {
    if (seed == null) {
      seed = List.of();
    }
  }

  /** 도메인 시드로 변환 (검증 실패 시 IllegalArgumentException) */
  public List<ActivitySeed> toSeeds() {
    return seed.stream().map(SeedActivity::toSeed).toList();
  }

  /** 시드 활동 1건 */
  public record SeedActivity(
      @NotBlank String name,
      @NotNull String description,
      @NotNull String schedule,
      @Positive int maxParticipants,
      List<String> participants) {

    ActivitySeed toSeed() {
      return new ActivitySeed(name, description, schedule, maxParticipants, participants);
    }
  }
}
