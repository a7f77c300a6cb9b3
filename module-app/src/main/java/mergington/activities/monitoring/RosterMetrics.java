package mergington.activities.monitoring;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import mergington.activities.core.domain.directory.ActivityDirectory;
import mergington.activities.core.domain.model.ActivitySnapshot;
import mergington.activities.core.domain.model.RosterOutcome;
import org.springframework.stereotype.Component;

/**
 * 명단 메트릭
 *
 * <h3>메트릭</h3>
 *
 * <pre>
 * - activity_roster_operations_total : Counter (tag: operation=signup|unregister, outcome=signed_up|...)
 * - activity_roster_participants     : Gauge   (tag: activity)
 * </pre>
 */
@Component
@RequiredArgsConstructor
public class RosterMetrics {

  static final String OPERATIONS = "activity.roster.operations";
  static final String PARTICIPANTS = "activity.roster.participants";

  private final MeterRegistry registry;
  private final ActivityDirectory directory;

  @PostConstruct
  void registerGauges() {
    for (String activityName : directory.activityNames()) {
      Gauge.builder(PARTICIPANTS, directory, d -> participantCount(d, activityName))
          .tag("activity", activityName)
          .register(registry);
    }
  }

  public void record(String operation, RosterOutcome outcome) {
    registry
        .counter(
            OPERATIONS,
            "operation",
            operation,
            "outcome",
            outcome.status().name().toLowerCase(Locale.ROOT))
        .increment();
  }

  private static double participantCount(ActivityDirectory directory, String activityName) {
    return directory
        .find(activityName)
        .map(ActivitySnapshot::participants)
        .map(List::size)
        .orElse(0)
        .doubleValue();
  }
}
