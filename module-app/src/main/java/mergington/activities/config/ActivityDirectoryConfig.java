package mergington.activities.config;

import lombok.extern.slf4j.Slf4j;
import mergington.activities.core.domain.directory.ActivityDirectory;
import mergington.activities.core.port.out.RosterLockPort;
import mergington.activities.infrastructure.executor.LogicExecutor;
import mergington.activities.infrastructure.executor.TaskContext;
import mergington.activities.infrastructure.executor.strategy.ExceptionTranslator;
import mergington.activities.infrastructure.lock.StripedRosterLock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 활동 디렉터리 구성
 *
 * <p>디렉터리는 정적 싱글톤이 아닌 컨테이너가 소유하는 빈이며, 시드 검증 실패 시 {@code ActivitySeedException}으로 기동을 중단합니다.
 */
@Slf4j
@Configuration
public class ActivityDirectoryConfig {

  @Bean
  public RosterLockPort rosterLockPort(ActivityProperties properties, LogicExecutor executor) {
    return new StripedRosterLock(properties.lockStripes(), executor);
  }

  @Bean
  public ActivityDirectory activityDirectory(
      ActivityProperties properties, RosterLockPort rosterLockPort, LogicExecutor executor) {
    ActivityDirectory directory =
        executor.executeWithTranslation(
            () ->
                ActivityDirectory.create(
                    properties.toSeeds(), rosterLockPort, properties.capacityPolicy()),
            ExceptionTranslator.forSeed(),
            TaskContext.of("Directory", "Seed"));

    log.info(
        "[Directory] 활동 {}개 로드 완료 (capacity-policy: {})",
        directory.activityNames().size(),
        directory.capacityPolicy());
    return directory;
  }
}
