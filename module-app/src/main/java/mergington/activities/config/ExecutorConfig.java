package mergington.activities.config;

import mergington.activities.infrastructure.executor.DefaultLogicExecutor;
import mergington.activities.infrastructure.executor.LogicExecutor;
import mergington.activities.infrastructure.executor.strategy.ExceptionTranslator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ExecutorConfig {

  @Bean
  public LogicExecutor logicExecutor() {
    return new DefaultLogicExecutor(ExceptionTranslator.defaultTranslator());
  }
}
