package mergington.activities.infrastructure.executor;

import java.util.Objects;

/**
 * 로그 추적을 위한 작업 컨텍스트
 *
 * <h3>형식</h3>
 *
 * <pre>
 * "component:operation:dynamicValue"
 *
 * 예시:
 * - TaskContext.of("RosterLock", "Guard", "Chess Club") → "RosterLock:Guard:Chess Club"
 * - TaskContext.of("Filter", "MDC") → "Filter:MDC"
 * </pre>
 *
 * @param component 컴포넌트 이름 (예: "RosterLock", "Filter")
 * @param operation 작업 유형 (예: "Guard", "Seed")
 * @param dynamicValue 동적 값 (예: 활동 이름, correlation id)
 */
public record TaskContext(String component, String operation, String dynamicValue) {

  public TaskContext {
    Objects.requireNonNull(component, "component");
    Objects.requireNonNull(operation, "operation");
    if (dynamicValue == null) {
      dynamicValue = "";
    }
  }

  public static TaskContext of(String component, String operation, String dynamicValue) {
    return new TaskContext(component, operation, dynamicValue);
  }

  public static TaskContext of(String component, String operation) {
    return new TaskContext(component, operation, "");
  }

  /** @return "component:operation[:dynamicValue]" */
  public String toTaskName() {
    if (dynamicValue.isEmpty()) {
      return component + ":" + operation;
    }
    return component + ":" + operation + ":" + dynamicValue;
  }
}
