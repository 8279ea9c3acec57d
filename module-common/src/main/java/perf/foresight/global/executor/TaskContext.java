package perf.foresight.global.executor;

import java.util.Objects;

/**
 * Structured task name used for logging and failure metrics.
 *
 * <pre>
 * "component:operation:dynamicValue"
 *
 * TaskContext.of("Engine", "Detect", "response_time") → "Engine:Detect:response_time"
 * TaskContext.of("Engine", "Collect")                 → "Engine:Collect"
 * </pre>
 *
 * <p>component and operation are fixed taxonomy values and may be used as metric tags;
 * dynamicValue (a metric key, a model name) only goes to the log.
 *
 * @param component component name (e.g. "Engine", "BaselineManager")
 * @param operation operation name (e.g. "Predict", "Refresh")
 * @param dynamicValue free-form value, empty when absent
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

  public String toTaskName() {
    if (dynamicValue.isEmpty()) {
      return component + ":" + operation;
    }
    return component + ":" + operation + ":" + dynamicValue;
  }
}
