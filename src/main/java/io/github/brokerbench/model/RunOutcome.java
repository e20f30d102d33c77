package io.github.brokerbench.model;

/**
 * How a subscriber's measurement window was closed.
 */
public enum RunOutcome {
  COMPLETED("completed"),
  START_TIMEOUT("start_timeout"),
  RUN_TIMEOUT("run_timeout");

  private final String value;

  RunOutcome(String value) {
    this.value = value;
  }

  public String getValue() {
    return value;
  }

  /**
   * @return the matching outcome, COMPLETED for null or unknown values
   */
  public static RunOutcome fromValue(String value) {
    for (RunOutcome outcome : values()) {
      if (outcome.value.equals(value)) {
        return outcome;
      }
    }
    return COMPLETED;
  }
}
