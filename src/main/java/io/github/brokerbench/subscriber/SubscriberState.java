package io.github.brokerbench.subscriber;

/**
 * Lifecycle of a subscriber's measurement window.
 */
public enum SubscriberState {
  AWAITING_START("awaiting_start"),
  MEASURING("measuring"),
  FINALIZED("finalized");

  private final String value;

  SubscriberState(String value) {
    this.value = value;
  }

  public String getValue() {
    return value;
  }
}
