package io.github.brokerbench.broker;

/**
 * Supported broker backends.
 */
public enum BrokerType {
  MEMORY("memory"),
  REDIS("redis"),
  NATS("nats"),
  KAFKA("kafka");

  private final String value;

  BrokerType(String value) {
    this.value = value;
  }

  public String getValue() {
    return value;
  }

  /**
   * Resolves a broker type from its configuration name (case-insensitive).
   *
   * @param name the configured broker type
   * @return matching BrokerType
   * @throws IllegalArgumentException if the name is unknown
   */
  public static BrokerType fromName(String name) {
    if (name != null) {
      for (BrokerType type : values()) {
        if (type.value.equalsIgnoreCase(name.trim())) {
          return type;
        }
      }
    }
    throw new IllegalArgumentException("Unknown broker type: " + name);
  }
}
