package io.github.brokerbench.health;

/**
 * Health of the benchmark service, with the HTTP status code the health endpoints return.
 */
public enum HealthStatus {
  UP("UP", 200),
  DOWN("DOWN", 503);

  private final String value;
  private final int httpStatusCode;

  HealthStatus(String value, int httpStatusCode) {
    this.value = value;
    this.httpStatusCode = httpStatusCode;
  }

  public static HealthStatus of(boolean up) {
    return up ? UP : DOWN;
  }

  public String getValue() {
    return value;
  }

  public int httpStatusCode() {
    return httpStatusCode;
  }
}
