package io.github.brokerbench.health;

import io.vertx.core.json.JsonObject;

/**
 * Immutable health check response.
 *
 * @param status overall health status
 * @param broker broker backend name (null for liveness check)
 * @param subscription subscribed or unsubscribed (null for liveness check)
 * @param benchmark benchmark state of the subscriber (null for liveness check)
 */
public record HealthCheckResponse(
  HealthStatus status,
  String broker,
  String subscription,
  String benchmark
) {
  /**
   * Creates a liveness response (HTTP server only).
   *
   * @return HealthCheckResponse with UP status
   */
  public static HealthCheckResponse liveness() {
    return new HealthCheckResponse(HealthStatus.UP, null, null, null);
  }

  /**
   * Creates a readiness response. A subscriber is ready once its subscription is active.
   *
   * @param broker broker backend name
   * @param subscribed true if the benchmark channel subscription is active
   * @param benchmark current benchmark state
   * @return HealthCheckResponse with appropriate status
   */
  public static HealthCheckResponse readiness(String broker, boolean subscribed, String benchmark) {
    HealthStatus status = HealthStatus.of(subscribed);
    return new HealthCheckResponse(status, broker, subscribed ? "subscribed" : "unsubscribed", benchmark);
  }

  public boolean isUp() {
    return status == HealthStatus.UP;
  }

  /**
   * Converts to JSON for HTTP response.
   *
   * @return JsonObject representation
   */
  public JsonObject toJson() {
    JsonObject json = new JsonObject().put("status", status.getValue());
    if (broker != null) {
      json.put("broker", broker);
    }
    if (subscription != null) {
      json.put("subscription", subscription);
    }
    if (benchmark != null) {
      json.put("benchmark", benchmark);
    }
    return json;
  }
}
