package io.github.brokerbench.health;

import io.vertx.core.http.HttpHeaders;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP handler for health check endpoints.
 */
public class HealthCheckHandler {

  private static final Logger log = LoggerFactory.getLogger(HealthCheckHandler.class);
  private static final String CONTENT_TYPE_JSON = "application/json";

  private final Supplier<HealthCheckResponse> readiness;

  /**
   * @param readiness evaluated on every /readyz request
   */
  public HealthCheckHandler(Supplier<HealthCheckResponse> readiness) {
    this.readiness = readiness;
  }

  /**
   * Registers health check routes on the router.
   *
   * @param router the Vert.x router
   */
  public void registerRoutes(Router router) {
    router.get("/healthz").handler(this::handleLiveness);
    router.get("/readyz").handler(this::handleReadiness);
    log.info("Health check routes registered: /healthz, /readyz");
  }

  /**
   * Liveness probe - always 200 while the HTTP server is up.
   */
  private void handleLiveness(RoutingContext ctx) {
    ctx.response()
      .putHeader(HttpHeaders.CONTENT_TYPE, CONTENT_TYPE_JSON)
      .setStatusCode(HealthStatus.UP.httpStatusCode())
      .end(HealthCheckResponse.liveness().toJson().encode());
  }

  /**
   * Readiness probe - 200 while subscribed, 503 otherwise.
   */
  private void handleReadiness(RoutingContext ctx) {
    HealthCheckResponse response = readiness.get();
    if (!response.isUp()) {
      log.debug("Readiness DOWN: broker={}, subscription={}", response.broker(), response.subscription());
    }
    ctx.response()
      .putHeader(HttpHeaders.CONTENT_TYPE, CONTENT_TYPE_JSON)
      .setStatusCode(response.status().httpStatusCode())
      .end(response.toJson().encode());
  }
}
