package io.github.brokerbench.metrics;

import io.micrometer.prometheus.PrometheusMeterRegistry;
import io.vertx.core.http.HttpHeaders;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serves the subscriber's benchmark gauges on /metrics for Prometheus scraping.
 */
public class PrometheusHandler {

  private static final Logger log = LoggerFactory.getLogger(PrometheusHandler.class);
  private static final String PROMETHEUS_CONTENT_TYPE = "text/plain; version=0.0.4; charset=utf-8";
  static final String METRICS_PATH = "/metrics";

  private final PrometheusMeterRegistry registry;
  private final String brokerType;
  private final String batchId;

  /**
   * @param registry registry holding the benchmark gauges
   * @param brokerType broker under test, used in log lines
   * @param batchId benchmark batch, used in log lines
   */
  public PrometheusHandler(PrometheusMeterRegistry registry, String brokerType, String batchId) {
    this.registry = Objects.requireNonNull(registry, "registry cannot be null");
    this.brokerType = brokerType;
    this.batchId = batchId;
  }

  public void registerRoutes(Router router) {
    router.get(METRICS_PATH).handler(this::handleMetrics);
    log.info("Registered Prometheus endpoint at {} for broker {} (batch {})", METRICS_PATH, brokerType, batchId);
  }

  private void handleMetrics(RoutingContext ctx) {
    String body;
    try {
      body = registry.scrape();
    } catch (RuntimeException e) {
      log.error("Prometheus scrape failed for broker {} (batch {})", brokerType, batchId, e);
      ctx.fail(500, e);
      return;
    }
    log.debug("Served Prometheus scrape for broker {} (batch {}): {} bytes", brokerType, batchId, body.length());
    ctx.response()
      .putHeader(HttpHeaders.CONTENT_TYPE, PROMETHEUS_CONTENT_TYPE)
      .end(body);
  }
}
