package io.github.brokerbench;

import io.github.brokerbench.config.ConfigSource;
import io.github.brokerbench.metrics.BenchmarkMetricsReporter;
import io.github.brokerbench.metrics.MetricsConfig;
import io.github.brokerbench.metrics.MicrometerConfig;
import io.github.brokerbench.metrics.MicrometerReporter;
import io.github.brokerbench.metrics.PrometheusHandler;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import io.vertx.ext.web.Router;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the metrics reporter of a role, registering /metrics when the registry is Prometheus
 * and a router is given.
 */
final class MetricsSupport {

  private static final Logger log = LoggerFactory.getLogger(MetricsSupport.class);

  private MetricsSupport() {}

  static BenchmarkMetricsReporter createReporter(MetricsConfig config, ConfigSource source, Router router,
                                                 String brokerType, String batchId) {
    if (!config.isEnabled()) {
      log.info("Metrics reporting is disabled");
      return BenchmarkMetricsReporter.noop();
    }

    MeterRegistry registry = MicrometerConfig.createRegistry(config.reporterType(), source);
    if (registry == null) {
      log.warn("Failed to create meter registry for type: {}", config.reporterType());
      return BenchmarkMetricsReporter.noop();
    }

    if (config.jvmMetricsEnabled()) {
      MicrometerConfig.bindJvmMetrics(registry);
      log.info("JVM metrics enabled");
    }

    if (router != null && registry instanceof PrometheusMeterRegistry prometheusRegistry) {
      new PrometheusHandler(prometheusRegistry, brokerType, batchId).registerRoutes(router);
    }

    return new MicrometerReporter(registry, brokerType, batchId);
  }
}
