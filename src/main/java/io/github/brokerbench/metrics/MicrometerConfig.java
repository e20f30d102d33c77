package io.github.brokerbench.metrics;

import io.github.brokerbench.config.ConfigSource;
import io.micrometer.core.instrument.Clock;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import io.micrometer.registry.otlp.AggregationTemporality;
import io.micrometer.registry.otlp.OtlpConfig;
import io.micrometer.registry.otlp.OtlpMeterRegistry;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory for creating Micrometer registries.
 */
public final class MicrometerConfig {

  private static final Logger log = LoggerFactory.getLogger(MicrometerConfig.class);

  private static final String DEFAULT_OTLP_URL = "http://localhost:4318/v1/metrics";
  private static final long DEFAULT_OTLP_STEP_MS = 10_000;

  private MicrometerConfig() {}

  /**
   * Creates a Prometheus meter registry.
   */
  public static PrometheusMeterRegistry createPrometheusRegistry() {
    log.info("Creating Prometheus meter registry");
    return new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
  }

  /**
   * Creates an OTLP meter registry.
   *
   * <p>Endpoint: OTLP_ENDPOINT, then OTEL_EXPORTER_OTLP_METRICS_ENDPOINT, then
   * OTEL_EXPORTER_OTLP_ENDPOINT + /v1/metrics. Step: OTLP_STEP_MS (default 10s, short runs
   * would otherwise never export). Headers: OTLP_HEADERS as key1=value1,key2=value2.
   * HTTP only, cumulative temporality.
   */
  public static MeterRegistry createOtlpRegistry(ConfigSource source) {
    log.info("Creating OTLP meter registry");

    String url = resolveOtlpUrl(source);
    Duration step = Duration.ofMillis(source.getLong("OTLP_STEP_MS", DEFAULT_OTLP_STEP_MS));
    Map<String, String> headers = parsePairs(source.get("OTLP_HEADERS", ""));
    Map<String, String> attributes = new HashMap<>(parsePairs(source.get("OTEL_RESOURCE_ATTRIBUTES", "")));
    attributes.put("service.name", source.get("OTEL_SERVICE_NAME", "brokerbench"));

    OtlpConfig config = new OtlpConfig() {
      @Override
      public String url() {
        return url;
      }

      @Override
      public AggregationTemporality aggregationTemporality() {
        return AggregationTemporality.CUMULATIVE;
      }

      @Override
      public Duration step() {
        return step;
      }

      @Override
      public Map<String, String> headers() {
        return headers;
      }

      @Override
      public Map<String, String> resourceAttributes() {
        return attributes;
      }

      @Override
      public String get(String key) {
        return null;
      }
    };

    OtlpMeterRegistry registry = new OtlpMeterRegistry(config, Clock.SYSTEM);
    log.info("OTLP registry created - endpoint: {}, step: {}", url, step);
    return registry;
  }

  /**
   * Creates a meter registry based on the reporter type.
   *
   * @param reporterType prometheus or otlp
   * @return the configured MeterRegistry, or null if the type is unknown
   */
  public static MeterRegistry createRegistry(String reporterType, ConfigSource source) {
    if (reporterType == null) {
      return null;
    }

    return switch (reporterType.toLowerCase()) {
      case "prometheus" -> createPrometheusRegistry();
      case "otlp" -> createOtlpRegistry(source);
      default -> {
        log.warn("Unknown reporter type: {}", reporterType);
        yield null;
      }
    };
  }

  /**
   * Binds JVM metrics (memory, GC, threads, CPU) to the given registry.
   */
  public static void bindJvmMetrics(MeterRegistry registry) {
    log.info("Binding JVM metrics to registry");
    new JvmMemoryMetrics().bindTo(registry);
    new JvmGcMetrics().bindTo(registry);
    new JvmThreadMetrics().bindTo(registry);
    new ProcessorMetrics().bindTo(registry);
  }

  static String resolveOtlpUrl(ConfigSource source) {
    String url = source.get("OTLP_ENDPOINT");
    if (url == null || url.isBlank()) {
      url = source.get("OTEL_EXPORTER_OTLP_METRICS_ENDPOINT");
    }
    if (url == null || url.isBlank()) {
      String base = source.get("OTEL_EXPORTER_OTLP_ENDPOINT");
      if (base != null && !base.isBlank()) {
        url = base.endsWith("/v1/metrics") ? base : base + "/v1/metrics";
      }
    }
    return (url != null && !url.isBlank()) ? url : DEFAULT_OTLP_URL;
  }

  static Map<String, String> parsePairs(String raw) {
    Map<String, String> pairs = new HashMap<>();
    if (raw == null || raw.isBlank()) {
      return pairs;
    }
    for (String pair : raw.split(",")) {
      String[] parts = pair.trim().split("=", 2);
      if (parts.length == 2) {
        pairs.put(parts[0].trim(), parts[1].trim());
      } else {
        log.warn("Invalid pair format (expected key=value): {}", pair);
      }
    }
    return pairs;
  }
}
