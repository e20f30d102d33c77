package io.github.brokerbench.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.brokerbench.config.ConfigSource;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import java.util.Map;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for MicrometerConfig and MetricsConfig.
 */
public class MicrometerConfigTest {

  @Test
  void otlpUrl_priority() {
    assertEquals("http://localhost:4318/v1/metrics",
      MicrometerConfig.resolveOtlpUrl(ConfigSource.of(Map.of())));
    assertEquals("http://collector:4318/v1/metrics",
      MicrometerConfig.resolveOtlpUrl(ConfigSource.of(Map.of("OTEL_EXPORTER_OTLP_ENDPOINT", "http://collector:4318"))));
    assertEquals("http://direct/v1/metrics", MicrometerConfig.resolveOtlpUrl(ConfigSource.of(Map.of(
      "OTLP_ENDPOINT", "http://direct/v1/metrics",
      "OTEL_EXPORTER_OTLP_ENDPOINT", "http://collector:4318"))));
  }

  @Test
  void parsePairs_skipsInvalid() {
    assertEquals(Map.of("a", "1", "b", "x=y"), MicrometerConfig.parsePairs("a=1, bogus ,b=x=y"));
    assertTrue(MicrometerConfig.parsePairs("").isEmpty());
  }

  @Test
  void createRegistry_byType() {
    ConfigSource source = ConfigSource.of(Map.of());

    MeterRegistry prometheus = MicrometerConfig.createRegistry("Prometheus", source);

    assertTrue(prometheus instanceof PrometheusMeterRegistry);
    assertNull(MicrometerConfig.createRegistry("datadog", source));
    assertNull(MicrometerConfig.createRegistry(null, source));
    prometheus.close();
  }

  @Test
  void metricsConfig_defaults() {
    MetricsConfig config = MetricsConfig.fromSource(ConfigSource.of(Map.of()));

    assertTrue(config.isEnabled());
    assertEquals("prometheus", config.reporterType());
    assertFalse(config.jvmMetricsEnabled());
  }
}
