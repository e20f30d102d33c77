package io.github.brokerbench.metrics;

import io.github.brokerbench.config.ConfigSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Metrics reporting configuration.
 *
 * @param enabled whether a meter registry is created at all
 * @param reporterType prometheus or otlp
 * @param jvmMetricsEnabled whether JVM memory, GC, thread and CPU meters are bound
 */
public record MetricsConfig(
  boolean enabled,
  String reporterType,
  boolean jvmMetricsEnabled
) {
  private static final Logger log = LoggerFactory.getLogger(MetricsConfig.class);

  private static final String DEFAULT_REPORTER = "prometheus";

  public boolean isEnabled() {
    return enabled;
  }

  public static MetricsConfig fromSource(ConfigSource source) {
    MetricsConfig config = new MetricsConfig(
      source.getBoolean("METRICS_ENABLED", true),
      source.get("METRICS_REPORTER", DEFAULT_REPORTER).toLowerCase(),
      source.getBoolean("METRICS_JVM_ENABLED", false)
    );
    log.info("MetricsConfig loaded: enabled={}, reporter={}, jvmMetrics={}",
      config.enabled, config.reporterType, config.jvmMetricsEnabled);
    return config;
  }

  public static MetricsConfig fromEnvironment() {
    return fromSource(ConfigSource.load());
  }
}
