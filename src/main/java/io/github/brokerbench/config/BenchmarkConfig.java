package io.github.brokerbench.config;

import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parameters of one benchmark run, shared by publisher and subscriber roles.
 *
 * @param numPublishers number of concurrent publishing workers
 * @param publishDurationSeconds wall-clock publishing duration
 * @param channelName the single channel carrying sentinels and payload
 * @param brokerType broker backend selector (memory, redis, nats, kafka)
 * @param leaderWarmupMs pause after START_BENCHMARK before flooding begins
 * @param startGracePeriodMs how long a subscriber waits for START_BENCHMARK
 * @param runTimeoutMarginMs slack added to the publish duration before a subscriber gives up on END_BENCHMARK
 * @param pollTimeoutMs budget of a single processMessages call
 * @param drainTimeoutMs how long the leader waits for the other workers to drain before END_BENCHMARK
 */
public record BenchmarkConfig(
  int numPublishers,
  int publishDurationSeconds,
  String channelName,
  String brokerType,
  long leaderWarmupMs,
  long startGracePeriodMs,
  long runTimeoutMarginMs,
  long pollTimeoutMs,
  long drainTimeoutMs
) {
  private static final Logger log = LoggerFactory.getLogger(BenchmarkConfig.class);

  public static final String DEFAULT_CHANNEL = "benchmark_channel";

  private static final int DEFAULT_NUM_PUBLISHERS = 10;
  private static final int DEFAULT_PUBLISH_DURATION_SECONDS = 60;
  private static final String DEFAULT_BROKER_TYPE = "redis";
  private static final long DEFAULT_LEADER_WARMUP_MS = 100;
  private static final long DEFAULT_START_GRACE_PERIOD_MS = 15_000;
  private static final long DEFAULT_RUN_TIMEOUT_MARGIN_MS = 30_000;
  private static final long DEFAULT_POLL_TIMEOUT_MS = 100;
  private static final long DEFAULT_DRAIN_TIMEOUT_MS = 30_000;

  public BenchmarkConfig {
    if (numPublishers < 1) {
      throw new IllegalArgumentException("numPublishers must be >= 1, got " + numPublishers);
    }
    if (publishDurationSeconds < 0) {
      throw new IllegalArgumentException("publishDurationSeconds must be >= 0, got " + publishDurationSeconds);
    }
    if (channelName == null || channelName.isBlank()) {
      throw new IllegalArgumentException("channelName cannot be blank");
    }
    if (pollTimeoutMs <= 0) {
      throw new IllegalArgumentException("pollTimeoutMs must be > 0, got " + pollTimeoutMs);
    }
  }

  /**
   * Loads benchmark parameters from the given source.
   *
   * <p>Supported keys:
   * <ul>
   *   <li>NUM_PUBLISHERS (default: 10)</li>
   *   <li>PUBLISH_DURATION_SECONDS (default: 60)</li>
   *   <li>CHANNEL_NAME (default: benchmark_channel)</li>
   *   <li>BROKER_TYPE (default: redis)</li>
   *   <li>LEADER_WARMUP_MS (default: 100)</li>
   *   <li>START_GRACE_PERIOD_MS (default: 15000)</li>
   *   <li>RUN_TIMEOUT_MARGIN_MS (default: 30000)</li>
   *   <li>POLL_TIMEOUT_MS (default: 100)</li>
   *   <li>DRAIN_TIMEOUT_MS (default: 30000)</li>
   * </ul>
   */
  public static BenchmarkConfig fromSource(ConfigSource source) {
    BenchmarkConfig config = new BenchmarkConfig(
      source.getInt("NUM_PUBLISHERS", DEFAULT_NUM_PUBLISHERS),
      source.getInt("PUBLISH_DURATION_SECONDS", DEFAULT_PUBLISH_DURATION_SECONDS),
      source.get("CHANNEL_NAME", DEFAULT_CHANNEL),
      source.get("BROKER_TYPE", DEFAULT_BROKER_TYPE),
      source.getLong("LEADER_WARMUP_MS", DEFAULT_LEADER_WARMUP_MS),
      source.getLong("START_GRACE_PERIOD_MS", DEFAULT_START_GRACE_PERIOD_MS),
      source.getLong("RUN_TIMEOUT_MARGIN_MS", DEFAULT_RUN_TIMEOUT_MARGIN_MS),
      source.getLong("POLL_TIMEOUT_MS", DEFAULT_POLL_TIMEOUT_MS),
      source.getLong("DRAIN_TIMEOUT_MS", DEFAULT_DRAIN_TIMEOUT_MS)
    );

    log.info("Benchmark config: publishers={}, duration={}s, channel={}, broker={}, startGrace={}ms, runMargin={}ms",
      config.numPublishers, config.publishDurationSeconds, config.channelName, config.brokerType,
      config.startGracePeriodMs, config.runTimeoutMarginMs);
    return config;
  }

  public static BenchmarkConfig fromEnvironment() {
    return fromSource(ConfigSource.load());
  }

  public Duration publishDuration() {
    return Duration.ofSeconds(publishDurationSeconds);
  }

  public Duration pollTimeout() {
    return Duration.ofMillis(pollTimeoutMs);
  }
}
