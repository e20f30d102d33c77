package io.github.brokerbench.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for BenchmarkConfig and AppConfig.
 */
public class BenchmarkConfigTest {

  @Test
  void defaults() {
    BenchmarkConfig config = BenchmarkConfig.fromSource(ConfigSource.of(Map.of()));

    assertEquals(10, config.numPublishers());
    assertEquals(60, config.publishDurationSeconds());
    assertEquals("benchmark_channel", config.channelName());
    assertEquals("redis", config.brokerType());
    assertEquals(100, config.leaderWarmupMs());
    assertEquals(15_000, config.startGracePeriodMs());
    assertEquals(30_000, config.runTimeoutMarginMs());
    assertEquals(Duration.ofMillis(100), config.pollTimeout());
    assertEquals(30_000, config.drainTimeoutMs());
  }

  @Test
  void overrides() {
    BenchmarkConfig config = BenchmarkConfig.fromSource(ConfigSource.of(Map.of(
      "NUM_PUBLISHERS", "4",
      "PUBLISH_DURATION_SECONDS", "5",
      "CHANNEL_NAME", "load",
      "BROKER_TYPE", "nats"
    )));

    assertEquals(4, config.numPublishers());
    assertEquals(Duration.ofSeconds(5), config.publishDuration());
    assertEquals("load", config.channelName());
    assertEquals("nats", config.brokerType());
  }

  @Test
  void invalidValues_rejected() {
    assertThrows(IllegalArgumentException.class, () -> BenchmarkConfig.fromSource(
      ConfigSource.of(Map.of("NUM_PUBLISHERS", "0"))));
    assertThrows(IllegalArgumentException.class, () -> BenchmarkConfig.fromSource(
      ConfigSource.of(Map.of("PUBLISH_DURATION_SECONDS", "-1"))));
    assertThrows(IllegalArgumentException.class, () -> BenchmarkConfig.fromSource(
      ConfigSource.of(Map.of("POLL_TIMEOUT_MS", "0"))));
  }

  @Test
  void appConfig_roleOverrideAndInstanceId() {
    ConfigSource source = ConfigSource.of(Map.of(
      "BENCH_ROLE", "subscriber",
      "PUBLISHER_ID", "publisher_2",
      "SUBSCRIBER_ID", "subscriber_5",
      "RESULTS_DIR", "/tmp/results",
      "BATCH_ID", "b1"
    ));

    AppConfig publisher = AppConfig.fromSource(source, "PUBLISHER");
    AppConfig subscriber = AppConfig.fromSource(source, null);

    assertEquals("publisher", publisher.role());
    assertEquals("publisher_2", publisher.instanceId());
    assertEquals("subscriber", subscriber.role());
    assertEquals("subscriber_5", subscriber.instanceId());
    assertEquals(Path.of("/tmp/results"), subscriber.resultsDir());
    assertEquals("b1", subscriber.batchId());
    assertEquals(8888, subscriber.httpPort());
  }

  @Test
  void appConfig_defaultBatchIdIsTimestamp() {
    AppConfig config = AppConfig.fromSource(ConfigSource.of(Map.of()), null);

    assertEquals("subscriber", config.role());
    assertEquals(15, config.batchId().length());
  }
}
