package io.github.brokerbench.metrics;

import io.github.brokerbench.model.PublisherStats;
import io.github.brokerbench.model.RunOutcome;
import io.github.brokerbench.model.RunStats;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.vertx.core.Future;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reports benchmark gauges using a Micrometer MeterRegistry.
 * Works with any Micrometer-supported backend (Prometheus, OTLP, etc).
 */
public class MicrometerReporter implements BenchmarkMetricsReporter {

  private static final Logger log = LoggerFactory.getLogger(MicrometerReporter.class);

  static final String SUBSCRIBER_RECEIVED = "brokerbench.subscriber.messages.received";
  static final String SUBSCRIBER_DURATION = "brokerbench.subscriber.duration.seconds";
  static final String SUBSCRIBER_THROUGHPUT = "brokerbench.subscriber.throughput";
  static final String SUBSCRIBER_OUTCOME = "brokerbench.subscriber.outcome";
  static final String PUBLISHER_PUBLISHED = "brokerbench.publisher.messages.published";
  static final String PUBLISHER_FAILED = "brokerbench.publisher.messages.failed";
  static final String PUBLISHER_THROUGHPUT = "brokerbench.publisher.throughput";
  static final String PUBLISHER_WORKERS_FAILED = "brokerbench.publisher.workers.failed";

  private final MeterRegistry registry;
  private final String brokerType;
  private final String batchId;
  // Doubles are held as raw long bits
  private final Map<String, AtomicLong> gaugeValues = new ConcurrentHashMap<>();

  public MicrometerReporter(MeterRegistry registry, String brokerType, String batchId) {
    this.registry = registry;
    this.brokerType = brokerType;
    this.batchId = batchId;
  }

  @Override
  public void reportSubscriberProgress(String instanceId, long messagesReceived) {
    recordGauge(SUBSCRIBER_RECEIVED, tags(instanceId), messagesReceived);
  }

  @Override
  public void reportSubscriber(String instanceId, RunStats stats) {
    Tags tags = tags(instanceId);
    recordGauge(SUBSCRIBER_RECEIVED, tags, stats.messagesReceived());
    recordGauge(SUBSCRIBER_DURATION, tags, stats.durationSeconds());
    recordGauge(SUBSCRIBER_THROUGHPUT, tags, stats.throughput());
    for (RunOutcome outcome : RunOutcome.values()) {
      recordGauge(SUBSCRIBER_OUTCOME, tags.and("outcome", outcome.getValue()),
        outcome == stats.outcome() ? 1 : 0);
    }
    log.debug("Reported subscriber metrics for {}", instanceId);
  }

  @Override
  public void reportPublisher(String instanceId, PublisherStats stats) {
    Tags tags = tags(instanceId);
    recordGauge(PUBLISHER_PUBLISHED, tags, stats.messagesPublished());
    recordGauge(PUBLISHER_FAILED, tags, stats.messagesFailed());
    recordGauge(PUBLISHER_THROUGHPUT, tags, stats.throughput());
    recordGauge(PUBLISHER_WORKERS_FAILED, tags, stats.workersFailed());
    log.debug("Reported publisher metrics for {}", instanceId);
  }

  @Override
  public Future<Void> start() {
    log.info("MicrometerReporter started");
    return Future.succeededFuture();
  }

  @Override
  public Future<Void> close() {
    log.info("Closing MicrometerReporter");
    if (registry != null) {
      registry.close();
    }
    return Future.succeededFuture();
  }

  private Tags tags(String instanceId) {
    return Tags.of("broker", brokerType, "batch_id", batchId, "instance", instanceId);
  }

  private void recordGauge(String name, Tags tags, double value) {
    String key = name + tags.toString();
    long bits = Double.doubleToRawLongBits(value);
    AtomicLong holder = gaugeValues.computeIfAbsent(key, k -> {
      AtomicLong newValue = new AtomicLong(bits);
      Gauge.builder(name, newValue, v -> Double.longBitsToDouble(v.get()))
        .tags(tags)
        .register(registry);
      return newValue;
    });
    holder.set(bits);
  }
}
