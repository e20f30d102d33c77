package io.github.brokerbench.results;

import io.github.brokerbench.model.PublisherResult;
import io.github.brokerbench.model.PublisherStats;
import io.github.brokerbench.model.RunMetadata;
import io.github.brokerbench.model.RunStats;
import io.github.brokerbench.model.SubscriberResult;
import io.vertx.core.json.JsonObject;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes one pretty-printed JSON file per result to
 * {@code <resultsDir>/<batchId>/<broker>_<instance>_<host>_<timestamp>.json}.
 */
public class JsonResultsWriter implements ResultsWriter {

  private static final Logger log = LoggerFactory.getLogger(JsonResultsWriter.class);

  private final Path resultsDir;

  public JsonResultsWriter(Path resultsDir) {
    this.resultsDir = Objects.requireNonNull(resultsDir, "resultsDir cannot be null");
  }

  @Override
  public Optional<Path> write(SubscriberResult result) {
    return writeRecord(toJson(result), result.subscriberId(), result.metadata());
  }

  @Override
  public Optional<Path> write(PublisherResult result) {
    return writeRecord(toJson(result), result.publisherId(), result.metadata());
  }

  static JsonObject toJson(SubscriberResult result) {
    RunStats stats = result.stats();
    return metadataJson(result.metadata(), ResultFields.ROLE_SUBSCRIBER)
      .put(ResultFields.SUBSCRIBER_ID, result.subscriberId())
      .put(ResultFields.MESSAGES_RECEIVED, stats.messagesReceived())
      .put(ResultFields.DURATION_US, stats.duration().toNanos() / 1_000)
      .put(ResultFields.DURATION_MS, stats.duration().toMillis())
      .put(ResultFields.THROUGHPUT, round2(stats.throughput()))
      .put(ResultFields.OUTCOME, stats.outcome().getValue());
  }

  static JsonObject toJson(PublisherResult result) {
    PublisherStats stats = result.stats();
    return metadataJson(result.metadata(), ResultFields.ROLE_PUBLISHER)
      .put(ResultFields.PUBLISHER_ID, result.publisherId())
      .put(ResultFields.WORKERS, stats.workers())
      .put(ResultFields.WORKERS_FAILED, stats.workersFailed())
      .put(ResultFields.MESSAGES_PUBLISHED, stats.messagesPublished())
      .put(ResultFields.MESSAGES_FAILED, stats.messagesFailed())
      .put(ResultFields.DURATION_US, stats.duration().toNanos() / 1_000)
      .put(ResultFields.DURATION_MS, stats.duration().toMillis())
      .put(ResultFields.THROUGHPUT, round2(stats.throughput()));
  }

  static String fileName(String instanceId, RunMetadata metadata) {
    return sanitize(metadata.brokerType()) + "_" + sanitize(instanceId) + "_"
      + sanitize(metadata.host()) + "_" + sanitize(metadata.timestamp()) + ".json";
  }

  private Optional<Path> writeRecord(JsonObject json, String instanceId, RunMetadata metadata) {
    Path batchDir = resultsDir.resolve(sanitize(metadata.batchId()));
    Path file = batchDir.resolve(fileName(instanceId, metadata));
    try {
      Files.createDirectories(batchDir);
      Files.writeString(file, json.encodePrettily(), StandardCharsets.UTF_8);
      log.info("Results saved to {}", file);
      return Optional.of(file);
    } catch (IOException e) {
      log.error("Failed to write results to {}: {}", file, e.getMessage());
      return Optional.empty();
    }
  }

  private static JsonObject metadataJson(RunMetadata metadata, String role) {
    return new JsonObject()
      .put(ResultFields.BATCH_ID, metadata.batchId())
      .put(ResultFields.BROKER_TYPE, metadata.brokerType())
      .put(ResultFields.ROLE, role)
      .put(ResultFields.HOST, metadata.host())
      .put(ResultFields.TIMESTAMP, metadata.timestamp());
  }

  private static double round2(double value) {
    return Math.round(value * 100.0) / 100.0;
  }

  private static String sanitize(String part) {
    if (part == null || part.isBlank()) {
      return "unknown";
    }
    return part.replaceAll("[^A-Za-z0-9._-]", "_");
  }
}
