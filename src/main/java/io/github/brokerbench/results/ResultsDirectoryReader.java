package io.github.brokerbench.results;

import io.github.brokerbench.model.PublisherResult;
import io.github.brokerbench.model.PublisherStats;
import io.github.brokerbench.model.RunMetadata;
import io.github.brokerbench.model.RunOutcome;
import io.github.brokerbench.model.RunStats;
import io.github.brokerbench.model.SubscriberResult;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads every {@code *.json} record directly inside a results directory.
 *
 * <p>Files that are not valid JSON or lack the required counters are logged and skipped.
 * Records without a {@code role} field are treated as subscriber records.
 */
public class ResultsDirectoryReader {

  private static final Logger log = LoggerFactory.getLogger(ResultsDirectoryReader.class);

  /**
   * @param dir directory holding the records of one batch
   * @throws IOException if the directory cannot be listed
   */
  public ResultsDirectory read(Path dir) throws IOException {
    List<Path> files;
    try (Stream<Path> entries = Files.list(dir)) {
      files = entries
        .filter(Files::isRegularFile)
        .filter(p -> p.getFileName().toString().endsWith(".json"))
        .sorted()
        .toList();
    }

    List<SubscriberResult> subscribers = new ArrayList<>();
    List<PublisherResult> publishers = new ArrayList<>();
    int skipped = 0;
    for (Path file : files) {
      try {
        JsonObject json = new JsonObject(Files.readString(file, StandardCharsets.UTF_8));
        if (ResultFields.ROLE_PUBLISHER.equals(json.getString(ResultFields.ROLE))) {
          publishers.add(parsePublisher(json));
        } else {
          subscribers.add(parseSubscriber(json));
        }
        log.debug("Loaded {}", file.getFileName());
      } catch (DecodeException | IllegalArgumentException | ClassCastException e) {
        log.warn("Skipping {}: {}", file.getFileName(), e.getMessage());
        skipped++;
      } catch (IOException e) {
        log.warn("Skipping unreadable {}: {}", file.getFileName(), e.getMessage());
        skipped++;
      }
    }
    log.info("Read {} subscriber and {} publisher records from {}, skipped {}",
      subscribers.size(), publishers.size(), dir, skipped);
    return new ResultsDirectory(subscribers, publishers, skipped);
  }

  static SubscriberResult parseSubscriber(JsonObject json) {
    String id = requireString(json, ResultFields.SUBSCRIBER_ID);
    RunStats stats = new RunStats(
      requireLong(json, ResultFields.MESSAGES_RECEIVED),
      Duration.ofNanos(requireLong(json, ResultFields.DURATION_US) * 1_000),
      RunOutcome.fromValue(json.getString(ResultFields.OUTCOME))
    );
    return new SubscriberResult(id, stats, metadata(json));
  }

  static PublisherResult parsePublisher(JsonObject json) {
    String id = requireString(json, ResultFields.PUBLISHER_ID);
    PublisherStats stats = new PublisherStats(
      json.getInteger(ResultFields.WORKERS, 0),
      json.getInteger(ResultFields.WORKERS_FAILED, 0),
      requireLong(json, ResultFields.MESSAGES_PUBLISHED),
      json.getLong(ResultFields.MESSAGES_FAILED, 0L),
      Duration.ofNanos(requireLong(json, ResultFields.DURATION_US) * 1_000)
    );
    return new PublisherResult(id, stats, metadata(json));
  }

  private static RunMetadata metadata(JsonObject json) {
    return new RunMetadata(
      json.getString(ResultFields.BATCH_ID, ""),
      json.getString(ResultFields.BROKER_TYPE, "unknown"),
      json.getString(ResultFields.HOST, "unknown-host"),
      json.getString(ResultFields.TIMESTAMP, "")
    );
  }

  private static String requireString(JsonObject json, String field) {
    String value = json.getString(field);
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("missing " + field);
    }
    return value;
  }

  private static long requireLong(JsonObject json, String field) {
    Long value = json.getLong(field);
    if (value == null) {
      throw new IllegalArgumentException("missing " + field);
    }
    return value;
  }
}
