package io.github.brokerbench.results;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.brokerbench.model.PublisherResult;
import io.github.brokerbench.model.PublisherStats;
import io.github.brokerbench.model.RunMetadata;
import io.github.brokerbench.model.RunOutcome;
import io.github.brokerbench.model.RunStats;
import io.github.brokerbench.model.SubscriberResult;
import io.vertx.core.json.JsonObject;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Unit tests for JsonResultsWriter.
 */
public class JsonResultsWriterTest {

  private static final RunMetadata METADATA = new RunMetadata("batch42", "nats", "host-a", "20240101T120000");

  @TempDir
  Path tempDir;

  @Test
  void subscriberRecord_pathAndFields() throws IOException {
    JsonResultsWriter writer = new JsonResultsWriter(tempDir);
    SubscriberResult result = new SubscriberResult("subscriber_3",
      new RunStats(1000, Duration.ofMillis(3000), RunOutcome.COMPLETED), METADATA);

    Path file = writer.write(result).orElseThrow();

    assertEquals(tempDir.resolve("batch42").resolve("nats_subscriber_3_host-a_20240101T120000.json"), file);
    JsonObject json = new JsonObject(Files.readString(file));
    assertEquals("batch42", json.getString("batch_id"));
    assertEquals("nats", json.getString("broker_type"));
    assertEquals("subscriber", json.getString("role"));
    assertEquals("subscriber_3", json.getString("subscriber_id"));
    assertEquals("host-a", json.getString("host"));
    assertEquals("20240101T120000", json.getString("timestamp"));
    assertEquals(1000L, json.getLong("messages_received"));
    assertEquals(3_000_000L, json.getLong("duration_us"));
    assertEquals(3000L, json.getLong("duration_ms"));
    assertEquals(333.33, json.getDouble("throughput_msg_per_sec"), 1e-9);
    assertEquals("completed", json.getString("outcome"));
  }

  @Test
  void publisherRecord_fields() throws IOException {
    JsonResultsWriter writer = new JsonResultsWriter(tempDir);
    PublisherResult result = new PublisherResult("publisher_1",
      new PublisherStats(10, 1, 50_000, 7, Duration.ofSeconds(5)), METADATA);

    Path file = writer.write(result).orElseThrow();

    JsonObject json = new JsonObject(Files.readString(file));
    assertEquals("publisher", json.getString("role"));
    assertEquals("publisher_1", json.getString("publisher_id"));
    assertEquals(50_000L, json.getLong("messages_published"));
    assertEquals(7L, json.getLong("messages_failed"));
    assertEquals(1, json.getInteger("workers_failed"));
    assertEquals(10_000.0, json.getDouble("throughput_msg_per_sec"), 1e-9);
    assertFalse(json.containsKey("outcome"));
  }

  @Test
  void fileName_sanitizesUnsafeCharacters() {
    RunMetadata metadata = new RunMetadata("b", "redis", "pod/1 a", "t");

    assertEquals("redis_sub_1_pod_1_a_t.json", JsonResultsWriter.fileName("sub:1", metadata));
  }

  @Test
  void writeFailure_returnsEmpty() throws IOException {
    Path blocker = Files.writeString(tempDir.resolve("not-a-dir"), "x");
    JsonResultsWriter writer = new JsonResultsWriter(blocker);
    SubscriberResult result = new SubscriberResult("s", RunStats.completed(1, Duration.ofSeconds(1)), METADATA);

    Optional<Path> written = writer.write(result);

    assertTrue(written.isEmpty());
  }
}
