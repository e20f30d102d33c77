package io.github.brokerbench.results;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.brokerbench.model.PublisherResult;
import io.github.brokerbench.model.PublisherStats;
import io.github.brokerbench.model.RunMetadata;
import io.github.brokerbench.model.RunOutcome;
import io.github.brokerbench.model.RunStats;
import io.github.brokerbench.model.SubscriberResult;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Unit tests for AggregateCommand.
 */
public class AggregateCommandTest {

  @TempDir
  Path tempDir;

  private ByteArrayOutputStream out;
  private ByteArrayOutputStream err;
  private AggregateCommand command;

  @BeforeEach
  void setUp() {
    out = new ByteArrayOutputStream();
    err = new ByteArrayOutputStream();
    command = new AggregateCommand(new PrintStream(out, true, StandardCharsets.UTF_8),
      new PrintStream(err, true, StandardCharsets.UTF_8));
  }

  private String out() {
    return out.toString(StandardCharsets.UTF_8);
  }

  private String err() {
    return err.toString(StandardCharsets.UTF_8);
  }

  @Test
  void aggregatesBatch() {
    RunMetadata metadata = new RunMetadata("b1", "redis", "h", "20240101T000000");
    JsonResultsWriter writer = new JsonResultsWriter(tempDir);
    writer.write(new SubscriberResult("subscriber_1", RunStats.completed(100, Duration.ofSeconds(1)), metadata));
    writer.write(new SubscriberResult("subscriber_2", RunStats.completed(300, Duration.ofSeconds(3)), metadata));
    writer.write(new PublisherResult("publisher_1", new PublisherStats(2, 0, 400, 0, Duration.ofSeconds(3)), metadata));

    int exit = command.run(tempDir.resolve("b1").toString(), "redis");

    assertEquals(AggregateCommand.EXIT_OK, exit);
    String printed = out();
    assertTrue(printed.contains("redis Benchmark Results"), printed);
    assertTrue(printed.contains("Subscriber Instances:   2"), printed);
    assertTrue(printed.contains("Combined Throughput:    200.00 msg/sec"), printed);
    assertTrue(printed.contains("Delivery Rate:          50.00 %"), printed);
    assertTrue(printed.contains("subscriber_1"), printed);
  }

  @Test
  void startTimeoutInstance_excludedButListed() {
    RunMetadata metadata = new RunMetadata("b2", "nats", "h", "20240101T000000");
    JsonResultsWriter writer = new JsonResultsWriter(tempDir);
    writer.write(new SubscriberResult("subscriber_1", RunStats.completed(1000, Duration.ofSeconds(2)), metadata));
    writer.write(new SubscriberResult("subscriber_2",
      new RunStats(0, Duration.ZERO, RunOutcome.START_TIMEOUT), metadata));

    int exit = command.run(tempDir.resolve("b2").toString());

    assertEquals(AggregateCommand.EXIT_OK, exit);
    String printed = out();
    assertTrue(printed.contains("Subscriber Instances:   1"), printed);
    assertTrue(printed.contains("Excluded (no messages): 1"), printed);
    assertTrue(printed.contains("Combined Throughput:    500.00 msg/sec"), printed);
    assertTrue(printed.contains("(start_timeout) [excluded]"), printed);
  }

  @Test
  void onlyTimedOutInstances_fails() {
    RunMetadata metadata = new RunMetadata("b3", "nats", "h", "20240101T000000");
    new JsonResultsWriter(tempDir).write(new SubscriberResult("subscriber_1",
      new RunStats(0, Duration.ZERO, RunOutcome.START_TIMEOUT), metadata));

    assertEquals(AggregateCommand.EXIT_FAILURE, command.run(tempDir.resolve("b3").toString()));
    assertTrue(err().contains("received any messages"), err());
  }

  @Test
  void missingArguments_usage() {
    assertEquals(AggregateCommand.EXIT_FAILURE, command.run());
    assertTrue(err().contains("Usage"));
  }

  @Test
  void missingDirectory_fails() {
    assertEquals(AggregateCommand.EXIT_FAILURE, command.run(tempDir.resolve("nope").toString()));
    assertTrue(err().contains("not found"));
  }

  @Test
  void emptyDirectory_fails() throws IOException {
    Path empty = Files.createDirectories(tempDir.resolve("empty"));

    assertEquals(AggregateCommand.EXIT_FAILURE, command.run(empty.toString()));
    assertTrue(err().contains("No results found"));
  }
}
