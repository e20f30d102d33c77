package io.github.brokerbench.publisher;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.brokerbench.broker.BrokerClient;
import io.github.brokerbench.broker.ScriptedBrokerClient;
import io.github.brokerbench.config.BenchmarkConfig;
import io.github.brokerbench.model.PublisherStats;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.IntFunction;
import java.util.function.Supplier;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for PublisherDriver using scripted clients.
 */
public class PublisherDriverTest {

  private static BenchmarkConfig config(int publishers, int durationSeconds) {
    return new BenchmarkConfig(publishers, durationSeconds, "bench", "memory", 0, 15_000, 30_000, 100, 5_000);
  }

  /**
   * Hands out clients in worker order, keeping them for inspection.
   */
  private static final class Clients implements Supplier<BrokerClient> {
    private final IntFunction<ScriptedBrokerClient> factory;
    private final List<ScriptedBrokerClient> created = new CopyOnWriteArrayList<>();

    Clients(IntFunction<ScriptedBrokerClient> factory) {
      this.factory = factory;
    }

    @Override
    public BrokerClient get() {
      ScriptedBrokerClient client = factory.apply(created.size());
      created.add(client);
      return client;
    }

    ScriptedBrokerClient get(int workerId) {
      return created.get(workerId);
    }

    long payloadPublished() {
      return created.stream().mapToLong(ScriptedBrokerClient::payloadPublished).sum();
    }
  }

  @Test
  void zeroDuration_terminatesWithSentinelPairOnly() throws InterruptedException {
    Clients clients = new Clients(id -> new ScriptedBrokerClient());
    PublisherDriver driver = new PublisherDriver(clients, config(3, 0));

    PublisherStats stats = driver.run();

    assertEquals(3, stats.workers());
    assertEquals(0, stats.messagesPublished());
    assertEquals(0, stats.workersFailed());
    assertEquals(List.of("START_BENCHMARK", "END_BENCHMARK"), clients.get(0).sentinelsPublished());
  }

  @Test
  void onlyLeaderPublishesSentinels() throws InterruptedException {
    Clients clients = new Clients(id -> new ScriptedBrokerClient());
    PublisherDriver driver = new PublisherDriver(clients, config(3, 1));

    PublisherStats stats = driver.run();

    assertEquals(List.of("START_BENCHMARK", "END_BENCHMARK"), clients.get(0).sentinelsPublished());
    assertTrue(clients.get(1).sentinelsPublished().isEmpty());
    assertTrue(clients.get(2).sentinelsPublished().isEmpty());
    assertEquals(clients.payloadPublished(), stats.messagesPublished());
    assertTrue(stats.messagesPublished() > 0);
    assertTrue(stats.duration().compareTo(Duration.ofSeconds(1)) >= 0);
    assertTrue(driver.sentinelSpan().isPresent());
  }

  @Test
  void everyWorkerFlushesAndDisconnects() throws InterruptedException {
    Clients clients = new Clients(id -> new ScriptedBrokerClient());

    new PublisherDriver(clients, config(2, 0)).run();

    for (int i = 0; i < 2; i++) {
      assertTrue(clients.get(i).flushes() > 0, "worker " + i + " flushed");
      assertTrue(clients.get(i).wasDisconnected(), "worker " + i + " disconnected");
    }
  }

  @Test
  void followerConnectFailure_runContinues() throws InterruptedException {
    Clients clients = new Clients(id -> new ScriptedBrokerClient(id != 1, 0));
    PublisherDriver driver = new PublisherDriver(clients, config(3, 1));

    PublisherStats stats = driver.run();

    assertEquals(1, stats.workersFailed());
    assertEquals(0, clients.get(1).payloadPublished());
    assertTrue(clients.get(2).payloadPublished() > 0);
    assertEquals(List.of("START_BENCHMARK", "END_BENCHMARK"), clients.get(0).sentinelsPublished());
    assertEquals(false, driver.workerResults().get(1).connected());
  }

  @Test
  void leaderConnectFailure_followersStillPublish() throws InterruptedException {
    Clients clients = new Clients(id -> new ScriptedBrokerClient(id != 0, 0));
    PublisherDriver driver = new PublisherDriver(clients, config(2, 1));

    PublisherStats stats = driver.run();

    assertEquals(1, stats.workersFailed());
    assertTrue(clients.get(0).sentinelsPublished().isEmpty());
    assertTrue(clients.get(1).payloadPublished() > 0);
    assertTrue(driver.sentinelSpan().isEmpty());
  }

  @Test
  void failedPublishes_countedNotRetried() throws InterruptedException {
    Clients clients = new Clients(id -> new ScriptedBrokerClient(true, 2));
    PublisherDriver driver = new PublisherDriver(clients, config(2, 1));

    PublisherStats stats = driver.run();

    assertTrue(stats.messagesFailed() > 0);
    assertEquals(clients.payloadPublished(), stats.messagesPublished());
    WorkerResult follower = driver.workerResults().get(1);
    // Every second call fails
    assertTrue(Math.abs(follower.published() - follower.failed()) <= 1);
  }

  @Test
  void aggregate_sumsWorkers() {
    List<WorkerResult> results = List.of(
      new WorkerResult(0, true, 100, 2),
      new WorkerResult(1, true, 300, 0),
      WorkerResult.connectFailed(2)
    );

    PublisherStats stats = PublisherDriver.aggregate(results, Duration.ofSeconds(2));

    assertEquals(3, stats.workers());
    assertEquals(1, stats.workersFailed());
    assertEquals(400, stats.messagesPublished());
    assertEquals(2, stats.messagesFailed());
    assertEquals(200.0, stats.throughput(), 1e-9);
  }
}
