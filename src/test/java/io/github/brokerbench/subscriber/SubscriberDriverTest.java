package io.github.brokerbench.subscriber;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.brokerbench.broker.ScriptedBrokerClient;
import io.github.brokerbench.config.BenchmarkConfig;
import io.github.brokerbench.model.RunOutcome;
import io.github.brokerbench.model.RunStats;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for SubscriberDriver, driven by a scripted client and a fake clock that advances
 * one second per poll.
 */
public class SubscriberDriverTest {

  private static final long SECOND = 1_000_000_000L;

  private final BenchmarkConfig config = new BenchmarkConfig(
    1, 2, "bench", "memory", 0, 15_000, 30_000, 100, 1_000);

  private AtomicLong clock;

  @BeforeEach
  void setUp() {
    clock = new AtomicLong();
  }

  private SubscriberDriver driver(ScriptedBrokerClient client) {
    client.onPoll(() -> clock.addAndGet(SECOND));
    return new SubscriberDriver(client, config, clock::get);
  }

  @Test
  void completedRun_countsPayloadInsideWindow() throws InterruptedException {
    ScriptedBrokerClient client = new ScriptedBrokerClient()
      .deliver("msg_0_early", "START_BENCHMARK", "msg_0_0", "msg_0_1")
      .deliver("msg_0_2", "END_BENCHMARK", "msg_0_late");
    SubscriberDriver driver = driver(client);

    assertTrue(driver.subscribe());
    RunStats stats = driver.runUntilFinalized();

    assertEquals(3, stats.messagesReceived());
    assertEquals(Duration.ofSeconds(1), stats.duration());
    assertEquals(3.0, stats.throughput(), 1e-9);
    assertEquals(RunOutcome.COMPLETED, stats.outcome());
    assertEquals(SubscriberState.FINALIZED, driver.state());
  }

  @Test
  void duplicateSentinels_ignored() throws InterruptedException {
    ScriptedBrokerClient client = new ScriptedBrokerClient()
      .deliver("START_BENCHMARK", "msg_0_0")
      .deliver("START_BENCHMARK", "msg_0_1")
      .deliver("END_BENCHMARK", "END_BENCHMARK");
    SubscriberDriver driver = driver(client);
    driver.subscribe();

    RunStats stats = driver.runUntilFinalized();

    assertEquals(2, stats.messagesReceived());
    assertEquals(Duration.ofSeconds(2), stats.duration());
  }

  @Test
  void endBeforeStart_ignored() throws InterruptedException {
    ScriptedBrokerClient client = new ScriptedBrokerClient()
      .deliver("END_BENCHMARK", "msg_0_0")
      .deliver("START_BENCHMARK", "msg_0_1")
      .deliver("END_BENCHMARK");
    SubscriberDriver driver = driver(client);
    driver.subscribe();

    RunStats stats = driver.runUntilFinalized();

    assertEquals(1, stats.messagesReceived());
    assertEquals(RunOutcome.COMPLETED, stats.outcome());
  }

  @Test
  void noStart_finalizesAfterGracePeriodWithZeroMessages() throws InterruptedException {
    ScriptedBrokerClient client = new ScriptedBrokerClient()
      .deliver("msg_0_0", "msg_0_1");
    SubscriberDriver driver = driver(client);
    driver.subscribe();

    RunStats stats = driver.runUntilFinalized();

    assertEquals(0, stats.messagesReceived());
    assertEquals(Duration.ZERO, stats.duration());
    assertEquals(0.0, stats.throughput());
    assertEquals(RunOutcome.START_TIMEOUT, stats.outcome());
    assertEquals(15, client.polls());
  }

  @Test
  void noEnd_finalizesAfterDurationPlusMargin() throws InterruptedException {
    ScriptedBrokerClient client = new ScriptedBrokerClient()
      .deliver("START_BENCHMARK", "msg_0_0", "msg_0_1");
    SubscriberDriver driver = driver(client);
    driver.subscribe();

    RunStats stats = driver.runUntilFinalized();

    assertEquals(2, stats.messagesReceived());
    assertEquals(RunOutcome.RUN_TIMEOUT, stats.outcome());
    // 2s publish duration + 30s margin
    assertEquals(Duration.ofSeconds(32), stats.duration());
  }

  @Test
  void reportOnce_firesExactlyOnce() {
    ScriptedBrokerClient client = new ScriptedBrokerClient()
      .deliver("START_BENCHMARK", "msg_0_0")
      .deliver("END_BENCHMARK");
    SubscriberDriver driver = driver(client);
    driver.subscribe();
    List<RunStats> reports = new ArrayList<>();

    driver.pollOnce();
    assertFalse(driver.reportOnce(reports::add), "nothing to report while measuring");

    driver.pollOnce();
    assertTrue(driver.reportOnce(reports::add));
    assertFalse(driver.reportOnce(reports::add));
    driver.pollOnce();
    assertFalse(driver.reportOnce(reports::add));

    assertEquals(1, reports.size());
    assertTrue(driver.isReported());
  }

  @Test
  void afterFinalized_pollingContinuesWithoutCounting() {
    ScriptedBrokerClient client = new ScriptedBrokerClient()
      .deliver("START_BENCHMARK", "msg_0_0", "END_BENCHMARK")
      .deliver("msg_0_1", "msg_0_2");
    SubscriberDriver driver = driver(client);
    driver.subscribe();

    assertEquals(SubscriberState.FINALIZED, driver.pollOnce());
    assertEquals(SubscriberState.FINALIZED, driver.pollOnce());

    assertEquals(2, client.polls());
    assertEquals(1, driver.liveMessages());
    assertEquals(1, driver.result().orElseThrow().messagesReceived());
  }

  @Test
  void liveMessages_visibleWhileMeasuring() {
    ScriptedBrokerClient client = new ScriptedBrokerClient()
      .deliver("START_BENCHMARK", "msg_0_0", "msg_0_1");
    SubscriberDriver driver = driver(client);
    driver.subscribe();

    assertEquals(SubscriberState.MEASURING, driver.pollOnce());

    assertEquals(2, driver.liveMessages());
    assertTrue(driver.result().isEmpty());
  }

  @Test
  void subscribe_connectFailure() {
    SubscriberDriver driver = driver(new ScriptedBrokerClient(false, 0));

    assertFalse(driver.subscribe());
    assertFalse(driver.isSubscribed());
    assertThrows(IllegalStateException.class, driver::pollOnce);
  }

  @Test
  void close_disconnectsClient() {
    ScriptedBrokerClient client = new ScriptedBrokerClient();
    SubscriberDriver driver = driver(client);
    driver.subscribe();

    driver.close();

    assertTrue(client.wasDisconnected());
    assertFalse(driver.isSubscribed());
  }
}
