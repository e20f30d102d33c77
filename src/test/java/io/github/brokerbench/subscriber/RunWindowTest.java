package io.github.brokerbench.subscriber;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.brokerbench.model.RunOutcome;
import io.github.brokerbench.model.RunStats;
import java.time.Duration;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for RunWindow.
 */
public class RunWindowTest {

  @Test
  void payloadBeforeStart_notCounted() {
    RunWindow window = new RunWindow();

    window.recordPayload();
    window.recordPayload();

    assertEquals(0, window.received());
    assertEquals(SubscriberState.AWAITING_START, window.state());
  }

  @Test
  void countsOnlyBetweenStartAndEnd() {
    RunWindow window = new RunWindow();

    window.recordPayload();
    assertTrue(window.markStart(1_000));
    window.recordPayload();
    window.recordPayload();
    window.recordPayload();
    assertTrue(window.markEnd(2_000_001_000L));
    window.recordPayload();

    RunStats stats = window.toStats();
    assertEquals(3, stats.messagesReceived());
    assertEquals(Duration.ofSeconds(2), stats.duration());
    assertEquals(RunOutcome.COMPLETED, stats.outcome());
  }

  @Test
  void latches_areIdempotent() {
    RunWindow window = new RunWindow();

    assertTrue(window.markStart(100));
    assertFalse(window.markStart(500));
    assertTrue(window.markEnd(1_000));
    assertFalse(window.markEnd(5_000));
    assertFalse(window.markStart(9_000));

    assertEquals(Duration.ofNanos(900), window.toStats().duration());
  }

  @Test
  void endBeforeStart_ignored() {
    RunWindow window = new RunWindow();

    assertFalse(window.markEnd(100));

    assertEquals(SubscriberState.AWAITING_START, window.state());
    assertTrue(window.markStart(200));
    assertEquals(SubscriberState.MEASURING, window.state());
  }

  @Test
  void forceClose_withoutStart_zeroLength() {
    RunWindow window = new RunWindow();

    assertTrue(window.forceClose(5_000, RunOutcome.START_TIMEOUT));

    RunStats stats = window.toStats();
    assertEquals(0, stats.messagesReceived());
    assertEquals(Duration.ZERO, stats.duration());
    assertEquals(RunOutcome.START_TIMEOUT, stats.outcome());
    assertEquals(0.0, stats.throughput());
  }

  @Test
  void forceClose_afterStart_endsNow() {
    RunWindow window = new RunWindow();
    window.markStart(1_000);
    window.recordPayload();

    assertTrue(window.forceClose(3_000, RunOutcome.RUN_TIMEOUT));
    assertFalse(window.forceClose(9_000, RunOutcome.RUN_TIMEOUT));
    assertFalse(window.markEnd(10_000));

    RunStats stats = window.toStats();
    assertEquals(1, stats.messagesReceived());
    assertEquals(Duration.ofNanos(2_000), stats.duration());
    assertEquals(RunOutcome.RUN_TIMEOUT, stats.outcome());
  }

  @Test
  void endNeverBeforeStart_onClockSkew() {
    RunWindow window = new RunWindow();
    window.markStart(5_000);

    window.markEnd(4_000);

    assertEquals(Duration.ZERO, window.toStats().duration());
  }

  @Test
  void toStats_whileOpen_throws() {
    RunWindow window = new RunWindow();
    window.markStart(1);

    assertThrows(IllegalStateException.class, window::toStats);
  }
}
