package io.github.brokerbench.broker;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for DeliveryQueue.
 */
public class DeliveryQueueTest {

  private static final Duration NO_WAIT = Duration.ZERO;

  @Test
  void drain_dispatchesInOrderToChannelCallback() {
    DeliveryQueue queue = new DeliveryQueue(10);
    List<String> received = new ArrayList<>();
    queue.register("a", received::add);

    queue.offer("a", "1", NO_WAIT);
    queue.offer("a", "2", NO_WAIT);
    queue.offer("b", "ignored", NO_WAIT);

    assertEquals(3, queue.drain(Duration.ofMillis(10)));
    assertEquals(List.of("1", "2"), received);
    assertEquals(0, queue.size());
  }

  @Test
  void drain_emptyQueue_returnsAfterBudget() {
    DeliveryQueue queue = new DeliveryQueue(10);

    long start = System.nanoTime();
    assertEquals(0, queue.drain(Duration.ofMillis(50)));

    assertTrue(System.nanoTime() - start >= Duration.ofMillis(50).toNanos());
  }

  @Test
  void drain_budgetStartsOnEntry() {
    Duration budget = Duration.ofMillis(100);
    AtomicLong clock = new AtomicLong();
    DeliveryQueue queue = new DeliveryQueue(10, clock::get);
    List<String> received = new ArrayList<>();
    // Handling the first delivery uses up the whole budget
    queue.register("a", m -> {
      received.add(m);
      clock.addAndGet(budget.toNanos());
    });
    queue.offer("a", "1", NO_WAIT);
    queue.offer("a", "2", NO_WAIT);
    queue.offer("a", "3", NO_WAIT);

    assertEquals(1, queue.drain(budget));
    assertEquals(List.of("1"), received);
    assertEquals(2, queue.size());
  }

  @Test
  void offer_fullQueue_fails() {
    DeliveryQueue queue = new DeliveryQueue(1);

    assertTrue(queue.offer("a", "1", NO_WAIT));
    assertFalse(queue.offer("a", "2", Duration.ofMillis(10)));
  }

  @Test
  void clear_dropsDeliveriesAndCallbacks() {
    DeliveryQueue queue = new DeliveryQueue(10);
    queue.register("a", m -> { });
    queue.offer("a", "1", NO_WAIT);

    queue.clear();

    assertEquals(0, queue.size());
    assertFalse(queue.isRegistered("a"));
  }

  @Test
  void capacity_mustBePositive() {
    assertThrows(IllegalArgumentException.class, () -> new DeliveryQueue(0));
  }
}
