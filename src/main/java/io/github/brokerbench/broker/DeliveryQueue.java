package io.github.brokerbench.broker;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.LongSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Adapts push-style backend deliveries into pull-style {@code processMessages} calls.
 *
 * <p>Backend threads {@link #offer} messages; the subscriber's polling thread {@link #drain}s
 * them and invokes the registered callbacks, so subscriber state is only touched by one thread.
 */
public class DeliveryQueue {

  private static final Logger log = LoggerFactory.getLogger(DeliveryQueue.class);

  private static final int DRAIN_BATCH = 1024;

  private final BlockingQueue<Delivery> queue;
  private final Map<String, Consumer<String>> callbacks = new ConcurrentHashMap<>();
  private final LongSupplier nanoTime;

  public DeliveryQueue(int capacity) {
    this(capacity, System::nanoTime);
  }

  DeliveryQueue(int capacity, LongSupplier nanoTime) {
    if (capacity < 1) {
      throw new IllegalArgumentException("capacity must be >= 1, got " + capacity);
    }
    this.queue = new LinkedBlockingQueue<>(capacity);
    this.nanoTime = nanoTime;
  }

  /**
   * Registers (or replaces) the callback for a channel.
   */
  public void register(String channel, Consumer<String> callback) {
    callbacks.put(channel, callback);
  }

  public void unregister(String channel) {
    callbacks.remove(channel);
  }

  public boolean isRegistered(String channel) {
    return callbacks.containsKey(channel);
  }

  /**
   * Enqueues a delivery, waiting up to the timeout for space.
   *
   * @return false if the queue stayed full or the calling thread was interrupted
   */
  public boolean offer(String channel, String message, Duration timeout) {
    try {
      return queue.offer(new Delivery(channel, message), timeout.toNanos(), TimeUnit.NANOSECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  /**
   * Waits for a first delivery, then hands every immediately available delivery to its channel
   * callback on the calling thread. The whole call, waiting included, stays within the budget.
   *
   * @param budget maximum time spent in this call
   * @return number of deliveries dispatched
   */
  public int drain(Duration budget) {
    long deadline = nanoTime.getAsLong() + budget.toNanos();
    Delivery first;
    try {
      first = queue.poll(budget.toNanos(), TimeUnit.NANOSECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return 0;
    }
    if (first == null) {
      return 0;
    }

    dispatch(first);
    int dispatched = 1;

    List<Delivery> batch = new ArrayList<>(DRAIN_BATCH);
    while (nanoTime.getAsLong() < deadline && queue.drainTo(batch, DRAIN_BATCH) > 0) {
      for (Delivery delivery : batch) {
        dispatch(delivery);
      }
      dispatched += batch.size();
      batch.clear();
    }

    log.trace("Dispatched {} deliveries", dispatched);
    return dispatched;
  }

  public int size() {
    return queue.size();
  }

  public void clear() {
    queue.clear();
    callbacks.clear();
  }

  private void dispatch(Delivery delivery) {
    Consumer<String> callback = callbacks.get(delivery.channel());
    if (callback != null) {
      callback.accept(delivery.message());
    }
  }

  private record Delivery(String channel, String message) {}
}
