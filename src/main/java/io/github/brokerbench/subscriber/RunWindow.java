package io.github.brokerbench.subscriber;

import io.github.brokerbench.model.RunOutcome;
import io.github.brokerbench.model.RunStats;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Subscriber-observed measurement window with its payload counter.
 *
 * <p>Start and end are latched at most once each; later sentinels of the same kind are no-ops.
 * Once closed, {@code start <= end} holds and the counter no longer moves. Payload is counted
 * only strictly between start and end.
 */
public final class RunWindow {

  private final AtomicLong received = new AtomicLong();

  private volatile boolean started;
  private volatile boolean closed;
  private long startNanos;
  private long endNanos;
  private RunOutcome outcome;

  /**
   * Latches the start instant.
   *
   * @return true if this call opened the window, false if it was already open or closed
   */
  public synchronized boolean markStart(long nowNanos) {
    if (started || closed) {
      return false;
    }
    startNanos = nowNanos;
    started = true;
    return true;
  }

  /**
   * Latches the end instant. An end seen before any start is ignored.
   *
   * @return true if this call closed the window
   */
  public synchronized boolean markEnd(long nowNanos) {
    if (!started || closed) {
      return false;
    }
    close(nowNanos, RunOutcome.COMPLETED);
    return true;
  }

  /**
   * Closes the window on a timeout. Without a start the window becomes zero-length at
   * {@code nowNanos}; with a start the end is {@code nowNanos}.
   *
   * @return true if this call closed the window
   */
  public synchronized boolean forceClose(long nowNanos, RunOutcome reason) {
    if (closed) {
      return false;
    }
    if (!started) {
      startNanos = nowNanos;
      started = true;
    }
    close(nowNanos, reason);
    return true;
  }

  /**
   * Counts one payload message if the window is open.
   */
  public void recordPayload() {
    if (started && !closed) {
      received.incrementAndGet();
    }
  }

  public boolean isStarted() {
    return started;
  }

  public boolean isClosed() {
    return closed;
  }

  public synchronized long startNanos() {
    return startNanos;
  }

  public long received() {
    return received.get();
  }

  public SubscriberState state() {
    if (closed) {
      return SubscriberState.FINALIZED;
    }
    return started ? SubscriberState.MEASURING : SubscriberState.AWAITING_START;
  }

  /**
   * @return immutable statistics of the closed window
   * @throws IllegalStateException if the window is still open
   */
  public synchronized RunStats toStats() {
    if (!closed) {
      throw new IllegalStateException("Window is not closed yet");
    }
    return new RunStats(received.get(), Duration.ofNanos(endNanos - startNanos), outcome);
  }

  private void close(long nowNanos, RunOutcome reason) {
    endNanos = Math.max(nowNanos, startNanos);
    outcome = reason;
    closed = true;
  }
}
