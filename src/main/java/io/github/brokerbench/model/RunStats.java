package io.github.brokerbench.model;

import java.time.Duration;
import java.util.Objects;

/**
 * Statistics of one subscriber's measurement window.
 *
 * @param messagesReceived payload messages observed strictly inside the window
 * @param duration window length (end - start)
 * @param outcome whether the window closed on END_BENCHMARK or a timeout
 */
public record RunStats(
  long messagesReceived,
  Duration duration,
  RunOutcome outcome
) {

  public RunStats {
    Objects.requireNonNull(duration, "duration cannot be null");
    Objects.requireNonNull(outcome, "outcome cannot be null");
    if (messagesReceived < 0) {
      throw new IllegalArgumentException("messagesReceived cannot be negative: " + messagesReceived);
    }
    if (duration.isNegative()) {
      throw new IllegalArgumentException("duration cannot be negative: " + duration);
    }
  }

  public static RunStats completed(long messagesReceived, Duration duration) {
    return new RunStats(messagesReceived, duration, RunOutcome.COMPLETED);
  }

  public double durationSeconds() {
    return duration.toNanos() / 1_000_000_000.0;
  }

  /**
   * @return messages per second, 0 when the duration is 0
   */
  public double throughput() {
    return throughput(messagesReceived, duration);
  }

  /**
   * Messages per second over the given duration; a zero duration yields 0 rather than a fault.
   */
  public static double throughput(long messages, Duration duration) {
    double seconds = duration.toNanos() / 1_000_000_000.0;
    return seconds > 0 ? messages / seconds : 0.0;
  }
}
