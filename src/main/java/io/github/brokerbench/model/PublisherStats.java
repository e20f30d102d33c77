package io.github.brokerbench.model;

import java.time.Duration;
import java.util.Objects;

/**
 * Totals of one publisher driver run across all of its workers.
 *
 * @param workers number of workers launched
 * @param workersFailed workers that could not connect and published nothing
 * @param messagesPublished successful publish calls (payload only)
 * @param messagesFailed publish calls that returned false
 * @param duration wall clock from before worker launch to after all workers joined
 */
public record PublisherStats(
  int workers,
  int workersFailed,
  long messagesPublished,
  long messagesFailed,
  Duration duration
) {

  public PublisherStats {
    Objects.requireNonNull(duration, "duration cannot be null");
  }

  public double durationSeconds() {
    return duration.toNanos() / 1_000_000_000.0;
  }

  public double throughput() {
    return RunStats.throughput(messagesPublished, duration);
  }

  /**
   * @return average throughput per launched worker
   */
  public double throughputPerWorker() {
    return workers > 0 ? throughput() / workers : 0.0;
  }
}
