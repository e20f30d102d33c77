package io.github.brokerbench.publisher;

import java.time.Duration;
import java.util.Optional;

/**
 * Instants at which the leader emitted START_BENCHMARK and END_BENCHMARK. Written twice in
 * total, by the leader, and read after all workers joined; the lock is for visibility.
 */
final class SentinelTimes {

  private long startNanos;
  private long endNanos;
  private boolean startSet;
  private boolean endSet;

  synchronized void markStart(long nanos) {
    startNanos = nanos;
    startSet = true;
  }

  synchronized void markEnd(long nanos) {
    endNanos = nanos;
    endSet = true;
  }

  /**
   * @return time between the two sentinels, empty if either was never emitted
   */
  synchronized Optional<Duration> span() {
    if (!startSet || !endSet) {
      return Optional.empty();
    }
    return Optional.of(Duration.ofNanos(Math.max(0, endNanos - startNanos)));
  }
}
