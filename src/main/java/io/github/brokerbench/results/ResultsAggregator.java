package io.github.brokerbench.results;

import io.github.brokerbench.model.AggregateStats;
import io.github.brokerbench.model.RunStats;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Combines the RunStats of the subscriber instances of one run.
 */
public final class ResultsAggregator {

  private ResultsAggregator() {}

  /**
   * Aggregates per-instance statistics. Instances that received no messages (typically a
   * start timeout with a zero-length window) are left out of every average.
   *
   * @param stats one entry per subscriber instance
   * @return aggregate statistics over the instances that received messages
   * @throws EmptyAggregateInputException if {@code stats} is empty or no instance received messages
   */
  public static AggregateStats aggregate(Collection<RunStats> stats) {
    if (stats == null || stats.isEmpty()) {
      throw new EmptyAggregateInputException("No subscriber results to aggregate");
    }
    List<RunStats> measured = stats.stream().filter(ResultsAggregator::isMeasured).toList();
    if (measured.isEmpty()) {
      throw new EmptyAggregateInputException(
        "None of the " + stats.size() + " subscriber results received any messages");
    }

    long totalMessages = 0;
    double totalDurationSeconds = 0.0;
    List<Double> throughputs = new ArrayList<>(measured.size());
    for (RunStats s : measured) {
      totalMessages += s.messagesReceived();
      totalDurationSeconds += s.durationSeconds();
      throughputs.add(s.throughput());
    }

    int n = measured.size();
    double avgDurationSeconds = totalDurationSeconds / n;
    StatisticalUtils.Stats throughputStats = StatisticalUtils.calculateStats(throughputs);
    double combined = avgDurationSeconds > 0 ? totalMessages / avgDurationSeconds : 0.0;

    return new AggregateStats(
      n,
      totalMessages,
      (double) totalMessages / n,
      avgDurationSeconds,
      throughputStats.mean(),
      combined,
      throughputStats.stdDev()
    );
  }

  /**
   * Whether an instance contributes to the aggregate.
   */
  public static boolean isMeasured(RunStats stats) {
    return stats.messagesReceived() > 0;
  }
}
