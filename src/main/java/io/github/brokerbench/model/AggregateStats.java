package io.github.brokerbench.model;

/**
 * Read-only view over the RunStats of several subscriber instances of one run.
 *
 * <p>{@code combinedThroughput} is total messages over the average duration, which is not the
 * same as {@code avgThroughput} (the mean of per-instance rates).
 *
 * @param instances number of subscriber instances
 * @param totalMessages sum of received messages
 * @param avgMessages mean received messages per instance
 * @param avgDurationSeconds mean window length
 * @param avgThroughput mean of per-instance throughput
 * @param combinedThroughput totalMessages / avgDurationSeconds
 * @param throughputStdDev population standard deviation of per-instance throughput
 */
public record AggregateStats(
  int instances,
  long totalMessages,
  double avgMessages,
  double avgDurationSeconds,
  double avgThroughput,
  double combinedThroughput,
  double throughputStdDev
) {}
