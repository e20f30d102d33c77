package io.github.brokerbench.metrics;

import io.github.brokerbench.model.PublisherStats;
import io.github.brokerbench.model.RunStats;
import io.vertx.core.Future;

/**
 * Interface for reporting benchmark results to external metrics systems.
 */
public interface BenchmarkMetricsReporter {

  /**
   * Reports the payload count of a subscriber that is still measuring.
   *
   * @param instanceId subscriber instance
   * @param messagesReceived payload counted so far
   */
  void reportSubscriberProgress(String instanceId, long messagesReceived);

  /**
   * Reports the final statistics of a subscriber.
   */
  void reportSubscriber(String instanceId, RunStats stats);

  /**
   * Reports the totals of a publisher run.
   */
  void reportPublisher(String instanceId, PublisherStats stats);

  /**
   * Starts the reporter.
   *
   * @return Future that completes when started
   */
  Future<Void> start();

  /**
   * Closes the reporter and releases resources. Push registries export a final time here.
   *
   * @return Future that completes when closed
   */
  Future<Void> close();

  /**
   * @return a reporter that records nothing, used when metrics are disabled
   */
  static BenchmarkMetricsReporter noop() {
    return new BenchmarkMetricsReporter() {
      @Override
      public void reportSubscriberProgress(String instanceId, long messagesReceived) {
      }

      @Override
      public void reportSubscriber(String instanceId, RunStats stats) {
      }

      @Override
      public void reportPublisher(String instanceId, PublisherStats stats) {
      }

      @Override
      public Future<Void> start() {
        return Future.succeededFuture();
      }

      @Override
      public Future<Void> close() {
        return Future.succeededFuture();
      }
    };
  }
}
