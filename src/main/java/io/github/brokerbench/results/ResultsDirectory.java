package io.github.brokerbench.results;

import io.github.brokerbench.model.PublisherResult;
import io.github.brokerbench.model.RunStats;
import io.github.brokerbench.model.SubscriberResult;
import java.util.List;

/**
 * Records loaded from one results directory.
 *
 * @param subscribers subscriber records, in file name order
 * @param publishers publisher records, in file name order
 * @param skippedFiles JSON files that could not be parsed
 */
public record ResultsDirectory(
  List<SubscriberResult> subscribers,
  List<PublisherResult> publishers,
  int skippedFiles
) {

  public ResultsDirectory {
    subscribers = List.copyOf(subscribers);
    publishers = List.copyOf(publishers);
  }

  /**
   * Keeps only the records of the given broker type; null or blank keeps everything.
   */
  public ResultsDirectory forBroker(String brokerType) {
    if (brokerType == null || brokerType.isBlank()) {
      return this;
    }
    return new ResultsDirectory(
      subscribers.stream().filter(r -> brokerType.equalsIgnoreCase(r.metadata().brokerType())).toList(),
      publishers.stream().filter(r -> brokerType.equalsIgnoreCase(r.metadata().brokerType())).toList(),
      skippedFiles
    );
  }

  public List<RunStats> subscriberStats() {
    return subscribers.stream().map(SubscriberResult::stats).toList();
  }

  public long totalPublished() {
    return publishers.stream().mapToLong(p -> p.stats().messagesPublished()).sum();
  }
}
