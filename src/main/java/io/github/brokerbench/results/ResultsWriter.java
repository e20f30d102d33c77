package io.github.brokerbench.results;

import io.github.brokerbench.model.PublisherResult;
import io.github.brokerbench.model.SubscriberResult;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Persists benchmark results so that a later aggregation step can read them.
 */
public interface ResultsWriter {

  /**
   * @return path of the written record, empty if writing failed
   */
  Optional<Path> write(SubscriberResult result);

  /**
   * @return path of the written record, empty if writing failed
   */
  Optional<Path> write(PublisherResult result);
}
