package io.github.brokerbench.results;

import io.github.brokerbench.model.AggregateStats;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code aggregate <results_directory> [<broker_type>]}: combines the subscriber records of one
 * batch and prints the tables.
 */
public class AggregateCommand {

  private static final Logger log = LoggerFactory.getLogger(AggregateCommand.class);

  public static final int EXIT_OK = 0;
  public static final int EXIT_FAILURE = 1;

  private final ResultsDirectoryReader reader;
  private final PrintStream out;
  private final PrintStream err;

  public AggregateCommand(PrintStream out, PrintStream err) {
    this(new ResultsDirectoryReader(), out, err);
  }

  AggregateCommand(ResultsDirectoryReader reader, PrintStream out, PrintStream err) {
    this.reader = reader;
    this.out = out;
    this.err = err;
  }

  /**
   * @param args results directory, optionally followed by a broker type to filter on
   * @return process exit code
   */
  public int run(String... args) {
    if (args.length < 1) {
      err.println("Usage: aggregate <results_directory> [<broker_type>]");
      err.println("Example: aggregate /data/20240101T120000 redis");
      return EXIT_FAILURE;
    }
    Path dir = Path.of(args[0]);
    String brokerType = args.length > 1 ? args[1] : null;

    if (!Files.isDirectory(dir)) {
      err.println("Results directory not found: " + dir);
      return EXIT_FAILURE;
    }

    ResultsDirectory results;
    try {
      results = reader.read(dir).forBroker(brokerType);
    } catch (IOException e) {
      log.error("Failed to read results from {}: {}", dir, e.getMessage());
      err.println("Failed to read results from " + dir + ": " + e.getMessage());
      return EXIT_FAILURE;
    }

    AggregateStats stats;
    try {
      stats = ResultsAggregator.aggregate(results.subscriberStats());
    } catch (EmptyAggregateInputException e) {
      if (results.subscribers().isEmpty()) {
        err.println("No results found in " + dir);
      } else {
        err.println(e.getMessage() + " in " + dir);
      }
      return EXIT_FAILURE;
    }

    String title = brokerType != null ? brokerType : results.subscribers().get(0).metadata().brokerType();
    long published = results.publishers().isEmpty() ? -1 : results.totalPublished();
    new ResultsPrinter(out).printAggregate(title, stats, results.subscribers(), published);
    return EXIT_OK;
  }
}
