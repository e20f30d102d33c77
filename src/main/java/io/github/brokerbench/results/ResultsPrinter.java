package io.github.brokerbench.results;

import io.github.brokerbench.model.AggregateStats;
import io.github.brokerbench.model.PublisherStats;
import io.github.brokerbench.model.RunStats;
import io.github.brokerbench.model.SubscriberResult;
import java.io.PrintStream;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Human-readable result tables.
 */
public class ResultsPrinter {

  private static final String RULE = "-----------------------------------------------";

  private final PrintStream out;

  public ResultsPrinter(PrintStream out) {
    this.out = Objects.requireNonNull(out, "out cannot be null");
  }

  public void printPublisher(String brokerName, PublisherStats stats) {
    header(brokerName + " Publisher Results");
    line("Publishers", String.valueOf(stats.workers()));
    line("Failed Publishers", String.valueOf(stats.workersFailed()));
    line("Messages Published", String.valueOf(stats.messagesPublished()));
    line("Failed Publishes", String.valueOf(stats.messagesFailed()));
    line("Duration", format("%.3f seconds", stats.durationSeconds()));
    line("Throughput", format("%.2f msg/sec", stats.throughput()));
    line("Per Publisher", format("%.2f msg/sec", stats.throughputPerWorker()));
    out.println();
  }

  public void printSubscriber(String brokerName, String subscriberId, RunStats stats) {
    header(brokerName + " Subscriber Results");
    line("Subscriber", subscriberId);
    line("Outcome", stats.outcome().getValue());
    line("Messages Received", String.valueOf(stats.messagesReceived()));
    line("Duration", format("%.3f seconds", stats.durationSeconds()));
    line("Throughput", format("%.2f msg/sec", stats.throughput()));
    out.println();
  }

  /**
   * Prints the aggregate table followed by one line per instance.
   *
   * @param totalPublished messages published according to publisher records, or a negative
   *     value when no publisher record is available
   */
  public void printAggregate(String brokerName, AggregateStats stats, List<SubscriberResult> instances,
                             long totalPublished) {
    header(brokerName + " Benchmark Results");
    out.println("Aggregated Results:");
    out.println(RULE);
    line("Subscriber Instances", String.valueOf(stats.instances()));
    int excluded = instances.size() - stats.instances();
    if (excluded > 0) {
      line("Excluded (no messages)", String.valueOf(excluded));
    }
    line("Total Messages", String.valueOf(stats.totalMessages()));
    line("Avg Messages/Instance", format("%.0f", stats.avgMessages()));
    line("Avg Duration", format("%.3f seconds", stats.avgDurationSeconds()));
    line("Avg Throughput", format("%.2f msg/sec", stats.avgThroughput()));
    line("Throughput Std Dev", format("%.2f msg/sec", stats.throughputStdDev()));
    line("Combined Throughput", format("%.2f msg/sec", stats.combinedThroughput()));
    if (totalPublished >= 0) {
      line("Messages Published", String.valueOf(totalPublished));
      line("Delivery Rate", format("%.2f %%", deliveryRate(stats, totalPublished)));
    }

    out.println();
    out.println("Per-Instance Details:");
    out.println(RULE);
    for (SubscriberResult result : instances) {
      RunStats s = result.stats();
      out.println(format("  %-25s: %-12d msgs, %.2f msg/sec (%s)%s",
        result.subscriberId(), s.messagesReceived(), s.throughput(), s.outcome().getValue(),
        ResultsAggregator.isMeasured(s) ? "" : " [excluded]"));
    }
    out.println();
  }

  /**
   * Average share of published messages that each subscriber received, in percent.
   */
  static double deliveryRate(AggregateStats stats, long totalPublished) {
    if (totalPublished <= 0) {
      return 0.0;
    }
    return stats.avgMessages() * 100.0 / totalPublished;
  }

  private void header(String title) {
    out.println();
    out.println("===============================================");
    out.println("  " + title);
    out.println("===============================================");
  }

  private void line(String label, String value) {
    out.println(format("  %-24s%s", label + ":", value));
  }

  private static String format(String pattern, Object... args) {
    return String.format(Locale.ROOT, pattern, args);
  }
}
