package io.github.brokerbench.publisher;

import io.github.brokerbench.broker.BrokerClient;
import io.github.brokerbench.config.BenchmarkConfig;
import io.github.brokerbench.model.PublisherStats;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.LongSupplier;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs N concurrent publishing workers for a fixed wall-clock duration.
 *
 * <p>Each worker owns its own {@link BrokerClient}. Worker 0 (the leader) publishes
 * START_BENCHMARK before anyone floods and END_BENCHMARK once every worker has drained. A worker
 * that cannot connect is reported and skipped; the run goes on with the others.
 */
public class PublisherDriver {

  private static final Logger log = LoggerFactory.getLogger(PublisherDriver.class);

  private final Supplier<BrokerClient> clientFactory;
  private final BenchmarkConfig config;
  private final LongSupplier nanoTime;
  private final SentinelTimes sentinelTimes = new SentinelTimes();

  private List<WorkerResult> workerResults = List.of();

  public PublisherDriver(Supplier<BrokerClient> clientFactory, BenchmarkConfig config) {
    this(clientFactory, config, System::nanoTime);
  }

  PublisherDriver(Supplier<BrokerClient> clientFactory, BenchmarkConfig config, LongSupplier nanoTime) {
    this.clientFactory = Objects.requireNonNull(clientFactory, "clientFactory cannot be null");
    this.config = Objects.requireNonNull(config, "config cannot be null");
    this.nanoTime = Objects.requireNonNull(nanoTime, "nanoTime cannot be null");
  }

  /**
   * Launches the workers, waits for all of them and aggregates their counters.
   *
   * @return totals of the run
   * @throws InterruptedException if the calling thread is interrupted while joining workers
   */
  public PublisherStats run() throws InterruptedException {
    int workers = config.numPublishers();
    log.info("Starting {} concurrent publishers on {} for {} seconds",
      workers, config.channelName(), config.publishDurationSeconds());

    CountDownLatch leaderStarted = new CountDownLatch(1);
    CountDownLatch followersDrained = new CountDownLatch(workers - 1);
    ExecutorService pool = Executors.newFixedThreadPool(workers, workerThreadFactory());

    long startNanos = nanoTime.getAsLong();
    long deadlineNanos = startNanos + config.publishDuration().toNanos();

    List<Future<WorkerResult>> futures = new ArrayList<>(workers);
    try {
      for (int i = 0; i < workers; i++) {
        PublisherWorker worker = new PublisherWorker(
          i,
          clientFactory.get(),
          config.channelName(),
          deadlineNanos,
          config.leaderWarmupMs(),
          config.drainTimeoutMs(),
          leaderStarted,
          followersDrained,
          sentinelTimes,
          nanoTime
        );
        futures.add(pool.submit(worker));
      }
      workerResults = join(futures);
    } finally {
      pool.shutdownNow();
    }

    Duration duration = Duration.ofNanos(nanoTime.getAsLong() - startNanos);
    PublisherStats stats = aggregate(workerResults, duration);
    log.info("Publishers finished: published={}, failed={}, workersFailed={}, duration={}ms",
      stats.messagesPublished(), stats.messagesFailed(), stats.workersFailed(), duration.toMillis());
    return stats;
  }

  /**
   * @return per-worker results of the last run, in worker order
   */
  public List<WorkerResult> workerResults() {
    return workerResults;
  }

  /**
   * @return time between the leader's START and END sentinels, empty if either was not emitted
   */
  public Optional<Duration> sentinelSpan() {
    return sentinelTimes.span();
  }

  static PublisherStats aggregate(List<WorkerResult> results, Duration duration) {
    long published = 0;
    long failed = 0;
    int workersFailed = 0;
    for (WorkerResult result : results) {
      published += result.published();
      failed += result.failed();
      if (!result.connected()) {
        workersFailed++;
      }
    }
    return new PublisherStats(results.size(), workersFailed, published, failed, duration);
  }

  private List<WorkerResult> join(List<Future<WorkerResult>> futures) throws InterruptedException {
    List<WorkerResult> results = new ArrayList<>(futures.size());
    for (int i = 0; i < futures.size(); i++) {
      try {
        results.add(futures.get(i).get());
      } catch (ExecutionException e) {
        log.error("Publisher {} failed unexpectedly", i, e.getCause());
        results.add(WorkerResult.connectFailed(i));
      }
    }
    return results;
  }

  private static ThreadFactory workerThreadFactory() {
    AtomicInteger counter = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable, "publisher-worker-" + counter.getAndIncrement());
      thread.setDaemon(true);
      return thread;
    };
  }
}
