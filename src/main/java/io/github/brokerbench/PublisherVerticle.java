package io.github.brokerbench;

import io.github.brokerbench.broker.BrokerClient;
import io.github.brokerbench.broker.BrokerClientConfig;
import io.github.brokerbench.broker.BrokerClientFactory;
import io.github.brokerbench.config.AppConfig;
import io.github.brokerbench.config.BenchmarkConfig;
import io.github.brokerbench.config.ConfigSource;
import io.github.brokerbench.metrics.BenchmarkMetricsReporter;
import io.github.brokerbench.metrics.MetricsConfig;
import io.github.brokerbench.model.PublisherResult;
import io.github.brokerbench.model.PublisherStats;
import io.github.brokerbench.model.RunMetadata;
import io.github.brokerbench.publisher.PublisherDriver;
import io.github.brokerbench.results.JsonResultsWriter;
import io.github.brokerbench.results.ResultsPrinter;
import io.github.brokerbench.results.ResultsWriter;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.WorkerExecutor;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publisher run: drives the workers once, then persists, prints and reports the totals.
 * {@link #completion()} resolves when all of that is done.
 */
public class PublisherVerticle extends AbstractVerticle {

  private static final Logger log = LoggerFactory.getLogger(PublisherVerticle.class);

  private final AppConfig appConfig;
  private final BenchmarkConfig benchmarkConfig;
  private final Supplier<BrokerClient> clients;
  private final ResultsWriter writer;
  private final MetricsConfig metricsConfig;
  private final ConfigSource source;
  private final Promise<PublisherResult> completion = Promise.promise();

  private BenchmarkMetricsReporter reporter;
  private WorkerExecutor runExecutor;

  public PublisherVerticle(ConfigSource source, AppConfig appConfig) {
    this(
      appConfig,
      BenchmarkConfig.fromSource(source),
      new BrokerClientFactory(BrokerClientConfig.load(source)),
      new JsonResultsWriter(appConfig.resultsDir()),
      MetricsConfig.fromSource(source),
      source
    );
  }

  PublisherVerticle(AppConfig appConfig, BenchmarkConfig benchmarkConfig, Supplier<BrokerClient> clients,
                    ResultsWriter writer, MetricsConfig metricsConfig, ConfigSource source) {
    this.appConfig = appConfig;
    this.benchmarkConfig = benchmarkConfig;
    this.clients = clients;
    this.writer = writer;
    this.metricsConfig = metricsConfig;
    this.source = source;
  }

  @Override
  public void start(Promise<Void> startPromise) {
    log.info("Starting publisher {} for broker {}", appConfig.instanceId(), benchmarkConfig.brokerType());

    reporter = MetricsSupport.createReporter(metricsConfig, source, null,
      benchmarkConfig.brokerType(), appConfig.batchId());
    long maxRunMs = benchmarkConfig.publishDuration().toMillis() + benchmarkConfig.leaderWarmupMs()
      + benchmarkConfig.drainTimeoutMs() + benchmarkConfig.runTimeoutMarginMs();
    runExecutor = vertx.createSharedWorkerExecutor("publisher-run-" + appConfig.instanceId(), 1,
      maxRunMs, TimeUnit.MILLISECONDS);

    reporter.start()
      .onSuccess(v -> {
        startPromise.complete();
        runBenchmark();
      })
      .onFailure(startPromise::fail);
  }

  @Override
  public void stop(Promise<Void> stopPromise) {
    Future<Void> closeExecutor = (runExecutor != null)
      ? runExecutor.close()
      : Future.succeededFuture();
    closeExecutor
      .onSuccess(v -> {
        log.info("Publisher stopped");
        stopPromise.complete();
      })
      .onFailure(stopPromise::fail);
  }

  /**
   * @return completes with the persisted record, or fails if the run could not be carried out
   */
  public Future<PublisherResult> completion() {
    return completion.future();
  }

  private void runBenchmark() {
    PublisherDriver driver = new PublisherDriver(clients, benchmarkConfig);
    runExecutor.executeBlocking(() -> {
      PublisherStats stats = driver.run();
      return report(stats, driver);
    }, false)
      .compose(result -> reporter.close().map(result))
      .onSuccess(completion::tryComplete)
      .onFailure(err -> {
        log.error("Publisher run failed", err);
        completion.tryFail(err);
      });
  }

  private PublisherResult report(PublisherStats stats, PublisherDriver driver) {
    PublisherResult result = new PublisherResult(appConfig.instanceId(), stats,
      RunMetadata.now(appConfig.batchId(), benchmarkConfig.brokerType()));
    writer.write(result);
    new ResultsPrinter(System.out).printPublisher(benchmarkConfig.brokerType(), stats);
    driver.sentinelSpan().ifPresent(span ->
      log.info("Leader sentinel span: {}ms", span.toMillis()));
    reporter.reportPublisher(appConfig.instanceId(), stats);
    return result;
  }
}
