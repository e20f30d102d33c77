package io.github.brokerbench;

import io.github.brokerbench.broker.BrokerClient;
import io.github.brokerbench.broker.BrokerClientConfig;
import io.github.brokerbench.broker.BrokerClientFactory;
import io.github.brokerbench.config.AppConfig;
import io.github.brokerbench.config.BenchmarkConfig;
import io.github.brokerbench.config.ConfigSource;
import io.github.brokerbench.health.HealthCheckHandler;
import io.github.brokerbench.health.HealthCheckResponse;
import io.github.brokerbench.metrics.BenchmarkMetricsReporter;
import io.github.brokerbench.metrics.MetricsConfig;
import io.github.brokerbench.model.RunMetadata;
import io.github.brokerbench.model.RunStats;
import io.github.brokerbench.model.SubscriberResult;
import io.github.brokerbench.results.JsonResultsWriter;
import io.github.brokerbench.results.ResultsHandler;
import io.github.brokerbench.results.ResultsPrinter;
import io.github.brokerbench.results.ResultsWriter;
import io.github.brokerbench.subscriber.SubscriberDriver;
import io.github.brokerbench.subscriber.SubscriberState;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.WorkerExecutor;
import io.vertx.core.http.HttpServer;
import io.vertx.ext.web.Router;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Subscriber service: measures one run and serves health, results and metrics over HTTP.
 *
 * <p>Polling happens on a single ordered worker, one {@code pollOnce()} per task, each task
 * scheduling the next. The process keeps running after the result has been reported.
 */
public class SubscriberVerticle extends AbstractVerticle {

  private static final Logger log = LoggerFactory.getLogger(SubscriberVerticle.class);

  private final AppConfig appConfig;
  private final BenchmarkConfig benchmarkConfig;
  private final Supplier<BrokerClient> clients;
  private final ResultsWriter writer;
  private final MetricsConfig metricsConfig;
  private final ConfigSource source;
  private final Promise<SubscriberResult> reported = Promise.promise();

  private SubscriberDriver driver;
  private BenchmarkMetricsReporter reporter;
  private WorkerExecutor pollExecutor;
  private HttpServer httpServer;
  private volatile SubscriberResult result;
  private volatile boolean stopping;

  public SubscriberVerticle(ConfigSource source, AppConfig appConfig) {
    this(
      appConfig,
      BenchmarkConfig.fromSource(source),
      new BrokerClientFactory(BrokerClientConfig.load(source)),
      new JsonResultsWriter(appConfig.resultsDir()),
      MetricsConfig.fromSource(source),
      source
    );
  }

  SubscriberVerticle(AppConfig appConfig, BenchmarkConfig benchmarkConfig, Supplier<BrokerClient> clients,
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
    log.info("Starting subscriber {} for broker {}", appConfig.instanceId(), benchmarkConfig.brokerType());

    driver = new SubscriberDriver(clients.get(), benchmarkConfig);
    long maxPollMs = benchmarkConfig.pollTimeoutMs() + benchmarkConfig.startGracePeriodMs()
      + benchmarkConfig.publishDuration().toMillis() + benchmarkConfig.runTimeoutMarginMs();
    pollExecutor = vertx.createSharedWorkerExecutor("subscriber-poll-" + appConfig.instanceId(), 1,
      maxPollMs, TimeUnit.MILLISECONDS);

    Router router = Router.router(vertx);
    new HealthCheckHandler(this::readiness).registerRoutes(router);
    new ResultsHandler(() -> Optional.ofNullable(result)).registerRoutes(router);
    reporter = MetricsSupport.createReporter(metricsConfig, source, router,
      benchmarkConfig.brokerType(), appConfig.batchId());

    router.route().handler(ctx -> {
      ctx.response()
        .setStatusCode(404)
        .putHeader("content-type", "application/json")
        .end("{\"error\": \"Not Found\"}");
    });

    reporter.start()
      .compose(v -> pollExecutor.executeBlocking(driver::subscribe, true))
      .compose(subscribed -> subscribed
        ? startHttpServer(router, appConfig.httpPort())
        : Future.failedFuture(new IllegalStateException(
            "Could not subscribe to " + benchmarkConfig.channelName() + " on " + driver.brokerName())))
      .onSuccess(server -> {
        httpServer = server;
        log.info("Subscriber ready on port {}", server.actualPort());
        schedulePoll();
        startPromise.complete();
      })
      .onFailure(err -> {
        log.error("Failed to start subscriber", err);
        startPromise.fail(err);
      });
  }

  @Override
  public void stop(Promise<Void> stopPromise) {
    log.info("Stopping subscriber {}", appConfig.instanceId());
    stopping = true;

    Future<Void> stopHttpServer = (httpServer != null)
      ? httpServer.close()
      : Future.succeededFuture();

    stopHttpServer
      .compose(v -> pollExecutor.executeBlocking(() -> {
        driver.close();
        return null;
      }, true))
      .compose(v -> reporter.close())
      .compose(v -> pollExecutor.close())
      .onSuccess(v -> {
        log.info("Subscriber stopped");
        stopPromise.complete();
      })
      .onFailure(err -> {
        log.error("Error during subscriber shutdown", err);
        stopPromise.fail(err);
      });
  }

  /**
   * @return completes with the result once it has been reported
   */
  public Future<SubscriberResult> reported() {
    return reported.future();
  }

  /**
   * @return HTTP port the service listens on, 0 before start
   */
  public int actualPort() {
    return httpServer != null ? httpServer.actualPort() : 0;
  }

  private HealthCheckResponse readiness() {
    return HealthCheckResponse.readiness(driver.brokerName(),
      driver.isSubscribed() && driver.isBrokerConnected(), driver.state().getValue());
  }

  private void schedulePoll() {
    if (stopping) {
      return;
    }
    pollExecutor.executeBlocking(this::pollAndReport, true)
      .onSuccess(state -> schedulePoll())
      .onFailure(err -> {
        log.error("Subscriber poll failed", err);
        vertx.setTimer(benchmarkConfig.pollTimeoutMs(), id -> schedulePoll());
      });
  }

  private SubscriberState pollAndReport() {
    SubscriberState state = driver.pollOnce();
    if (state == SubscriberState.MEASURING) {
      reporter.reportSubscriberProgress(appConfig.instanceId(), driver.liveMessages());
    } else if (state == SubscriberState.FINALIZED) {
      driver.reportOnce(this::report);
    }
    return state;
  }

  private void report(RunStats stats) {
    SubscriberResult finished = new SubscriberResult(appConfig.instanceId(), stats,
      RunMetadata.now(appConfig.batchId(), benchmarkConfig.brokerType()));
    writer.write(finished);
    new ResultsPrinter(System.out).printSubscriber(driver.brokerName(), appConfig.instanceId(), stats);
    reporter.reportSubscriber(appConfig.instanceId(), stats);
    result = finished;
    reported.tryComplete(finished);
  }

  private Future<HttpServer> startHttpServer(Router router, int port) {
    return vertx.createHttpServer()
      .requestHandler(router)
      .listen(port)
      .onSuccess(server -> log.info("HTTP server started on port {}", server.actualPort()))
      .onFailure(err -> log.error("Failed to start HTTP server", err));
  }
}
