package io.github.brokerbench;

import io.github.brokerbench.config.AppConfig;
import io.github.brokerbench.config.ConfigSource;
import io.github.brokerbench.config.VertxConfig;
import io.github.brokerbench.model.PublisherStats;
import io.github.brokerbench.results.AggregateCommand;
import io.vertx.core.Vertx;
import io.vertx.core.VertxOptions;
import java.util.Arrays;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point. The role comes from the first argument or BENCH_ROLE:
 * {@code publisher}, {@code subscriber} or {@code aggregate <dir> [broker]}.
 */
public class BrokerBenchLauncher {

  private static final Logger log = LoggerFactory.getLogger(BrokerBenchLauncher.class);

  static final String ROLE_PUBLISHER = "publisher";
  static final String ROLE_SUBSCRIBER = "subscriber";
  static final String ROLE_AGGREGATE = "aggregate";
  private static final String BATCH_ID = "BATCH_ID";

  public static void main(String[] args) {
    String roleArg = args.length > 0 ? args[0] : null;

    if (ROLE_AGGREGATE.equalsIgnoreCase(roleArg)) {
      String[] rest = Arrays.copyOfRange(args, 1, args.length);
      System.exit(new AggregateCommand(System.out, System.err).run(rest));
      return;
    }

    ConfigSource source = ConfigSource.load();
    AppConfig appConfig;
    try {
      appConfig = AppConfig.fromSource(source, roleArg);
    } catch (IllegalArgumentException e) {
      log.error("Invalid configuration: {}", e.getMessage());
      System.exit(1);
      return;
    }

    switch (appConfig.role()) {
      case ROLE_PUBLISHER -> runPublisher(source, appConfig);
      case ROLE_SUBSCRIBER -> runSubscriber(source, appConfig);
      case ROLE_AGGREGATE -> System.exit(new AggregateCommand(System.out, System.err)
        .run(aggregateArgs(source, appConfig)));
      default -> {
        log.error("Unknown role: {} (expected publisher, subscriber or aggregate)", appConfig.role());
        System.exit(1);
      }
    }
  }

  private static void runSubscriber(ConfigSource source, AppConfig appConfig) {
    Vertx vertx = createVertx(source);
    SubscriberVerticle verticle;
    try {
      verticle = new SubscriberVerticle(source, appConfig);
    } catch (IllegalArgumentException e) {
      log.error("Invalid configuration: {}", e.getMessage());
      vertx.close();
      System.exit(1);
      return;
    }

    vertx.deployVerticle(verticle)
      .onSuccess(id -> log.info("SubscriberVerticle deployed with ID: {}", id))
      .onFailure(err -> {
        log.error("Failed to deploy SubscriberVerticle", err);
        vertx.close();
        System.exit(1);
      });
  }

  private static void runPublisher(ConfigSource source, AppConfig appConfig) {
    Vertx vertx = createVertx(source);
    PublisherVerticle verticle;
    try {
      verticle = new PublisherVerticle(source, appConfig);
    } catch (IllegalArgumentException e) {
      log.error("Invalid configuration: {}", e.getMessage());
      vertx.close();
      System.exit(1);
      return;
    }

    vertx.deployVerticle(verticle)
      .onSuccess(id -> log.info("PublisherVerticle deployed with ID: {}", id))
      .compose(id -> verticle.completion())
      .onComplete(ar -> {
        if (ar.failed()) {
          log.error("Publisher failed", ar.cause());
        }
        int code = ar.succeeded() ? exitCode(ar.result().stats()) : 1;
        vertx.close().onComplete(v -> System.exit(code));
      });
  }

  /**
   * Arguments for an aggregate run selected through BENCH_ROLE. The batch directory needs an
   * explicit BATCH_ID; without one the command gets no arguments and prints its usage.
   */
  static String[] aggregateArgs(ConfigSource source, AppConfig appConfig) {
    if (source.get(BATCH_ID, null) == null) {
      log.error("BENCH_ROLE=aggregate requires BATCH_ID, or run: aggregate <results_directory> [<broker_type>]");
      return new String[0];
    }
    return new String[] {appConfig.resultsDir().resolve(appConfig.batchId()).toString()};
  }

  /**
   * A completed publisher run fails only if none of its workers connected.
   */
  static int exitCode(PublisherStats stats) {
    return stats.workers() > 0 && stats.workersFailed() == stats.workers() ? 1 : 0;
  }

  private static Vertx createVertx(ConfigSource source) {
    VertxOptions options = VertxConfig.createVertxOptions(source);
    return Vertx.vertx(options);
  }
}
