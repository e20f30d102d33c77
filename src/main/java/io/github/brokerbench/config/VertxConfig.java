package io.github.brokerbench.config;

import io.vertx.core.VertxOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Vert.x configuration. Worker pool size can be tuned via VERTX_WORKER_POOL_SIZE.
 */
public class VertxConfig {

  private static final Logger log = LoggerFactory.getLogger(VertxConfig.class);
  private static final String ENV_WORKER_POOL_SIZE = "VERTX_WORKER_POOL_SIZE";

  public static VertxOptions createVertxOptions(ConfigSource source) {
    VertxOptions options = new VertxOptions();
    options.setPreferNativeTransport(true);
    int workerPoolSize = source.getInt(ENV_WORKER_POOL_SIZE, VertxOptions.DEFAULT_WORKER_POOL_SIZE);
    options.setWorkerPoolSize(workerPoolSize);
    log.info("Vert.x worker pool size: {}", workerPoolSize);
    return options;
  }
}
