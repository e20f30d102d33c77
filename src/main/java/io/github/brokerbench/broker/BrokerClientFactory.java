package io.github.brokerbench.broker;

import io.github.brokerbench.broker.kafka.KafkaBrokerClient;
import io.github.brokerbench.broker.memory.InMemoryBroker;
import io.github.brokerbench.broker.nats.NatsBrokerClient;
import io.github.brokerbench.broker.redis.RedisBrokerClient;
import java.time.Duration;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Creates a fresh, unconnected {@link BrokerClient} for the configured backend on every call.
 */
public class BrokerClientFactory implements Supplier<BrokerClient> {

  private final BrokerClientConfig config;

  public BrokerClientFactory(BrokerClientConfig config) {
    this.config = Objects.requireNonNull(config, "config cannot be null");
  }

  @Override
  public BrokerClient get() {
    return switch (config.getBrokerType()) {
      case MEMORY -> InMemoryBroker.shared().newClient();
      case REDIS -> new RedisBrokerClient(config.getRedisHost(), config.getRedisPort(), config.getConnectTimeoutMs());
      case NATS -> new NatsBrokerClient(config.getNatsUrl(), Duration.ofMillis(config.getConnectTimeoutMs()));
      case KAFKA -> new KafkaBrokerClient(config);
    };
  }

  public BrokerType brokerType() {
    return config.getBrokerType();
  }
}
