package io.github.brokerbench.broker.memory;

import io.github.brokerbench.broker.BrokerClient;
import io.github.brokerbench.broker.DeliveryQueue;
import java.time.Duration;
import java.util.Objects;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link BrokerClient} talking to an {@link InMemoryBroker}. Publishing is synchronous, so
 * {@link #flush()} has nothing to wait for.
 */
public class InMemoryBrokerClient implements BrokerClient {

  private static final Logger log = LoggerFactory.getLogger(InMemoryBrokerClient.class);

  private final InMemoryBroker broker;
  private final DeliveryQueue deliveries;

  private volatile boolean connected;

  InMemoryBrokerClient(InMemoryBroker broker) {
    this.broker = Objects.requireNonNull(broker, "broker cannot be null");
    this.deliveries = new DeliveryQueue(broker.queueCapacity());
  }

  @Override
  public boolean connect() {
    connected = true;
    return true;
  }

  @Override
  public boolean publish(String channel, String message) {
    if (!connected) {
      return false;
    }
    return broker.route(channel, message);
  }

  @Override
  public void flush() {
    // publish hands messages over synchronously
  }

  @Override
  public boolean subscribe(String channel, Consumer<String> onMessage) {
    if (!connected) {
      log.warn("Cannot subscribe to {}: not connected", channel);
      return false;
    }
    deliveries.register(channel, onMessage);
    broker.addSubscriber(channel, this);
    return true;
  }

  @Override
  public void processMessages(Duration timeoutBudget) {
    if (!connected) {
      return;
    }
    deliveries.drain(timeoutBudget);
  }

  @Override
  public void disconnect() {
    if (connected) {
      connected = false;
      broker.removeSubscriber(this);
      deliveries.clear();
    }
  }

  @Override
  public boolean isConnected() {
    return connected;
  }

  @Override
  public String name() {
    return "InMemory";
  }

  boolean deliver(String channel, String message, Duration offerTimeout) {
    return deliveries.offer(channel, message, offerTimeout);
  }
}
