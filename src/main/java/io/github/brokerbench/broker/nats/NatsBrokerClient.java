package io.github.brokerbench.broker.nats;

import io.github.brokerbench.broker.BrokerClient;
import io.github.brokerbench.broker.DeliveryQueue;
import io.nats.client.Connection;
import io.nats.client.Dispatcher;
import io.nats.client.Nats;
import io.nats.client.Options;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * NATS core pub/sub backend built on jnats.
 *
 * <p>Publishing is buffered by the NATS connection, so {@link #flush()} performs a server
 * round trip. The subscription dispatcher thread hands messages to a {@link DeliveryQueue}.
 */
public class NatsBrokerClient implements BrokerClient {

  private static final Logger log = LoggerFactory.getLogger(NatsBrokerClient.class);

  private static final int QUEUE_CAPACITY = 100_000;
  private static final Duration OFFER_TIMEOUT = Duration.ofSeconds(1);
  private static final Duration FLUSH_TIMEOUT = Duration.ofSeconds(15);

  private final String url;
  private final Duration connectTimeout;
  private final DeliveryQueue deliveries = new DeliveryQueue(QUEUE_CAPACITY);
  private final AtomicLong droppedDeliveries = new AtomicLong();

  private Connection connection;
  private Dispatcher dispatcher;

  public NatsBrokerClient(String url, Duration connectTimeout) {
    this.url = Objects.requireNonNull(url, "url cannot be null");
    this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout cannot be null");
  }

  @Override
  public boolean connect() {
    Options options = new Options.Builder()
      .server(url)
      .connectionTimeout(connectTimeout)
      .maxReconnects(0)
      .build();
    try {
      connection = Nats.connect(options);
      log.info("Connected to NATS at {}", url);
      return true;
    } catch (IOException e) {
      log.error("Failed to connect to NATS at {}: {}", url, e.getMessage());
      return false;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.error("Interrupted while connecting to NATS at {}", url);
      return false;
    }
  }

  @Override
  public boolean publish(String channel, String message) {
    if (connection == null) {
      return false;
    }
    try {
      connection.publish(channel, message.getBytes(StandardCharsets.UTF_8));
      return true;
    } catch (IllegalStateException e) {
      log.debug("Publish to {} failed: {}", channel, e.getMessage());
      return false;
    }
  }

  @Override
  public void flush() {
    if (connection == null) {
      return;
    }
    try {
      connection.flush(FLUSH_TIMEOUT);
    } catch (TimeoutException e) {
      log.warn("NATS flush timed out after {}", FLUSH_TIMEOUT);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  @Override
  public boolean subscribe(String channel, Consumer<String> onMessage) {
    if (connection == null) {
      log.warn("Cannot subscribe to {}: not connected", channel);
      return false;
    }
    boolean alreadySubscribed = deliveries.isRegistered(channel);
    deliveries.register(channel, onMessage);
    if (alreadySubscribed) {
      return true;
    }

    try {
      if (dispatcher == null) {
        dispatcher = connection.createDispatcher(msg -> {
          String body = new String(msg.getData(), StandardCharsets.UTF_8);
          if (!deliveries.offer(msg.getSubject(), body, OFFER_TIMEOUT)) {
            droppedDeliveries.incrementAndGet();
          }
        });
      }
      dispatcher.subscribe(channel);
      // Make sure the server has registered the interest before anyone relies on it
      connection.flush(FLUSH_TIMEOUT);
      log.info("Subscribed to NATS subject {}", channel);
      return true;
    } catch (IllegalStateException | TimeoutException e) {
      log.error("Failed to subscribe to NATS subject {}: {}", channel, e.getMessage());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    deliveries.unregister(channel);
    return false;
  }

  @Override
  public void processMessages(Duration timeoutBudget) {
    deliveries.drain(timeoutBudget);
  }

  @Override
  public void disconnect() {
    if (connection == null) {
      return;
    }
    if (dispatcher != null) {
      connection.closeDispatcher(dispatcher);
      dispatcher = null;
    }
    try {
      connection.close();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    connection = null;
    deliveries.clear();
    if (droppedDeliveries.get() > 0) {
      log.warn("{} NATS deliveries dropped on a full delivery queue", droppedDeliveries.get());
    }
  }

  @Override
  public boolean isConnected() {
    return connection != null && connection.getStatus() == Connection.Status.CONNECTED;
  }

  @Override
  public String name() {
    return "NATS";
  }
}
