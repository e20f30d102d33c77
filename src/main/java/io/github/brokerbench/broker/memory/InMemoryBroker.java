package io.github.brokerbench.broker.memory;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loopback pub/sub hub living inside one JVM. Every message published on a channel is offered
 * to the delivery queue of each client subscribed to it; nothing is persisted.
 */
public class InMemoryBroker {

  private static final Logger log = LoggerFactory.getLogger(InMemoryBroker.class);

  static final int DEFAULT_QUEUE_CAPACITY = 100_000;
  static final Duration DEFAULT_OFFER_TIMEOUT = Duration.ofSeconds(5);

  // Must follow the defaults it is built from.
  private static final InMemoryBroker SHARED = new InMemoryBroker();

  private final int queueCapacity;
  private final Duration offerTimeout;
  private final Map<String, Set<InMemoryBrokerClient>> subscribers = new ConcurrentHashMap<>();
  private final AtomicLong published = new AtomicLong();
  private final AtomicLong dropped = new AtomicLong();

  public InMemoryBroker() {
    this(DEFAULT_QUEUE_CAPACITY, DEFAULT_OFFER_TIMEOUT);
  }

  /**
   * @param queueCapacity per-subscriber delivery queue capacity
   * @param offerTimeout how long a publish waits on a full subscriber queue before failing
   */
  public InMemoryBroker(int queueCapacity, Duration offerTimeout) {
    this.queueCapacity = queueCapacity;
    this.offerTimeout = Objects.requireNonNull(offerTimeout, "offerTimeout cannot be null");
  }

  /**
   * Process-wide hub used by the {@code memory} broker type.
   */
  public static InMemoryBroker shared() {
    return SHARED;
  }

  public InMemoryBrokerClient newClient() {
    return new InMemoryBrokerClient(this);
  }

  int queueCapacity() {
    return queueCapacity;
  }

  void addSubscriber(String channel, InMemoryBrokerClient client) {
    subscribers.computeIfAbsent(channel, c -> new CopyOnWriteArraySet<>()).add(client);
    log.debug("Client subscribed to {}, {} subscribers", channel, subscribers.get(channel).size());
  }

  void removeSubscriber(InMemoryBrokerClient client) {
    subscribers.values().forEach(clients -> clients.remove(client));
  }

  /**
   * Offers the message to every subscriber of the channel.
   *
   * @return false if any subscriber queue stayed full past the offer timeout
   */
  boolean route(String channel, String message) {
    published.incrementAndGet();
    Set<InMemoryBrokerClient> clients = subscribers.get(channel);
    if (clients == null) {
      return true;
    }
    boolean delivered = true;
    for (InMemoryBrokerClient client : clients) {
      if (!client.deliver(channel, message, offerTimeout)) {
        dropped.incrementAndGet();
        delivered = false;
      }
    }
    return delivered;
  }

  public int subscriberCount(String channel) {
    Set<InMemoryBrokerClient> clients = subscribers.get(channel);
    return clients == null ? 0 : clients.size();
  }

  public long publishedCount() {
    return published.get();
  }

  public long droppedCount() {
    return dropped.get();
  }
}
