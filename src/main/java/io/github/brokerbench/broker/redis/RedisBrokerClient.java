package io.github.brokerbench.broker.redis;

import io.github.brokerbench.broker.BrokerClient;
import io.github.brokerbench.broker.DeliveryQueue;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPubSub;
import redis.clients.jedis.exceptions.JedisException;

/**
 * Redis pub/sub backend built on Jedis.
 *
 * <p>PUBLISH is issued synchronously on the command connection. Subscriptions use a second
 * connection whose blocking SUBSCRIBE loop runs on a dedicated thread and feeds a
 * {@link DeliveryQueue}.
 */
public class RedisBrokerClient implements BrokerClient {

  private static final Logger log = LoggerFactory.getLogger(RedisBrokerClient.class);

  private static final int QUEUE_CAPACITY = 100_000;
  private static final Duration OFFER_TIMEOUT = Duration.ofSeconds(1);

  private final String host;
  private final int port;
  private final int timeoutMs;
  private final DeliveryQueue deliveries = new DeliveryQueue(QUEUE_CAPACITY);
  private final AtomicLong droppedDeliveries = new AtomicLong();

  private Jedis commands;
  private Jedis subscriptions;
  private Listener listener;
  private Thread subscriberThread;

  public RedisBrokerClient(String host, int port, int timeoutMs) {
    this.host = Objects.requireNonNull(host, "host cannot be null");
    this.port = port;
    this.timeoutMs = timeoutMs;
  }

  @Override
  public boolean connect() {
    try {
      commands = new Jedis(host, port, timeoutMs);
      commands.ping();
      log.info("Connected to Redis at {}:{}", host, port);
      return true;
    } catch (JedisException e) {
      log.error("Failed to connect to Redis at {}:{}: {}", host, port, e.getMessage());
      closeQuietly(commands);
      commands = null;
      return false;
    }
  }

  @Override
  public boolean publish(String channel, String message) {
    if (commands == null) {
      return false;
    }
    try {
      commands.publish(channel, message);
      return true;
    } catch (JedisException e) {
      log.debug("PUBLISH to {} failed: {}", channel, e.getMessage());
      return false;
    }
  }

  @Override
  public void flush() {
    // PUBLISH waits for its reply, nothing is buffered client-side
  }

  @Override
  public boolean subscribe(String channel, Consumer<String> onMessage) {
    boolean alreadySubscribed = deliveries.isRegistered(channel);
    deliveries.register(channel, onMessage);
    if (alreadySubscribed) {
      return true;
    }

    if (listener != null && listener.isSubscribed()) {
      CountDownLatch confirmed = listener.expect(channel);
      listener.subscribe(channel);
      return awaitConfirmation(channel, confirmed);
    }

    try {
      subscriptions = new Jedis(host, port, timeoutMs);
      subscriptions.ping();
    } catch (JedisException e) {
      log.error("Failed to open Redis subscription connection: {}", e.getMessage());
      closeQuietly(subscriptions);
      subscriptions = null;
      deliveries.unregister(channel);
      return false;
    }

    listener = new Listener();
    CountDownLatch confirmed = listener.expect(channel);
    Jedis connection = subscriptions;
    Listener activeListener = listener;
    subscriberThread = new Thread(() -> {
      try {
        connection.subscribe(activeListener, channel);
      } catch (JedisException e) {
        log.warn("Redis subscription loop ended: {}", e.getMessage());
      }
    }, "redis-subscriber-" + channel);
    subscriberThread.setDaemon(true);
    subscriberThread.start();

    return awaitConfirmation(channel, confirmed);
  }

  @Override
  public void processMessages(Duration timeoutBudget) {
    deliveries.drain(timeoutBudget);
  }

  @Override
  public void disconnect() {
    if (listener != null) {
      try {
        if (listener.isSubscribed()) {
          listener.unsubscribe();
        }
      } catch (JedisException e) {
        log.debug("UNSUBSCRIBE failed: {}", e.getMessage());
      }
      listener = null;
    }
    if (subscriberThread != null) {
      try {
        subscriberThread.join(timeoutMs);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
      subscriberThread = null;
    }
    closeQuietly(subscriptions);
    subscriptions = null;
    closeQuietly(commands);
    commands = null;
    deliveries.clear();
    if (droppedDeliveries.get() > 0) {
      log.warn("{} Redis deliveries dropped on a full delivery queue", droppedDeliveries.get());
    }
  }

  @Override
  public boolean isConnected() {
    return commands != null && commands.isConnected();
  }

  @Override
  public String name() {
    return "Redis";
  }

  private boolean awaitConfirmation(String channel, CountDownLatch confirmed) {
    try {
      if (confirmed.await(timeoutMs, TimeUnit.MILLISECONDS)) {
        log.info("Subscribed to Redis channel {}", channel);
        return true;
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    log.error("No subscription confirmation from Redis for channel {}", channel);
    deliveries.unregister(channel);
    return false;
  }

  private static void closeQuietly(Jedis jedis) {
    if (jedis == null) {
      return;
    }
    try {
      jedis.close();
    } catch (JedisException e) {
      log.debug("Error closing Redis connection: {}", e.getMessage());
    }
  }

  private class Listener extends JedisPubSub {

    private final Map<String, CountDownLatch> pending = new ConcurrentHashMap<>();

    CountDownLatch expect(String channel) {
      return pending.computeIfAbsent(channel, c -> new CountDownLatch(1));
    }

    @Override
    public void onSubscribe(String channel, int subscribedChannels) {
      CountDownLatch latch = pending.remove(channel);
      if (latch != null) {
        latch.countDown();
      }
    }

    @Override
    public void onMessage(String channel, String message) {
      if (!deliveries.offer(channel, message, OFFER_TIMEOUT)) {
        droppedDeliveries.incrementAndGet();
      }
    }
  }
}
