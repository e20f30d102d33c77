package io.github.brokerbench.broker.kafka;

import io.github.brokerbench.broker.BrokerClient;
import io.github.brokerbench.broker.BrokerClientConfig;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import org.apache.kafka.clients.admin.Admin;
import org.apache.kafka.clients.admin.AdminClientConfig;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Kafka backend: the channel maps to a topic, every subscriber instance joins its own consumer
 * group starting at the latest offset so that it sees the full fan-out, as with pub/sub brokers.
 *
 * <p>The producer batches sends, which is why {@link #flush()} matters here. Send failures are
 * reported asynchronously and only show up in {@link #asyncSendFailures()}.
 */
public class KafkaBrokerClient implements BrokerClient {

  private static final Logger log = LoggerFactory.getLogger(KafkaBrokerClient.class);

  private final BrokerClientConfig config;
  private final Map<String, Consumer<String>> callbacks = new HashMap<>();
  private final AtomicLong asyncSendFailures = new AtomicLong();

  private KafkaProducer<String, String> producer;
  private KafkaConsumer<String, String> consumer;

  public KafkaBrokerClient(BrokerClientConfig config) {
    this.config = Objects.requireNonNull(config, "config cannot be null");
  }

  @Override
  public boolean connect() {
    try {
      String clusterId = describeCluster();
      producer = new KafkaProducer<>(producerProperties());
      log.info("Connected to Kafka at {}, cluster ID: {}", config.getKafkaBootstrapServers(), clusterId);
      return true;
    } catch (KafkaException | ExecutionException | TimeoutException e) {
      log.error("Failed to connect to Kafka at {}: {}", config.getKafkaBootstrapServers(), e.getMessage());
      closeProducer();
      return false;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.error("Interrupted while connecting to Kafka at {}", config.getKafkaBootstrapServers());
      return false;
    }
  }

  /**
   * Lightweight metadata round trip, so that an unreachable cluster fails at connect time.
   */
  private String describeCluster() throws ExecutionException, InterruptedException, TimeoutException {
    Properties props = new Properties();
    props.put(AdminClientConfig.BOOTSTRAP_SERVERS_CONFIG, config.getKafkaBootstrapServers());
    props.put(AdminClientConfig.REQUEST_TIMEOUT_MS_CONFIG, String.valueOf(config.getConnectTimeoutMs()));
    props.putAll(config.getKafkaProperties());
    try (Admin admin = Admin.create(props)) {
      return admin.describeCluster().clusterId().get(config.getConnectTimeoutMs(), TimeUnit.MILLISECONDS);
    }
  }

  @Override
  public boolean publish(String channel, String message) {
    if (producer == null) {
      return false;
    }
    try {
      producer.send(new ProducerRecord<>(channel, message), (metadata, err) -> {
        if (err != null) {
          asyncSendFailures.incrementAndGet();
        }
      });
      return true;
    } catch (KafkaException | IllegalStateException e) {
      log.debug("Send to {} failed: {}", channel, e.getMessage());
      return false;
    }
  }

  @Override
  public void flush() {
    if (producer != null) {
      try {
        producer.flush();
      } catch (KafkaException e) {
        log.warn("Kafka flush failed: {}", e.getMessage());
      }
    }
  }

  @Override
  public boolean subscribe(String channel, Consumer<String> onMessage) {
    callbacks.put(channel, onMessage);
    try {
      if (consumer == null) {
        consumer = new KafkaConsumer<>(consumerProperties());
      }
      consumer.subscribe(List.copyOf(callbacks.keySet()));
      // First poll joins the group and resolves the starting offsets
      dispatch(consumer.poll(Duration.ZERO));
      log.info("Subscribed to Kafka topic {}", channel);
      return true;
    } catch (KafkaException e) {
      log.error("Failed to subscribe to Kafka topic {}: {}", channel, e.getMessage());
      callbacks.remove(channel);
      return false;
    }
  }

  @Override
  public void processMessages(Duration timeoutBudget) {
    if (consumer == null) {
      return;
    }
    try {
      dispatch(consumer.poll(timeoutBudget));
    } catch (KafkaException e) {
      log.warn("Kafka poll failed: {}", e.getMessage());
    }
  }

  @Override
  public void disconnect() {
    closeProducer();
    if (consumer != null) {
      try {
        consumer.close(Duration.ofMillis(config.getConnectTimeoutMs()));
      } catch (KafkaException e) {
        log.debug("Error closing Kafka consumer: {}", e.getMessage());
      }
      consumer = null;
    }
    callbacks.clear();
    if (asyncSendFailures.get() > 0) {
      log.warn("{} Kafka sends failed after being accepted", asyncSendFailures.get());
    }
  }

  @Override
  public boolean isConnected() {
    return producer != null || consumer != null;
  }

  @Override
  public String name() {
    return "Kafka";
  }

  public long asyncSendFailures() {
    return asyncSendFailures.get();
  }

  private void dispatch(ConsumerRecords<String, String> records) {
    for (ConsumerRecord<String, String> record : records) {
      Consumer<String> callback = callbacks.get(record.topic());
      if (callback != null) {
        callback.accept(record.value());
      }
    }
  }

  private void closeProducer() {
    if (producer != null) {
      try {
        producer.close(Duration.ofMillis(config.getConnectTimeoutMs()));
      } catch (KafkaException e) {
        log.debug("Error closing Kafka producer: {}", e.getMessage());
      }
      producer = null;
    }
  }

  private Properties producerProperties() {
    Properties props = new Properties();
    props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, config.getKafkaBootstrapServers());
    props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
    props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
    props.put(ProducerConfig.MAX_BLOCK_MS_CONFIG, String.valueOf(config.getConnectTimeoutMs()));
    props.put(ProducerConfig.ACKS_CONFIG, "1");
    props.putAll(config.getKafkaProperties());
    return props;
  }

  private Properties consumerProperties() {
    Properties props = new Properties();
    props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, config.getKafkaBootstrapServers());
    props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
    props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
    props.put(ConsumerConfig.GROUP_ID_CONFIG, "brokerbench-" + UUID.randomUUID());
    props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "latest");
    props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "false");
    props.putAll(config.getKafkaProperties());
    return props;
  }
}
