package io.github.brokerbench.broker;

import io.github.brokerbench.config.ConfigSource;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Connection settings for every supported broker backend.
 */
public class BrokerClientConfig {

  private static final Logger log = LoggerFactory.getLogger(BrokerClientConfig.class);

  static final String CONFIG_FILE_KEY = "BROKER_CONFIG_FILE";

  private static final String PROP_KAFKA_PREFIX = "kafka.";
  private static final String PROP_KAFKA_BOOTSTRAP_SERVERS = "kafka.bootstrap.servers";
  private static final String PROP_REDIS_HOST = "redis.host";
  private static final String PROP_REDIS_PORT = "redis.port";
  private static final String PROP_NATS_URL = "nats.url";

  private static final String DEFAULT_REDIS_HOST = "localhost";
  private static final int DEFAULT_REDIS_PORT = 6379;
  private static final String DEFAULT_NATS_URL = "nats://localhost:4222";
  private static final String DEFAULT_KAFKA_BOOTSTRAP_SERVERS = "localhost:9092";
  private static final int DEFAULT_CONNECT_TIMEOUT_MS = 5000;

  private final BrokerType brokerType;
  private final String redisHost;
  private final int redisPort;
  private final String natsUrl;
  private final String kafkaBootstrapServers;
  private final int connectTimeoutMs;
  private final Map<String, String> kafkaProperties;

  private BrokerClientConfig(Builder builder) {
    this.brokerType = builder.brokerType;
    this.redisHost = builder.redisHost;
    this.redisPort = builder.redisPort;
    this.natsUrl = builder.natsUrl;
    this.kafkaBootstrapServers = builder.kafkaBootstrapServers;
    this.connectTimeoutMs = builder.connectTimeoutMs;
    this.kafkaProperties = new HashMap<>(builder.kafkaProperties);
  }

  public BrokerType getBrokerType() {
    return brokerType;
  }

  public String getRedisHost() {
    return redisHost;
  }

  public int getRedisPort() {
    return redisPort;
  }

  public String getNatsUrl() {
    return natsUrl;
  }

  public String getKafkaBootstrapServers() {
    return kafkaBootstrapServers;
  }

  public int getConnectTimeoutMs() {
    return connectTimeoutMs;
  }

  /**
   * Extra Kafka client properties (security settings and the like), keys without the kafka. prefix.
   */
  public Map<String, String> getKafkaProperties() {
    return Map.copyOf(kafkaProperties);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Loads broker settings from the properties file named by BROKER_CONFIG_FILE when set, else
   * from environment-style keys. An unreadable file falls back to the environment.
   *
   * @param source configuration source
   * @return BrokerClientConfig instance
   * @throws IllegalArgumentException if BROKER_TYPE is unknown
   */
  public static BrokerClientConfig load(ConfigSource source) {
    String file = source.get(CONFIG_FILE_KEY);
    if (file == null || file.isBlank()) {
      return fromSource(source);
    }
    BrokerType type = BrokerType.fromName(source.get("BROKER_TYPE", BrokerType.REDIS.getValue()));
    try {
      BrokerClientConfig config = fromFile(Path.of(file), type);
      log.info("Broker config loaded from {}: type={}, endpoint={}", file, type.getValue(), config.endpoint());
      return config;
    } catch (IOException e) {
      log.warn("Could not read broker config file {}, loading from environment: {}", file, e.getMessage());
      return fromSource(source);
    }
  }

  /**
   * Loads broker settings from environment-style keys: BROKER_TYPE, REDIS_HOST, REDIS_PORT,
   * NATS_URL, KAFKA_BOOTSTRAP_SERVERS, BROKER_CONNECT_TIMEOUT_MS.
   *
   * @param source configuration source
   * @return BrokerClientConfig instance
   * @throws IllegalArgumentException if BROKER_TYPE is unknown
   */
  public static BrokerClientConfig fromSource(ConfigSource source) {
    BrokerClientConfig config = builder()
      .brokerType(BrokerType.fromName(source.get("BROKER_TYPE", BrokerType.REDIS.getValue())))
      .redisHost(source.get("REDIS_HOST", DEFAULT_REDIS_HOST))
      .redisPort(source.getInt("REDIS_PORT", DEFAULT_REDIS_PORT))
      .natsUrl(source.get("NATS_URL", DEFAULT_NATS_URL))
      .kafkaBootstrapServers(source.get("KAFKA_BOOTSTRAP_SERVERS", DEFAULT_KAFKA_BOOTSTRAP_SERVERS))
      .connectTimeoutMs(source.getInt("BROKER_CONNECT_TIMEOUT_MS", DEFAULT_CONNECT_TIMEOUT_MS))
      .build();
    log.info("Broker config loaded: type={}, endpoint={}", config.brokerType.getValue(), config.endpoint());
    return config;
  }

  /**
   * Loads broker settings from a properties file at the given path.
   *
   * @param path the properties file
   * @param brokerType the backend to configure
   * @return BrokerClientConfig loaded from the file
   * @throws IOException if the file cannot be read
   */
  public static BrokerClientConfig fromFile(Path path, BrokerType brokerType) throws IOException {
    log.info("Loading broker configuration from file: {}", path);
    try (InputStream is = Files.newInputStream(path)) {
      Properties props = new Properties();
      props.load(is);
      return fromProperties(props, brokerType);
    }
  }

  /**
   * Creates configuration from properties. Recognised keys: redis.host, redis.port, nats.url,
   * kafka.bootstrap.servers; any other kafka.* key is passed through to the Kafka clients.
   *
   * @param props the properties
   * @param brokerType the backend to configure
   * @return BrokerClientConfig built from the properties
   */
  public static BrokerClientConfig fromProperties(Properties props, BrokerType brokerType) {
    Builder builder = builder().brokerType(brokerType);

    String redisHost = props.getProperty(PROP_REDIS_HOST);
    if (redisHost != null && !redisHost.isBlank()) {
      builder.redisHost(redisHost.trim());
    }
    String redisPort = props.getProperty(PROP_REDIS_PORT);
    if (redisPort != null && !redisPort.isBlank()) {
      builder.redisPort(Integer.parseInt(redisPort.trim()));
    }
    String natsUrl = props.getProperty(PROP_NATS_URL);
    if (natsUrl != null && !natsUrl.isBlank()) {
      builder.natsUrl(natsUrl.trim());
    }
    String bootstrapServers = props.getProperty(PROP_KAFKA_BOOTSTRAP_SERVERS);
    if (bootstrapServers != null && !bootstrapServers.isBlank()) {
      builder.kafkaBootstrapServers(bootstrapServers.trim());
    }

    for (String name : props.stringPropertyNames()) {
      if (name.startsWith(PROP_KAFKA_PREFIX) && !name.equals(PROP_KAFKA_BOOTSTRAP_SERVERS)) {
        // kafka.security.protocol -> security.protocol
        builder.kafkaProperty(name.substring(PROP_KAFKA_PREFIX.length()), props.getProperty(name));
      }
    }

    return builder.build();
  }

  /**
   * Address of the configured backend, for logs.
   */
  public String endpoint() {
    return switch (brokerType) {
      case MEMORY -> "in-memory";
      case REDIS -> redisHost + ":" + redisPort;
      case NATS -> natsUrl;
      case KAFKA -> kafkaBootstrapServers;
    };
  }

  public static class Builder {

    private BrokerType brokerType = BrokerType.REDIS;
    private String redisHost = DEFAULT_REDIS_HOST;
    private int redisPort = DEFAULT_REDIS_PORT;
    private String natsUrl = DEFAULT_NATS_URL;
    private String kafkaBootstrapServers = DEFAULT_KAFKA_BOOTSTRAP_SERVERS;
    private int connectTimeoutMs = DEFAULT_CONNECT_TIMEOUT_MS;
    private final Map<String, String> kafkaProperties = new HashMap<>();

    public Builder brokerType(BrokerType brokerType) {
      this.brokerType = Objects.requireNonNull(brokerType, "brokerType cannot be null");
      return this;
    }

    public Builder redisHost(String redisHost) {
      this.redisHost = Objects.requireNonNull(redisHost, "redisHost cannot be null");
      return this;
    }

    public Builder redisPort(int redisPort) {
      this.redisPort = redisPort;
      return this;
    }

    public Builder natsUrl(String natsUrl) {
      this.natsUrl = Objects.requireNonNull(natsUrl, "natsUrl cannot be null");
      return this;
    }

    public Builder kafkaBootstrapServers(String kafkaBootstrapServers) {
      this.kafkaBootstrapServers = Objects.requireNonNull(kafkaBootstrapServers,
        "kafkaBootstrapServers cannot be null");
      return this;
    }

    public Builder connectTimeoutMs(int connectTimeoutMs) {
      this.connectTimeoutMs = connectTimeoutMs;
      return this;
    }

    public Builder kafkaProperty(String key, String value) {
      this.kafkaProperties.put(key, value);
      return this;
    }

    public BrokerClientConfig build() {
      return new BrokerClientConfig(this);
    }
  }
}
