package io.github.brokerbench.broker;

import java.time.Duration;
import java.util.function.Consumer;

/**
 * Capability interface implemented once per broker backend.
 *
 * <p>Instances are not thread-safe: concurrent publishing workers must each own their own
 * client. Backend exceptions never escape {@link #connect()}, {@link #publish(String, String)}
 * or {@link #subscribe(String, Consumer)}; they are logged and reported as {@code false}.
 */
public interface BrokerClient {

  /**
   * Establishes a session with the broker.
   *
   * @return true if connected, false if the broker could not be reached
   */
  boolean connect();

  /**
   * Best-effort send of one message.
   *
   * @param channel the channel name
   * @param message the message body
   * @return true if the message was handed to the transport, false on failure
   */
  boolean publish(String channel, String message);

  /**
   * Blocks until every previously issued publish has been transmitted (not necessarily delivered).
   * Mandatory right after a sentinel publish.
   */
  void flush();

  /**
   * Registers a callback invoked once per message received on the channel. Registering again on
   * the same channel replaces the callback. Callbacks run on the thread calling
   * {@link #processMessages(Duration)}.
   *
   * @param channel the channel name
   * @param onMessage callback receiving the raw message body
   * @return true if the subscription is active
   */
  boolean subscribe(String channel, Consumer<String> onMessage);

  /**
   * Delivers zero or more pending messages to the registered callbacks, returning once the budget
   * elapses or nothing more is immediately available.
   *
   * @param timeoutBudget maximum time to wait for the first message
   */
  void processMessages(Duration timeoutBudget);

  /**
   * Releases the session. Safe to call multiple times.
   */
  void disconnect();

  /**
   * @return true while a session is established
   */
  boolean isConnected();

  /**
   * @return human-readable backend name
   */
  String name();
}
