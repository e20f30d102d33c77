package io.github.brokerbench.subscriber;

import io.github.brokerbench.broker.BrokerClient;
import io.github.brokerbench.config.BenchmarkConfig;
import io.github.brokerbench.model.RunOutcome;
import io.github.brokerbench.model.RunStats;
import io.github.brokerbench.protocol.SentinelProtocol;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.LongSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Measures one subscriber's view of a benchmark run.
 *
 * <p>The window opens on the first START_BENCHMARK and closes on the first END_BENCHMARK that
 * follows it. If START never arrives within the start grace period the window is closed as a
 * zero-length {@link RunOutcome#START_TIMEOUT}; if END never arrives within the publish duration
 * plus the run margin the window is closed at that moment as a {@link RunOutcome#RUN_TIMEOUT}.
 * The result is handed to the reporter exactly once.
 */
public class SubscriberDriver {

  private static final Logger log = LoggerFactory.getLogger(SubscriberDriver.class);

  private final BrokerClient client;
  private final BenchmarkConfig config;
  private final LongSupplier nanoTime;
  private final RunWindow window = new RunWindow();
  private final AtomicBoolean reported = new AtomicBoolean();

  private volatile boolean subscribed;
  private long subscribedAtNanos;

  public SubscriberDriver(BrokerClient client, BenchmarkConfig config) {
    this(client, config, System::nanoTime);
  }

  SubscriberDriver(BrokerClient client, BenchmarkConfig config, LongSupplier nanoTime) {
    this.client = Objects.requireNonNull(client, "client cannot be null");
    this.config = Objects.requireNonNull(config, "config cannot be null");
    this.nanoTime = Objects.requireNonNull(nanoTime, "nanoTime cannot be null");
  }

  /**
   * Connects if needed and subscribes to the benchmark channel. The start grace period is
   * measured from a successful call.
   *
   * @return false if the broker is unreachable or refused the subscription
   */
  public boolean subscribe() {
    if (subscribed) {
      return true;
    }
    if (!client.isConnected() && !client.connect()) {
      log.error("Subscriber could not connect to {}", client.name());
      return false;
    }
    if (!client.subscribe(config.channelName(), this::onMessage)) {
      log.error("Subscriber could not subscribe to {} on {}", config.channelName(), client.name());
      return false;
    }
    subscribedAtNanos = nanoTime.getAsLong();
    subscribed = true;
    log.info("Subscribed to {} on {}, waiting for {}",
      config.channelName(), client.name(), SentinelProtocol.START_BENCHMARK);
    return true;
  }

  /**
   * Handles one delivered message.
   */
  void onMessage(String raw) {
    switch (SentinelProtocol.classify(raw)) {
      case START -> {
        if (window.markStart(nanoTime.getAsLong())) {
          log.info("Benchmark started");
        } else {
          log.debug("Ignoring repeated {}", raw);
        }
      }
      case END -> {
        if (window.markEnd(nanoTime.getAsLong())) {
          log.info("Benchmark ended after {} messages", window.received());
        } else if (!window.isStarted()) {
          log.warn("{} received before {}, ignoring", raw, SentinelProtocol.START_BENCHMARK);
        } else {
          log.debug("Ignoring repeated {}", raw);
        }
      }
      case PAYLOAD -> window.recordPayload();
    }
  }

  /**
   * Processes deliveries for at most one poll budget, then applies the timeouts. Once the window
   * is closed, deliveries are still drained but no longer counted.
   *
   * @return the state after this poll
   * @throws IllegalStateException if {@link #subscribe()} has not succeeded
   */
  public SubscriberState pollOnce() {
    if (!subscribed) {
      throw new IllegalStateException("Not subscribed");
    }
    client.processMessages(config.pollTimeout());
    if (!window.isClosed()) {
      checkTimeouts(nanoTime.getAsLong());
    }
    return window.state();
  }

  /**
   * Polls until the window is closed. Termination is guaranteed by the timeouts.
   *
   * @throws InterruptedException if the calling thread is interrupted between polls
   */
  public RunStats runUntilFinalized() throws InterruptedException {
    while (pollOnce() != SubscriberState.FINALIZED) {
      if (Thread.currentThread().isInterrupted()) {
        throw new InterruptedException("Subscriber interrupted while measuring");
      }
    }
    return window.toStats();
  }

  /**
   * Hands the final statistics to {@code reporter} if the window is closed and nothing has been
   * reported yet.
   *
   * @return true if this call reported
   */
  public boolean reportOnce(Consumer<RunStats> reporter) {
    if (!window.isClosed() || !reported.compareAndSet(false, true)) {
      return false;
    }
    reporter.accept(window.toStats());
    return true;
  }

  public Optional<RunStats> result() {
    return window.isClosed() ? Optional.of(window.toStats()) : Optional.empty();
  }

  public SubscriberState state() {
    return window.state();
  }

  public boolean isSubscribed() {
    return subscribed;
  }

  public boolean isReported() {
    return reported.get();
  }

  /**
   * @return payload counted so far, also while measuring
   */
  public long liveMessages() {
    return window.received();
  }

  public String brokerName() {
    return client.name();
  }

  public boolean isBrokerConnected() {
    return client.isConnected();
  }

  public void close() {
    client.disconnect();
    subscribed = false;
  }

  private void checkTimeouts(long now) {
    if (!window.isStarted()) {
      long waitedMs = (now - subscribedAtNanos) / 1_000_000;
      if (waitedMs >= config.startGracePeriodMs()
          && window.forceClose(now, RunOutcome.START_TIMEOUT)) {
        log.warn("No {} within {}ms, finishing with zero messages",
          SentinelProtocol.START_BENCHMARK, config.startGracePeriodMs());
      }
      return;
    }
    long runningMs = (now - window.startNanos()) / 1_000_000;
    long limitMs = config.publishDuration().toMillis() + config.runTimeoutMarginMs();
    if (runningMs >= limitMs && window.forceClose(now, RunOutcome.RUN_TIMEOUT)) {
      log.warn("No {} within {}ms of start, closing window with {} messages",
        SentinelProtocol.END_BENCHMARK, limitMs, window.received());
    }
  }
}
