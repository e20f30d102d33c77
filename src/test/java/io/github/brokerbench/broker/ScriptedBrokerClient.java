package io.github.brokerbench.broker;

import io.github.brokerbench.protocol.MessageKind;
import io.github.brokerbench.protocol.SentinelProtocol;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Test double: counts what is published and hands scripted batches to the subscriber, one batch
 * per {@link #processMessages} call.
 */
public class ScriptedBrokerClient implements BrokerClient {

  private final boolean connectSucceeds;
  private final int failEveryNth;
  private final List<String> sentinels = Collections.synchronizedList(new ArrayList<>());
  private final AtomicLong payloadPublished = new AtomicLong();
  private final Deque<List<String>> script = new ArrayDeque<>();
  private final AtomicInteger publishCalls = new AtomicInteger();
  private final AtomicInteger flushes = new AtomicInteger();

  private Runnable onPoll = () -> {};
  private Consumer<String> callback;
  private volatile boolean connected;
  private volatile boolean disconnected;
  private int polls;

  public ScriptedBrokerClient() {
    this(true, 0);
  }

  /**
   * @param connectSucceeds result of {@link #connect()}
   * @param failEveryNth every n-th publish returns false, 0 never fails
   */
  public ScriptedBrokerClient(boolean connectSucceeds, int failEveryNth) {
    this.connectSucceeds = connectSucceeds;
    this.failEveryNth = failEveryNth;
  }

  public ScriptedBrokerClient deliver(String... messages) {
    script.add(List.of(messages));
    return this;
  }

  /**
   * Runs after every {@link #processMessages} call, e.g. to advance a fake clock.
   */
  public ScriptedBrokerClient onPoll(Runnable hook) {
    this.onPoll = hook;
    return this;
  }

  @Override
  public boolean connect() {
    connected = connectSucceeds;
    return connectSucceeds;
  }

  @Override
  public boolean publish(String channel, String message) {
    if (!connected) {
      return false;
    }
    int call = publishCalls.incrementAndGet();
    if (failEveryNth > 0 && call % failEveryNth == 0) {
      return false;
    }
    if (SentinelProtocol.classify(message) == MessageKind.PAYLOAD) {
      payloadPublished.incrementAndGet();
    } else {
      sentinels.add(message);
    }
    return true;
  }

  @Override
  public void flush() {
    flushes.incrementAndGet();
  }

  @Override
  public boolean subscribe(String channel, Consumer<String> onMessage) {
    if (!connected) {
      return false;
    }
    callback = onMessage;
    return true;
  }

  @Override
  public void processMessages(Duration timeoutBudget) {
    polls++;
    List<String> batch = script.poll();
    if (batch != null && callback != null) {
      batch.forEach(callback);
    }
    onPoll.run();
  }

  @Override
  public void disconnect() {
    connected = false;
    disconnected = true;
  }

  @Override
  public boolean isConnected() {
    return connected;
  }

  @Override
  public String name() {
    return "Scripted";
  }

  /**
   * @return sentinels successfully published, in order
   */
  public List<String> sentinelsPublished() {
    synchronized (sentinels) {
      return List.copyOf(sentinels);
    }
  }

  public long payloadPublished() {
    return payloadPublished.get();
  }

  public int flushes() {
    return flushes.get();
  }

  public int polls() {
    return polls;
  }

  public boolean wasDisconnected() {
    return disconnected;
  }
}
