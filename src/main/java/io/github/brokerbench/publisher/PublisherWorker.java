package io.github.brokerbench.publisher;

import io.github.brokerbench.broker.BrokerClient;
import io.github.brokerbench.protocol.MessageKind;
import io.github.brokerbench.protocol.SentinelProtocol;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One simulated publisher: owns its broker client, floods payload until the shared deadline.
 * Worker 0 is the leader and brackets the run with the sentinel pair.
 */
class PublisherWorker implements Callable<WorkerResult> {

  private static final Logger log = LoggerFactory.getLogger(PublisherWorker.class);

  private final int workerId;
  private final BrokerClient client;
  private final String channel;
  private final long deadlineNanos;
  private final long leaderWarmupMs;
  private final long drainTimeoutMs;
  private final CountDownLatch leaderStarted;
  private final CountDownLatch followersDrained;
  private final SentinelTimes sentinelTimes;
  private final LongSupplier nanoTime;

  PublisherWorker(
    int workerId,
    BrokerClient client,
    String channel,
    long deadlineNanos,
    long leaderWarmupMs,
    long drainTimeoutMs,
    CountDownLatch leaderStarted,
    CountDownLatch followersDrained,
    SentinelTimes sentinelTimes,
    LongSupplier nanoTime
  ) {
    this.workerId = workerId;
    this.client = client;
    this.channel = channel;
    this.deadlineNanos = deadlineNanos;
    this.leaderWarmupMs = leaderWarmupMs;
    this.drainTimeoutMs = drainTimeoutMs;
    this.leaderStarted = leaderStarted;
    this.followersDrained = followersDrained;
    this.sentinelTimes = sentinelTimes;
    this.nanoTime = nanoTime;
  }

  boolean isLeader() {
    return workerId == 0;
  }

  @Override
  public WorkerResult call() {
    try {
      if (!client.connect()) {
        if (isLeader()) {
          log.error("Leader publisher failed to connect to {}: no sentinels will be emitted", client.name());
        } else {
          log.error("Publisher {} failed to connect to {}, continuing without it", workerId, client.name());
        }
        return WorkerResult.connectFailed(workerId);
      }
      return publish();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Publisher {} interrupted", workerId);
      return new WorkerResult(workerId, true, 0, 0);
    } finally {
      // Release whoever waits on this worker, whatever happened to it
      if (isLeader()) {
        leaderStarted.countDown();
      } else {
        followersDrained.countDown();
      }
      client.disconnect();
    }
  }

  private WorkerResult publish() throws InterruptedException {
    if (isLeader()) {
      emitSentinel(MessageKind.START);
      sentinelTimes.markStart(nanoTime.getAsLong());
      if (leaderWarmupMs > 0) {
        Thread.sleep(leaderWarmupMs);
      }
      leaderStarted.countDown();
    } else {
      awaitLeader();
    }

    long published = 0;
    long failed = 0;
    long sequence = 0;
    while (nanoTime.getAsLong() < deadlineNanos) {
      if (client.publish(channel, SentinelProtocol.payload(workerId, sequence++))) {
        published++;
      } else {
        failed++;
      }
    }
    client.flush();
    log.debug("Publisher {} drained: published={}, failed={}", workerId, published, failed);

    if (isLeader()) {
      if (!followersDrained.await(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
        log.warn("{} publishers still draining after {}ms, sending END_BENCHMARK anyway",
          followersDrained.getCount(), drainTimeoutMs);
      }
      emitSentinel(MessageKind.END);
      sentinelTimes.markEnd(nanoTime.getAsLong());
    }

    return new WorkerResult(workerId, true, published, failed);
  }

  private void awaitLeader() throws InterruptedException {
    long remainingNanos = deadlineNanos - nanoTime.getAsLong();
    if (remainingNanos > 0 && !leaderStarted.await(remainingNanos, TimeUnit.NANOSECONDS)) {
      log.warn("Publisher {} saw no START_BENCHMARK from the leader before the deadline", workerId);
    }
  }

  private void emitSentinel(MessageKind kind) {
    String sentinel = SentinelProtocol.sentinel(kind);
    if (client.publish(channel, sentinel)) {
      log.info("Sent {} on {}", sentinel, channel);
    } else {
      log.error("Failed to publish {} on {}", sentinel, channel);
    }
    client.flush();
  }
}
