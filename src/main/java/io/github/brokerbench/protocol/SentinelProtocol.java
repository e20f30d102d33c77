package io.github.brokerbench.protocol;

/**
 * In-band control messages demarcating a benchmark window on a shared channel.
 *
 * <p>The leader publisher emits {@link #START_BENCHMARK} before any payload and
 * {@link #END_BENCHMARK} after all payload, flushing right after each. Subscribers derive their
 * measurement window from the order in which the broker delivers them, so no clock
 * synchronization between processes is needed. Raw values are only ever compared here.
 */
public final class SentinelProtocol {

  public static final String START_BENCHMARK = "START_BENCHMARK";
  public static final String END_BENCHMARK = "END_BENCHMARK";

  private static final String PAYLOAD_PREFIX = "msg_";

  private SentinelProtocol() {}

  /**
   * Classifies a raw message.
   *
   * @param raw the message body as received (null is treated as payload)
   * @return START, END or PAYLOAD
   */
  public static MessageKind classify(String raw) {
    if (START_BENCHMARK.equals(raw)) {
      return MessageKind.START;
    }
    if (END_BENCHMARK.equals(raw)) {
      return MessageKind.END;
    }
    return MessageKind.PAYLOAD;
  }

  /**
   * @return the raw sentinel value for START or END
   * @throws IllegalArgumentException for PAYLOAD
   */
  public static String sentinel(MessageKind kind) {
    return switch (kind) {
      case START -> START_BENCHMARK;
      case END -> END_BENCHMARK;
      case PAYLOAD -> throw new IllegalArgumentException("PAYLOAD has no sentinel value");
    };
  }

  /**
   * Builds a uniquely identifiable payload, e.g. {@code msg_3_1042}. The content is diagnostic
   * only; subscribers never parse it.
   *
   * @param publisherId worker index
   * @param sequence per-worker, monotonically increasing sequence number
   */
  public static String payload(int publisherId, long sequence) {
    return PAYLOAD_PREFIX + publisherId + "_" + sequence;
  }
}
