package io.github.brokerbench.protocol;

/**
 * Closed set of message classes travelling on a benchmark channel.
 */
public enum MessageKind {
  /** Opens the measurement window. */
  START,
  /** Closes the measurement window. */
  END,
  /** Anything else; counted while the window is open. */
  PAYLOAD
}
