package io.github.brokerbench.model;

/**
 * Persisted per-instance subscriber record.
 *
 * @param subscriberId instance identifier
 * @param stats finalized window statistics
 * @param metadata batch, broker, host and timestamp
 */
public record SubscriberResult(
  String subscriberId,
  RunStats stats,
  RunMetadata metadata
) {}
