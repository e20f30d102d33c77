package io.github.brokerbench.model;

/**
 * Persisted publisher record.
 *
 * @param publisherId instance identifier
 * @param stats totals across workers
 * @param metadata batch, broker, host and timestamp
 */
public record PublisherResult(
  String publisherId,
  PublisherStats stats,
  RunMetadata metadata
) {}
