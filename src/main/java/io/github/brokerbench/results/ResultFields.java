package io.github.brokerbench.results;

/**
 * Field names of persisted result records.
 */
final class ResultFields {

  static final String BATCH_ID = "batch_id";
  static final String BROKER_TYPE = "broker_type";
  static final String ROLE = "role";
  static final String SUBSCRIBER_ID = "subscriber_id";
  static final String PUBLISHER_ID = "publisher_id";
  static final String HOST = "host";
  static final String TIMESTAMP = "timestamp";
  static final String MESSAGES_RECEIVED = "messages_received";
  static final String MESSAGES_PUBLISHED = "messages_published";
  static final String MESSAGES_FAILED = "messages_failed";
  static final String WORKERS = "workers";
  static final String WORKERS_FAILED = "workers_failed";
  static final String DURATION_US = "duration_us";
  static final String DURATION_MS = "duration_ms";
  static final String THROUGHPUT = "throughput_msg_per_sec";
  static final String OUTCOME = "outcome";

  static final String ROLE_SUBSCRIBER = "subscriber";
  static final String ROLE_PUBLISHER = "publisher";

  private ResultFields() {}
}
