package io.github.brokerbench.model;

import io.github.brokerbench.config.AppConfig;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.LocalDateTime;
import java.util.Map;

/**
 * Environment-supplied metadata attached to every persisted result.
 *
 * @param batchId groups the records of one benchmark run
 * @param brokerType backend under test
 * @param host host name of the reporting process
 * @param timestamp local time of the report, yyyyMMdd'T'HHmmss
 */
public record RunMetadata(
  String batchId,
  String brokerType,
  String host,
  String timestamp
) {

  /**
   * Builds metadata for a report happening now.
   *
   * @param batchId the configured batch ID
   * @param brokerType the backend name
   * @return metadata with host from HOSTNAME (or the local host name) and the current timestamp
   */
  public static RunMetadata now(String batchId, String brokerType) {
    return new RunMetadata(batchId, brokerType, resolveHost(System.getenv()),
      LocalDateTime.now().format(AppConfig.TIMESTAMP_FORMAT));
  }

  static String resolveHost(Map<String, String> env) {
    String hostname = env.get("HOSTNAME");
    if (hostname != null && !hostname.isBlank()) {
      return hostname;
    }
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException e) {
      return "unknown-host";
    }
  }
}
