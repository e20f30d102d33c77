package io.github.brokerbench.config;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-level configuration: which role to run and where results go.
 *
 * @param role publisher, subscriber or aggregate
 * @param httpPort HTTP port of the subscriber service
 * @param instanceId identifier written into result records (SUBSCRIBER_ID / PUBLISHER_ID)
 * @param resultsDir root directory for result files
 * @param batchId batch directory name under resultsDir
 */
public record AppConfig(
  String role,
  int httpPort,
  String instanceId,
  Path resultsDir,
  String batchId
) {
  private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

  public static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss");

  private static final String DEFAULT_ROLE = "subscriber";
  private static final int DEFAULT_HTTP_PORT = 8888;
  private static final String DEFAULT_RESULTS_DIR = "/data";

  /**
   * Loads configuration from the given source with defaults.
   *
   * @param source configuration source
   * @param roleOverride role from the command line, takes precedence over BENCH_ROLE (may be null)
   * @return AppConfig instance
   */
  public static AppConfig fromSource(ConfigSource source, String roleOverride) {
    String role = (roleOverride != null && !roleOverride.isBlank())
      ? roleOverride
      : source.get("BENCH_ROLE", DEFAULT_ROLE);
    role = role.toLowerCase();

    int port = source.getInt("HTTP_PORT", DEFAULT_HTTP_PORT);
    String instanceId = "publisher".equals(role)
      ? source.get("PUBLISHER_ID", "publisher_1")
      : source.get("SUBSCRIBER_ID", "subscriber_1");
    Path resultsDir = Path.of(source.get("RESULTS_DIR", DEFAULT_RESULTS_DIR));
    String batchId = source.get("BATCH_ID", LocalDateTime.now().format(TIMESTAMP_FORMAT));

    log.info("AppConfig loaded: role={}, httpPort={}, instanceId={}, resultsDir={}, batchId={}",
      role, port, instanceId, resultsDir, batchId);
    return new AppConfig(role, port, instanceId, resultsDir, batchId);
  }
}
