package io.github.brokerbench.config;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Key/value configuration view: process environment layered on top of an optional
 * {@code .env}-style file. Environment variables win over file entries.
 */
public final class ConfigSource {

  private static final Logger log = LoggerFactory.getLogger(ConfigSource.class);

  static final String ENV_FILE_VARIABLE = "BENCH_ENV_FILE";
  private static final String DEFAULT_ENV_FILE = ".env";

  private final Map<String, String> values;

  private ConfigSource(Map<String, String> values) {
    this.values = Map.copyOf(values);
  }

  /**
   * Loads the {@code .env} file (path from BENCH_ENV_FILE, default ./.env) and overlays the
   * process environment.
   *
   * @return merged configuration source
   */
  public static ConfigSource load() {
    Map<String, String> env = System.getenv();
    Path envFile = Path.of(env.getOrDefault(ENV_FILE_VARIABLE, DEFAULT_ENV_FILE));
    return load(envFile, env);
  }

  /**
   * Loads the given env file (if readable) and overlays the given environment map.
   *
   * @param envFile path to a KEY=VALUE file, may not exist
   * @param environment variables taking precedence over the file
   * @return merged configuration source
   */
  public static ConfigSource load(Path envFile, Map<String, String> environment) {
    Map<String, String> merged = new HashMap<>(readEnvFile(envFile));
    merged.putAll(environment);
    return new ConfigSource(merged);
  }

  /**
   * Creates a source backed only by the given map (used in tests and embedded runs).
   */
  public static ConfigSource of(Map<String, String> values) {
    return new ConfigSource(Objects.requireNonNull(values, "values cannot be null"));
  }

  /**
   * Reads a {@code .env}-style file. Blank lines and lines starting with '#' are skipped;
   * lines without '=' or with an empty key or value are ignored.
   *
   * @param envFile the file to read
   * @return parsed entries, empty if the file is missing or unreadable
   */
  static Map<String, String> readEnvFile(Path envFile) {
    if (envFile == null || !Files.isRegularFile(envFile)) {
      log.debug("No env file at {}", envFile);
      return Map.of();
    }

    List<String> lines;
    try {
      lines = Files.readAllLines(envFile, StandardCharsets.UTF_8);
    } catch (IOException e) {
      log.warn("Could not read env file {}: {}", envFile, e.getMessage());
      return Map.of();
    }

    Map<String, String> entries = new HashMap<>();
    for (String line : lines) {
      if (line.isBlank() || line.startsWith("#")) {
        continue;
      }
      int separator = line.indexOf('=');
      if (separator < 0) {
        continue;
      }
      String key = line.substring(0, separator).trim();
      String value = line.substring(separator + 1).trim();
      if (!key.isEmpty() && !value.isEmpty()) {
        entries.put(key, value);
      }
    }

    log.info("Loaded {} entries from env file {}", entries.size(), envFile);
    return entries;
  }

  public String get(String name) {
    return values.get(name);
  }

  public String get(String name, String defaultValue) {
    String value = values.get(name);
    return (value == null || value.isBlank()) ? defaultValue : value;
  }

  public boolean has(String name) {
    return values.containsKey(name);
  }

  public int getInt(String name, int defaultValue) {
    String value = values.get(name);
    if (value != null && !value.isBlank()) {
      try {
        return Integer.parseInt(value.trim());
      } catch (NumberFormatException e) {
        log.warn("Invalid integer for {}: {}, using default: {}", name, value, defaultValue);
      }
    }
    return defaultValue;
  }

  public long getLong(String name, long defaultValue) {
    String value = values.get(name);
    if (value != null && !value.isBlank()) {
      try {
        return Long.parseLong(value.trim());
      } catch (NumberFormatException e) {
        log.warn("Invalid long for {}: {}, using default: {}", name, value, defaultValue);
      }
    }
    return defaultValue;
  }

  public boolean getBoolean(String name, boolean defaultValue) {
    String value = values.get(name);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return Boolean.parseBoolean(value.trim());
  }
}
