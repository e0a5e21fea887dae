package io.restfulobjects.e2e.config;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Centralises access to the environment variables that drive the objects API acceptance harness.
 */
public final class EnvironmentConfig {

  public static final String OBJECTS_API_BASE_URL = "OBJECTS_API_BASE_URL";
  public static final String OBJECTS_HTTP_TIMEOUT_SECONDS = "OBJECTS_HTTP_TIMEOUT_SECONDS";
  public static final String OBJECTS_E2E_ENABLED = "OBJECTS_E2E_ENABLED";
  public static final String OBJECTS_TESTDATA_DIR = "OBJECTS_TESTDATA_DIR";

  static final URI DEFAULT_BASE_URL = URI.create("https://api.restful-api.dev/");
  static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

  private EnvironmentConfig() {
  }

  /**
   * Reads the harness settings from the process environment.
   *
   * @return immutable settings with defaults applied
   * @throws IllegalStateException when a variable is present but invalid
   */
  public static HarnessSettings loadHarnessSettings() {
    return loadHarnessSettings(System.getenv());
  }

  /**
   * Reads the harness settings from the supplied variables.
   *
   * @param environment variable name to value
   * @return immutable settings with defaults applied
   */
  public static HarnessSettings loadHarnessSettings(Map<String, String> environment) {
    Objects.requireNonNull(environment, "environment");
    URI baseUrl = value(environment, OBJECTS_API_BASE_URL)
        .map(candidate -> toUri(OBJECTS_API_BASE_URL, candidate))
        .orElse(DEFAULT_BASE_URL);
    Duration timeout = value(environment, OBJECTS_HTTP_TIMEOUT_SECONDS)
        .map(EnvironmentConfig::parseTimeout)
        .orElse(DEFAULT_TIMEOUT);
    boolean enabled = value(environment, OBJECTS_E2E_ENABLED)
        .map(EnvironmentConfig::parseFlag)
        .orElse(false);
    Optional<Path> testDataDir = value(environment, OBJECTS_TESTDATA_DIR).map(Path::of);
    return new HarnessSettings(baseUrl, timeout, enabled, testDataDir);
  }

  private static Optional<String> value(Map<String, String> environment, String variable) {
    return Optional.ofNullable(environment.get(variable))
        .map(String::trim)
        .filter(value -> !value.isEmpty());
  }

  private static URI toUri(String variable, String candidate) {
    URI uri;
    try {
      uri = URI.create(candidate);
    } catch (IllegalArgumentException ex) {
      throw new IllegalStateException("Invalid URI configured for " + variable + ": " + candidate, ex);
    }
    if (uri.getScheme() == null || uri.getHost() == null) {
      throw new IllegalStateException("Expected an absolute http(s) URI for " + variable + " but was " + candidate);
    }
    return uri;
  }

  private static Duration parseTimeout(String value) {
    try {
      long seconds = Long.parseLong(value);
      if (seconds <= 0) {
        throw new IllegalStateException(OBJECTS_HTTP_TIMEOUT_SECONDS + " must be positive but was " + value);
      }
      return Duration.ofSeconds(seconds);
    } catch (NumberFormatException ex) {
      throw new IllegalStateException("Invalid " + OBJECTS_HTTP_TIMEOUT_SECONDS + " configured: " + value, ex);
    }
  }

  private static boolean parseFlag(String value) {
    return switch (value.toLowerCase(Locale.ROOT)) {
      case "true", "yes", "1" -> true;
      case "false", "no", "0" -> false;
      default -> throw new IllegalStateException("Invalid " + OBJECTS_E2E_ENABLED + " flag: " + value);
    };
  }

  /**
   * Immutable projection of the settings used across the harness.
   */
  public record HarnessSettings(URI baseUrl,
                                Duration httpTimeout,
                                boolean liveTestsEnabled,
                                Optional<Path> testDataDirectory) {

    public HarnessSettings {
      baseUrl = Objects.requireNonNull(baseUrl, "baseUrl");
      httpTimeout = Objects.requireNonNull(httpTimeout, "httpTimeout");
      testDataDirectory = testDataDirectory == null ? Optional.empty() : testDataDirectory;
    }

    /**
     * Converts the settings into a simple map for logging or reporting purposes.
     */
    public Map<String, String> asMap() {
      return Map.of(
          "baseUrl", baseUrl.toString(),
          "httpTimeout", httpTimeout.toString(),
          "liveTestsEnabled", Boolean.toString(liveTestsEnabled),
          "testDataDirectory", testDataDirectory.map(Path::toString).orElse("<classpath>")
      );
    }
  }
}
