package ca.gc.cra.leap.config;

import ca.gc.cra.leap.application.DispatchSettings;
import ca.gc.cra.leap.infrastructure.leap.libleap.JnrLeapService;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;

/**
 * <strong>What:</strong> Effective bridge configuration.
 * <p><strong>Why:</strong> Collects the few runtime knobs (native library, failure policy, metrics, verbosity) in one
 * validated value.</p>
 * <p><strong>Role:</strong> Input to {@link CompositionRoot}.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * <p>Precedence is system property {@code leap.<key>} &gt; YAML &gt; defaults.</p>
 *
 * @param nativeLibrary shim library name loaded through JNR ({@code native.library})
 * @param failureExitCode halt status used when a listener fails ({@code dispatch.failureExitCode})
 * @param metricPrefix prefix for dispatch metrics ({@code dispatch.metricPrefix})
 * @param metricsEnabled whether to export metrics through OpenTelemetry ({@code metrics.enabled})
 * @param verboseLogging whether to raise the root logger to DEBUG ({@code logging.verbose})
 * @since 0.1.0
 */
public record LeapConfig(
    String nativeLibrary,
    int failureExitCode,
    String metricPrefix,
    boolean metricsEnabled,
    boolean verboseLogging) {

  static final String SYSTEM_PROPERTY_PREFIX = "leap.";

  /** Default key/value pairs. */
  public static final Map<String, String> DEFAULTS = Map.of(
      "native.library", JnrLeapService.DEFAULT_LIBRARY,
      "dispatch.failureExitCode", Integer.toString(DispatchSettings.DEFAULT_FAILURE_EXIT_CODE),
      "dispatch.metricPrefix", DispatchSettings.DEFAULT_METRIC_PREFIX,
      "metrics.enabled", "false",
      "logging.verbose", "false");

  public LeapConfig {
    if (nativeLibrary == null || nativeLibrary.isBlank()) {
      throw new IllegalArgumentException("native.library must not be blank");
    }
    if (failureExitCode < 0 || failureExitCode > 255) {
      throw new IllegalArgumentException("dispatch.failureExitCode must be between 0 and 255");
    }
    if (metricPrefix == null || metricPrefix.isBlank()) {
      throw new IllegalArgumentException("dispatch.metricPrefix must not be blank");
    }
  }

  /**
   * Returns the configuration with every key at its default.
   *
   * @return default configuration
   */
  public static LeapConfig defaults() {
    return fromMap(Map.of(), new Properties());
  }

  /**
   * Builds the effective configuration from YAML values, applying JVM system property overrides.
   *
   * @param yaml flattened YAML values, typically from {@link LeapConfigLoader}
   * @return effective configuration
   * @throws IllegalArgumentException when a value is malformed or out of range
   */
  public static LeapConfig fromMap(Map<String, String> yaml) {
    return fromMap(yaml, System.getProperties());
  }

  static LeapConfig fromMap(Map<String, String> yaml, Properties overrides) {
    Objects.requireNonNull(yaml, "yaml");
    Objects.requireNonNull(overrides, "overrides");
    Map<String, String> merged = new LinkedHashMap<>(DEFAULTS);
    yaml.forEach((key, value) -> {
      if (value != null && !value.isBlank()) {
        merged.put(key, value.trim());
      }
    });
    for (String key : DEFAULTS.keySet()) {
      String override = overrides.getProperty(SYSTEM_PROPERTY_PREFIX + key);
      if (override != null && !override.isBlank()) {
        merged.put(key, override.trim());
      }
    }
    return new LeapConfig(
        merged.get("native.library"),
        parseInt(merged.get("dispatch.failureExitCode"), "dispatch.failureExitCode"),
        merged.get("dispatch.metricPrefix"),
        parseBoolean(merged.get("metrics.enabled"), "metrics.enabled"),
        parseBoolean(merged.get("logging.verbose"), "logging.verbose"));
  }

  private static int parseInt(String raw, String key) {
    try {
      return Integer.parseInt(raw);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be an integer: " + raw, ex);
    }
  }

  private static boolean parseBoolean(String raw, String key) {
    if ("true".equalsIgnoreCase(raw)) {
      return true;
    }
    if ("false".equalsIgnoreCase(raw)) {
      return false;
    }
    throw new IllegalArgumentException(key + " must be true or false: " + raw);
  }
}
