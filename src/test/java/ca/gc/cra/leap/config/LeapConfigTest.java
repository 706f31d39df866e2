package ca.gc.cra.leap.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import java.util.Properties;
import org.junit.jupiter.api.Test;

class LeapConfigTest {

  @Test
  void defaultsMatchDocumentedValues() {
    LeapConfig config = LeapConfig.defaults();

    assertEquals("LeapShim", config.nativeLibrary());
    assertEquals(134, config.failureExitCode());
    assertEquals("leap.dispatch", config.metricPrefix());
    assertFalse(config.metricsEnabled());
    assertFalse(config.verboseLogging());
  }

  @Test
  void systemPropertiesOverrideYamlWhichOverridesDefaults() {
    Properties overrides = new Properties();
    overrides.setProperty("leap.dispatch.failureExitCode", "99");

    LeapConfig config = LeapConfig.fromMap(
        Map.of("dispatch.failureExitCode", "70", "logging.verbose", "TRUE", "native.library", "CustomShim"),
        overrides);

    assertEquals(99, config.failureExitCode());
    assertTrue(config.verboseLogging());
    assertEquals("CustomShim", config.nativeLibrary());
  }

  @Test
  void malformedValuesAreRejected() {
    Properties none = new Properties();

    assertThrows(IllegalArgumentException.class,
        () -> LeapConfig.fromMap(Map.of("dispatch.failureExitCode", "abort"), none));
    assertThrows(IllegalArgumentException.class,
        () -> LeapConfig.fromMap(Map.of("dispatch.failureExitCode", "300"), none));
    assertThrows(IllegalArgumentException.class,
        () -> LeapConfig.fromMap(Map.of("metrics.enabled", "yes"), none));
  }
}
