package ca.gc.cra.leap.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingConfiguratorTest {
  private Logger root;
  private Level original;

  @BeforeEach
  void captureLevel() {
    root = (Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
    original = root.getLevel();
  }

  @AfterEach
  void restoreLevel() {
    root.setLevel(original);
  }

  @Test
  void verboseLoggingRaisesRootToDebug() {
    root.setLevel(Level.WARN);

    assertTrue(LoggingConfigurator.enableVerboseLogging());

    assertEquals(Level.DEBUG, root.getLevel());
  }
}
