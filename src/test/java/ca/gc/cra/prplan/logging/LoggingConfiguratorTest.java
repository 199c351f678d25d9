package ca.gc.cra.prplan.logging;

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
  private Level originalLevel;

  @BeforeEach
  void setUp() {
    root = (Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
    originalLevel = root.getLevel();
  }

  @AfterEach
  void tearDown() {
    root.setLevel(originalLevel);
  }

  @Test
  void verboseSwitchesRootToDebugAndResetRestoresInfo() {
    assertTrue(LoggingConfigurator.enableVerboseLogging());
    assertEquals(Level.DEBUG, root.getLevel());

    assertTrue(LoggingConfigurator.resetLogging());
    assertEquals(Level.INFO, root.getLevel());
  }
}
