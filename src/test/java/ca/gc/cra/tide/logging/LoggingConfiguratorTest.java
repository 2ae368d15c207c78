package ca.gc.cra.tide.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingConfiguratorTest {
  private final Logger root = (Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);

  @AfterEach
  void reset() {
    LoggingConfigurator.resetLogging();
  }

  @Test
  void verboseSwitchesRootToDebugAndBack() {
    LoggingConfigurator.enableVerboseLogging();
    assertEquals(Level.DEBUG, root.getLevel());

    LoggingConfigurator.resetLogging();
    assertEquals(Level.INFO, root.getLevel());
  }
}
