package ca.gc.cra.relay.logging;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

class LoggingConfiguratorTest {
  private final Logger relay = LoggerFactory.getLogger("ca.gc.cra.relay.application.stage.FifoStage");

  @AfterEach
  void reset() {
    LoggingConfigurator.resetVerboseLogging();
  }

  @Test
  void verboseLoggingTogglesDebugForRelayLoggers() {
    assertFalse(relay.isDebugEnabled());

    assertTrue(LoggingConfigurator.enableVerboseLogging());
    assertTrue(relay.isDebugEnabled());

    assertTrue(LoggingConfigurator.resetVerboseLogging());
    assertFalse(relay.isDebugEnabled());
    assertTrue(relay.isInfoEnabled());
  }
}
