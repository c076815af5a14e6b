package ca.gc.cra.relay.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Adjusts RELAY logging verbosity at runtime.
 * <p><strong>Why:</strong> Lets operators trace stage lifecycles ({@code logging.verbose=true}) without editing
 * {@code logback.xml}.</p>
 * <p><strong>Thread-safety:</strong> Intended for single-threaded startup.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings fall back to a warning and retain defaults.
 * @since 0.1.0
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);
  private static final String RELAY_LOGGER = "ca.gc.cra.relay";

  private static Level baseline;
  private static boolean baselineCaptured;

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Elevates the {@code ca.gc.cra.relay} logger to DEBUG within the running JVM.
   *
   * @return {@code true} when the level was applied; {@code false} when the backend does not support it
   */
  public static synchronized boolean enableVerboseLogging() {
    Logger relay = relayLogger();
    if (relay == null) {
      return false;
    }
    if (!baselineCaptured) {
      baseline = relay.getLevel();
      baselineCaptured = true;
    }
    relay.setLevel(Level.DEBUG);
    return true;
  }

  /**
   * Restores the {@code ca.gc.cra.relay} logger to the level it had before verbose logging was first enabled.
   *
   * @return {@code true} when the level was reset
   */
  public static synchronized boolean resetVerboseLogging() {
    Logger relay = relayLogger();
    if (relay == null) {
      return false;
    }
    if (baselineCaptured) {
      relay.setLevel(baseline);
    }
    return true;
  }

  private static Logger relayLogger() {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      return context.getLogger(RELAY_LOGGER);
    }
    log.warn("Verbose logging requested but backend {} does not support dynamic level updates",
        factory.getClass().getName());
    return null;
  }
}
