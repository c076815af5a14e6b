package ca.gc.cra.relay.config;

import ca.gc.cra.relay.application.pipeline.Pipeline;
import ca.gc.cra.relay.application.port.MetricsPort;
import ca.gc.cra.relay.application.port.Stage;
import ca.gc.cra.relay.application.port.Transform;
import ca.gc.cra.relay.application.stage.Stages;
import ca.gc.cra.relay.logging.LoggingConfigurator;
import ca.gc.cra.relay.validation.Numbers;
import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Validated pipeline settings.
 * <p><strong>Role:</strong> Bridges YAML configuration to {@link Pipeline.Builder} and the {@link Stages}
 * factory.</p>
 * <p><strong>Thread-safety:</strong> Record is immutable.</p>
 *
 * <p>Recognized keys: {@code feed.capacity}, {@code pool.workers}, {@code pool.maxInFlight},
 * {@code pipeline.failurePolicy}, {@code logging.verbose}. {@code metrics.*} keys are kept in {@link #raw()} for the
 * metrics adapter; other keys are ignored with a debug log.</p>
 *
 * @param feedCapacity buffered items per inter-stage feed
 * @param poolWorkers replica count for fixed pools
 * @param poolMaxInFlight ceiling for dynamic pools
 * @param failurePolicy driver reaction to failures
 * @param verboseLogging whether RELAY loggers run at DEBUG
 * @param raw flattened source settings
 * @since 0.1.0
 */
public record PipelineConfig(
    int feedCapacity,
    int poolWorkers,
    int poolMaxInFlight,
    Pipeline.FailurePolicy failurePolicy,
    boolean verboseLogging,
    Map<String, String> raw) {
  private static final Logger log = LoggerFactory.getLogger(PipelineConfig.class);

  private static final int PROCESSORS = Math.max(1, Runtime.getRuntime().availableProcessors());
  static final int MAX_FEED_CAPACITY = 65_536;
  static final int MAX_POOL_WORKERS = 1_024;
  static final int MAX_IN_FLIGHT = 4_096;

  /**
   * Validates the settings.
   *
   * @param feedCapacity buffered items per inter-stage feed
   * @param poolWorkers replica count for fixed pools
   * @param poolMaxInFlight ceiling for dynamic pools
   * @param failurePolicy driver reaction to failures
   * @param verboseLogging whether RELAY loggers run at DEBUG
   * @param raw flattened source settings
   */
  public PipelineConfig {
    Numbers.requireRange("feed.capacity", feedCapacity, 1, MAX_FEED_CAPACITY);
    Numbers.requireRange("pool.workers", poolWorkers, 1, MAX_POOL_WORKERS);
    Numbers.requireRange("pool.maxInFlight", poolMaxInFlight, 1, MAX_IN_FLIGHT);
    Objects.requireNonNull(failurePolicy, "failurePolicy");
    raw = Map.copyOf(Objects.requireNonNullElse(raw, Map.of()));
  }

  /**
   * Returns the defaults used when no configuration is supplied.
   *
   * @return default settings
   */
  public static PipelineConfig defaults() {
    return new PipelineConfig(
        Pipeline.DEFAULT_FEED_CAPACITY,
        Math.min(PROCESSORS, MAX_POOL_WORKERS),
        Math.min(PROCESSORS * 2, MAX_IN_FLIGHT),
        Pipeline.FailurePolicy.CONTINUE,
        false,
        Map.of());
  }

  /**
   * Builds settings from a flattened map, falling back to {@link #defaults()} for absent keys.
   *
   * @param settings flattened key/value settings
   * @return validated settings
   * @throws IllegalArgumentException if a value is malformed or out of range
   */
  public static PipelineConfig fromMap(Map<String, String> settings) {
    Objects.requireNonNull(settings, "settings");
    PipelineConfig defaults = defaults();
    Map<String, String> copy = new LinkedHashMap<>(settings);

    int feedCapacity = intSetting(copy, "feed.capacity", defaults.feedCapacity(), MAX_FEED_CAPACITY);
    int workers = intSetting(copy, "pool.workers", defaults.poolWorkers(), MAX_POOL_WORKERS);
    int maxInFlight = intSetting(copy, "pool.maxInFlight", defaults.poolMaxInFlight(), MAX_IN_FLIGHT);
    Pipeline.FailurePolicy policy = Pipeline.FailurePolicy.from(copy.get("pipeline.failurePolicy"));
    boolean verbose = parseBoolean("logging.verbose", copy.get("logging.verbose"));

    for (String key : copy.keySet()) {
      if (!isKnown(key)) {
        log.debug("Ignoring unrecognized pipeline setting {}", key);
      }
    }
    return new PipelineConfig(feedCapacity, workers, maxInFlight, policy, verbose, copy);
  }

  /**
   * Loads settings for {@code profile} from a YAML file; a missing file yields {@link #defaults()}.
   *
   * @param path YAML file location
   * @param profile profile section merged over {@code common}
   * @return validated settings
   * @throws IOException if the file exists but cannot be read
   * @throws IllegalArgumentException if the YAML or a value is invalid
   */
  public static PipelineConfig load(Path path, String profile) throws IOException {
    return YamlSettings.read(path, profile)
        .map(PipelineConfig::fromMap)
        .orElseGet(() -> {
          log.info("No pipeline configuration at {}; using defaults", path);
          return defaults();
        });
  }

  /**
   * Copies feed capacity and failure policy into a pipeline builder, and applies the logging level.
   *
   * @param builder pipeline builder to configure
   * @return the same builder
   */
  public Pipeline.Builder applyTo(Pipeline.Builder builder) {
    Objects.requireNonNull(builder, "builder");
    if (verboseLogging) {
      LoggingConfigurator.enableVerboseLogging();
    }
    return builder.feedCapacity(feedCapacity).failurePolicy(failurePolicy);
  }

  /**
   * Builds a fixed pool sized by {@code pool.workers}.
   *
   * @param transform per-item logic
   * @param metrics metrics sink
   * @return fixed pool stage
   */
  public Stage fixedPool(Transform transform, MetricsPort metrics) {
    return Stages.fixedPool(transform, poolWorkers, metrics);
  }

  /**
   * Builds a dynamic pool bounded by {@code pool.maxInFlight}.
   *
   * @param transform per-item logic
   * @param metrics metrics sink
   * @return dynamic pool stage
   */
  public Stage dynamicPool(Transform transform, MetricsPort metrics) {
    return Stages.dynamicPool(transform, poolMaxInFlight, metrics);
  }

  private static int intSetting(Map<String, String> settings, String key, int fallback, int max) {
    String raw = settings.get(key);
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    return Numbers.parseIntInRange(key, raw, 1, max);
  }

  private static boolean parseBoolean(String key, String raw) {
    if (raw == null || raw.isBlank()) {
      return false;
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "true", "yes", "on" -> true;
      case "false", "no", "off" -> false;
      default -> throw new IllegalArgumentException(key + " must be a boolean (was '" + raw + "')");
    };
  }

  private static boolean isKnown(String key) {
    return switch (key) {
      case "feed.capacity", "pool.workers", "pool.maxInFlight", "pipeline.failurePolicy", "logging.verbose" -> true;
      default -> key.startsWith("metrics.");
    };
  }
}
