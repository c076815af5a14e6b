package ca.gc.cra.relay.infrastructure.metrics;

import ca.gc.cra.relay.application.port.MetricsPort;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Metrics adapter that forwards RELAY stage counters and observations to OpenTelemetry.
 *
 * <p>Counters and histograms are created lazily per metric key and cached. Stage metrics are tagged with the
 * {@code relay.stage.kind} attribute derived from the key ({@code stage.dynamic.*} becomes {@code dynamic}).</p>
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);
  private static final AttributeKey<String> STAGE_KIND = AttributeKey.stringKey("relay.stage.kind");

  private final OpenTelemetryBootstrap.BootstrapResult bootstrap;
  private final Meter meter;
  private final ConcurrentMap<String, Instrument<LongCounter>> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Instrument<LongHistogram>> histograms = new ConcurrentHashMap<>();

  /**
   * Creates an adapter configured from flattened RELAY settings ({@code metrics.*} keys) and {@code OTEL_*}
   * environment variables.
   *
   * @param settings flattened configuration map
   */
  public OpenTelemetryMetricsAdapter(Map<String, String> settings) {
    this(OpenTelemetryBootstrap.initialize(settings));
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.BootstrapResult bootstrap) {
    this.bootstrap = Objects.requireNonNull(bootstrap, "bootstrap");
    this.meter = bootstrap.meter();
    if (bootstrap.isNoop()) {
      log.info("OpenTelemetry metrics adapter running in noop mode");
    }
  }

  @Override
  public void increment(String key) {
    Instrument<LongCounter> instrument = counters.computeIfAbsent(Objects.requireNonNull(key, "key"),
        name -> new Instrument<>(
            meter.counterBuilder(name).setUnit("1").setDescription("RELAY counter " + name).build(),
            attributesFor(name)));
    instrument.value().add(1, instrument.attributes());
  }

  @Override
  public void observe(String key, long value) {
    Instrument<LongHistogram> instrument = histograms.computeIfAbsent(Objects.requireNonNull(key, "key"),
        name -> new Instrument<>(
            meter.histogramBuilder(name).ofLongs().setDescription("RELAY observation " + name).build(),
            attributesFor(name)));
    instrument.value().record(value, instrument.attributes());
  }

  /**
   * Reports whether metrics are actually exported.
   *
   * @return {@code true} when the exporter is disabled
   */
  public boolean isNoop() {
    return bootstrap.isNoop();
  }

  void forceFlush() {
    bootstrap.forceFlush();
  }

  @Override
  public void close() {
    bootstrap.close();
  }

  static Attributes attributesFor(String key) {
    if (!key.startsWith("stage.")) {
      return Attributes.empty();
    }
    int end = key.indexOf('.', "stage.".length());
    String kind = end < 0 ? key.substring("stage.".length()) : key.substring("stage.".length(), end);
    return Attributes.of(STAGE_KIND, kind);
  }

  private record Instrument<T>(T value, Attributes attributes) {}
}
