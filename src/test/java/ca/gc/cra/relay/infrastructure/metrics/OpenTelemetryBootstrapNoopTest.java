package ca.gc.cra.relay.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.Test;

class OpenTelemetryBootstrapNoopTest {

  @Test
  void exporterNoneFallsBackToNoop() {
    OpenTelemetryBootstrap.BootstrapResult result =
        OpenTelemetryBootstrap.initialize(Map.of("metrics.exporter", "none"));
    assertTrue(result.isNoop(), "Expected noop metrics bootstrap when exporter=none");
    result.close();
  }

  @Test
  void unknownExporterIsTreatedAsNone() {
    assertEquals(OpenTelemetryBootstrap.ExporterMode.NONE, OpenTelemetryBootstrap.ExporterMode.from("prometheus"));
    assertEquals(OpenTelemetryBootstrap.ExporterMode.OTLP, OpenTelemetryBootstrap.ExporterMode.from(" OTLP "));
  }

  @Test
  void noopAdapterAcceptsRecordings() {
    try (OpenTelemetryMetricsAdapter adapter = new OpenTelemetryMetricsAdapter(Map.of("metrics.exporter", "none"))) {
      adapter.increment("pipeline.items.sourced");
      adapter.observe("stage.fixed.replicas", 4);
      assertTrue(adapter.isNoop());
    }
  }
}
