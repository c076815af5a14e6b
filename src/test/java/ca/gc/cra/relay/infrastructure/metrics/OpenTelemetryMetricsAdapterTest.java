package ca.gc.cra.relay.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import java.util.Collection;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterTest {
  private static final AttributeKey<String> STAGE_KIND = AttributeKey.stringKey("relay.stage.kind");

  private InMemoryMetricReader reader;
  private OpenTelemetryMetricsAdapter adapter;

  @BeforeEach
  void setUp() {
    reader = InMemoryMetricReader.create();
    adapter = new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.forTesting(reader));
  }

  @AfterEach
  void tearDown() {
    if (adapter != null) {
      adapter.close();
    }
  }

  @Test
  void incrementRecordsCounterTaggedWithStageKind() {
    adapter.increment("stage.fifo.processed");
    adapter.increment("stage.fifo.processed");
    adapter.increment("stage.fifo.processed");
    adapter.forceFlush();

    MetricData counter = find(reader.collectAllMetrics(), "stage.fifo.processed");
    assertEquals(MetricDataType.LONG_SUM, counter.getType());
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(3L, point.getValue());
    assertEquals("fifo", point.getAttributes().get(STAGE_KIND));

    assertEquals("relay", counter.getResource().getAttribute(AttributeKey.stringKey("service.name")));
    assertEquals("ca.gc.cra", counter.getResource().getAttribute(AttributeKey.stringKey("service.namespace")));
    String instance = counter.getResource().getAttribute(AttributeKey.stringKey("service.instance.id"));
    assertTrue(instance != null && !instance.isBlank(), "Service instance id should be provided");
  }

  @Test
  void observeRecordsHistogramSamples() {
    adapter.observe("stage.dynamic.inFlight", 1L);
    adapter.observe("stage.dynamic.inFlight", 2L);
    adapter.observe("stage.dynamic.inFlight", 2L);
    adapter.forceFlush();

    MetricData histogram = find(reader.collectAllMetrics(), "stage.dynamic.inFlight");
    assertEquals(MetricDataType.HISTOGRAM, histogram.getType());
    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(3L, point.getCount());
    assertEquals(5.0, point.getSum());
    assertEquals("dynamic", point.getAttributes().get(STAGE_KIND));
  }

  @Test
  void pipelineKeysCarryNoStageAttribute() {
    adapter.increment("pipeline.errors");
    adapter.forceFlush();

    MetricData counter = find(reader.collectAllMetrics(), "pipeline.errors");
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(1L, point.getValue());
    assertNull(point.getAttributes().get(STAGE_KIND));
    assertFalse(adapter.isNoop());
  }

  @Test
  void derivesStageKindFromKey() {
    assertEquals("broadcast", OpenTelemetryMetricsAdapter.attributesFor("stage.broadcast.replicas").get(STAGE_KIND));
    assertEquals("fixed", OpenTelemetryMetricsAdapter.attributesFor("stage.fixed").get(STAGE_KIND));
    assertTrue(OpenTelemetryMetricsAdapter.attributesFor("pipeline.items.sunk").isEmpty());
  }

  private static MetricData find(Collection<MetricData> metrics, String name) {
    Optional<MetricData> match = metrics.stream()
        .filter(metric -> metric.getName().equalsIgnoreCase(name))
        .findFirst();
    assertTrue(match.isPresent(), "Expected metric " + name + " to be exported");
    return match.orElseThrow();
  }
}
