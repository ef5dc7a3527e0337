package ca.gc.cra.replay.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import java.time.Duration;
import java.util.Collection;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterTest {
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
  void incrementRecordsCounterWithKeyAttribute() {
    adapter.increment("publish.values");
    adapter.increment("publish.values");
    adapter.increment("publish.values");
    adapter.forceFlush();

    MetricData counter = find(reader.collectAllMetrics(), "publish.values");
    assertEquals(MetricDataType.LONG_SUM, counter.getType());
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(3L, point.getValue());
    assertEquals("publish.values", point.getAttributes().get(AttributeKey.stringKey("replay.metric.key")));

    assertEquals("replay", counter.getResource().getAttribute(AttributeKey.stringKey("service.name")));
    String instance = counter.getResource().getAttribute(AttributeKey.stringKey("service.instance.id"));
    assertTrue(instance != null && !instance.isBlank(), "Service instance id should be provided");
  }

  @Test
  void observeRecordsHistogram() {
    adapter.observe("load.samples", 120);
    adapter.observe("load.samples", 30);
    adapter.forceFlush();

    MetricData histogram = find(reader.collectAllMetrics(), "load.samples");
    assertEquals(MetricDataType.HISTOGRAM, histogram.getType());
    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(2L, point.getCount());
    assertEquals(150.0, point.getSum(), 0.0001);
  }

  @Test
  void sanitizeNameProducesValidInstrumentNames() {
    assertEquals("control.command.set_server", OpenTelemetryMetricsAdapter.sanitizeName("control.command.SET_SERVER"));
    assertEquals("m9lives", OpenTelemetryMetricsAdapter.sanitizeName("9lives"));
    assertEquals("a_b", OpenTelemetryMetricsAdapter.sanitizeName("a b"));
    assertEquals("replay.metric", OpenTelemetryMetricsAdapter.sanitizeName("  "));
  }

  @Test
  void disabledSettingsYieldNoopAdapter() {
    try (OpenTelemetryMetricsAdapter noop = new OpenTelemetryMetricsAdapter(MetricsSettings.disabled())) {
      noop.increment("anything");
      assertTrue(noop.isNoop());
    }
  }

  @Test
  void settingsRejectUnknownExporter() {
    assertThrows(IllegalArgumentException.class,
        () -> new MetricsSettings("prometheus", "", "", Duration.ofSeconds(5)));
    assertThrows(IllegalArgumentException.class,
        () -> new MetricsSettings("otlp", "", "", Duration.ZERO));
    assertEquals(MetricsSettings.DEFAULT_ENDPOINT,
        new MetricsSettings(null, " ", null, Duration.ofSeconds(1)).endpoint());
  }

  @Test
  void parseAttributesSkipsMalformedTokens() {
    Attributes attributes = OpenTelemetryBootstrap.parseAttributes("team=frc1234, broken, =x,site=field");

    assertEquals(2, attributes.size());
    assertEquals("frc1234", attributes.get(AttributeKey.stringKey("team")));
    assertEquals("field", attributes.get(AttributeKey.stringKey("site")));
  }

  private static MetricData find(Collection<MetricData> metrics, String name) {
    Optional<MetricData> match = metrics.stream().filter(m -> m.getName().equals(name)).findFirst();
    assertTrue(match.isPresent(), "Expected metric " + name + " to be exported");
    return match.orElseThrow();
  }
}
