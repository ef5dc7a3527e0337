package ca.gc.cra.replay.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;

class PublisherConfigTest {
  @Test
  void defaultsFromEmptyMap() {
    PublisherConfig config = PublisherConfig.fromMap(DefaultsForMode.asFlatMap("publish"));

    assertEquals(PublisherConfig.defaults(), config);
    assertEquals(20_000L, config.periodMicros());
    assertTrue(config.server().isEmpty());
  }

  @Test
  void parsesOverrides() {
    PublisherConfig config = PublisherConfig.fromMap(Map.of(
        "periodMillis", "10",
        "maxTimestampSeconds", "150.5",
        "sink", "none",
        "kafkaMaxBlockMs", "250",
        "server", "[::1]:5810",
        "metricsExporter", "NONE"));

    assertEquals(10, config.periodMillis());
    assertEquals(150.5, config.maxTimestampSeconds());
    assertEquals(SinkType.NONE, config.sinkType());
    assertEquals(250L, config.kafkaMaxBlockMs());
    assertEquals("::1", config.server().orElseThrow().host());
    assertEquals(5810, config.server().orElseThrow().port());
    assertEquals("none", config.telemetry().metricsExporter());
  }

  @Test
  void rejectsOutOfRangeValues() {
    assertThrows(IllegalArgumentException.class, () -> PublisherConfig.fromMap(Map.of("periodMillis", "0")));
    assertThrows(IllegalArgumentException.class,
        () -> PublisherConfig.fromMap(Map.of("maxTimestampSeconds", "-1")));
    assertThrows(IllegalArgumentException.class,
        () -> PublisherConfig.fromMap(Map.of("kafkaMaxBlockMs", "60001")));
    assertThrows(IllegalArgumentException.class, () -> PublisherConfig.fromMap(Map.of("sink", "mqtt")));
    assertThrows(IllegalArgumentException.class, () -> PublisherConfig.fromMap(Map.of("server", "::1:5810")));
  }

  @Test
  void telemetryValidatesEndpointAndAttributes() {
    assertThrows(IllegalArgumentException.class,
        () -> TelemetryConfig.fromMap(Map.of("otelEndpoint", "grpc://collector:4317")));
    assertThrows(IllegalArgumentException.class,
        () -> TelemetryConfig.fromMap(Map.of("otelResourceAttributes", "team=é")));
    assertThrows(IllegalArgumentException.class,
        () -> TelemetryConfig.fromMap(Map.of("metricsExporter", "prometheus")));
    TelemetryConfig ok = TelemetryConfig.fromMap(
        Map.of("otelEndpoint", "https://collector:4317", "otelResourceAttributes", "team=frc"));
    assertEquals("https://collector:4317", ok.otelEndpoint());
    assertEquals("otlp", ok.metricsExporter());
  }

  @Test
  void convertConfigDerivesOutputName() {
    ConvertConfig config = ConvertConfig.fromMap(Map.of("in", "/logs/FRC_2024.wpilog"));

    assertEquals(Path.of("/logs/FRC_2024.csv"), config.output());
    assertEquals(Path.of("/logs/noext.csv"), ConvertConfig.defaultOutput(Path.of("/logs/noext")));
    assertEquals(Path.of("out.csv"), ConvertConfig.fromMap(Map.of("in", "a.wpilog", "out", "out.csv")).output());
    assertThrows(IllegalArgumentException.class, () -> ConvertConfig.fromMap(Map.of("in", " ")));
  }

  @Test
  void sinkTypeParsesCaseInsensitively() {
    assertEquals(SinkType.KAFKA, SinkType.parse(" kafka "));
    assertEquals(SinkType.LOG, SinkType.parse("Log"));
    assertThrows(IllegalArgumentException.class, () -> SinkType.parse(null));
  }
}
