package ca.gc.cra.replay.config;

import ca.gc.cra.replay.validation.Net;
import ca.gc.cra.replay.validation.Numbers;
import ca.gc.cra.replay.validation.Strings;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Typed configuration of the {@code publish} mode.
 * <p><strong>Role:</strong> Produced from the merged defaults/YAML/CLI map; consumed by {@link CompositionRoot}.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param periodMillis frame width in milliseconds ({@code 1..1000})
 * @param maxTimestampSeconds upper bound of the replay window
 * @param sinkType sink implementation
 * @param kafkaTopic topic used by the Kafka sink
 * @param kafkaMaxBlockMs producer {@code max.block.ms}
 * @param server optional endpoint to connect at startup
 * @param telemetry metrics settings
 * @since 0.1.0
 */
public record PublisherConfig(
    int periodMillis,
    double maxTimestampSeconds,
    SinkType sinkType,
    String kafkaTopic,
    long kafkaMaxBlockMs,
    Optional<Net.HostPort> server,
    TelemetryConfig telemetry) {

  /**
   * Validates invariants.
   */
  public PublisherConfig {
    Numbers.requireRange("periodMillis", periodMillis, 1, 1_000);
    if (!(maxTimestampSeconds > 0) || Double.isInfinite(maxTimestampSeconds)) {
      throw new IllegalArgumentException("maxTimestampSeconds must be positive and finite");
    }
    Objects.requireNonNull(sinkType, "sinkType");
    Objects.requireNonNull(kafkaTopic, "kafkaTopic");
    Numbers.requireRange("kafkaMaxBlockMs", kafkaMaxBlockMs, 0, 60_000);
    Objects.requireNonNull(server, "server");
    Objects.requireNonNull(telemetry, "telemetry");
  }

  /**
   * Returns the built-in defaults.
   *
   * @return default publisher configuration
   */
  public static PublisherConfig defaults() {
    return new PublisherConfig(20, 1_000.0, SinkType.KAFKA, "replay.values", 10L, Optional.empty(),
        new TelemetryConfig("otlp", "", ""));
  }

  /**
   * Builds a configuration from flattened key/value pairs; missing keys take their defaults.
   *
   * @param map merged configuration
   * @return validated configuration
   * @throws IllegalArgumentException when a value is invalid
   */
  public static PublisherConfig fromMap(Map<String, String> map) {
    Objects.requireNonNull(map, "map");
    PublisherConfig defaults = defaults();
    int period = map.containsKey("periodMillis")
        ? Numbers.parseIntInRange("periodMillis", map.get("periodMillis"), 1, 1_000)
        : defaults.periodMillis();
    double maxTimestamp = map.containsKey("maxTimestampSeconds")
        ? Numbers.parseFinite("maxTimestampSeconds", map.get("maxTimestampSeconds"))
        : defaults.maxTimestampSeconds();
    SinkType sink = map.containsKey("sink") ? SinkType.parse(map.get("sink")) : defaults.sinkType();
    String topic = map.getOrDefault("kafkaTopic", defaults.kafkaTopic());
    if (sink == SinkType.KAFKA) {
      topic = Strings.sanitizeTopic("kafkaTopic", topic);
    }
    long maxBlock = map.containsKey("kafkaMaxBlockMs")
        ? Numbers.parseIntInRange("kafkaMaxBlockMs", map.get("kafkaMaxBlockMs"), 0, 60_000)
        : defaults.kafkaMaxBlockMs();
    String serverText = map.getOrDefault("server", "").trim();
    Optional<Net.HostPort> server =
        serverText.isEmpty() ? Optional.empty() : Optional.of(Net.parseHostPort(serverText));
    return new PublisherConfig(
        period, maxTimestamp, sink, topic, maxBlock, server, TelemetryConfig.fromMap(map));
  }

  /**
   * Returns the frame width.
   *
   * @return period in microseconds
   */
  public long periodMicros() {
    return periodMillis * 1_000L;
  }
}
