package ca.gc.cra.replay.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each CLI mode.
 *
 * <p>The defaults remain the single source of truth for optional YAML keys.</p>
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns a flattened map of defaults for the requested mode merged with common defaults.
   *
   * @param mode target CLI mode (publish, convert)
   * @return unmodifiable map of default key/value pairs as strings
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "publish" -> buildPublishDefaults();
      case "convert" -> buildConvertDefaults();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("metricsExporter", "otlp");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("verbose", "false");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildPublishDefaults() {
    PublisherConfig defaults = PublisherConfig.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("periodMillis", Integer.toString(defaults.periodMillis()));
    map.put("maxTimestampSeconds", Double.toString(defaults.maxTimestampSeconds()));
    map.put("sink", defaults.sinkType().name());
    map.put("kafkaTopic", defaults.kafkaTopic());
    map.put("kafkaMaxBlockMs", Long.toString(defaults.kafkaMaxBlockMs()));
    map.put("server", "");
    return map;
  }

  private static Map<String, String> buildConvertDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("in", "");
    map.put("out", "");
    return map;
  }
}
