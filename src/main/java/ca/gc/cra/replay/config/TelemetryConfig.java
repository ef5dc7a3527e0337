package ca.gc.cra.replay.config;

import ca.gc.cra.replay.validation.Strings;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Map;

/**
 * OpenTelemetry settings shared by every mode.
 *
 * @param metricsExporter {@code otlp} or {@code none}
 * @param otelEndpoint OTLP endpoint, blank for the exporter default
 * @param otelResourceAttributes extra resource attributes as {@code key=value,...}
 * @since 0.1.0
 */
public record TelemetryConfig(String metricsExporter, String otelEndpoint, String otelResourceAttributes) {
  private static final int MAX_RESOURCE_ATTRIBUTES_LENGTH = 4_096;

  /**
   * Builds the telemetry settings from flattened configuration.
   *
   * @param map merged configuration
   * @return validated settings
   * @throws IllegalArgumentException when a value is invalid
   */
  public static TelemetryConfig fromMap(Map<String, String> map) {
    String exporter = map.getOrDefault("metricsExporter", "otlp").trim().toLowerCase(Locale.ROOT);
    if (exporter.isEmpty()) {
      exporter = "otlp";
    }
    if (!exporter.equals("otlp") && !exporter.equals("none")) {
      throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
    }
    String endpoint = map.getOrDefault("otelEndpoint", "").trim();
    if (!endpoint.isEmpty()) {
      validateEndpoint(endpoint);
    }
    String attributes = map.getOrDefault("otelResourceAttributes", "").trim();
    if (!attributes.isEmpty()) {
      for (int i = 0; i < attributes.length(); i++) {
        char c = attributes.charAt(i);
        if (c < 0x20 || c > 0x7E) {
          throw new IllegalArgumentException("otelResourceAttributes must contain printable ASCII characters");
        }
      }
      if (attributes.length() > MAX_RESOURCE_ATTRIBUTES_LENGTH) {
        throw new IllegalArgumentException(
            "otelResourceAttributes length must be <= " + MAX_RESOURCE_ATTRIBUTES_LENGTH);
      }
    }
    return new TelemetryConfig(exporter, endpoint, attributes);
  }

  private static void validateEndpoint(String raw) {
    Strings.requireNonBlank("otelEndpoint", raw);
    try {
      URI uri = new URI(raw);
      String scheme = uri.getScheme();
      if (scheme == null || (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https"))) {
        throw new IllegalArgumentException("otelEndpoint must use http or https scheme");
      }
      if (uri.getHost() == null || uri.getHost().isBlank()) {
        throw new IllegalArgumentException("otelEndpoint must include a host");
      }
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("otelEndpoint must be a valid URI", ex);
    }
  }
}
