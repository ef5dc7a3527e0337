package ca.gc.cra.replay.infrastructure.metrics;

import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * Exporter settings for the OpenTelemetry meter provider.
 *
 * @param exporter {@code otlp} or {@code none}
 * @param endpoint OTLP gRPC endpoint; blank selects {@link #DEFAULT_ENDPOINT}
 * @param resourceAttributes extra {@code key=value,...} resource attributes; may be blank
 * @param exportInterval periodic export interval
 * @since 0.1.0
 */
public record MetricsSettings(
    String exporter, String endpoint, String resourceAttributes, Duration exportInterval) {
  public static final String DEFAULT_ENDPOINT = "http://localhost:4317";

  /**
   * Normalizes and validates the settings.
   */
  public MetricsSettings {
    exporter = exporter == null || exporter.isBlank() ? "otlp" : exporter.trim().toLowerCase(Locale.ROOT);
    if (!exporter.equals("otlp") && !exporter.equals("none")) {
      throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
    }
    endpoint = endpoint == null || endpoint.isBlank() ? DEFAULT_ENDPOINT : endpoint.trim();
    resourceAttributes = resourceAttributes == null ? "" : resourceAttributes.trim();
    Objects.requireNonNull(exportInterval, "exportInterval");
    if (exportInterval.isNegative() || exportInterval.isZero()) {
      throw new IllegalArgumentException("exportInterval must be positive");
    }
  }

  /**
   * Settings that disable export entirely.
   *
   * @return noop settings
   */
  public static MetricsSettings disabled() {
    return new MetricsSettings("none", "", "", Duration.ofSeconds(30));
  }

  /**
   * Indicates whether an exporter should be created.
   *
   * @return {@code false} when the exporter is {@code none}
   */
  public boolean enabled() {
    return !exporter.equals("none");
  }
}
