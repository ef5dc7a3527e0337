/**
 * Metrics adapters that bridge the replay {@code MetricsPort} to OpenTelemetry.
 * <p><strong>Concurrency:</strong> Instruments are cached in concurrent maps; safe for the control and timing
 * threads.</p>
 * <p><strong>Metrics:</strong> Publishes under {@code load.*}, {@code replay.*} and {@code control.*}.</p>
 */
package ca.gc.cra.replay.infrastructure.metrics;
