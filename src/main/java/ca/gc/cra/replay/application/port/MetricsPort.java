package ca.gc.cra.replay.application.port;

/**
 * <strong>What:</strong> Port abstracting metrics emission.
 * <p><strong>Why:</strong> Lets loading, playback, and the control channel record counters without binding to a
 * vendor SDK.</p>
 * <p><strong>Role:</strong> Domain port implemented by adapters such as {@code OpenTelemetryMetricsAdapter}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent updates from the control and
 * timing threads.</p>
 * <p><strong>Performance:</strong> Calls must be non-blocking; the timing loop invokes them every tick.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code replay.sink.error}).</p>
 *
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric identifier; must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param value observed value; semantics defined by the caller
   */
  void observe(String key, long value);

  /** Metrics implementation that ignores all updates. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
