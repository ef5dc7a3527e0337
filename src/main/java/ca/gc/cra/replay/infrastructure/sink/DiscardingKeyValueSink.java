package ca.gc.cra.replay.infrastructure.sink;

import ca.gc.cra.replay.application.port.KeyValueSink;
import ca.gc.cra.replay.application.port.MetricsPort;
import ca.gc.cra.replay.application.port.SinkConnector;
import ca.gc.cra.replay.domain.replay.SampleValue;
import java.util.Objects;

/**
 * Sink selected by {@code sink=NONE}: counts updates and drops them.
 *
 * @since 0.1.0
 */
public final class DiscardingKeyValueSink implements KeyValueSink {
  private final String target;
  private final MetricsPort metrics;

  /**
   * Creates a sink.
   *
   * @param target endpoint reported by {@link #describe()}
   * @param metrics metrics sink
   */
  public DiscardingKeyValueSink(String target, MetricsPort metrics) {
    this.target = Objects.requireNonNull(target, "target");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Connector producing discarding sinks.
   *
   * @param metrics metrics sink
   * @return connector
   */
  public static SinkConnector connector(MetricsPort metrics) {
    return (host, port) -> new DiscardingKeyValueSink("none:" + host + ':' + port, metrics);
  }

  @Override
  public void put(String key, SampleValue value) {
    Objects.requireNonNull(key, "key");
    metrics.increment("sink.none.discarded");
  }

  @Override
  public String describe() {
    return target;
  }

  @Override
  public void close() {
    // nothing held
  }
}
