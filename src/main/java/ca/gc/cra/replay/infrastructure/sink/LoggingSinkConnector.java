package ca.gc.cra.replay.infrastructure.sink;

import ca.gc.cra.replay.application.port.KeyValueSink;
import ca.gc.cra.replay.application.port.MetricsPort;
import ca.gc.cra.replay.application.port.SinkConnector;
import java.util.Objects;

/**
 * Opens {@link LoggingKeyValueSink}s.
 */
public final class LoggingSinkConnector implements SinkConnector {
  private final MetricsPort metrics;

  public LoggingSinkConnector(MetricsPort metrics) {
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  @Override
  public KeyValueSink connect(String host, int port) {
    return new LoggingKeyValueSink(host + ':' + port, metrics);
  }
}
