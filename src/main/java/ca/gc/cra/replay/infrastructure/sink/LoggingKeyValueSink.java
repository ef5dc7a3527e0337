package ca.gc.cra.replay.infrastructure.sink;

import ca.gc.cra.replay.application.port.KeyValueSink;
import ca.gc.cra.replay.application.port.MetricsPort;
import ca.gc.cra.replay.domain.replay.SampleValue;
import ca.gc.cra.replay.logging.Logs;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link KeyValueSink} that writes every update to the application log.
 *
 * <p>Used for dry runs and when no broker is available. Values are truncated before logging.</p>
 *
 * @since 0.1.0
 */
public final class LoggingKeyValueSink implements KeyValueSink {
  private static final Logger log = LoggerFactory.getLogger(LoggingKeyValueSink.class);
  private static final int MAX_VALUE_BYTES = 256;

  private final String target;
  private final MetricsPort metrics;
  private volatile boolean closed;

  /**
   * Creates a logging sink.
   *
   * @param target label of the configured server
   * @param metrics metrics sink
   */
  public LoggingKeyValueSink(String target, MetricsPort metrics) {
    this.target = Objects.requireNonNull(target, "target");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  @Override
  public void put(String key, SampleValue value) {
    if (closed) {
      throw new IllegalStateException("sink " + target + " is closed");
    }
    metrics.increment("sink.log.put");
    log.info("sink.put target={} key={} type={} value={}",
        target, key, value.typeName(), Logs.truncate(value.value(), MAX_VALUE_BYTES));
  }

  @Override
  public String describe() {
    return "log:" + target;
  }

  @Override
  public void close() {
    closed = true;
  }
}
