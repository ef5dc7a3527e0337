package ca.gc.cra.replay.adapter.kafka;

import ca.gc.cra.replay.application.port.KeyValueSink;
import ca.gc.cra.replay.application.port.MetricsPort;
import ca.gc.cra.replay.application.port.SinkConnector;
import ca.gc.cra.replay.infrastructure.sink.QueueingKeyValueSink;
import java.time.Duration;
import java.util.Objects;
import org.apache.kafka.common.KafkaException;

/**
 * Opens {@link KafkaKeyValueSink}s, using the server address as the bootstrap broker.
 *
 * <p>Each sink is wrapped in a {@link QueueingKeyValueSink} so producer sends, which can block for up to
 * {@code max.block.ms} per record while metadata is unavailable, never run on the timing thread.</p>
 *
 * @since 0.1.0
 */
public final class KafkaSinkConnector implements SinkConnector {
  private static final Duration DRAIN_CLOSE_TIMEOUT = Duration.ofSeconds(1);

  private final String topic;
  private final long maxBlockMillis;
  private final MetricsPort metrics;

  /**
   * Creates a connector.
   *
   * @param topic destination topic for every sink it opens
   * @param maxBlockMillis producer {@code max.block.ms}
   * @param metrics metrics sink
   */
  public KafkaSinkConnector(String topic, long maxBlockMillis, MetricsPort metrics) {
    this.topic = Objects.requireNonNull(topic, "topic");
    this.maxBlockMillis = maxBlockMillis;
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  @Override
  public KeyValueSink connect(String host, int port) {
    String bootstrap = host.indexOf(':') >= 0 ? '[' + host + "]:" + port : host + ':' + port;
    try {
      KafkaKeyValueSink kafka = new KafkaKeyValueSink(bootstrap, topic, maxBlockMillis, metrics);
      return new QueueingKeyValueSink(kafka, QueueingKeyValueSink.DEFAULT_CAPACITY, DRAIN_CLOSE_TIMEOUT, metrics);
    } catch (KafkaException ex) {
      throw new IllegalArgumentException("Unable to create Kafka producer for " + bootstrap, ex);
    }
  }
}
