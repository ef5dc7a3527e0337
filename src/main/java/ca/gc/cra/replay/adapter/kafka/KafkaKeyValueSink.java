package ca.gc.cra.replay.adapter.kafka;

import ca.gc.cra.replay.application.port.KeyValueSink;
import ca.gc.cra.replay.application.port.MetricsPort;
import ca.gc.cra.replay.domain.replay.SampleValue;
import ca.gc.cra.replay.infrastructure.sink.SinkRecordJson;
import java.time.Duration;
import java.util.Objects;
import java.util.Properties;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Kafka-backed {@link KeyValueSink} that publishes each replayed update as a keyed JSON
 * record.
 * <p><strong>Why:</strong> Lets downstream dashboards and consumers observe the replayed telemetry as if the
 * robot were live.</p>
 * <p><strong>Role:</strong> Adapter on the output side of playback.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Key records by entry name so per-key ordering is preserved and log compaction keeps the latest value.</li>
 *   <li>Send without waiting; failures surface in the producer callback as warnings and metrics.</li>
 *   <li>Close the producer with a bounded timeout.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Mirrors the provided {@link Producer}; the default {@link KafkaProducer} is
 * thread-safe.</p>
 * <p><strong>Performance:</strong> {@code send} may still block for up to {@code max.block.ms} while metadata
 * is unavailable; {@link KafkaSinkConnector} therefore puts a {@code QueueingKeyValueSink} in front of it.</p>
 * <p><strong>Observability:</strong> {@code sink.kafka.sent} and {@code sink.kafka.error} counters.</p>
 *
 * @since 0.1.0
 */
public final class KafkaKeyValueSink implements KeyValueSink {
  private static final Logger log = LoggerFactory.getLogger(KafkaKeyValueSink.class);
  private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(2);

  private final Producer<String, byte[]> producer;
  private final String topic;
  private final String bootstrap;
  private final MetricsPort metrics;

  /**
   * Creates a sink with its own producer.
   *
   * @param bootstrap {@code host:port} of a broker
   * @param topic destination topic
   * @param maxBlockMillis upper bound on how long {@code send} may block for metadata
   * @param metrics metrics sink
   * @throws KafkaException when the producer cannot be created
   */
  public KafkaKeyValueSink(String bootstrap, String topic, long maxBlockMillis, MetricsPort metrics) {
    this(createProducer(bootstrap, maxBlockMillis), bootstrap, topic, metrics);
  }

  KafkaKeyValueSink(Producer<String, byte[]> producer, String bootstrap, String topic, MetricsPort metrics) {
    this.producer = Objects.requireNonNull(producer, "producer");
    this.bootstrap = Objects.requireNonNull(bootstrap, "bootstrap");
    this.topic = requireTopic(topic);
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Publishes an update without waiting for acknowledgement.
   *
   * @param key entry name, used as the record key
   * @param value value to encode
   */
  @Override
  public void put(String key, SampleValue value) {
    ProducerRecord<String, byte[]> record =
        new ProducerRecord<>(topic, key, SinkRecordJson.serialize(key, value));
    producer.send(record, (metadata, ex) -> {
      if (ex != null) {
        metrics.increment("sink.kafka.error");
        log.warn("Kafka publish failure for key {} on topic {}: {}", key, topic, ex.getMessage());
      } else {
        metrics.increment("sink.kafka.sent");
      }
    });
  }

  @Override
  public String describe() {
    return "kafka:" + bootstrap + "/" + topic;
  }

  /**
   * Closes the producer, waiting briefly for in-flight sends.
   */
  @Override
  public void close() {
    try {
      producer.close(CLOSE_TIMEOUT);
    } catch (KafkaException ex) {
      log.warn("Kafka producer for {} did not close cleanly", bootstrap, ex);
    }
  }

  private static String requireTopic(String topic) {
    if (topic == null || topic.isBlank()) {
      throw new IllegalArgumentException("topic must not be blank");
    }
    return topic.trim();
  }

  private static Producer<String, byte[]> createProducer(String bootstrap, long maxBlockMillis) {
    Objects.requireNonNull(bootstrap, "bootstrap");
    if (bootstrap.isBlank()) {
      throw new IllegalArgumentException("bootstrap must not be blank");
    }
    Properties props = new Properties();
    props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrap.trim());
    props.put(ProducerConfig.CLIENT_ID_CONFIG, "replay-publisher");
    props.put(ProducerConfig.ACKS_CONFIG, "1");
    props.put(ProducerConfig.LINGER_MS_CONFIG, 0);
    props.put(ProducerConfig.MAX_BLOCK_MS_CONFIG, maxBlockMillis);
    props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
    props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, ByteArraySerializer.class.getName());
    return new KafkaProducer<>(props);
  }
}
