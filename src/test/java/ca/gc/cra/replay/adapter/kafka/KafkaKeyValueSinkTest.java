package ca.gc.cra.replay.adapter.kafka;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.replay.domain.replay.SampleValue;
import ca.gc.cra.replay.testutil.RecordingMetrics;
import java.nio.charset.StandardCharsets;
import org.apache.kafka.clients.producer.MockProducer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.errors.TimeoutException;
import org.junit.jupiter.api.Test;

class KafkaKeyValueSinkTest {
  @Test
  void putPublishesKeyedJsonRecord() {
    MockProducer<String, byte[]> producer = MockProducerFactory.autoCompleting();
    RecordingMetrics metrics = new RecordingMetrics();
    KafkaKeyValueSink sink = new KafkaKeyValueSink(producer, "10.0.0.2:5810", " replay.values ", metrics);

    sink.put("/drive/speed", new SampleValue("double", "2.5", ""));

    assertEquals(1, producer.history().size());
    ProducerRecord<String, byte[]> sent = producer.history().get(0);
    assertEquals("replay.values", sent.topic());
    assertEquals("/drive/speed", sent.key());
    String payload = new String(sent.value(), StandardCharsets.UTF_8);
    assertTrue(payload.contains("\"value\":2.5"));
    assertTrue(payload.contains("\"type\":\"double\""));
    assertEquals(1L, metrics.count("sink.kafka.sent"));
    assertEquals("kafka:10.0.0.2:5810/replay.values", sink.describe());
  }

  @Test
  void failedSendIsCountedNotThrown() {
    MockProducer<String, byte[]> producer = MockProducerFactory.manual();
    RecordingMetrics metrics = new RecordingMetrics();
    KafkaKeyValueSink sink = new KafkaKeyValueSink(producer, "broker:9092", "replay.values", metrics);

    sink.put("/a", new SampleValue("boolean", "true", ""));
    sink.put("/b", new SampleValue("boolean", "false", ""));
    producer.completeNext();
    producer.errorNext(new TimeoutException("broker unreachable"));

    assertEquals(1L, metrics.count("sink.kafka.sent"));
    assertEquals(1L, metrics.count("sink.kafka.error"));
  }

  @Test
  void closeClosesProducer() {
    MockProducer<String, byte[]> producer = MockProducerFactory.autoCompleting();
    KafkaKeyValueSink sink = new KafkaKeyValueSink(producer, "broker:9092", "t", new RecordingMetrics());

    sink.close();

    assertTrue(producer.closed());
  }

  @Test
  void blankTopicRejected() {
    MockProducer<String, byte[]> producer = MockProducerFactory.autoCompleting();
    assertThrows(IllegalArgumentException.class,
        () -> new KafkaKeyValueSink(producer, "broker:9092", "  ", new RecordingMetrics()));
  }
}
