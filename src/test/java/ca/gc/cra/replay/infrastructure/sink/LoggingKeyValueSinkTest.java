package ca.gc.cra.replay.infrastructure.sink;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.replay.application.port.KeyValueSink;
import ca.gc.cra.replay.domain.replay.SampleValue;
import ca.gc.cra.replay.testutil.RecordingMetrics;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingKeyValueSinkTest {
  @Test
  void putLogsUpdateAndCounts() {
    RecordingMetrics metrics = new RecordingMetrics();
    KeyValueSink sink = new LoggingSinkConnector(metrics).connect("10.0.0.2", 5810);

    Logger logger = (Logger) LoggerFactory.getLogger(LoggingKeyValueSink.class);
    ListAppender<ILoggingEvent> appender = new ListAppender<>();
    Level originalLevel = logger.getLevel();
    boolean originalAdditive = logger.isAdditive();
    logger.setLevel(Level.INFO);
    logger.setAdditive(false);
    appender.start();
    logger.addAppender(appender);

    try {
      sink.put("/drive/speed", new SampleValue("double", "1.25", ""));
    } finally {
      logger.detachAppender(appender);
      logger.setAdditive(originalAdditive);
      logger.setLevel(originalLevel);
      appender.stop();
    }

    assertEquals("log:10.0.0.2:5810", sink.describe());
    assertEquals(1L, metrics.count("sink.log.put"));
    List<ILoggingEvent> events = appender.list;
    assertEquals(1, events.size());
    String message = events.get(0).getFormattedMessage();
    assertTrue(message.startsWith("sink.put target=10.0.0.2:5810"));
    assertTrue(message.contains("key=/drive/speed"));
    assertTrue(message.contains("value=1.25"));
  }

  @Test
  void putAfterCloseFails() {
    LoggingKeyValueSink sink = new LoggingKeyValueSink("host:1", new RecordingMetrics());
    sink.close();

    assertThrows(IllegalStateException.class,
        () -> sink.put("/k", new SampleValue("string", "v", "")));
  }

  @Test
  void discardingSinkOnlyCounts() {
    RecordingMetrics metrics = new RecordingMetrics();
    KeyValueSink sink = DiscardingKeyValueSink.connector(metrics).connect("127.0.0.1", 5810);

    sink.put("/a", new SampleValue("boolean", "true", ""));
    sink.put("/b", new SampleValue("boolean", "false", ""));
    sink.close();

    assertEquals("none:127.0.0.1:5810", sink.describe());
    assertEquals(2L, metrics.count("sink.none.discarded"));
  }
}
