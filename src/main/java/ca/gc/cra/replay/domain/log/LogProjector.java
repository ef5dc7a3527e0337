package ca.gc.cra.replay.domain.log;

import ca.gc.cra.replay.domain.replay.Sample;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Turns decoded log records into {@link Sample}s.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Feed control records to a fresh {@link EntryRegistry}.</li>
 *   <li>Resolve data records to their live entry; drop the unresolved.</li>
 *   <li>Decode values with {@link ValueCodec}, substituting an empty value when a payload is malformed.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; each call uses its own registry.</p>
 *
 * @since 0.1.0
 */
public final class LogProjector {
  private static final Logger log = LoggerFactory.getLogger(LogProjector.class);

  /**
   * Projects every record produced by {@code records}.
   *
   * @param records record sequence, typically {@link LogCodec#records()}
   * @return samples plus record counters
   */
  public LogProjection project(Iterable<LogRecord> records) {
    Objects.requireNonNull(records, "records");
    EntryRegistry registry = new EntryRegistry();
    List<Sample> samples = new ArrayList<>();
    long control = 0;
    long dropped = 0;
    long malformed = 0;
    for (LogRecord record : records) {
      if (record.isControl()) {
        control++;
        registry.apply(record);
        continue;
      }
      Optional<LogEntry> resolved = registry.resolve(record.entryId());
      if (resolved.isEmpty()) {
        dropped++;
        continue;
      }
      LogEntry entry = resolved.get();
      String value;
      try {
        value = ValueCodec.decode(entry.valueType(), record.payloadView());
      } catch (IllegalArgumentException ex) {
        malformed++;
        log.debug("Malformed {} value for {} at {}us: {}",
            entry.typeName(), entry.name(), Long.toUnsignedString(record.timestampMicros()), ex.getMessage());
        value = "";
      }
      samples.add(new Sample(
          record.timestampSeconds(), entry.name(), entry.typeName(), value, entry.metadata()));
    }
    return new LogProjection(samples, control, dropped, malformed);
  }
}
