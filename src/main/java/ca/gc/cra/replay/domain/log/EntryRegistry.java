package ca.gc.cra.replay.domain.log;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Tracks live log entries during one forward pass over the records.
 *
 * <p>Start records register (or replace) an entry, Finish records retire it, and SetMetadata records
 * overwrite the metadata of a live entry. A registry is local to one decode pass.</p>
 *
 * <p>Not thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class EntryRegistry {
  private final Map<Long, LogEntry> live = new HashMap<>();

  /**
   * Applies a record to the registry.
   *
   * @param record decoded record; data records and unrecognized control records are ignored
   * @return the control instruction that was applied, or empty when nothing changed
   */
  public Optional<ControlRecord> apply(LogRecord record) {
    Objects.requireNonNull(record, "record");
    Optional<ControlRecord> control = record.control();
    control.ifPresent(this::apply);
    return control;
  }

  /**
   * Applies a parsed control instruction.
   *
   * @param control instruction to apply
   */
  public void apply(ControlRecord control) {
    Objects.requireNonNull(control, "control");
    if (control instanceof ControlRecord.Start start) {
      live.put(start.entryId(),
          new LogEntry(start.entryId(), start.name(), start.typeName(), start.metadata()));
    } else if (control instanceof ControlRecord.Finish finish) {
      live.remove(finish.entryId());
    } else if (control instanceof ControlRecord.SetMetadata update) {
      live.computeIfPresent(update.entryId(), (id, entry) -> entry.withMetadata(update.metadata()));
    }
  }

  /**
   * Resolves a live entry.
   *
   * @param entryId id referenced by a data record
   * @return live entry, or empty for unknown or retired ids
   */
  public Optional<LogEntry> resolve(long entryId) {
    return Optional.ofNullable(live.get(entryId));
  }

  /**
   * Returns the number of live entries.
   *
   * @return live entry count
   */
  public int size() {
    return live.size();
  }
}
