package ca.gc.cra.replay.domain.log;

import java.util.Objects;

/**
 * A named, typed value series registered by a Start control record.
 *
 * @param id entry identifier; unique among live entries only
 * @param name replay key
 * @param typeName type name as declared in the log
 * @param metadata current metadata; replaced by SetMetadata records
 * @since 0.1.0
 */
public record LogEntry(long id, String name, String typeName, String metadata) {
  /**
   * Creates an entry, normalizing {@code null} metadata to empty.
   */
  public LogEntry {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(typeName, "typeName");
    metadata = metadata == null ? "" : metadata;
  }

  /**
   * Resolves the declared type name.
   *
   * @return value type used to decode data records
   */
  public ValueType valueType() {
    return ValueType.fromTypeName(typeName);
  }

  /**
   * Returns a copy carrying new metadata.
   *
   * @param replacement metadata to store
   * @return updated entry
   */
  public LogEntry withMetadata(String replacement) {
    return new LogEntry(id, name, typeName, replacement);
  }
}
