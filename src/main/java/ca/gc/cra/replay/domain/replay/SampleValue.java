package ca.gc.cra.replay.domain.replay;

import ca.gc.cra.replay.domain.log.ValueType;
import java.util.Objects;

/**
 * The value a frame holds for one key. Equality over all three fields drives the publish diff.
 *
 * @param typeName declared type name
 * @param value string-encoded value
 * @param metadata entry metadata
 * @since 0.1.0
 */
public record SampleValue(String typeName, String value, String metadata) {
  /**
   * Creates a value, normalizing {@code null} value and metadata to empty strings.
   */
  public SampleValue {
    Objects.requireNonNull(typeName, "typeName");
    value = value == null ? "" : value;
    metadata = metadata == null ? "" : metadata;
  }

  /**
   * Resolves the declared type name.
   *
   * @return value type
   */
  public ValueType valueType() {
    return ValueType.fromTypeName(typeName);
  }
}
