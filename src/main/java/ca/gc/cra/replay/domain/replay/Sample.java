package ca.gc.cra.replay.domain.replay;

import ca.gc.cra.replay.domain.log.ValueType;
import java.util.Comparator;
import java.util.Objects;

/**
 * One timestamped value change for a key.
 *
 * @param timestampSeconds seconds since the start of the log
 * @param key entry name
 * @param typeName declared type name
 * @param value string-encoded value
 * @param metadata entry metadata at the time of the sample
 * @since 0.1.0
 */
public record Sample(double timestampSeconds, String key, String typeName, String value, String metadata) {
  /** Orders samples by timestamp; use with a stable sort to keep ties in original order. */
  public static final Comparator<Sample> BY_TIMESTAMP = Comparator.comparingDouble(Sample::timestampSeconds);

  /**
   * Creates a sample, normalizing {@code null} value and metadata to empty strings.
   */
  public Sample {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(typeName, "typeName");
    value = value == null ? "" : value;
    metadata = metadata == null ? "" : metadata;
  }

  /**
   * Returns the payload stored in frames for this sample.
   *
   * @return type, value, and metadata triple
   */
  public SampleValue toSampleValue() {
    return new SampleValue(typeName, value, metadata);
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
