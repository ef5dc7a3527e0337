package ca.gc.cra.replay.domain.log;

import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Closed set of value types a log entry may declare.
 *
 * <p>Type names outside the ten well-known primitives and arrays collapse to {@link #RAW}, whose values
 * travel as lowercase hex together with the original type name.</p>
 *
 * @since 0.1.0
 */
public enum ValueType {
  BOOLEAN("boolean"),
  INT64("int64"),
  FLOAT("float"),
  DOUBLE("double"),
  STRING("string"),
  BOOLEAN_ARRAY("boolean[]"),
  INT64_ARRAY("int64[]"),
  FLOAT_ARRAY("float[]"),
  DOUBLE_ARRAY("double[]"),
  STRING_ARRAY("string[]"),
  RAW("raw");

  private static final Map<String, ValueType> BY_NAME = Stream.of(values())
      .collect(Collectors.toUnmodifiableMap(ValueType::typeName, Function.identity()));

  private final String typeName;

  ValueType(String typeName) {
    this.typeName = typeName;
  }

  /**
   * Returns the canonical type name as written in log Start records.
   *
   * @return canonical name, e.g. {@code double[]}
   */
  public String typeName() {
    return typeName;
  }

  /**
   * Indicates whether values of this type are comma-joined element lists.
   *
   * @return {@code true} for the five array types
   */
  public boolean isArray() {
    return switch (this) {
      case BOOLEAN_ARRAY, INT64_ARRAY, FLOAT_ARRAY, DOUBLE_ARRAY, STRING_ARRAY -> true;
      default -> false;
    };
  }

  /**
   * Resolves a declared type name; unknown names map to {@link #RAW}.
   *
   * @param typeName declared name; {@code null} maps to {@link #RAW}
   * @return matching value type
   */
  public static ValueType fromTypeName(String typeName) {
    if (typeName == null) {
      return RAW;
    }
    ValueType exact = BY_NAME.get(typeName);
    if (exact != null) {
      return exact;
    }
    return BY_NAME.getOrDefault(typeName.trim().toLowerCase(Locale.ROOT), RAW);
  }
}
