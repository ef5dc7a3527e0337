package ca.gc.cra.replay.domain.replay;

import java.util.HexFormat;
import java.util.Set;

/**
 * Converts string-encoded sample values into the typed forms a key-value sink stores.
 *
 * <p>Parsing is lenient: booleans accept {@code true}, {@code True}, {@code t}, {@code T} and {@code 1};
 * unparsable numbers become {@code 0.0}; malformed hex becomes an empty byte array. Integers are widened
 * to doubles.</p>
 *
 * @since 0.1.0
 */
public final class SinkValues {
  private static final Set<String> TRUE_TOKENS = Set.of("True", "true", "1", "t", "T");
  private static final HexFormat HEX = HexFormat.of();

  private SinkValues() {}

  public static boolean parseBoolean(String value) {
    return value != null && TRUE_TOKENS.contains(value);
  }

  public static double parseDouble(String value) {
    if (value == null) {
      return 0.0;
    }
    try {
      return Double.parseDouble(value.trim());
    } catch (NumberFormatException ex) {
      return 0.0;
    }
  }

  public static boolean[] parseBooleanArray(String value) {
    String[] parts = split(value);
    boolean[] result = new boolean[parts.length];
    for (int i = 0; i < parts.length; i++) {
      result[i] = parseBoolean(parts[i]);
    }
    return result;
  }

  public static double[] parseDoubleArray(String value) {
    String[] parts = split(value);
    double[] result = new double[parts.length];
    for (int i = 0; i < parts.length; i++) {
      result[i] = parseDouble(parts[i]);
    }
    return result;
  }

  public static String[] parseStringArray(String value) {
    return split(value);
  }

  /**
   * Decodes a hex-encoded raw payload.
   *
   * @param value hex text
   * @return decoded bytes, or an empty array when the text is not valid hex
   */
  public static byte[] parseHex(String value) {
    if (value == null || value.isEmpty()) {
      return new byte[0];
    }
    try {
      return HEX.parseHex(value.trim());
    } catch (IllegalArgumentException ex) {
      return new byte[0];
    }
  }

  private static String[] split(String value) {
    if (value == null || value.isEmpty()) {
      return new String[0];
    }
    return value.split(",", -1);
  }
}
