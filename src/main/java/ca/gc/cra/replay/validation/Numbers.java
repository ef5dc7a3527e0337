package ca.gc.cra.replay.validation;

/**
 * Numeric validation helpers used by configuration parsing and the control channel.
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that a value falls within an inclusive range.
   *
   * @param name logical parameter name for diagnostics
   * @param value candidate value
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return the validated value
   * @throws IllegalArgumentException if {@code value} lies outside {@code [min, max]}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Parses an integer and validates its range.
   *
   * @param name logical parameter name for diagnostics
   * @param raw text to parse
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return parsed value
   * @throws IllegalArgumentException if the text is not an integer or lies outside the range
   */
  public static int parseIntInRange(String name, String raw, int min, int max) {
    String text = Strings.requireNonBlank(name, raw);
    try {
      return (int) requireRange(name, Long.parseLong(text), min, max);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(label(name) + " must be an integer (was " + text + ")", ex);
    }
  }

  /**
   * Parses a finite decimal number.
   *
   * @param name logical parameter name for diagnostics
   * @param raw text to parse
   * @return parsed value
   * @throws IllegalArgumentException if the text is not a number or is NaN or infinite
   */
  public static double parseFinite(String name, String raw) {
    String text = Strings.requireNonBlank(name, raw);
    double value;
    try {
      value = Double.parseDouble(text);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(label(name) + " must be a number (was " + text + ")", ex);
    }
    if (!Double.isFinite(value)) {
      throw new IllegalArgumentException(label(name) + " must be finite (was " + text + ")");
    }
    return value;
  }

  private static String label(String name) {
    return (name == null || name.isBlank()) ? "value" : name;
  }
}
