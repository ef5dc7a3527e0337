package ca.gc.cra.replay.validation;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Validation utilities for strings arriving from the CLI, YAML, and the control channel.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Reject blank or control-character inputs.</li>
 *   <li>Validate Kafka topic names against the supported character set.</li>
 *   <li>Strip one pair of surrounding quotes from path arguments.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent access.</p>
 * <p><strong>Observability:</strong> Failures raise {@link IllegalArgumentException}.</p>
 *
 * @since 0.1.0
 * @see Numbers
 * @see Paths
 */
public final class Strings {
  private static final Pattern TOPIC_PATTERN = Pattern.compile("^[A-Za-z0-9._-]+$");
  private static final int MAX_TOPIC_LENGTH = 249;

  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank, and control-character free.
   *
   * @param name logical parameter name for diagnostics
   * @param value candidate text; must not be {@code null}
   * @return trimmed input
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, label(name));
    if (containsControl(raw)) {
      throw new IllegalArgumentException(label(name) + " must not contain control characters");
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(label(name) + " must not be blank");
    }
    return trimmed;
  }

  /**
   * Validates a Kafka topic name.
   *
   * @param name logical parameter name for diagnostics
   * @param topic candidate topic
   * @return trimmed topic matching {@code [A-Za-z0-9._-]+}
   * @throws IllegalArgumentException if the topic is blank, too long, or has unsupported characters
   */
  public static String sanitizeTopic(String name, String topic) {
    String sanitized = requireNonBlank(name, topic);
    if (sanitized.length() > MAX_TOPIC_LENGTH || !TOPIC_PATTERN.matcher(sanitized).matches()) {
      throw new IllegalArgumentException(label(name)
          + " must be at most " + MAX_TOPIC_LENGTH + " letters, digits, dots, underscores, or hyphens");
    }
    return sanitized;
  }

  /**
   * Removes one pair of matching single or double quotes around a value.
   *
   * @param value raw argument; {@code null} yields an empty string
   * @return trimmed value without its surrounding quotes
   */
  public static String stripQuotes(String value) {
    if (value == null) {
      return "";
    }
    String trimmed = value.trim();
    if (trimmed.length() >= 2) {
      char first = trimmed.charAt(0);
      char last = trimmed.charAt(trimmed.length() - 1);
      if ((first == '"' || first == '\'') && first == last) {
        return trimmed.substring(1, trimmed.length() - 1);
      }
    }
    return trimmed;
  }

  /**
   * Checks for ISO control characters.
   *
   * @param value text to inspect
   * @return {@code true} when any character is a control character
   */
  public static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String label(String name) {
    return (name == null || name.isBlank()) ? "value" : name;
  }
}
