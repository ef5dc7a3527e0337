package ca.gc.cra.replay.config;

import java.util.Locale;

/**
 * Key-value sink implementations selectable through the {@code sink} option.
 *
 * @since 0.1.0
 */
public enum SinkType {
  /** Publish JSON records to Kafka; the server address is the bootstrap broker. */
  KAFKA,
  /** Write every update to the application log. */
  LOG,
  /** Discard updates; {@code SET_SERVER} still succeeds. */
  NONE;

  /**
   * Parses a sink type name, case-insensitively.
   *
   * @param raw option value
   * @return sink type
   * @throws IllegalArgumentException for unknown names
   */
  public static SinkType parse(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("sink must be one of KAFKA, LOG, NONE");
    }
    try {
      return SinkType.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("sink must be one of KAFKA, LOG, NONE (was " + raw + ")", ex);
    }
  }
}
