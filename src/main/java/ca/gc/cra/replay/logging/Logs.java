package ca.gc.cra.replay.logging;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Logging hygiene helpers that keep large sample values and protocol lines out of the log at full size.
 *
 * <p>Stateless; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";

  private Logs() {
    // Utility
  }

  /**
   * Truncates a string to a UTF-8 byte budget, appending the original length.
   *
   * @param value string to truncate; {@code null} yields {@code "<null>"}
   * @param maxBytes bytes to retain; must be positive
   * @return the original value when it fits, otherwise a shortened copy with a length suffix
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String truncate(String value, int maxBytes) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    if (bytes.length <= maxBytes) {
      return value;
    }
    CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.IGNORE)
        .onUnmappableCharacter(CodingErrorAction.IGNORE);
    try {
      CharBuffer kept = decoder.decode(ByteBuffer.wrap(bytes, 0, maxBytes));
      return kept + "... (truncated, " + maxBytes + " of " + bytes.length + " bytes)";
    } catch (CharacterCodingException ex) {
      throw new IllegalStateException("UTF-8 decoder rejected input despite IGNORE actions", ex);
    }
  }

  /**
   * Escapes control characters so a protocol line logs on one line.
   *
   * @param line raw line; {@code null} yields {@code "<null>"}
   * @return printable representation
   */
  public static String printable(String line) {
    if (line == null) {
      return NULL_PLACEHOLDER;
    }
    StringBuilder sb = new StringBuilder(line.length());
    for (int i = 0; i < line.length(); i++) {
      char c = line.charAt(i);
      if (Character.isISOControl(c)) {
        sb.append(String.format("\\u%04x", (int) c));
      } else {
        sb.append(c);
      }
    }
    return sb.toString();
  }
}
