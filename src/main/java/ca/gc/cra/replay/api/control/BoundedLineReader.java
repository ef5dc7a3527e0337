package ca.gc.cra.replay.api.control;

import java.io.IOException;
import java.io.Reader;
import java.util.Objects;

/**
 * Reads {@code \n}-terminated lines while holding at most {@code maxLength + 1} characters in memory.
 *
 * <p>Characters past the limit are read and discarded up to the end of the line, and the line is flagged via
 * {@link #overflowed()}. A trailing {@code \r} is dropped.</p>
 */
final class BoundedLineReader {
  private final Reader in;
  private final int maxLength;
  private final StringBuilder buffer;
  private boolean overflowed;

  BoundedLineReader(Reader in, int maxLength) {
    this.in = Objects.requireNonNull(in, "in");
    if (maxLength <= 0) {
      throw new IllegalArgumentException("maxLength must be positive");
    }
    this.maxLength = maxLength;
    this.buffer = new StringBuilder(Math.min(maxLength + 1, 256));
  }

  /**
   * Reads the next line.
   *
   * @return the line without its terminator, a truncated prefix when {@link #overflowed()} is set, or
   *     {@code null} at end of input
   * @throws IOException when the underlying reader fails
   */
  String readLine() throws IOException {
    buffer.setLength(0);
    overflowed = false;
    boolean sawAny = false;
    int c;
    while ((c = in.read()) != -1) {
      sawAny = true;
      if (c == '\n') {
        break;
      }
      if (buffer.length() <= maxLength) {
        buffer.append((char) c);
      } else {
        overflowed = true;
      }
    }
    if (!sawAny) {
      return null;
    }
    int length = buffer.length();
    if (!overflowed && length > 0 && buffer.charAt(length - 1) == '\r') {
      buffer.setLength(length - 1);
    }
    if (buffer.length() > maxLength) {
      overflowed = true;
    }
    return buffer.toString();
  }

  /**
   * Indicates whether the last line read exceeded the limit.
   *
   * @return {@code true} when the last line was longer than {@code maxLength}
   */
  boolean overflowed() {
    return overflowed;
  }
}
