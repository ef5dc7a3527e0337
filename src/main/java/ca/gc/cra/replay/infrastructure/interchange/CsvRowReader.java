package ca.gc.cra.replay.infrastructure.interchange;

import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Streaming RFC 4180 row tokenizer. Accepts {@code \n}, {@code \r\n} and {@code \r} line endings; quoted fields
 * may span lines. Blank lines are skipped. Not thread-safe.
 */
final class CsvRowReader {
  private static final int EOF = -1;

  private final Reader reader;
  private int pushback = Integer.MIN_VALUE;

  CsvRowReader(Reader reader) {
    this.reader = Objects.requireNonNull(reader, "reader");
  }

  /**
   * Reads the next row.
   *
   * @return fields of the row, or {@code null} at end of input
   * @throws IOException when reading fails
   */
  List<String> next() throws IOException {
    while (true) {
      int c = read();
      if (c == EOF) {
        return null;
      }
      if (c == '\r' || c == '\n') {
        consumeLineFeedAfter(c);
        continue;
      }
      unread(c);
      return readRow();
    }
  }

  private List<String> readRow() throws IOException {
    List<String> fields = new ArrayList<>();
    StringBuilder field = new StringBuilder();
    boolean quoted = false;
    boolean afterQuote = false;
    while (true) {
      int c = read();
      if (quoted) {
        if (c == EOF) {
          fields.add(field.toString());
          return fields;
        }
        if (c == '"') {
          int peek = read();
          if (peek == '"') {
            field.append('"');
          } else {
            quoted = false;
            afterQuote = true;
            unread(peek);
          }
        } else {
          field.append((char) c);
        }
        continue;
      }
      if (c == EOF || c == '\r' || c == '\n') {
        consumeLineFeedAfter(c);
        fields.add(field.toString());
        return fields;
      }
      if (c == ',') {
        fields.add(field.toString());
        field.setLength(0);
        afterQuote = false;
      } else if (c == '"' && field.length() == 0 && !afterQuote) {
        quoted = true;
      } else {
        field.append((char) c);
      }
    }
  }

  private void consumeLineFeedAfter(int c) throws IOException {
    if (c == '\r') {
      int peek = read();
      if (peek != '\n') {
        unread(peek);
      }
    }
  }

  private int read() throws IOException {
    if (pushback != Integer.MIN_VALUE) {
      int c = pushback;
      pushback = Integer.MIN_VALUE;
      return c;
    }
    return reader.read();
  }

  private void unread(int c) {
    pushback = c;
  }
}
