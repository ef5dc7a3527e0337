package ca.gc.cra.replay.domain.log;

import ca.gc.cra.replay.domain.util.Bytes;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * <strong>What:</strong> Decoder for the length-prefixed binary telemetry log layout.
 * <p><strong>Why:</strong> Turns a raw log buffer into a lazy sequence of {@link LogRecord}s without interpreting
 * entry semantics.</p>
 * <p><strong>Role:</strong> Leaf of the load pipeline (bytes -> records -> samples -> frames).</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Skip the fixed prologue and the variable-length header it announces.</li>
 *   <li>Decode variable-width record headers (entry id, payload size, timestamp).</li>
 *   <li>Stop cleanly at the first record that does not fit in the remaining bytes.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable once constructed; each call to {@link #records()} returns an
 * independent iteration.</p>
 * <p><strong>Performance:</strong> Single forward pass; each record copies only its payload.</p>
 *
 * @implNote The buffer is shared, not copied; callers must not mutate it after construction.
 * @since 0.1.0
 */
public final class LogCodec {
  /** Bytes occupied by the magic, version, and header-length fields. */
  public static final int PROLOGUE_LENGTH = 12;
  private static final byte[] MAGIC = "WPILOG".getBytes(StandardCharsets.US_ASCII);
  private static final int MIN_RECORD_HEADER = 4;

  private final byte[] buffer;

  /**
   * Creates a codec over an in-memory log image.
   *
   * @param buffer complete log bytes; must not be {@code null}
   */
  public LogCodec(byte[] buffer) {
    this.buffer = Objects.requireNonNull(buffer, "buffer");
  }

  /**
   * Reads a log file fully into memory.
   *
   * @param path log file
   * @return codec over the file contents
   * @throws IOException when the file cannot be read
   */
  public static LogCodec fromFile(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    return new LogCodec(Files.readAllBytes(path));
  }

  /**
   * Checks the magic bytes at the start of the prologue.
   *
   * @return {@code true} when the buffer starts with the expected magic
   */
  public boolean hasValidPrologue() {
    return buffer.length >= PROLOGUE_LENGTH
        && Arrays.equals(buffer, 0, MAGIC.length, MAGIC, 0, MAGIC.length);
  }

  /**
   * Returns the format version stored after the magic.
   *
   * @return version as {@code major << 8 | minor}, or {@code 0} when the prologue is missing
   */
  public int version() {
    if (buffer.length < PROLOGUE_LENGTH) {
      return 0;
    }
    return (int) Bytes.uLe(buffer, 6, 2);
  }

  /**
   * Returns the variable header text that follows the prologue.
   *
   * @return header string, or empty when absent or truncated
   */
  public String extraHeader() {
    if (buffer.length < PROLOGUE_LENGTH) {
      return "";
    }
    long length = Bytes.u32le(buffer, 8);
    if (!Bytes.hasRemaining(buffer, PROLOGUE_LENGTH, length)) {
      return "";
    }
    return new String(buffer, PROLOGUE_LENGTH, (int) length, StandardCharsets.UTF_8);
  }

  /**
   * Returns the offset at which the first record begins.
   *
   * @return offset past the prologue and extra header, capped at the buffer length
   */
  public long firstRecordOffset() {
    if (buffer.length < PROLOGUE_LENGTH) {
      return buffer.length;
    }
    long offset = PROLOGUE_LENGTH + Bytes.u32le(buffer, 8);
    return Math.min(offset, buffer.length);
  }

  /**
   * Returns a restartable, lazy view of every record in the log.
   *
   * @return iterable whose iterators each start from the first record
   */
  public Iterable<LogRecord> records() {
    return records(firstRecordOffset());
  }

  /**
   * Returns a restartable view of the records starting at {@code offset}.
   *
   * @param offset byte offset of a record header
   * @return iterable over the records from that point
   */
  public Iterable<LogRecord> records(long offset) {
    if (offset < 0) {
      throw new IllegalArgumentException("offset must be >= 0");
    }
    return () -> new RecordIterator(offset);
  }

  /**
   * Streams every record in the log.
   *
   * @return sequential ordered stream
   */
  public Stream<LogRecord> stream() {
    Spliterator<LogRecord> spliterator = Spliterators.spliteratorUnknownSize(
        new RecordIterator(firstRecordOffset()), Spliterator.ORDERED | Spliterator.NONNULL);
    return StreamSupport.stream(spliterator, false);
  }

  /**
   * Returns the size of the underlying buffer.
   *
   * @return buffer length in bytes
   */
  public int length() {
    return buffer.length;
  }

  private final class RecordIterator implements Iterator<LogRecord> {
    private long position;
    private LogRecord next;
    private boolean finished;

    private RecordIterator(long position) {
      this.position = position;
    }

    @Override
    public boolean hasNext() {
      if (next != null) {
        return true;
      }
      if (finished) {
        return false;
      }
      next = decodeAt();
      if (next == null) {
        finished = true;
      }
      return next != null;
    }

    @Override
    public LogRecord next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      LogRecord record = next;
      next = null;
      return record;
    }

    private LogRecord decodeAt() {
      long pos = position;
      if (!Bytes.hasRemaining(buffer, pos, MIN_RECORD_HEADER)) {
        return null;
      }
      int head = Bytes.u8(buffer, (int) pos);
      int entryWidth = (head & 0x3) + 1;
      int sizeWidth = ((head >> 2) & 0x3) + 1;
      int timestampWidth = ((head >> 4) & 0x7) + 1;
      int headerLength = 1 + entryWidth + sizeWidth + timestampWidth;
      if (!Bytes.hasRemaining(buffer, pos, headerLength)) {
        return null;
      }
      int cursor = (int) pos + 1;
      long entryId = Bytes.uLe(buffer, cursor, entryWidth);
      cursor += entryWidth;
      long size = Bytes.uLe(buffer, cursor, sizeWidth);
      cursor += sizeWidth;
      long timestamp = Bytes.uLe(buffer, cursor, timestampWidth);
      cursor += timestampWidth;
      if (!Bytes.hasRemaining(buffer, cursor, size)) {
        return null;
      }
      byte[] payload = Arrays.copyOfRange(buffer, cursor, cursor + (int) size);
      position = cursor + size;
      return new LogRecord(entryId, timestamp, payload);
    }
  }
}
