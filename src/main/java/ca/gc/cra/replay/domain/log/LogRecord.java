package ca.gc.cra.replay.domain.log;

import ca.gc.cra.replay.domain.util.Bytes;
import java.util.Arrays;
import java.util.Optional;

/**
 * <strong>What:</strong> One decoded record of a binary telemetry log.
 * <p><strong>Why:</strong> Separates framing (handled by {@link LogCodec}) from interpretation of control and
 * data payloads.</p>
 * <p><strong>Role:</strong> Domain value object flowing from the codec to the {@link EntryRegistry} and
 * {@link LogProjector}.</p>
 * <p><strong>Thread-safety:</strong> Immutable; payload is defensively copied.</p>
 *
 * @param entryId unsigned 32-bit entry identifier; {@code 0} marks a control record
 * @param timestampMicros unsigned microsecond timestamp
 * @param payload record payload bytes; defensively copied
 * @since 0.1.0
 */
public record LogRecord(long entryId, long timestampMicros, byte[] payload) {
  /** Entry id reserved for control records. */
  public static final long CONTROL_ENTRY = 0L;

  /**
   * Creates a record, copying the payload.
   */
  public LogRecord {
    payload = payload != null ? payload.clone() : new byte[0];
  }

  /**
   * Returns a copy of the payload.
   *
   * @return payload bytes
   */
  @Override
  public byte[] payload() {
    return payload.clone();
  }

  /**
   * Returns the payload length without copying.
   *
   * @return payload size in bytes
   */
  public int size() {
    return payload.length;
  }

  /**
   * Indicates whether this record carries entry lifecycle information rather than a value.
   *
   * @return {@code true} when {@link #entryId()} is zero
   */
  public boolean isControl() {
    return entryId == CONTROL_ENTRY;
  }

  /**
   * Returns the timestamp in seconds.
   *
   * @return microseconds divided by one million
   */
  public double timestampSeconds() {
    return Bytes.unsignedToDouble(timestampMicros) / 1_000_000.0;
  }

  /**
   * Interprets a control record.
   *
   * @return the parsed control record, or empty for data records and unrecognized control payloads
   */
  public Optional<ControlRecord> control() {
    if (!isControl()) {
      return Optional.empty();
    }
    return ControlRecord.parse(payload);
  }

  byte[] payloadView() {
    return payload;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof LogRecord that)) {
      return false;
    }
    return entryId == that.entryId
        && timestampMicros == that.timestampMicros
        && Arrays.equals(payload, that.payload);
  }

  @Override
  public int hashCode() {
    int result = Long.hashCode(entryId);
    result = 31 * result + Long.hashCode(timestampMicros);
    result = 31 * result + Arrays.hashCode(payload);
    return result;
  }

  @Override
  public String toString() {
    return "LogRecord{"
        + "entryId=" + entryId
        + ", timestampMicros=" + Long.toUnsignedString(timestampMicros)
        + ", size=" + payload.length
        + '}';
  }
}
