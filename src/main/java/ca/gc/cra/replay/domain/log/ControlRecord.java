package ca.gc.cra.replay.domain.log;

import ca.gc.cra.replay.domain.util.Bytes;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Entry lifecycle instruction carried by a control record (entry id {@code 0}).
 *
 * <p>The first payload byte selects the kind; payloads too short for their kind, or whose inner
 * length-prefixed strings run past the payload, are not recognized and parse to empty.</p>
 *
 * @since 0.1.0
 */
public sealed interface ControlRecord
    permits ControlRecord.Start, ControlRecord.Finish, ControlRecord.SetMetadata {

  /** Control kind byte for {@link Start}. */
  int KIND_START = 0;
  /** Control kind byte for {@link Finish}. */
  int KIND_FINISH = 1;
  /** Control kind byte for {@link SetMetadata}. */
  int KIND_SET_METADATA = 2;

  /**
   * Returns the id of the entry this instruction targets.
   *
   * @return unsigned 32-bit entry id
   */
  long entryId();

  /**
   * Registers an entry.
   *
   * @param entryId id being registered
   * @param name entry name (the replay key)
   * @param typeName declared type name
   * @param metadata free-form metadata, often JSON
   */
  record Start(long entryId, String name, String typeName, String metadata) implements ControlRecord {}

  /**
   * Retires an entry.
   *
   * @param entryId id being retired
   */
  record Finish(long entryId) implements ControlRecord {}

  /**
   * Replaces the metadata of a live entry.
   *
   * @param entryId target id
   * @param metadata replacement metadata
   */
  record SetMetadata(long entryId, String metadata) implements ControlRecord {}

  /**
   * Parses a control payload.
   *
   * @param payload control record payload
   * @return parsed instruction, or empty when the payload is not a recognized control record
   */
  static Optional<ControlRecord> parse(byte[] payload) {
    if (payload == null || payload.length == 0) {
      return Optional.empty();
    }
    int kind = Bytes.u8(payload, 0);
    return switch (kind) {
      case KIND_START -> parseStart(payload);
      case KIND_FINISH -> payload.length == 5
          ? Optional.of(new Finish(Bytes.u32le(payload, 1)))
          : Optional.empty();
      case KIND_SET_METADATA -> parseSetMetadata(payload);
      default -> Optional.empty();
    };
  }

  private static Optional<ControlRecord> parseStart(byte[] payload) {
    if (payload.length < 17) {
      return Optional.empty();
    }
    long entryId = Bytes.u32le(payload, 1);
    int[] cursor = {5};
    String name = readInnerString(payload, cursor);
    String type = readInnerString(payload, cursor);
    String metadata = readInnerString(payload, cursor);
    if (name == null || type == null || metadata == null) {
      return Optional.empty();
    }
    return Optional.of(new Start(entryId, name, type, metadata));
  }

  private static Optional<ControlRecord> parseSetMetadata(byte[] payload) {
    if (payload.length < 9) {
      return Optional.empty();
    }
    long entryId = Bytes.u32le(payload, 1);
    int[] cursor = {5};
    String metadata = readInnerString(payload, cursor);
    if (metadata == null) {
      return Optional.empty();
    }
    return Optional.of(new SetMetadata(entryId, metadata));
  }

  private static String readInnerString(byte[] payload, int[] cursor) {
    int pos = cursor[0];
    if (!Bytes.hasRemaining(payload, pos, 4)) {
      return null;
    }
    long length = Bytes.u32le(payload, pos);
    if (!Bytes.hasRemaining(payload, pos + 4L, length)) {
      return null;
    }
    cursor[0] = pos + 4 + (int) length;
    return new String(payload, pos + 4, (int) length, StandardCharsets.UTF_8);
  }
}
