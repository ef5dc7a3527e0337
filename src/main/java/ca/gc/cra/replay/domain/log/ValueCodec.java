package ca.gc.cra.replay.domain.log;

import ca.gc.cra.replay.domain.util.Bytes;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.HexFormat;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Decodes data record payloads into their string-encoded value form.
 *
 * <p>Array values are comma-joined, booleans encode as {@code true}/{@code false}, and raw payloads as
 * lowercase hex. Stateless and thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class ValueCodec {
  private static final HexFormat HEX = HexFormat.of();

  private ValueCodec() {}

  /**
   * Decodes a payload according to its value type.
   *
   * @param type declared value type
   * @param payload data record payload
   * @return string-encoded value
   * @throws IllegalArgumentException when the payload does not fit the type
   */
  public static String decode(ValueType type, byte[] payload) {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(payload, "payload");
    return switch (type) {
      case BOOLEAN -> {
        requireLength(type, payload.length >= 1, payload);
        yield Boolean.toString(payload[0] != 0);
      }
      case INT64 -> {
        requireLength(type, payload.length >= 1 && payload.length <= 8, payload);
        yield Long.toString(Bytes.sLe(payload, 0, payload.length));
      }
      case FLOAT -> {
        requireLength(type, payload.length == 4, payload);
        yield Float.toString(Float.intBitsToFloat((int) Bytes.uLe(payload, 0, 4)));
      }
      case DOUBLE -> {
        requireLength(type, payload.length == 8, payload);
        yield Double.toString(Double.longBitsToDouble(Bytes.uLe(payload, 0, 8)));
      }
      case STRING -> utf8(payload, 0, payload.length);
      case BOOLEAN_ARRAY -> {
        StringJoiner joiner = new StringJoiner(",");
        for (byte b : payload) {
          joiner.add(Boolean.toString(b != 0));
        }
        yield joiner.toString();
      }
      case INT64_ARRAY -> {
        requireLength(type, payload.length % 8 == 0, payload);
        StringJoiner joiner = new StringJoiner(",");
        for (int off = 0; off < payload.length; off += 8) {
          joiner.add(Long.toString(Bytes.uLe(payload, off, 8)));
        }
        yield joiner.toString();
      }
      case FLOAT_ARRAY -> {
        requireLength(type, payload.length % 4 == 0, payload);
        StringJoiner joiner = new StringJoiner(",");
        for (int off = 0; off < payload.length; off += 4) {
          joiner.add(Float.toString(Float.intBitsToFloat((int) Bytes.uLe(payload, off, 4))));
        }
        yield joiner.toString();
      }
      case DOUBLE_ARRAY -> {
        requireLength(type, payload.length % 8 == 0, payload);
        StringJoiner joiner = new StringJoiner(",");
        for (int off = 0; off < payload.length; off += 8) {
          joiner.add(Double.toString(Double.longBitsToDouble(Bytes.uLe(payload, off, 8))));
        }
        yield joiner.toString();
      }
      case STRING_ARRAY -> decodeStringArray(payload);
      case RAW -> HEX.formatHex(payload);
    };
  }

  private static String decodeStringArray(byte[] payload) {
    requireLength(ValueType.STRING_ARRAY, payload.length >= 4, payload);
    long count = Bytes.u32le(payload, 0);
    StringJoiner joiner = new StringJoiner(",");
    long pos = 4;
    for (long i = 0; i < count; i++) {
      if (!Bytes.hasRemaining(payload, pos, 4)) {
        throw new IllegalArgumentException("string[] element " + i + " header truncated");
      }
      long length = Bytes.u32le(payload, (int) pos);
      if (!Bytes.hasRemaining(payload, pos + 4, length)) {
        throw new IllegalArgumentException("string[] element " + i + " truncated");
      }
      joiner.add(utf8(payload, (int) pos + 4, (int) length));
      pos += 4 + length;
    }
    return joiner.toString();
  }

  private static String utf8(byte[] payload, int offset, int length) {
    try {
      return StandardCharsets.UTF_8.newDecoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT)
          .decode(ByteBuffer.wrap(payload, offset, length))
          .toString();
    } catch (CharacterCodingException ex) {
      throw new IllegalArgumentException("payload is not valid UTF-8", ex);
    }
  }

  private static void requireLength(ValueType type, boolean valid, byte[] payload) {
    if (!valid) {
      throw new IllegalArgumentException(
          "payload of " + payload.length + " bytes does not fit " + type.typeName());
    }
  }
}
