package ca.gc.cra.replay.infrastructure.sink;

import ca.gc.cra.replay.domain.log.ValueType;
import ca.gc.cra.replay.domain.replay.SampleValue;
import ca.gc.cra.replay.domain.replay.SinkValues;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Serializes one key/value update into the JSON document published to message-based sinks.
 *
 * <p>Document shape: {@code {"key", "type", "typeName", "value", "metadata"}} plus {@code rawType} for raw
 * payloads. {@code type} is the wire type after encoding: {@code boolean}, {@code double}, {@code string},
 * {@code boolean[]}, {@code double[]}, {@code string[]} or {@code raw}; integers and floats are widened to
 * doubles. Raw values stay hex encoded.</p>
 */
public final class SinkRecordJson {
  private static final JsonFactory FACTORY = new JsonFactory();
  private static final HexFormat HEX = HexFormat.of();

  private SinkRecordJson() {}

  /**
   * Serializes an update.
   *
   * @param key entry name
   * @param value value to encode
   * @return UTF-8 JSON bytes
   */
  public static byte[] serialize(String key, SampleValue value) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(value, "value");
    ByteArrayOutputStream out = new ByteArrayOutputStream(128);
    try (JsonGenerator gen = FACTORY.createGenerator(out)) {
      gen.writeStartObject();
      gen.writeStringField("key", key);
      ValueType type = value.valueType();
      gen.writeStringField("type", wireType(type));
      gen.writeStringField("typeName", value.typeName());
      gen.writeFieldName("value");
      writeValue(gen, type, value.value());
      gen.writeStringField("metadata", value.metadata());
      if (type == ValueType.RAW) {
        gen.writeStringField("rawType", RawTypeTags.resolve(value.typeName(), value.metadata()));
      }
      gen.writeEndObject();
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to serialize value for key " + key, ex);
    }
    return out.toByteArray();
  }

  static String wireType(ValueType type) {
    return switch (type) {
      case BOOLEAN -> "boolean";
      case INT64, FLOAT, DOUBLE -> "double";
      case STRING -> "string";
      case BOOLEAN_ARRAY -> "boolean[]";
      case INT64_ARRAY, FLOAT_ARRAY, DOUBLE_ARRAY -> "double[]";
      case STRING_ARRAY -> "string[]";
      case RAW -> "raw";
    };
  }

  private static void writeValue(JsonGenerator gen, ValueType type, String value) throws IOException {
    switch (type) {
      case BOOLEAN -> gen.writeBoolean(SinkValues.parseBoolean(value));
      case INT64, FLOAT, DOUBLE -> writeDouble(gen, SinkValues.parseDouble(value));
      case STRING -> gen.writeString(value);
      case BOOLEAN_ARRAY -> {
        gen.writeStartArray();
        for (boolean b : SinkValues.parseBooleanArray(value)) {
          gen.writeBoolean(b);
        }
        gen.writeEndArray();
      }
      case INT64_ARRAY, FLOAT_ARRAY, DOUBLE_ARRAY -> {
        gen.writeStartArray();
        for (double d : SinkValues.parseDoubleArray(value)) {
          writeDouble(gen, d);
        }
        gen.writeEndArray();
      }
      case STRING_ARRAY -> {
        gen.writeStartArray();
        for (String s : SinkValues.parseStringArray(value)) {
          gen.writeString(s);
        }
        gen.writeEndArray();
      }
      case RAW -> gen.writeString(HEX.formatHex(SinkValues.parseHex(value)));
    }
  }

  private static void writeDouble(JsonGenerator gen, double value) throws IOException {
    if (Double.isFinite(value)) {
      gen.writeNumber(value);
    } else {
      gen.writeString(Double.toString(value));
    }
  }
}
