package ca.gc.cra.replay.infrastructure.sink;

import ca.gc.cra.replay.domain.log.ValueType;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.util.Optional;

/**
 * Resolves the type tag that accompanies raw payloads at the sink.
 *
 * <p>Order of preference: the {@code type} string field of the entry's JSON metadata, then the entry's own type
 * name when it is not one of the well-known types (for example {@code struct:Pose2d}), then {@code raw}.</p>
 */
public final class RawTypeTags {
  static final String FALLBACK = "raw";
  private static final JsonFactory FACTORY = new JsonFactory();

  private RawTypeTags() {}

  /**
   * Resolves the tag.
   *
   * @param typeName entry type name
   * @param metadata entry metadata, possibly JSON
   * @return non-blank type tag
   */
  public static String resolve(String typeName, String metadata) {
    Optional<String> fromMetadata = typeField(metadata);
    if (fromMetadata.isPresent()) {
      return fromMetadata.get();
    }
    if (typeName != null && !typeName.isBlank()
        && ValueType.fromTypeName(typeName) == ValueType.RAW
        && !FALLBACK.equals(typeName.trim())) {
      return typeName.trim();
    }
    return FALLBACK;
  }

  /**
   * Extracts the top-level {@code type} string from a JSON object.
   *
   * @param metadata candidate JSON text
   * @return the field value, or empty when absent, blank, or not JSON
   */
  static Optional<String> typeField(String metadata) {
    if (metadata == null || metadata.isBlank()) {
      return Optional.empty();
    }
    try (JsonParser parser = FACTORY.createParser(metadata)) {
      if (parser.nextToken() != JsonToken.START_OBJECT) {
        return Optional.empty();
      }
      JsonToken token;
      while ((token = parser.nextToken()) == JsonToken.FIELD_NAME) {
        String field = parser.currentName();
        JsonToken value = parser.nextToken();
        if ("type".equals(field) && value == JsonToken.VALUE_STRING) {
          String text = parser.getText();
          return text.isBlank() ? Optional.empty() : Optional.of(text);
        }
        parser.skipChildren();
      }
      return Optional.empty();
    } catch (IOException ex) {
      return Optional.empty();
    }
  }
}
