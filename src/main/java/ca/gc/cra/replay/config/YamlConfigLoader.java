package ca.gc.cra.replay.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.StringJoiner;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads the replay YAML file and flattens the {@code common} and mode sections into one key/value map.
 *
 * <p>Nested mappings become dotted keys. Lists of scalars are joined with commas so that list-valued
 * options (for example resource attributes) can be written either way.</p>
 */
public final class YamlConfigLoader {

  private YamlConfigLoader() {}

  /**
   * Loads YAML from {@code path}; the mode section overrides {@code common}.
   *
   * @param path location of the YAML configuration
   * @param mode CLI mode (publish, convert)
   * @return flat map, or empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the YAML structure is invalid
   */
  public static Optional<Map<String, String>> load(Path path, String mode) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(mode, "mode");
    if (!Files.exists(path)) {
      return Optional.empty();
    }
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return Optional.of(parse(reader, mode));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Invalid YAML config at " + path + ": " + ex.getMessage(), ex);
    }
  }

  /**
   * Parses a YAML document already opened by the caller.
   *
   * @param reader document source
   * @param mode CLI mode
   * @return immutable flat map; empty for an empty document
   * @throws IllegalArgumentException when the document is malformed
   */
  public static Map<String, String> parse(Reader reader, String mode) {
    Objects.requireNonNull(reader, "reader");
    String section = mode.trim().toLowerCase(Locale.ROOT);
    Object document;
    try {
      document = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("malformed YAML", ex);
    }
    if (document == null) {
      return Map.of();
    }
    Map<String, Object> root = mapping(document, "root");
    Map<String, String> flat = new LinkedHashMap<>();
    Object common = sectionOf(root, "common");
    if (common != null) {
      flattenInto(mapping(common, "common"), "", flat);
    }
    Object specific = sectionOf(root, section);
    if (specific != null) {
      flattenInto(mapping(specific, section), "", flat);
    }
    return Map.copyOf(flat);
  }

  private static Map<String, Object> mapping(Object node, String where) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(where + " must be a mapping");
    }
    Map<String, Object> out = new LinkedHashMap<>();
    raw.forEach((k, v) -> {
      if (!(k instanceof String key) || key.isBlank()) {
        throw new IllegalArgumentException(where + " has a blank or non-string key");
      }
      out.put(key.trim(), v);
    });
    return out;
  }

  private static Object sectionOf(Map<String, Object> root, String name) {
    return root.entrySet().stream()
        .filter(e -> e.getKey().toLowerCase(Locale.ROOT).equals(name))
        .map(Map.Entry::getValue)
        .findFirst()
        .orElse(null);
  }

  private static void flattenInto(Map<String, Object> node, String prefix, Map<String, String> flat) {
    for (Map.Entry<String, Object> entry : node.entrySet()) {
      String key = prefix.isEmpty() ? entry.getKey() : prefix + '.' + entry.getKey();
      Object value = entry.getValue();
      if (value instanceof Map<?, ?> nested) {
        flattenInto(mapping(nested, key), key, flat);
      } else if (value instanceof Iterable<?> list) {
        StringJoiner joined = new StringJoiner(",");
        for (Object item : list) {
          if (item instanceof Map<?, ?> || item instanceof Iterable<?>) {
            throw new IllegalArgumentException("list " + key + " must contain scalars only");
          }
          joined.add(item == null ? "" : item.toString());
        }
        flat.put(key, joined.toString());
      } else {
        flat.put(key, value == null ? "" : value.toString());
      }
    }
  }
}
