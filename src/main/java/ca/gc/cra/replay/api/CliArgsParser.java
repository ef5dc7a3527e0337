package ca.gc.cra.replay.api;

import ca.gc.cra.replay.validation.Strings;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Turns {@code key=value} arguments into a map, splitting on the first {@code '='}.
 * <p>Stateless and thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class CliArgsParser {
  private static final Pattern KEY_PATTERN = Pattern.compile("^[A-Za-z0-9._-]+$");

  private CliArgsParser() {}

  /**
   * Parses arguments. Values may be wrapped in one pair of quotes, which is removed; an empty value is kept so a
   * default can be cleared.
   *
   * @param args raw arguments; {@code null} returns an empty map
   * @return mutable map in argument order
   * @throws IllegalArgumentException for a missing {@code '='}, an invalid key, a repeated key, or control characters
   */
  public static Map<String, String> toMap(String[] args) {
    Map<String, String> map = new LinkedHashMap<>();
    if (args == null) {
      return map;
    }
    for (String raw : args) {
      String arg = raw == null ? "" : raw.trim();
      if (arg.isEmpty()) {
        continue;
      }
      int idx = arg.indexOf('=');
      if (idx <= 0) {
        throw new IllegalArgumentException("argument must be key=value (was '" + raw + "')");
      }
      String key = arg.substring(0, idx).trim();
      if (!KEY_PATTERN.matcher(key).matches()) {
        throw new IllegalArgumentException("invalid argument name: " + key);
      }
      String value = Strings.stripQuotes(arg.substring(idx + 1));
      if (Strings.containsControl(value)) {
        throw new IllegalArgumentException("argument " + key + " must not contain control characters");
      }
      if (map.put(key, value) != null) {
        throw new IllegalArgumentException("argument " + key + " given more than once");
      }
    }
    return map;
  }
}
