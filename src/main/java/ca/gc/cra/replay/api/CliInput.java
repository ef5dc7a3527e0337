package ca.gc.cra.replay.api;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Command-line arguments split into {@code key=value} pairs and {@code --flags}.
 *
 * @param keyValueArgs arguments that are not flags, in order
 * @param flags lowercase flags; help and verbose aliases are normalized to {@code --help} and {@code --verbose}
 * @since 0.1.0
 */
public record CliInput(List<String> keyValueArgs, Set<String> flags) {
  private static final Set<String> HELP_ALIASES = Set.of("--help", "-h", "help");
  private static final Set<String> VERBOSE_ALIASES = Set.of("--verbose", "-v", "--debug");

  /**
   * Copies the collections.
   */
  public CliInput {
    keyValueArgs = List.copyOf(keyValueArgs);
    flags = Set.copyOf(flags);
  }

  /**
   * Splits raw arguments; blank and {@code null} entries are ignored.
   *
   * @param args raw arguments, may be {@code null}
   * @return parsed arguments
   */
  public static CliInput parse(String[] args) {
    List<String> pairs = new ArrayList<>();
    Set<String> flags = new LinkedHashSet<>();
    if (args != null) {
      for (String raw : args) {
        String arg = raw == null ? "" : raw.trim();
        if (arg.isEmpty()) {
          continue;
        }
        String lower = arg.toLowerCase(Locale.ROOT);
        if (HELP_ALIASES.contains(lower)) {
          flags.add("--help");
        } else if (VERBOSE_ALIASES.contains(lower)) {
          flags.add("--verbose");
        } else if (arg.startsWith("-") && arg.indexOf('=') < 0) {
          flags.add(lower);
        } else {
          pairs.add(arg);
        }
      }
    }
    return new CliInput(pairs, flags);
  }

  /**
   * Returns the non-flag arguments as an array.
   *
   * @return copy of the arguments
   */
  public String[] keyValueArray() {
    return keyValueArgs.toArray(String[]::new);
  }

  /**
   * Whether help was requested.
   *
   * @return {@code true} for any help alias
   */
  public boolean help() {
    return flags.contains("--help");
  }

  /**
   * Whether DEBUG logging was requested.
   *
   * @return {@code true} for any verbose alias
   */
  public boolean verbose() {
    return flags.contains("--verbose");
  }

  /**
   * Checks for a flag, case-insensitively.
   *
   * @param flag flag such as {@code --dry-run}
   * @return {@code true} if present
   */
  public boolean hasFlag(String flag) {
    return flag != null && flags.contains(flag.trim().toLowerCase(Locale.ROOT));
  }
}
