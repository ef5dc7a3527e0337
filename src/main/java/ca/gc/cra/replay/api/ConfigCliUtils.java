package ca.gc.cra.replay.api;

import ca.gc.cra.replay.config.ConfigMerger;
import ca.gc.cra.replay.config.DefaultsForMode;
import ca.gc.cra.replay.config.YamlConfigLoader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;

/**
 * Layers embedded defaults, an optional YAML file and CLI arguments for one mode.
 */
final class ConfigCliUtils {

  private ConfigCliUtils() {}

  /**
   * Removes and returns the {@code config} argument.
   *
   * @param args mutable CLI map
   * @return the YAML path text, or {@code null} when absent
   */
  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    String value = args.remove("config");
    return value == null || value.isBlank() ? null : value.trim();
  }

  /**
   * Builds the effective configuration for {@code mode}.
   *
   * @param mode CLI mode
   * @param cli CLI arguments; the {@code config} entry is consumed
   * @param log logger receiving override warnings
   * @return merged map
   * @throws IOException when the YAML file cannot be read
   * @throws IllegalArgumentException when the YAML file is missing or invalid, or a cross-key rule fails
   */
  static Map<String, String> effectiveConfig(String mode, Map<String, String> cli, Logger log) throws IOException {
    String configPath = extractConfigPath(cli);
    Optional<Map<String, String>> yaml = Optional.empty();
    if (configPath != null) {
      Path path = Path.of(configPath);
      if (!Files.exists(path)) {
        throw new IllegalArgumentException("Configuration file does not exist: " + path);
      }
      yaml = YamlConfigLoader.load(path, mode);
      log.debug("Loaded {} keys from {}", yaml.map(Map::size).orElse(0), path);
    }
    return ConfigMerger.buildEffectiveConfig(mode, yaml, cli, DefaultsForMode.asFlatMap(mode), log::warn);
  }
}
