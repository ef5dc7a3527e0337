package ca.gc.cra.replay.config;

import ca.gc.cra.replay.validation.Paths;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Typed configuration of the {@code convert} mode.
 *
 * @param input binary log to decode
 * @param output interchange CSV to write; defaults to the input path with a {@code .csv} extension
 * @param telemetry metrics settings
 * @since 0.1.0
 */
public record ConvertConfig(Path input, Path output, TelemetryConfig telemetry) {
  /**
   * Validates presence of the paths.
   */
  public ConvertConfig {
    Objects.requireNonNull(input, "input");
    Objects.requireNonNull(output, "output");
    Objects.requireNonNull(telemetry, "telemetry");
  }

  /**
   * Builds a configuration from flattened key/value pairs.
   *
   * @param map merged configuration; {@code in} is required
   * @return validated configuration
   * @throws IllegalArgumentException when {@code in} is missing or a path is invalid
   */
  public static ConvertConfig fromMap(Map<String, String> map) {
    Objects.requireNonNull(map, "map");
    String in = map.getOrDefault("in", "").trim();
    if (in.isEmpty()) {
      throw new IllegalArgumentException("in is required");
    }
    Path input = Paths.parse("in", in);
    String out = map.getOrDefault("out", "").trim();
    Path output = out.isEmpty() ? defaultOutput(input) : Paths.parse("out", out);
    return new ConvertConfig(input, output, TelemetryConfig.fromMap(map));
  }

  static Path defaultOutput(Path input) {
    String name = input.getFileName().toString();
    int dot = name.lastIndexOf('.');
    String base = dot > 0 ? name.substring(0, dot) : name;
    return input.resolveSibling(base + ".csv");
  }
}
