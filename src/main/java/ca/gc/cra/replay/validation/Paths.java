package ca.gc.cra.replay.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/**
 * File path validation for log inputs and interchange outputs.
 *
 * @since 0.1.0
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Parses a user supplied path string.
   *
   * @param name logical parameter name for diagnostics
   * @param raw path text
   * @return parsed path
   * @throws IllegalArgumentException when the text is blank or not a valid path
   */
  public static Path parse(String name, String raw) {
    String text = Strings.requireNonBlank(name, raw);
    try {
      return Path.of(text);
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(name + " is not a valid path: " + text, ex);
    }
  }

  /**
   * Ensures a path names an existing, readable regular file.
   *
   * @param path candidate file
   * @return the real path of the file
   * @throws IllegalArgumentException when the file is missing, not regular, or unreadable
   */
  public static Path requireReadableFile(Path path) {
    try {
      Path real = path.toRealPath();
      if (!Files.isRegularFile(real)) {
        throw new IllegalArgumentException("Not a regular file: " + path);
      }
      if (!Files.isReadable(real)) {
        throw new IllegalArgumentException("File is not readable: " + path);
      }
      return real;
    } catch (IOException ex) {
      throw new IllegalArgumentException("Unable to access file: " + path, ex);
    }
  }

  /**
   * Validates an output file location, optionally creating its parent directory.
   *
   * @param path destination file
   * @param allowOverwrite whether an existing file may be replaced
   * @param createParent whether to create a missing parent directory
   * @return absolute normalized destination
   * @throws IllegalArgumentException when the destination cannot be written
   */
  public static Path validateOutputFile(Path path, boolean allowOverwrite, boolean createParent) {
    Path target = path.toAbsolutePath().normalize();
    if (Files.isDirectory(target)) {
      throw new IllegalArgumentException("Output path is a directory: " + path);
    }
    if (Files.exists(target) && !allowOverwrite) {
      throw new IllegalArgumentException("Output file exists (use --allow-overwrite): " + path);
    }
    Path parent = target.getParent();
    if (parent != null && !Files.isDirectory(parent)) {
      if (!createParent) {
        throw new IllegalArgumentException("Output directory does not exist: " + parent);
      }
      try {
        Files.createDirectories(parent);
      } catch (IOException ex) {
        throw new IllegalArgumentException("Unable to create output directory: " + parent, ex);
      }
    }
    if (parent != null && !Files.isWritable(parent)) {
      throw new IllegalArgumentException("Output directory is not writable: " + parent);
    }
    return target;
  }
}
