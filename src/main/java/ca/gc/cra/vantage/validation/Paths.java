package ca.gc.cra.vantage.validation;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem checks for input files named in configuration.
 * <p><strong>Thread-safety:</strong> Stateless; results reflect the filesystem at call time.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Paths {
  private Paths() {}

  /**
   * Resolves and validates a readable regular file.
   *
   * @param name parameter name used in diagnostics
   * @param raw candidate path text
   * @return absolute normalized path
   * @throws IllegalArgumentException if the text is blank, not a valid path, or not a readable regular file
   */
  public static Path requireReadableFile(String name, String raw) {
    String trimmed = Strings.requireNonBlank(name, raw == null ? "" : raw);
    Path path;
    try {
      path = Path.of(trimmed).toAbsolutePath().normalize();
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(name + " is not a valid path: " + trimmed, ex);
    }
    if (!Files.isRegularFile(path)) {
      throw new IllegalArgumentException(name + " does not exist or is not a file: " + path);
    }
    if (!Files.isReadable(path)) {
      throw new IllegalArgumentException(name + " is not readable: " + path);
    }
    return path;
  }
}
