package ca.gc.cra.vigil.guard;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem guards for files named on the command line (profiles, batch inputs).
 * <p><strong>Thread-safety:</strong> Stateless; results depend on the filesystem at call time.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Validates that a path names an existing, readable regular file.
   *
   * @param name option name for diagnostics
   * @param path candidate file; must not be {@code null}
   * @return absolute normalized path
   * @throws IllegalArgumentException if the path contains control characters, is missing, is a directory or
   *         is not readable
   */
  public static Path requireReadableFile(String name, Path path) {
    if (path == null) {
      throw new IllegalArgumentException(Strings.message(name, "must not be null"));
    }
    String raw = path.toString();
    for (int i = 0; i < raw.length(); i++) {
      if (Character.isISOControl(raw.charAt(i))) {
        throw new IllegalArgumentException(Strings.message(name, "must not contain control characters"));
      }
    }
    Path normalized = path.toAbsolutePath().normalize();
    if (!Files.exists(normalized)) {
      throw new IllegalArgumentException(Strings.message(name, "does not exist: " + normalized));
    }
    if (!Files.isRegularFile(normalized)) {
      throw new IllegalArgumentException(Strings.message(name, "is not a regular file: " + normalized));
    }
    if (!Files.isReadable(normalized)) {
      throw new IllegalArgumentException(Strings.message(name, "is not readable: " + normalized));
    }
    return normalized;
  }
}
