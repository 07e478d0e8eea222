package ca.gc.cra.vigil.guard;

import java.util.Locale;
import java.util.Objects;

/**
 * <strong>What:</strong> String guards for CLI arguments and YAML profile values.
 * <p><strong>Why:</strong> Option values arrive as untyped text; malformed ones must fail fast with a message
 * naming the option before any validation runs.</p>
 * <p><strong>Thread-safety:</strong> Stateless utility.</p>
 *
 * @since 0.1.0
 * @see Numbers
 * @see Paths
 */
public final class Strings {
  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank, and control-character free.
   *
   * @param name option name for diagnostics; {@code null} defaults to {@code "value"}
   * @param value candidate text; must not be {@code null}
   * @return trimmed input
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the trimmed value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Parses a strict boolean: {@code true} or {@code false}, ignoring case.
   *
   * @param name option name for diagnostics
   * @param value candidate text; must not be {@code null}
   * @return parsed flag
   * @throws IllegalArgumentException if the value is neither {@code true} nor {@code false}
   */
  public static boolean requireBoolean(String name, String value) {
    String trimmed = requireNonBlank(name, value).toLowerCase(Locale.ROOT);
    if ("true".equals(trimmed)) {
      return true;
    }
    if ("false".equals(trimmed)) {
      return false;
    }
    throw new IllegalArgumentException(message(name, "must be true or false (was " + value + ")"));
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
