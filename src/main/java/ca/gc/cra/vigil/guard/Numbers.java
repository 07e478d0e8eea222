package ca.gc.cra.vigil.guard;

/**
 * <strong>What:</strong> Numeric guards used by CLI and YAML option parsing.
 * <p><strong>Why:</strong> Bounds and lengths must be real numbers within sane limits before they reach a
 * {@code ValidationConfig}.</p>
 * <p><strong>Thread-safety:</strong> Stateless utility.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that a value falls within an inclusive range.
   *
   * @param name option name included in diagnostics; defaults to {@code "value"} when blank
   * @param value candidate value
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return the validated value for fluent call sites
   * @throws IllegalArgumentException if {@code value} lies outside {@code [min, max]}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          Strings.message(name, "must be between " + min + " and " + max + " (was " + value + ")"));
    }
    return value;
  }

  /**
   * Parses a non-negative integer such as a length or a decimal-place count.
   *
   * @param name option name for diagnostics
   * @param value candidate text; must not be {@code null}
   * @return parsed integer
   * @throws IllegalArgumentException if the text is not an integer or is negative
   */
  public static int parseNonNegativeInt(String name, String value) {
    String trimmed = Strings.requireNonBlank(name, value);
    long parsed;
    try {
      parsed = Long.parseLong(trimmed);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(Strings.message(name, "must be an integer (was " + trimmed + ")"), ex);
    }
    return (int) requireRange(name, parsed, 0, Integer.MAX_VALUE);
  }

  /**
   * Parses a finite decimal number such as a range bound.
   *
   * @param name option name for diagnostics
   * @param value candidate text; must not be {@code null}
   * @return parsed number
   * @throws IllegalArgumentException if the text is not a finite number
   */
  public static double parseFinite(String name, String value) {
    String trimmed = Strings.requireNonBlank(name, value);
    double parsed;
    try {
      parsed = Double.parseDouble(trimmed);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(Strings.message(name, "must be a number (was " + trimmed + ")"), ex);
    }
    if (!Double.isFinite(parsed)) {
      throw new IllegalArgumentException(Strings.message(name, "must be finite (was " + trimmed + ")"));
    }
    return parsed;
  }
}
