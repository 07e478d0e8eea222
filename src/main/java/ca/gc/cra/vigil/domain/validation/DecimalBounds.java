package ca.gc.cra.vigil.domain.validation;

import java.util.OptionalInt;

/**
 * <strong>What:</strong> Minimum and maximum number of decimal places accepted by the numeric validator.
 * <p><strong>Thread-safety:</strong> Immutable record; safe for sharing.</p>
 *
 * @param min minimum fractional digits, or empty when unbounded
 * @param max maximum fractional digits, or empty when unbounded
 * @since 0.1.0
 */
public record DecimalBounds(OptionalInt min, OptionalInt max) {
  /**
   * Validates both bounds.
   *
   * @throws IllegalArgumentException when a bound is negative or {@code min > max}
   */
  public DecimalBounds {
    min = min == null ? OptionalInt.empty() : min;
    max = max == null ? OptionalInt.empty() : max;
    if (min.isPresent() && min.getAsInt() < 0) {
      throw new IllegalArgumentException("decimals.min must be >= 0");
    }
    if (max.isPresent() && max.getAsInt() < 0) {
      throw new IllegalArgumentException("decimals.max must be >= 0");
    }
    if (min.isPresent() && max.isPresent() && min.getAsInt() > max.getAsInt()) {
      throw new IllegalArgumentException("decimals.min must be <= decimals.max");
    }
  }

  /**
   * Creates bounds with only a maximum.
   *
   * @param max maximum number of decimal places
   * @return decimal bounds
   */
  public static DecimalBounds atMost(int max) {
    return new DecimalBounds(OptionalInt.empty(), OptionalInt.of(max));
  }

  /**
   * Creates bounds with only a minimum.
   *
   * @param min minimum number of decimal places
   * @return decimal bounds
   */
  public static DecimalBounds atLeast(int min) {
    return new DecimalBounds(OptionalInt.of(min), OptionalInt.empty());
  }

  /**
   * Creates bounds with both ends set.
   *
   * @param min minimum number of decimal places
   * @param max maximum number of decimal places
   * @return decimal bounds
   */
  public static DecimalBounds between(int min, int max) {
    return new DecimalBounds(OptionalInt.of(min), OptionalInt.of(max));
  }
}
