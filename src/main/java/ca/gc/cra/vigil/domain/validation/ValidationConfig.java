package ca.gc.cra.vigil.domain.validation;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;

/**
 * <strong>What:</strong> Immutable per-call options understood by the validators.
 * <p><strong>Why:</strong> One option bag serves every validator; each validator reads the options that apply
 * to it and ignores the rest.</p>
 * <p><strong>Role:</strong> Domain value built by callers, YAML profiles or CLI arguments.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe for concurrent sharing.</p>
 *
 * @since 0.1.0
 */
public final class ValidationConfig {
  private static final ValidationConfig NONE = builder().build();

  private final OptionalDouble min;
  private final OptionalDouble max;
  private final OptionalInt minLength;
  private final OptionalInt maxLength;
  private final OptionalInt fixLength;
  private final Optional<DecimalBounds> decimals;
  private final Optional<Boolean> allowSpecialChars;
  private final List<String> acceptedFileExtensions;
  private final Optional<String> customErrorMessage;
  private final Optional<InputValue> birthDate;

  private ValidationConfig(Builder builder) {
    this.min = builder.min;
    this.max = builder.max;
    this.minLength = builder.minLength;
    this.maxLength = builder.maxLength;
    this.fixLength = builder.fixLength;
    this.decimals = builder.decimals;
    this.allowSpecialChars = builder.allowSpecialChars;
    this.acceptedFileExtensions = List.copyOf(builder.acceptedFileExtensions);
    this.customErrorMessage = builder.customErrorMessage;
    this.birthDate = builder.birthDate;
  }

  /**
   * Returns the empty configuration.
   *
   * @return configuration with no option set
   */
  public static ValidationConfig none() {
    return NONE;
  }

  /**
   * Creates an empty builder.
   *
   * @return new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Creates a builder pre-populated with this configuration's options.
   *
   * @return builder copy
   */
  public Builder toBuilder() {
    Builder builder = new Builder();
    builder.min = min;
    builder.max = max;
    builder.minLength = minLength;
    builder.maxLength = maxLength;
    builder.fixLength = fixLength;
    builder.decimals = decimals;
    builder.allowSpecialChars = allowSpecialChars;
    builder.acceptedFileExtensions = new ArrayList<>(acceptedFileExtensions);
    builder.customErrorMessage = customErrorMessage;
    builder.birthDate = birthDate;
    return builder;
  }

  /** @return inclusive lower bound (numeric value, epoch millis for dates, years for ages) */
  public OptionalDouble min() {
    return min;
  }

  /** @return inclusive upper bound (numeric value, epoch millis for dates, years for ages) */
  public OptionalDouble max() {
    return max;
  }

  /** @return minimum length in characters */
  public OptionalInt minLength() {
    return minLength;
  }

  /** @return maximum length in characters */
  public OptionalInt maxLength() {
    return maxLength;
  }

  /** @return exact length in characters */
  public OptionalInt fixLength() {
    return fixLength;
  }

  /** @return decimal-place bounds for numeric values */
  public Optional<DecimalBounds> decimals() {
    return decimals;
  }

  /**
   * Returns the special-character switch. Only an explicit {@code false} restricts text to letters, digits
   * and whitespace; unset and {@code true} behave the same.
   *
   * @return tri-state flag
   */
  public Optional<Boolean> allowSpecialChars() {
    return allowSpecialChars;
  }

  /** @return accepted file extensions as configured; empty when any extension is allowed */
  public List<String> acceptedFileExtensions() {
    return acceptedFileExtensions;
  }

  /** @return message replacing generated failure messages */
  public Optional<String> customErrorMessage() {
    return customErrorMessage;
  }

  /** @return birth date used by the age validator instead of the validated value */
  public Optional<InputValue> birthDate() {
    return birthDate;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ValidationConfig)) {
      return false;
    }
    ValidationConfig other = (ValidationConfig) o;
    return min.equals(other.min)
        && max.equals(other.max)
        && minLength.equals(other.minLength)
        && maxLength.equals(other.maxLength)
        && fixLength.equals(other.fixLength)
        && decimals.equals(other.decimals)
        && allowSpecialChars.equals(other.allowSpecialChars)
        && acceptedFileExtensions.equals(other.acceptedFileExtensions)
        && customErrorMessage.equals(other.customErrorMessage)
        && birthDate.equals(other.birthDate);
  }

  @Override
  public int hashCode() {
    return Objects.hash(min, max, minLength, maxLength, fixLength, decimals, allowSpecialChars,
        acceptedFileExtensions, customErrorMessage, birthDate);
  }

  @Override
  public String toString() {
    return "ValidationConfig{"
        + "min=" + min
        + ", max=" + max
        + ", minLength=" + minLength
        + ", maxLength=" + maxLength
        + ", fixLength=" + fixLength
        + ", decimals=" + decimals
        + ", allowSpecialChars=" + allowSpecialChars
        + ", acceptedFileExtensions=" + acceptedFileExtensions
        + ", customErrorMessage=" + customErrorMessage.isPresent()
        + ", birthDate=" + birthDate.isPresent()
        + '}';
  }

  /**
   * Mutable builder for {@link ValidationConfig}. Not thread-safe.
   *
   * @since 0.1.0
   */
  public static final class Builder {
    private OptionalDouble min = OptionalDouble.empty();
    private OptionalDouble max = OptionalDouble.empty();
    private OptionalInt minLength = OptionalInt.empty();
    private OptionalInt maxLength = OptionalInt.empty();
    private OptionalInt fixLength = OptionalInt.empty();
    private Optional<DecimalBounds> decimals = Optional.empty();
    private Optional<Boolean> allowSpecialChars = Optional.empty();
    private List<String> acceptedFileExtensions = new ArrayList<>();
    private Optional<String> customErrorMessage = Optional.empty();
    private Optional<InputValue> birthDate = Optional.empty();

    private Builder() {}

    /**
     * Sets the inclusive lower bound.
     *
     * @param value bound; must not be NaN
     * @return this builder
     */
    public Builder min(double value) {
      this.min = OptionalDouble.of(requireNumber(value, "min"));
      return this;
    }

    /**
     * Sets the inclusive upper bound.
     *
     * @param value bound; must not be NaN
     * @return this builder
     */
    public Builder max(double value) {
      this.max = OptionalDouble.of(requireNumber(value, "max"));
      return this;
    }

    /**
     * Sets the minimum length.
     *
     * @param value length; must be non-negative
     * @return this builder
     */
    public Builder minLength(int value) {
      this.minLength = OptionalInt.of(requireLength(value, "minLength"));
      return this;
    }

    /**
     * Sets the maximum length.
     *
     * @param value length; must be non-negative
     * @return this builder
     */
    public Builder maxLength(int value) {
      this.maxLength = OptionalInt.of(requireLength(value, "maxLength"));
      return this;
    }

    /**
     * Sets the exact length.
     *
     * @param value length; must be non-negative
     * @return this builder
     */
    public Builder fixLength(int value) {
      this.fixLength = OptionalInt.of(requireLength(value, "fixLength"));
      return this;
    }

    /**
     * Sets the decimal-place bounds.
     *
     * @param value bounds; {@code null} clears them
     * @return this builder
     */
    public Builder decimals(DecimalBounds value) {
      this.decimals = Optional.ofNullable(value);
      return this;
    }

    /**
     * Sets the special-character switch.
     *
     * @param value {@code false} restricts text to letters, digits and whitespace; {@code null} unsets
     * @return this builder
     */
    public Builder allowSpecialChars(Boolean value) {
      this.allowSpecialChars = Optional.ofNullable(value);
      return this;
    }

    /**
     * Replaces the accepted file extensions.
     *
     * @param values extensions with or without leading dot; {@code null} clears them
     * @return this builder
     */
    public Builder acceptedFileExtensions(List<String> values) {
      this.acceptedFileExtensions = new ArrayList<>();
      if (values != null) {
        for (String value : values) {
          this.acceptedFileExtensions.add(Objects.requireNonNull(value, "acceptedFileExtensions entry"));
        }
      }
      return this;
    }

    /**
     * Sets the message replacing generated failure messages. An empty message is ignored by validators.
     *
     * @param value message; {@code null} clears it
     * @return this builder
     */
    public Builder customErrorMessage(String value) {
      this.customErrorMessage = Optional.ofNullable(value);
      return this;
    }

    /**
     * Sets the birth date used by the age validator.
     *
     * @param value text, number or temporal object; {@code null} clears it
     * @return this builder
     */
    public Builder birthDate(Object value) {
      InputValue input = InputValue.of(value);
      this.birthDate = input.kind() == InputValue.Kind.ABSENT ? Optional.empty() : Optional.of(input);
      return this;
    }

    /**
     * Builds the immutable configuration.
     *
     * @return configuration
     */
    public ValidationConfig build() {
      return new ValidationConfig(this);
    }

    private static double requireNumber(double value, String name) {
      if (Double.isNaN(value)) {
        throw new IllegalArgumentException(name + " must be a number");
      }
      return value;
    }

    private static int requireLength(int value, String name) {
      if (value < 0) {
        throw new IllegalArgumentException(name + " must be >= 0");
      }
      return value;
    }
  }
}
