package ca.gc.cra.vigil.domain.validation;

/**
 * <strong>What:</strong> Outcome of one validation: either valid with an optional normalized value, or invalid
 * with a non-empty message.
 * <p><strong>Why:</strong> Invalid input is an expected outcome, not an exception; callers branch on
 * {@link #valid()}.</p>
 * <p><strong>Role:</strong> Domain value returned by every validator.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; safe for sharing.</p>
 *
 * @param valid whether the input passed every rule
 * @param errorMessage failure message; {@code null} on success
 * @param normalizedValue canonical form of valid input; {@code null} on failure
 * @since 0.1.0
 */
public record ValidationResult(boolean valid, String errorMessage, Object normalizedValue) {
  /**
   * Enforces the two legal shapes.
   *
   * @throws IllegalArgumentException when a success carries a message or a failure lacks one or carries a value
   */
  public ValidationResult {
    if (valid && errorMessage != null) {
      throw new IllegalArgumentException("valid result must not carry an error message");
    }
    if (!valid && (errorMessage == null || errorMessage.isEmpty())) {
      throw new IllegalArgumentException("errorMessage must not be empty for an invalid result");
    }
    if (!valid && normalizedValue != null) {
      throw new IllegalArgumentException("invalid result must not carry a normalized value");
    }
  }

  /**
   * Creates a success.
   *
   * @param normalizedValue canonical value; may be {@code null}
   * @return valid result
   */
  public static ValidationResult success(Object normalizedValue) {
    return new ValidationResult(true, null, normalizedValue);
  }

  /**
   * Creates a success without a normalized value.
   *
   * @return valid result
   */
  public static ValidationResult success() {
    return success(null);
  }

  /**
   * Creates a failure.
   *
   * @param message non-empty message
   * @return invalid result
   */
  public static ValidationResult failure(String message) {
    return new ValidationResult(false, message, null);
  }

  /**
   * Creates a failure, letting a non-empty {@code customErrorMessage} replace the generated message.
   *
   * @param message generated message
   * @param config options of the current call; may be {@code null}
   * @return invalid result
   */
  public static ValidationResult failure(String message, ValidationConfig config) {
    if (config != null) {
      String custom = config.customErrorMessage().orElse("");
      if (!custom.isEmpty()) {
        return failure(custom);
      }
    }
    return failure(message);
  }

  /**
   * Returns the normalized value cast to the expected type.
   *
   * @param type expected type
   * @param <T> expected type
   * @return normalized value, or {@code null} when there is none
   * @throws ClassCastException when the value has another type
   */
  public <T> T normalizedValueAs(Class<T> type) {
    return type.cast(normalizedValue);
  }
}
