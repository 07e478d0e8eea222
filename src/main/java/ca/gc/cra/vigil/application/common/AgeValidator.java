package ca.gc.cra.vigil.application.common;

import ca.gc.cra.vigil.application.AbstractValidator;
import ca.gc.cra.vigil.application.port.ClockPort;
import ca.gc.cra.vigil.domain.util.Dates;
import ca.gc.cra.vigil.domain.util.Decimals;
import ca.gc.cra.vigil.domain.validation.InputValue;
import ca.gc.cra.vigil.domain.validation.ValidationConfig;
import ca.gc.cra.vigil.domain.validation.ValidationResult;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Derives an age in whole years from a birth date and validates it.
 * <p><strong>Why:</strong> Forms usually ask for a birth date but constrain the age (e.g. adults only).</p>
 * <p><strong>Rules:</strong> the birth date is {@code config.birthDate} when present, otherwise the validated
 * value; it must parse and not lie in the future; the age must be within 0..130 and, when configured,
 * within the inclusive {@code min}/{@code max} age bounds.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from the injected clock; safe for concurrent use.</p>
 *
 * <p>The normalized value is the age as an {@link Integer}.</p>
 *
 * @since 0.1.0
 */
public final class AgeValidator extends AbstractValidator {
  private final ClockPort clock;

  /**
   * Creates the validator.
   *
   * @param clock source of the "now" reference; must not be {@code null}
   */
  public AgeValidator(ClockPort clock) {
    super("age", "Birth date is required to calculate age");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  protected InputValue select(InputValue value, ValidationConfig config) {
    return config.birthDate().orElse(value);
  }

  @Override
  protected ValidationResult check(InputValue value, ValidationConfig config) {
    Optional<Instant> parsed = value.asInstant();
    if (parsed.isEmpty()) {
      return ValidationResult.failure("Invalid birth date format", config);
    }
    Instant birthDate = parsed.get();
    Instant now = clock.now();
    if (birthDate.isAfter(now)) {
      return ValidationResult.failure("Birth date cannot be in the future", config);
    }
    int age = Dates.calculateAge(birthDate, now);
    if (age < 0) {
      return ValidationResult.failure("Invalid age (negative)", config);
    }
    if (age > BirthDateValidator.MAX_AGE) {
      return ValidationResult.failure("Invalid age (exceeds 130 years)", config);
    }
    if (config.min().isPresent() && age < config.min().getAsDouble()) {
      return ValidationResult.failure("Age must be at least " + Decimals.format(config.min().getAsDouble()), config);
    }
    if (config.max().isPresent() && age > config.max().getAsDouble()) {
      return ValidationResult.failure("Age must be at most " + Decimals.format(config.max().getAsDouble()), config);
    }
    return ValidationResult.success(age);
  }
}
