package ca.gc.cra.vigil.application.common;

import ca.gc.cra.vigil.application.AbstractValidator;
import ca.gc.cra.vigil.application.port.ClockPort;
import ca.gc.cra.vigil.domain.util.Dates;
import ca.gc.cra.vigil.domain.validation.InputValue;
import ca.gc.cra.vigil.domain.validation.ValidationConfig;
import ca.gc.cra.vigil.domain.validation.ValidationResult;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Validates a date of birth: parseable, not in the future, at most 130 years ago.
 * <p><strong>Thread-safety:</strong> Stateless apart from the injected clock; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class BirthDateValidator extends AbstractValidator {
  /** Oldest accepted age in whole years. */
  public static final int MAX_AGE = 130;

  private final ClockPort clock;

  /**
   * Creates the validator.
   *
   * @param clock source of the "now" reference; must not be {@code null}
   */
  public BirthDateValidator(ClockPort clock) {
    super("birth date", "Birth date is required");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  protected ValidationResult check(InputValue value, ValidationConfig config) {
    Optional<Instant> parsed = value.asInstant();
    if (parsed.isEmpty()) {
      return ValidationResult.failure("Invalid date format", config);
    }
    Instant birthDate = parsed.get();
    Instant now = clock.now();
    if (birthDate.isAfter(now)) {
      return ValidationResult.failure("Birth date cannot be in the future", config);
    }
    if (Dates.calculateAge(birthDate, now) > MAX_AGE) {
      return ValidationResult.failure("Birth date is too far in the past (max 130 years)", config);
    }
    return ValidationResult.success(birthDate);
  }
}
