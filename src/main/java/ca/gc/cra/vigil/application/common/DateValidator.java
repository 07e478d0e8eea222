package ca.gc.cra.vigil.application.common;

import ca.gc.cra.vigil.application.AbstractValidator;
import ca.gc.cra.vigil.domain.util.Dates;
import ca.gc.cra.vigil.domain.validation.InputValue;
import ca.gc.cra.vigil.domain.validation.ValidationConfig;
import ca.gc.cra.vigil.domain.validation.ValidationResult;
import java.time.Instant;
import java.util.Optional;

/**
 * <strong>What:</strong> Validates calendar dates and timestamps.
 * <p><strong>Rules:</strong> the value must parse (ISO-8601 text, epoch milliseconds or a temporal object);
 * {@code min} and {@code max}, when set, are inclusive epoch-millisecond bounds.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 *
 * <p>The normalized value is the parsed {@link Instant}.</p>
 *
 * @since 0.1.0
 */
public final class DateValidator extends AbstractValidator {

  /** Creates the validator. */
  public DateValidator() {
    super("date", "Date is required");
  }

  @Override
  protected ValidationResult check(InputValue value, ValidationConfig config) {
    Optional<Instant> parsed = value.asInstant();
    if (parsed.isEmpty()) {
      return ValidationResult.failure("Invalid date format", config);
    }
    Instant date = parsed.get();
    if (config.min().isPresent()) {
      Optional<Instant> min = Dates.fromEpochMillis(config.min().getAsDouble());
      if (min.isPresent() && date.isBefore(min.get())) {
        return ValidationResult.failure("Date must be on or after " + Dates.isoDate(min.get()), config);
      }
    }
    if (config.max().isPresent()) {
      Optional<Instant> max = Dates.fromEpochMillis(config.max().getAsDouble());
      if (max.isPresent() && date.isAfter(max.get())) {
        return ValidationResult.failure("Date must be on or before " + Dates.isoDate(max.get()), config);
      }
    }
    return ValidationResult.success(date);
  }
}
