package ca.gc.cra.vigil.application.common;

import ca.gc.cra.vigil.application.AbstractValidator;
import ca.gc.cra.vigil.domain.util.Decimals;
import ca.gc.cra.vigil.domain.validation.DecimalBounds;
import ca.gc.cra.vigil.domain.validation.InputValue;
import ca.gc.cra.vigil.domain.validation.ValidationConfig;
import ca.gc.cra.vigil.domain.validation.ValidationResult;

/**
 * <strong>What:</strong> Validates integers and decimals against inclusive range and precision bounds.
 * <p><strong>Rules:</strong> parse, finite, {@code min}, {@code max}, {@code decimals.min},
 * {@code decimals.max}; the first failing rule wins.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 *
 * <p>The normalized value is the parsed {@link Double}.</p>
 *
 * @since 0.1.0
 */
public final class NumericValidator extends AbstractValidator {

  /** Creates the validator. */
  public NumericValidator() {
    super("numeric value", "Numeric value is required");
  }

  @Override
  protected ValidationResult check(InputValue value, ValidationConfig config) {
    double number = value.asNumber();
    if (Double.isNaN(number)) {
      return ValidationResult.failure("Invalid numeric value", config);
    }
    if (Double.isInfinite(number)) {
      return ValidationResult.failure("Value must be a finite number", config);
    }
    if (config.min().isPresent() && number < config.min().getAsDouble()) {
      return ValidationResult.failure(
          "Value must be at least " + Decimals.format(config.min().getAsDouble()), config);
    }
    if (config.max().isPresent() && number > config.max().getAsDouble()) {
      return ValidationResult.failure(
          "Value must be at most " + Decimals.format(config.max().getAsDouble()), config);
    }
    if (config.decimals().isPresent()) {
      DecimalBounds bounds = config.decimals().get();
      int places = Decimals.countDecimalPlaces(number);
      if (bounds.min().isPresent() && places < bounds.min().getAsInt()) {
        return ValidationResult.failure(
            "Must have at least " + bounds.min().getAsInt() + " decimal places", config);
      }
      if (bounds.max().isPresent() && places > bounds.max().getAsInt()) {
        return ValidationResult.failure(
            "Must have at most " + bounds.max().getAsInt() + " decimal places", config);
      }
    }
    return ValidationResult.success(number);
  }
}
