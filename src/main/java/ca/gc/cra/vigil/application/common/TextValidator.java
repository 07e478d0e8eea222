package ca.gc.cra.vigil.application.common;

import ca.gc.cra.vigil.application.AbstractValidator;
import ca.gc.cra.vigil.domain.util.Whitespace;
import ca.gc.cra.vigil.domain.validation.InputValue;
import ca.gc.cra.vigil.domain.validation.ValidationConfig;
import ca.gc.cra.vigil.domain.validation.ValidationResult;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Validates free text against length bounds and an optional character restriction.
 * <p><strong>Rules:</strong> trim, {@code fixLength}, {@code minLength}, {@code maxLength}, then letters,
 * digits and whitespace only when {@code allowSpecialChars} is explicitly {@code false}.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class TextValidator extends AbstractValidator {
  private static final Pattern PLAIN = Pattern.compile("[a-zA-Z0-9" + Whitespace.CLASS + "]+");

  /** Creates the validator. */
  public TextValidator() {
    super("text", "Text is required");
  }

  @Override
  protected ValidationResult check(InputValue value, ValidationConfig config) {
    String text = Whitespace.trim(value.asText());
    int length = text.length();
    if (config.fixLength().isPresent() && length != config.fixLength().getAsInt()) {
      return ValidationResult.failure(
          "Text must be exactly " + config.fixLength().getAsInt() + " characters", config);
    }
    if (config.minLength().isPresent() && length < config.minLength().getAsInt()) {
      return ValidationResult.failure(
          "Text must be at least " + config.minLength().getAsInt() + " characters", config);
    }
    if (config.maxLength().isPresent() && length > config.maxLength().getAsInt()) {
      return ValidationResult.failure(
          "Text must be at most " + config.maxLength().getAsInt() + " characters", config);
    }
    if (Boolean.FALSE.equals(config.allowSpecialChars().orElse(null)) && !PLAIN.matcher(text).matches()) {
      return ValidationResult.failure("Text can only contain letters, numbers, and spaces", config);
    }
    return ValidationResult.success(text);
  }
}
