package ca.gc.cra.vigil.application.common;

import ca.gc.cra.vigil.application.AbstractValidator;
import ca.gc.cra.vigil.domain.util.Whitespace;
import ca.gc.cra.vigil.domain.validation.InputValue;
import ca.gc.cra.vigil.domain.validation.ValidationConfig;
import ca.gc.cra.vigil.domain.validation.ValidationResult;
import java.util.regex.Pattern;

/**
 * Validates text made of letters and whitespace, then applies the {@link TextValidator} length rules.
 *
 * @since 0.1.0
 */
public final class AlphaValidator extends AbstractValidator {
  private static final Pattern LETTERS = Pattern.compile("[a-zA-Z" + Whitespace.CLASS + "]+");

  private final TextValidator text;

  /**
   * Creates the validator.
   *
   * @param text validator applying the length rules
   */
  public AlphaValidator(TextValidator text) {
    super("text", "Text is required");
    this.text = text;
  }

  /** Creates the validator with its own text validator. */
  public AlphaValidator() {
    this(new TextValidator());
  }

  @Override
  protected ValidationResult check(InputValue value, ValidationConfig config) {
    String trimmed = Whitespace.trim(value.asText());
    if (!LETTERS.matcher(trimmed).matches()) {
      return ValidationResult.failure("Text can only contain letters and spaces", config);
    }
    return text.validate(InputValue.text(trimmed), config);
  }
}
