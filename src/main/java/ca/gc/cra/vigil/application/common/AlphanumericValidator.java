package ca.gc.cra.vigil.application.common;

import ca.gc.cra.vigil.application.AbstractValidator;
import ca.gc.cra.vigil.domain.validation.InputValue;
import ca.gc.cra.vigil.domain.validation.ValidationConfig;
import ca.gc.cra.vigil.domain.validation.ValidationResult;

/**
 * Text validation with special characters always disallowed, whatever the caller configured.
 *
 * @since 0.1.0
 */
public final class AlphanumericValidator extends AbstractValidator {
  private final TextValidator text;

  /**
   * Creates the validator.
   *
   * @param text validator the rules are delegated to
   */
  public AlphanumericValidator(TextValidator text) {
    super("text", "Text is required");
    this.text = text;
  }

  /** Creates the validator with its own text validator. */
  public AlphanumericValidator() {
    this(new TextValidator());
  }

  @Override
  protected ValidationResult check(InputValue value, ValidationConfig config) {
    return text.validate(value, config.toBuilder().allowSpecialChars(false).build());
  }
}
