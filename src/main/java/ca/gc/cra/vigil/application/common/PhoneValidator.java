package ca.gc.cra.vigil.application.common;

import ca.gc.cra.vigil.application.AbstractValidator;
import ca.gc.cra.vigil.domain.util.Whitespace;
import ca.gc.cra.vigil.domain.validation.InputValue;
import ca.gc.cra.vigil.domain.validation.ValidationConfig;
import ca.gc.cra.vigil.domain.validation.ValidationResult;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Validates international phone numbers in E.164 form.
 * <p><strong>Rules:</strong> leading {@code +}; spaces, dashes, dots, parentheses and brackets are stripped;
 * {@code +} followed by 1 to 15 digits not starting with 0; at least 7 digits.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 *
 * <p>The normalized value is the stripped form, e.g. {@code +33123456789}.</p>
 *
 * @since 0.1.0
 */
public final class PhoneValidator extends AbstractValidator {
  static final int MIN_DIGITS = 7;

  private static final Pattern SEPARATORS = Pattern.compile("[\\-.()\\[\\]" + Whitespace.CLASS + "]");
  private static final Pattern E164 = Pattern.compile("\\+[1-9][0-9]{0,14}");

  /** Creates the validator. */
  public PhoneValidator() {
    super("phone number", "Phone number is required");
  }

  @Override
  protected ValidationResult check(InputValue value, ValidationConfig config) {
    String phone = Whitespace.trim(value.asText());
    if (!phone.startsWith("+")) {
      return ValidationResult.failure("Phone number must start with + for international format", config);
    }
    String normalized = SEPARATORS.matcher(phone).replaceAll("");
    if (!E164.matcher(normalized).matches()) {
      return ValidationResult.failure(
          "Invalid phone number format. Expected: + followed by 1-15 digits", config);
    }
    if (normalized.length() - 1 < MIN_DIGITS) {
      return ValidationResult.failure("Phone number too short (minimum 7 digits)", config);
    }
    return ValidationResult.success(normalized);
  }
}
