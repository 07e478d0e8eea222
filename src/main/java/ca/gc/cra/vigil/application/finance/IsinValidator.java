package ca.gc.cra.vigil.application.finance;

import ca.gc.cra.vigil.application.AbstractValidator;
import ca.gc.cra.vigil.domain.util.Codes;
import ca.gc.cra.vigil.domain.validation.InputValue;
import ca.gc.cra.vigil.domain.validation.ValidationConfig;
import ca.gc.cra.vigil.domain.validation.ValidationResult;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Validates International Securities Identification Numbers (ISO 6166).
 * <p><strong>Rules:</strong> two letters, nine alphanumerics and a check digit; letters expand to two digits
 * and the Luhn sum over the expanded digits, doubling digits at odd distance from the right, must be a
 * multiple of ten.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class IsinValidator extends AbstractValidator {
  private static final Pattern FORMAT = Pattern.compile("[A-Z]{2}[A-Z0-9]{9}[0-9]");

  /** Creates the validator. */
  public IsinValidator() {
    super("ISIN", "ISIN is required");
  }

  @Override
  protected ValidationResult check(InputValue value, ValidationConfig config) {
    String isin = Codes.sanitizeAlphanumeric(value.asText());
    if (!FORMAT.matcher(isin).matches()) {
      return ValidationResult.failure("Invalid ISIN format. Expected: 2-letter country code + "
          + "9 alphanumeric characters + 1 check digit", config);
    }
    if (luhnSum(Codes.convertLettersToNumbers(isin)) % 10 != 0) {
      return ValidationResult.failure("Invalid ISIN check digit", config);
    }
    return ValidationResult.success(isin);
  }

  static int luhnSum(String digits) {
    int sum = 0;
    int length = digits.length();
    for (int i = 0; i < length; i++) {
      int digit = digits.charAt(i) - '0';
      if ((length - 1 - i) % 2 == 1) {
        digit *= 2;
        if (digit > 9) {
          digit -= 9;
        }
      }
      sum += digit;
    }
    return sum;
  }
}
