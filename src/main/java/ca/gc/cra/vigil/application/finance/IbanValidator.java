package ca.gc.cra.vigil.application.finance;

import ca.gc.cra.vigil.application.AbstractValidator;
import ca.gc.cra.vigil.domain.util.Codes;
import ca.gc.cra.vigil.domain.validation.InputValue;
import ca.gc.cra.vigil.domain.validation.ValidationConfig;
import ca.gc.cra.vigil.domain.validation.ValidationResult;
import java.math.BigInteger;
import java.util.OptionalInt;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Validates International Bank Account Numbers (ISO 13616, Mod 97-10).
 * <p><strong>Rules:</strong> whitespace removed and uppercased; two letters, two check digits and an
 * alphanumeric BBAN; registered country; exact country length; the rearranged numeric form modulo 97
 * equals 1.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 *
 * <p>The normalized value is the electronic form, e.g. {@code GB82WEST12345698765432}.</p>
 *
 * @since 0.1.0
 */
public final class IbanValidator extends AbstractValidator {
  private static final Pattern FORMAT = Pattern.compile("[A-Z]{2}[0-9]{2}[A-Z0-9]+");
  private static final BigInteger MODULUS = BigInteger.valueOf(97);

  /** Creates the validator. */
  public IbanValidator() {
    super("IBAN", "IBAN is required");
  }

  @Override
  protected ValidationResult check(InputValue value, ValidationConfig config) {
    String iban = Codes.sanitizeAlphanumeric(value.asText());
    if (!FORMAT.matcher(iban).matches()) {
      return ValidationResult.failure(
          "Invalid IBAN format. Expected: 2-letter country code + 2 check digits + BBAN", config);
    }
    String countryCode = iban.substring(0, 2);
    OptionalInt expected = IbanRegistry.expectedLength(countryCode);
    if (expected.isEmpty()) {
      return ValidationResult.failure("Unknown IBAN country code: " + countryCode, config);
    }
    if (iban.length() != expected.getAsInt()) {
      return ValidationResult.failure("Invalid IBAN length for " + countryCode + ". Expected "
          + expected.getAsInt() + " characters, got " + iban.length(), config);
    }
    String rearranged = iban.substring(4) + iban.substring(0, 4);
    BigInteger numeric;
    try {
      numeric = new BigInteger(Codes.convertLettersToNumbers(rearranged));
    } catch (NumberFormatException ex) {
      return ValidationResult.failure("Invalid IBAN format", config);
    }
    if (!numeric.mod(MODULUS).equals(BigInteger.ONE)) {
      return ValidationResult.failure("Invalid IBAN checksum", config);
    }
    return ValidationResult.success(iban);
  }
}
