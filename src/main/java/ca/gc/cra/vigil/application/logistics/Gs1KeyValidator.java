package ca.gc.cra.vigil.application.logistics;

import ca.gc.cra.vigil.application.AbstractValidator;
import ca.gc.cra.vigil.domain.util.Codes;
import ca.gc.cra.vigil.domain.validation.InputValue;
import ca.gc.cra.vigil.domain.validation.ValidationConfig;
import ca.gc.cra.vigil.domain.validation.ValidationResult;
import java.util.Set;

/**
 * <strong>What:</strong> Validates one GS1 identification key: GLN, GTIN or SSCC.
 * <p><strong>Rules:</strong> whitespace and every non-digit are removed; the digit count must be one of the
 * key's lengths; the GS1 check digit must match.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe for concurrent use.</p>
 *
 * <p>The normalized value is the digit string.</p>
 *
 * @since 0.1.0
 */
public final class Gs1KeyValidator extends AbstractValidator {
  private final Set<Integer> lengths;
  private final int expectedLength;
  private final String lengthDescription;

  private Gs1KeyValidator(String key, Set<Integer> lengths, int expectedLength, String lengthDescription) {
    super(key, key + " is required");
    this.lengths = Set.copyOf(lengths);
    this.expectedLength = expectedLength;
    this.lengthDescription = lengthDescription;
  }

  /**
   * Global Location Number: 13 digits.
   *
   * @return GLN validator
   */
  public static Gs1KeyValidator gln() {
    return new Gs1KeyValidator("GLN", Set.of(13), 13, "13");
  }

  /**
   * Global Trade Item Number: 8, 12, 13 or 14 digits.
   *
   * @return GTIN validator
   */
  public static Gs1KeyValidator gtin() {
    return new Gs1KeyValidator("GTIN", Set.of(8, 12, 13, 14), 0, "8, 12, 13, or 14");
  }

  /**
   * Serial Shipping Container Code: 18 digits.
   *
   * @return SSCC validator
   */
  public static Gs1KeyValidator sscc() {
    return new Gs1KeyValidator("SSCC", Set.of(18), 18, "18");
  }

  @Override
  protected ValidationResult check(InputValue value, ValidationConfig config) {
    String digits = Codes.digitsOnly(Codes.sanitizeAlphanumeric(value.asText()));
    if (!lengths.contains(digits.length())) {
      return ValidationResult.failure("Invalid " + subject() + " length. Expected " + lengthDescription
          + " digits, got " + digits.length(), config);
    }
    if (!Gs1CheckDigit.isValid(digits, expectedLength)) {
      return ValidationResult.failure("Invalid " + subject() + " check digit", config);
    }
    return ValidationResult.success(digits);
  }
}
