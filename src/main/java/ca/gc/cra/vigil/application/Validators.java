package ca.gc.cra.vigil.application;

import ca.gc.cra.vigil.application.common.AlphaValidator;
import ca.gc.cra.vigil.application.common.AlphanumericValidator;
import ca.gc.cra.vigil.application.common.BirthDateValidator;
import ca.gc.cra.vigil.application.common.TextValidator;
import ca.gc.cra.vigil.application.logistics.Gs1KeyValidator;
import ca.gc.cra.vigil.application.port.ClockPort;
import ca.gc.cra.vigil.domain.validation.InputType;
import ca.gc.cra.vigil.domain.validation.InputValue;
import ca.gc.cra.vigil.domain.validation.ValidationConfig;
import ca.gc.cra.vigil.domain.validation.ValidationResult;

/**
 * Static entry points, one per validator, on the system clock.
 *
 * <p>Validators reachable only here (alpha, alphanumeric, birth date, SSCC) have no {@link InputType} tag.</p>
 *
 * @since 0.1.0
 */
public final class Validators {
  private static final InputValidator DISPATCH = InputValidator.standard();
  private static final TextValidator TEXT = new TextValidator();
  private static final AlphaValidator ALPHA = new AlphaValidator(TEXT);
  private static final AlphanumericValidator ALPHANUMERIC = new AlphanumericValidator(TEXT);
  private static final BirthDateValidator BIRTH_DATE = new BirthDateValidator(ClockPort.SYSTEM);
  private static final Gs1KeyValidator SSCC = Gs1KeyValidator.sscc();

  private Validators() {
    // Utility
  }

  public static ValidationResult validateInput(Object value, InputType type, ValidationConfig config) {
    return DISPATCH.validate(value, type, config);
  }

  public static ValidationResult validateInput(Object value, InputType type) {
    return validateInput(value, type, null);
  }

  public static ValidationResult validateInput(Object value, String tag, ValidationConfig config) {
    return DISPATCH.validate(value, tag, config);
  }

  public static ValidationResult validateInput(Object value, String tag) {
    return validateInput(value, tag, null);
  }

  public static ValidationResult validateNumeric(Object value, ValidationConfig config) {
    return validateInput(value, InputType.NUMERIC, config);
  }

  public static ValidationResult validateNumeric(Object value) {
    return validateNumeric(value, null);
  }

  public static ValidationResult validateText(Object value, ValidationConfig config) {
    return validateInput(value, InputType.TEXT, config);
  }

  public static ValidationResult validateText(Object value) {
    return validateText(value, null);
  }

  public static ValidationResult validateAlpha(Object value, ValidationConfig config) {
    return ALPHA.validate(InputValue.of(value), config);
  }

  public static ValidationResult validateAlpha(Object value) {
    return validateAlpha(value, null);
  }

  public static ValidationResult validateAlphanumeric(Object value, ValidationConfig config) {
    return ALPHANUMERIC.validate(InputValue.of(value), config);
  }

  public static ValidationResult validateAlphanumeric(Object value) {
    return validateAlphanumeric(value, null);
  }

  public static ValidationResult validateEmail(Object value, ValidationConfig config) {
    return validateInput(value, InputType.EMAIL, config);
  }

  public static ValidationResult validateEmail(Object value) {
    return validateEmail(value, null);
  }

  public static ValidationResult validateUrl(Object value, ValidationConfig config) {
    return validateInput(value, InputType.URL, config);
  }

  public static ValidationResult validateUrl(Object value) {
    return validateUrl(value, null);
  }

  public static ValidationResult validatePhone(Object value, ValidationConfig config) {
    return validateInput(value, InputType.PHONE, config);
  }

  public static ValidationResult validatePhone(Object value) {
    return validatePhone(value, null);
  }

  public static ValidationResult validateDate(Object value, ValidationConfig config) {
    return validateInput(value, InputType.DATE, config);
  }

  public static ValidationResult validateDate(Object value) {
    return validateDate(value, null);
  }

  public static ValidationResult validateBirthDate(Object value, ValidationConfig config) {
    return BIRTH_DATE.validate(InputValue.of(value), config);
  }

  public static ValidationResult validateBirthDate(Object value) {
    return validateBirthDate(value, null);
  }

  public static ValidationResult validateAge(Object value, ValidationConfig config) {
    return validateInput(value, InputType.AGE, config);
  }

  public static ValidationResult validateAge(Object value) {
    return validateAge(value, null);
  }

  public static ValidationResult validateIban(Object value, ValidationConfig config) {
    return validateInput(value, InputType.IBAN, config);
  }

  public static ValidationResult validateIban(Object value) {
    return validateIban(value, null);
  }

  public static ValidationResult validateIsin(Object value, ValidationConfig config) {
    return validateInput(value, InputType.ISIN, config);
  }

  public static ValidationResult validateIsin(Object value) {
    return validateIsin(value, null);
  }

  public static ValidationResult validateGln(Object value, ValidationConfig config) {
    return validateInput(value, InputType.GLN, config);
  }

  public static ValidationResult validateGln(Object value) {
    return validateGln(value, null);
  }

  public static ValidationResult validateGtin(Object value, ValidationConfig config) {
    return validateInput(value, InputType.GTIN, config);
  }

  public static ValidationResult validateGtin(Object value) {
    return validateGtin(value, null);
  }

  public static ValidationResult validateSscc(Object value, ValidationConfig config) {
    return SSCC.validate(InputValue.of(value), config);
  }

  public static ValidationResult validateSscc(Object value) {
    return validateSscc(value, null);
  }

  public static ValidationResult validateFileName(Object value, ValidationConfig config) {
    return validateInput(value, InputType.FILE_NAME, config);
  }

  public static ValidationResult validateFileName(Object value) {
    return validateFileName(value, null);
  }
}
