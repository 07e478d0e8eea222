package ca.gc.cra.vigil.application;

import ca.gc.cra.vigil.application.common.AgeValidator;
import ca.gc.cra.vigil.application.common.DateValidator;
import ca.gc.cra.vigil.application.common.EmailValidator;
import ca.gc.cra.vigil.application.common.NumericValidator;
import ca.gc.cra.vigil.application.common.PhoneValidator;
import ca.gc.cra.vigil.application.common.TextValidator;
import ca.gc.cra.vigil.application.common.UrlValidator;
import ca.gc.cra.vigil.application.finance.IbanValidator;
import ca.gc.cra.vigil.application.finance.IsinValidator;
import ca.gc.cra.vigil.application.logistics.Gs1KeyValidator;
import ca.gc.cra.vigil.application.port.ClockPort;
import ca.gc.cra.vigil.application.port.Validator;
import ca.gc.cra.vigil.application.system.FileNameValidator;
import ca.gc.cra.vigil.domain.validation.InputType;
import ca.gc.cra.vigil.domain.validation.InputValue;
import ca.gc.cra.vigil.domain.validation.ValidationConfig;
import ca.gc.cra.vigil.domain.validation.ValidationResult;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Master dispatch routing an {@link InputType} to exactly one validator.
 * <p><strong>Why:</strong> Lets callers pick validation by tag (form metadata, CLI argument, batch job)
 * without knowing validator classes.</p>
 * <p><strong>Role:</strong> Application entry point used by the static facade, the batch use case and the
 * CLI.</p>
 * <p><strong>Thread-safety:</strong> Immutable; validators are stateless singletons held per instance.</p>
 *
 * @since 0.1.0
 */
public final class InputValidator {
  private final NumericValidator numeric = new NumericValidator();
  private final TextValidator text = new TextValidator();
  private final EmailValidator email = new EmailValidator();
  private final UrlValidator url = new UrlValidator();
  private final PhoneValidator phone = new PhoneValidator();
  private final IbanValidator iban = new IbanValidator();
  private final IsinValidator isin = new IsinValidator();
  private final Gs1KeyValidator gln = Gs1KeyValidator.gln();
  private final Gs1KeyValidator gtin = Gs1KeyValidator.gtin();
  private final DateValidator date = new DateValidator();
  private final AgeValidator age;
  private final FileNameValidator fileName = new FileNameValidator();

  /**
   * Creates a dispatch whose age validation reads the given clock.
   *
   * @param clock "now" reference for age validation; must not be {@code null}
   */
  public InputValidator(ClockPort clock) {
    this.age = new AgeValidator(Objects.requireNonNull(clock, "clock"));
  }

  /**
   * Creates a dispatch on the system clock.
   *
   * @return dispatch instance
   */
  public static InputValidator standard() {
    return new InputValidator(ClockPort.SYSTEM);
  }

  /**
   * Returns the validator registered for a type.
   *
   * @param type input type; must not be {@code null}
   * @return validator handling {@code type}
   */
  public Validator validatorFor(InputType type) {
    return switch (Objects.requireNonNull(type, "type")) {
      case NUMERIC -> numeric;
      case TEXT -> text;
      case EMAIL -> email;
      case URL -> url;
      case PHONE -> phone;
      case IBAN -> iban;
      case ISIN -> isin;
      case GLN -> gln;
      case GTIN -> gtin;
      case DATE -> date;
      case AGE -> age;
      case FILE_NAME -> fileName;
    };
  }

  /**
   * Validates a value with the validator registered for {@code type}.
   *
   * @param value value to validate; may be {@code null}
   * @param type input type; must not be {@code null}
   * @param config per-call options; may be {@code null}
   * @return validation outcome
   */
  public ValidationResult validate(Object value, InputType type, ValidationConfig config) {
    return validatorFor(type).validate(InputValue.of(value), config);
  }

  /**
   * Resolves a wire tag and validates. An unknown or {@code null} tag yields a failure rather than an
   * exception.
   *
   * @param value value to validate; may be {@code null}
   * @param tag input type wire name, e.g. {@code iban} or {@code fileName}
   * @param config per-call options; may be {@code null}
   * @return validation outcome
   */
  public ValidationResult validate(Object value, String tag, ValidationConfig config) {
    Optional<InputType> type = InputType.fromTag(tag);
    if (type.isEmpty()) {
      return ValidationResult.failure("Unknown input type: " + tag, config);
    }
    return validate(value, type.get(), config);
  }
}
