package ca.gc.cra.vigil.application;

import ca.gc.cra.vigil.application.port.Validator;
import ca.gc.cra.vigil.domain.validation.InputValue;
import ca.gc.cra.vigil.domain.validation.ValidationConfig;
import ca.gc.cra.vigil.domain.validation.ValidationResult;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Template for validators: null normalization, the required check and the
 * never-throw guarantee.
 * <p><strong>Why:</strong> Every validator starts with the same required rule and must convert unexpected
 * runtime failures into results instead of propagating them.</p>
 * <p><strong>Role:</strong> Base class of all validators in {@code application.*}.</p>
 * <p><strong>Thread-safety:</strong> Subclasses must be stateless.</p>
 * <p><strong>Observability:</strong> Logs unexpected exceptions at WARN with the validator subject; the raw
 * value is never logged.</p>
 *
 * @since 0.1.0
 */
public abstract class AbstractValidator implements Validator {
  private static final Logger log = LoggerFactory.getLogger(AbstractValidator.class);

  private final String subject;
  private final String requiredMessage;

  /**
   * Creates a validator.
   *
   * @param subject human readable name used in the fallback failure (e.g. {@code "IBAN"})
   * @param requiredMessage failure message for absent input
   */
  protected AbstractValidator(String subject, String requiredMessage) {
    this.subject = Objects.requireNonNull(subject, "subject");
    this.requiredMessage = Objects.requireNonNull(requiredMessage, "requiredMessage");
  }

  @Override
  public final ValidationResult validate(InputValue value, ValidationConfig config) {
    ValidationConfig options = config == null ? ValidationConfig.none() : config;
    InputValue input = select(value == null ? InputValue.absent() : value, options);
    if (input.isEmpty()) {
      return ValidationResult.failure(requiredMessage, options);
    }
    try {
      return check(input, options);
    } catch (RuntimeException ex) {
      log.warn("{} validation failed unexpectedly", subject, ex);
      return ValidationResult.failure("Unable to validate " + subject, options);
    }
  }

  /**
   * Chooses the value the rules apply to. Defaults to the validated value itself.
   *
   * @param value validated value; never {@code null}
   * @param config options of the call; never {@code null}
   * @return value to check
   */
  protected InputValue select(InputValue value, ValidationConfig config) {
    return value;
  }

  /**
   * Applies the validator's rules to a non-empty value.
   *
   * @param value non-empty input
   * @param config options of the call; never {@code null}
   * @return validation outcome
   */
  protected abstract ValidationResult check(InputValue value, ValidationConfig config);

  /**
   * Returns the subject used in diagnostics.
   *
   * @return subject name
   */
  public String subject() {
    return subject;
  }
}
