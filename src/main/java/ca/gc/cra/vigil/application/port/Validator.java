package ca.gc.cra.vigil.application.port;

import ca.gc.cra.vigil.domain.validation.InputValue;
import ca.gc.cra.vigil.domain.validation.ValidationConfig;
import ca.gc.cra.vigil.domain.validation.ValidationResult;

/**
 * <strong>What:</strong> Uniform contract shared by every validator.
 * <p><strong>Role:</strong> Application port targeted by the master dispatch and the batch use case.</p>
 * <p><strong>Thread-safety:</strong> Implementations are stateless and safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface Validator {
  /**
   * Validates one value.
   *
   * @param value input to validate; may be absent
   * @param config per-call options; {@code null} behaves as {@link ValidationConfig#none()}
   * @return validation outcome; never {@code null}; never throws for bad input
   */
  ValidationResult validate(InputValue value, ValidationConfig config);

  /**
   * Validates a loosely typed value with no options.
   *
   * @param value input to validate; may be {@code null}
   * @return validation outcome
   */
  default ValidationResult validate(Object value) {
    return validate(InputValue.of(value), ValidationConfig.none());
  }
}
