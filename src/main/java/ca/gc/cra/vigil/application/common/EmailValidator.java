package ca.gc.cra.vigil.application.common;

import ca.gc.cra.vigil.application.AbstractValidator;
import ca.gc.cra.vigil.domain.util.Whitespace;
import ca.gc.cra.vigil.domain.validation.InputValue;
import ca.gc.cra.vigil.domain.validation.ValidationConfig;
import ca.gc.cra.vigil.domain.validation.ValidationResult;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Validates email addresses with a simplified RFC 5322 pattern.
 * <p><strong>Rules:</strong> total length at most 254 (RFC 5321), an {@code @}, the pattern, local part at
 * most 64 characters, and a dotted domain.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 *
 * <p>The normalized value is the trimmed, lowercased address.</p>
 *
 * @since 0.1.0
 */
public final class EmailValidator extends AbstractValidator {
  static final int MAX_LENGTH = 254;
  static final int MAX_LOCAL_PART_LENGTH = 64;

  private static final Pattern EMAIL = Pattern.compile(
      "[a-zA-Z0-9.!#$%&'*+/=?^_`{|}~-]+@[a-zA-Z0-9](?:[a-zA-Z0-9-]{0,61}[a-zA-Z0-9])?"
          + "(?:\\.[a-zA-Z0-9](?:[a-zA-Z0-9-]{0,61}[a-zA-Z0-9])?)*");

  /** Creates the validator. */
  public EmailValidator() {
    super("email", "Email is required");
  }

  @Override
  protected ValidationResult check(InputValue value, ValidationConfig config) {
    String email = Whitespace.trim(value.asText()).toLowerCase(Locale.ROOT);
    if (email.length() > MAX_LENGTH) {
      return ValidationResult.failure("Email address is too long (max 254 characters)", config);
    }
    int at = email.indexOf('@');
    if (at < 0) {
      return ValidationResult.failure("Invalid email format: missing @ symbol", config);
    }
    if (!EMAIL.matcher(email).matches()) {
      return ValidationResult.failure("Invalid email format", config);
    }
    if (at > MAX_LOCAL_PART_LENGTH) {
      return ValidationResult.failure("Email local part too long (max 64 characters)", config);
    }
    if (email.indexOf('.', at + 1) < 0) {
      return ValidationResult.failure("Invalid email domain: missing top-level domain", config);
    }
    return ValidationResult.success(email);
  }
}
