package ca.gc.cra.vigil.api;

import ca.gc.cra.vigil.domain.util.Decimals;
import ca.gc.cra.vigil.domain.validation.ValidationResult;

/**
 * Text rendering of normalized values and results for console output.
 */
final class ValueFormat {
  private ValueFormat() {}

  static String render(Object value) {
    if (value == null) {
      return "";
    }
    if (value instanceof Number number) {
      return Decimals.format(number);
    }
    return value.toString();
  }

  /**
   * Renders a result as {@code VALID <normalized>} or {@code INVALID <message>}.
   *
   * @param result result to render
   * @return one console line
   */
  static String line(ValidationResult result) {
    if (result.valid()) {
      String normalized = render(result.normalizedValue());
      return normalized.isEmpty() ? "VALID" : "VALID " + normalized;
    }
    return "INVALID " + result.errorMessage();
  }
}
