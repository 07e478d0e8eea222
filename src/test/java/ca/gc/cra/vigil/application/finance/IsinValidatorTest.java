package ca.gc.cra.vigil.application.finance;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.vigil.domain.validation.ValidationResult;
import java.util.List;
import org.junit.jupiter.api.Test;

class IsinValidatorTest {
  private final IsinValidator validator = new IsinValidator();

  @Test
  void acceptsValidIsins() {
    for (String isin : List.of("US0378331005", "US5949181045", "GB0002634946", "DE000BAY0017", "CA0679011084")) {
      assertTrue(validator.validate(isin).valid(), isin);
    }
  }

  @Test
  void normalizesCaseAndWhitespace() {
    ValidationResult result = validator.validate(" us03 7833 1005 ");
    assertTrue(result.valid());
    assertEquals("US0378331005", result.normalizedValue());
  }

  @Test
  void rejectsBadCheckDigit() {
    assertEquals("Invalid ISIN check digit", validator.validate("US0378331006").errorMessage());
  }

  @Test
  void rejectsMalformedInput() {
    String expected = "Invalid ISIN format. Expected: 2-letter country code + 9 alphanumeric characters + 1 check digit";
    assertEquals(expected, validator.validate("US037833100").errorMessage());
    assertEquals(expected, validator.validate("1S0378331005").errorMessage());
    assertEquals(expected, validator.validate("US037833100X").errorMessage());
  }

  @Test
  void luhnSumDoublesEveryOtherDigitFromTheRight() {
    assertEquals(0, IsinValidator.luhnSum("0"));
    assertEquals(2, IsinValidator.luhnSum("10"));
    assertEquals(1 + 9, IsinValidator.luhnSum("59"));
  }

  @Test
  void requiresAValue() {
    assertEquals("ISIN is required", validator.validate("").errorMessage());
  }
}
