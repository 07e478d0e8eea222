package ca.gc.cra.vigil.application;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.vigil.application.port.ClockPort;
import ca.gc.cra.vigil.domain.validation.InputType;
import ca.gc.cra.vigil.domain.validation.ValidationConfig;
import ca.gc.cra.vigil.domain.validation.ValidationResult;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class InputValidatorTest {
  private final InputValidator validator = new InputValidator(ClockPort.fixed(Instant.parse("2024-06-15T00:00:00Z")));

  @Test
  void everyInputTypeHasAValidator() {
    for (InputType type : InputType.values()) {
      assertNotNull(validator.validatorFor(type), type.tag());
    }
  }

  @Test
  void everyValidatorReportsAbsentValues() {
    for (InputType type : InputType.values()) {
      ValidationResult result = validator.validate(null, type, null);
      assertFalse(result.valid(), type.tag());
      assertTrue(result.errorMessage().contains("required"), type.tag());
    }
  }

  @Test
  void unknownTagFails() {
    assertEquals("Unknown input type: bogus", validator.validate("x", "bogus", null).errorMessage());
    assertEquals("Unknown input type: null", validator.validate("x", (String) null, null).errorMessage());
  }

  @Test
  void unknownTagHonoursCustomErrorMessage() {
    ValidationConfig config = ValidationConfig.builder().customErrorMessage("Oops").build();
    assertEquals("Oops", validator.validate("x", "bogus", config).errorMessage());
  }

  @Test
  void customErrorMessageOnlyAffectsFailures() {
    ValidationConfig config = ValidationConfig.builder().customErrorMessage("Please enter a valid IBAN").build();
    assertEquals("Please enter a valid IBAN", validator.validate("bad", InputType.IBAN, config).errorMessage());
    assertTrue(validator.validate("GB82WEST12345698765432", InputType.IBAN, config).valid());
  }

  @Test
  void ageUsesInjectedClock() {
    assertEquals(34, validator.validate("1990-01-01", "age", null).normalizedValue());
  }
}
