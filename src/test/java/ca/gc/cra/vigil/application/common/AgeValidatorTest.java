package ca.gc.cra.vigil.application.common;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.vigil.application.port.ClockPort;
import ca.gc.cra.vigil.domain.validation.InputValue;
import ca.gc.cra.vigil.domain.validation.ValidationConfig;
import ca.gc.cra.vigil.domain.validation.ValidationResult;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class AgeValidatorTest {
  private final AgeValidator validator = new AgeValidator(ClockPort.fixed(Instant.parse("2024-06-15T12:00:00Z")));

  @Test
  void computesAgeInCompleteYears() {
    ValidationResult birthday = validator.validate("1990-06-15");
    assertTrue(birthday.valid());
    assertEquals(34, birthday.normalizedValueAs(Integer.class));
    assertEquals(33, validator.validate("1990-06-16").normalizedValueAs(Integer.class));
  }

  @Test
  void configuredBirthDateTakesPrecedence() {
    ValidationConfig config = ValidationConfig.builder().birthDate("2000-01-01").build();
    assertEquals(24, validator.validate(InputValue.absent(), config).normalizedValue());
    assertEquals(24, validator.validate(InputValue.of("1950-01-01"), config).normalizedValue());
  }

  @Test
  void enforcesAgeBounds() {
    ValidationConfig adult = ValidationConfig.builder().min(18).build();
    assertEquals("Age must be at least 18", validator.validate(InputValue.of("2010-01-01"), adult).errorMessage());
    ValidationConfig working = ValidationConfig.builder().max(65).build();
    assertEquals("Age must be at most 65", validator.validate(InputValue.of("1950-01-01"), working).errorMessage());
  }

  @Test
  void rejectsImplausibleBirthDates() {
    assertEquals("Birth date cannot be in the future", validator.validate("2025-01-01").errorMessage());
    assertEquals("Invalid age (exceeds 130 years)", validator.validate("1890-01-01").errorMessage());
    assertEquals("Invalid birth date format", validator.validate("garbage").errorMessage());
  }

  @Test
  void requiresABirthDate() {
    assertEquals("Birth date is required to calculate age", validator.validate(null).errorMessage());
  }
}
