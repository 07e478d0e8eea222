package ca.gc.cra.vigil.domain.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class ValidationResultTest {

  @Test
  void successCarriesNormalizedValueOnly() {
    ValidationResult result = ValidationResult.success("abc");
    assertTrue(result.valid());
    assertNull(result.errorMessage());
    assertEquals("abc", result.normalizedValueAs(String.class));
  }

  @Test
  void failureCarriesMessageOnly() {
    ValidationResult result = ValidationResult.failure("Bad input");
    assertFalse(result.valid());
    assertEquals("Bad input", result.errorMessage());
    assertNull(result.normalizedValue());
  }

  @Test
  void rejectsIllegalShapes() {
    assertThrows(IllegalArgumentException.class, () -> new ValidationResult(true, "oops", null));
    assertThrows(IllegalArgumentException.class, () -> new ValidationResult(false, "", null));
    assertThrows(IllegalArgumentException.class, () -> new ValidationResult(false, null, null));
    assertThrows(IllegalArgumentException.class, () -> new ValidationResult(false, "oops", 1));
  }

  @Test
  void customErrorMessageReplacesGeneratedMessage() {
    ValidationConfig config = ValidationConfig.builder().customErrorMessage("Please check the value").build();
    assertEquals("Please check the value", ValidationResult.failure("Invalid IBAN format", config).errorMessage());
  }

  @Test
  void whitespaceMessagesAreNonEmpty() {
    assertEquals(" ", new ValidationResult(false, " ", null).errorMessage());
    ValidationConfig config = ValidationConfig.builder().customErrorMessage(" ").build();
    assertEquals(" ", ValidationResult.failure("Invalid IBAN format", config).errorMessage());
  }

  @Test
  void emptyOrMissingCustomErrorMessageKeepsGeneratedMessage() {
    ValidationConfig config = ValidationConfig.builder().customErrorMessage("").build();
    assertEquals("Invalid IBAN format", ValidationResult.failure("Invalid IBAN format", config).errorMessage());
    assertEquals("Invalid IBAN format", ValidationResult.failure("Invalid IBAN format", null).errorMessage());
  }

  @Test
  void normalizedValueAsRejectsOtherTypes() {
    ValidationResult result = ValidationResult.success(12.5);
    assertThrows(ClassCastException.class, () -> result.normalizedValueAs(String.class));
  }
}
