package ca.gc.cra.vigil.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.vigil.domain.validation.DecimalBounds;
import ca.gc.cra.vigil.domain.validation.ValidationConfig;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import org.junit.jupiter.api.Test;

class ValidationConfigsTest {

  @Test
  void parsesEveryOption() {
    Map<String, String> options = Map.ofEntries(
        Map.entry("min", "1,000"),
        Map.entry("max", "5000.5"),
        Map.entry("minLength", "2"),
        Map.entry("maxLength", "10"),
        Map.entry("fixLength", "5"),
        Map.entry("decimals.min", "1"),
        Map.entry("decimals.max", "2"),
        Map.entry("allowSpecialChars", "false"),
        Map.entry("acceptedFileExtensions", "pdf, .png ,"),
        Map.entry("customErrorMessage", "Try again"),
        Map.entry("birthDate", "1990-05-20"));

    ValidationConfig config = ValidationConfigs.fromMap(options);

    assertEquals(OptionalDouble.of(1000), config.min());
    assertEquals(OptionalDouble.of(5000.5), config.max());
    assertEquals(OptionalInt.of(2), config.minLength());
    assertEquals(OptionalInt.of(10), config.maxLength());
    assertEquals(OptionalInt.of(5), config.fixLength());
    assertEquals(Optional.of(DecimalBounds.between(1, 2)), config.decimals());
    assertEquals(Optional.of(false), config.allowSpecialChars());
    assertEquals(List.of("pdf", ".png"), config.acceptedFileExtensions());
    assertEquals(Optional.of("Try again"), config.customErrorMessage());
    assertTrue(config.birthDate().isPresent());
  }

  @Test
  void dateBoundsBecomeEpochMillis() {
    ValidationConfig config = ValidationConfigs.fromMap(Map.of("min", "2024-01-01"));
    assertEquals(Instant.parse("2024-01-01T00:00:00Z").toEpochMilli(), (long) config.min().getAsDouble());
  }

  @Test
  void blankValuesLeaveOptionsUnset() {
    ValidationConfig config = ValidationConfigs.fromMap(Map.of("min", " ", "customErrorMessage", ""));
    assertTrue(config.min().isEmpty());
    assertEquals(Optional.of(""), config.customErrorMessage());
  }

  @Test
  void rejectsUnknownKeys() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> ValidationConfigs.fromMap(Map.of("maxlen", "3")));
    assertEquals("unknown option: maxlen", ex.getMessage());
  }

  @Test
  void rejectsMalformedValues() {
    assertThrows(IllegalArgumentException.class, () -> ValidationConfigs.fromMap(Map.of("min", "ten")));
    assertThrows(IllegalArgumentException.class, () -> ValidationConfigs.fromMap(Map.of("maxLength", "-1")));
    assertThrows(IllegalArgumentException.class, () -> ValidationConfigs.fromMap(Map.of("allowSpecialChars", "no")));
    assertThrows(IllegalArgumentException.class,
        () -> ValidationConfigs.fromMap(Map.of("decimals.min", "3", "decimals.max", "1")));
  }

  @Test
  void splitListDropsEmptyItems() {
    assertEquals(List.of("a", "b"), ValidationConfigs.splitList(" a,,b , "));
    assertFalse(ValidationConfigs.OPTION_KEYS.contains("decimals"));
  }
}
