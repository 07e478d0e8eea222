package ca.gc.cra.vigil.domain.util;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class CodesTest {

  @Test
  void sanitizeAlphanumericStripsWhitespaceAndUppercases() {
    assertEquals("GB82WEST12345698765432", Codes.sanitizeAlphanumeric(" gb82 west\t1234 5698 7654 32 "));
    assertEquals("", Codes.sanitizeAlphanumeric(null));
  }

  @Test
  void stripNonAlphanumericKeepsLettersAndDigits() {
    assertEquals("AB12cd", Codes.stripNonAlphanumeric("A-B 1.2_c/d"));
  }

  @Test
  void digitsOnlyDropsEverythingElse() {
    assertEquals("0614141000012", Codes.digitsOnly("0614-141 000.012"));
  }

  @Test
  void lettersMapToIso7064Values() {
    assertEquals("10", Codes.letterToNumber('A'));
    assertEquals("35", Codes.letterToNumber('z'));
    assertEquals("7", Codes.letterToNumber('7'));
    assertEquals("302801128", Codes.convertLettersToNumbers("US0B28"));
  }

  @Test
  void sanitizeAlphanumericStripsUnicodeSpaces() {
    assertEquals("DE89370400440532013000",
        Codes.sanitizeAlphanumeric("de89\u00A03704\u202F0044\u20090532\u3000013000\uFEFF"));
  }
}
