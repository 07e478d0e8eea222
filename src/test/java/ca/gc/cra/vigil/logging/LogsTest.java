package ca.gc.cra.vigil.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class LogsTest {

  @Test
  void truncateKeepsShortValues() {
    assertEquals("abc", Logs.truncate("abc", 3));
    assertEquals("<null>", Logs.truncate(null, 3));
  }

  @Test
  void truncateAppendsOriginalLength() {
    assertEquals("abc... (truncated, 6 chars)", Logs.truncate("abcdef", 3));
  }

  @Test
  void truncateRequiresPositiveLimit() {
    assertThrows(IllegalArgumentException.class, () -> Logs.truncate("abc", 0));
  }

  @Test
  void maskKeepsLastFourCharacters() {
    assertEquals("**************5432", Logs.mask("GB82WEST1234565432"));
    assertEquals("****", Logs.mask("abcd"));
    assertEquals("", Logs.mask(""));
    assertEquals("<null>", Logs.mask(null));
  }
}
