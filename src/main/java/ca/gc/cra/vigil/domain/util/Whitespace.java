package ca.gc.cra.vigil.domain.util;

/**
 * Whitespace handling shared by every validator that trims or strips its input.
 *
 * <p>Whitespace here means the Java {@code \s} characters plus every Unicode space separator
 * (including U+00A0 no-break space), U+2028, U+2029 and the U+FEFF byte order mark. Text pasted from
 * statements and spreadsheets routinely carries no-break spaces, which {@link String#strip()} keeps.</p>
 *
 * @since 0.1.0
 */
public final class Whitespace {
  /** Regex character class matching one whitespace character; embed it in larger patterns. */
  public static final String CLASS = "[\\s\\p{Z}\\uFEFF]";

  private Whitespace() {
    // Utility
  }

  /**
   * Reports whether a character counts as whitespace.
   *
   * @param c character to test
   * @return {@code true} for whitespace
   */
  public static boolean isWhitespace(char c) {
    return c == '\uFEFF'
        || c == ' ' || (c >= '\t' && c <= '\r')
        || Character.isSpaceChar(c);
  }

  /**
   * Removes leading and trailing whitespace.
   *
   * @param value text to trim; must not be {@code null}
   * @return trimmed text
   */
  public static String trim(String value) {
    int start = 0;
    int end = value.length();
    while (start < end && isWhitespace(value.charAt(start))) {
      start++;
    }
    while (end > start && isWhitespace(value.charAt(end - 1))) {
      end--;
    }
    return value.substring(start, end);
  }
}
