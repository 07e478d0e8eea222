package ca.gc.cra.vigil.domain.util;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Character-level helpers for checksum-based identifiers (IBAN, ISIN, GS1).
 * <p><strong>Why:</strong> Every identifier validator starts from the same canonical form and the same
 * ISO 7064 letter mapping.</p>
 * <p><strong>Thread-safety:</strong> Stateless utility; patterns are precompiled and immutable.</p>
 *
 * @since 0.1.0
 */
public final class Codes {
  private static final Pattern WHITESPACE = Pattern.compile(Whitespace.CLASS + "+");
  private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^A-Za-z0-9]");
  private static final Pattern NON_DIGIT = Pattern.compile("[^0-9]");

  private Codes() {
    // Utility
  }

  /**
   * Removes all whitespace and uppercases the value.
   *
   * @param value candidate value; {@code null} yields an empty string
   * @return sanitized uppercase text
   */
  public static String sanitizeAlphanumeric(Object value) {
    if (value == null) {
      return "";
    }
    return WHITESPACE.matcher(String.valueOf(value)).replaceAll("").toUpperCase(Locale.ROOT);
  }

  /**
   * Removes every character outside {@code [A-Za-z0-9]}.
   *
   * @param value text to filter; must not be {@code null}
   * @return alphanumeric characters of {@code value} in order
   */
  public static String stripNonAlphanumeric(String value) {
    return NON_ALPHANUMERIC.matcher(value).replaceAll("");
  }

  /**
   * Removes every character that is not an ASCII digit.
   *
   * @param value text to filter; must not be {@code null}
   * @return digits of {@code value} in order
   */
  public static String digitsOnly(String value) {
    return NON_DIGIT.matcher(value).replaceAll("");
  }

  /**
   * Maps a letter to its ISO 7064 value (A=10 ... Z=35, case-insensitive).
   *
   * @param c character to convert
   * @return two-digit string for letters; the character itself otherwise
   */
  public static String letterToNumber(char c) {
    if (c >= 'A' && c <= 'Z') {
      return Integer.toString(c - 'A' + 10);
    }
    if (c >= 'a' && c <= 'z') {
      return Integer.toString(c - 'a' + 10);
    }
    return String.valueOf(c);
  }

  /**
   * Replaces every letter with its ISO 7064 value, character by character.
   *
   * @param value letters and digits; must not be {@code null}
   * @return digit string suitable for modular arithmetic
   */
  public static String convertLettersToNumbers(String value) {
    StringBuilder digits = new StringBuilder(value.length() * 2);
    for (int i = 0; i < value.length(); i++) {
      digits.append(letterToNumber(value.charAt(i)));
    }
    return digits.toString();
  }
}
