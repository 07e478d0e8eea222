package ca.gc.cra.vigil.application.logistics;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> GS1 Modulo-10 check digit engine shared by GLN, GTIN and SSCC.
 * <p><strong>Algorithm:</strong> weights 3, 1, 3, ... applied from the rightmost data digit; the check digit is
 * {@code (10 - sum mod 10) mod 10}.</p>
 * <p><strong>Thread-safety:</strong> Stateless utility.</p>
 *
 * @since 0.1.0
 */
public final class Gs1CheckDigit {
  /** Key lengths defined by GS1: GTIN-8, GTIN-12, GTIN-13/GLN, GTIN-14 and SSCC. */
  public static final Set<Integer> VALID_LENGTHS = Set.of(8, 12, 13, 14, 18);

  private static final Pattern DIGITS = Pattern.compile("\\d+");

  private Gs1CheckDigit() {
    // Utility
  }

  /**
   * Computes the check digit for the given data digits.
   *
   * @param dataDigits key without its check digit; ASCII digits only
   * @return check digit in {@code 0..9}
   * @throws IllegalArgumentException when {@code dataDigits} holds a non-digit
   */
  public static int compute(String dataDigits) {
    int sum = 0;
    int length = dataDigits.length();
    for (int i = length - 1; i >= 0; i--) {
      char c = dataDigits.charAt(i);
      if (c < '0' || c > '9') {
        throw new IllegalArgumentException("dataDigits must contain digits only");
      }
      int weight = (length - 1 - i) % 2 == 0 ? 3 : 1;
      sum += (c - '0') * weight;
    }
    return (10 - sum % 10) % 10;
  }

  /**
   * Checks a complete key: digits only, a GS1 length, the expected length when given, and a matching check digit.
   *
   * @param code key including its check digit
   * @param expectedLength required length, or 0 for any GS1 length
   * @return {@code true} when the key is well formed and its check digit matches
   */
  public static boolean isValid(String code, int expectedLength) {
    if (code == null || !DIGITS.matcher(code).matches()) {
      return false;
    }
    if (expectedLength > 0 && code.length() != expectedLength) {
      return false;
    }
    if (!VALID_LENGTHS.contains(code.length())) {
      return false;
    }
    int last = code.length() - 1;
    return compute(code.substring(0, last)) == code.charAt(last) - '0';
  }
}
