package ca.gc.cra.vigil.domain.util;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Numeric coercion and precision helpers shared by validators.
 * <p><strong>Why:</strong> Numeric and date validators accept both text and numbers; coercion must be
 * identical everywhere so bounds and decimal checks agree.</p>
 * <p><strong>Thread-safety:</strong> Stateless utility.</p>
 * <p><strong>Observability:</strong> Emits no logs; an unparseable value is signalled with
 * {@link Double#NaN}, never an exception.</p>
 *
 * @since 0.1.0
 */
public final class Decimals {
  private static final Pattern DECIMAL_LITERAL =
      Pattern.compile("[+-]?(?:Infinity|(?:\\d+\\.?\\d*|\\.\\d+)(?:[eE][+-]?\\d+)?)");
  private static final double PLAIN_INTEGER_LIMIT = 1e21;
  private static final double PLAIN_FRACTION_LIMIT = 1e-6;

  private Decimals() {
    // Utility
  }

  /**
   * Coerces a number or numeric text into a {@code double}.
   *
   * <p>Text is trimmed and thousands-separator commas are removed, then the longest leading decimal
   * literal is read: an optionally signed number with an optional fraction and exponent, or
   * {@code Infinity}. Trailing characters are ignored, so {@code "12abc"} reads as 12 and {@code "1e"}
   * as 1. Text with no leading literal yields {@link Double#NaN}.</p>
   *
   * @param value candidate value; may be {@code null}
   * @return parsed value, or {@link Double#NaN} when the value is not numeric
   */
  public static double parseToNumber(Object value) {
    if (value instanceof Number number) {
      return number.doubleValue();
    }
    if (value instanceof CharSequence text) {
      Matcher literal = DECIMAL_LITERAL.matcher(normalize(text));
      if (!literal.lookingAt()) {
        return Double.NaN;
      }
      String prefix = literal.group();
      if (prefix.endsWith("Infinity")) {
        return prefix.startsWith("-") ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
      }
      return Double.parseDouble(prefix);
    }
    return Double.NaN;
  }

  /**
   * Reports whether text, once trimmed and stripped of commas, is a decimal literal with nothing after it.
   *
   * @param text candidate text; must not be {@code null}
   * @return {@code true} when the whole text is numeric
   */
  public static boolean isDecimalLiteral(CharSequence text) {
    return DECIMAL_LITERAL.matcher(normalize(text)).matches();
  }

  /**
   * Counts the fractional digits of a value as rendered in decimal.
   *
   * <p>Exponential renderings such as {@code 1.25E-5} adjust the mantissa's fractional digit count by
   * the exponent. Trailing fractional zeros do not count, so {@code 1.0} yields 0.</p>
   *
   * @param value value to inspect
   * @return number of decimal places; 0 for integers and non-finite values
   */
  public static int countDecimalPlaces(double value) {
    if (!Double.isFinite(value)) {
      return 0;
    }
    String rendered = Double.toString(value).toLowerCase(Locale.ROOT);
    int exponentIndex = rendered.indexOf('e');
    if (exponentIndex < 0) {
      return fractionDigits(rendered);
    }
    String mantissa = rendered.substring(0, exponentIndex);
    int exponent = Integer.parseInt(rendered.substring(exponentIndex + 1));
    return Math.max(0, fractionDigits(mantissa) - exponent);
  }

  /**
   * Renders a number the way it reads in a message: integral values without a fractional part.
   *
   * @param value number to render; {@code null} renders as {@code "null"}
   * @return compact decimal rendering
   */
  public static String format(Number value) {
    if (value == null) {
      return "null";
    }
    if (value instanceof BigDecimal decimal) {
      return decimal.stripTrailingZeros().toPlainString();
    }
    if (value instanceof BigInteger || value instanceof Long || value instanceof Integer
        || value instanceof Short || value instanceof Byte) {
      return value.toString();
    }
    if (value instanceof Float f) {
      return format(Double.parseDouble(Float.toString(f)));
    }
    return format(value.doubleValue());
  }

  /**
   * Renders a {@code double} without a trailing {@code .0} when it is integral.
   *
   * @param value value to render
   * @return compact decimal rendering
   */
  public static String format(double value) {
    if (Double.isNaN(value)) {
      return "NaN";
    }
    if (Double.isInfinite(value)) {
      return value > 0 ? "Infinity" : "-Infinity";
    }
    double magnitude = Math.abs(value);
    if (value == Math.rint(value) && magnitude < PLAIN_INTEGER_LIMIT) {
      return new BigDecimal(value).toPlainString();
    }
    if (magnitude >= PLAIN_FRACTION_LIMIT && magnitude < PLAIN_INTEGER_LIMIT) {
      return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
    return Double.toString(value);
  }

  private static String normalize(CharSequence text) {
    return Whitespace.trim(text.toString()).replace(",", "");
  }

  private static int fractionDigits(String plain) {
    int dot = plain.indexOf('.');
    if (dot < 0) {
      return 0;
    }
    int end = plain.length();
    while (end > dot + 1 && plain.charAt(end - 1) == '0') {
      end--;
    }
    return end - dot - 1;
  }
}
