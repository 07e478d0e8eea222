package ca.gc.cra.vigil.logging;

/**
 * <strong>What:</strong> Log hygiene for validated values.
 * <p><strong>Why:</strong> Account numbers, emails and phone numbers are personal data; long batch lines would
 * flood the log.</p>
 * <p><strong>Thread-safety:</strong> Stateless utilities safe for concurrent use.</p>
 *
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";
  private static final int VISIBLE_SUFFIX = 4;
  private static final char MASK = '*';

  private Logs() {
    // Utility
  }

  /**
   * Shortens text to at most {@code maxChars} characters, appending the original length.
   *
   * @param value text to shorten; {@code null} results in {@code "<null>"}
   * @param maxChars characters to keep; must be positive
   * @return the original value when short enough, otherwise its prefix with a {@code "... (truncated, N chars)"}
   *     suffix
   * @throws IllegalArgumentException if {@code maxChars} is not positive
   */
  public static String truncate(String value, int maxChars) {
    if (maxChars <= 0) {
      throw new IllegalArgumentException("maxChars must be positive");
    }
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    if (value.length() <= maxChars) {
      return value;
    }
    int end = maxChars;
    if (Character.isHighSurrogate(value.charAt(end - 1))) {
      end--;
    }
    return value.substring(0, end) + "... (truncated, " + value.length() + " chars)";
  }

  /**
   * Masks every character but the last four, keeping the length visible.
   *
   * @param value sensitive identifier; {@code null} results in {@code "<null>"}
   * @return masked text, e.g. {@code ******************5432}; values of four characters or fewer are fully masked
   */
  public static String mask(String value) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    int length = value.length();
    StringBuilder masked = new StringBuilder(length);
    int visibleFrom = length > VISIBLE_SUFFIX ? length - VISIBLE_SUFFIX : length;
    for (int i = 0; i < length; i++) {
      masked.append(i < visibleFrom ? MASK : value.charAt(i));
    }
    return masked.toString();
  }
}
