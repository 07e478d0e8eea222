package ca.gc.cra.vigil.domain.validation;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * <strong>What:</strong> Closed set of input kinds understood by the master dispatch.
 * <p><strong>Why:</strong> Callers select a validator by tag only, never by validator signature.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and thread-safe.</p>
 *
 * @since 0.1.0
 */
public enum InputType {
  /** Integers or decimals with optional range and precision bounds. */
  NUMERIC("numeric"),
  /** Free text with optional length and character constraints. */
  TEXT("text"),
  /** Email address (simplified RFC 5322). */
  EMAIL("email"),
  /** Absolute http, https or ftp URL. */
  URL("url"),
  /** International phone number (E.164). */
  PHONE("phone"),
  /** International Bank Account Number (ISO 13616). */
  IBAN("iban"),
  /** International Securities Identification Number (ISO 6166). */
  ISIN("isin"),
  /** GS1 Global Location Number (13 digits). */
  GLN("gln"),
  /** GS1 Global Trade Item Number (8, 12, 13 or 14 digits). */
  GTIN("gtin"),
  /** Calendar date or timestamp. */
  DATE("date"),
  /** Age in whole years derived from a birth date. */
  AGE("age"),
  /** Cross-platform safe file name. */
  FILE_NAME("fileName");

  private static final Map<String, InputType> BY_TAG = Arrays.stream(values())
      .collect(Collectors.toUnmodifiableMap(
          type -> type.tag.toLowerCase(Locale.ROOT), Function.identity()));

  private final String tag;

  InputType(String tag) {
    this.tag = tag;
  }

  /**
   * Returns the wire name used by string-based dispatch and the CLI.
   *
   * @return lower camel case tag (e.g. {@code fileName})
   */
  public String tag() {
    return tag;
  }

  /**
   * Resolves a wire name, ignoring case and surrounding whitespace.
   *
   * @param tag candidate tag; may be {@code null}
   * @return matching type, or empty when the tag is unknown
   */
  public static Optional<InputType> fromTag(String tag) {
    if (tag == null || tag.isBlank()) {
      return Optional.empty();
    }
    return Optional.ofNullable(BY_TAG.get(tag.trim().toLowerCase(Locale.ROOT)));
  }

  @Override
  public String toString() {
    return tag;
  }
}
