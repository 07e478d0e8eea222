package ca.gc.cra.vigil.config;

import ca.gc.cra.vigil.domain.util.Dates;
import ca.gc.cra.vigil.domain.util.Decimals;
import ca.gc.cra.vigil.domain.validation.DecimalBounds;
import ca.gc.cra.vigil.domain.validation.ValidationConfig;
import ca.gc.cra.vigil.guard.Numbers;
import ca.gc.cra.vigil.guard.Strings;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

/**
 * <strong>What:</strong> Parses flat option maps (CLI {@code key=value} pairs, flattened YAML) into
 * {@link ValidationConfig}.
 * <p><strong>Why:</strong> Both configuration sources produce strings; typing and range checks happen once.</p>
 * <p><strong>Thread-safety:</strong> Stateless utility.</p>
 *
 * @since 0.1.0
 */
public final class ValidationConfigs {
  public static final String MIN = "min";
  public static final String MAX = "max";
  public static final String MIN_LENGTH = "minLength";
  public static final String MAX_LENGTH = "maxLength";
  public static final String FIX_LENGTH = "fixLength";
  public static final String DECIMALS_MIN = "decimals.min";
  public static final String DECIMALS_MAX = "decimals.max";
  public static final String ALLOW_SPECIAL_CHARS = "allowSpecialChars";
  public static final String ACCEPTED_FILE_EXTENSIONS = "acceptedFileExtensions";
  public static final String CUSTOM_ERROR_MESSAGE = "customErrorMessage";
  public static final String BIRTH_DATE = "birthDate";

  /** Every option key understood by {@link #fromMap(Map)}. */
  public static final Set<String> OPTION_KEYS = Set.of(
      MIN, MAX, MIN_LENGTH, MAX_LENGTH, FIX_LENGTH, DECIMALS_MIN, DECIMALS_MAX,
      ALLOW_SPECIAL_CHARS, ACCEPTED_FILE_EXTENSIONS, CUSTOM_ERROR_MESSAGE, BIRTH_DATE);

  private ValidationConfigs() {
    // Utility
  }

  /**
   * Builds a configuration from option strings. Blank values leave the option unset, except
   * {@code customErrorMessage}, which is kept verbatim.
   *
   * @param options option key to raw value; must not be {@code null}
   * @return typed configuration
   * @throws IllegalArgumentException when a key is unknown or a value is malformed
   */
  public static ValidationConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    for (String key : options.keySet()) {
      if (!OPTION_KEYS.contains(key)) {
        throw new IllegalArgumentException("unknown option: " + key);
      }
    }

    ValidationConfig.Builder builder = ValidationConfig.builder();
    value(options, MIN).ifPresent(v -> builder.min(parseBound(MIN, v)));
    value(options, MAX).ifPresent(v -> builder.max(parseBound(MAX, v)));
    value(options, MIN_LENGTH).ifPresent(v -> builder.minLength(Numbers.parseNonNegativeInt(MIN_LENGTH, v)));
    value(options, MAX_LENGTH).ifPresent(v -> builder.maxLength(Numbers.parseNonNegativeInt(MAX_LENGTH, v)));
    value(options, FIX_LENGTH).ifPresent(v -> builder.fixLength(Numbers.parseNonNegativeInt(FIX_LENGTH, v)));

    OptionalInt decimalsMin = value(options, DECIMALS_MIN)
        .map(v -> OptionalInt.of(Numbers.parseNonNegativeInt(DECIMALS_MIN, v)))
        .orElse(OptionalInt.empty());
    OptionalInt decimalsMax = value(options, DECIMALS_MAX)
        .map(v -> OptionalInt.of(Numbers.parseNonNegativeInt(DECIMALS_MAX, v)))
        .orElse(OptionalInt.empty());
    if (decimalsMin.isPresent() || decimalsMax.isPresent()) {
      builder.decimals(new DecimalBounds(decimalsMin, decimalsMax));
    }

    value(options, ALLOW_SPECIAL_CHARS)
        .ifPresent(v -> builder.allowSpecialChars(Strings.requireBoolean(ALLOW_SPECIAL_CHARS, v)));
    value(options, ACCEPTED_FILE_EXTENSIONS)
        .ifPresent(v -> builder.acceptedFileExtensions(splitList(v)));
    String customMessage = options.get(CUSTOM_ERROR_MESSAGE);
    if (customMessage != null) {
      builder.customErrorMessage(customMessage);
    }
    value(options, BIRTH_DATE).ifPresent(builder::birthDate);
    return builder.build();
  }

  /**
   * Parses a range bound: a finite number, or an ISO-8601 date converted to epoch milliseconds so date
   * bounds can be written as {@code min=2024-01-01}.
   *
   * @param name option name for diagnostics
   * @param value raw text
   * @return numeric bound
   * @throws IllegalArgumentException when the value is neither a number nor a date
   */
  static double parseBound(String name, String value) {
    if (!Decimals.isDecimalLiteral(value)) {
      Optional<Instant> date = Dates.parseToDate(value);
      if (date.isPresent()) {
        return date.get().toEpochMilli();
      }
    }
    return Numbers.parseFinite(name, value.trim().replace(",", ""));
  }

  static List<String> splitList(String value) {
    List<String> items = new ArrayList<>();
    for (String part : value.split(",")) {
      String trimmed = part.trim();
      if (!trimmed.isEmpty()) {
        items.add(trimmed);
      }
    }
    return items;
  }

  private static Optional<String> value(Map<String, String> options, String key) {
    String raw = options.get(key);
    if (raw == null || raw.isBlank()) {
      return Optional.empty();
    }
    return Optional.of(raw);
  }
}
