package ca.gc.cra.vigil.domain.util;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.Year;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Date;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Date coercion and age arithmetic on the UTC calendar.
 *
 * <p>Text follows ISO-8601: instants, offset and zoned date-times, local date-times (read as UTC), plain
 * dates (UTC midnight), year-months and years. Numbers are epoch milliseconds. Calendar-impossible dates
 * such as {@code 2024-02-30} are rejected.</p>
 *
 * @since 0.1.0
 */
public final class Dates {
  /** Largest distance from the epoch, in milliseconds, accepted for numeric dates (100 million days). */
  public static final double MAX_EPOCH_MILLIS = 8.64e15;

  private static final List<Function<String, Instant>> TEXT_PARSERS = List.of(
      Instant::parse,
      text -> OffsetDateTime.parse(text).toInstant(),
      text -> ZonedDateTime.parse(text).toInstant(),
      text -> LocalDateTime.parse(text).toInstant(ZoneOffset.UTC),
      text -> LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC).toInstant(),
      text -> YearMonth.parse(text).atDay(1).atStartOfDay(ZoneOffset.UTC).toInstant(),
      Dates::startOfYear);

  private Dates() {
    // Utility
  }

  /**
   * Coerces a temporal object, ISO-8601 text or epoch-millisecond number into an instant.
   *
   * @param value candidate value; may be {@code null}
   * @return parsed instant, or empty when the value is not a date
   */
  public static Optional<Instant> parseToDate(Object value) {
    if (value instanceof Instant instant) {
      return Optional.of(instant);
    }
    if (value instanceof Date date) {
      return Optional.of(date.toInstant());
    }
    if (value instanceof OffsetDateTime dateTime) {
      return Optional.of(dateTime.toInstant());
    }
    if (value instanceof ZonedDateTime dateTime) {
      return Optional.of(dateTime.toInstant());
    }
    if (value instanceof LocalDateTime dateTime) {
      return Optional.of(dateTime.toInstant(ZoneOffset.UTC));
    }
    if (value instanceof LocalDate date) {
      return Optional.of(date.atStartOfDay(ZoneOffset.UTC).toInstant());
    }
    if (value instanceof Number number) {
      return fromEpochMillis(number.doubleValue());
    }
    if (value instanceof CharSequence text) {
      return parseText(Whitespace.trim(text.toString()));
    }
    return Optional.empty();
  }

  /**
   * Computes whole years elapsed between a birth instant and a reference instant.
   *
   * <p>The naive year difference is decremented when the reference month/day precedes the birth
   * month/day.</p>
   *
   * @param birthDate date of birth; must not be {@code null}
   * @param referenceDate instant the age is measured at; must not be {@code null}
   * @return age in complete years; negative when the birth date lies after the reference
   */
  public static int calculateAge(Instant birthDate, Instant referenceDate) {
    LocalDate birth = LocalDate.ofInstant(birthDate, ZoneOffset.UTC);
    LocalDate reference = LocalDate.ofInstant(referenceDate, ZoneOffset.UTC);
    int age = reference.getYear() - birth.getYear();
    int monthDiff = reference.getMonthValue() - birth.getMonthValue();
    if (monthDiff < 0 || (monthDiff == 0 && reference.getDayOfMonth() < birth.getDayOfMonth())) {
      age--;
    }
    return age;
  }

  /**
   * Renders the UTC calendar date of an instant as {@code yyyy-MM-dd}.
   *
   * @param instant instant to render; must not be {@code null}
   * @return ISO local date text
   */
  public static String isoDate(Instant instant) {
    return LocalDate.ofInstant(instant, ZoneOffset.UTC).toString();
  }

  /**
   * Converts an epoch-millisecond bound into an instant.
   *
   * @param epochMillis bound expressed in milliseconds since the epoch
   * @return matching instant, or empty when the bound is not finite or beyond {@link #MAX_EPOCH_MILLIS}
   */
  public static Optional<Instant> fromEpochMillis(double epochMillis) {
    if (!Double.isFinite(epochMillis) || Math.abs(epochMillis) > MAX_EPOCH_MILLIS) {
      return Optional.empty();
    }
    return Optional.of(Instant.ofEpochMilli((long) epochMillis));
  }

  private static Optional<Instant> parseText(String text) {
    if (text.isEmpty()) {
      return Optional.empty();
    }
    for (Function<String, Instant> parser : TEXT_PARSERS) {
      Optional<Instant> parsed = tryParse(parser, text);
      if (parsed.isPresent()) {
        return parsed;
      }
    }
    return Optional.empty();
  }

  private static Instant startOfYear(String text) {
    if (text.length() != 4) {
      throw new DateTimeException("year must have four digits: " + text);
    }
    return Year.parse(text).atDay(1).atStartOfDay(ZoneOffset.UTC).toInstant();
  }

  private static Optional<Instant> tryParse(Function<String, Instant> parser, String text) {
    try {
      return Optional.of(parser.apply(text));
    } catch (DateTimeException ex) {
      return Optional.empty();
    }
  }
}
