package ca.gc.cra.vigil.domain.validation;

import ca.gc.cra.vigil.domain.util.Dates;
import ca.gc.cra.vigil.domain.util.Decimals;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.Date;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Tagged union of the input kinds a validator accepts.
 * <p><strong>Why:</strong> Callers hand over loosely typed values (form fields, CSV cells, parsed JSON); the
 * union fixes their kind once so every validator coerces them the same way.</p>
 * <p><strong>Role:</strong> Domain value passed from the dispatch to individual validators.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe for concurrent sharing.</p>
 * <p><strong>Observability:</strong> {@link #toString()} exposes the kind only, never the raw value.</p>
 *
 * @since 0.1.0
 */
public final class InputValue {
  /** Discriminator of the union. */
  public enum Kind {
    /** No value ({@code null}). */
    ABSENT,
    /** Character data, including objects coerced with {@link String#valueOf(Object)}. */
    TEXT,
    /** A {@link Number}. */
    NUMBER,
    /** A temporal object normalized to an {@link Instant}. */
    DATE
  }

  private static final InputValue ABSENT = new InputValue(Kind.ABSENT, null);

  private final Kind kind;
  private final Object value;

  private InputValue(Kind kind, Object value) {
    this.kind = kind;
    this.value = value;
  }

  /**
   * Classifies an arbitrary object.
   *
   * @param raw candidate value; may be {@code null}
   * @return union holding {@code raw}; the same instance when {@code raw} already is an {@code InputValue}
   */
  public static InputValue of(Object raw) {
    if (raw == null) {
      return ABSENT;
    }
    if (raw instanceof InputValue input) {
      return input;
    }
    if (raw instanceof Number number) {
      return new InputValue(Kind.NUMBER, number);
    }
    if (raw instanceof Date || raw instanceof Instant || raw instanceof LocalDate
        || raw instanceof LocalDateTime || raw instanceof OffsetDateTime || raw instanceof ZonedDateTime) {
      return new InputValue(Kind.DATE, Dates.parseToDate(raw).orElseThrow());
    }
    return new InputValue(Kind.TEXT, String.valueOf(raw));
  }

  /**
   * Returns the absent value.
   *
   * @return shared absent instance
   */
  public static InputValue absent() {
    return ABSENT;
  }

  /**
   * Wraps text.
   *
   * @param text character data; {@code null} yields the absent value
   * @return text input
   */
  public static InputValue text(String text) {
    return text == null ? ABSENT : new InputValue(Kind.TEXT, text);
  }

  /**
   * Reports whether an arbitrary object counts as absent: {@code null}, an absent union or the empty string.
   *
   * @param raw candidate value
   * @return {@code true} when the value is absent
   */
  public static boolean isEmpty(Object raw) {
    return of(raw).isEmpty();
  }

  /**
   * Returns the discriminator.
   *
   * @return input kind
   */
  public Kind kind() {
    return kind;
  }

  /**
   * Reports whether this value is absent or the empty string. Whitespace-only text is not empty.
   *
   * @return {@code true} when absent
   */
  public boolean isEmpty() {
    return kind == Kind.ABSENT || (kind == Kind.TEXT && ((String) value).isEmpty());
  }

  /**
   * Renders the value as text: numbers in compact decimal form, dates as ISO-8601 instants.
   *
   * @return text form; empty string when absent
   */
  public String asText() {
    return switch (kind) {
      case ABSENT -> "";
      case NUMBER -> Decimals.format((Number) value);
      case TEXT, DATE -> value.toString();
    };
  }

  /**
   * Coerces the value into a number.
   *
   * @return numeric value, or {@link Double#NaN} when absent, a date or non-numeric text
   */
  public double asNumber() {
    if (kind == Kind.NUMBER || kind == Kind.TEXT) {
      return Decimals.parseToNumber(value);
    }
    return Double.NaN;
  }

  /**
   * Coerces the value into an instant.
   *
   * @return instant for dates, epoch-millisecond numbers and ISO-8601 text; empty otherwise
   */
  public Optional<Instant> asInstant() {
    if (kind == Kind.ABSENT) {
      return Optional.empty();
    }
    return Dates.parseToDate(value);
  }

  /**
   * Returns the held value: a {@link String}, {@link Number} or {@link Instant}.
   *
   * @return raw value, or {@code null} when absent
   */
  public Object raw() {
    return value;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof InputValue)) {
      return false;
    }
    InputValue other = (InputValue) o;
    return kind == other.kind && Objects.equals(value, other.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, value);
  }

  @Override
  public String toString() {
    return "InputValue{" + kind + '}';
  }
}
