package ca.gc.cra.vigil.application.port;

import java.time.Instant;
import java.util.Objects;

/**
 * <strong>What:</strong> Port supplying the "now" reference of birth-date and age validation.
 * <p><strong>Why:</strong> Keeps every validator a pure function of its inputs once the clock is fixed.</p>
 * <p><strong>Role:</strong> Application port consumed by date-relative validators.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe.</p>
 *
 * @implNote Default implementation delegates to {@link Instant#now()}.
 * @since 0.1.0
 */
public interface ClockPort {
  /**
   * Returns the current instant.
   *
   * @return wall-clock instant; subject to system clock adjustments
   */
  Instant now();

  /** Default {@link ClockPort} reading the JVM wall clock. */
  ClockPort SYSTEM = Instant::now;

  /**
   * Returns a clock frozen at the given instant.
   *
   * @param instant instant every call returns; must not be {@code null}
   * @return fixed clock
   */
  static ClockPort fixed(Instant instant) {
    Objects.requireNonNull(instant, "instant");
    return () -> instant;
  }
}
