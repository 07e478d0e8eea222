package ca.gc.cra.vigil.application.batch;

/**
 * <strong>What:</strong> Counters of one batch run.
 * <p><strong>Thread-safety:</strong> Immutable record; safe for sharing.</p>
 *
 * @param total lines read, including skipped ones
 * @param valid lines that passed validation
 * @param invalid lines that failed validation
 * @param skipped blank lines that were not validated
 * @since 0.1.0
 */
public record BatchSummary(long total, long valid, long invalid, long skipped) {
  /**
   * Reports whether every validated line passed.
   *
   * @return {@code true} when no line failed
   */
  public boolean allValid() {
    return invalid == 0;
  }
}
