package ca.gc.cra.vigil.application.batch;

import ca.gc.cra.vigil.application.InputValidator;
import ca.gc.cra.vigil.domain.validation.InputType;
import ca.gc.cra.vigil.domain.validation.InputValue;
import ca.gc.cra.vigil.domain.validation.ValidationConfig;
import ca.gc.cra.vigil.domain.validation.ValidationResult;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Streams a line-oriented source through one validator.
 * <p><strong>Why:</strong> Bulk checks of exported identifiers (IBAN lists, GTIN catalogues, file manifests)
 * without loading the whole file.</p>
 * <p><strong>Role:</strong> Application-layer use case driven by the {@code batch} CLI command.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Read the source line by line as UTF-8.</li>
 *   <li>Validate each line as text, or skip blank lines when requested.</li>
 *   <li>Hand every outcome to a listener and count the results.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable; concurrent runs on distinct sources are safe.</p>
 * <p><strong>Observability:</strong> Logs the run summary at INFO and each line outcome at DEBUG without the
 * line content.</p>
 *
 * @since 0.1.0
 */
public final class BatchValidationUseCase {
  private static final Logger log = LoggerFactory.getLogger(BatchValidationUseCase.class);

  private final InputValidator validator;

  /**
   * Creates the use case.
   *
   * @param validator dispatch used for every line; must not be {@code null}
   */
  public BatchValidationUseCase(InputValidator validator) {
    this.validator = Objects.requireNonNull(validator, "validator");
  }

  /**
   * Validates every line of a UTF-8 file.
   *
   * @param source file to read; must not be {@code null}
   * @param type input type applied to each line; must not be {@code null}
   * @param config options applied to each line; may be {@code null}
   * @param skipBlank whether blank lines are skipped instead of validated
   * @param listener receives each outcome in line order; must not be {@code null}
   * @return counters of the run
   * @throws IOException when the file cannot be read
   */
  public BatchSummary run(Path source, InputType type, ValidationConfig config, boolean skipBlank,
      Consumer<LineOutcome> listener) throws IOException {
    Objects.requireNonNull(source, "source");
    try (BufferedReader reader = Files.newBufferedReader(source, StandardCharsets.UTF_8)) {
      BatchSummary summary = run(reader, type, config, skipBlank, listener);
      log.info("Validated {} lines from {} as {} ({} valid, {} invalid, {} skipped)",
          summary.total(), source, type, summary.valid(), summary.invalid(), summary.skipped());
      return summary;
    }
  }

  /**
   * Validates every line of a reader. The reader is not closed.
   *
   * @param source text to read; must not be {@code null}
   * @param type input type applied to each line; must not be {@code null}
   * @param config options applied to each line; may be {@code null}
   * @param skipBlank whether blank lines are skipped instead of validated
   * @param listener receives each outcome in line order; must not be {@code null}
   * @return counters of the run
   * @throws IOException when reading fails
   */
  public BatchSummary run(Reader source, InputType type, ValidationConfig config, boolean skipBlank,
      Consumer<LineOutcome> listener) throws IOException {
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(listener, "listener");
    BufferedReader reader = source instanceof BufferedReader buffered ? buffered : new BufferedReader(source);

    long total = 0;
    long valid = 0;
    long invalid = 0;
    long skipped = 0;
    String line;
    while ((line = reader.readLine()) != null) {
      total++;
      if (skipBlank && line.isBlank()) {
        skipped++;
        continue;
      }
      ValidationResult result = validator.validate(InputValue.text(line), type, config);
      if (result.valid()) {
        valid++;
      } else {
        invalid++;
      }
      log.debug("Line {} valid={}", total, result.valid());
      listener.accept(new LineOutcome(total, line, result));
    }
    return new BatchSummary(total, valid, invalid, skipped);
  }
}
