package ca.gc.cra.vigil.api;

import ca.gc.cra.vigil.application.InputValidator;
import ca.gc.cra.vigil.application.batch.BatchSummary;
import ca.gc.cra.vigil.application.batch.BatchValidationUseCase;
import ca.gc.cra.vigil.application.batch.LineOutcome;
import ca.gc.cra.vigil.domain.validation.InputType;
import ca.gc.cra.vigil.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validates every line of a UTF-8 text file with one input type.
 *
 * @since 0.1.0
 */
public final class BatchCli {
  private static final Logger log = LoggerFactory.getLogger(BatchCli.class);
  private static final String SUMMARY_USAGE =
      "usage: batch type=TYPE in=FILE [config=FILE] [profile=NAME] [option=VALUE ...] [--json] [--skip-blank]";
  private static final String HELP_TEXT = """
      VIGIL batch validation

      Usage:
        batch type=TYPE in=FILE [options]

      Arguments:
        type=TYPE                   numeric|text|email|url|phone|iban|isin|gln|gtin|date|age|fileName
        in=FILE                     UTF-8 text file, one value per line

      Options:
        config=FILE                 YAML file holding a common section and named profiles
        profile=NAME                Profile section merged over common (requires config)
        option=VALUE                Any validation option accepted by the validate command
        --skip-blank                Skip blank lines instead of validating them
        --json                      Print one JSON object per line plus a summary object
        --verbose                   Enable DEBUG logging
        --help                      Show this message

      Output:
        One line per input line (N: VALID value | N: INVALID message), then a summary line.

      Exit codes:
        0 all valid, 1 some invalid, 2 bad arguments, 3 I/O error, 4 configuration error, 5 runtime failure
      """;

  private BatchCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Executes the batch command and returns a normalized exit code.
   *
   * @param args raw CLI arguments
   * @return exit code describing the outcome
   */
  static ExitCode run(String[] args) {
    return run(args, InputValidator.standard());
  }

  static ExitCode run(String[] args, InputValidator validator) {
    return run(CliInput.parse(args), validator);
  }

  static ExitCode run(CliInput input, InputValidator validator) {
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for batch CLI");
    }

    Map<String, String> kv;
    InputType inputType;
    try {
      kv = input.options();
      inputType = CliInput.takeType(kv);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    Path source;
    try {
      source = CliInput.takeInputFile(kv);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid input file: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    ConfigCliUtils.Resolution resolution = ConfigCliUtils.resolve(kv);
    if (!resolution.ok()) {
      CliPrinter.println(SUMMARY_USAGE);
      return resolution.failure();
    }

    boolean json = input.json();
    Consumer<LineOutcome> printer = outcome -> CliPrinter.println(json
        ? ResultJson.render(inputType, outcome.lineNumber(), outcome.result())
        : outcome.lineNumber() + ": " + ValueFormat.line(outcome.result()));

    BatchSummary summary;
    try {
      summary = new BatchValidationUseCase(validator)
          .run(source, inputType, resolution.config(), input.skipBlank(), printer);
    } catch (IOException ex) {
      log.error("Unable to read batch input {}", source, ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in batch validation", ex);
      return ExitCode.RUNTIME_FAILURE;
    }

    CliPrinter.println(json ? ResultJson.render(summary) : String.format(
        "total=%d valid=%d invalid=%d skipped=%d",
        summary.total(), summary.valid(), summary.invalid(), summary.skipped()));
    return summary.allValid() ? ExitCode.SUCCESS : ExitCode.VALIDATION_FAILED;
  }
}
