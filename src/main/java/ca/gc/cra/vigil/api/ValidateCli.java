package ca.gc.cra.vigil.api;

import ca.gc.cra.vigil.application.InputValidator;
import ca.gc.cra.vigil.domain.validation.InputType;
import ca.gc.cra.vigil.domain.validation.ValidationResult;
import ca.gc.cra.vigil.logging.LoggingConfigurator;
import ca.gc.cra.vigil.logging.Logs;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validates a single value given on the command line.
 *
 * @since 0.1.0
 */
public final class ValidateCli {
  private static final Logger log = LoggerFactory.getLogger(ValidateCli.class);
  private static final int LOG_PREVIEW_CHARS = 64;
  private static final String SUMMARY_USAGE =
      "usage: validate type=TYPE value=VALUE [config=FILE] [profile=NAME] [option=VALUE ...] [--json]";
  private static final String HELP_TEXT = """
      VIGIL single value validation

      Usage:
        validate type=TYPE value=VALUE [options]

      Arguments:
        type=TYPE                   numeric|text|email|url|phone|iban|isin|gln|gtin|date|age|fileName
        value=VALUE                 Value to validate (value= validates an empty value)

      Options:
        config=FILE                 YAML file holding a common section and named profiles
        profile=NAME                Profile section merged over common (requires config)
        min=N max=N                 Inclusive bounds (numbers, epoch millis or ISO dates, ages)
        minLength=N maxLength=N     Length bounds for text and file names
        fixLength=N                 Exact text length
        decimals.min=N              Minimum decimal places
        decimals.max=N              Maximum decimal places
        allowSpecialChars=BOOL      false restricts text to letters, digits and spaces
        acceptedFileExtensions=L    Comma separated extensions, e.g. pdf,.png
        customErrorMessage=TEXT     Replaces every failure message
        birthDate=DATE              Birth date used by type=age instead of value
        --json                      Print the result as a JSON object
        --verbose                   Enable DEBUG logging
        --help                      Show this message

      Exit codes:
        0 valid, 1 invalid, 2 bad arguments, 3 I/O error, 4 configuration error, 5 runtime failure
      """;

  private ValidateCli() {}

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
   * Executes the validate command and returns a normalized exit code.
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
      log.debug("Verbose logging enabled for validate CLI");
    }

    Map<String, String> kv;
    InputType type;
    String value;
    try {
      kv = input.options();
      type = CliInput.takeType(kv);
      value = CliInput.takeValue(kv);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    ConfigCliUtils.Resolution resolution = ConfigCliUtils.resolve(kv);
    if (!resolution.ok()) {
      CliPrinter.println(SUMMARY_USAGE);
      return resolution.failure();
    }

    ValidationResult result;
    try {
      result = validator.validate(value, type, resolution.config());
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure validating {}", type, ex);
      return ExitCode.RUNTIME_FAILURE;
    }
    log.debug("Validated {} value {} -> valid={}", type,
        Logs.mask(Logs.truncate(value, LOG_PREVIEW_CHARS)), result.valid());

    CliPrinter.println(input.json() ? ResultJson.render(type, result) : ValueFormat.line(result));
    return result.valid() ? ExitCode.SUCCESS : ExitCode.VALIDATION_FAILED;
  }
}
