package ca.gc.cra.vigil.api;

import ca.gc.cra.vigil.application.InputValidator;
import ca.gc.cra.vigil.logging.LoggingConfigurator;
import java.util.Locale;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * VIGIL CLI dispatcher that routes to subcommands.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: vigil <validate|batch> [options]";
  private static final String HELP_TEXT = """
      VIGIL input validation

      Usage:
        vigil <command> [options]

      Commands:
        validate    Validate one value (validate --help for details)
        batch       Validate every line of a file (batch --help for details)

      Global flags:
        --help      Show this message
        --verbose   Enable DEBUG logging before dispatching to subcommand
      """;

  private Main() {}

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
   * Dispatches a subcommand and returns its exit code without terminating the JVM.
   *
   * @param args dispatcher arguments (first token is the subcommand)
   * @return exit code reported by the delegated CLI
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    Optional<String> command = input.command();
    if (input.help() && command.isEmpty()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for dispatcher");
    }

    if (command.isEmpty()) {
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    // Flags may appear before or after the command; the subcommand receives all of them.
    CliInput delegate = input.withoutCommand();
    String name = command.get().toLowerCase(Locale.ROOT);
    return switch (name) {
      case "validate" -> ValidateCli.run(delegate, InputValidator.standard());
      case "batch" -> BatchCli.run(delegate, InputValidator.standard());
      default -> {
        log.error("Unknown command: {}", name);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }
}
