package ca.gc.cra.vigil.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.vigil.application.InputValidator;
import ca.gc.cra.vigil.application.port.ClockPort;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class ValidateCliTest {
  @TempDir Path tempDir;

  private final StringWriter buffer = new StringWriter();
  private ListAppender<ILoggingEvent> appender;
  private Logger cliLogger;
  private Logger configLogger;

  @BeforeEach
  void setUp() {
    appender = new ListAppender<>();
    appender.start();
    cliLogger = (Logger) LoggerFactory.getLogger(ValidateCli.class);
    configLogger = (Logger) LoggerFactory.getLogger(ConfigCliUtils.class);
    cliLogger.addAppender(appender);
    configLogger.addAppender(appender);
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void tearDown() {
    cliLogger.detachAppender(appender);
    configLogger.detachAppender(appender);
    CliPrinter.clearTestWriter();
  }

  @Test
  void validValuePrintsNormalizedForm() {
    ExitCode code = ValidateCli.run(new String[] {"type=iban", "value=GB82 WEST 1234 5698 7654 32"});

    assertEquals(ExitCode.SUCCESS, code);
    assertEquals("VALID GB82WEST12345698765432", buffer.toString().trim());
  }

  @Test
  void invalidValuePrintsMessage() {
    ExitCode code = ValidateCli.run(new String[] {"type=iban", "value=GB82WEST12345698765433"});

    assertEquals(ExitCode.VALIDATION_FAILED, code);
    assertEquals("INVALID Invalid IBAN checksum", buffer.toString().trim());
  }

  @Test
  void emptyValueIsValidatedAsAbsent() {
    ExitCode code = ValidateCli.run(new String[] {"type=email", "value="});

    assertEquals(ExitCode.VALIDATION_FAILED, code);
    assertEquals("INVALID Email is required", buffer.toString().trim());
  }

  @Test
  void jsonOutputRendersResultObject() {
    ExitCode code = ValidateCli.run(new String[] {"--json", "type=numeric", "value=12.50"});

    assertEquals(ExitCode.SUCCESS, code);
    assertEquals("{\"type\":\"numeric\",\"valid\":true,\"normalizedValue\":12.5}", buffer.toString().trim());
  }

  @Test
  void jsonOutputRendersFailures() {
    ExitCode code = ValidateCli.run(new String[] {"type=fileName", "value=CON.txt", "--json"});

    assertEquals(ExitCode.VALIDATION_FAILED, code);
    assertEquals("{\"type\":\"fileName\",\"valid\":false,"
        + "\"errorMessage\":\"File name uses reserved Windows name: CON\"}", buffer.toString().trim());
  }

  @Test
  void optionsAreAppliedToTheValidator() {
    ExitCode code = ValidateCli.run(new String[] {"type=numeric", "value=1.23", "decimals.max=1"});

    assertEquals(ExitCode.VALIDATION_FAILED, code);
    assertEquals("INVALID Must have at most 1 decimal places", buffer.toString().trim());
  }

  @Test
  void ageUsesSuppliedValidatorClock() {
    InputValidator validator = new InputValidator(ClockPort.fixed(Instant.parse("2024-06-15T00:00:00Z")));

    ExitCode code = ValidateCli.run(new String[] {"type=age", "value=", "birthDate=2000-06-16", "min=18"}, validator);

    assertEquals(ExitCode.SUCCESS, code);
    assertEquals("VALID 23", buffer.toString().trim());
  }

  @Test
  void profileOptionsComeFromYamlAndCliOverridesThem() throws IOException {
    Path config = tempDir.resolve("vigil.yaml");
    Files.writeString(config, """
        common:
          customErrorMessage: ""
        amount:
          min: 0
          decimals:
            max: 2
        """);

    ExitCode fromYaml = ValidateCli.run(new String[] {
        "type=numeric", "value=12.345", "config=" + config, "profile=amount"});
    assertEquals(ExitCode.VALIDATION_FAILED, fromYaml);
    assertTrue(buffer.toString().contains("INVALID Must have at most 2 decimal places"));

    ExitCode overridden = ValidateCli.run(new String[] {
        "type=numeric", "value=12.345", "config=" + config, "profile=amount", "decimals.max=3"});
    assertEquals(ExitCode.SUCCESS, overridden);
    assertTrue(buffer.toString().contains("VALID 12.345"));
    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getLevel() == Level.WARN
            && event.getFormattedMessage().equals("CLI overrides YAML for key: decimals.max")));
  }

  @Test
  void missingTypeIsRejected() {
    ExitCode code = ValidateCli.run(new String[] {"value=abc"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: validate"));
    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getFormattedMessage().contains("Missing required argument: type")));
  }

  @Test
  void unknownTypeIsRejected() {
    ExitCode code = ValidateCli.run(new String[] {"type=postcode", "value=abc"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getFormattedMessage().contains("Unknown input type: postcode")));
  }

  @Test
  void missingValueIsRejected() {
    assertEquals(ExitCode.INVALID_ARGS, ValidateCli.run(new String[] {"type=email"}));
  }

  @Test
  void unknownOptionIsRejected() {
    ExitCode code = ValidateCli.run(new String[] {"type=text", "value=abc", "colour=red"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getLevel() == Level.ERROR
            && event.getFormattedMessage().contains("Invalid option: unknown option: colour")));
  }

  @Test
  void profileWithoutConfigIsRejected() {
    assertEquals(ExitCode.INVALID_ARGS,
        ValidateCli.run(new String[] {"type=text", "value=abc", "profile=amount"}));
  }

  @Test
  void contradictoryOptionsAreAConfigError() {
    ExitCode code = ValidateCli.run(new String[] {"type=numeric", "value=3", "min=5", "max=1"});

    assertEquals(ExitCode.CONFIG_ERROR, code);
    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getFormattedMessage().contains("min must be <= max")));
  }

  @Test
  void missingProfileIsAConfigError() throws IOException {
    Path config = tempDir.resolve("vigil.yaml");
    Files.writeString(config, "common:\n  min: 0\n");

    ExitCode code = ValidateCli.run(new String[] {
        "type=numeric", "value=3", "config=" + config, "profile=amount"});

    assertEquals(ExitCode.CONFIG_ERROR, code);
    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getFormattedMessage().startsWith("Invalid config file: profile amount")));
  }

  @Test
  void helpPrintsUsage() {
    ExitCode code = ValidateCli.run(new String[] {"--help"});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains("VIGIL single value validation"));
  }
}
