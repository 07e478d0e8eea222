package ca.gc.cra.vigil.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.PrintWriter;
import java.io.StringWriter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class MainTest {
  private final StringWriter buffer = new StringWriter();
  private ListAppender<ILoggingEvent> appender;
  private Logger logger;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(Main.class);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void tearDown() {
    logger.detachAppender(appender);
    CliPrinter.clearTestWriter();
  }

  @Test
  void helpWithoutCommandPrintsDispatcherHelp() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"--help"}));
    assertTrue(buffer.toString().contains("VIGIL input validation"));
  }

  @Test
  void missingCommandIsRejected() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[0]));
    assertTrue(buffer.toString().contains("usage: vigil"));
  }

  @Test
  void unknownCommandIsRejected() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"frobnicate"}));
    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getFormattedMessage().equals("Unknown command: frobnicate")));
  }

  @Test
  void dispatchesToValidate() {
    ExitCode code = Main.run(new String[] {"validate", "type=email", "value= A@B.co "});

    assertEquals(ExitCode.SUCCESS, code);
    assertEquals("VALID a@b.co", buffer.toString().trim());
  }

  @Test
  void flagsBeforeTheCommandAreForwarded() {
    ExitCode code = Main.run(new String[] {"--json", "validate", "type=phone", "value=+33-1-23-45-67-89"});

    assertEquals(ExitCode.SUCCESS, code);
    assertEquals("{\"type\":\"phone\",\"valid\":true,\"normalizedValue\":\"+33123456789\"}", buffer.toString().trim());
  }

  @Test
  void subcommandHelpIsDelegated() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"batch", "--help"}));
    assertTrue(buffer.toString().contains("VIGIL batch validation"));
  }

  @Test
  void flagsAfterTheCommandReachTheSubcommand() {
    ExitCode code = Main.run(new String[] {"validate", "type=numeric", "value=12abc", "--JSON"});

    assertEquals(ExitCode.SUCCESS, code);
    assertEquals("{\"type\":\"numeric\",\"valid\":true,\"normalizedValue\":12}", buffer.toString().trim());
  }
}
