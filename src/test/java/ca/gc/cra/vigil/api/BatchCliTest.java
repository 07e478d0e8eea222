package ca.gc.cra.vigil.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class BatchCliTest {
  @TempDir Path tempDir;

  private final StringWriter buffer = new StringWriter();
  private ListAppender<ILoggingEvent> appender;
  private Logger logger;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(BatchCli.class);
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
  void printsOneLinePerValueAndSummary() throws IOException {
    Path in = writeIbans();

    ExitCode code = BatchCli.run(new String[] {"type=iban", "in=" + in, "--skip-blank"});

    assertEquals(ExitCode.VALIDATION_FAILED, code);
    assertEquals(List.of(
        "1: VALID GB82WEST12345698765432",
        "3: INVALID Invalid IBAN checksum",
        "total=3 valid=1 invalid=1 skipped=1"), buffer.toString().lines().toList());
  }

  @Test
  void jsonOutputIncludesLineNumbersAndSummary() throws IOException {
    Path in = tempDir.resolve("gtins.txt");
    Files.writeString(in, "5901234123457\n96385074\n");

    ExitCode code = BatchCli.run(new String[] {"type=gtin", "in=" + in, "--json"});

    assertEquals(ExitCode.SUCCESS, code);
    assertEquals(List.of(
        "{\"type\":\"gtin\",\"line\":1,\"valid\":true,\"normalizedValue\":\"5901234123457\"}",
        "{\"type\":\"gtin\",\"line\":2,\"valid\":true,\"normalizedValue\":\"96385074\"}",
        "{\"summary\":{\"total\":2,\"valid\":2,\"invalid\":0,\"skipped\":0}}"), buffer.toString().lines().toList());
  }

  @Test
  void optionsApplyToEveryLine() throws IOException {
    Path in = tempDir.resolve("names.txt");
    Files.writeString(in, "report.pdf\nnotes.doc\n");

    ExitCode code = BatchCli.run(new String[] {"type=fileName", "in=" + in, "acceptedFileExtensions=pdf"});

    assertEquals(ExitCode.VALIDATION_FAILED, code);
    assertTrue(buffer.toString().contains("2: INVALID File extension not allowed. Accepted: .pdf"));
  }

  @Test
  void missingInputFileIsRejected() {
    ExitCode code = BatchCli.run(new String[] {"type=iban", "in=" + tempDir.resolve("missing.txt")});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: batch"));
    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getFormattedMessage().contains("does not exist")));
  }

  @Test
  void missingTypeIsRejected() throws IOException {
    Path in = writeIbans();

    assertEquals(ExitCode.INVALID_ARGS, BatchCli.run(new String[] {"in=" + in}));
    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getFormattedMessage().contains("Missing required argument: type")));
  }

  private Path writeIbans() throws IOException {
    Path in = tempDir.resolve("ibans.txt");
    Files.writeString(in, """
        GB82 WEST 1234 5698 7654 32

        GB82WEST12345698765433
        """);
    return in;
  }
}
