package ca.gc.cra.vigil.api;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;

/**
 * Console output for validation results and usage text.
 *
 * <p>Writes to the stdout file descriptor directly so results never interleave with log output, which
 * Logback sends to stderr.</p>
 */
public final class CliPrinter {
  private static final PrintWriter STDOUT = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  private static volatile PrintWriter override;

  private CliPrinter() {
    // Utility
  }

  /**
   * Prints a single line to stdout.
   *
   * @param message line to emit
   */
  public static void println(String message) {
    writer().println(message);
  }

  static void setWriterForTesting(PrintWriter writer) {
    override = writer;
  }

  static void clearTestWriter() {
    override = null;
  }

  private static PrintWriter writer() {
    PrintWriter current = override;
    return current != null ? current : STDOUT;
  }
}
