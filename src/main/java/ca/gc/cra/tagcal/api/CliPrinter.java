package ca.gc.cra.tagcal.api;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Console output for usage text, dry-run plans and {@code refcheck} reports.
 *
 * <p>Writes to the stdout file descriptor rather than {@code System.out} so log appenders and report output do not
 * interleave through the same stream object.</p>
 */
public final class CliPrinter {
  private static final PrintWriter STDOUT = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  private static volatile PrintWriter override;

  private CliPrinter() {
    // Utility
  }

  public static void println(String message) {
    writer().println(message);
  }

  public static void printLines(String... lines) {
    if (lines == null) {
      return;
    }
    PrintWriter writer = writer();
    for (String line : lines) {
      writer.println(line);
    }
  }

  /**
   * Prints one formatted line using {@link Locale#ROOT}.
   *
   * @param format {@link String#format} pattern without trailing newline
   * @param args format arguments
   */
  public static void printf(String format, Object... args) {
    writer().println(String.format(Locale.ROOT, format, args));
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
