package ca.gc.cra.pacer.api;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

/**
 * Writes command output (usage, dry-run plans, snapshots) to stdout in UTF-8, apart from the log stream.
 *
 * @since PACER 0.1
 */
public final class CliPrinter {
  private static final PrintWriter STDOUT = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  private static volatile PrintWriter override;

  private CliPrinter() {}

  public static void println(String message) {
    PrintWriter writer = writer();
    writer.println(message);
    writer.flush();
  }

  public static void printLines(String... lines) {
    if (lines != null) {
      printLines(Arrays.asList(lines));
    }
  }

  /**
   * Prints a block of lines and flushes once at the end.
   *
   * @param lines lines to print; {@code null} prints nothing
   */
  public static void printLines(List<String> lines) {
    if (lines == null || lines.isEmpty()) {
      return;
    }
    PrintWriter writer = writer();
    lines.forEach(writer::println);
    writer.flush();
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
