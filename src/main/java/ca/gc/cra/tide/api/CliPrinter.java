package ca.gc.cra.tide.api;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;

/**
 * Writes usage text, dry-run plans and verification reports to stdout, separate from the log stream.
 */
final class CliPrinter {
  private static final PrintWriter STDOUT = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  private static volatile PrintWriter testWriter;

  private CliPrinter() {}

  static void println(String line) {
    out().println(line);
  }

  static void printLines(String... lines) {
    PrintWriter out = out();
    for (String line : lines) {
      out.println(line);
    }
    out.flush();
  }

  static void setWriterForTesting(PrintWriter writer) {
    testWriter = writer;
  }

  static void clearTestWriter() {
    testWriter = null;
  }

  private static PrintWriter out() {
    PrintWriter writer = testWriter;
    return writer != null ? writer : STDOUT;
  }
}
