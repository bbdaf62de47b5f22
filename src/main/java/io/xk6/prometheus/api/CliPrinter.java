package io.xk6.prometheus.api;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Console text meant for the operator: help, usage errors and the serving banner. Diagnostics use SLF4J.
 */
final class CliPrinter {
  private static final PrintWriter STDOUT = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  private static final AtomicReference<PrintWriter> TARGET = new AtomicReference<>(STDOUT);

  private CliPrinter() {
    // Utility
  }

  static void println(String message) {
    TARGET.get().println(message);
  }

  /**
   * Prints a usage error followed by the one-line usage summary.
   *
   * @param problem what was wrong with the invocation
   * @param usage usage summary of the command
   */
  static void usageError(String problem, String usage) {
    PrintWriter out = TARGET.get();
    out.println("error: " + problem);
    out.println(usage);
  }

  static void setWriterForTesting(PrintWriter writer) {
    TARGET.set(writer == null ? STDOUT : writer);
  }

  static void clearTestWriter() {
    TARGET.set(STDOUT);
  }
}
