package io.xk6.prometheus.api;

import io.xk6.prometheus.logging.LoggingConfigurator;
import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command dispatcher for the {@code xk6-prometheus} executable.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: xk6-prometheus <run> [options]";
  private static final String HELP_TEXT = """
      xk6-prometheus command dispatcher

      Usage:
        xk6-prometheus <command> [options]

      Commands:
        run         Serve k6 samples on a Prometheus pull endpoint (run --help for details)

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

  static ExitCode run(String[] args) {
    String[] safeArgs = args == null ? new String[0] : args;
    int commandIndex = 0;
    boolean help = false;
    boolean verbose = false;
    while (commandIndex < safeArgs.length && safeArgs[commandIndex] != null
        && safeArgs[commandIndex].trim().startsWith("-")) {
      CliInput.GlobalFlag flag = CliInput.GlobalFlag.of(safeArgs[commandIndex]).orElse(null);
      help |= flag == CliInput.GlobalFlag.HELP;
      verbose |= flag == CliInput.GlobalFlag.VERBOSE;
      commandIndex++;
    }
    if (help) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (verbose) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for dispatcher");
    }
    if (commandIndex >= safeArgs.length || safeArgs[commandIndex] == null) {
      log.debug("No command given");
      CliPrinter.usageError("missing command", SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String command = safeArgs[commandIndex].trim().toLowerCase(Locale.ROOT);
    String[] delegateArgs = Arrays.copyOfRange(safeArgs, commandIndex + 1, safeArgs.length);
    return switch (command) {
      case "run" -> RunCli.run(delegateArgs);
      case "help" -> {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        yield ExitCode.SUCCESS;
      }
      default -> {
        log.debug("Unknown command: {}", command);
        CliPrinter.usageError("unknown command '" + command + "'", SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }
}
