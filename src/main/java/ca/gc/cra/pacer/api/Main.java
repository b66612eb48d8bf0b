package ca.gc.cra.pacer.api;

import ca.gc.cra.pacer.logging.LoggingConfigurator;
import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * PACER CLI dispatcher that routes to subcommands.
 *
 * @since PACER 0.1
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: pacer <simulate> [options]";
  private static final String HELP_TEXT = """
      PACER frame admission and adaptive-quality governor

      Usage:
        pacer <command> [options]

      Commands:
        simulate    Run the governor against a synthetic camera (simulate --help for details)

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
   * @return exit code reported by the delegated command
   */
  static ExitCode run(String[] args) {
    String[] safeArgs = args == null ? new String[0] : args;
    int commandIndex = 0;
    while (commandIndex < safeArgs.length
        && (safeArgs[commandIndex] == null || safeArgs[commandIndex].trim().startsWith("-"))) {
      commandIndex++;
    }
    CliInput globals = CliInput.parse(Arrays.copyOfRange(safeArgs, 0, commandIndex));
    if (globals.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for dispatcher");
    }
    if (globals.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (commandIndex == safeArgs.length) {
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    String command = safeArgs[commandIndex].trim().toLowerCase(Locale.ROOT);
    if (command.equals("help")) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    return dispatch(command, Arrays.copyOfRange(safeArgs, commandIndex + 1, safeArgs.length));
  }

  private static ExitCode dispatch(String command, String[] delegateArgs) {
    return switch (command) {
      case "simulate" -> SimulateCli.run(delegateArgs);
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }
}
