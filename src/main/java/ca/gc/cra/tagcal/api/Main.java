package ca.gc.cra.tagcal.api;

import ca.gc.cra.tagcal.logging.LoggingConfigurator;
import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * TAGCAL CLI dispatcher that routes to subcommands.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: tagcal <calibrate|refcheck> [options]";
  private static final String HELP_TEXT = """
      TAGCAL time-tag event calibration

      Usage:
        tagcal <command> [options]

      Commands:
        calibrate   Calibrate one exposure (calibrate --help for details)
        refcheck    Inspect and validate a reference-table document

      Global flags:
        --help      Show this message
        --verbose   Enable DEBUG logging before dispatching to subcommand
      """;

  private Main() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  /**
   * Dispatches a subcommand and returns its exit code without terminating the JVM.
   *
   * @param args dispatcher arguments (first non-flag token is the subcommand)
   * @return exit code reported by the delegated command
   */
  static ExitCode run(String[] args) {
    String[] raw = args == null ? new String[0] : args;
    int commandIndex = -1;
    for (int i = 0; i < raw.length; i++) {
      if (raw[i] != null && !raw[i].isBlank() && !raw[i].trim().startsWith("-")) {
        commandIndex = i;
        break;
      }
    }
    CliInput global = CliInput.parse(commandIndex < 0 ? raw : Arrays.copyOfRange(raw, 0, commandIndex));
    if (commandIndex < 0) {
      if (global.help()) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (global.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for dispatcher");
    }

    String command = raw[commandIndex].trim().toLowerCase(Locale.ROOT);
    String[] delegateArgs = Arrays.copyOfRange(raw, commandIndex + 1, raw.length);
    return switch (command) {
      case "calibrate" -> CalibrateCli.run(delegateArgs);
      case "refcheck" -> RefCheckCli.run(delegateArgs);
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }
}
