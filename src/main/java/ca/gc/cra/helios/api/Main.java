package ca.gc.cra.helios.api;

import ca.gc.cra.helios.logging.LoggingConfigurator;
import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HELIOS command dispatcher.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: helios <run|backfill|locate|quality> [options]";
  private static final String HELP_TEXT = """
      HELIOS image pipeline scheduler

      Usage:
        helios <command> [options]

      Commands:
        run         Run the pipeline on a fixed cadence, resuming from the state file
        backfill    Run the pipeline for every tick in a past interval
        locate      Print the first good-quality image for a date and channel
        quality     Report the quality flags of matching image files

      Global flags:
        --help      Show this message (or <command> --help for command options)
        --verbose   Enable DEBUG logging
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
    if (safeArgs.length == 0) {
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String command = safeArgs[0].trim().toLowerCase(Locale.ROOT);
    String[] delegateArgs = Arrays.copyOfRange(safeArgs, 1, safeArgs.length);

    return switch (command) {
      case "run" -> RunCli.run(delegateArgs);
      case "backfill" -> BackfillCli.run(delegateArgs);
      case "locate" -> LocateCli.run(delegateArgs);
      case "quality" -> QualityCli.run(delegateArgs);
      case "--help", "-h", "help" -> {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        yield ExitCode.SUCCESS;
      }
      case "--verbose", "-v" -> {
        LoggingConfigurator.enableVerboseLogging();
        yield run(delegateArgs);
      }
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }
}
