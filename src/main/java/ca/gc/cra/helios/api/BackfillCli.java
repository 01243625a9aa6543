package ca.gc.cra.helios.api;

import ca.gc.cra.helios.application.pipeline.BackfillUseCase;
import ca.gc.cra.helios.config.CompositionRoot;
import ca.gc.cra.helios.config.HeliosConfig;
import ca.gc.cra.helios.logging.LoggingConfigurator;
import ca.gc.cra.helios.validation.Times;
import java.time.Instant;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reprocesses a past interval tick by tick, without waiting, alerting, or touching the state file.
 *
 * @since 0.1.0
 */
public final class BackfillCli {
  private static final Logger log = LoggerFactory.getLogger(BackfillCli.class);
  private static final String MODE = "backfill";
  private static final String SUMMARY_USAGE =
      "usage: backfill config=helios.yaml start=ISO [end=ISO] [cadence=PT6H] [--verbose]";
  private static final String HELP_TEXT = """
      HELIOS backfill

      Usage:
        backfill config=PATH start=ISO [end=ISO] [cadence=DURATION] [key=value ...]

      Options:
        start=ISO          First tick (inclusive), e.g. 2024-01-01 or 2024-01-01T06:00:00Z
        end=ISO            End of the interval (exclusive, default now)
        cadence=DURATION   Interval between ticks (default run.cadence)
        --verbose          Enable DEBUG logging
        --help             Show this message

      Exit status is non-zero when any tick failed.
      """;

  private BackfillCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }

    HeliosConfig config;
    Instant end;
    try {
      Map<String, String> cliKv = CliArgsParser.toMap(input.keyValueArgs());
      String rawEnd = cliKv.remove("end");
      moveKey(cliKv, "start", "run.start");
      moveKey(cliKv, "cadence", "run.cadence");
      Map<String, String> effective = ConfigCliUtils.effectiveConfig(MODE, cliKv, SUMMARY_USAGE, log);
      config = HeliosConfig.fromMap(effective);
      end = rawEnd == null || rawEnd.isBlank() ? Instant.now() : Times.parseInstant("end", rawEnd);
    } catch (ConfigCliUtils.CliAbort abort) {
      return abort.exitCode();
    } catch (IllegalArgumentException ex) {
      log.error("Invalid backfill arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    try (CompositionRoot root = new CompositionRoot(config)) {
      BackfillUseCase backfill = root.backfillUseCase();
      BackfillUseCase.Result result = backfill.run(config.run().start(), end, config.run().cadence());
      CliPrinter.println(String.format("Backfill %s .. %s: %d ticks, %d failed",
          config.run().start(), end, result.outcomes().size(), result.failedCount()));
      return result.allSucceeded() ? ExitCode.SUCCESS : ExitCode.PARTIAL_FAILURE;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("Backfill interrupted");
      return ExitCode.INTERRUPTED;
    } catch (IllegalArgumentException ex) {
      log.error("Backfill configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in backfill", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static void moveKey(Map<String, String> cliKv, String from, String to) {
    String value = cliKv.remove(from);
    if (value != null) {
      cliKv.put(to, value);
    }
  }
}
