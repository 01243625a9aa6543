package ca.gc.cra.helios.api;

import ca.gc.cra.helios.application.locate.FileLocator;
import ca.gc.cra.helios.application.port.MetricsPort;
import ca.gc.cra.helios.config.CompositionRoot;
import ca.gc.cra.helios.config.DataConfig;
import ca.gc.cra.helios.config.HeliosConfig;
import ca.gc.cra.helios.domain.locate.LocatorKey;
import ca.gc.cra.helios.logging.LoggingConfigurator;
import ca.gc.cra.helios.validation.Numbers;
import ca.gc.cra.helios.validation.Times;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prints the first good-quality image for a date and optional channel.
 *
 * @since 0.1.0
 */
public final class LocateCli {
  private static final Logger log = LoggerFactory.getLogger(LocateCli.class);
  private static final String MODE = "locate";
  static final String NOT_FOUND = "No file found!";
  private static final String SUMMARY_USAGE =
      "usage: locate [config=helios.yaml] date=ISO [channel=N] [data.filePattern=TEMPLATE]";
  private static final String HELP_TEXT = """
      HELIOS file locator

      Usage:
        locate [config=PATH] date=ISO [channel=N] [key=value ...]

      Options:
        date=ISO                 Observation date, e.g. 2024-01-01T06:00:00Z
        channel=N                Channel substituted into {channel} placeholders
        data.filePattern=TPL     Overrides the configured image template
        data.ignoreQualityBits   Tolerated quality bits (default 0,1,2,3,4,8)
        --verbose                Enable DEBUG logging
        --help                   Show this message
      """;

  private LocateCli() {}

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

    DataConfig data;
    LocatorKey key;
    MetricsPort metrics;
    try {
      Map<String, String> cliKv = CliArgsParser.toMap(input.keyValueArgs());
      String rawDate = cliKv.remove("date");
      String rawChannel = cliKv.remove("channel");
      Map<String, String> effective = ConfigCliUtils.effectiveConfig(MODE, cliKv, SUMMARY_USAGE, log);
      data = DataConfig.fromMap(effective);
      data.requireFilePattern();
      Instant date = Times.parseInstant("date", rawDate);
      key = rawChannel == null || rawChannel.isBlank()
          ? LocatorKey.of(date)
          : LocatorKey.of(date, Numbers.parseInt("channel", rawChannel, 0, Integer.MAX_VALUE));
      metrics = CompositionRoot.metricsFor(HeliosConfig.telemetryFromMap(effective));
    } catch (ConfigCliUtils.CliAbort abort) {
      return abort.exitCode();
    } catch (IllegalArgumentException ex) {
      log.error("Invalid locate arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    try {
      FileLocator locator = CompositionRoot.fileLocator(data, CompositionRoot.qualityReader(data), metrics);
      Optional<Path> found = locator.locate(key);
      CliPrinter.println(found.map(Path::toString).orElse(NOT_FOUND));
      return found.isPresent() ? ExitCode.SUCCESS : ExitCode.PARTIAL_FAILURE;
    } catch (RuntimeException ex) {
      log.error("Unexpected failure while locating {}", key, ex);
      return ExitCode.RUNTIME_FAILURE;
    } finally {
      closeMetrics(metrics);
    }
  }

  static void closeMetrics(MetricsPort metrics) {
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception ex) {
        log.warn("Failed to close metrics exporter", ex);
      }
    }
  }
}
