package ca.gc.cra.helios.api;

import ca.gc.cra.helios.application.port.FileMatcherPort;
import ca.gc.cra.helios.application.port.QualityReaderPort;
import ca.gc.cra.helios.config.CompositionRoot;
import ca.gc.cra.helios.config.DataConfig;
import ca.gc.cra.helios.domain.quality.QualityGate;
import ca.gc.cra.helios.domain.quality.QualityMask;
import ca.gc.cra.helios.infrastructure.fs.GlobFileMatcher;
import ca.gc.cra.helios.logging.LoggingConfigurator;
import ca.gc.cra.helios.validation.Strings;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prints a one-line quality verdict for every image matching a glob.
 *
 * @since 0.1.0
 */
public final class QualityCli {
  private static final Logger log = LoggerFactory.getLogger(QualityCli.class);
  private static final String MODE = "quality";
  private static final String SUMMARY_USAGE =
      "usage: quality file=GLOB [config=helios.yaml] [data.ignoreQualityBits=0,1,2] [data.hdu=1]";
  private static final String HELP_TEXT = """
      HELIOS quality report

      Usage:
        quality file=GLOB [key=value ...]

      Options:
        file=GLOB                  Image files to inspect, e.g. /data/2024/01/01/*.fits
        data.ignoreQualityBits     Bits reported as tolerated (default 0,1,2,3,4,8)
        data.hdu=N                 Header-data unit holding the keyword (default 1)
        data.qualityKeyword=NAME   Header keyword (default QUALITY)
        --verbose                  Enable DEBUG logging
        --help                     Show this message
      """;

  private QualityCli() {}

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
    String glob;
    try {
      Map<String, String> cliKv = CliArgsParser.toMap(input.keyValueArgs());
      glob = Strings.requireNonBlank("file", cliKv.remove("file"));
      data = DataConfig.fromMap(ConfigCliUtils.effectiveConfig(MODE, cliKv, SUMMARY_USAGE, log));
    } catch (ConfigCliUtils.CliAbort abort) {
      return abort.exitCode();
    } catch (IllegalArgumentException ex) {
      log.error("Invalid quality arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    return report(glob, new GlobFileMatcher(), CompositionRoot.qualityReader(data), new QualityGate(data.ignore()));
  }

  static ExitCode report(String glob, FileMatcherPort matcher, QualityReaderPort reader, QualityGate gate) {
    List<Path> files;
    try {
      files = matcher.match(glob);
    } catch (IOException ex) {
      log.error("Unable to expand {}", glob, ex);
      return ExitCode.IO_ERROR;
    }
    if (files.isEmpty()) {
      CliPrinter.println(LocateCli.NOT_FOUND);
      return ExitCode.PARTIAL_FAILURE;
    }
    boolean allGood = true;
    for (Path file : files) {
      Verdict verdict = verdict(file, reader, gate);
      allGood &= verdict.good();
      CliPrinter.println(verdict.line());
    }
    return allGood ? ExitCode.SUCCESS : ExitCode.PARTIAL_FAILURE;
  }

  static Verdict verdict(Path file, QualityReaderPort reader, QualityGate gate) {
    OptionalLong raw;
    try {
      raw = reader.readQuality(file);
    } catch (IOException ex) {
      log.warn("Unable to read header of {}: {}", file, ex.getMessage());
      return new Verdict("Error reading quality for file " + file, false);
    }
    if (raw.isEmpty()) {
      log.warn("No quality keyword in {}", file);
      return new Verdict("Error reading quality for file " + file, false);
    }
    QualityMask mask;
    try {
      mask = QualityMask.fromHeader(raw.getAsLong());
    } catch (IllegalArgumentException ex) {
      log.warn("Invalid quality value in {}: {}", file, ex.getMessage());
      return new Verdict("Error reading quality for file " + file, false);
    }
    if (mask.equals(QualityMask.CLEAN)) {
      return new Verdict(file + " is good quality", true);
    }
    String defects = String.join(", ", QualityGate.explain(mask));
    if (gate.isGood(mask)) {
      return new Verdict(file + " is good quality, BUT: " + defects, true);
    }
    return new Verdict(file + " is bad quality: " + defects, false);
  }

  record Verdict(String line, boolean good) {}
}
