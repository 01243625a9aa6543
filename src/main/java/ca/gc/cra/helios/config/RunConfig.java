package ca.gc.cra.helios.config;

import ca.gc.cra.helios.validation.Numbers;
import ca.gc.cra.helios.validation.Strings;
import ca.gc.cra.helios.validation.Times;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Cadence loop settings.
 *
 * @param start cursor used when no state has been persisted
 * @param cadence interval between ticks
 * @param delay data availability delay after a tick's nominal time
 * @param maxErrors failure counter value above which an alert is sent
 * @param stateFile location of the persisted state
 * @param lookupWorkers size of the parallel lookup pool
 * @param reportDir directory for per-tick CSV reports, if enabled
 * @since 0.1.0
 */
public record RunConfig(
    Instant start,
    Duration cadence,
    Duration delay,
    int maxErrors,
    Path stateFile,
    int lookupWorkers,
    Optional<Path> reportDir) {
  private static final Duration DEFAULT_CADENCE = Duration.ofHours(6);
  private static final Duration DEFAULT_DELAY = Duration.ofDays(1);
  private static final int DEFAULT_MAX_ERRORS = 5;
  private static final Path DEFAULT_STATE_FILE = Path.of("helios-state.json");
  private static final int DEFAULT_LOOKUP_WORKERS = 2;

  public RunConfig {
    Objects.requireNonNull(start, "start");
    Objects.requireNonNull(cadence, "cadence");
    Objects.requireNonNull(delay, "delay");
    Objects.requireNonNull(stateFile, "stateFile");
    Objects.requireNonNull(reportDir, "reportDir");
  }

  /**
   * Defaults used to seed {@link DefaultsForMode}; the start instant is a placeholder.
   *
   * @return default settings
   */
  public static RunConfig defaults() {
    return new RunConfig(
        Instant.EPOCH,
        DEFAULT_CADENCE,
        DEFAULT_DELAY,
        DEFAULT_MAX_ERRORS,
        DEFAULT_STATE_FILE,
        DEFAULT_LOOKUP_WORKERS,
        Optional.empty());
  }

  /**
   * Builds run settings from flattened configuration.
   *
   * @param map effective configuration
   * @return parsed settings
   * @throws IllegalArgumentException if {@code run.start} is missing or a value is malformed
   */
  public static RunConfig fromMap(Map<String, String> map) {
    RunConfig defaults = defaults();
    String reportDir = Strings.trimToEmpty(map.get("run.reportDir"));
    String stateFile = Strings.trimToEmpty(map.get("run.stateFile"));
    return new RunConfig(
        Times.parseInstant("run.start", map.get("run.start")),
        Times.parseDuration("run.cadence", map.getOrDefault("run.cadence", defaults.cadence().toString()), false),
        Times.parseDuration("run.delay", map.getOrDefault("run.delay", defaults.delay().toString()), true),
        Numbers.parseInt("run.maxErrors", map.getOrDefault("run.maxErrors", "5"), 0, 1_000_000),
        stateFile.isEmpty() ? defaults.stateFile() : Path.of(stateFile),
        Numbers.parseInt("run.lookupWorkers", map.getOrDefault("run.lookupWorkers", "2"), 1, 64),
        reportDir.isEmpty() ? Optional.empty() : Optional.of(Path.of(reportDir)));
  }
}
