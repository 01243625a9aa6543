package ca.gc.cra.helios.config;

import ca.gc.cra.helios.domain.locate.PathTemplate;
import ca.gc.cra.helios.infrastructure.metrics.TelemetrySettings;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Typed configuration of the scheduler and backfill commands.
 * <p><strong>Why:</strong> Every required key is checked once at startup so that misconfiguration aborts the process
 * before the loop starts.</p>
 *
 * @param data image location and quality settings
 * @param run cadence loop settings
 * @param steps pipeline steps in execution order
 * @param notification alert delivery settings
 * @param telemetry metrics export settings
 * @since 0.1.0
 */
public record HeliosConfig(
    DataConfig data, RunConfig run, List<StepConfig> steps, NotifyConfig notification, TelemetrySettings telemetry) {

  public HeliosConfig {
    Objects.requireNonNull(data, "data");
    Objects.requireNonNull(run, "run");
    steps = List.copyOf(steps);
    Objects.requireNonNull(notification, "notification");
    Objects.requireNonNull(telemetry, "telemetry");
  }

  /**
   * Builds the configuration from the merged key/value map.
   *
   * @param map effective configuration
   * @return parsed configuration
   * @throws IllegalArgumentException if a required key is missing, a value is malformed, or an image step omits
   *     channels that the file pattern needs
   */
  public static HeliosConfig fromMap(Map<String, String> map) {
    Objects.requireNonNull(map, "map");
    DataConfig data = DataConfig.fromMap(map);
    PathTemplate pattern = data.requireFilePattern();
    List<StepConfig> steps = StepConfig.listFromMap(map);
    if (steps.isEmpty()) {
      throw new IllegalArgumentException("steps must list at least one pipeline step");
    }
    for (StepConfig step : steps) {
      if (pattern.usesChannel() && step.needsImages() && step.channels().isEmpty()) {
        throw new IllegalArgumentException(
            "step." + step.name() + ".channels is required because data.filePattern contains {channel}");
      }
    }
    return new HeliosConfig(
        data,
        RunConfig.fromMap(map),
        steps,
        NotifyConfig.fromMap(map),
        telemetryFromMap(map));
  }

  /**
   * Resolves metrics export settings from the {@code metricsExporter}, {@code otelEndpoint}, and
   * {@code otelResourceAttributes} keys.
   *
   * @param map effective configuration
   * @return telemetry settings
   */
  public static TelemetrySettings telemetryFromMap(Map<String, String> map) {
    return TelemetrySettings.resolve(
        map.get("metricsExporter"), map.get("otelEndpoint"), map.get("otelResourceAttributes"));
  }
}
