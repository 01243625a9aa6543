package ca.gc.cra.helios.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each HELIOS command.
 *
 * <p>The defaults remain the single source of truth for optional keys. Per-step keys
 * ({@code step.<name>.*}) have no entries here because step names are operator-defined; {@link StepConfig} applies
 * their defaults.</p>
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns a flattened map of defaults for the requested command merged with common defaults.
   *
   * @param mode command (run, backfill, locate, quality)
   * @return unmodifiable map of default key/value pairs as strings
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "run" -> buildRunDefaults();
      case "backfill" -> buildBackfillDefaults();
      case "locate", "quality" -> Map.of();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("data.filePattern", "");
    map.put("data.ignoreQualityBits", "0,1,2,3,4,8");
    map.put("data.hdu", "1");
    map.put("data.qualityKeyword", "QUALITY");
    map.put("run.lookupWorkers", "2");
    map.put("metricsExporter", "none");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildRunDefaults() {
    RunConfig defaults = RunConfig.defaults();
    Map<String, String> map = new LinkedHashMap<>(buildPipelineDefaults());
    map.put("run.delay", defaults.delay().toString());
    map.put("run.maxErrors", Integer.toString(defaults.maxErrors()));
    map.put("run.stateFile", defaults.stateFile().toString());
    map.put("notify.mode", NotifyConfig.NotifyMode.LOG.name());
    map.put("notify.recipients", "");
    map.put("notify.sender", NotifyConfig.DEFAULT_SENDER);
    map.put("notify.kafkaBootstrap", "");
    map.put("notify.kafkaTopic", NotifyConfig.DEFAULT_TOPIC);
    return map;
  }

  private static Map<String, String> buildBackfillDefaults() {
    return buildPipelineDefaults();
  }

  private static Map<String, String> buildPipelineDefaults() {
    RunConfig defaults = RunConfig.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("run.cadence", defaults.cadence().toString());
    map.put("run.reportDir", "");
    map.put("steps", "");
    return map;
  }
}
