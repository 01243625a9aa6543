package ca.gc.cra.helios.api;

import ca.gc.cra.helios.config.ConfigMerger;
import ca.gc.cra.helios.config.DefaultsForMode;
import ca.gc.cra.helios.config.YamlConfigLoader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;

/**
 * Shared steps of every command: pull the {@code config=} path out of the arguments, load the YAML file, and
 * merge it with defaults and CLI overrides.
 */
final class ConfigCliUtils {

  private ConfigCliUtils() {}

  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    for (String key : new String[] {"config", "--config"}) {
      String value = args.remove(key);
      if (value != null && !value.isBlank()) {
        return value.trim();
      }
    }
    return null;
  }

  /**
   * Builds the effective configuration for a command.
   *
   * @param mode command name
   * @param cliKv parsed CLI overrides; the {@code config} key is removed
   * @param usage usage line printed on argument errors
   * @param log command logger
   * @return merged configuration
   * @throws CliAbort carrying the exit code when the configuration cannot be loaded or merged
   */
  static Map<String, String> effectiveConfig(String mode, Map<String, String> cliKv, String usage, Logger log)
      throws CliAbort {
    String configPath = extractConfigPath(cliKv);
    Optional<Map<String, String>> yaml = loadYaml(configPath, mode, usage, log);
    try {
      return ConfigMerger.buildEffectiveConfig(mode, yaml, cliKv, DefaultsForMode.asFlatMap(mode), log::warn);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid {} configuration: {}", mode, ex.getMessage());
      CliPrinter.println(usage);
      throw new CliAbort(ExitCode.CONFIG_ERROR);
    }
  }

  private static Optional<Map<String, String>> loadYaml(String configPath, String mode, String usage, Logger log)
      throws CliAbort {
    if (configPath == null) {
      return Optional.empty();
    }
    Path yamlPath = Path.of(configPath);
    if (!Files.exists(yamlPath)) {
      log.error("Configuration file does not exist: {}", yamlPath);
      CliPrinter.println(usage);
      throw new CliAbort(ExitCode.INVALID_ARGS);
    }
    try {
      return YamlConfigLoader.load(yamlPath, mode);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid YAML configuration: {}", ex.getMessage());
      CliPrinter.println(usage);
      throw new CliAbort(ExitCode.CONFIG_ERROR);
    } catch (IOException ex) {
      log.error("Unable to read configuration file {}", yamlPath, ex);
      throw new CliAbort(ExitCode.IO_ERROR);
    }
  }

  /** Signals that a command must stop with the given exit code; the cause has already been logged. */
  static final class CliAbort extends Exception {
    private static final long serialVersionUID = 1L;

    private final transient ExitCode exitCode;

    CliAbort(ExitCode exitCode) {
      super(exitCode.name(), null, false, false);
      this.exitCode = exitCode;
    }

    ExitCode exitCode() {
      return exitCode;
    }
  }
}
