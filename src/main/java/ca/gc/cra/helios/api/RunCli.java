package ca.gc.cra.helios.api;

import ca.gc.cra.helios.application.pipeline.SchedulerUseCase;
import ca.gc.cra.helios.config.CompositionRoot;
import ca.gc.cra.helios.config.HeliosConfig;
import ca.gc.cra.helios.config.StepConfig;
import ca.gc.cra.helios.domain.pipeline.TickOutcome;
import ca.gc.cra.helios.logging.LoggingConfigurator;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the pipeline on a fixed cadence until the process is stopped.
 *
 * @since 0.1.0
 */
public final class RunCli {
  private static final Logger log = LoggerFactory.getLogger(RunCli.class);
  private static final String MODE = "run";
  private static final long SHUTDOWN_GRACE_SECONDS = 30;
  private static final String SUMMARY_USAGE =
      "usage: run config=helios.yaml [run.start=ISO] [run.cadence=PT6H] [run.delay=P1D] [run.maxErrors=5] "
          + "[run.stateFile=PATH] [--once] [--verbose]";
  private static final String HELP_TEXT = """
      HELIOS cadence scheduler

      Usage:
        run config=PATH [key=value ...] [--once]

      Required (YAML or CLI):
        data.filePattern=TEMPLATE  Image path template, e.g. /data/{date:yyyy/MM/dd}/img_{channel:4}_*.fits
        run.start=ISO              First tick when no state file exists (e.g. 2024-01-01T00:00:00Z)
        steps=a,b                  Ordered pipeline step names
        step.<name>.executable     Program run by each step

      Optional:
        run.cadence=PT6H           Interval between ticks
        run.delay=P1D              Wait after a tick's nominal time before processing it
        run.maxErrors=5            Alert once the failure counter exceeds this value
        run.stateFile=PATH         Resumable state (default helios-state.json)
        run.reportDir=DIR          Write a CSV report per successful tick
        notify.mode=LOG|KAFKA      Alert transport (KAFKA requires notify.kafkaBootstrap)
        metricsExporter=otlp|none  Metrics exporter (default none)
        --once                     Process a single tick and exit
        --verbose                  Enable DEBUG logging
        --help                     Show this message

      Notes:
        - A stored state file overrides run.start.
        - SIGTERM/SIGINT stop the loop; the unfinished tick is repeated on the next start.
      """;

  private RunCli() {}

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
      log.debug("Verbose logging enabled for run command");
    }

    HeliosConfig config;
    try {
      Map<String, String> cliKv = CliArgsParser.toMap(input.keyValueArgs());
      Map<String, String> effective = ConfigCliUtils.effectiveConfig(MODE, cliKv, SUMMARY_USAGE, log);
      config = HeliosConfig.fromMap(effective);
    } catch (ConfigCliUtils.CliAbort abort) {
      return abort.exitCode();
    } catch (IllegalArgumentException ex) {
      log.error("Invalid run configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.CONFIG_ERROR;
    }

    log.info("Configured pipeline: steps=[{}], cadence={}, delay={}, maxErrors={}, stateFile={}, notify={}",
        config.steps().stream().map(StepConfig::name).collect(Collectors.joining(",")),
        config.run().cadence(),
        config.run().delay(),
        config.run().maxErrors(),
        config.run().stateFile(),
        config.notification().mode());

    try (CompositionRoot root = new CompositionRoot(config)) {
      SchedulerUseCase scheduler = root.schedulerUseCase();
      if (input.hasFlag("--once")) {
        TickOutcome outcome = scheduler.runOnce();
        return outcome.success() ? ExitCode.SUCCESS : ExitCode.PARTIAL_FAILURE;
      }
      return runUntilStopped(scheduler);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.info("Scheduler stopped; cursor remains at the unfinished tick");
      return ExitCode.INTERRUPTED;
    } catch (IllegalArgumentException ex) {
      log.error("Pipeline configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in scheduler", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static ExitCode runUntilStopped(SchedulerUseCase scheduler) throws InterruptedException {
    Thread worker = Thread.currentThread();
    CountDownLatch stopped = new CountDownLatch(1);
    Thread hook = new Thread(() -> {
      log.info("Shutdown requested; interrupting scheduler");
      worker.interrupt();
      try {
        if (!stopped.await(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS)) {
          log.warn("Scheduler did not stop within {}s", SHUTDOWN_GRACE_SECONDS);
        }
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
      }
    }, "helios-shutdown");
    Runtime.getRuntime().addShutdownHook(hook);
    try {
      scheduler.run();
      return ExitCode.SUCCESS;
    } finally {
      stopped.countDown();
      removeHook(hook);
    }
  }

  private static void removeHook(Thread hook) {
    try {
      Runtime.getRuntime().removeShutdownHook(hook);
    } catch (IllegalStateException ex) {
      log.debug("JVM shutdown already in progress", ex);
    }
  }
}
