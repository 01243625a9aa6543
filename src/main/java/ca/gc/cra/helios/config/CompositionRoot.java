package ca.gc.cra.helios.config;

import ca.gc.cra.helios.adapter.kafka.KafkaNotificationAdapter;
import ca.gc.cra.helios.application.job.ExternalJob;
import ca.gc.cra.helios.application.locate.FileLocator;
import ca.gc.cra.helios.application.pipeline.BackfillUseCase;
import ca.gc.cra.helios.application.pipeline.Pipeline;
import ca.gc.cra.helios.application.pipeline.PipelineStep;
import ca.gc.cra.helios.application.pipeline.SchedulerUseCase;
import ca.gc.cra.helios.application.pipeline.TickRunner;
import ca.gc.cra.helios.application.port.ClockPort;
import ca.gc.cra.helios.application.port.MetricsPort;
import ca.gc.cra.helios.application.port.NotificationPort;
import ca.gc.cra.helios.application.port.ProcessRunnerPort;
import ca.gc.cra.helios.application.port.QualityReaderPort;
import ca.gc.cra.helios.application.port.TickReportPort;
import ca.gc.cra.helios.domain.locate.PathTemplate;
import ca.gc.cra.helios.domain.quality.QualityGate;
import ca.gc.cra.helios.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.helios.infrastructure.fits.FitsQualityReader;
import ca.gc.cra.helios.infrastructure.fs.GlobFileMatcher;
import ca.gc.cra.helios.infrastructure.metrics.NoOpMetricsAdapter;
import ca.gc.cra.helios.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.helios.infrastructure.metrics.TelemetrySettings;
import ca.gc.cra.helios.infrastructure.notify.LoggingNotificationAdapter;
import ca.gc.cra.helios.infrastructure.process.SystemProcessRunner;
import ca.gc.cra.helios.infrastructure.report.CsvTickReportAdapter;
import ca.gc.cra.helios.infrastructure.state.JsonStateStore;
import ca.gc.cra.helios.infrastructure.time.SystemClockAdapter;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Central composition root that wires HELIOS use cases to concrete adapters.
 * <p><strong>Why:</strong> Keeps configuration-to-object translation in one place so CLIs stay thin.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Build the file locator, pipeline, and tick runner from {@link HeliosConfig}.</li>
 *   <li>Pick the metrics, notification, and report adapters selected by configuration.</li>
 *   <li>Release the lookup pool, Kafka producer, and meter provider on {@link #close()}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Construct and use on the CLI thread.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);
  private static final String ALERT_SUBJECT_PLACEHOLDER = "HELIOS";

  private final HeliosConfig config;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final ExecutorService lookupPool;
  private final TickRunner tickRunner;
  private final List<AutoCloseable> closeables = new ArrayList<>();

  /**
   * Creates a composition root backed by the system clock, real processes, and FITS headers.
   *
   * @param config validated configuration
   */
  public CompositionRoot(HeliosConfig config) {
    this(
        config,
        metricsFor(config.telemetry()),
        new SystemProcessRunner(),
        qualityReader(config.data()),
        new SystemClockAdapter());
  }

  CompositionRoot(
      HeliosConfig config,
      MetricsPort metrics,
      ProcessRunnerPort processRunner,
      QualityReaderPort qualityReader,
      ClockPort clock) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
    if (metrics instanceof AutoCloseable closeable) {
      closeables.add(closeable);
    }
    FileLocator locator = fileLocator(config.data(), qualityReader, metrics);
    Pipeline pipeline = pipeline(config.steps(), processRunner, clock, metrics);
    this.lookupPool = ExecutorFactories.newLookupPool(
        config.run().lookupWorkers(),
        "helios-lookup",
        (thread, ex) -> log.error("Lookup worker {} failed", thread.getName(), ex));
    this.tickRunner = new TickRunner(locator, pipeline, lookupPool);
  }

  /**
   * Builds the metrics adapter selected by the telemetry settings.
   *
   * @param settings resolved telemetry settings
   * @return OpenTelemetry adapter when export is enabled, otherwise a no-op adapter
   */
  public static MetricsPort metricsFor(TelemetrySettings settings) {
    if (settings.exporter() == TelemetrySettings.ExporterMode.NONE) {
      return new NoOpMetricsAdapter();
    }
    return new OpenTelemetryMetricsAdapter(settings);
  }

  /**
   * Builds the FITS header reader for the configured HDU and keyword.
   *
   * @param data data settings
   * @return quality reader
   */
  public static QualityReaderPort qualityReader(DataConfig data) {
    return new FitsQualityReader(data.hdu(), data.qualityKeyword());
  }

  /**
   * Builds a file locator over the local file system.
   *
   * @param data data settings; {@code data.filePattern} must be set
   * @param reader quality reader
   * @param metrics metrics sink
   * @return file locator
   * @throws IllegalArgumentException if no file pattern is configured
   */
  public static FileLocator fileLocator(DataConfig data, QualityReaderPort reader, MetricsPort metrics) {
    return new FileLocator(
        data.requireFilePattern(), new QualityGate(data.ignore()), new GlobFileMatcher(), reader, metrics);
  }

  static Pipeline pipeline(
      List<StepConfig> steps, ProcessRunnerPort processRunner, ClockPort clock, MetricsPort metrics) {
    List<PipelineStep> built = new ArrayList<>(steps.size());
    for (StepConfig step : steps) {
      ExternalJob job = new ExternalJob(step.jobSpec(), step.outputFlag(), processRunner, clock, metrics);
      PipelineStep pipelineStep = new PipelineStep(
          step.name(),
          job,
          step.channels(),
          step.arguments(),
          step.output().map(PathTemplate::parse).orElse(null),
          step.allowPartialInputs());
      for (String warning : pipelineStep.sanityWarnings()) {
        log.warn("Step {}: {}", step.name(), warning);
      }
      built.add(pipelineStep);
    }
    return new Pipeline(built);
  }

  /**
   * Returns the tick runner shared by the scheduler and backfill use cases.
   *
   * @return tick runner
   */
  public TickRunner tickRunner() {
    return tickRunner;
  }

  /**
   * Returns the metrics sink used by every component.
   *
   * @return metrics port
   */
  public MetricsPort metrics() {
    return metrics;
  }

  /**
   * Builds the cadence scheduler with durable state, alerts, and optional reports.
   *
   * @return scheduler use case
   */
  public SchedulerUseCase schedulerUseCase() {
    RunConfig run = config.run();
    NotifyConfig notify = config.notification();
    NotificationPort.Alert template = new NotificationPort.Alert(
        notify.sender(), notify.recipients(), ALERT_SUBJECT_PLACEHOLDER, "");
    return new SchedulerUseCase(
        tickRunner,
        new JsonStateStore(run.stateFile(), clock),
        notifier(notify),
        template,
        reporter(run),
        clock,
        metrics,
        new SchedulerUseCase.Settings(run.start(), run.cadence(), run.delay(), run.maxErrors()));
  }

  /**
   * Builds the backfill use case.
   *
   * @return backfill use case
   */
  public BackfillUseCase backfillUseCase() {
    return new BackfillUseCase(tickRunner, reporter(config.run()), metrics);
  }

  private NotificationPort notifier(NotifyConfig notify) {
    if (notify.mode() == NotifyConfig.NotifyMode.KAFKA) {
      KafkaNotificationAdapter kafka = new KafkaNotificationAdapter(notify.kafkaBootstrap(), notify.kafkaTopic());
      closeables.add(kafka);
      log.info("Alerts will be published to Kafka topic {}", notify.kafkaTopic());
      return kafka;
    }
    if (notify.recipients().isEmpty()) {
      log.warn("notify.recipients is empty; alerts will only be logged");
    }
    return new LoggingNotificationAdapter();
  }

  private static TickReportPort reporter(RunConfig run) {
    return run.reportDir().<TickReportPort>map(CsvTickReportAdapter::new).orElse(TickReportPort.NONE);
  }

  /** Stops the lookup pool and closes adapters that hold external resources. */
  @Override
  public void close() {
    lookupPool.shutdownNow();
    for (int i = closeables.size() - 1; i >= 0; i--) {
      AutoCloseable closeable = closeables.get(i);
      try {
        closeable.close();
      } catch (Exception ex) {
        log.warn("Failed to close {}", closeable.getClass().getSimpleName(), ex);
      }
    }
    closeables.clear();
  }
}
