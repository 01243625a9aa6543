package ca.gc.cra.helios.application.pipeline;

import ca.gc.cra.helios.application.port.ClockPort;
import ca.gc.cra.helios.application.port.MetricsPort;
import ca.gc.cra.helios.application.port.NotificationPort;
import ca.gc.cra.helios.application.port.StateStorePort;
import ca.gc.cra.helios.application.port.TickReportPort;
import ca.gc.cra.helios.domain.pipeline.StepRecord;
import ca.gc.cra.helios.domain.pipeline.TickOutcome;
import ca.gc.cra.helios.domain.state.FailureCounter;
import ca.gc.cra.helios.domain.state.PipelineState;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Long-running cadence loop: wait for data, run the tick, persist progress, alert on sustained
 * failure.
 * <p><strong>Why:</strong> The pipeline runs unattended for months; it must resume where it stopped after a restart
 * and page operators only when failures pile up.</p>
 * <p><strong>Role:</strong> Application use case driven by the {@code run} command.</p>
 * <p><strong>States:</strong> {@link Phase#WAITING_FOR_DATA} &rarr; {@link Phase#RUNNING_TICK} &rarr;
 * {@link Phase#PERSISTING} &rarr; ({@link Phase#ALERTING}) &rarr; {@link Phase#WAITING_FOR_DATA}.</p>
 * <p><strong>Thread-safety:</strong> Driven by a single thread. Interrupting that thread stops the loop; an interrupted
 * tick is neither counted nor persisted and is replayed on restart.</p>
 * <p><strong>Observability:</strong> Emits {@code scheduler.tick.succeeded}, {@code scheduler.tick.failed},
 * {@code scheduler.alert.sent}, {@code scheduler.state.persistFailed}, and {@code scheduler.failureCount}. The MDC
 * key {@code tick} holds the cursor while a tick runs.</p>
 *
 * @since 0.1.0
 */
public final class SchedulerUseCase {
  private static final Logger log = LoggerFactory.getLogger(SchedulerUseCase.class);
  static final String MDC_TICK = "tick";

  /** Scheduler states. */
  public enum Phase {
    WAITING_FOR_DATA,
    RUNNING_TICK,
    PERSISTING,
    ALERTING
  }

  /**
   * Loop timing and alert settings.
   *
   * @param start cursor used when no state was persisted
   * @param cadence interval between ticks; positive
   * @param delay data availability delay; not negative
   * @param maxErrors alert once the failure counter exceeds this value; not negative
   */
  public record Settings(Instant start, Duration cadence, Duration delay, int maxErrors) {
    /**
     * Validates settings.
     *
     * @throws IllegalArgumentException if a duration or threshold is out of range
     */
    public Settings {
      Objects.requireNonNull(start, "start");
      Objects.requireNonNull(cadence, "cadence");
      Objects.requireNonNull(delay, "delay");
      if (cadence.isZero() || cadence.isNegative()) {
        throw new IllegalArgumentException("run.cadence must be positive");
      }
      if (delay.isNegative()) {
        throw new IllegalArgumentException("run.delay must not be negative");
      }
      if (maxErrors < 0) {
        throw new IllegalArgumentException("run.maxErrors must not be negative");
      }
    }
  }

  private final TickRunner runner;
  private final StateStorePort store;
  private final NotificationPort notifier;
  private final NotificationPort.Alert alertTemplate;
  private final TickReportPort reporter;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final Settings settings;

  private PipelineState state;
  private volatile Phase phase = Phase.WAITING_FOR_DATA;

  /**
   * Creates a scheduler.
   *
   * @param runner tick runner
   * @param store durable state store
   * @param notifier alert transport
   * @param alertTemplate sender and recipients for alerts; subject and body are replaced per alert
   * @param reporter tick report writer
   * @param clock clock used for waiting
   * @param metrics metrics sink
   * @param settings loop settings
   */
  public SchedulerUseCase(
      TickRunner runner,
      StateStorePort store,
      NotificationPort notifier,
      NotificationPort.Alert alertTemplate,
      TickReportPort reporter,
      ClockPort clock,
      MetricsPort metrics,
      Settings settings) {
    this.runner = Objects.requireNonNull(runner, "runner");
    this.store = Objects.requireNonNull(store, "store");
    this.notifier = Objects.requireNonNull(notifier, "notifier");
    this.alertTemplate = Objects.requireNonNull(alertTemplate, "alertTemplate");
    this.reporter = reporter == null ? TickReportPort.NONE : reporter;
    this.clock = clock == null ? ClockPort.SYSTEM : clock;
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.settings = Objects.requireNonNull(settings, "settings");
  }

  /**
   * Loads persisted progress, falling back to the configured start.
   *
   * @return state the loop starts from
   */
  public PipelineState initialize() {
    Optional<PipelineState> loaded = store.load();
    state = loaded.orElseGet(() -> PipelineState.initial(settings.start()));
    log.info("Scheduler starting at cursor {} with failure count {}{}",
        state.cursor(), state.failures().value(), loaded.isPresent() ? " (resumed)" : "");
    return state;
  }

  /**
   * Runs ticks until the calling thread is interrupted.
   *
   * @throws InterruptedException when interrupted; the unfinished tick is not persisted
   */
  public void run() throws InterruptedException {
    if (state == null) {
      initialize();
    }
    while (!Thread.currentThread().isInterrupted()) {
      runOnce();
    }
    throw new InterruptedException("scheduler interrupted");
  }

  /**
   * Runs exactly one iteration of the state machine.
   *
   * @return outcome of the tick
   * @throws InterruptedException if interrupted while waiting or while the tick runs
   */
  public TickOutcome runOnce() throws InterruptedException {
    if (state == null) {
      initialize();
    }
    Instant cursor = state.cursor();
    phase = Phase.WAITING_FOR_DATA;
    awaitData(cursor);

    phase = Phase.RUNNING_TICK;
    MDC.put(MDC_TICK, cursor.toString());
    try {
      TickOutcome outcome = runTick(cursor);
      FailureCounter failures = state.failures().record(outcome.success());
      if (outcome.success()) {
        metrics.increment("scheduler.tick.succeeded");
        log.info("Tick {} succeeded", cursor);
        writeReport(outcome);
      } else {
        metrics.increment("scheduler.tick.failed");
        log.warn("Tick {} failed: {}", cursor,
            outcome.firstFailure().map(StepRecord::message).orElse("unknown failure"));
      }
      metrics.observe("scheduler.failureCount", failures.value());

      phase = Phase.PERSISTING;
      state = state.advance(settings.cadence()).withFailures(failures);
      persist();

      if (failures.exceeds(settings.maxErrors())) {
        phase = Phase.ALERTING;
        alert(cursor, failures, outcome);
        state = state.withFailures(failures.reset());
        persist();
      }
      return outcome;
    } finally {
      MDC.remove(MDC_TICK);
      phase = Phase.WAITING_FOR_DATA;
    }
  }

  /**
   * Returns the in-memory state.
   *
   * @return current state, or {@code null} before {@link #initialize()}
   */
  public PipelineState state() {
    return state;
  }

  public Phase phase() {
    return phase;
  }

  private void awaitData(Instant cursor) throws InterruptedException {
    long readiness = cursor.plus(settings.delay()).toEpochMilli();
    long now = clock.nowMillis();
    if (now < readiness) {
      log.info("Waiting until {} for data of tick {}", Instant.ofEpochMilli(readiness), cursor);
    }
    while (now < readiness) {
      clock.sleepMillis(readiness - now);
      now = clock.nowMillis();
    }
  }

  private TickOutcome runTick(Instant cursor) throws InterruptedException {
    try {
      return runner.run(cursor);
    } catch (RuntimeException ex) {
      log.error("Tick {} aborted by unexpected error", cursor, ex);
      return new TickOutcome(cursor, Map.of(), List.of(StepRecord.failed("tick", String.valueOf(ex.getMessage()))));
    }
  }

  private void writeReport(TickOutcome outcome) {
    try {
      reporter.write(outcome.tick(), TickSummary.of(outcome));
    } catch (IOException ex) {
      log.warn("Unable to write report for tick {}", outcome.tick(), ex);
    }
  }

  private void persist() {
    try {
      store.save(state);
    } catch (IOException ex) {
      metrics.increment("scheduler.state.persistFailed");
      log.error("Unable to persist scheduler state (cursor {}); continuing with in-memory state", state.cursor(), ex);
    }
  }

  private void alert(Instant cursor, FailureCounter failures, TickOutcome outcome) {
    String subject = "HELIOS: too many errors";
    String body = "The pipeline recorded " + failures.value() + " failed ticks (limit " + settings.maxErrors()
        + ").\nLast tick: " + cursor + "\nLast failure: "
        + outcome.firstFailure().map(step -> step.stepName() + ": " + step.message()).orElse("unknown")
        + "\nNext tick: " + state.cursor();
    NotificationPort.Alert alert =
        new NotificationPort.Alert(alertTemplate.sender(), alertTemplate.recipients(), subject, body);
    try {
      notifier.send(alert);
      metrics.increment("scheduler.alert.sent");
      log.warn("Alert sent after {} failed ticks; failure counter reset", failures.value());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while sending alert", ex);
    } catch (Exception ex) {
      log.error("Unable to send alert after {} failed ticks", failures.value(), ex);
    }
  }
}
