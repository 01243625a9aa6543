package ca.gc.cra.helios.application.pipeline;

import ca.gc.cra.helios.application.port.MetricsPort;
import ca.gc.cra.helios.application.port.TickReportPort;
import ca.gc.cra.helios.domain.pipeline.StepRecord;
import ca.gc.cra.helios.domain.pipeline.TickOutcome;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Reprocesses a historical range of ticks back to back.
 *
 * <p>No waiting, no persisted state, and no alerts: the operator sees the result directly. Tick reports are written
 * for successful ticks just as in the scheduler.</p>
 *
 * @since 0.1.0
 */
public final class BackfillUseCase {
  private static final Logger log = LoggerFactory.getLogger(BackfillUseCase.class);

  private final TickRunner runner;
  private final TickReportPort reporter;
  private final MetricsPort metrics;

  public BackfillUseCase(TickRunner runner, TickReportPort reporter, MetricsPort metrics) {
    this.runner = Objects.requireNonNull(runner, "runner");
    this.reporter = reporter == null ? TickReportPort.NONE : reporter;
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /**
   * Runs every tick in {@code [start, end)}.
   *
   * @param start first tick
   * @param end exclusive upper bound
   * @param cadence tick interval; positive
   * @return per-tick outcomes
   * @throws InterruptedException if interrupted; ticks already run are kept in the log only
   * @throws IllegalArgumentException if the cadence is not positive or {@code end} precedes {@code start}
   */
  public Result run(Instant start, Instant end, Duration cadence) throws InterruptedException {
    Objects.requireNonNull(start, "start");
    Objects.requireNonNull(end, "end");
    if (cadence == null || cadence.isZero() || cadence.isNegative()) {
      throw new IllegalArgumentException("cadence must be positive");
    }
    if (end.isBefore(start)) {
      throw new IllegalArgumentException("end " + end + " is before start " + start);
    }
    List<TickOutcome> outcomes = new ArrayList<>();
    for (Instant tick = start; tick.isBefore(end); tick = tick.plus(cadence)) {
      MDC.put(SchedulerUseCase.MDC_TICK, tick.toString());
      try {
        TickOutcome outcome = runTick(tick);
        outcomes.add(outcome);
        if (outcome.success()) {
          metrics.increment("scheduler.tick.succeeded");
          writeReport(outcome);
        } else {
          metrics.increment("scheduler.tick.failed");
          log.warn("Backfill tick {} failed: {}", tick,
              outcome.firstFailure().map(StepRecord::message).orElse("unknown failure"));
        }
      } finally {
        MDC.remove(SchedulerUseCase.MDC_TICK);
      }
    }
    Result result = new Result(outcomes);
    log.info("Backfill finished: {} tick(s), {} failed", outcomes.size(), result.failedCount());
    return result;
  }

  private TickOutcome runTick(Instant tick) throws InterruptedException {
    try {
      return runner.run(tick);
    } catch (RuntimeException ex) {
      log.error("Backfill tick {} aborted by unexpected error", tick, ex);
      return new TickOutcome(tick, Map.of(), List.of(StepRecord.failed("tick", String.valueOf(ex.getMessage()))));
    }
  }

  private void writeReport(TickOutcome outcome) {
    try {
      reporter.write(outcome.tick(), TickSummary.of(outcome));
    } catch (IOException ex) {
      log.warn("Unable to write report for tick {}", outcome.tick(), ex);
    }
  }

  /**
   * Backfill outcome.
   *
   * @param outcomes per-tick outcomes in tick order
   */
  public record Result(List<TickOutcome> outcomes) {
    public Result {
      outcomes = List.copyOf(outcomes);
    }

    public long failedCount() {
      return outcomes.stream().filter(outcome -> !outcome.success()).count();
    }

    public boolean allSucceeded() {
      return failedCount() == 0;
    }
  }
}
