package ca.gc.cra.helios.application.job;

import ca.gc.cra.helios.application.port.ClockPort;
import ca.gc.cra.helios.application.port.MetricsPort;
import ca.gc.cra.helios.application.port.ProcessRunnerPort;
import ca.gc.cra.helios.domain.job.JobResult;
import ca.gc.cra.helios.domain.job.JobSpec;
import ca.gc.cra.helios.domain.job.JobStatus;
import ca.gc.cra.helios.logging.Logs;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Runs one external program described by a {@link JobSpec} and classifies its outcome.
 * <p><strong>Why:</strong> A job only counts as successful when the program exits with zero <em>and</em> leaves its
 * declared artifact on disk; segmentation programs are known to exit cleanly without writing anything.</p>
 * <p><strong>Role:</strong> Application service invoked by pipeline steps.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from its collaborators; safe for concurrent use.</p>
 * <p><strong>Observability:</strong> Emits {@code job.succeeded}, {@code job.failed}, and
 * {@code job.durationMillis}. Program output is logged truncated to {@link Logs#OUTPUT_BUDGET_BYTES}.</p>
 *
 * @implNote A job is never retried; the scheduler decides what a failure means.
 * @since 0.1.0
 */
public final class ExternalJob {
  private static final Logger log = LoggerFactory.getLogger(ExternalJob.class);

  private final JobSpec spec;
  private final String outputFlag;
  private final ProcessRunnerPort runner;
  private final ClockPort clock;
  private final MetricsPort metrics;

  /**
   * Creates a job runner.
   *
   * @param spec program, default options, and timeout
   * @param outputFlag option name carrying the artifact path on each call; blank to not pass it
   * @param runner process runner
   * @param clock clock used for duration measurement
   * @param metrics metrics sink
   */
  public ExternalJob(
      JobSpec spec, String outputFlag, ProcessRunnerPort runner, ClockPort clock, MetricsPort metrics) {
    this.spec = Objects.requireNonNull(spec, "spec");
    this.outputFlag = outputFlag == null ? "" : outputFlag.trim();
    this.runner = Objects.requireNonNull(runner, "runner");
    this.clock = clock == null ? ClockPort.SYSTEM : clock;
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /**
   * Runs the program once.
   *
   * @param positional positional arguments appended after the options
   * @param callOptions per-call options overriding the spec defaults
   * @param expectedArtifact file the program must produce; empty when the job declares no artifact
   * @return classified result; never {@code null}
   * @throws InterruptedException if interrupted while the program runs; the program is destroyed
   */
  public JobResult run(List<String> positional, Map<String, String> callOptions, Optional<Path> expectedArtifact)
      throws InterruptedException {
    Objects.requireNonNull(expectedArtifact, "expectedArtifact");
    Map<String, String> options = new LinkedHashMap<>();
    if (callOptions != null) {
      options.putAll(callOptions);
    }
    if (!outputFlag.isEmpty() && expectedArtifact.isPresent()) {
      options.put(outputFlag, expectedArtifact.get().toString());
    }
    List<String> command = spec.commandLine(positional, options);
    log.info("Running job {}: {}", spec.name(), String.join(" ", command));

    long started = clock.nowMillis();
    JobResult result;
    try {
      ProcessRunnerPort.Outcome outcome = runner.run(command, spec.timeout());
      long elapsed = clock.nowMillis() - started;
      result = classify(command, outcome, expectedArtifact, elapsed);
    } catch (IOException ex) {
      long elapsed = clock.nowMillis() - started;
      result = new JobResult(
          spec.name(), command, -1, "", "", Optional.empty(), JobStatus.LAUNCH_FAILED,
          "failed to start " + spec.executable() + ": " + ex.getMessage(), elapsed);
    }
    record(result);
    return result;
  }

  /**
   * Returns the spec this job runs.
   *
   * @return job spec
   */
  public JobSpec spec() {
    return spec;
  }

  private JobResult classify(
      List<String> command, ProcessRunnerPort.Outcome outcome, Optional<Path> expected, long elapsed) {
    JobStatus status;
    String message;
    Optional<Path> artifact = Optional.empty();
    if (outcome.timedOut()) {
      status = JobStatus.TIMED_OUT;
      message = "timed out after " + spec.timeout();
    } else if (outcome.exitCode() != 0) {
      status = JobStatus.NON_ZERO_EXIT;
      message = "exited with code " + outcome.exitCode();
    } else if (expected.isPresent() && !Files.exists(expected.get())) {
      status = JobStatus.MISSING_ARTIFACT;
      message = "exited cleanly but did not create " + expected.get();
    } else {
      status = JobStatus.SUCCEEDED;
      message = "ok";
      artifact = expected;
    }
    return new JobResult(
        spec.name(), command, outcome.exitCode(), outcome.stdout(), outcome.stderr(), artifact, status, message,
        elapsed);
  }

  private void record(JobResult result) {
    metrics.observe("job.durationMillis", result.durationMillis());
    if (result.success()) {
      metrics.increment("job.succeeded");
      log.info("Job {} succeeded in {} ms", result.jobName(), result.durationMillis());
      if (!result.stdout().isBlank()) {
        log.debug("Job {} stdout: {}", result.jobName(), Logs.output(result.stdout()));
      }
      return;
    }
    metrics.increment("job.failed");
    log.error("Job {} failed ({}): {}\ncommand: {}\nstdout: {}\nstderr: {}",
        result.jobName(),
        result.status(),
        result.message(),
        result.commandLine(),
        Logs.output(result.stdout()),
        Logs.output(result.stderr()));
  }
}
