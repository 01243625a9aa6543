package ca.gc.cra.helios.domain.pipeline;

import ca.gc.cra.helios.domain.job.JobResult;
import ca.gc.cra.helios.domain.locate.LocatorKey;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Diagnostic record of a single pipeline step for one tick.
 *
 * @param stepName step name
 * @param status step outcome
 * @param result job result when the job was started
 * @param missingInputs inputs that could not be located
 * @param message short human-readable summary
 * @since 0.1.0
 */
public record StepRecord(
    String stepName,
    StepStatus status,
    Optional<JobResult> result,
    List<LocatorKey> missingInputs,
    String message) {

  /**
   * Validates components.
   *
   * @throws NullPointerException if a component is {@code null}
   */
  public StepRecord {
    Objects.requireNonNull(stepName, "stepName");
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(result, "result");
    missingInputs = List.copyOf(missingInputs);
    Objects.requireNonNull(message, "message");
  }

  /**
   * Creates a record for a step that ran.
   *
   * @param stepName step name
   * @param result job result
   * @return record with {@link StepStatus#SUCCEEDED} or {@link StepStatus#FAILED}
   */
  public static StepRecord ran(String stepName, JobResult result) {
    StepStatus status = result.success() ? StepStatus.SUCCEEDED : StepStatus.FAILED;
    return new StepRecord(stepName, status, Optional.of(result), List.of(), result.message());
  }

  /**
   * Creates a record for a step skipped because inputs were missing.
   *
   * @param stepName step name
   * @param missing keys that resolved to no file
   * @return skipped record
   */
  public static StepRecord missingInputs(String stepName, List<LocatorKey> missing) {
    return new StepRecord(
        stepName,
        StepStatus.SKIPPED_MISSING_INPUT,
        Optional.empty(),
        missing,
        "missing inputs " + missing);
  }

  /**
   * Creates a record for a step never considered because an earlier step did not succeed.
   *
   * @param stepName step name
   * @return not-attempted record
   */
  public static StepRecord skipped(String stepName) {
    return new StepRecord(stepName, StepStatus.NOT_ATTEMPTED, Optional.empty(), List.of(), "not attempted");
  }

  /**
   * Creates a record for a step that could not be prepared (for example, its output directory could not be made).
   *
   * @param stepName step name
   * @param message failure description
   * @return failed record without a job result
   */
  public static StepRecord failed(String stepName, String message) {
    return new StepRecord(stepName, StepStatus.FAILED, Optional.empty(), List.of(), message);
  }

  public boolean succeeded() {
    return status == StepStatus.SUCCEEDED;
  }
}
