package ca.gc.cra.helios.domain.pipeline;

/**
 * Per-step outcome within one tick.
 *
 * @since 0.1.0
 */
public enum StepStatus {
  /** The job ran and produced its declared artifact. */
  SUCCEEDED,
  /** The job ran and failed (exit code, artifact, launch, or timeout). */
  FAILED,
  /** A required input could not be located; the job was not started. */
  SKIPPED_MISSING_INPUT,
  /** An earlier step failed or was skipped, so this step was never considered. */
  NOT_ATTEMPTED
}
