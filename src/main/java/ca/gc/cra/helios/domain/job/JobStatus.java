package ca.gc.cra.helios.domain.job;

/**
 * Outcome classification of one external program invocation.
 *
 * @since 0.1.0
 */
public enum JobStatus {
  /** Exit code 0 and the declared artifact, if any, exists. */
  SUCCEEDED,
  /** The program returned a non-zero exit code. */
  NON_ZERO_EXIT,
  /** Exit code 0 but the declared artifact was not produced. */
  MISSING_ARTIFACT,
  /** The program could not be started. */
  LAUNCH_FAILED,
  /** The program exceeded its timeout and was destroyed. */
  TIMED_OUT;

  /**
   * Returns whether this status counts as success.
   *
   * @return {@code true} only for {@link #SUCCEEDED}
   */
  public boolean isSuccess() {
    return this == SUCCEEDED;
  }
}
