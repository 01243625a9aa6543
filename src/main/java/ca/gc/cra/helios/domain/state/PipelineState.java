package ca.gc.cra.helios.domain.state;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Versioned, durable scheduler progress: the cadence cursor and the failure counter.
 *
 * @param version record format version
 * @param cursor nominal instant of the next tick to process
 * @param failures failure counter at the time of persisting
 * @since 0.1.0
 */
public record PipelineState(int version, Instant cursor, FailureCounter failures) {
  /** Format version written by this build. */
  public static final int CURRENT_VERSION = 1;

  /**
   * Validates components.
   *
   * @throws NullPointerException if a component is {@code null}
   * @throws IllegalArgumentException if the version is not positive
   */
  public PipelineState {
    if (version <= 0) {
      throw new IllegalArgumentException("version must be positive (was " + version + ")");
    }
    Objects.requireNonNull(cursor, "cursor");
    Objects.requireNonNull(failures, "failures");
  }

  /**
   * Creates a current-version state.
   *
   * @param cursor cursor
   * @param failures failure counter
   * @return state
   */
  public static PipelineState of(Instant cursor, FailureCounter failures) {
    return new PipelineState(CURRENT_VERSION, cursor, failures);
  }

  /**
   * Creates the initial state used when nothing was persisted.
   *
   * @param start configured first cursor
   * @return state with a zero failure counter
   */
  public static PipelineState initial(Instant start) {
    return of(start, FailureCounter.ZERO);
  }

  /**
   * Advances the cursor by one cadence interval.
   *
   * @param cadence cadence interval; must be positive
   * @return advanced state
   */
  public PipelineState advance(Duration cadence) {
    if (cadence.isZero() || cadence.isNegative()) {
      throw new IllegalArgumentException("cadence must be positive");
    }
    return new PipelineState(CURRENT_VERSION, cursor.plus(cadence), failures);
  }

  /**
   * Replaces the failure counter.
   *
   * @param counter new counter
   * @return updated state
   */
  public PipelineState withFailures(FailureCounter counter) {
    return new PipelineState(CURRENT_VERSION, cursor, counter);
  }
}
