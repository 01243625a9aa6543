package ca.gc.cra.helios.domain.state;

/**
 * Saturating, non-negative count of recent failed ticks.
 *
 * <p>A failed tick adds one, a fully successful tick removes one (floored at zero). The counter only
 * returns to zero on an explicit {@link #reset()}, which the scheduler does after alerting.</p>
 *
 * @param value current count, never negative
 * @since 0.1.0
 */
public record FailureCounter(int value) {
  /** Empty counter. */
  public static final FailureCounter ZERO = new FailureCounter(0);

  /**
   * Clamps negative input to zero.
   */
  public FailureCounter {
    if (value < 0) {
      value = 0;
    }
  }

  /**
   * Records a failed tick.
   *
   * @return incremented counter (saturates at {@link Integer#MAX_VALUE})
   */
  public FailureCounter recordFailure() {
    return value == Integer.MAX_VALUE ? this : new FailureCounter(value + 1);
  }

  /**
   * Records a fully successful tick.
   *
   * @return decremented counter, floored at zero
   */
  public FailureCounter recordSuccess() {
    return new FailureCounter(Math.max(0, value - 1));
  }

  /**
   * Applies a tick result.
   *
   * @param success whether the tick fully succeeded
   * @return adjusted counter
   */
  public FailureCounter record(boolean success) {
    return success ? recordSuccess() : recordFailure();
  }

  /**
   * Returns whether the counter is strictly above a threshold.
   *
   * @param threshold alert threshold
   * @return {@code true} when an alert is due
   */
  public boolean exceeds(int threshold) {
    return value > threshold;
  }

  public FailureCounter reset() {
    return ZERO;
  }
}
