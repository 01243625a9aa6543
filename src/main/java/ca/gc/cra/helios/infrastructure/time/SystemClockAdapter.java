package ca.gc.cra.helios.infrastructure.time;

import ca.gc.cra.helios.application.port.ClockPort;

/**
 * {@link ClockPort} implementation backed by the JVM clock and {@link Thread#sleep(long)}.
 *
 * @since 0.1.0
 */
public final class SystemClockAdapter implements ClockPort {
  /**
   * Creates a system clock adapter.
   */
  public SystemClockAdapter() {}

  @Override
  public long nowMillis() {
    return System.currentTimeMillis();
  }

  /**
   * Sleeps the calling thread.
   *
   * @param millis milliseconds to wait; non-positive values return immediately
   * @throws InterruptedException if interrupted while sleeping
   * @implNote Long waits are split into one-hour slices so that wall-clock adjustments are not compounded.
   */
  @Override
  public void sleepMillis(long millis) throws InterruptedException {
    long remaining = millis;
    long slice = 3_600_000L;
    while (remaining > 0) {
      long step = Math.min(remaining, slice);
      Thread.sleep(step);
      remaining -= step;
    }
  }
}
