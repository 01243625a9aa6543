package ca.gc.cra.helios.application.port;

/**
 * <strong>What:</strong> Port supplying wall-clock time and blocking waits to the scheduler.
 * <p><strong>Why:</strong> The scheduler waits for data to age before each tick; tests substitute a clock that
 * advances instantly instead of sleeping.</p>
 * <p><strong>Role:</strong> Port consumed by application use cases.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe.</p>
 *
 * @implNote Default implementation delegates to {@link System#currentTimeMillis()} and {@link Thread#sleep(long)}.
 * @since 0.1.0
 * @see ca.gc.cra.helios.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z
   */
  long nowMillis();

  /**
   * Blocks the calling thread for the given duration.
   *
   * @param millis milliseconds to wait; values {@code <= 0} return immediately
   * @throws InterruptedException if the waiting thread is interrupted
   */
  void sleepMillis(long millis) throws InterruptedException;

  /**
   * Default {@link ClockPort} backed by the JVM clock.
   */
  ClockPort SYSTEM = new ClockPort() {
    @Override
    public long nowMillis() {
      return System.currentTimeMillis();
    }

    @Override
    public void sleepMillis(long millis) throws InterruptedException {
      if (millis > 0) {
        Thread.sleep(millis);
      }
    }
  };
}
