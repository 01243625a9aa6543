package ca.gc.cra.helios.infrastructure.time;

import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class SystemClockAdapterTest {
  private final SystemClockAdapter clock = new SystemClockAdapter();

  @Test
  void sleepsAtLeastRequestedTime() throws InterruptedException {
    long before = clock.nowMillis();

    clock.sleepMillis(50);

    assertTrue(clock.nowMillis() - before >= 45);
  }

  @Test
  void nonPositiveSleepReturnsImmediately() throws InterruptedException {
    Thread.currentThread().interrupt();
    try {
      clock.sleepMillis(0);
    } finally {
      assertTrue(Thread.interrupted());
    }
  }

  @Test
  void interruptAbortsSleep() {
    Thread.currentThread().interrupt();

    assertThrows(InterruptedException.class, () -> clock.sleepMillis(10_000));
  }
}
