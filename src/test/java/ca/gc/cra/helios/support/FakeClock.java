package ca.gc.cra.helios.support;

import ca.gc.cra.helios.application.port.ClockPort;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/** Clock whose sleeps advance time instantly. */
public final class FakeClock implements ClockPort {
  private long now;
  private final List<Long> sleeps = new ArrayList<>();

  public FakeClock(Instant start) {
    this.now = start.toEpochMilli();
  }

  @Override
  public long nowMillis() {
    return now;
  }

  @Override
  public void sleepMillis(long millis) throws InterruptedException {
    if (Thread.currentThread().isInterrupted()) {
      throw new InterruptedException("fake sleep interrupted");
    }
    sleeps.add(millis);
    now += millis;
  }

  public void advance(long millis) {
    now += millis;
  }

  public Instant now() {
    return Instant.ofEpochMilli(now);
  }

  public List<Long> sleeps() {
    return sleeps;
  }
}
