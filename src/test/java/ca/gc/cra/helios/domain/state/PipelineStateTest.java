package ca.gc.cra.helios.domain.state;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class PipelineStateTest {

  @Test
  void counterRisesOnFailureAndFallsOnSuccess() {
    FailureCounter counter = FailureCounter.ZERO.recordFailure().recordFailure().recordSuccess();

    assertEquals(1, counter.value());
    assertEquals(0, counter.recordSuccess().recordSuccess().value());
  }

  @Test
  void counterIsClampedAndSaturates() {
    assertEquals(0, new FailureCounter(-4).value());
    FailureCounter max = new FailureCounter(Integer.MAX_VALUE);
    assertSame(max, max.recordFailure());
  }

  @Test
  void exceedsIsStrict() {
    assertFalse(new FailureCounter(5).exceeds(5));
    assertTrue(new FailureCounter(6).exceeds(5));
    assertEquals(FailureCounter.ZERO, new FailureCounter(6).reset());
  }

  @Test
  void advanceMovesCursorByCadence() {
    PipelineState state = PipelineState.initial(Instant.parse("2024-01-01T00:00:00Z"));

    PipelineState next = state.advance(Duration.ofHours(6)).withFailures(new FailureCounter(2));

    assertEquals(Instant.parse("2024-01-01T06:00:00Z"), next.cursor());
    assertEquals(2, next.failures().value());
    assertEquals(PipelineState.CURRENT_VERSION, next.version());
  }

  @Test
  void nonPositiveCadenceIsRejected() {
    PipelineState state = PipelineState.initial(Instant.EPOCH);

    assertThrows(IllegalArgumentException.class, () -> state.advance(Duration.ZERO));
    assertThrows(IllegalArgumentException.class, () -> state.advance(Duration.ofHours(-1)));
  }
}
