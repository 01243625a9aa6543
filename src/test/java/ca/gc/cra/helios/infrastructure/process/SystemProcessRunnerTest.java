package ca.gc.cra.helios.infrastructure.process;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.helios.application.port.ProcessRunnerPort.Outcome;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;

@DisabledOnOs(OS.WINDOWS)
class SystemProcessRunnerTest {
  private final SystemProcessRunner runner = new SystemProcessRunner();

  @Test
  void capturesExitCodeAndBothStreams() throws Exception {
    Outcome outcome = runner.run(
        List.of("/bin/sh", "-c", "echo processed; echo 'bad header' 1>&2; exit 3"), Duration.ZERO);

    assertEquals(3, outcome.exitCode());
    assertEquals("processed\n", outcome.stdout());
    assertEquals("bad header\n", outcome.stderr());
    assertFalse(outcome.timedOut());
  }

  @Test
  void killsProcessThatOutlivesTimeout() throws Exception {
    long started = System.nanoTime();

    Outcome outcome = runner.run(List.of("/bin/sh", "-c", "sleep 30"), Duration.ofMillis(200));

    assertTrue(outcome.timedOut());
    assertEquals(-1, outcome.exitCode());
    assertTrue(Duration.ofNanos(System.nanoTime() - started).compareTo(Duration.ofSeconds(20)) < 0);
  }

  @Test
  void missingExecutableFailsToStart() {
    assertThrows(IOException.class,
        () -> runner.run(List.of("/nonexistent/helios-step-binary"), Duration.ZERO));
  }

  @Test
  void emptyCommandIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> runner.run(List.of(), Duration.ZERO));
  }
}
