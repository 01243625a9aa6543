package ca.gc.cra.helios.application.port;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Port that launches an external program and waits for it.
 * <p><strong>Why:</strong> Keeps process handling out of the job logic so that job outcome classification is testable
 * without spawning processes.</p>
 * <p><strong>Thread-safety:</strong> Implementations must allow concurrent invocations.</p>
 *
 * @since 0.1.0
 * @see ca.gc.cra.helios.infrastructure.process.SystemProcessRunner
 */
public interface ProcessRunnerPort {
  /**
   * Runs a command to completion.
   *
   * @param command executable followed by its arguments; must not be empty
   * @param timeout maximum wall time; {@link Duration#ZERO} means unlimited
   * @return captured outcome
   * @throws IOException if the process cannot be started
   * @throws InterruptedException if the caller is interrupted while waiting; the process is destroyed first
   */
  Outcome run(List<String> command, Duration timeout) throws IOException, InterruptedException;

  /**
   * Captured process outcome.
   *
   * @param exitCode exit code; {@code -1} when the process was killed on timeout
   * @param stdout captured standard output
   * @param stderr captured standard error
   * @param timedOut whether the timeout elapsed before the process exited
   */
  record Outcome(int exitCode, String stdout, String stderr, boolean timedOut) {
    /**
     * Normalizes {@code null} output to empty strings.
     */
    public Outcome {
      stdout = Objects.requireNonNullElse(stdout, "");
      stderr = Objects.requireNonNullElse(stderr, "");
    }
  }
}
