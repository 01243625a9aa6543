package ca.gc.cra.helios.domain.job;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Structured result of one external program invocation.
 *
 * @param jobName logical job name
 * @param command argument vector that was executed
 * @param exitCode process exit code; {@code -1} when the process never completed
 * @param stdout captured standard output
 * @param stderr captured standard error
 * @param artifact declared output artifact, if the invocation declared one
 * @param status outcome classification
 * @param message human-readable summary naming the failed check
 * @param durationMillis wall-clock duration
 * @since 0.1.0
 */
public record JobResult(
    String jobName,
    List<String> command,
    int exitCode,
    String stdout,
    String stderr,
    Optional<Path> artifact,
    JobStatus status,
    String message,
    long durationMillis) {

  /**
   * Validates components and freezes the command list.
   *
   * @throws NullPointerException if a component is {@code null}
   */
  public JobResult {
    Objects.requireNonNull(jobName, "jobName");
    command = List.copyOf(command);
    stdout = stdout == null ? "" : stdout;
    stderr = stderr == null ? "" : stderr;
    Objects.requireNonNull(artifact, "artifact");
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(message, "message");
  }

  /**
   * Returns whether the invocation succeeded.
   *
   * @return {@code true} on exit code 0 with the declared artifact present
   */
  public boolean success() {
    return status.isSuccess();
  }

  /**
   * Returns the executable name (first element of the command line).
   *
   * @return executable, or the job name when the command is empty
   */
  public String executable() {
    return command.isEmpty() ? jobName : command.get(0);
  }

  /**
   * Renders the command line for logs.
   *
   * @return space-joined command
   */
  public String commandLine() {
    return String.join(" ", command);
  }
}
