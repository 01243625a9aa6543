package ca.gc.cra.helios.infrastructure.process;

import ca.gc.cra.helios.application.port.ProcessRunnerPort;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link ProcessRunnerPort} backed by {@link ProcessBuilder}.
 * <p><strong>Behaviour:</strong> stdout and stderr are drained on two daemon threads so a chatty program never blocks
 * on a full pipe. On timeout or interruption the process tree is destroyed forcibly before returning.</p>
 * <p><strong>Thread-safety:</strong> Stateless; concurrent invocations are independent.</p>
 *
 * @since 0.1.0
 */
public final class SystemProcessRunner implements ProcessRunnerPort {
  private static final Logger log = LoggerFactory.getLogger(SystemProcessRunner.class);
  private static final long DRAIN_JOIN_MILLIS = 5_000L;

  @Override
  public Outcome run(List<String> command, Duration timeout) throws IOException, InterruptedException {
    Objects.requireNonNull(command, "command");
    if (command.isEmpty()) {
      throw new IllegalArgumentException("command must not be empty");
    }
    Process process = new ProcessBuilder(command).start();
    process.getOutputStream().close();
    StreamDrain stdout = StreamDrain.start(process.getInputStream(), "helios-stdout-" + process.pid());
    StreamDrain stderr = StreamDrain.start(process.getErrorStream(), "helios-stderr-" + process.pid());

    boolean timedOut = false;
    try {
      if (timeout == null || timeout.isZero()) {
        process.waitFor();
      } else if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
        timedOut = true;
        log.warn("Process {} exceeded timeout {}; destroying", command.get(0), timeout);
        destroy(process);
      }
    } catch (InterruptedException ex) {
      log.warn("Interrupted while waiting for {}; destroying process", command.get(0));
      destroy(process);
      throw ex;
    }
    int exitCode = timedOut ? -1 : process.exitValue();
    return new Outcome(exitCode, stdout.await(), stderr.await(), timedOut);
  }

  private static void destroy(Process process) {
    process.descendants().forEach(ProcessHandle::destroyForcibly);
    process.destroyForcibly();
    try {
      if (!process.waitFor(DRAIN_JOIN_MILLIS, TimeUnit.MILLISECONDS)) {
        log.warn("Process {} did not exit after being destroyed", process.pid());
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    }
  }

  private static final class StreamDrain {
    private final Thread thread;
    private final AtomicReference<String> text = new AtomicReference<>("");
    private final AtomicReference<IOException> failure = new AtomicReference<>();

    private StreamDrain(InputStream in, String name) {
      this.thread = new Thread(() -> {
        try (InputStream stream = in) {
          text.set(new String(stream.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException ex) {
          failure.set(ex);
        }
      }, name);
      this.thread.setDaemon(true);
    }

    static StreamDrain start(InputStream in, String name) {
      StreamDrain drain = new StreamDrain(in, name);
      drain.thread.start();
      return drain;
    }

    String await() throws InterruptedException {
      thread.join(DRAIN_JOIN_MILLIS);
      IOException ex = failure.get();
      if (ex != null) {
        log.debug("Output stream closed early", ex);
      }
      return text.get();
    }
  }
}
