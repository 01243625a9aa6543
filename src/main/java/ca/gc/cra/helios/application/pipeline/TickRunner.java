package ca.gc.cra.helios.application.pipeline;

import ca.gc.cra.helios.application.locate.FileLocator;
import ca.gc.cra.helios.domain.locate.LocatorKey;
import ca.gc.cra.helios.domain.pipeline.StepRecord;
import ca.gc.cra.helios.domain.pipeline.TickOutcome;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;

/**
 * Resolves a tick's inputs (in parallel on the lookup pool) and runs the pipeline over them.
 *
 * @since 0.1.0
 */
public final class TickRunner {
  private final FileLocator locator;
  private final Pipeline pipeline;
  private final ExecutorService lookupPool;

  /**
   * Creates a runner.
   *
   * @param locator image locator
   * @param pipeline step chain
   * @param lookupPool pool used for parallel lookups; owned by the caller
   */
  public TickRunner(FileLocator locator, Pipeline pipeline, ExecutorService lookupPool) {
    this.locator = Objects.requireNonNull(locator, "locator");
    this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
    this.lookupPool = Objects.requireNonNull(lookupPool, "lookupPool");
  }

  /**
   * Runs one tick.
   *
   * @param tick nominal tick instant
   * @return outcome with the selected inputs and per-step records
   * @throws InterruptedException if interrupted during lookups or while a job runs
   */
  public TickOutcome run(Instant tick) throws InterruptedException {
    List<LocatorKey> keys = pipeline.inputKeys(tick);
    Map<LocatorKey, Optional<Path>> located = locator.locateAll(keys, lookupPool);
    List<StepRecord> records = pipeline.run(tick, located);
    Map<LocatorKey, Path> selected = new LinkedHashMap<>();
    located.forEach((key, path) -> path.ifPresent(p -> selected.put(key, p)));
    return new TickOutcome(tick, selected, records);
  }

  public Pipeline pipeline() {
    return pipeline;
  }

  public FileLocator locator() {
    return locator;
  }
}
