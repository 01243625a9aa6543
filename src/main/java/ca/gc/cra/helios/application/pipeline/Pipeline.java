package ca.gc.cra.helios.application.pipeline;

import ca.gc.cra.helios.domain.locate.LocatorKey;
import ca.gc.cra.helios.domain.pipeline.StepRecord;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Ordered chain of {@link PipelineStep}s run sequentially for one tick.
 * <p><strong>Policy:</strong> Stops at the first step that is skipped for missing input or fails; every later step is
 * recorded as not attempted. Artifacts of successful steps are handed to later steps that reference them.</p>
 * <p><strong>Thread-safety:</strong> Immutable; steps never run concurrently.</p>
 *
 * @since 0.1.0
 */
public final class Pipeline {
  private static final Logger log = LoggerFactory.getLogger(Pipeline.class);

  private final List<PipelineStep> steps;

  /**
   * Creates a pipeline.
   *
   * @param steps steps in execution order
   * @throws IllegalArgumentException if step names repeat, or a step references a step that does not run before it
   *     or declares no output
   */
  public Pipeline(List<PipelineStep> steps) {
    this.steps = List.copyOf(steps);
    Map<String, PipelineStep> seen = new HashMap<>();
    for (PipelineStep step : this.steps) {
      for (String dependency : step.dependencies()) {
        PipelineStep producer = seen.get(dependency);
        if (producer == null) {
          throw new IllegalArgumentException(
              "step " + step.name() + " uses @" + dependency + " which is not an earlier step");
        }
        if (!producer.declaresOutput()) {
          throw new IllegalArgumentException(
              "step " + step.name() + " uses @" + dependency + " which declares no output");
        }
      }
      if (seen.putIfAbsent(step.name(), step) != null) {
        throw new IllegalArgumentException("duplicate step name " + step.name());
      }
    }
  }

  public List<PipelineStep> steps() {
    return steps;
  }

  /**
   * Collects the lookup keys every step needs for a tick.
   *
   * @param tick nominal tick instant
   * @return distinct keys in first-use order
   */
  public List<LocatorKey> inputKeys(Instant tick) {
    Set<LocatorKey> keys = new LinkedHashSet<>();
    for (PipelineStep step : steps) {
      keys.addAll(step.inputKeys(tick));
    }
    return new ArrayList<>(keys);
  }

  /**
   * Runs the chain.
   *
   * @param tick nominal tick instant
   * @param located lookup results for {@link #inputKeys(Instant)}
   * @return one record per step, in order
   * @throws InterruptedException if interrupted while a step runs
   */
  public List<StepRecord> run(Instant tick, Map<LocatorKey, Optional<Path>> located) throws InterruptedException {
    List<StepRecord> records = new ArrayList<>(steps.size());
    Map<String, Path> artifacts = new HashMap<>();
    StepRecord blocker = null;
    for (PipelineStep step : steps) {
      if (blocker != null) {
        records.add(StepRecord.skipped(step.name()));
        continue;
      }
      StepRecord record = step.execute(tick, located, artifacts);
      records.add(record);
      if (record.succeeded()) {
        record.result().flatMap(result -> result.artifact()).ifPresent(path -> artifacts.put(step.name(), path));
      } else {
        blocker = record;
        log.warn("Step {} did not succeed ({}); remaining steps not attempted", step.name(), record.status());
      }
    }
    return records;
  }
}
