package ca.gc.cra.helios.domain.pipeline;

import ca.gc.cra.helios.domain.locate.LocatorKey;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of running the pipeline for one tick.
 *
 * <p>A tick succeeds only when every step ran and produced its declared artifact.</p>
 *
 * @param tick nominal tick instant (the cursor value)
 * @param inputs selected file per lookup key; keys without a good file are absent
 * @param steps per-step records in pipeline order
 * @since 0.1.0
 */
public record TickOutcome(Instant tick, Map<LocatorKey, Path> inputs, List<StepRecord> steps) {

  /**
   * Validates and freezes components.
   *
   * @throws NullPointerException if a component is {@code null}
   */
  public TickOutcome {
    Objects.requireNonNull(tick, "tick");
    inputs = Collections.unmodifiableMap(new LinkedHashMap<>(inputs));
    steps = List.copyOf(steps);
  }

  /**
   * Returns whether every step succeeded.
   *
   * @return {@code true} for a fully successful tick; an empty pipeline counts as success
   */
  public boolean success() {
    return steps.stream().allMatch(StepRecord::succeeded);
  }

  /**
   * Returns the first step that did not succeed.
   *
   * @return failing or skipped step, if any
   */
  public Optional<StepRecord> firstFailure() {
    return steps.stream().filter(step -> !step.succeeded()).findFirst();
  }

  /**
   * Looks up the record for a step.
   *
   * @param stepName step name
   * @return the record, if the pipeline contains that step
   */
  public Optional<StepRecord> step(String stepName) {
    return steps.stream().filter(step -> step.stepName().equals(stepName)).findFirst();
  }
}
