package ca.gc.cra.helios.application.pipeline;

import ca.gc.cra.helios.domain.job.JobResult;
import ca.gc.cra.helios.domain.locate.LocatorKey;
import ca.gc.cra.helios.domain.pipeline.StepRecord;
import ca.gc.cra.helios.domain.pipeline.TickOutcome;
import java.nio.file.Path;
import java.util.Map;
import java.util.TreeMap;

/** Flattens a {@link TickOutcome} into the key/value statistics written by tick reports. */
final class TickSummary {
  private TickSummary() {}

  static Map<String, String> of(TickOutcome outcome) {
    Map<String, String> values = new TreeMap<>();
    values.put("tick", outcome.tick().toString());
    for (Map.Entry<LocatorKey, Path> input : outcome.inputs().entrySet()) {
      LocatorKey key = input.getKey();
      String name = key.channel().isPresent() ? "input." + key.channel().getAsInt() : "input";
      values.put(name, input.getValue().toString());
    }
    for (StepRecord step : outcome.steps()) {
      String prefix = "step." + step.stepName() + ".";
      values.put(prefix + "status", step.status().name());
      if (step.result().isPresent()) {
        JobResult result = step.result().get();
        values.put(prefix + "exitCode", Integer.toString(result.exitCode()));
        values.put(prefix + "durationMillis", Long.toString(result.durationMillis()));
        result.artifact().ifPresent(artifact -> values.put(prefix + "artifact", artifact.toString()));
      }
    }
    return values;
  }
}
