package ca.gc.cra.helios.config;

import ca.gc.cra.helios.application.pipeline.PipelineStep;
import ca.gc.cra.helios.domain.job.JobSpec;
import ca.gc.cra.helios.validation.Numbers;
import ca.gc.cra.helios.validation.Strings;
import ca.gc.cra.helios.validation.Times;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Settings of one pipeline step, read from the {@code step.<name>.*} keys.
 *
 * @param name step name
 * @param executable program to run
 * @param options default {@code flag -> value} options
 * @param flagPrefix prefix placed before each option name
 * @param channels channels whose images the step consumes
 * @param arguments positional argument tokens
 * @param output declared artifact template, if any
 * @param outputFlag option carrying the artifact path on each call
 * @param allowPartialInputs whether to run with a subset of images
 * @param timeout per-invocation timeout, zero for none
 * @since 0.1.0
 */
public record StepConfig(
    String name,
    String executable,
    Map<String, String> options,
    String flagPrefix,
    List<Integer> channels,
    List<String> arguments,
    Optional<String> output,
    String outputFlag,
    boolean allowPartialInputs,
    Duration timeout) {
  private static final Pattern NAME_PATTERN = Pattern.compile("^[A-Za-z0-9_-]+$");

  public StepConfig {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(executable, "executable");
    options = Collections.unmodifiableMap(new TreeMap<>(options));
    channels = List.copyOf(channels);
    arguments = List.copyOf(arguments);
    Objects.requireNonNull(output, "output");
    Objects.requireNonNull(flagPrefix, "flagPrefix");
    Objects.requireNonNull(outputFlag, "outputFlag");
    Objects.requireNonNull(timeout, "timeout");
  }

  /**
   * Reads all steps listed under {@code steps}, in order.
   *
   * @param map effective configuration
   * @return step settings
   * @throws IllegalArgumentException if a step is malformed or listed twice
   */
  public static List<StepConfig> listFromMap(Map<String, String> map) {
    List<String> names = Strings.splitList(map.get("steps"));
    List<StepConfig> steps = new ArrayList<>(names.size());
    for (String name : names) {
      if (steps.stream().anyMatch(step -> step.name().equals(name))) {
        throw new IllegalArgumentException("step " + name + " is listed twice in steps");
      }
      steps.add(fromMap(name, map));
    }
    return steps;
  }

  /**
   * Reads one step.
   *
   * @param name step name
   * @param map effective configuration
   * @return step settings
   * @throws IllegalArgumentException if the name is invalid, the executable is missing, or a value is malformed
   */
  public static StepConfig fromMap(String name, Map<String, String> map) {
    if (!NAME_PATTERN.matcher(name).matches()) {
      throw new IllegalArgumentException("step name must match [A-Za-z0-9_-]+ (was " + name + ")");
    }
    String prefix = "step." + name + ".";
    String optionPrefix = prefix + "options.";
    Map<String, String> options = new TreeMap<>();
    for (Map.Entry<String, String> entry : map.entrySet()) {
      if (entry.getKey().startsWith(optionPrefix) && entry.getKey().length() > optionPrefix.length()) {
        options.put(entry.getKey().substring(optionPrefix.length()), Strings.trimToEmpty(entry.getValue()));
      }
    }
    List<Integer> channels = new ArrayList<>();
    for (String token : Strings.splitList(map.get(prefix + "channels"))) {
      channels.add(Numbers.parseInt(prefix + "channels", token, 0, Integer.MAX_VALUE));
    }
    List<String> arguments = map.containsKey(prefix + "arguments")
        ? Strings.splitList(map.get(prefix + "arguments"))
        : List.of(PipelineStep.IMAGES_TOKEN);
    String output = Strings.trimToEmpty(map.get(prefix + "output"));
    String flagPrefix = map.containsKey(prefix + "flagPrefix")
        ? Strings.trimToEmpty(map.get(prefix + "flagPrefix"))
        : JobSpec.DEFAULT_FLAG_PREFIX;
    return new StepConfig(
        name,
        Strings.requireNonBlank(prefix + "executable", map.get(prefix + "executable")),
        options,
        flagPrefix,
        channels,
        arguments,
        output.isEmpty() ? Optional.empty() : Optional.of(output),
        map.containsKey(prefix + "outputFlag") ? Strings.trimToEmpty(map.get(prefix + "outputFlag")) : "output",
        Boolean.parseBoolean(Strings.trimToEmpty(map.get(prefix + "allowPartialInputs"))),
        Times.parseDuration(prefix + "timeout", map.getOrDefault(prefix + "timeout", "PT0S"), true));
  }

  /**
   * Returns whether the step consumes located images.
   *
   * @return {@code true} if an {@code images} argument is present
   */
  public boolean needsImages() {
    return arguments.contains(PipelineStep.IMAGES_TOKEN);
  }

  /**
   * Builds the immutable job description for this step.
   *
   * @return job spec
   */
  public JobSpec jobSpec() {
    return new JobSpec(name, executable, options, flagPrefix, timeout);
  }
}
