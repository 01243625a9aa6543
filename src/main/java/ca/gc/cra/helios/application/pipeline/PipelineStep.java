package ca.gc.cra.helios.application.pipeline;

import ca.gc.cra.helios.application.job.ExternalJob;
import ca.gc.cra.helios.domain.job.JobResult;
import ca.gc.cra.helios.domain.locate.LocatorKey;
import ca.gc.cra.helios.domain.locate.PathTemplate;
import ca.gc.cra.helios.domain.pipeline.StepRecord;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> One named pipeline stage: the images it needs, the artifacts of earlier stages it consumes,
 * and the artifact it promises to produce.
 * <p><strong>Arguments:</strong> positional arguments are built from tokens, in order:</p>
 * <ul>
 *   <li>{@value #IMAGES_TOKEN} expands to the located images, in channel order;</li>
 *   <li>{@code @name} expands to the artifact produced earlier in the same tick by step {@code name};</li>
 *   <li>any other token is passed verbatim.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable; executed only by the scheduler thread.</p>
 *
 * @since 0.1.0
 */
public final class PipelineStep {
  /** Argument token standing for the located input images. */
  public static final String IMAGES_TOKEN = "images";

  private static final Logger log = LoggerFactory.getLogger(PipelineStep.class);

  private final String name;
  private final ExternalJob job;
  private final List<Integer> channels;
  private final List<String> arguments;
  private final PathTemplate output;
  private final boolean allowPartialInputs;

  /**
   * Creates a step.
   *
   * @param name unique step name
   * @param job job run by this step
   * @param channels channels to locate; empty means one lookup without a channel
   * @param arguments positional argument tokens
   * @param output declared artifact template, or {@code null} when the step declares none
   * @param allowPartialInputs run with whichever images were found instead of requiring all of them
   * @throws IllegalArgumentException if the output template references a channel
   */
  public PipelineStep(
      String name,
      ExternalJob job,
      List<Integer> channels,
      List<String> arguments,
      PathTemplate output,
      boolean allowPartialInputs) {
    this.name = Objects.requireNonNull(name, "name");
    this.job = Objects.requireNonNull(job, "job");
    this.channels = List.copyOf(channels);
    this.arguments = List.copyOf(arguments);
    if (output != null && output.usesChannel()) {
      throw new IllegalArgumentException("output of step " + name + " must not depend on a channel");
    }
    this.output = output;
    this.allowPartialInputs = allowPartialInputs;
  }

  public String name() {
    return name;
  }

  public ExternalJob job() {
    return job;
  }

  public List<String> arguments() {
    return arguments;
  }

  /**
   * Returns whether the step consumes located images.
   *
   * @return {@code true} if an {@value #IMAGES_TOKEN} argument is present
   */
  public boolean needsImages() {
    return arguments.contains(IMAGES_TOKEN);
  }

  /**
   * Names of earlier steps whose artifacts this step consumes.
   *
   * @return referenced step names, in argument order
   */
  public List<String> dependencies() {
    List<String> names = new ArrayList<>();
    for (String token : arguments) {
      if (token.startsWith("@") && token.length() > 1) {
        names.add(token.substring(1));
      }
    }
    return names;
  }

  /**
   * Lookup keys required for a tick.
   *
   * @param tick nominal tick instant
   * @return keys in channel order; empty when the step needs no images
   */
  public List<LocatorKey> inputKeys(Instant tick) {
    if (!needsImages()) {
      return List.of();
    }
    if (channels.isEmpty()) {
      return List.of(LocatorKey.of(tick));
    }
    List<LocatorKey> keys = new ArrayList<>(channels.size());
    for (int channel : channels) {
      keys.add(new LocatorKey(tick, OptionalInt.of(channel)));
    }
    return keys;
  }

  /**
   * Returns whether the step declares an output artifact.
   *
   * @return {@code true} if an output template was given
   */
  public boolean declaresOutput() {
    return output != null;
  }

  /**
   * Expands the declared artifact path for a tick.
   *
   * @param tick nominal tick instant
   * @return artifact path, or empty when the step declares none
   */
  public Optional<Path> artifactFor(Instant tick) {
    return output == null ? Optional.empty() : Optional.of(Path.of(output.expand(LocatorKey.of(tick))));
  }

  /**
   * Runs the step for a tick.
   *
   * @param tick nominal tick instant
   * @param located lookup results for at least this step's {@link #inputKeys(Instant)}
   * @param artifacts artifacts produced by earlier steps in this tick, by step name
   * @return step record; never {@code null}
   * @throws InterruptedException if interrupted while the job runs
   */
  StepRecord execute(Instant tick, Map<LocatorKey, Optional<Path>> located, Map<String, Path> artifacts)
      throws InterruptedException {
    List<Path> images = new ArrayList<>();
    List<LocatorKey> missing = new ArrayList<>();
    for (LocatorKey key : inputKeys(tick)) {
      Optional<Path> path = located.getOrDefault(key, Optional.empty());
      if (path.isPresent()) {
        images.add(path.get());
      } else {
        missing.add(key);
      }
    }
    if (!missing.isEmpty() && (!allowPartialInputs || images.isEmpty())) {
      log.warn("Skipping step {}: no good quality file for {}", name, missing);
      return StepRecord.missingInputs(name, missing);
    }
    if (!missing.isEmpty()) {
      log.warn("Step {} running with partial inputs; missing {}", name, missing);
    }

    List<String> positional = new ArrayList<>();
    for (String token : arguments) {
      if (token.equals(IMAGES_TOKEN)) {
        images.forEach(image -> positional.add(image.toString()));
      } else if (token.startsWith("@") && token.length() > 1) {
        Path artifact = artifacts.get(token.substring(1));
        if (artifact == null) {
          return StepRecord.failed(name, "no artifact from step " + token.substring(1));
        }
        positional.add(artifact.toString());
      } else {
        positional.add(token);
      }
    }

    Optional<Path> artifact = artifactFor(tick);
    if (artifact.isPresent()) {
      Path parent = artifact.get().toAbsolutePath().getParent();
      try {
        if (parent != null) {
          Files.createDirectories(parent);
        }
      } catch (IOException ex) {
        log.error("Step {} cannot create output directory {}", name, parent, ex);
        return StepRecord.failed(name, "cannot create output directory " + parent + ": " + ex.getMessage());
      }
    }

    JobResult result = job.run(positional, Map.of(), artifact);
    return StepRecord.ran(name, result);
  }

  /**
   * Checks the step's program and configuration files, returning a warning per problem found.
   *
   * @return human-readable warnings; empty when everything looks right
   */
  public List<String> sanityWarnings() {
    List<String> warnings = new ArrayList<>();
    String executable = job.spec().executable();
    if (!Executables.isRunnable(executable)) {
      warnings.add("executable " + executable + " of step " + name + " is missing or not executable, could be wrong");
    }
    for (Map.Entry<String, String> option : job.spec().options().entrySet()) {
      if (option.getKey().toLowerCase(Locale.ROOT).contains("config")
          && !option.getValue().isEmpty()
          && !Files.isRegularFile(Path.of(option.getValue()))) {
        warnings.add("option " + option.getKey() + " of step " + name + " points to missing file "
            + option.getValue() + ", could be wrong");
      }
    }
    return warnings;
  }

  @Override
  public String toString() {
    return "PipelineStep[" + name + "]";
  }
}
