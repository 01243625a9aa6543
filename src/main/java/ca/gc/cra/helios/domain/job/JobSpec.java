package ca.gc.cra.helios.domain.job;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * <strong>What:</strong> Immutable description of an external program invocation.
 * <p><strong>Why:</strong> One spec is reused for every tick; only positional arguments and per-call
 * options (such as the output path) change between invocations.</p>
 * <p><strong>Argument order:</strong> executable, then one {@code flag value} pair per non-empty option
 * sorted by option name, then the positional arguments in caller order.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @since 0.1.0
 */
public final class JobSpec {
  /** Prefix prepended to option names when building the command line. */
  public static final String DEFAULT_FLAG_PREFIX = "--";

  private final String name;
  private final String executable;
  private final Map<String, String> options;
  private final String flagPrefix;
  private final Duration timeout;

  /**
   * Creates a job spec.
   *
   * @param name logical job name used in logs and results; must not be blank
   * @param executable program path; must not be blank
   * @param options optional named parameters; blank values are kept but never emitted
   * @param flagPrefix text prepended to option names; {@code null} uses {@link #DEFAULT_FLAG_PREFIX}
   * @param timeout maximum run time; zero or {@code null} means unlimited
   * @throws IllegalArgumentException if a required value is blank or the timeout is negative
   */
  public JobSpec(
      String name, String executable, Map<String, String> options, String flagPrefix, Duration timeout) {
    this.name = requireText(name, "name");
    this.executable = requireText(executable, "executable");
    TreeMap<String, String> sorted = new TreeMap<>();
    if (options != null) {
      for (Map.Entry<String, String> entry : options.entrySet()) {
        String key = requireText(entry.getKey(), "option name");
        sorted.put(key, entry.getValue() == null ? "" : entry.getValue());
      }
    }
    this.options = Collections.unmodifiableMap(sorted);
    this.flagPrefix = flagPrefix == null ? DEFAULT_FLAG_PREFIX : flagPrefix;
    Duration effective = timeout == null ? Duration.ZERO : timeout;
    if (effective.isNegative()) {
      throw new IllegalArgumentException("timeout must not be negative");
    }
    this.timeout = effective;
  }

  /**
   * Creates a job spec with the default flag prefix and no timeout.
   *
   * @param name logical job name
   * @param executable program path
   * @param options optional named parameters
   */
  public JobSpec(String name, String executable, Map<String, String> options) {
    this(name, executable, options, DEFAULT_FLAG_PREFIX, Duration.ZERO);
  }

  /**
   * Builds the argument vector for one invocation.
   *
   * @param positional positional arguments in caller order; must not be {@code null}
   * @param callOptions options for this call only; they override spec options of the same name
   * @return immutable command line
   */
  public List<String> commandLine(List<String> positional, Map<String, String> callOptions) {
    Objects.requireNonNull(positional, "positional");
    TreeMap<String, String> merged = new TreeMap<>(options);
    if (callOptions != null) {
      callOptions.forEach((key, value) -> merged.put(requireText(key, "option name"), value == null ? "" : value));
    }
    List<String> command = new ArrayList<>(1 + merged.size() * 2 + positional.size());
    command.add(executable);
    for (Map.Entry<String, String> entry : merged.entrySet()) {
      if (!entry.getValue().isEmpty()) {
        command.add(flagPrefix + entry.getKey());
        command.add(entry.getValue());
      }
    }
    for (String arg : positional) {
      command.add(Objects.requireNonNull(arg, "positional argument"));
    }
    return List.copyOf(command);
  }

  public String name() {
    return name;
  }

  public String executable() {
    return executable;
  }

  public Map<String, String> options() {
    return options;
  }

  public Duration timeout() {
    return timeout;
  }

  public boolean hasTimeout() {
    return !timeout.isZero();
  }

  @Override
  public String toString() {
    return "JobSpec[" + name + ", " + executable + ", options=" + options + "]";
  }

  private static String requireText(String value, String label) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(label + " must not be blank");
    }
    return value.trim();
  }
}
