package ca.gc.cra.helios.application.port;

/**
 * <strong>What:</strong> Port abstracting HELIOS metrics emission.
 * <p><strong>Why:</strong> Lets the locator, job runner, and scheduler record counters and durations without binding
 * to a vendor SDK.</p>
 * <p><strong>Role:</strong> Port implemented by adapters such as {@code OpenTelemetryMetricsAdapter}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent updates from lookup workers and the
 * scheduler thread.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code scheduler.tick.failed}).</p>
 *
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric identifier (e.g., {@code locator.cache.hit}); must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram/gauge style metric.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param value observed value (e.g., milliseconds)
   */
  void observe(String key, long value);

  /** Metrics implementation that ignores all updates. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
