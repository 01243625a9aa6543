package ca.gc.cra.helios.application.port;

import java.io.IOException;
import java.time.Instant;
import java.util.Map;

/**
 * Writes a per-tick summary of key/value statistics.
 *
 * @since 0.1.0
 * @see ca.gc.cra.helios.infrastructure.report.CsvTickReportAdapter
 */
public interface TickReportPort {
  /**
   * Writes the report for one tick, replacing any earlier report for the same tick.
   *
   * @param tick nominal tick instant
   * @param values statistic name to value
   * @throws IOException if the report cannot be written
   */
  void write(Instant tick, Map<String, String> values) throws IOException;

  /** Reporter that discards everything. */
  TickReportPort NONE = (tick, values) -> {};
}
