package ca.gc.cra.helios.infrastructure.report;

import ca.gc.cra.helios.application.port.TickReportPort;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Writes one CSV file per tick: a header row of statistic names in sorted order and a single row of values.
 *
 * <p>Files are named {@code yyyyMMdd_HHmmss.csv} after the tick (UTC) and are overwritten when a tick is replayed.</p>
 *
 * @since 0.1.0
 */
public final class CsvTickReportAdapter implements TickReportPort {
  private static final DateTimeFormatter FILE_NAME =
      DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss", Locale.ROOT).withZone(ZoneOffset.UTC);

  private final Path directory;

  public CsvTickReportAdapter(Path directory) {
    this.directory = Objects.requireNonNull(directory, "directory");
  }

  /**
   * Returns the report path for a tick.
   *
   * @param tick nominal tick instant
   * @return target CSV file
   */
  public Path reportFile(Instant tick) {
    return directory.resolve(FILE_NAME.format(tick) + ".csv");
  }

  @Override
  public void write(Instant tick, Map<String, String> values) throws IOException {
    Objects.requireNonNull(tick, "tick");
    Map<String, String> sorted = new TreeMap<>(values);
    Files.createDirectories(directory);
    StringBuilder header = new StringBuilder();
    StringBuilder row = new StringBuilder();
    for (Map.Entry<String, String> entry : sorted.entrySet()) {
      if (header.length() > 0) {
        header.append(',');
        row.append(',');
      }
      header.append(escape(entry.getKey()));
      row.append(escape(entry.getValue()));
    }
    try (BufferedWriter writer = Files.newBufferedWriter(
        reportFile(tick),
        StandardCharsets.UTF_8,
        StandardOpenOption.CREATE,
        StandardOpenOption.TRUNCATE_EXISTING,
        StandardOpenOption.WRITE)) {
      writer.write(header.toString());
      writer.newLine();
      writer.write(row.toString());
      writer.newLine();
    }
  }

  static String escape(String value) {
    String text = value == null ? "" : value;
    if (text.indexOf(',') < 0 && text.indexOf('"') < 0 && text.indexOf('\n') < 0 && text.indexOf('\r') < 0) {
      return text;
    }
    return '"' + text.replace("\"", "\"\"") + '"';
  }
}
