package ca.gc.cra.helios.validation;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;

/**
 * Parses ISO-8601 instants and durations from configuration.
 *
 * @since 0.1.0
 */
public final class Times {
  private Times() {
    // Utility
  }

  /**
   * Parses an instant. Accepts a full instant ({@code 2024-01-01T06:00:00Z}), a local date-time read as UTC
   * ({@code 2024-01-01T06:00:00}), or a date meaning midnight UTC ({@code 2024-01-01}).
   *
   * @param name configuration key included in diagnostics
   * @param raw text to parse
   * @return parsed instant
   * @throws IllegalArgumentException if the text matches none of the accepted forms
   */
  public static Instant parseInstant(String name, String raw) {
    String text = Strings.requireNonBlank(name, raw);
    try {
      if (text.indexOf('T') < 0) {
        return LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC).toInstant();
      }
      TemporalAccessor parsed =
          DateTimeFormatter.ISO_DATE_TIME.parseBest(text, OffsetDateTime::from, LocalDateTime::from);
      if (parsed instanceof OffsetDateTime offset) {
        return offset.toInstant();
      }
      return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
    } catch (DateTimeParseException ex) {
      throw new IllegalArgumentException(Strings.message(name, "must be an ISO-8601 instant (was " + text + ")"), ex);
    }
  }

  /**
   * Parses an ISO-8601 duration such as {@code PT6H} or {@code P1D}.
   *
   * @param name configuration key included in diagnostics
   * @param raw text to parse
   * @param allowZero whether {@link Duration#ZERO} is acceptable
   * @return parsed, non-negative duration
   * @throws IllegalArgumentException if the text is not a duration, is negative, or is zero when not allowed
   */
  public static Duration parseDuration(String name, String raw, boolean allowZero) {
    String text = Strings.requireNonBlank(name, raw);
    Duration duration;
    try {
      duration = Duration.parse(text);
    } catch (DateTimeParseException ex) {
      throw new IllegalArgumentException(Strings.message(name, "must be an ISO-8601 duration (was " + text + ")"), ex);
    }
    if (duration.isNegative() || (!allowZero && duration.isZero())) {
      throw new IllegalArgumentException(Strings.message(name, allowZero ? "must not be negative" : "must be positive"));
    }
    return duration;
  }
}
