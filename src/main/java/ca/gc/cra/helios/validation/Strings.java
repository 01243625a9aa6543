package ca.gc.cra.helios.validation;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Validation utilities for strings read from YAML and the command line.
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent access.</p>
 * <p><strong>Observability:</strong> No logs; violations raise {@link IllegalArgumentException} naming the key.</p>
 *
 * @since 0.1.0
 * @see Numbers
 * @see Times
 */
public final class Strings {
  private static final Pattern TOPIC_PATTERN = Pattern.compile("^([A-Za-z0-9._-]+)$");

  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank, and control-character free.
   *
   * @param name configuration key for diagnostics
   * @param value candidate text
   * @return trimmed value
   * @throws IllegalArgumentException if the value is missing, blank, or contains control characters
   */
  public static String requireNonBlank(String name, String value) {
    if (value == null) {
      throw new IllegalArgumentException(message(name, "is required"));
    }
    if (containsControl(value)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = value.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Validates a Kafka topic name.
   *
   * @param name configuration key for diagnostics
   * @param topic candidate topic
   * @return trimmed topic matching {@code [A-Za-z0-9._-]+}
   */
  public static String sanitizeTopic(String name, String topic) {
    String sanitized = requireNonBlank(name, topic);
    if (!TOPIC_PATTERN.matcher(sanitized).matches()) {
      throw new IllegalArgumentException(message(name,
          "must only contain letters, digits, dot, underscore, or hyphen"));
    }
    return sanitized;
  }

  /**
   * Splits a comma-separated list, trimming entries and dropping empty ones.
   *
   * @param raw list text; {@code null} or blank yields an empty list
   * @return entries in order
   */
  public static List<String> splitList(String raw) {
    List<String> values = new ArrayList<>();
    if (raw == null || raw.isBlank()) {
      return values;
    }
    for (String token : raw.split(",")) {
      String trimmed = token.trim();
      if (!trimmed.isEmpty()) {
        values.add(trimmed);
      }
    }
    return values;
  }

  /**
   * Returns the trimmed value or an empty string.
   *
   * @param value possibly {@code null} value
   * @return trimmed text, never {@code null}
   */
  public static String trimToEmpty(String value) {
    return value == null ? "" : value.trim();
  }

  static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }
}
