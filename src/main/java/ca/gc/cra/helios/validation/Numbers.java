package ca.gc.cra.helios.validation;

/**
 * Numeric validation helpers used by configuration parsing.
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that a numeric value falls within an inclusive range.
   *
   * @param name configuration key included in diagnostics
   * @param value candidate value
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return the validated value
   * @throws IllegalArgumentException if {@code value} lies outside {@code [min, max]}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          Strings.message(name, "must be between " + min + " and " + max + " (was " + value + ")"));
    }
    return value;
  }

  /**
   * Parses an integer and checks its range.
   *
   * @param name configuration key included in diagnostics
   * @param raw text to parse
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return parsed value
   * @throws IllegalArgumentException if the text is not an integer or is out of range
   */
  public static int parseInt(String name, String raw, int min, int max) {
    String text = Strings.requireNonBlank(name, raw);
    try {
      return (int) requireRange(name, Integer.parseInt(text), min, max);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(Strings.message(name, "must be an integer (was " + text + ")"), ex);
    }
  }
}
