package io.xk6.prometheus.validation;

/**
 * <strong>What:</strong> Numeric validation helpers used by option and CLI parsing.
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent access.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Ensures {@code value} lies within {@code [min, max]}.
   *
   * @param name logical parameter name for diagnostics
   * @param value candidate value
   * @param min inclusive lower bound
   * @param max inclusive upper bound
   * @return {@code value}
   * @throws IllegalArgumentException if the value is out of range
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          (name == null || name.isBlank() ? "value" : name)
              + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Parses a decimal integer and checks its range.
   *
   * @param name logical parameter name for diagnostics
   * @param raw text to parse; surrounding whitespace is ignored
   * @param min inclusive lower bound
   * @param max inclusive upper bound
   * @return parsed value
   * @throws IllegalArgumentException if the text is not an integer or is out of range
   */
  public static long parseInRange(String name, String raw, long min, long max) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException(label(name) + " must be a number");
    }
    long value;
    try {
      value = Long.parseLong(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(label(name) + " must be a number (was '" + raw.trim() + "')", ex);
    }
    return requireRange(name, value, min, max);
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
