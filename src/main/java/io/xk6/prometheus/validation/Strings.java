package io.xk6.prometheus.validation;

/**
 * Guards for free-text option values such as host names and identity prefixes.
 * Violations raise {@link IllegalArgumentException} naming the offending option.
 *
 * @see Numbers
 */
public final class Strings {
  /** Longest option value accepted from the command line or a query string. */
  public static final int MAX_OPTION_LENGTH = 1024;

  private Strings() {
    // Utility
  }

  /**
   * Returns the trimmed value, which must contain something other than whitespace.
   *
   * @param option option name used in the error message
   * @param value raw value
   * @return trimmed value
   * @throws IllegalArgumentException if the value is missing, blank, too long or holds control characters
   */
  public static String requireNonBlank(String option, String value) {
    if (value == null) {
      throw new IllegalArgumentException(label(option) + " is required");
    }
    String trimmed = checked(option, value);
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(label(option) + " must not be blank");
    }
    return trimmed;
  }

  /**
   * Returns the trimmed value, or {@code ""} when it is absent.
   *
   * @param option option name used in the error message
   * @param value raw value, may be {@code null}
   * @return trimmed value, possibly empty
   * @throws IllegalArgumentException if the value is too long or holds control characters
   */
  public static String trimToEmpty(String option, String value) {
    return value == null ? "" : checked(option, value);
  }

  private static String checked(String option, String value) {
    if (value.length() > MAX_OPTION_LENGTH) {
      throw new IllegalArgumentException(
          label(option) + " exceeds " + MAX_OPTION_LENGTH + " characters");
    }
    if (value.chars().anyMatch(Character::isISOControl)) {
      throw new IllegalArgumentException(label(option) + " must not contain control characters");
    }
    return value.trim();
  }

  private static String label(String option) {
    return option == null || option.isBlank() ? "value" : option;
  }
}
