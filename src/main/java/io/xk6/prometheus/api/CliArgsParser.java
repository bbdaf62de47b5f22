package io.xk6.prometheus.api;

import io.xk6.prometheus.validation.Strings;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Parses {@code key=value} command-line arguments.
 * <p>Only the first {@code =} separates key from value, so {@code out=port=9090&namespace=k6} keeps the whole
 * option string as the value of {@code out}.</p>
 */
final class CliArgsParser {
  private static final Pattern KEY_PATTERN = Pattern.compile("^[A-Za-z0-9._-]+$");

  private CliArgsParser() {}

  /**
   * Converts arguments to an ordered map; later duplicates replace earlier ones.
   *
   * @param args raw arguments
   * @return mutable map of arguments
   * @throws IllegalArgumentException when an argument is not {@code key=value} or contains control characters
   */
  static Map<String, String> toMap(String[] args) {
    Map<String, String> map = new LinkedHashMap<>();
    if (args == null) {
      return map;
    }
    for (String raw : args) {
      if (raw == null || raw.isBlank()) {
        continue;
      }
      String arg = raw.trim();
      int idx = arg.indexOf('=');
      if (idx <= 0 || idx == arg.length() - 1) {
        throw new IllegalArgumentException("argument must be key=value (was '" + raw + "')");
      }
      String key = arg.substring(0, idx).trim();
      String value = arg.substring(idx + 1).trim();
      if (!KEY_PATTERN.matcher(key).matches()) {
        throw new IllegalArgumentException("invalid argument name: " + key);
      }
      map.put(key, Strings.requireNonBlank(key, value));
    }
    return map;
  }
}
