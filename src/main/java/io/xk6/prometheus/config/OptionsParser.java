package io.xk6.prometheus.config;

import io.xk6.prometheus.validation.Numbers;
import io.xk6.prometheus.validation.Strings;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Parses the exporter option string, e.g. {@code port=5656&namespace=k6&subsystem=run}.
 * <p>The string is query-string shaped: {@code &}-separated {@code key=value} pairs with percent-encoding.
 * Keys are case-insensitive; when a key repeats, the last value wins. Unknown keys, {@code ;} separators and
 * malformed percent-encoding are rejected with {@link ExporterConfigException}.</p>
 *
 * @since 0.1.0
 */
public final class OptionsParser {
  public static final String PORT = "port";
  public static final String HOST = "host";
  public static final String NAMESPACE = "namespace";
  public static final String SUBSYSTEM = "subsystem";
  public static final String BUCKETS = "buckets";
  public static final Set<String> KNOWN_KEYS = Set.of(PORT, HOST, NAMESPACE, SUBSYSTEM, BUCKETS);

  private OptionsParser() {}

  /**
   * Parses and validates an option string.
   *
   * @param raw option string; {@code null} or blank yields the defaults
   * @return validated options
   * @throws ExporterConfigException when the string is malformed or a value is invalid
   */
  public static ExporterOptions parse(String raw) {
    return fromMap(parseQuery(raw));
  }

  /**
   * Splits an option string into decoded, lower-cased keys and decoded values.
   *
   * @param raw option string; may be {@code null}
   * @return ordered map of options; later duplicates replace earlier ones
   * @throws ExporterConfigException on {@code ;} separators, blank keys or malformed percent-encoding
   */
  public static Map<String, String> parseQuery(String raw) {
    if (raw == null || raw.isBlank()) {
      return Map.of();
    }
    if (raw.indexOf(';') >= 0) {
      throw new ExporterConfigException("invalid option string: ';' is not a valid separator");
    }
    Map<String, String> options = new LinkedHashMap<>();
    for (String pair : raw.trim().split("&")) {
      if (pair.isEmpty()) {
        continue;
      }
      int idx = pair.indexOf('=');
      String key = decode(idx < 0 ? pair : pair.substring(0, idx)).trim().toLowerCase(Locale.ROOT);
      String value = idx < 0 ? "" : decode(pair.substring(idx + 1));
      if (key.isEmpty()) {
        throw new ExporterConfigException("invalid option string: blank key in '" + pair + "'");
      }
      options.put(key, value);
    }
    return Collections.unmodifiableMap(options);
  }

  /**
   * Validates a key/value map into options, applying defaults for absent keys.
   *
   * @param options keys are matched case-insensitively
   * @return validated options
   * @throws ExporterConfigException on unknown keys or invalid values
   */
  public static ExporterOptions fromMap(Map<String, String> options) {
    ExporterOptions defaults = ExporterOptions.defaults();
    int port = defaults.port();
    String host = defaults.host();
    String namespace = defaults.namespace();
    String subsystem = defaults.subsystem();
    List<Double> buckets = defaults.buckets();
    if (options == null) {
      return defaults;
    }
    for (Map.Entry<String, String> entry : options.entrySet()) {
      String key = entry.getKey() == null ? "" : entry.getKey().trim().toLowerCase(Locale.ROOT);
      String value = entry.getValue();
      try {
        switch (key) {
          case PORT -> port = (int) Numbers.parseInRange(PORT, value, 0, 65535);
          case HOST -> host = Strings.trimToEmpty(HOST, value);
          case NAMESPACE -> namespace = Strings.trimToEmpty(NAMESPACE, value);
          case SUBSYSTEM -> subsystem = Strings.trimToEmpty(SUBSYSTEM, value);
          case BUCKETS -> buckets = parseBuckets(value);
          default -> throw new ExporterConfigException(
              "unknown option '" + entry.getKey() + "'; supported options are " + new TreeSet<>(KNOWN_KEYS));
        }
      } catch (ExporterConfigException ex) {
        throw ex;
      } catch (IllegalArgumentException ex) {
        throw new ExporterConfigException("invalid option " + key + ": " + ex.getMessage(), ex);
      }
    }
    return new ExporterOptions(port, host, namespace, subsystem, buckets);
  }

  /**
   * Parses a comma-separated list of strictly increasing finite bucket boundaries.
   *
   * @param raw list such as {@code 1,5,10}
   * @return immutable boundary list
   * @throws ExporterConfigException when the list is empty, non-numeric, non-finite or not increasing
   */
  public static List<Double> parseBuckets(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new ExporterConfigException("buckets must not be empty");
    }
    List<Double> result = new ArrayList<>();
    for (String token : raw.split(",")) {
      String trimmed = token.trim();
      double value;
      try {
        value = Double.parseDouble(trimmed);
      } catch (NumberFormatException ex) {
        throw new ExporterConfigException("bucket boundary '" + trimmed + "' is not a number", ex);
      }
      if (!Double.isFinite(value)) {
        throw new ExporterConfigException("bucket boundary must be finite (was " + trimmed + ")");
      }
      if (!result.isEmpty() && value <= result.get(result.size() - 1)) {
        throw new ExporterConfigException("buckets must be strictly increasing (" + raw.trim() + ")");
      }
      result.add(value);
    }
    return List.copyOf(result);
  }

  private static String decode(String component) {
    try {
      return URLDecoder.decode(component, StandardCharsets.UTF_8);
    } catch (IllegalArgumentException ex) {
      throw new ExporterConfigException("invalid option string: malformed escape in '" + component + "'", ex);
    }
  }
}
