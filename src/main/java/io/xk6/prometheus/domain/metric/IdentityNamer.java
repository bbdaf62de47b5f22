package io.xk6.prometheus.domain.metric;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * <strong>What:</strong> Builds exported metric identities as {@code namespace_subsystem_name}.
 * <p><strong>Why:</strong> The scrape protocol only accepts {@code [a-zA-Z_][a-zA-Z0-9_]*}; k6 metric names and
 * user supplied prefixes are free-form.</p>
 * <p><strong>Role:</strong> Naming policy owned by the sample adapter; prefixes are fixed at construction.</p>
 * <p><strong>Thread-safety:</strong> Immutable configuration plus a concurrent memo of computed identities.</p>
 *
 * @since 0.1.0
 */
public final class IdentityNamer {
  private final String namespace;
  private final String subsystem;
  private final Map<String, String> identities = new ConcurrentHashMap<>();

  /**
   * Creates a namer.
   *
   * @param namespace first prefix segment; {@code null} or blank elides it
   * @param subsystem second prefix segment; {@code null} or blank elides it
   */
  public IdentityNamer(String namespace, String subsystem) {
    this.namespace = namespace == null ? "" : namespace.trim();
    this.subsystem = subsystem == null ? "" : subsystem.trim();
  }

  /**
   * Resolves the exported identity of a logical metric name.
   *
   * @param name logical metric name
   * @return prefixed, sanitized identity
   * @throws SampleClassificationException if the name is {@code null} or blank
   */
  public String identity(String name) {
    if (name == null || name.isBlank()) {
      throw new SampleClassificationException(String.valueOf(name), "name", "metric name is blank");
    }
    return identities.computeIfAbsent(name, this::compute);
  }

  public String namespace() {
    return namespace;
  }

  public String subsystem() {
    return subsystem;
  }

  private String compute(String name) {
    StringBuilder joined = new StringBuilder(namespace.length() + subsystem.length() + name.length() + 2);
    append(joined, namespace);
    append(joined, subsystem);
    append(joined, name.trim());
    return sanitize(joined.toString());
  }

  private static void append(StringBuilder target, String segment) {
    if (segment.isEmpty()) {
      return;
    }
    if (target.length() > 0) {
      target.append('_');
    }
    target.append(segment);
  }

  /**
   * Replaces every character outside {@code [A-Za-z0-9_]} with {@code '_'} and guards a leading digit.
   *
   * @param raw candidate name; must not be {@code null} or empty
   * @return protocol-safe name
   */
  public static String sanitize(String raw) {
    Objects.requireNonNull(raw, "raw");
    if (raw.isEmpty()) {
      throw new IllegalArgumentException("name must not be empty");
    }
    StringBuilder result = new StringBuilder(raw.length() + 1);
    if (isDigit(raw.charAt(0))) {
      result.append('_');
    }
    for (int i = 0; i < raw.length(); i++) {
      char c = raw.charAt(i);
      result.append(isNameChar(c) ? c : '_');
    }
    return result.toString();
  }

  private static boolean isNameChar(char c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || isDigit(c) || c == '_';
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }
}
