package io.xk6.prometheus.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges exporter options from the YAML file and the option string with precedence option string &gt; YAML.
 * <p>Defaults are applied afterwards by {@link OptionsParser#fromMap(Map)}.</p>
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds the effective option map.
   *
   * @param yaml optional YAML-derived settings
   * @param options option-string overrides (may be empty)
   * @param warn consumer invoked when an option-string key overrides a YAML key
   * @return immutable merged map with lower-cased keys
   */
  public static Map<String, String> buildEffectiveOptions(
      Optional<Map<String, String>> yaml, Map<String, String> options, Consumer<String> warn) {
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> merged = new LinkedHashMap<>();
    yaml.orElse(Map.of()).forEach((key, value) -> merged.put(normalize(key), value));
    Map<String, String> overrides = options == null ? Map.of() : options;
    for (Map.Entry<String, String> entry : overrides.entrySet()) {
      if (entry.getKey() == null || entry.getValue() == null) {
        continue;
      }
      String key = normalize(entry.getKey());
      if (merged.containsKey(key) && warn != null) {
        warn.accept("Option string overrides YAML for key: " + key);
      }
      merged.put(key, entry.getValue());
    }
    return Map.copyOf(merged);
  }

  private static String normalize(String key) {
    return key.trim().toLowerCase(Locale.ROOT);
  }
}
