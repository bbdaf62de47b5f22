package io.xk6.prometheus.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads exporter defaults from YAML.
 * <p>The {@code common} section applies first and the named section overrides it. Keys are lower-cased,
 * nested mappings become dotted keys and scalar lists are joined with commas, which is how the option
 * string spells bucket boundaries:</p>
 * <pre>
 * common:
 *   namespace: k6
 * exporter:
 *   port: 9090
 *   buckets: [5, 50, 500]
 * </pre>
 */
public final class YamlConfigLoader {
  public static final String EXPORTER_SECTION = "exporter";
  static final String COMMON_SECTION = "common";

  private YamlConfigLoader() {}

  /**
   * Loads the {@code common} section merged with {@code section}.
   *
   * @param path YAML file
   * @param section section name, usually {@link #EXPORTER_SECTION}
   * @return flat key/value map, or empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws ExporterConfigException when the document is malformed or not shaped as sections of mappings
   */
  public static Optional<Map<String, String>> load(Path path, String section) throws IOException {
    Objects.requireNonNull(path, "path");
    String wanted = Objects.requireNonNull(section, "section").trim().toLowerCase(Locale.ROOT);
    if (!Files.exists(path)) {
      return Optional.empty();
    }

    Object document;
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      document = newYaml().load(reader);
    } catch (YAMLException ex) {
      throw new ExporterConfigException("Failed to parse YAML config at " + path, ex);
    }
    if (document == null) {
      return Optional.of(Map.of());
    }

    Flattener flattener = new Flattener();
    Map<String, Object> sections = mapping(document, "root");
    for (String name : List.of(COMMON_SECTION, wanted)) {
      Object body = sections.get(name);
      if (body != null) {
        flattener.add("", mapping(body, name));
      }
    }
    return Optional.of(Map.copyOf(flattener.values));
  }

  private static Yaml newYaml() {
    LoaderOptions options = new LoaderOptions();
    options.setAllowDuplicateKeys(false);
    options.setMaxAliasesForCollections(16);
    return new Yaml(new SafeConstructor(options));
  }

  /** Copies a YAML mapping, lower-casing and trimming its keys. */
  private static Map<String, Object> mapping(Object node, String where) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new ExporterConfigException(where + " section must be a mapping");
    }
    Map<String, Object> copy = new LinkedHashMap<>();
    raw.forEach((key, value) -> {
      if (!(key instanceof String text) || text.isBlank()) {
        throw new ExporterConfigException(where + " section contains a blank or non-string key");
      }
      copy.put(text.trim().toLowerCase(Locale.ROOT), value);
    });
    return copy;
  }

  private static final class Flattener {
    private final Map<String, String> values = new LinkedHashMap<>();

    void add(String prefix, Map<String, Object> node) {
      node.forEach((key, value) -> {
        String name = prefix.isEmpty() ? key : prefix + '.' + key;
        if (value instanceof Map<?, ?>) {
          add(name, mapping(value, name));
        } else if (value instanceof Iterable<?> items) {
          values.put(name, join(name, items));
        } else {
          values.put(name, value == null ? "" : value.toString());
        }
      });
    }

    private static String join(String name, Iterable<?> items) {
      return StreamSupport.stream(items.spliterator(), false)
          .map(item -> {
            if (item instanceof Map<?, ?> || item instanceof Iterable<?>) {
              throw new ExporterConfigException("nested collections are not supported for key " + name);
            }
            return String.valueOf(item);
          })
          .collect(Collectors.joining(","));
    }
  }
}
