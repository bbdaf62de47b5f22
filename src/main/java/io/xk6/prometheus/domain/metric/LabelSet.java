package io.xk6.prometheus.domain.metric;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Label names and values derived from sample tags, ordered by label name.
 *
 * @param names sanitized label names in ascending order
 * @param values label values aligned with {@code names}
 * @since 0.1.0
 */
public record LabelSet(List<String> names, List<String> values) {
  private static final Set<String> RESERVED = Set.of("le", "quantile");

  public LabelSet {
    names = List.copyOf(names);
    values = List.copyOf(values);
    if (names.size() != values.size()) {
      throw new IllegalArgumentException("label names and values must align");
    }
  }

  /** Label set with no labels. */
  public static final LabelSet EMPTY = new LabelSet(List.of(), List.of());

  /**
   * Converts sample tags into an ordered label set.
   *
   * @param identity identity of the metric the tags belong to (diagnostics only)
   * @param tags sample tags; {@code null} treated as empty
   * @return label set sorted by sanitized label name
   * @throws SampleClassificationException when a tag key is blank or two keys collapse to one label name
   */
  public static LabelSet fromTags(String identity, Map<String, String> tags) {
    if (tags == null || tags.isEmpty()) {
      return EMPTY;
    }
    TreeMap<String, String> sorted = new TreeMap<>();
    for (Map.Entry<String, String> tag : tags.entrySet()) {
      String key = tag.getKey();
      if (key == null || key.isBlank()) {
        throw new SampleClassificationException(identity, "tags", "tag key is blank");
      }
      String label = labelName(key.trim());
      String previous = sorted.put(label, tag.getValue() == null ? "" : tag.getValue());
      if (previous != null) {
        throw new SampleClassificationException(
            identity, "tags", "tag '" + key + "' collides with another tag as label '" + label + "'");
      }
    }
    return new LabelSet(new ArrayList<>(sorted.keySet()), new ArrayList<>(sorted.values()));
  }

  /**
   * Maps a tag key to a label name accepted by the scrape protocol.
   * <p>Names starting with {@code __} are reserved by the protocol and get an {@code x} prefix;
   * {@code le} and {@code quantile} are reserved by distributions and get an {@code _} suffix.</p>
   *
   * @param key trimmed tag key
   * @return label name
   */
  static String labelName(String key) {
    String sanitized = IdentityNamer.sanitize(key);
    if (sanitized.startsWith("__")) {
      sanitized = "x" + sanitized;
    }
    if (RESERVED.contains(sanitized)) {
      sanitized = sanitized + "_";
    }
    return sanitized;
  }
}
