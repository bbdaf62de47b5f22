package io.xk6.prometheus.infrastructure.metrics;

import io.prometheus.client.Collector;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.DoubleAdder;

/**
 * Counter family whose samples carry the bare identity, e.g. {@code reqs{status="200"} 2}.
 * <p>simpleclient renames {@link Collector.Type#COUNTER} samples to {@code <name>_total} and adds
 * {@code _created} series, so the family is collected as {@link Collector.Type#UNKNOWN}. The scrape handler
 * restores the {@code counter} type from the catalog.</p>
 * <p>Each label tuple owns a {@link DoubleAdder}; a collected value is always a sum of whole increments and
 * never decreases between two collections.</p>
 */
final class CounterFamily extends Collector {
  private static final Comparator<List<String>> LABEL_ORDER = (a, b) -> {
    for (int i = 0; i < Math.min(a.size(), b.size()); i++) {
      int cmp = a.get(i).compareTo(b.get(i));
      if (cmp != 0) {
        return cmp;
      }
    }
    return Integer.compare(a.size(), b.size());
  };

  private final String name;
  private final String help;
  private final List<String> labelNames;
  private final ConcurrentMap<List<String>, DoubleAdder> cells = new ConcurrentHashMap<>();

  CounterFamily(String name, String help, List<String> labelNames) {
    this.name = name;
    this.help = help;
    this.labelNames = List.copyOf(labelNames);
  }

  void inc(List<String> labelValues, double amount) {
    cells.computeIfAbsent(List.copyOf(labelValues), k -> new DoubleAdder()).add(amount);
  }

  @Override
  public List<MetricFamilySamples> collect() {
    List<Map.Entry<List<String>, DoubleAdder>> snapshot = new ArrayList<>(cells.entrySet());
    snapshot.sort(Map.Entry.comparingByKey(LABEL_ORDER));
    List<MetricFamilySamples.Sample> samples = new ArrayList<>(snapshot.size());
    for (Map.Entry<List<String>, DoubleAdder> cell : snapshot) {
      samples.add(new MetricFamilySamples.Sample(name, labelNames, cell.getKey(), cell.getValue().sum()));
    }
    List<MetricFamilySamples> families = new ArrayList<>(1);
    families.add(new MetricFamilySamples(name, Type.UNKNOWN, help, samples));
    return families;
  }
}
