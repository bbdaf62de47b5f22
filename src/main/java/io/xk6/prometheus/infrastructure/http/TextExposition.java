package io.xk6.prometheus.infrastructure.http;

import io.prometheus.client.Collector;
import io.prometheus.client.Collector.MetricFamilySamples;
import java.io.IOException;
import java.io.Writer;
import java.util.Enumeration;
import java.util.Optional;
import java.util.function.Function;

/**
 * Writes the Prometheus text format 0.0.4.
 * <p>Sample names are written as collected, whole values without a fraction ({@code 2}, not {@code 2.0}) and
 * label sets without a trailing comma. OpenMetrics-only {@code _created}, {@code _gcount} and {@code _gsum}
 * samples are left out.</p>
 */
final class TextExposition {
  private final Function<String, Optional<Collector.Type>> declaredType;

  /**
   * @param declaredType type a family was declared with, overriding the collected type when present
   */
  TextExposition(Function<String, Optional<Collector.Type>> declaredType) {
    this.declaredType = declaredType;
  }

  void write(Writer out, Enumeration<MetricFamilySamples> families) throws IOException {
    while (families.hasMoreElements()) {
      MetricFamilySamples family = families.nextElement();
      Collector.Type type = declaredType.apply(family.name).orElse(family.type);
      // simpleclient's own counters keep the family name without _total but sample as <name>_total
      String header = family.type == Collector.Type.COUNTER ? family.name + "_total" : family.name;
      out.write("# HELP ");
      out.write(header);
      out.write(' ');
      out.write(escape(family.help, false));
      out.write("\n# TYPE ");
      out.write(header);
      out.write(' ');
      out.write(typeName(type));
      out.write('\n');
      for (MetricFamilySamples.Sample sample : family.samples) {
        if (!openMetricsOnly(family.name, sample.name)) {
          writeSample(out, sample);
        }
      }
    }
  }

  private static void writeSample(Writer out, MetricFamilySamples.Sample sample) throws IOException {
    out.write(sample.name);
    if (!sample.labelNames.isEmpty()) {
      out.write('{');
      for (int i = 0; i < sample.labelNames.size(); i++) {
        if (i > 0) {
          out.write(',');
        }
        out.write(sample.labelNames.get(i));
        out.write("=\"");
        out.write(escape(sample.labelValues.get(i), true));
        out.write('"');
      }
      out.write('}');
    }
    out.write(' ');
    out.write(formatValue(sample.value));
    if (sample.timestampMs != null) {
      out.write(' ');
      out.write(Long.toString(sample.timestampMs));
    }
    out.write('\n');
  }

  private static boolean openMetricsOnly(String family, String sample) {
    return sample.equals(family + "_created")
        || sample.equals(family + "_gcount")
        || sample.equals(family + "_gsum");
  }

  static String formatValue(double value) {
    if (Double.isNaN(value)) {
      return "NaN";
    }
    if (Double.isInfinite(value)) {
      return value > 0 ? "+Inf" : "-Inf";
    }
    if (value == Math.rint(value) && Math.abs(value) < 1e15) {
      return Long.toString((long) value);
    }
    return Double.toString(value);
  }

  static String typeName(Collector.Type type) {
    return switch (type) {
      case COUNTER -> "counter";
      case GAUGE -> "gauge";
      case HISTOGRAM -> "histogram";
      case SUMMARY -> "summary";
      default -> "untyped";
    };
  }

  static String escape(String text, boolean quote) {
    if (text == null) {
      return "";
    }
    StringBuilder escaped = new StringBuilder(text.length());
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      switch (c) {
        case '\\' -> escaped.append("\\\\");
        case '\n' -> escaped.append("\\n");
        case '"' -> escaped.append(quote ? "\\\"" : "\"");
        default -> escaped.append(c);
      }
    }
    return escaped.toString();
  }
}
