package io.xk6.prometheus.infrastructure.http;

import static org.junit.jupiter.api.Assertions.assertEquals;

import io.prometheus.client.Collector;
import io.prometheus.client.Collector.MetricFamilySamples;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import java.io.StringWriter;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class TextExpositionTest {

  @Test
  void wholeValuesDropTheFraction() {
    assertEquals("2", TextExposition.formatValue(2.0));
    assertEquals("-3", TextExposition.formatValue(-3.0));
    assertEquals("0.25", TextExposition.formatValue(0.25));
    assertEquals("+Inf", TextExposition.formatValue(Double.POSITIVE_INFINITY));
    assertEquals("-Inf", TextExposition.formatValue(Double.NEGATIVE_INFINITY));
    assertEquals("NaN", TextExposition.formatValue(Double.NaN));
    assertEquals("1.0E20", TextExposition.formatValue(1e20));
  }

  @Test
  void labelValuesAndHelpAreEscaped() {
    assertEquals("a\\\\b\\n\\\"c\\\"", TextExposition.escape("a\\b\n\"c\"", true));
    assertEquals("say \"hi\"\\n", TextExposition.escape("say \"hi\"\n", false));
  }

  @Test
  void declaredTypeOverridesCollectedType() throws Exception {
    MetricFamilySamples family = new MetricFamilySamples("reqs", Collector.Type.UNKNOWN, "requests", List.of(
        new MetricFamilySamples.Sample("reqs", List.of("method", "status"), List.of("GET", "200"), 4)));
    StringWriter out = new StringWriter();

    new TextExposition(name -> Optional.of(Collector.Type.COUNTER))
        .write(out, Collections.enumeration(List.of(family)));

    assertEquals("# HELP reqs requests\n# TYPE reqs counter\nreqs{method=\"GET\",status=\"200\"} 4\n",
        out.toString());
  }

  @Test
  void foreignSimpleclientCountersKeepTheirTotalSuffix() throws Exception {
    CollectorRegistry registry = new CollectorRegistry();
    Counter.build().name("jobs").help("jobs").register(registry).inc();
    StringWriter out = new StringWriter();

    new TextExposition(name -> Optional.empty()).write(out, registry.metricFamilySamples());

    assertEquals("# HELP jobs_total jobs\n# TYPE jobs_total counter\njobs_total 1\n", out.toString());
  }
}
