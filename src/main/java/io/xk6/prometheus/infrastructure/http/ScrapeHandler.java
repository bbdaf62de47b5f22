package io.xk6.prometheus.infrastructure.http;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import io.prometheus.client.Collector;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import io.xk6.prometheus.application.port.MetricCatalog;
import io.xk6.prometheus.domain.metric.ExportKind;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Enumeration;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Answers pull requests by serializing the registry in the Prometheus text format 0.0.4.
 * <p>{@code GET} and {@code HEAD} only; other methods receive {@code 405}. Catalog families are typed from
 * their descriptors, so counters appear under their bare identity. Repeated {@code name[]} query parameters
 * restrict the output to the named sample families. Reads never consume samples.</p>
 * <p>The body is rendered into memory before the status line is sent so a serialization failure can still
 * be reported as {@code 500}.</p>
 *
 * @since 0.1.0
 */
public final class ScrapeHandler implements HttpHandler {
  private static final Logger log = LoggerFactory.getLogger(ScrapeHandler.class);
  private static final String NAME_PARAM = "name[]";

  private final CollectorRegistry registry;
  private final TextExposition exposition;

  /**
   * Serves a registry whose families carry their own types.
   *
   * @param registry registry to serialize
   */
  public ScrapeHandler(CollectorRegistry registry) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.exposition = new TextExposition(name -> Optional.empty());
  }

  /**
   * Serves a registry holding the catalog's families.
   *
   * @param registry registry to serialize
   * @param catalog catalog whose descriptors declare family types
   */
  public ScrapeHandler(CollectorRegistry registry, MetricCatalog catalog) {
    this.registry = Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(catalog, "catalog");
    this.exposition = new TextExposition(
        name -> catalog.find(name).map(entry -> typeOf(entry.descriptor().kind())));
  }

  private static Collector.Type typeOf(ExportKind kind) {
    return switch (kind) {
      case COUNTER -> Collector.Type.COUNTER;
      case GAUGE -> Collector.Type.GAUGE;
      case DISTRIBUTION -> Collector.Type.HISTOGRAM;
    };
  }

  @Override
  public void handle(HttpExchange exchange) throws IOException {
    try {
      String method = exchange.getRequestMethod();
      boolean head = "HEAD".equalsIgnoreCase(method);
      if (!head && !"GET".equalsIgnoreCase(method)) {
        exchange.getResponseHeaders().set("Allow", "GET, HEAD");
        exchange.sendResponseHeaders(405, -1);
        return;
      }
      byte[] body;
      try {
        body = render(requestedNames(exchange.getRequestURI().getRawQuery()));
      } catch (IOException | RuntimeException ex) {
        log.error("Failed to serialize metrics for scrape", ex);
        exchange.sendResponseHeaders(500, -1);
        return;
      }
      exchange.getResponseHeaders().set("Content-Type", TextFormat.CONTENT_TYPE_004);
      if (head) {
        exchange.sendResponseHeaders(200, -1);
        return;
      }
      exchange.sendResponseHeaders(200, body.length);
      try (OutputStream out = exchange.getResponseBody()) {
        out.write(body);
      }
    } finally {
      exchange.close();
    }
  }

  byte[] render(Set<String> names) throws IOException {
    Enumeration<Collector.MetricFamilySamples> families = names.isEmpty()
        ? registry.metricFamilySamples()
        : registry.filteredMetricFamilySamples(names);
    ByteArrayOutputStream buffer = new ByteArrayOutputStream(4096);
    try (Writer writer = new OutputStreamWriter(buffer, StandardCharsets.UTF_8)) {
      exposition.write(writer, families);
    }
    return buffer.toByteArray();
  }

  static Set<String> requestedNames(String rawQuery) {
    Set<String> names = new TreeSet<>();
    if (rawQuery == null || rawQuery.isEmpty()) {
      return names;
    }
    for (String pair : rawQuery.split("&")) {
      int idx = pair.indexOf('=');
      if (idx <= 0) {
        continue;
      }
      String key = decodeOrNull(pair.substring(0, idx));
      String value = decodeOrNull(pair.substring(idx + 1));
      if (NAME_PARAM.equals(key) && value != null && !value.isEmpty()) {
        names.add(value);
      }
    }
    return names;
  }

  private static String decodeOrNull(String component) {
    try {
      return URLDecoder.decode(component, StandardCharsets.UTF_8);
    } catch (IllegalArgumentException ex) {
      log.debug("Ignoring malformed scrape query component {}", component);
      return null;
    }
  }
}
