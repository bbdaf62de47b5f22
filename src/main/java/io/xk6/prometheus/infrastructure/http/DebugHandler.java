package io.xk6.prometheus.infrastructure.http;

import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import io.xk6.prometheus.application.port.CatalogEntry;
import io.xk6.prometheus.application.port.MetricCatalog;
import io.xk6.prometheus.domain.metric.MetricDescriptor;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.lang.management.ManagementFactory;
import java.lang.management.MemoryUsage;
import java.lang.management.ThreadInfo;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Diagnostic endpoints mounted under {@code /debug/}.
 * <ul>
 *   <li>{@code /debug/threads}: plain-text thread dump</li>
 *   <li>{@code /debug/runtime}: JSON runtime summary</li>
 *   <li>{@code /debug/catalog}: JSON listing of catalog entries</li>
 * </ul>
 *
 * @since 0.1.0
 */
public final class DebugHandler implements HttpHandler {
  private static final Logger log = LoggerFactory.getLogger(DebugHandler.class);
  private static final JsonFactory JSON = new JsonFactory();

  private final MetricCatalog catalog;

  public DebugHandler(MetricCatalog catalog) {
    this.catalog = Objects.requireNonNull(catalog, "catalog");
  }

  @Override
  public void handle(HttpExchange exchange) throws IOException {
    try {
      if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
        exchange.getResponseHeaders().set("Allow", "GET");
        exchange.sendResponseHeaders(405, -1);
        return;
      }
      String path = exchange.getRequestURI().getPath();
      byte[] body;
      String contentType;
      try {
        switch (path) {
          case "/debug/threads" -> {
            body = threadDump();
            contentType = "text/plain; charset=utf-8";
          }
          case "/debug/runtime" -> {
            body = runtimeJson();
            contentType = "application/json";
          }
          case "/debug/catalog" -> {
            body = catalogJson();
            contentType = "application/json";
          }
          default -> {
            exchange.sendResponseHeaders(404, -1);
            return;
          }
        }
      } catch (IOException | RuntimeException ex) {
        log.error("Failed to render {}", path, ex);
        exchange.sendResponseHeaders(500, -1);
        return;
      }
      exchange.getResponseHeaders().set("Content-Type", contentType);
      exchange.sendResponseHeaders(200, body.length);
      try (OutputStream out = exchange.getResponseBody()) {
        out.write(body);
      }
    } finally {
      exchange.close();
    }
  }

  static byte[] threadDump() {
    StringBuilder dump = new StringBuilder(8192);
    for (ThreadInfo info : ManagementFactory.getThreadMXBean().dumpAllThreads(false, false)) {
      dump.append(info);
    }
    return dump.toString().getBytes(StandardCharsets.UTF_8);
  }

  static byte[] runtimeJson() throws IOException {
    Runtime runtime = Runtime.getRuntime();
    MemoryUsage heap = ManagementFactory.getMemoryMXBean().getHeapMemoryUsage();
    ByteArrayOutputStream buffer = new ByteArrayOutputStream(512);
    try (JsonGenerator gen = JSON.createGenerator(buffer, JsonEncoding.UTF8)) {
      gen.writeStartObject();
      gen.writeNumberField("uptimeMillis", ManagementFactory.getRuntimeMXBean().getUptime());
      gen.writeNumberField("availableProcessors", runtime.availableProcessors());
      gen.writeNumberField("threads", ManagementFactory.getThreadMXBean().getThreadCount());
      gen.writeNumberField("heapUsedBytes", heap.getUsed());
      gen.writeNumberField("heapCommittedBytes", heap.getCommitted());
      gen.writeNumberField("heapMaxBytes", heap.getMax());
      gen.writeStringField("javaVersion", System.getProperty("java.version", "unknown"));
      gen.writeEndObject();
    }
    return buffer.toByteArray();
  }

  byte[] catalogJson() throws IOException {
    ByteArrayOutputStream buffer = new ByteArrayOutputStream(1024);
    try (JsonGenerator gen = JSON.createGenerator(buffer, JsonEncoding.UTF8)) {
      gen.writeStartObject();
      gen.writeArrayFieldStart("families");
      for (CatalogEntry entry : catalog.entries()) {
        MetricDescriptor descriptor = entry.descriptor();
        gen.writeStartObject();
        gen.writeStringField("identity", descriptor.identity());
        gen.writeStringField("kind", descriptor.kind().name().toLowerCase(Locale.ROOT));
        gen.writeArrayFieldStart("labelNames");
        for (String label : descriptor.labelNames()) {
          gen.writeString(label);
        }
        gen.writeEndArray();
        if (!descriptor.buckets().isEmpty()) {
          gen.writeArrayFieldStart("buckets");
          for (Double bound : descriptor.buckets()) {
            gen.writeNumber(bound);
          }
          gen.writeEndArray();
        }
        gen.writeNumberField("series", entry.seriesCount());
        gen.writeEndObject();
      }
      gen.writeEndArray();
      gen.writeEndObject();
    }
    return buffer.toByteArray();
  }
}
