package io.xk6.prometheus.infrastructure.http;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.prometheus.client.CollectorRegistry;
import io.xk6.prometheus.application.pipeline.SampleAdapter;
import io.xk6.prometheus.application.port.CatalogEntry;
import io.xk6.prometheus.config.ExporterOptions;
import io.xk6.prometheus.domain.metric.IdentityNamer;
import io.xk6.prometheus.domain.metric.ExportKind;
import io.xk6.prometheus.domain.metric.MetricDescriptor;
import io.xk6.prometheus.domain.sample.MetricKind;
import io.xk6.prometheus.domain.sample.Sample;
import io.xk6.prometheus.infrastructure.metrics.PrometheusMetricCatalog;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class HttpScrapeEndpointTest {
  private final HttpClient client = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(2)).build();

  private PrometheusMetricCatalog catalog;
  private HttpScrapeEndpoint endpoint;
  private int port;

  @BeforeEach
  void setUp() throws IOException {
    CollectorRegistry registry = new CollectorRegistry();
    catalog = new PrometheusMetricCatalog(registry);
    CatalogEntry reqs = catalog.resolve(
        new MetricDescriptor("k6_http_reqs", ExportKind.COUNTER, List.of("status"), List.of(), "requests"));
    catalog.observe(reqs, List.of("200"), 3);
    CatalogEntry vus = catalog.resolve(
        new MetricDescriptor("k6_vus", ExportKind.GAUGE, List.of(), List.of(), "virtual users"));
    catalog.observe(vus, List.of(), 7);
    endpoint = new HttpScrapeEndpoint(registry, catalog);
    InetSocketAddress bound = endpoint.start("127.0.0.1", 0);
    port = bound.getPort();
  }

  @AfterEach
  void tearDown() {
    endpoint.stop();
  }

  private HttpResponse<String> get(String path) throws IOException, InterruptedException {
    return send(HttpRequest.newBuilder(uri(path)).GET().build());
  }

  private HttpResponse<String> send(HttpRequest request) throws IOException, InterruptedException {
    return client.send(request, HttpResponse.BodyHandlers.ofString());
  }

  private URI uri(String path) {
    return URI.create("http://127.0.0.1:" + port + path);
  }

  @Test
  void getReturnsTextExposition() throws Exception {
    HttpResponse<String> response = get("/metrics");

    assertEquals(200, response.statusCode());
    assertTrue(response.headers().firstValue("Content-Type").orElse("").startsWith("text/plain; version=0.0.4"));
    assertTrue(response.body().contains("# TYPE k6_http_reqs counter\n"), response.body());
    assertTrue(response.body().contains("\nk6_http_reqs{status=\"200\"} 3\n"), response.body());
    assertTrue(response.body().contains("\nk6_vus 7\n"), response.body());
    assertFalse(response.body().contains("_total"), response.body());
    assertFalse(response.body().contains("_created"), response.body());
  }

  @Test
  void scrapingDoesNotConsumeValues() throws Exception {
    String first = get("/").body();
    String second = get("/").body();

    assertEquals(first, second);
  }

  @Test
  void openMetricsAcceptHeaderStillReceivesTextFormat() throws Exception {
    HttpResponse<String> response = send(HttpRequest.newBuilder(uri("/"))
        .header("Accept", "application/openmetrics-text; version=1.0.0")
        .GET()
        .build());

    assertEquals(200, response.statusCode());
    assertTrue(response.headers().firstValue("Content-Type").orElse("").startsWith("text/plain; version=0.0.4"));
    assertFalse(response.body().contains("# EOF"));
  }

  @Test
  void nameFilterRestrictsFamilies() throws Exception {
    HttpResponse<String> response = get("/?name%5B%5D=k6_vus");

    assertTrue(response.body().contains("k6_vus 7"));
    assertFalse(response.body().contains("k6_http_reqs"));
  }

  @Test
  void nonReadMethodsAreRejected() throws Exception {
    HttpResponse<String> response = send(HttpRequest.newBuilder(uri("/"))
        .POST(HttpRequest.BodyPublishers.ofString("x"))
        .build());

    assertEquals(405, response.statusCode());
    assertEquals("GET, HEAD", response.headers().firstValue("Allow").orElse(""));
  }

  @Test
  void headReturnsHeadersOnly() throws Exception {
    HttpResponse<String> response = send(HttpRequest.newBuilder(uri("/"))
        .method("HEAD", HttpRequest.BodyPublishers.noBody())
        .build());

    assertEquals(200, response.statusCode());
    assertEquals("", response.body());
  }

  @Test
  void debugCatalogListsFamilies() throws Exception {
    HttpResponse<String> response = get("/debug/catalog");

    assertEquals(200, response.statusCode());
    assertEquals("application/json", response.headers().firstValue("Content-Type").orElse(""));
    assertTrue(response.body().contains("\"identity\":\"k6_http_reqs\""));
    assertTrue(response.body().contains("\"kind\":\"counter\""));
    assertTrue(response.body().contains("\"labelNames\":[\"status\"]"));
    assertTrue(response.body().contains("\"series\":1"));
  }

  @Test
  void debugRuntimeAndThreadsRespond() throws Exception {
    HttpResponse<String> runtime = get("/debug/runtime");
    HttpResponse<String> threads = get("/debug/threads");

    assertEquals(200, runtime.statusCode());
    assertTrue(runtime.body().contains("\"availableProcessors\""));
    assertEquals(200, threads.statusCode());
    assertFalse(threads.body().isEmpty());
  }

  @Test
  void unknownDebugPathIsNotFound() throws Exception {
    assertEquals(404, get("/debug/nope").statusCode());
  }

  @Test
  void concurrentScrapesAllSucceed() throws Exception {
    ExecutorService pool = Executors.newFixedThreadPool(8);
    try {
      List<Future<Integer>> futures = new ArrayList<>();
      for (int i = 0; i < 32; i++) {
        futures.add(pool.submit(() -> get("/").statusCode()));
      }
      for (Future<Integer> future : futures) {
        assertEquals(200, future.get(10, TimeUnit.SECONDS));
      }
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void scrapesDuringFlushesSeeWholeNonDecreasingCounts() throws Exception {
    SampleAdapter adapter = new SampleAdapter(catalog, new IdentityNamer("k6", ""), ExporterOptions.DEFAULT_BUCKETS);
    List<Sample> batch = List.of(
        Sample.of("http_reqs", MetricKind.COUNTER, 1, Map.of("status", "200")),
        Sample.of("http_reqs", MetricKind.COUNTER, 1, Map.of("status", "200")));
    AtomicBoolean flushing = new AtomicBoolean(true);
    Thread flusher = new Thread(() -> {
      while (flushing.get()) {
        adapter.apply(batch);
      }
    }, "test-flusher");
    ExecutorService scrapers = Executors.newFixedThreadPool(4);
    flusher.start();
    try {
      List<Future<Integer>> futures = new ArrayList<>();
      for (int i = 0; i < 4; i++) {
        futures.add(scrapers.submit(() -> {
          double previous = 0;
          for (int n = 0; n < 25; n++) {
            double value = reqsValue(get("/").body());
            assertEquals(Math.rint(value), value, "partial increment visible: " + value);
            assertTrue(value >= previous, "count went from " + previous + " to " + value);
            previous = value;
          }
          return 25;
        }));
      }
      for (Future<Integer> future : futures) {
        assertEquals(25, future.get(30, TimeUnit.SECONDS));
      }
    } finally {
      flushing.set(false);
      flusher.join(5_000);
      scrapers.shutdownNow();
    }
  }

  private static double reqsValue(String body) {
    String prefix = "k6_http_reqs{status=\"200\"} ";
    for (String line : body.split("\n")) {
      if (line.startsWith(prefix)) {
        return Double.parseDouble(line.substring(prefix.length()));
      }
    }
    throw new AssertionError("no k6_http_reqs series in\n" + body);
  }

  @Test
  void startTwiceIsRejected() {
    assertThrows(IllegalStateException.class, () -> endpoint.start("127.0.0.1", 0));
  }

  @Test
  void stopReleasesPortAndIsIdempotent() {
    endpoint.stop();
    endpoint.stop();

    assertThrows(IOException.class, () -> get("/"));
  }
}
