package io.xk6.prometheus.infrastructure.http;

import com.sun.net.httpserver.HttpServer;
import io.prometheus.client.CollectorRegistry;
import io.xk6.prometheus.application.port.MetricCatalog;
import io.xk6.prometheus.application.port.ScrapeEndpoint;
import io.xk6.prometheus.infrastructure.exec.ExecutorFactories;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.UnknownHostException;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ScrapeEndpoint} on the JDK HTTP server.
 * <p>Routes {@code /} to {@link ScrapeHandler} and {@code /debug/} to {@link DebugHandler}. Requests run on a
 * small pool of daemon threads so concurrent scrapes never wait on each other or on a flush.</p>
 *
 * @since 0.1.0
 */
public final class HttpScrapeEndpoint implements ScrapeEndpoint {
  private static final Logger log = LoggerFactory.getLogger(HttpScrapeEndpoint.class);
  static final int DEFAULT_WORKERS = 4;

  private final ScrapeHandler scrapeHandler;
  private final DebugHandler debugHandler;
  private final int workers;
  private final Object lock = new Object();
  private HttpServer server;
  private ExecutorService executor;

  public HttpScrapeEndpoint(CollectorRegistry registry, MetricCatalog catalog) {
    this(registry, catalog, DEFAULT_WORKERS);
  }

  public HttpScrapeEndpoint(CollectorRegistry registry, MetricCatalog catalog, int workers) {
    Objects.requireNonNull(catalog, "catalog");
    this.scrapeHandler = new ScrapeHandler(Objects.requireNonNull(registry, "registry"), catalog);
    this.debugHandler = new DebugHandler(catalog);
    if (workers <= 0) {
      throw new IllegalArgumentException("workers must be positive");
    }
    this.workers = workers;
  }

  @Override
  public InetSocketAddress start(String host, int port) throws IOException {
    synchronized (lock) {
      if (server != null) {
        throw new IllegalStateException("Scrape endpoint already started");
      }
      InetSocketAddress requested = host == null || host.isBlank()
          ? new InetSocketAddress(port)
          : new InetSocketAddress(host.trim(), port);
      if (requested.isUnresolved()) {
        throw new UnknownHostException("Cannot resolve listen host " + host);
      }
      HttpServer created = HttpServer.create(requested, 0);
      ExecutorService pool = ExecutorFactories.newHttpPool(workers, "scrape-http",
          (thread, ex) -> log.error("Scrape thread {} terminated unexpectedly", thread.getName(), ex));
      created.createContext("/", scrapeHandler);
      created.createContext("/debug/", debugHandler);
      created.setExecutor(pool);
      created.start();
      server = created;
      executor = pool;
      InetSocketAddress bound = created.getAddress();
      log.info("Serving metrics on {}:{}", host == null ? "" : host.trim(), bound.getPort());
      return bound;
    }
  }

  @Override
  public void stop() {
    synchronized (lock) {
      if (server == null) {
        return;
      }
      int port = server.getAddress().getPort();
      server.stop(0);
      executor.shutdownNow();
      log.debug("Scrape endpoint on port {} released", port);
      server = null;
      executor = null;
    }
  }
}
