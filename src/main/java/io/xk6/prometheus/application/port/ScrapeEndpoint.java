package io.xk6.prometheus.application.port;

import java.io.IOException;
import java.net.InetSocketAddress;

/**
 * <strong>What:</strong> Port for the network listener that serves scrape requests.
 * <p><strong>Role:</strong> Started after configuration is validated and stopped on output shutdown.</p>
 * <p><strong>Thread-safety:</strong> {@link #stop()} may be called from any thread and more than once.</p>
 *
 * @since 0.1.0
 */
public interface ScrapeEndpoint {
  /**
   * Binds the listener and begins serving.
   *
   * @param host interface to bind; blank binds all interfaces
   * @param port TCP port; {@code 0} selects an ephemeral port
   * @return bound socket address
   * @throws IOException if the listener cannot be bound (e.g., port in use)
   * @throws IllegalStateException if already started
   */
  InetSocketAddress start(String host, int port) throws IOException;

  /**
   * Releases the listener. Idempotent; no-op when never started.
   */
  void stop();
}
