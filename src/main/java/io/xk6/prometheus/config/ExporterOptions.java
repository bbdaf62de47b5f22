package io.xk6.prometheus.config;

import java.util.List;
import java.util.Objects;

/**
 * Parsed exporter options.
 *
 * @param port listen port; {@code 0} asks the OS for an ephemeral port
 * @param host listen host; empty means all interfaces
 * @param namespace identity prefix segment; may be empty
 * @param subsystem identity prefix segment placed after the namespace; may be empty
 * @param buckets strictly increasing bucket boundaries used for trend distributions
 * @since 0.1.0
 */
public record ExporterOptions(int port, String host, String namespace, String subsystem, List<Double> buckets) {
  public static final int DEFAULT_PORT = 5656;
  public static final List<Double> DEFAULT_BUCKETS =
      List.of(1d, 2.5d, 5d, 10d, 25d, 50d, 100d, 250d, 500d, 1000d, 2500d, 5000d, 10000d);

  public ExporterOptions {
    if (port < 0 || port > 65535) {
      throw new ExporterConfigException("port must be between 0 and 65535 (was " + port + ")");
    }
    host = Objects.requireNonNullElse(host, "");
    namespace = Objects.requireNonNullElse(namespace, "");
    subsystem = Objects.requireNonNullElse(subsystem, "");
    buckets = List.copyOf(Objects.requireNonNullElse(buckets, DEFAULT_BUCKETS));
    if (buckets.isEmpty()) {
      throw new ExporterConfigException("buckets must not be empty");
    }
  }

  /**
   * Options used when the option string is empty.
   *
   * @return defaults: port 5656, all interfaces, no prefix, default buckets
   */
  public static ExporterOptions defaults() {
    return new ExporterOptions(DEFAULT_PORT, "", "", "", DEFAULT_BUCKETS);
  }

  /**
   * Listen address in {@code host:port} form.
   *
   * @return address string; the host part is empty for all interfaces
   */
  public String address() {
    return host + ":" + port;
  }
}
