package io.xk6.prometheus.domain.sample;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> One time-stamped, labeled measurement produced by the load generator.
 * <p><strong>Why:</strong> Unit of work buffered by producers and folded into exported metrics on each flush.</p>
 * <p><strong>Role:</strong> Domain value object flowing from sample producers through the buffer to the adapter.</p>
 * <p><strong>Thread-safety:</strong> Immutable; tags are copied on construction.</p>
 *
 * @param name logical metric name as emitted by the engine (e.g., {@code http_req_duration}); never {@code null}
 * @param value observed value
 * @param timestamp observation time; never {@code null}
 * @param tags label key/value pairs; copied, must not contain {@code null} keys or values
 * @param kind declared metric type, or {@code null} when the producer did not supply one
 * @since 0.1.0
 */
public record Sample(String name, double value, Instant timestamp, Map<String, String> tags, MetricKind kind) {

  public Sample {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(timestamp, "timestamp");
    tags = tags == null ? Map.of() : Map.copyOf(tags);
  }

  /**
   * Creates a sample stamped with the current time.
   *
   * @param name metric name
   * @param kind declared metric type; may be {@code null}
   * @param value observed value
   * @param tags label pairs; may be {@code null}
   * @return new sample
   */
  public static Sample of(String name, MetricKind kind, double value, Map<String, String> tags) {
    return new Sample(name, value, Instant.now(), tags, kind);
  }

  /**
   * Returns the declared metric type, if the producer supplied one.
   *
   * @return optional kind hint
   */
  public Optional<MetricKind> kindHint() {
    return Optional.ofNullable(kind);
  }
}
