package io.xk6.prometheus.infrastructure.ingest;

import io.xk6.prometheus.domain.sample.MetricKind;
import io.xk6.prometheus.domain.sample.Sample;
import io.xk6.prometheus.infrastructure.ingest.K6RecordParser.K6Record;
import io.xk6.prometheus.logging.Logs;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses k6 JSON output ({@code k6 run --out json=...}) one line at a time.
 * <p>{@code Metric} records declare a metric's type and are remembered; {@code Point} records become samples
 * whose kind hint comes from the remembered declaration, if any. Blank lines yield nothing, malformed lines
 * are logged and skipped.</p>
 * <p>Not thread-safe; one reader per stream.</p>
 *
 * @since 0.1.0
 */
public final class NdjsonSampleReader {
  private static final Logger log = LoggerFactory.getLogger(NdjsonSampleReader.class);
  private static final int LOG_LINE_BYTES = 256;

  private final K6RecordParser parser = new K6RecordParser();
  private final Map<String, MetricKind> declaredKinds = new HashMap<>();
  private long malformedLines;

  /**
   * Parses one line.
   *
   * @param line raw NDJSON line; may be {@code null} or blank
   * @return the sample for a {@code Point} record, empty otherwise
   */
  public Optional<Sample> parseLine(String line) {
    if (line == null || line.isBlank()) {
      return Optional.empty();
    }
    try {
      K6Record record = parser.parse(line);
      if ("Metric".equals(record.type())) {
        declare(record);
        return Optional.empty();
      }
      if ("Point".equals(record.type())) {
        return Optional.of(toSample(record));
      }
      log.debug("Ignoring k6 record of type {}", record.type());
      return Optional.empty();
    } catch (IllegalArgumentException ex) {
      malformedLines++;
      log.warn("Skipping malformed k6 JSON line ({}): {}",
          Logs.safe(ex.getMessage(), LOG_LINE_BYTES), Logs.safe(line, LOG_LINE_BYTES));
      return Optional.empty();
    }
  }

  /**
   * Kind declared by a {@code Metric} record.
   *
   * @param metric metric name
   * @return declared kind, if a declaration was seen
   */
  public Optional<MetricKind> declaredKind(String metric) {
    return Optional.ofNullable(declaredKinds.get(metric));
  }

  public long malformedLines() {
    return malformedLines;
  }

  private void declare(K6Record record) {
    if (!record.hasData()) {
      throw new IllegalArgumentException("data must be a JSON object");
    }
    String metric = record.dataName() != null ? record.dataName() : record.metric();
    if (metric == null || metric.isBlank()) {
      throw new IllegalArgumentException("Metric record without a name");
    }
    MetricKind kind = MetricKind.fromTypeName(record.dataType())
        .orElseThrow(() -> new IllegalArgumentException(
            "Metric " + metric + " has unknown type " + record.dataType()));
    declaredKinds.put(metric, kind);
  }

  private Sample toSample(K6Record record) {
    String name = record.metric();
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Point record without a metric name");
    }
    if (!record.hasData()) {
      throw new IllegalArgumentException("data must be a JSON object");
    }
    if (record.value() == null) {
      throw new IllegalArgumentException("Point record for " + name + " has no value");
    }
    return new Sample(name, record.value(), timestamp(record.time()), record.tags(), declaredKinds.get(name));
  }

  private static Instant timestamp(String text) {
    if (text != null) {
      try {
        return OffsetDateTime.parse(text).toInstant();
      } catch (DateTimeParseException ex) {
        log.debug("Unparseable sample time {}; using current time", text);
      }
    }
    return Instant.now();
  }
}
