package io.xk6.prometheus.domain.metric;

import io.xk6.prometheus.domain.sample.MetricKind;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Metrics emitted by the k6 engine itself, with their declared type and documented meaning.
 *
 * @since 0.1.0
 */
public enum BuiltinMetric {
  VUS("vus", MetricKind.GAUGE, "Current number of active virtual users"),
  VUS_MAX("vus_max", MetricKind.GAUGE, "Max possible number of virtual users"),
  ITERATIONS("iterations", MetricKind.COUNTER, "The aggregate number of times the VUs in the test have executed"),
  ITERATION_DURATION("iteration_duration", MetricKind.TREND, "The time it took to complete one full iteration"),
  DROPPED_ITERATIONS("dropped_iterations", MetricKind.COUNTER, "The number of iterations that could not be started"),
  DATA_RECEIVED("data_received", MetricKind.COUNTER, "The amount of received data"),
  DATA_SENT("data_sent", MetricKind.COUNTER, "The amount of data sent"),
  CHECKS("checks", MetricKind.RATE, "The rate of successful checks"),
  GROUP_DURATION("group_duration", MetricKind.TREND, "Time to execute a group"),
  HTTP_REQS("http_reqs", MetricKind.COUNTER, "How many HTTP requests has k6 generated, in total"),
  HTTP_REQ_BLOCKED("http_req_blocked", MetricKind.TREND, "Time spent blocked before initiating the request"),
  HTTP_REQ_CONNECTING("http_req_connecting", MetricKind.TREND, "Time spent establishing TCP connection"),
  HTTP_REQ_TLS_HANDSHAKING("http_req_tls_handshaking", MetricKind.TREND, "Time spent handshaking TLS session"),
  HTTP_REQ_SENDING("http_req_sending", MetricKind.TREND, "Time spent sending data"),
  HTTP_REQ_WAITING("http_req_waiting", MetricKind.TREND, "Time spent waiting for response"),
  HTTP_REQ_RECEIVING("http_req_receiving", MetricKind.TREND, "Time spent receiving response data"),
  HTTP_REQ_DURATION("http_req_duration", MetricKind.TREND, "Total time for the request"),
  HTTP_REQ_FAILED("http_req_failed", MetricKind.RATE, "The rate of failed requests"),
  WS_CONNECTING("ws_connecting", MetricKind.TREND, "Total duration for the WebSocket connection request"),
  WS_SESSION_DURATION("ws_session_duration", MetricKind.TREND, "Duration of the WebSocket session"),
  WS_PING("ws_ping", MetricKind.TREND, "Duration between a ping request and its pong reception"),
  WS_SESSIONS("ws_sessions", MetricKind.COUNTER, "Total number of started WebSocket sessions"),
  WS_MSGS_SENT("ws_msgs_sent", MetricKind.COUNTER, "Total number of messages sent"),
  WS_MSGS_RECEIVED("ws_msgs_received", MetricKind.COUNTER, "Total number of received messages"),
  GRPC_REQ_DURATION("grpc_req_duration", MetricKind.TREND, "Time to receive response from remote host");

  private static final Map<String, BuiltinMetric> BY_NAME = new HashMap<>();

  static {
    for (BuiltinMetric metric : values()) {
      BY_NAME.put(metric.metricName, metric);
    }
  }

  private final String metricName;
  private final MetricKind kind;
  private final String help;

  BuiltinMetric(String metricName, MetricKind kind, String help) {
    this.metricName = metricName;
    this.kind = kind;
    this.help = help;
  }

  /**
   * Looks up a built-in metric by its k6 name.
   *
   * @param name logical metric name
   * @return matching built-in metric, if any
   */
  public static Optional<BuiltinMetric> byName(String name) {
    return name == null ? Optional.empty() : Optional.ofNullable(BY_NAME.get(name.trim()));
  }

  /**
   * Produces the help text published with a metric family.
   *
   * @param name logical metric name
   * @param kind k6 metric type of the samples
   * @param suffix optional qualifier appended in parentheses (e.g., {@code current}); may be {@code null}
   * @return documented meaning for built-ins, otherwise a generic description
   */
  public static String helpFor(String name, MetricKind kind, String suffix) {
    String base = byName(name).map(BuiltinMetric::help).orElse("k6 " + kind.typeName() + " " + name);
    return suffix == null || suffix.isBlank() ? base : base + " (" + suffix + ")";
  }

  public String metricName() {
    return metricName;
  }

  public MetricKind kind() {
    return kind;
  }

  public String help() {
    return help;
  }
}
