package io.xk6.prometheus.application.port;

/**
 * Outcome of applying one batch of samples.
 *
 * @param applied samples folded into metric state
 * @param dropped samples rejected by classification
 * @since 0.1.0
 */
public record ApplyResult(int applied, int dropped) {
  /** Result of an empty batch. */
  public static final ApplyResult EMPTY = new ApplyResult(0, 0);

  /**
   * Total samples seen.
   *
   * @return applied plus dropped
   */
  public int total() {
    return applied + dropped;
  }
}
