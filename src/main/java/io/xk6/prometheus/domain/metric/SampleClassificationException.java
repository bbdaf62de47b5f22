package io.xk6.prometheus.domain.metric;

/**
 * Raised when a single sample cannot be mapped onto exported metric state.
 * <p>Per-sample and non-fatal: the adapter logs the offending sample and continues with the batch.</p>
 *
 * @since 0.1.0
 */
public final class SampleClassificationException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  private final String identity;
  private final String field;

  /**
   * Creates a classification failure.
   *
   * @param identity metric identity (or raw name when no identity could be computed)
   * @param field sample field that caused the rejection (e.g., {@code tags}, {@code value}, {@code kind})
   * @param message human readable reason
   */
  public SampleClassificationException(String identity, String field, String message) {
    super(message);
    this.identity = identity;
    this.field = field;
  }

  /**
   * Identity of the rejected sample.
   *
   * @return identity or raw metric name
   */
  public String identity() {
    return identity;
  }

  /**
   * Field that failed classification.
   *
   * @return offending field name
   */
  public String field() {
    return field;
  }
}
