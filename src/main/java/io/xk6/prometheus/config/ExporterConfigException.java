package io.xk6.prometheus.config;

/**
 * Raised when the exporter option string or configuration file is invalid.
 * <p>Thrown synchronously from option parsing, before any listener or timer exists.</p>
 *
 * @since 0.1.0
 */
public final class ExporterConfigException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  public ExporterConfigException(String message) {
    super(message);
  }

  public ExporterConfigException(String message, Throwable cause) {
    super(message, cause);
  }
}
