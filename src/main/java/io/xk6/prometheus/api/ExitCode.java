package io.xk6.prometheus.api;

import io.xk6.prometheus.config.ExporterConfigException;
import java.io.IOException;
import java.io.InterruptedIOException;

/**
 * Process exit codes of the {@code xk6-prometheus} executable.
 */
public enum ExitCode {
  SUCCESS(0),
  INVALID_ARGS(2),
  /** Listener could not be bound or an input file could not be read. */
  IO_ERROR(3),
  CONFIG_ERROR(4),
  RUNTIME_FAILURE(5),
  /** 128 + SIGINT. */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  /**
   * Exit code for a failure that ended the run command.
   *
   * @param failure exception that escaped the exporter
   * @return matching exit code
   */
  static ExitCode forFailure(Throwable failure) {
    if (failure instanceof ExporterConfigException) {
      return CONFIG_ERROR;
    }
    if (failure instanceof InterruptedException || failure instanceof InterruptedIOException) {
      return INTERRUPTED;
    }
    if (failure instanceof IOException) {
      return IO_ERROR;
    }
    return RUNTIME_FAILURE;
  }
}
