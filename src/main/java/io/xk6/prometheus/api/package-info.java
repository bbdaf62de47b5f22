/**
 * Entry points: the {@link io.xk6.prometheus.api.PrometheusOutput} lifecycle facade driven by a load engine and
 * the {@code xk6-prometheus run} command line.
 * <p><strong>Exit codes:</strong> see {@link io.xk6.prometheus.api.ExitCode}.</p>
 */
package io.xk6.prometheus.api;
