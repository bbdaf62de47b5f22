/**
 * <strong>Purpose:</strong> Validation helpers used during option parsing and CLI bootstrap.
 * <p><strong>Concurrency:</strong> Stateless utilities safe for concurrent invocation.
 * <p><strong>Observability:</strong> No direct metrics or logging; failures surface via {@link IllegalArgumentException}.
 *
 * @since 0.1.0
 */
package io.xk6.prometheus.validation;
