/**
 * Time source adapters.
 */
package io.xk6.prometheus.infrastructure.time;
