/**
 * HTTP adapters serving the pull endpoint and diagnostics on the JDK HTTP server.
 */
package io.xk6.prometheus.infrastructure.http;
