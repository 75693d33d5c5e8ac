// SPDX-License-Identifier: Apache-2.0
package io.chittycan.metrics.httpserver.config;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Configuration for the metrics HTTP server, read from properties under {@value #PREFIX}.
 *
 * @param enabled whether the server is enabled (default: true)
 * @param hostname the hostname to bind to, while empty means all interfaces (default: empty)
 * @param port the port to listen on (default: 9090, range: 0-65535, 0 = any free port)
 * @param metricsPath the HTTP path to serve metrics on (default: /metrics)
 * @param healthPath the HTTP path answering health checks (default: /health)
 * @param bufferSize the buffer size for HTTP response output stream (default: 1024, range: 0-2mb, 0 = no buffering)
 * @param threads number of threads serving requests (default: 2, range: 1-64)
 */
public record MetricsHttpServerConfig(
        boolean enabled,
        @NonNull String hostname,
        int port,
        @NonNull String metricsPath,
        @NonNull String healthPath,
        int bufferSize,
        int threads) {

    public static final String PREFIX = "metrics.exporter.http";

    public static final int MAX_PORT = 65535;
    public static final int MAX_BUFFER_SIZE = 2 * 1024 * 1024;
    public static final int MAX_THREADS = 64;

    public static final MetricsHttpServerConfig DEFAULT =
            new MetricsHttpServerConfig(true, "", 9090, "/metrics", "/health", 1024, 2);

    /**
     * @throws IllegalArgumentException if a value is out of range, or a path is invalid
     */
    public MetricsHttpServerConfig {
        hostname = hostname == null ? "" : hostname.trim();
        checkRange("port", port, 0, MAX_PORT);
        checkRange("bufferSize", bufferSize, 0, MAX_BUFFER_SIZE);
        checkRange("threads", threads, 1, MAX_THREADS);
        checkPath("metricsPath", metricsPath);
        checkPath("healthPath", healthPath);
        if (metricsPath.equals(healthPath)) {
            throw new IllegalArgumentException(
                    PREFIX + ".metricsPath and " + PREFIX + ".healthPath must differ, but both are: " + metricsPath);
        }
    }

    /**
     * @param port the new port
     * @return a copy of this config listening on the given port
     */
    @NonNull
    public MetricsHttpServerConfig withPort(int port) {
        return new MetricsHttpServerConfig(enabled, hostname, port, metricsPath, healthPath, bufferSize, threads);
    }

    /**
     * @param hostname the new hostname, empty for all interfaces
     * @return a copy of this config bound to the given hostname
     */
    @NonNull
    public MetricsHttpServerConfig withHostname(@Nullable String hostname) {
        return new MetricsHttpServerConfig(enabled, hostname, port, metricsPath, healthPath, bufferSize, threads);
    }

    private static void checkRange(String property, int value, int min, int max) {
        if (value < min || value > max) {
            throw new IllegalArgumentException(PREFIX + "." + property + " must be in range " + min + ".." + max
                    + ", but was: " + value);
        }
    }

    private static void checkPath(String property, String path) {
        if (path == null || !path.startsWith("/") || path.chars().anyMatch(Character::isWhitespace)) {
            throw new IllegalArgumentException(
                    PREFIX + "." + property + " must start with '/' and contain no whitespace, but was: " + path);
        }
    }
}
