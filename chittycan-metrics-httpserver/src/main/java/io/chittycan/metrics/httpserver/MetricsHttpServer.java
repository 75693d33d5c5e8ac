// SPDX-License-Identifier: Apache-2.0
package io.chittycan.metrics.httpserver;

import com.sun.net.httpserver.Headers;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import com.sun.net.httpserver.spi.HttpServerProvider;
import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import io.chittycan.metrics.core.MetricRegistrySnapshot;
import io.chittycan.metrics.core.MetricsExporter;
import io.chittycan.metrics.exposition.PrometheusTextWriter;
import io.chittycan.metrics.httpserver.config.MetricsHttpServerConfig;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import java.util.zip.GZIPOutputStream;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * An HTTP server that exposes metrics in the Prometheus text format.
 * <p>
 * The server listens on a configurable hostname and port. GET on the metrics path answers with a snapshot
 * of the registry, HEAD with the headers only. It supports gzip compression if the client indicates support
 * for it via the "Accept-Encoding" header. The health path answers {@code OK}, any other path 404.
 * <p>
 * Requests are served by a fixed pool of daemon threads; scrapes may run concurrently.
 */
public final class MetricsHttpServer implements MetricsExporter {

    private static final Logger logger = LogManager.getLogger(MetricsHttpServer.class);

    private static final byte[] HEALTH_BODY = "OK".getBytes(StandardCharsets.UTF_8);

    private final PrometheusTextWriter writer = new PrometheusTextWriter();
    private final ExecutorService executorService;

    private final HttpServer server;
    private final String metricsPath;
    private final String healthPath;
    private final int bufferSize;

    private final AtomicBoolean closed = new AtomicBoolean(false);

    private volatile Supplier<MetricRegistrySnapshot> snapshotSupplier;

    /**
     * Creates and starts the server.
     *
     * @param config server config
     * @throws IOException if the server can not bind to the configured address
     */
    public MetricsHttpServer(@NonNull MetricsHttpServerConfig config) throws IOException {
        Objects.requireNonNull(config, "metrics HTTP server config must not be null");

        metricsPath = config.metricsPath();
        healthPath = config.healthPath();
        bufferSize = config.bufferSize();

        final InetSocketAddress address;
        if (!config.hostname().isBlank()) {
            address = new InetSocketAddress(config.hostname(), config.port());
        } else {
            address = new InetSocketAddress(config.port());
        }

        // small accept backlog to absorb short bursts of scrape connections
        server = HttpServerProvider.provider().createHttpServer(address, 3);
        executorService = Executors.newFixedThreadPool(config.threads(), new DaemonThreadFactory());
        server.setExecutor(executorService);
        // root context, so unknown paths are answered here with 404
        server.createContext("/", this::handle);
        server.start();

        logger.info(
                "Metrics HTTP server started. hostname={}, port={}, metricsPath={}, healthPath={}",
                config.hostname(),
                port(),
                metricsPath,
                healthPath);
    }

    /**
     * @return the port the server listens on, the bound one if the config asked for port 0
     */
    public int port() {
        return server.getAddress().getPort();
    }

    @Override
    public void setSnapshotSupplier(@Nullable Supplier<MetricRegistrySnapshot> snapshotSupplier) {
        this.snapshotSupplier = snapshotSupplier;
    }

    void handle(HttpExchange exchange) {
        try {
            final String path = exchange.getRequestURI().getPath();
            if (metricsPath.equals(path)) {
                handleMetricsPath(exchange);
            } else if (healthPath.equals(path)) {
                handleHealthPath(exchange);
            } else {
                logger.debug("Unknown path requested: {}", path);
                exchange.sendResponseHeaders(404, -1);
            }
        } catch (RuntimeException e) {
            logger.warn("Unexpected error while handling request: {}", exchange.getRequestURI(), e);
            // only possible before the response is committed
            try {
                if (exchange.getResponseCode() == -1) {
                    exchange.sendResponseHeaders(500, -1);
                }
            } catch (IOException sendFailure) {
                logger.debug("Unable to send error response", sendFailure);
            }
        } catch (IOException e) {
            // client went away, usually while the body was being written
            logger.debug("I/O error while handling request: {}", exchange.getRequestURI(), e);
        } finally {
            exchange.close();
        }
    }

    private void handleMetricsPath(HttpExchange exchange) throws IOException {
        if ("GET".equalsIgnoreCase(exchange.getRequestMethod())) {
            handleGetRequest(exchange);
        } else if ("HEAD".equalsIgnoreCase(exchange.getRequestMethod())) {
            handleHeadRequest(exchange);
        } else {
            rejectMethod(exchange);
        }
    }

    private void handleHealthPath(HttpExchange exchange) throws IOException {
        final String method = exchange.getRequestMethod();
        if (!"GET".equalsIgnoreCase(method) && !"HEAD".equalsIgnoreCase(method)) {
            rejectMethod(exchange);
            return;
        }
        exchange.getResponseHeaders().set("Content-Type", "text/plain");
        exchange.getResponseHeaders().set("Cache-Control", "no-store");
        if ("HEAD".equalsIgnoreCase(method)) {
            exchange.sendResponseHeaders(200, -1);
        } else {
            exchange.sendResponseHeaders(200, HEALTH_BODY.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(HEALTH_BODY);
            }
        }
    }

    private void rejectMethod(HttpExchange exchange) throws IOException {
        exchange.getResponseHeaders().set("Allow", "GET, HEAD");
        exchange.sendResponseHeaders(405, -1);
    }

    private void handleHeadRequest(HttpExchange exchange) throws IOException {
        if (snapshotSupplier == null) {
            handleNoSnapshotSupplier(exchange);
        } else {
            setCommonOkResponseHeaders(exchange.getResponseHeaders());
            handleGzipHeaders(exchange);
            exchange.sendResponseHeaders(200, -1);
        }
    }

    private void handleGetRequest(HttpExchange exchange) throws IOException {
        final Supplier<MetricRegistrySnapshot> snapshotSupplierRef = this.snapshotSupplier;

        if (snapshotSupplierRef == null) {
            handleNoSnapshotSupplier(exchange);
            return;
        }

        MetricRegistrySnapshot registrySnapshot = snapshotSupplierRef.get();

        setCommonOkResponseHeaders(exchange.getResponseHeaders());
        boolean useGzip = handleGzipHeaders(exchange);

        exchange.sendResponseHeaders(200, 0);

        // Choose output stream based on compression and buffer size and send body
        OutputStream outputStream = exchange.getResponseBody();
        if (useGzip) {
            outputStream = new GZIPOutputStream(outputStream);
        }
        if (bufferSize != 0) {
            outputStream = new BufferedOutputStream(outputStream, bufferSize);
        }
        try (OutputStream os = outputStream) {
            writer.write(registrySnapshot, os);
        }
    }

    private void handleNoSnapshotSupplier(HttpExchange exchange) throws IOException {
        logger.info("No snapshot supplier configured yet. method={}", exchange.getRequestMethod());
        exchange.getResponseHeaders().set("Cache-Control", "no-store");
        exchange.sendResponseHeaders(204, -1); // No Content
    }

    private void setCommonOkResponseHeaders(Headers responseHeaders) {
        responseHeaders.set("Content-Type", PrometheusTextWriter.CONTENT_TYPE);
        responseHeaders.set("Cache-Control", "no-store");
        responseHeaders.set("Vary", "Accept-Encoding");
    }

    private boolean handleGzipHeaders(HttpExchange exchange) {
        List<String> encodingHeaders = exchange.getRequestHeaders().get("Accept-Encoding");
        if (encodingHeaders == null) {
            return false;
        }
        for (String encodingHeader : encodingHeaders) {
            String[] encodings = encodingHeader.split(",");
            for (String encoding : encodings) {
                // drop quality values such as "gzip;q=1.0"
                String name = encoding.split(";", 2)[0].trim();
                if (name.equalsIgnoreCase("gzip")) {
                    exchange.getResponseHeaders().set("Content-Encoding", "gzip");
                    return true;
                }
            }
        }
        return false;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        logger.info("Stopping metrics HTTP server...");
        server.stop(1);
        executorService.shutdownNow();
    }

    private static final class DaemonThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(@NonNull Runnable runnable) {
            Thread thread = new Thread(runnable, "metrics-http-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
