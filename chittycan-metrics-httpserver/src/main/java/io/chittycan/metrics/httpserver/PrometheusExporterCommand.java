// SPDX-License-Identifier: Apache-2.0
package io.chittycan.metrics.httpserver;

import edu.umd.cs.findbugs.annotations.NonNull;
import io.chittycan.metrics.core.MetricRegistry;
import io.chittycan.metrics.gateway.GatewayMetrics;
import io.chittycan.metrics.gateway.SampleDataGenerator;
import io.chittycan.metrics.httpserver.config.MetricsHttpServerConfig;
import io.chittycan.metrics.httpserver.config.MetricsHttpServerConfigLoader;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.Random;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

/**
 * Runs a standalone exporter serving the ChittyCan gateway metrics to Prometheus, until the JVM is stopped.
 */
@Command(
        name = "chittycan-prometheus-exporter",
        mixinStandardHelpOptions = true,
        description = "Exports ChittyCan gateway metrics in Prometheus format.")
public final class PrometheusExporterCommand implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(PrometheusExporterCommand.class);

    static final int EXIT_DISABLED = 1;
    static final int EXIT_INVALID_CONFIG = 2;

    @Spec
    private CommandSpec spec;

    @Option(
            names = {"-p", "--port"},
            description = "Port to listen on, 0 for any free port. Overrides the config (default: 9090).")
    private Integer port;

    @Option(
            names = {"--host"},
            description = "Hostname to bind to, all interfaces when empty. Overrides the config.")
    private String host;

    @Option(
            names = {"-c", "--config"},
            description = "Properties file with " + MetricsHttpServerConfig.PREFIX + ".* settings.")
    private Path configFile;

    @Option(
            names = {"--sample-data"},
            description = "Generate sample data.")
    private boolean sampleData;

    @Option(
            names = {"--sample-size"},
            defaultValue = "" + SampleDataGenerator.DEFAULT_REQUESTS,
            description = "Number of sample requests (default: ${DEFAULT-VALUE}).")
    private int sampleSize;

    @Option(
            names = {"--seed"},
            description = "Seed for the sample data, random when not set.")
    private Long seed;

    private final CountDownLatch stopped = new CountDownLatch(1);

    private MetricRegistry registry;
    private MetricsHttpServer server;

    public static void main(final String[] args) {
        final int exitCode = new CommandLine(new PrometheusExporterCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        final MetricsHttpServerConfig config;
        try {
            config = resolveConfig();
        } catch (IllegalArgumentException e) {
            spec.commandLine().getErr().println("Invalid configuration: " + e.getMessage());
            return EXIT_INVALID_CONFIG;
        } catch (IOException e) {
            spec.commandLine().getErr().println("Invalid configuration: unable to read " + configFile + ": " + e);
            return EXIT_INVALID_CONFIG;
        }

        if (!config.enabled()) {
            logger.warn("Metrics HTTP server is disabled by {}.enabled", MetricsHttpServerConfig.PREFIX);
            return EXIT_DISABLED;
        }

        start(config);
        Runtime.getRuntime().addShutdownHook(new Thread(this::stop, "exporter-shutdown"));
        stopped.await();
        return 0;
    }

    /**
     * @return the config file and system properties, overridden by the command line options
     */
    @NonNull
    MetricsHttpServerConfig resolveConfig() throws IOException {
        MetricsHttpServerConfig config = MetricsHttpServerConfigLoader.load(configFile);
        if (port != null) {
            config = config.withPort(port);
        }
        if (host != null) {
            config = config.withHostname(host);
        }
        return config;
    }

    void start(@NonNull MetricsHttpServerConfig config) throws IOException {
        server = new MetricsHttpServer(config);
        final PrintWriter out = spec.commandLine().getOut();
        try {
            registry = MetricRegistry.builder()
                    .setMetricsExporter(server)
                    .discoverMetricProviders()
                    .build();
            final GatewayMetrics metrics = new GatewayMetrics(registry);

            if (sampleData) {
                out.println("Generating sample metrics...");
                SampleDataGenerator generator =
                        seed != null ? new SampleDataGenerator(seed) : new SampleDataGenerator(new Random());
                int generated = generator.generate(metrics, sampleSize);
                out.println("Generated " + generated + " sample requests");
            }
        } catch (RuntimeException e) {
            logger.error("Failed to start exporter, stopping metrics HTTP server", e);
            server.close();
            throw e;
        }

        printBanner(out, config);
    }

    void stop() {
        try {
            if (registry != null) {
                registry.close();
            }
        } catch (IOException e) {
            logger.warn("Failed to close metrics registry", e);
        } finally {
            stopped.countDown();
        }
    }

    /**
     * @return the port the server listens on
     * @throws IllegalStateException if the server is not started
     */
    int port() {
        if (server == null) {
            throw new IllegalStateException("Exporter is not started");
        }
        return server.port();
    }

    private void printBanner(PrintWriter out, MetricsHttpServerConfig config) {
        final String target = (config.hostname().isEmpty() ? "localhost" : config.hostname()) + ":" + port();

        out.println("ChittyCan Prometheus Exporter");
        out.println("Listening on http://" + target + config.metricsPath());
        out.println("Health check: http://" + target + config.healthPath());
        out.println();
        out.println("Prometheus scrape config:");
        out.println("  - job_name: 'chittycan'");
        if (!"/metrics".equals(config.metricsPath())) {
            out.println("    metrics_path: '" + config.metricsPath() + "'");
        }
        out.println("    static_configs:");
        out.println("      - targets: ['" + target + "']");
        out.println();
        out.flush();
    }
}
