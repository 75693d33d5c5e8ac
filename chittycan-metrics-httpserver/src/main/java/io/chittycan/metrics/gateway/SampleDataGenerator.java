// SPDX-License-Identifier: Apache-2.0
package io.chittycan.metrics.gateway;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Generates random gateway requests, so the exporter has something to show without a running gateway.
 * <p>
 * Each request picks a model and a tenant uniformly, takes 0.05 to 2 seconds and is served from the cache
 * with a probability of 70%. Requests that miss the cache cost 0.001 to 0.05 cents.
 */
public final class SampleDataGenerator {

    private static final Logger logger = LogManager.getLogger(SampleDataGenerator.class);

    public static final List<String> MODELS = List.of("gpt-4", "claude-sonnet", "groq/llama-3-70b");
    public static final List<String> TENANTS = List.of("tenant-a", "tenant-b", "tenant-c");

    public static final int DEFAULT_REQUESTS = 1000;

    private static final double MIN_DURATION_SECONDS = 0.05;
    private static final double MAX_DURATION_SECONDS = 2.0;
    private static final double CACHE_HIT_PROBABILITY = 0.7;
    private static final double MIN_COST_CENTS = 0.001;
    private static final double MAX_COST_CENTS = 0.05;

    private final Random random;

    /**
     * @param seed seed of the random generator, the same seed generates the same requests
     */
    public SampleDataGenerator(long seed) {
        this(new Random(seed));
    }

    public SampleDataGenerator(@NonNull Random random) {
        this.random = Objects.requireNonNull(random, "random must not be null");
    }

    /**
     * Records random requests.
     *
     * @param metrics  the metrics to record into
     * @param requests number of requests to record
     * @return number of recorded requests
     * @throws IllegalArgumentException if requests is negative
     */
    public int generate(@NonNull GatewayMetrics metrics, int requests) {
        Objects.requireNonNull(metrics, "metrics must not be null");
        if (requests < 0) {
            throw new IllegalArgumentException("Number of requests must not be negative, but was: " + requests);
        }

        logger.info("Generating {} sample requests", requests);
        for (int i = 0; i < requests; i++) {
            String model = MODELS.get(random.nextInt(MODELS.size()));
            String tenant = TENANTS.get(random.nextInt(TENANTS.size()));
            double duration = uniform(MIN_DURATION_SECONDS, MAX_DURATION_SECONDS);
            boolean cached = random.nextDouble() < CACHE_HIT_PROBABILITY;
            double cost = cached ? 0.0 : uniform(MIN_COST_CENTS, MAX_COST_CENTS);

            metrics.recordRequest(model, tenant, duration, cached, cost);
        }
        logger.info("Generated {} sample requests", requests);
        return requests;
    }

    private double uniform(double min, double max) {
        return min + (max - min) * random.nextDouble();
    }
}
