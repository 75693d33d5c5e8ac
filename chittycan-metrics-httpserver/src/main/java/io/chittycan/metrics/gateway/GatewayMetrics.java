// SPDX-License-Identifier: Apache-2.0
package io.chittycan.metrics.gateway;

import edu.umd.cs.findbugs.annotations.NonNull;
import io.chittycan.metrics.DerivedGauge;
import io.chittycan.metrics.DoubleCounter;
import io.chittycan.metrics.Histogram;
import io.chittycan.metrics.LongCounter;
import io.chittycan.metrics.core.InvalidDeltaException;
import io.chittycan.metrics.core.MetricFamily;
import io.chittycan.metrics.core.MetricKey;
import io.chittycan.metrics.core.MetricRegistry;
import java.util.List;
import java.util.Objects;

/**
 * Metrics of the ChittyCan gateway: requests, cache usage, cost, latency, provider fallbacks and
 * budget overruns.
 * <p>
 * Keys of all families are public constants, {@link #familyBuilders()} lists them in exposition order.
 * An instance records gateway events into the families of one {@link MetricRegistry}.
 */
public final class GatewayMetrics {

    public static final String MODEL_LABEL = "model";
    public static final String TENANT_LABEL = "tenant";
    public static final String FROM_MODEL_LABEL = "from_model";
    public static final String TO_MODEL_LABEL = "to_model";

    public static final MetricKey<LongCounter> REQUESTS = LongCounter.key("chitty_requests_total");
    public static final MetricKey<LongCounter> CACHE_HITS = LongCounter.key("chitty_cache_hits_total");
    public static final MetricKey<LongCounter> CACHE_REQUESTS = LongCounter.key("chitty_cache_requests_total");
    public static final MetricKey<DerivedGauge> CACHE_HIT_RATE = DerivedGauge.key("chitty_cache_hit_rate");
    public static final MetricKey<DoubleCounter> COST_CENTS = DoubleCounter.key("chitty_cost_cents_total");
    public static final MetricKey<Histogram> REQUEST_DURATION = Histogram.key("chitty_request_duration_seconds");
    public static final MetricKey<LongCounter> FALLBACK_EVENTS = LongCounter.key("chitty_fallback_events_total");
    public static final MetricKey<LongCounter> BUDGET_OVERRUNS = LongCounter.key("chitty_budget_overruns_total");

    private final LongCounter requests;
    private final LongCounter cacheHits;
    private final LongCounter cacheRequests;
    private final DoubleCounter costCents;
    private final Histogram requestDuration;
    private final LongCounter fallbackEvents;
    private final LongCounter budgetOverruns;

    /**
     * Binds to the gateway families of the registry, registering those that are missing.
     *
     * @param registry the registry to record into
     */
    public GatewayMetrics(@NonNull MetricRegistry registry) {
        Objects.requireNonNull(registry, "registry must not be null");
        for (MetricFamily.Builder<?, ?> builder : familyBuilders()) {
            if (!registry.containsFamily(builder.key())) {
                registry.register(builder);
            }
        }

        requests = registry.getFamily(REQUESTS);
        cacheHits = registry.getFamily(CACHE_HITS);
        cacheRequests = registry.getFamily(CACHE_REQUESTS);
        costCents = registry.getFamily(COST_CENTS);
        requestDuration = registry.getFamily(REQUEST_DURATION);
        fallbackEvents = registry.getFamily(FALLBACK_EVENTS);
        budgetOverruns = registry.getFamily(BUDGET_OVERRUNS);
    }

    /**
     * @return builders of all gateway families, in exposition order
     */
    @NonNull
    public static List<MetricFamily.Builder<?, ?>> familyBuilders() {
        return List.of(
                LongCounter.builder(REQUESTS)
                        .setHelp("Total number of requests")
                        .addLabelNames(MODEL_LABEL, TENANT_LABEL),
                LongCounter.builder(CACHE_HITS)
                        .setHelp("Total number of cache hits")
                        .addLabelNames(MODEL_LABEL),
                LongCounter.builder(CACHE_REQUESTS)
                        .setHelp("Total number of cacheable requests")
                        .addLabelNames(MODEL_LABEL),
                DerivedGauge.builder(CACHE_HIT_RATE)
                        .setHelp("Cache hit rate ratio (hits/requests)")
                        .addLabelNames(MODEL_LABEL)
                        .ratio(CACHE_HITS.name(), CACHE_REQUESTS.name()),
                DoubleCounter.builder(COST_CENTS)
                        .setHelp("Total cost in USD cents")
                        .setFractionDigits(2)
                        .addLabelNames(MODEL_LABEL, TENANT_LABEL),
                Histogram.builder(REQUEST_DURATION)
                        .setHelp("Request duration in seconds")
                        .setFractionDigits(4)
                        .addLabelNames(MODEL_LABEL),
                LongCounter.builder(FALLBACK_EVENTS)
                        .setHelp("Total number of provider fallback events")
                        .addLabelNames(FROM_MODEL_LABEL, TO_MODEL_LABEL),
                LongCounter.builder(BUDGET_OVERRUNS)
                        .setHelp("Total number of budget overrun incidents")
                        .addLabelNames(TENANT_LABEL));
    }

    /**
     * Records a completed request. Every request is cacheable and counted as a cache request of its model.
     *
     * @param model           model that served the request
     * @param tenant          tenant that sent the request
     * @param durationSeconds request duration in seconds
     * @param cached          whether the response came from the cache
     * @param costCentsAmount cost of the request in USD cents, {@code 0} for cached responses
     * @throws IllegalArgumentException if the duration is NaN, or the cost is negative or NaN;
     *                                  nothing is recorded then
     */
    public void recordRequest(
            @NonNull String model,
            @NonNull String tenant,
            double durationSeconds,
            boolean cached,
            double costCentsAmount) {
        Objects.requireNonNull(model, "model must not be null");
        Objects.requireNonNull(tenant, "tenant must not be null");
        if (Double.isNaN(durationSeconds)) {
            throw new IllegalArgumentException("Request duration must not be NaN for " + REQUEST_DURATION.name());
        }
        if (Double.isNaN(costCentsAmount) || costCentsAmount < 0.0) {
            throw new InvalidDeltaException(COST_CENTS.name(), costCentsAmount);
        }

        requests.getOrCreate(MODEL_LABEL, model, TENANT_LABEL, tenant).increment();
        cacheRequests.getOrCreate(MODEL_LABEL, model).increment();
        if (cached) {
            cacheHits.getOrCreate(MODEL_LABEL, model).increment();
        }
        costCents.getOrCreate(MODEL_LABEL, model, TENANT_LABEL, tenant).increment(costCentsAmount);
        requestDuration.getOrCreate(MODEL_LABEL, model).observe(durationSeconds);
    }

    /**
     * Records a fallback from one provider model to another.
     *
     * @param fromModel the model that failed
     * @param toModel   the model that took over
     */
    public void recordFallback(@NonNull String fromModel, @NonNull String toModel) {
        fallbackEvents
                .getOrCreate(FROM_MODEL_LABEL, fromModel, TO_MODEL_LABEL, toModel)
                .increment();
    }

    /**
     * Records a request rejected because the tenant exceeded its budget.
     *
     * @param tenant the tenant
     */
    public void recordBudgetOverrun(@NonNull String tenant) {
        budgetOverruns.getOrCreate(TENANT_LABEL, tenant).increment();
    }
}
