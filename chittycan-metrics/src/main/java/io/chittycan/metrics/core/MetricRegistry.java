// SPDX-License-Identifier: Apache-2.0
package io.chittycan.metrics.core;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import io.chittycan.metrics.DoubleCounter;
import io.chittycan.metrics.Histogram;
import io.chittycan.metrics.LongCounter;
import java.io.Closeable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * A thread-safe registry for {@link MetricFamily} instances. It allows registering new families by their builders,
 * retrieving existing families by their {@link MetricKey}, recording counter increments and histogram observations
 * by family name, and taking immutable snapshots of all families.
 * <p>
 * New registry can be created via {@link #builder()} using builder pattern.
 * <p>
 * Metric registry can optionally be associated with a {@link MetricsExporter} to export
 * the metrics snapshots to an external system. It can be set during the registry creation via
 * {@link Builder#setMetricsExporter(MetricsExporter)}.
 * It implements {@link Closeable} to allow closing associated {@link MetricsExporter}, if present.
 * <p>
 * Recording operations validate their arguments before changing anything: a recording that throws leaves the
 * registry exactly as it was.
 */
public final class MetricRegistry implements Closeable {

    private static final Logger logger = LogManager.getLogger(MetricRegistry.class);

    @Nullable
    private final MetricsExporter exporter;

    private final Map<String, MetricFamily> families = new ConcurrentHashMap<>();
    // registration order, appended while holding the map bin of the family name
    private final List<MetricFamily> registrationOrder = new CopyOnWriteArrayList<>();
    private final List<MetricFamily> familiesView = Collections.unmodifiableList(registrationOrder);

    private MetricRegistry(@Nullable MetricsExporter exporter) {
        this.exporter = exporter;

        if (exporter != null) {
            exporter.setSnapshotSupplier(this::snapshot);
            logger.info("Created metric registry. exporter={}", exporter.getClass().getName());
        } else {
            logger.info("Created metric registry without exporter.");
        }
    }

    /**
     * @return a new {@link Builder} for constructing {@link MetricRegistry} instance.
     */
    @NonNull
    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return {@code true} if this registry has an associated {@link MetricsExporter}, {@code false} otherwise
     */
    public boolean hasMetricsExporter() {
        return exporter != null;
    }

    /**
     * @return unmodifiable list of all registered families in registration order, may be empty but never {@code null}
     */
    @NonNull
    public List<MetricFamily> families() {
        return familiesView;
    }

    /**
     * Creates and registers a family using the given builder.
     * <p>
     * This method is <b>not idempotent</b> and throws an exception, if a family with the same name is already
     * registered.
     *
     * @param builder the family builder, must not be {@code null}
     * @param <F>     the type of the family to be created and registered
     * @param <B>     the type of the builder that creates the family
     * @return the created and registered family, never {@code null}
     * @throws NullPointerException     if the builder is {@code null}
     * @throws IllegalArgumentException if a family with the same name already exists in the registry
     */
    @NonNull
    public <F extends MetricFamily, B extends MetricFamily.Builder<?, F>> F register(final @NonNull B builder) {
        Objects.requireNonNull(builder, "metric builder must not be null");

        final MetricKey<F> metricKey = builder.key();

        return metricKey.type().cast(families.compute(metricKey.name(), (name, existingFamily) -> {
            if (existingFamily != null) {
                throw new IllegalArgumentException(
                        "Duplicate metric name: " + metricKey + ". Existing family: " + existingFamily);
            }

            F family = builder.build();
            registrationOrder.add(family);
            logger.debug("Registered metric family. name={}, type={}", family.name(), family.type());
            return family;
        }));
    }

    /**
     * Checks if a family with the given key is registered in the registry.
     * Family to be found has to have the same name as the provided key and be of compatible type.
     *
     * @param key the metric key, must not be {@code null}
     * @return {@code true} if a family with the given key is registered, {@code false} otherwise
     * @throws NullPointerException if the key is {@code null}
     */
    public boolean containsFamily(@NonNull MetricKey<?> key) {
        Objects.requireNonNull(key, "metric key must not be null");
        MetricFamily family = families.get(key.name());
        return key.type().isInstance(family);
    }

    /**
     * Gets a family by its key.
     * Family to be found has to have the same name as the provided key and be of compatible type.
     *
     * @param key the metric key, must not be {@code null}
     * @param <F> the type of the family
     * @return the found family, never {@code null}
     * @throws NullPointerException   if the key is {@code null}
     * @throws NoSuchElementException if no family is found for the given key name
     * @throws ClassCastException     if the family found with the given key name is not of the expected key type
     */
    @NonNull
    public <F extends MetricFamily> F getFamily(@NonNull MetricKey<F> key) {
        Objects.requireNonNull(key, "metric key must not be null");
        MetricFamily family = families.get(key.name());
        if (family == null) {
            throw new NoSuchElementException("Metric family not found: " + key);
        }
        return key.type().cast(family);
    }

    /**
     * Adds {@code delta} to the counter series identified by family name and labels.
     * <p>
     * If no family is registered under the name, a {@link LongCounter} with empty help is registered first.
     * The series is created lazily, the first series of a family without declared label names fixes its shape.
     *
     * @param familyName the counter family name
     * @param labels     the series labels
     * @param delta      non-negative increment
     * @throws InvalidDeltaException       if {@code delta} is negative
     * @throws LabelShapeMismatchException if the label names differ from the family's shape
     * @throws IllegalArgumentException    if the name is invalid or names a family that is not a counter
     */
    public void recordCounter(@NonNull String familyName, @NonNull LabelSet labels, long delta) {
        MetricUtils.validateMetricNameCharacters(familyName);
        Objects.requireNonNull(labels, "labels must not be null");
        if (delta < 0L) {
            throw new InvalidDeltaException(familyName, delta);
        }

        MetricFamily family = getOrRegister(familyName, name -> LongCounter.builder(name));
        if (family instanceof LongCounter longCounter) {
            longCounter.getOrCreate(labels).increment(delta);
        } else if (family instanceof DoubleCounter doubleCounter) {
            doubleCounter.getOrCreate(labels).increment((double) delta);
        } else {
            throw new IllegalArgumentException("Metric family is not a counter: " + family);
        }
    }

    /**
     * Adds {@code delta} to the counter series identified by family name and labels.
     * <p>
     * If no family is registered under the name, a {@link DoubleCounter} with empty help is registered first.
     * A {@code double} delta can not be added to a {@link LongCounter} family.
     *
     * @param familyName the counter family name
     * @param labels     the series labels
     * @param delta      non-negative increment
     * @throws InvalidDeltaException       if {@code delta} is negative or NaN
     * @throws LabelShapeMismatchException if the label names differ from the family's shape
     * @throws IllegalArgumentException    if the name is invalid or names a family that is not a double counter
     */
    public void recordCounter(@NonNull String familyName, @NonNull LabelSet labels, double delta) {
        MetricUtils.validateMetricNameCharacters(familyName);
        Objects.requireNonNull(labels, "labels must not be null");
        if (Double.isNaN(delta) || delta < 0.0) {
            throw new InvalidDeltaException(familyName, delta);
        }

        MetricFamily family = getOrRegister(familyName, name -> DoubleCounter.builder(name));
        if (family instanceof DoubleCounter doubleCounter) {
            doubleCounter.getOrCreate(labels).increment(delta);
        } else if (family instanceof LongCounter) {
            throw new IllegalArgumentException("Metric family counts integers, use a long delta: " + family);
        } else {
            throw new IllegalArgumentException("Metric family is not a counter: " + family);
        }
    }

    /**
     * Records an observation into the histogram series identified by family name and labels.
     * The histogram family must be registered, its bucket bounds are fixed at registration.
     *
     * @param familyName the histogram family name
     * @param labels     the series labels
     * @param value      the observed value
     * @throws UnknownBucketsException     if no histogram family is registered under the name
     * @throws LabelShapeMismatchException if the label names differ from the family's shape
     * @throws IllegalArgumentException    if the value is NaN
     */
    public void recordHistogramObservation(@NonNull String familyName, @NonNull LabelSet labels, double value) {
        Objects.requireNonNull(familyName, "family name must not be null");
        Objects.requireNonNull(labels, "labels must not be null");
        if (Double.isNaN(value)) {
            throw new IllegalArgumentException("Observed value must not be NaN for " + familyName);
        }

        if (families.get(familyName) instanceof Histogram histogram) {
            histogram.getOrCreate(labels).observe(value);
        } else {
            throw new UnknownBucketsException(familyName);
        }
    }

    /**
     * Takes an immutable snapshot of all families in registration order.
     * <p>
     * Each series is copied atomically. Derived families are evaluated against the copied stored families,
     * so values in one snapshot are consistent with each other.
     *
     * @return the snapshot, never {@code null}
     */
    @NonNull
    public MetricRegistrySnapshot snapshot() {
        final List<MetricFamily> ordered = List.copyOf(registrationOrder);

        final Map<String, FamilySnapshot> stored = new LinkedHashMap<>();
        final MetricRegistrySnapshot noStoredFamilies = new MetricRegistrySnapshot(List.of());
        for (MetricFamily family : ordered) {
            if (!family.isDerived()) {
                stored.put(family.name(), family.snapshot(noStoredFamilies));
            }
        }

        final MetricRegistrySnapshot storedSnapshot = new MetricRegistrySnapshot(new ArrayList<>(stored.values()));
        if (stored.size() == ordered.size()) {
            return storedSnapshot;
        }

        final List<FamilySnapshot> all = new ArrayList<>(ordered.size());
        for (MetricFamily family : ordered) {
            all.add(family.isDerived() ? family.snapshot(storedSnapshot) : stored.get(family.name()));
        }
        return new MetricRegistrySnapshot(all);
    }

    @Override
    public void close() throws IOException {
        if (exporter != null) {
            logger.info("Closing metrics exporter: {}", exporter.getClass().getName());
            exporter.close();
        }
    }

    private MetricFamily getOrRegister(String familyName, Function<String, MetricFamily.Builder<?, ?>> builder) {
        MetricFamily family = families.get(familyName);
        if (family != null) {
            return family;
        }
        return families.computeIfAbsent(familyName, name -> {
            MetricFamily created = builder.apply(name).build();
            registrationOrder.add(created);
            logger.info("Lazily registered metric family. name={}, type={}", name, created.type());
            return created;
        });
    }

    /**
     * Builder for constructing {@link MetricRegistry} instances.
     */
    public static final class Builder {

        private boolean discoverMetricProviders = false;
        private MetricsExporter metricsExporter;
        private final List<MetricFamily.Builder<?, ?>> familiesToRegister = new ArrayList<>();

        private Builder() {}

        /**
         * Sets the {@link MetricsExporter} to be associated with the registry.
         *
         * @param metricsExporter the metrics exporter, must not be {@code null}
         * @return this builder instance
         * @throws NullPointerException if the metrics exporter is {@code null}
         */
        @NonNull
        public Builder setMetricsExporter(@NonNull MetricsExporter metricsExporter) {
            this.metricsExporter = Objects.requireNonNull(metricsExporter, "metrics exporter must not be null");
            return this;
        }

        /**
         * Adds family builders to register when the registry is built, after discovered providers.
         *
         * @param builders family builders
         * @return this builder instance
         */
        @NonNull
        public Builder addFamilies(@NonNull Collection<? extends MetricFamily.Builder<?, ?>> builders) {
            Objects.requireNonNull(builders, "family builders must not be null");
            familiesToRegister.addAll(builders);
            return this;
        }

        /**
         * Enable discovery of {@link MetricsRegistrationProvider} implementations to register in the registry.
         * Actual discovery happens during the {@link #build()} call.
         *
         * @return this builder instance
         */
        @NonNull
        public Builder discoverMetricProviders() {
            discoverMetricProviders = true;
            return this;
        }

        /**
         * Builds the {@link MetricRegistry} instance.
         * <p>
         * If metric providers discovery is enabled via {@link #discoverMetricProviders()}, it discovers
         * all {@link MetricsRegistrationProvider} implementations via service loader and registers their families
         * in the constructed registry.
         *
         * @return the constructed {@link MetricRegistry}
         * @throws IllegalArgumentException if two providers or added builders use the same family name
         */
        @NonNull
        public MetricRegistry build() {
            final MetricRegistry registry = new MetricRegistry(metricsExporter);

            if (discoverMetricProviders) {
                List<MetricsRegistrationProvider> providers = MetricUtils.load(MetricsRegistrationProvider.class);

                if (providers.isEmpty()) {
                    logger.info("No metrics registration providers found.");
                }

                for (MetricsRegistrationProvider provider : providers) {
                    logger.info("Registering metrics from provider: {}", provider.getClass().getName());

                    Collection<MetricFamily.Builder<?, ?>> builders = provider.getFamiliesToRegister();
                    Objects.requireNonNull(builders, "metrics collection must not be null");

                    for (MetricFamily.Builder<?, ?> builder : builders) {
                        registry.register(builder);
                    }
                }
            }

            for (MetricFamily.Builder<?, ?> builder : familiesToRegister) {
                registry.register(builder);
            }

            return registry;
        }
    }
}
