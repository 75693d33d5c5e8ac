// SPDX-License-Identifier: Apache-2.0
package io.chittycan.metrics;

import edu.umd.cs.findbugs.annotations.NonNull;
import io.chittycan.metrics.core.DoubleSeriesSnapshot;
import io.chittycan.metrics.core.FamilySnapshot;
import io.chittycan.metrics.core.HistogramSeriesSnapshot;
import io.chittycan.metrics.core.LabelSet;
import io.chittycan.metrics.core.LongSeriesSnapshot;
import io.chittycan.metrics.core.MetricFamily;
import io.chittycan.metrics.core.MetricKey;
import io.chittycan.metrics.core.MetricRegistrySnapshot;
import io.chittycan.metrics.core.MetricType;
import io.chittycan.metrics.core.MetricUtils;
import io.chittycan.metrics.core.SeriesSnapshot;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * A family of type {@link MetricType#GAUGE} whose values are computed from other families each time
 * the registry takes a snapshot. Nothing is stored, so the gauge can never disagree with the families
 * it is derived from within one snapshot.
 * <p>
 * Values come either from a custom {@link DerivedValues} function, or from a ratio of two families
 * built with {@link Builder#ratio(String, String)}.
 */
public final class DerivedGauge extends MetricFamily {

    private static final Logger logger = LogManager.getLogger(DerivedGauge.class);

    private final DerivedValues values;

    private DerivedGauge(Builder builder, DerivedValues values) {
        super(builder);
        this.values = values;
    }

    /**
     * Create a metric key for a {@link DerivedGauge} with the given name. <br>
     * Name must match {@value MetricUtils#METRIC_NAME_REGEX}.
     *
     * @param name the name of the family
     * @return the metric key
     */
    @NonNull
    public static MetricKey<DerivedGauge> key(@NonNull String name) {
        return MetricKey.of(name, DerivedGauge.class);
    }

    /**
     * Create a builder for a {@link DerivedGauge} with the given metric key.
     *
     * @param key the metric key
     * @return the builder
     */
    @NonNull
    public static Builder builder(@NonNull MetricKey<DerivedGauge> key) {
        return new Builder(key);
    }

    /**
     * Create a builder for a {@link DerivedGauge} with the given name. <br>
     * Name must match {@value MetricUtils#METRIC_NAME_REGEX}.
     *
     * @param name the name of the family
     * @return the builder
     */
    @NonNull
    public static Builder builder(@NonNull String name) {
        return builder(key(name));
    }

    @Override
    public boolean isDerived() {
        return true;
    }

    @NonNull
    @Override
    protected List<DoubleSeriesSnapshot> collectSeries(@NonNull MetricRegistrySnapshot storedFamilies) {
        final Map<LabelSet, Double> computed = values.compute(storedFamilies);
        final List<String> expectedNames = labelNames();

        List<DoubleSeriesSnapshot> series = new ArrayList<>(computed.size());
        computed.forEach((labels, value) -> {
            if (labels.names().equals(expectedNames) && value != null) {
                series.add(new DoubleSeriesSnapshot(labels, value));
            } else {
                logger.warn(
                        "Skipping derived value with labels {} not matching {} of family {}",
                        labels,
                        expectedNames,
                        name());
            }
        });
        return series;
    }

    /**
     * @param series a series snapshot of a stored family
     * @return the series value, the observation count for histogram series
     */
    static double valueOf(@NonNull SeriesSnapshot series) {
        if (series instanceof LongSeriesSnapshot longSeries) {
            return longSeries.value();
        } else if (series instanceof DoubleSeriesSnapshot doubleSeries) {
            return doubleSeries.value();
        } else if (series instanceof HistogramSeriesSnapshot histogramSeries) {
            return histogramSeries.count();
        }
        throw new IllegalArgumentException("Unsupported series snapshot: " + series.getClass().getName());
    }

    /**
     * Builder for {@link DerivedGauge}.
     * Exactly one of {@link #compute(DerivedValues)} and {@link #ratio(String, String)} must be called.
     */
    public static final class Builder extends MetricFamily.Builder<Builder, DerivedGauge> {

        private DerivedValues values;
        private String numeratorFamily;
        private String denominatorFamily;

        private Builder(@NonNull MetricKey<DerivedGauge> key) {
            super(MetricType.GAUGE, key);
        }

        /**
         * Computes the gauge series with the given function. Returned label sets must have
         * the label names declared on this builder; others are skipped.
         *
         * @param values the function, must not be {@code null}
         * @return this builder
         */
        @NonNull
        public Builder compute(@NonNull DerivedValues values) {
            this.values = Objects.requireNonNull(values, "derived values must not be null");
            return this;
        }

        /**
         * Computes {@code sum(numerator) / sum(denominator)} grouped by the label names declared on this builder.
         * Groups are taken from the denominator series, a group whose denominator is zero yields {@code 0}.
         * Without declared label names a single unlabeled series is always produced.
         *
         * @param numeratorFamily   name of the numerator family
         * @param denominatorFamily name of the denominator family
         * @return this builder
         * @throws IllegalArgumentException if a name is invalid
         */
        @NonNull
        public Builder ratio(@NonNull String numeratorFamily, @NonNull String denominatorFamily) {
            this.numeratorFamily = MetricUtils.validateMetricNameCharacters(numeratorFamily);
            this.denominatorFamily = MetricUtils.validateMetricNameCharacters(denominatorFamily);
            return this;
        }

        /**
         * @throws IllegalStateException if neither or both of a function and a ratio were set
         */
        @NonNull
        @Override
        protected DerivedGauge buildFamily() {
            final boolean isRatio = numeratorFamily != null;
            if (isRatio == (values != null)) {
                throw new IllegalStateException(
                        "Derived gauge " + key().name() + " needs either a compute function or a ratio");
            }
            final DerivedValues effective =
                    isRatio ? new Ratio(numeratorFamily, denominatorFamily, labelNames()) : values;
            return new DerivedGauge(this, effective);
        }
    }

    private record Ratio(String numeratorFamily, String denominatorFamily, List<String> groupBy)
            implements DerivedValues {

        @NonNull
        @Override
        public Map<LabelSet, Double> compute(@NonNull MetricRegistrySnapshot storedFamilies) {
            final Map<LabelSet, double[]> groups = new HashMap<>();

            final FamilySnapshot denominator = storedFamilies.family(denominatorFamily);
            if (denominator != null) {
                for (SeriesSnapshot series : denominator) {
                    groups.computeIfAbsent(series.labels().select(groupBy), k -> new double[2])[1] +=
                            valueOf(series);
                }
            }

            final FamilySnapshot numerator = storedFamilies.family(numeratorFamily);
            if (numerator != null) {
                for (SeriesSnapshot series : numerator) {
                    double[] group = groups.get(series.labels().select(groupBy));
                    if (group != null) {
                        group[0] += valueOf(series);
                    }
                }
            }

            if (groupBy.isEmpty() && groups.isEmpty()) {
                groups.put(LabelSet.empty(), new double[2]);
            }

            final Map<LabelSet, Double> ratios = new HashMap<>(groups.size());
            groups.forEach((labels, sums) -> ratios.put(labels, sums[1] == 0.0 ? 0.0 : sums[0] / sums[1]));
            return ratios;
        }
    }
}
