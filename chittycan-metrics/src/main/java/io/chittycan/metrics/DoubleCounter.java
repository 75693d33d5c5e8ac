// SPDX-License-Identifier: Apache-2.0
package io.chittycan.metrics;

import edu.umd.cs.findbugs.annotations.NonNull;
import io.chittycan.metrics.core.DoubleSeriesSnapshot;
import io.chittycan.metrics.core.InvalidDeltaException;
import io.chittycan.metrics.core.LabelSet;
import io.chittycan.metrics.core.MetricFamily;
import io.chittycan.metrics.core.MetricKey;
import io.chittycan.metrics.core.MetricType;
import io.chittycan.metrics.core.MetricUtils;
import io.chittycan.metrics.core.SeriesFamily;
import io.chittycan.metrics.core.SeriesSnapshot;
import java.util.concurrent.atomic.DoubleAdder;

/**
 * A family of type {@link MetricType#COUNTER} that holds a {@link Series} per label set,
 * containing non-decreasing {@code double} value.
 * <p>
 * Use {@link Builder#setFractionDigits(int)} to render values with a fixed number of decimals,
 * e.g. {@code 2} for amounts in cents.
 */
public final class DoubleCounter extends SeriesFamily<DoubleCounter.Series> {

    private DoubleCounter(Builder builder) {
        super(builder);
    }

    /**
     * Create a metric key for a {@link DoubleCounter} with the given name. <br>
     * Name must match {@value MetricUtils#METRIC_NAME_REGEX}.
     *
     * @param name the name of the family
     * @return the metric key
     */
    @NonNull
    public static MetricKey<DoubleCounter> key(@NonNull String name) {
        return MetricKey.of(name, DoubleCounter.class);
    }

    /**
     * Create a builder for a {@link DoubleCounter} with the given metric key.
     *
     * @param key the metric key
     * @return the builder
     */
    @NonNull
    public static Builder builder(@NonNull MetricKey<DoubleCounter> key) {
        return new Builder(key);
    }

    /**
     * Create a builder for a {@link DoubleCounter} with the given name. <br>
     * Name must match {@value MetricUtils#METRIC_NAME_REGEX}.
     *
     * @param name the name of the family
     * @return the builder
     */
    @NonNull
    public static Builder builder(@NonNull String name) {
        return builder(key(name));
    }

    @NonNull
    @Override
    protected Series createSeries(@NonNull LabelSet labels) {
        return new Series(name());
    }

    @NonNull
    @Override
    protected SeriesSnapshot snapshotSeries(@NonNull LabelSet labels, @NonNull Series series) {
        return new DoubleSeriesSnapshot(labels, series.get());
    }

    /**
     * Builder for {@link DoubleCounter}.
     */
    public static final class Builder extends MetricFamily.Builder<Builder, DoubleCounter> {

        private Builder(@NonNull MetricKey<DoubleCounter> key) {
            super(MetricType.COUNTER, key);
        }

        @NonNull
        @Override
        protected DoubleCounter buildFamily() {
            return new DoubleCounter(this);
        }
    }

    /**
     * A series holding a non-decreasing {@code double} value.
     * Operations are thread-safe and atomic.
     */
    public static final class Series {

        private final String familyName;
        private final DoubleAdder container = new DoubleAdder();

        private Series(String familyName) {
            this.familyName = familyName;
        }

        /**
         * Increments the counter by the given non-negative value.
         *
         * @param value the value to increment by
         * @throws InvalidDeltaException if the given value is negative or NaN
         */
        public void increment(double value) {
            if (Double.isNaN(value) || value < 0.0) {
                throw new InvalidDeltaException(familyName, value);
            }
            if (value != 0.0) {
                container.add(value);
            }
        }

        /**
         * Increments the counter by {@code 1.0}.
         */
        public void increment() {
            container.add(1.0);
        }

        /**
         * @return current value
         */
        public double get() {
            return container.sum();
        }
    }
}
