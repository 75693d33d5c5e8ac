// SPDX-License-Identifier: Apache-2.0
package io.chittycan.metrics;

import edu.umd.cs.findbugs.annotations.NonNull;
import io.chittycan.metrics.core.InvalidDeltaException;
import io.chittycan.metrics.core.LabelSet;
import io.chittycan.metrics.core.LongSeriesSnapshot;
import io.chittycan.metrics.core.MetricFamily;
import io.chittycan.metrics.core.MetricKey;
import io.chittycan.metrics.core.MetricType;
import io.chittycan.metrics.core.MetricUtils;
import io.chittycan.metrics.core.SeriesFamily;
import io.chittycan.metrics.core.SeriesSnapshot;
import java.util.concurrent.atomic.LongAdder;

/**
 * A family of type {@link MetricType#COUNTER} that holds a {@link Series} per label set,
 * containing non-decreasing {@code long} value.
 */
public final class LongCounter extends SeriesFamily<LongCounter.Series> {

    private LongCounter(Builder builder) {
        super(builder);
    }

    /**
     * Create a metric key for a {@link LongCounter} with the given name. <br>
     * Name must match {@value MetricUtils#METRIC_NAME_REGEX}.
     *
     * @param name the name of the family
     * @return the metric key
     */
    @NonNull
    public static MetricKey<LongCounter> key(@NonNull String name) {
        return MetricKey.of(name, LongCounter.class);
    }

    /**
     * Create a builder for a {@link LongCounter} with the given metric key.
     *
     * @param key the metric key
     * @return the builder
     */
    @NonNull
    public static Builder builder(@NonNull MetricKey<LongCounter> key) {
        return new Builder(key);
    }

    /**
     * Create a builder for a {@link LongCounter} with the given name. <br>
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
        return new LongSeriesSnapshot(labels, series.get());
    }

    /**
     * Builder for {@link LongCounter}.
     */
    public static final class Builder extends MetricFamily.Builder<Builder, LongCounter> {

        private Builder(@NonNull MetricKey<LongCounter> key) {
            super(MetricType.COUNTER, key);
        }

        @NonNull
        @Override
        protected LongCounter buildFamily() {
            return new LongCounter(this);
        }
    }

    /**
     * A series holding a non-decreasing {@code long} value.
     * Operations are thread-safe and atomic.
     */
    public static final class Series {

        private final String familyName;
        private final LongAdder container = new LongAdder();

        private Series(String familyName) {
            this.familyName = familyName;
        }

        /**
         * Increments the counter by the given non-negative value.
         *
         * @param value the value to increment by
         * @throws InvalidDeltaException if the given value is negative
         */
        public void increment(long value) {
            if (value < 0L) {
                throw new InvalidDeltaException(familyName, value);
            }
            if (value != 0L) {
                container.add(value);
            }
        }

        /**
         * Increments the counter by {@code 1}.
         */
        public void increment() {
            container.increment();
        }

        /**
         * @return current value
         */
        public long get() {
            return container.sum();
        }
    }
}
