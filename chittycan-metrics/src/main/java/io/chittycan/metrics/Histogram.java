// SPDX-License-Identifier: Apache-2.0
package io.chittycan.metrics;

import edu.umd.cs.findbugs.annotations.NonNull;
import io.chittycan.metrics.core.HistogramSeriesSnapshot;
import io.chittycan.metrics.core.LabelSet;
import io.chittycan.metrics.core.MetricFamily;
import io.chittycan.metrics.core.MetricKey;
import io.chittycan.metrics.core.MetricType;
import io.chittycan.metrics.core.MetricUtils;
import io.chittycan.metrics.core.SeriesFamily;
import io.chittycan.metrics.core.SeriesSnapshot;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * A family of type {@link MetricType#HISTOGRAM} that holds a {@link Series} per label set.
 * <p>
 * Bucket upper bounds are fixed when the family is built and shared by all series.
 * They are strictly ascending and always end with {@code +Inf}.
 * The label name {@value #BUCKET_LABEL} is reserved for the bucket bound and can not be used by series.
 */
public final class Histogram extends SeriesFamily<Histogram.Series> {

    /** Label carrying the bucket upper bound in the exposition. */
    public static final String BUCKET_LABEL = "le";

    /** Bucket upper bounds used when none are set: {@code [0.01, 0.1, 0.5, 1, 2, 5, 10, +Inf]}. */
    private static final double[] DEFAULT_BUCKETS = {0.01, 0.1, 0.5, 1.0, 2.0, 5.0, 10.0, Double.POSITIVE_INFINITY};

    private final double[] bucketBounds;

    private Histogram(Builder builder) {
        super(builder);
        bucketBounds = builder.bucketBounds;
        validateLabelNames(labelNames());
    }

    /**
     * Create a metric key for a {@link Histogram} with the given name. <br>
     * Name must match {@value MetricUtils#METRIC_NAME_REGEX}.
     *
     * @param name the name of the family
     * @return the metric key
     */
    @NonNull
    public static MetricKey<Histogram> key(@NonNull String name) {
        return MetricKey.of(name, Histogram.class);
    }

    /**
     * Create a builder for a {@link Histogram} with the given metric key.
     *
     * @param key the metric key
     * @return the builder
     */
    @NonNull
    public static Builder builder(@NonNull MetricKey<Histogram> key) {
        return new Builder(key);
    }

    /**
     * Create a builder for a {@link Histogram} with the given name. <br>
     * Name must match {@value MetricUtils#METRIC_NAME_REGEX}.
     *
     * @param name the name of the family
     * @return the builder
     */
    @NonNull
    public static Builder builder(@NonNull String name) {
        return builder(key(name));
    }

    /**
     * @return default bucket upper bounds, ending with {@code +Inf}
     */
    @NonNull
    public static double[] defaultBuckets() {
        return DEFAULT_BUCKETS.clone();
    }

    /**
     * @return a copy of the bucket upper bounds of this family, ending with {@code +Inf}
     */
    @NonNull
    public double[] bucketBounds() {
        return bucketBounds.clone();
    }

    @Override
    protected void validateLabelNames(@NonNull List<String> names) {
        if (names.contains(BUCKET_LABEL)) {
            throw new IllegalArgumentException(
                    "Label name '" + BUCKET_LABEL + "' is reserved for histogram buckets of " + name());
        }
    }

    @NonNull
    @Override
    protected Series createSeries(@NonNull LabelSet labels) {
        return new Series(bucketBounds);
    }

    @NonNull
    @Override
    protected SeriesSnapshot snapshotSeries(@NonNull LabelSet labels, @NonNull Series series) {
        return series.snapshot(labels);
    }

    /**
     * Builder for {@link Histogram}.
     * <p>
     * Default bucket bounds are {@code [0.01, 0.1, 0.5, 1, 2, 5, 10, +Inf]},
     * that can be changed via {@link #setBuckets(double...)}.
     */
    public static final class Builder extends MetricFamily.Builder<Builder, Histogram> {

        private double[] bucketBounds = DEFAULT_BUCKETS;

        private Builder(@NonNull MetricKey<Histogram> key) {
            super(MetricType.HISTOGRAM, key);
        }

        /**
         * Sets bucket upper bounds. {@code +Inf} is appended if missing.
         *
         * @param bounds strictly ascending finite bounds, optionally followed by {@code +Inf}
         * @return this builder
         * @throws NullPointerException     if bounds is {@code null}
         * @throws IllegalArgumentException if bounds are empty, not finite or not strictly ascending
         */
        @NonNull
        public Builder setBuckets(@NonNull double... bounds) {
            Objects.requireNonNull(bounds, "bucket bounds must not be null");
            if (bounds.length == 0) {
                throw new IllegalArgumentException("Bucket bounds must not be empty");
            }

            final int last = bounds.length - 1;
            final boolean endsWithInf = bounds[last] == Double.POSITIVE_INFINITY;
            final int finiteCount = endsWithInf ? last : bounds.length;

            for (int i = 0; i < finiteCount; i++) {
                if (!Double.isFinite(bounds[i])) {
                    throw new IllegalArgumentException("Bucket bound must be finite, but was: " + bounds[i]);
                }
                if (i > 0 && bounds[i] <= bounds[i - 1]) {
                    throw new IllegalArgumentException(
                            "Bucket bounds must be strictly ascending: " + Arrays.toString(bounds));
                }
            }

            double[] copy = Arrays.copyOf(bounds, finiteCount + 1);
            copy[finiteCount] = Double.POSITIVE_INFINITY;
            this.bucketBounds = copy;
            return this;
        }

        @NonNull
        @Override
        protected Histogram buildFamily() {
            return new Histogram(this);
        }
    }

    /**
     * A histogram series counting observations per bucket together with their sum and count.
     * Observations and snapshots lock the series, so a snapshot always sees whole observations.
     */
    public static final class Series {

        private final double[] bucketBounds;
        private final long[] bucketCounts;
        private double sum;
        private long count;

        private Series(double[] bucketBounds) {
            this.bucketBounds = bucketBounds;
            this.bucketCounts = new long[bucketBounds.length];
        }

        /**
         * Records an observation: it is counted in the first bucket whose upper bound is greater
         * than or equal to the value, so in every bucket from there on cumulatively.
         *
         * @param value the observed value
         * @throws IllegalArgumentException if the value is NaN
         */
        public void observe(double value) {
            if (Double.isNaN(value)) {
                throw new IllegalArgumentException("Observed value must not be NaN");
            }
            int bucket = Arrays.binarySearch(bucketBounds, value);
            if (bucket < 0) {
                bucket = -bucket - 1;
            }
            synchronized (this) {
                bucketCounts[bucket]++;
                sum += value;
                count++;
            }
        }

        /**
         * @return number of observations
         */
        public synchronized long count() {
            return count;
        }

        /**
         * @return sum of observed values
         */
        public synchronized double sum() {
            return sum;
        }

        synchronized HistogramSeriesSnapshot snapshot(LabelSet labels) {
            long[] cumulative = new long[bucketCounts.length];
            long running = 0L;
            for (int i = 0; i < bucketCounts.length; i++) {
                running += bucketCounts[i];
                cumulative[i] = running;
            }
            return new HistogramSeriesSnapshot(labels, bucketBounds, cumulative, sum, count);
        }
    }
}
