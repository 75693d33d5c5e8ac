// SPDX-License-Identifier: Apache-2.0
package io.chittycan.metrics.core;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Arrays;
import java.util.Objects;

/**
 * Snapshot of a histogram series.
 * <p>
 * Bucket upper bounds are ascending and end with {@link Double#POSITIVE_INFINITY}.
 * Counts are cumulative and parallel to the bounds, so they never decrease from one bucket
 * to the next and the last count equals {@link #count()}.
 */
public final class HistogramSeriesSnapshot extends SeriesSnapshot {

    private final double[] bucketBounds;
    private final long[] cumulativeCounts;
    private final double sum;
    private final long count;

    /**
     * @param labels           labels of the series
     * @param bucketBounds     ascending upper bounds, last one is {@code +Inf}
     * @param cumulativeCounts cumulative counts, same length as bounds
     * @param sum              sum of all observed values
     * @param count            number of observations
     * @throws IllegalArgumentException if bounds and counts differ in length
     */
    public HistogramSeriesSnapshot(
            @NonNull LabelSet labels,
            @NonNull double[] bucketBounds,
            @NonNull long[] cumulativeCounts,
            double sum,
            long count) {
        super(labels);
        Objects.requireNonNull(bucketBounds, "bucket bounds must not be null");
        Objects.requireNonNull(cumulativeCounts, "cumulative counts must not be null");
        if (bucketBounds.length != cumulativeCounts.length) {
            throw new IllegalArgumentException("Expected " + bucketBounds.length + " bucket counts, got "
                    + cumulativeCounts.length);
        }
        this.bucketBounds = bucketBounds.clone();
        this.cumulativeCounts = cumulativeCounts.clone();
        this.sum = sum;
        this.count = count;
    }

    public int bucketCount() {
        return bucketBounds.length;
    }

    public double bucketBound(int index) {
        return bucketBounds[index];
    }

    public long cumulativeCount(int index) {
        return cumulativeCounts[index];
    }

    /**
     * @return a copy of the bucket upper bounds
     */
    @NonNull
    public double[] bucketBounds() {
        return bucketBounds.clone();
    }

    /**
     * @return a copy of the cumulative bucket counts
     */
    @NonNull
    public long[] cumulativeCounts() {
        return cumulativeCounts.clone();
    }

    public double sum() {
        return sum;
    }

    public long count() {
        return count;
    }

    @Override
    public String toString() {
        return labels() + " buckets=" + Arrays.toString(bucketBounds) + " counts="
                + Arrays.toString(cumulativeCounts) + " sum=" + sum + " count=" + count;
    }
}
