// SPDX-License-Identifier: Apache-2.0
package io.chittycan.metrics.core;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Abstract extension of {@link MetricFamily} that stores one series per {@link LabelSet}.
 * <p>
 * Subclasses must implement the creation of series and of their snapshots.
 * All series are created lazily, whenever a new label set is requested, and are never removed.
 * <p>
 * Clients should pay attention to label value cardinality, as the number of series is not bounded.
 * <b>Do not use</b> labels with values having unbounded cardinality, such as IDs or timestamps.
 *
 * @param <S> The type of the series of this family.
 */
public abstract class SeriesFamily<S> extends MetricFamily {

    private final Map<LabelSet, S> series = new ConcurrentHashMap<>();

    protected SeriesFamily(@NonNull MetricFamily.Builder<?, ?> builder) {
        super(builder);
    }

    /**
     * Get or create the series for the given label set.
     *
     * @param labels the labels identifying the series
     * @return the series, never {@code null}
     * @throws NullPointerException        if labels is {@code null}
     * @throws LabelShapeMismatchException if the label names differ from the family's shape
     */
    @NonNull
    public final S getOrCreate(@NonNull LabelSet labels) {
        Objects.requireNonNull(labels, "labels must not be null");
        S existing = series.get(labels);
        if (existing != null) {
            return existing;
        }
        checkLabelShape(labels);
        return series.computeIfAbsent(labels, this::createFixingShape);
    }

    /**
     * Get or create the series for the given label names and values.
     * See {@link LabelSet#of(String...)} and {@link #getOrCreate(LabelSet)}.
     *
     * @param namesAndValues alternating label names and values, e.g. "model", "gpt-4", "tenant", "t1"
     * @return the series, never {@code null}
     */
    @NonNull
    public final S getOrCreate(@NonNull String... namesAndValues) {
        return getOrCreate(LabelSet.of(namesAndValues));
    }

    /**
     * @return number of series created so far
     */
    public final int seriesCount() {
        return series.size();
    }

    /**
     * Create a new, empty series.
     *
     * @param labels the labels of the series
     * @return the created series
     */
    @NonNull
    protected abstract S createSeries(@NonNull LabelSet labels);

    /**
     * Copy the given series atomically.
     *
     * @param labels the labels associated with the series
     * @param series the series to copy
     * @return the series snapshot
     */
    @NonNull
    protected abstract SeriesSnapshot snapshotSeries(@NonNull LabelSet labels, @NonNull S series);

    @NonNull
    @Override
    protected final List<SeriesSnapshot> collectSeries(@NonNull MetricRegistrySnapshot storedFamilies) {
        List<SeriesSnapshot> snapshots = new ArrayList<>(series.size());
        series.forEach((labels, s) -> snapshots.add(snapshotSeries(labels, s)));
        return snapshots;
    }

    private S createFixingShape(LabelSet labels) {
        fixLabelShape(labels);
        return createSeries(labels);
    }
}
