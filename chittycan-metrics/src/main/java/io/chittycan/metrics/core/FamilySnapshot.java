// SPDX-License-Identifier: Apache-2.0
package io.chittycan.metrics.core;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Immutable snapshot of one metric family: its metadata and a copy of every series,
 * ordered by {@link LabelSet}.
 */
public final class FamilySnapshot implements Iterable<SeriesSnapshot> {

    private final String name;
    private final MetricType type;
    private final String help;
    private final Integer fractionDigits;
    private final List<String> labelNames;
    private final List<SeriesSnapshot> series;

    FamilySnapshot(@NonNull MetricFamily family, @NonNull List<? extends SeriesSnapshot> series) {
        this.name = family.name();
        this.type = family.type();
        this.help = family.help();
        this.fractionDigits = family.fractionDigits();
        this.labelNames = family.labelNames();
        this.series = series.stream()
                .sorted(Comparator.comparing(SeriesSnapshot::labels))
                .map(SeriesSnapshot.class::cast)
                .toList();
    }

    @NonNull
    public String name() {
        return name;
    }

    @NonNull
    public MetricType type() {
        return type;
    }

    /**
     * @return help text, empty if none was given
     */
    @NonNull
    public String help() {
        return help;
    }

    /**
     * @return fixed number of decimals to render floating values with, or {@code null} for natural formatting
     */
    @Nullable
    public Integer fractionDigits() {
        return fractionDigits;
    }

    /**
     * @return label names of the family's series, empty if the shape is not established yet
     */
    @NonNull
    public List<String> labelNames() {
        return labelNames;
    }

    /**
     * @return series ordered by their label sets
     */
    @NonNull
    public List<SeriesSnapshot> series() {
        return series;
    }

    /**
     * @param labels the series labels
     * @return the series with the given labels, or {@code null} if there is none
     */
    @Nullable
    public SeriesSnapshot series(@NonNull LabelSet labels) {
        Objects.requireNonNull(labels, "labels must not be null");
        for (SeriesSnapshot snapshot : series) {
            if (snapshot.labels().equals(labels)) {
                return snapshot;
            }
        }
        return null;
    }

    @NonNull
    @Override
    public Iterator<SeriesSnapshot> iterator() {
        return series.iterator();
    }

    @Override
    public String toString() {
        return "name=" + name + ", type=" + type + ", series=" + series;
    }
}
