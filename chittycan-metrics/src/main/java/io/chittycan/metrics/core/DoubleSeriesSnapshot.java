// SPDX-License-Identifier: Apache-2.0
package io.chittycan.metrics.core;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Snapshot of a series holding a single {@code double} value.
 */
public final class DoubleSeriesSnapshot extends SeriesSnapshot {

    private final double value;

    public DoubleSeriesSnapshot(@NonNull LabelSet labels, double value) {
        super(labels);
        this.value = value;
    }

    public double value() {
        return value;
    }

    @Override
    public String toString() {
        return labels() + " " + value;
    }
}
