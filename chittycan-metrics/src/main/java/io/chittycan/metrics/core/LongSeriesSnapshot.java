// SPDX-License-Identifier: Apache-2.0
package io.chittycan.metrics.core;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Snapshot of a series holding a single {@code long} value.
 */
public final class LongSeriesSnapshot extends SeriesSnapshot {

    private final long value;

    public LongSeriesSnapshot(@NonNull LabelSet labels, long value) {
        super(labels);
        this.value = value;
    }

    public long value() {
        return value;
    }

    @Override
    public String toString() {
        return labels() + " " + value;
    }
}
