// SPDX-License-Identifier: Apache-2.0
package io.chittycan.metrics.core;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Objects;

/**
 * Immutable copy of one series taken at snapshot time.
 */
public abstract class SeriesSnapshot {

    private final LabelSet labels;

    SeriesSnapshot(@NonNull LabelSet labels) {
        this.labels = Objects.requireNonNull(labels, "labels must not be null");
    }

    /**
     * @return labels identifying the series within its family
     */
    @NonNull
    public final LabelSet labels() {
        return labels;
    }
}
