// SPDX-License-Identifier: Apache-2.0
package io.chittycan.metrics.core;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Objects;

/**
 * A label is an immutable name-value pair used to differentiate series within the same metric family.
 * The value may be empty, but never {@code null}.
 */
public record Label(@NonNull String name, @NonNull String value) implements Comparable<Label> {

    /**
     * Constructs a new label with the specified name and value.
     *
     * @param name  the name of the label
     * @param value the value of the label, may be empty
     * @throws NullPointerException if name or value is {@code null}
     * @throws IllegalArgumentException if name doesn't match regex {@value MetricUtils#LABEL_NAME_REGEX}
     *                                  or starts with {@value MetricUtils#RESERVED_LABEL_PREFIX}
     */
    public Label {
        MetricUtils.validateLabelNameCharacters(name);
        Objects.requireNonNull(value, "label value must not be null");
    }

    @Override
    public String toString() {
        return name + "=" + value;
    }

    @Override
    public int compareTo(Label other) {
        int nameCompare = name.compareTo(other.name);
        return nameCompare != 0 ? nameCompare : value.compareTo(other.value);
    }
}
