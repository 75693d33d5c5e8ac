// SPDX-License-Identifier: Apache-2.0
package io.chittycan.metrics.core;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Objects;

/**
 * A key for identifying a {@link MetricFamily} by its name and class type.
 * Key instance is immutable and can be used to retrieve a family from a {@link MetricRegistry}.
 */
public record MetricKey<F extends MetricFamily>(@NonNull String name, @NonNull Class<F> type) {

    /**
     * Creates a new metric key instance with the specified name and type.
     *
     * @param name the name of the family
     * @param type the class type of the family
     * @throws NullPointerException    if name or type is {@code null}
     * @throws IllegalArgumentException if name doesn't match regex {@value MetricUtils#METRIC_NAME_REGEX}
     */
    public MetricKey {
        MetricUtils.validateMetricNameCharacters(name);
        Objects.requireNonNull(type, "metric type must not be null");
    }

    /**
     * Convenient factory method to construct metric key with generics. <br>
     * See {@link #MetricKey(String, Class)} for details.
     */
    @SuppressWarnings("unchecked")
    public static <F extends MetricFamily> MetricKey<F> of(@NonNull String name, @NonNull Class<? super F> type) {
        return new MetricKey<>(name, (Class<F>) type);
    }
}
