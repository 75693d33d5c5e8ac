// SPDX-License-Identifier: Apache-2.0
package io.chittycan.metrics;

import edu.umd.cs.findbugs.annotations.NonNull;
import io.chittycan.metrics.core.LabelSet;
import io.chittycan.metrics.core.MetricRegistrySnapshot;
import java.util.Map;

/**
 * Computes the series values of a {@link DerivedGauge} from a snapshot of the stored families.
 */
@FunctionalInterface
public interface DerivedValues {

    /**
     * @param storedFamilies snapshot of all stored families of the registry
     * @return gauge values by label set, never {@code null}
     */
    @NonNull
    Map<LabelSet, Double> compute(@NonNull MetricRegistrySnapshot storedFamilies);
}
