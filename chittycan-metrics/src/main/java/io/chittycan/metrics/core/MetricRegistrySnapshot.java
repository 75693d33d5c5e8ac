// SPDX-License-Identifier: Apache-2.0
package io.chittycan.metrics.core;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An immutable snapshot of all families of a {@link MetricRegistry} at a specific point in time,
 * in registration order.
 */
public final class MetricRegistrySnapshot implements Iterable<FamilySnapshot> {

    private final List<FamilySnapshot> families;
    private final Map<String, FamilySnapshot> familiesByName;

    MetricRegistrySnapshot(@NonNull List<FamilySnapshot> families) {
        this.families = List.copyOf(families);
        this.familiesByName = new LinkedHashMap<>();
        for (FamilySnapshot family : this.families) {
            familiesByName.put(family.name(), family);
        }
    }

    /**
     * @return family snapshots in registration order
     */
    @NonNull
    public List<FamilySnapshot> families() {
        return families;
    }

    /**
     * @param name the family name
     * @return the family snapshot, or {@code null} if no family with that name was captured
     */
    @Nullable
    public FamilySnapshot family(@NonNull String name) {
        return familiesByName.get(name);
    }

    public boolean isEmpty() {
        return families.isEmpty();
    }

    @NonNull
    @Override
    public Iterator<FamilySnapshot> iterator() {
        return families.iterator();
    }
}
