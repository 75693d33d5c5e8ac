// SPDX-License-Identifier: Apache-2.0
package io.chittycan.metrics.core;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Objects;

/**
 * Base class of the failures raised synchronously by recording operations.
 * A recording that fails with this exception leaves the registry unchanged.
 */
public abstract class MetricRecordingException extends IllegalArgumentException {

    private final String familyName;

    protected MetricRecordingException(@NonNull String familyName, @NonNull String message) {
        super(message);
        this.familyName = Objects.requireNonNull(familyName, "family name must not be null");
    }

    /**
     * @return name of the metric family the failed recording targeted
     */
    @NonNull
    public String familyName() {
        return familyName;
    }
}
