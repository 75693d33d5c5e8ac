// SPDX-License-Identifier: Apache-2.0
package io.chittycan.metrics.core;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Thrown when a counter is incremented by a negative or NaN delta.
 */
public final class InvalidDeltaException extends MetricRecordingException {

    public InvalidDeltaException(@NonNull String familyName, double delta) {
        super(familyName, "Increment value must be non-negative, but was: " + delta + " for " + familyName);
    }

    public InvalidDeltaException(@NonNull String familyName, long delta) {
        super(familyName, "Increment value must be non-negative, but was: " + delta + " for " + familyName);
    }
}
