// SPDX-License-Identifier: Apache-2.0
package io.chittycan.metrics.core;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Thrown when a histogram observation targets a name that has no histogram family with bucket bounds.
 */
public final class UnknownBucketsException extends MetricRecordingException {

    public UnknownBucketsException(@NonNull String familyName) {
        super(familyName, "No histogram buckets registered for family: " + familyName);
    }
}
