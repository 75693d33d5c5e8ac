// SPDX-License-Identifier: Apache-2.0
package io.chittycan.metrics.core;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.List;

/**
 * Thrown when the label names of a recording differ from the label names established for the family.
 */
public final class LabelShapeMismatchException extends MetricRecordingException {

    public LabelShapeMismatchException(
            @NonNull String familyName, @NonNull List<String> expected, @NonNull List<String> actual) {
        super(familyName, "Label names " + actual + " do not match " + expected + " of family " + familyName);
    }
}
