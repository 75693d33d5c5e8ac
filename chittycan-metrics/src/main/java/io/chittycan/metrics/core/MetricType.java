// SPDX-License-Identifier: Apache-2.0
package io.chittycan.metrics.core;

/**
 * The type of metric family as exposed in the Prometheus text format.
 */
public enum MetricType {
    /**
     * A cumulative metric that represents a single monotonically increasing counter value per series.
     */
    COUNTER,
    /**
     * A metric that represents a single numerical value that can arbitrarily go up and down.
     * Gauges of this library are derived from stored families at snapshot time.
     */
    GAUGE,
    /**
     * A metric that samples observations into cumulative buckets and keeps their sum and count.
     */
    HISTOGRAM
}
