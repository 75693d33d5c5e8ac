// SPDX-License-Identifier: Apache-2.0
package io.chittycan.metrics.core;

import io.chittycan.metrics.Histogram;
import io.chittycan.metrics.LongCounter;
import java.util.Collection;
import java.util.List;

public class TestMetricsRegistrationProvider implements MetricsRegistrationProvider {

    public static final MetricKey<LongCounter> DISCOVERED_COUNTER = LongCounter.key("discovered_requests_total");
    public static final MetricKey<Histogram> DISCOVERED_HISTOGRAM = Histogram.key("discovered_latency_seconds");

    @Override
    public Collection<MetricFamily.Builder<?, ?>> getFamiliesToRegister() {
        return List.of(
                LongCounter.builder(DISCOVERED_COUNTER).setHelp("Discovered counter"),
                Histogram.builder(DISCOVERED_HISTOGRAM).addLabelNames("model"));
    }
}
