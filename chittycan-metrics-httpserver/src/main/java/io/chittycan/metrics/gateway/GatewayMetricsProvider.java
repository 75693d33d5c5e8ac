// SPDX-License-Identifier: Apache-2.0
package io.chittycan.metrics.gateway;

import edu.umd.cs.findbugs.annotations.NonNull;
import io.chittycan.metrics.core.MetricFamily;
import io.chittycan.metrics.core.MetricsRegistrationProvider;
import java.util.Collection;

/**
 * Registers the {@link GatewayMetrics} families in registries discovering metric providers.
 */
public final class GatewayMetricsProvider implements MetricsRegistrationProvider {

    @NonNull
    @Override
    public Collection<MetricFamily.Builder<?, ?>> getFamiliesToRegister() {
        return GatewayMetrics.familyBuilders();
    }
}
