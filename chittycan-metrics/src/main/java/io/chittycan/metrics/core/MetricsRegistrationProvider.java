// SPDX-License-Identifier: Apache-2.0
package io.chittycan.metrics.core;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Collection;

/**
 * An SPI for providing metric families to register in a {@link MetricRegistry}.
 * <p>
 * The implementation class must have a no-arg constructor and be listed in the file
 * {@code META-INF/services/io.chittycan.metrics.core.MetricsRegistrationProvider} of its module.
 * Implementations are discovered by {@link java.util.ServiceLoader} when creating a {@link MetricRegistry}
 * with {@link MetricRegistry.Builder#discoverMetricProviders()} activated.
 * <p>
 * {@link MetricKey}s of the provided families can be kept in {@code public static final} fields
 * and used to retrieve the families from the registry where they are recorded.
 */
public interface MetricsRegistrationProvider {

    /**
     * @return a collection of family builders to register, never {@code null}
     */
    @NonNull
    Collection<MetricFamily.Builder<?, ?>> getFamiliesToRegister();
}
