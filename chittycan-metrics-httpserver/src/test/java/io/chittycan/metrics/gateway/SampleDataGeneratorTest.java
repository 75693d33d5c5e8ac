// SPDX-License-Identifier: Apache-2.0
package io.chittycan.metrics.gateway;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.chittycan.metrics.core.DoubleSeriesSnapshot;
import io.chittycan.metrics.core.HistogramSeriesSnapshot;
import io.chittycan.metrics.core.LongSeriesSnapshot;
import io.chittycan.metrics.core.MetricRegistry;
import io.chittycan.metrics.core.MetricRegistrySnapshot;
import io.chittycan.metrics.core.SeriesSnapshot;
import io.chittycan.metrics.exposition.PrometheusTextWriter;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class SampleDataGeneratorTest {

    private MetricRegistry registry;
    private GatewayMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = MetricRegistry.builder().build();
        metrics = new GatewayMetrics(registry);
    }

    @Test
    void testDefaultNumberOfRequests() {
        int generated = new SampleDataGenerator(42L).generate(metrics, SampleDataGenerator.DEFAULT_REQUESTS);

        MetricRegistrySnapshot snapshot = registry.snapshot();
        assertThat(generated).isEqualTo(1000);
        assertThat(sumLongs(snapshot, GatewayMetrics.REQUESTS.name())).isEqualTo(1000L);
        assertThat(sumLongs(snapshot, GatewayMetrics.CACHE_REQUESTS.name())).isEqualTo(1000L);

        long histogramCount = snapshot.family(GatewayMetrics.REQUEST_DURATION.name()).series().stream()
                .mapToLong(series -> ((HistogramSeriesSnapshot) series).count())
                .sum();
        assertThat(histogramCount).isEqualTo(1000L);
    }

    @Test
    void testDistribution() {
        new SampleDataGenerator(7L).generate(metrics, 1000);

        MetricRegistrySnapshot snapshot = registry.snapshot();

        // 70% cache hits
        assertThat(sumLongs(snapshot, GatewayMetrics.CACHE_HITS.name())).isBetween(600L, 800L);

        assertThat(labelValues(snapshot, GatewayMetrics.REQUESTS.name(), GatewayMetrics.MODEL_LABEL))
                .containsExactlyInAnyOrderElementsOf(SampleDataGenerator.MODELS);
        assertThat(labelValues(snapshot, GatewayMetrics.REQUESTS.name(), GatewayMetrics.TENANT_LABEL))
                .containsExactlyInAnyOrderElementsOf(SampleDataGenerator.TENANTS);

        for (SeriesSnapshot series : snapshot.family(GatewayMetrics.REQUEST_DURATION.name())) {
            HistogramSeriesSnapshot histogram = (HistogramSeriesSnapshot) series;
            // durations are in [0.05, 2.0)
            assertThat(histogram.cumulativeCount(0)).as("le=0.01").isZero();
            assertThat(histogram.cumulativeCount(4)).as("le=2").isEqualTo(histogram.count());
        }

        double totalCost = snapshot.family(GatewayMetrics.COST_CENTS.name()).series().stream()
                .mapToDouble(series -> ((DoubleSeriesSnapshot) series).value())
                .sum();
        assertThat(totalCost).isPositive().isLessThan(1000 * 0.05);
    }

    @Test
    void testSameSeedSameData() {
        MetricRegistry otherRegistry = MetricRegistry.builder().build();
        new SampleDataGenerator(11L).generate(metrics, 200);
        new SampleDataGenerator(11L).generate(new GatewayMetrics(otherRegistry), 200);

        PrometheusTextWriter writer = new PrometheusTextWriter();
        assertThat(writer.render(registry.snapshot())).isEqualTo(writer.render(otherRegistry.snapshot()));
    }

    @Test
    void testZeroRequests() {
        assertThat(new SampleDataGenerator(1L).generate(metrics, 0)).isZero();
        assertThat(registry.snapshot().family(GatewayMetrics.REQUESTS.name()).series())
                .isEmpty();
    }

    @Test
    void testNegativeRequests() {
        assertThatThrownBy(() -> new SampleDataGenerator(1L).generate(metrics, -1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static long sumLongs(MetricRegistrySnapshot snapshot, String familyName) {
        return snapshot.family(familyName).series().stream()
                .mapToLong(series -> ((LongSeriesSnapshot) series).value())
                .sum();
    }

    private static List<String> labelValues(MetricRegistrySnapshot snapshot, String familyName, String label) {
        return snapshot.family(familyName).series().stream()
                .map(series -> series.labels().get(label))
                .distinct()
                .collect(Collectors.toList());
    }
}
