// SPDX-License-Identifier: Apache-2.0
package io.chittycan.metrics.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import io.chittycan.metrics.DerivedGauge;
import io.chittycan.metrics.DoubleCounter;
import io.chittycan.metrics.Histogram;
import io.chittycan.metrics.LongCounter;
import io.chittycan.metrics.ThreadUtils;
import io.chittycan.metrics.exposition.PrometheusTextWriter;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.function.Supplier;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

public class MetricRegistryTest {

    private static final String DUPLICATE_NAME = "duplicate_name";
    private static final LabelSet GPT4_T1 = LabelSet.of("model", "gpt-4", "tenant", "t1");

    private static long longValue(MetricRegistrySnapshot snapshot, String family, LabelSet labels) {
        return ((LongSeriesSnapshot) snapshot.family(family).series(labels)).value();
    }

    private static double doubleValue(MetricRegistrySnapshot snapshot, String family, LabelSet labels) {
        return ((DoubleSeriesSnapshot) snapshot.family(family).series(labels)).value();
    }

    @Nested
    class Registration {

        @Test
        void testRegisterNullBuilderThrows() {
            MetricRegistry registry = MetricRegistry.builder().build();

            assertThatThrownBy(() -> registry.register((LongCounter.Builder) null))
                    .isInstanceOf(NullPointerException.class)
                    .hasMessage("metric builder must not be null");
        }

        @Test
        void testDuplicateNameThrows() {
            MetricRegistry registry = MetricRegistry.builder().build();
            registry.register(LongCounter.builder(DUPLICATE_NAME));

            assertThatThrownBy(() -> registry.register(Histogram.builder(DUPLICATE_NAME)))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContainingAll("Duplicate metric name", DUPLICATE_NAME);
            assertThat(registry.families()).hasSize(1);
        }

        @Test
        void testGetFamily() {
            MetricRegistry registry = MetricRegistry.builder().build();
            LongCounter counter = LongCounter.builder("requests_total").register(registry);

            assertThat(registry.getFamily(LongCounter.key("requests_total"))).isSameAs(counter);
            assertThat(registry.containsFamily(LongCounter.key("requests_total"))).isTrue();
        }

        @Test
        void testGetMissingFamilyThrows() {
            MetricRegistry registry = MetricRegistry.builder().build();

            assertThatThrownBy(() -> registry.getFamily(LongCounter.key("missing")))
                    .isInstanceOf(NoSuchElementException.class)
                    .hasMessageContaining("missing");
            assertThat(registry.containsFamily(LongCounter.key("missing"))).isFalse();
        }

        @Test
        void testGetFamilyWithWrongTypeThrows() {
            MetricRegistry registry = MetricRegistry.builder().build();
            registry.register(LongCounter.builder("requests_total"));

            assertThatThrownBy(() -> registry.getFamily(DoubleCounter.key("requests_total")))
                    .isInstanceOf(ClassCastException.class);
            assertThat(registry.containsFamily(DoubleCounter.key("requests_total"))).isFalse();
        }

        @Test
        void testFamiliesInRegistrationOrderAndUnmodifiable() {
            MetricRegistry registry = MetricRegistry.builder().build();
            registry.register(LongCounter.builder("b_total"));
            registry.register(Histogram.builder("a_seconds"));
            registry.recordCounter("c_total", LabelSet.empty(), 1L);

            assertThat(registry.families())
                    .extracting(MetricFamily::name)
                    .containsExactly("b_total", "a_seconds", "c_total");
            assertThatThrownBy(() -> registry.families().clear())
                    .isInstanceOf(UnsupportedOperationException.class);
        }

        @Test
        void testDiscoverMetricProviders() {
            MetricRegistry registry = MetricRegistry.builder().discoverMetricProviders().build();

            assertThat(registry.containsFamily(TestMetricsRegistrationProvider.DISCOVERED_COUNTER)).isTrue();
            assertThat(registry.getFamily(TestMetricsRegistrationProvider.DISCOVERED_HISTOGRAM).labelNames())
                    .containsExactly("model");
        }

        @Test
        void testNoDiscoveryByDefault() {
            MetricRegistry registry = MetricRegistry.builder().build();

            assertThat(registry.families()).isEmpty();
        }

        @Test
        void testAddFamilies() {
            MetricRegistry registry = MetricRegistry.builder()
                    .addFamilies(List.of(LongCounter.builder("a_total"), DoubleCounter.builder("b_total")))
                    .build();

            assertThat(registry.families()).extracting(MetricFamily::name).containsExactly("a_total", "b_total");
        }
    }

    @Nested
    class Exporter {

        @Test
        void testExporterReceivesSnapshotSupplier() {
            MetricsExporter exporter = mock(MetricsExporter.class);
            MetricRegistry registry =
                    MetricRegistry.builder().setMetricsExporter(exporter).build();
            registry.recordCounter("requests_total", GPT4_T1, 3L);

            @SuppressWarnings("unchecked")
            ArgumentCaptor<Supplier<MetricRegistrySnapshot>> captor = ArgumentCaptor.forClass(Supplier.class);
            verify(exporter).setSnapshotSupplier(captor.capture());

            assertThat(registry.hasMetricsExporter()).isTrue();
            assertThat(longValue(captor.getValue().get(), "requests_total", GPT4_T1))
                    .isEqualTo(3L);
        }

        @Test
        void testCloseClosesExporter() throws IOException {
            MetricsExporter exporter = mock(MetricsExporter.class);
            MetricRegistry registry =
                    MetricRegistry.builder().setMetricsExporter(exporter).build();

            registry.close();

            verify(exporter).close();
        }

        @Test
        void testNullExporterThrows() {
            assertThatThrownBy(() -> MetricRegistry.builder().setMetricsExporter(null))
                    .isInstanceOf(NullPointerException.class)
                    .hasMessage("metrics exporter must not be null");
        }
    }

    @Nested
    class RecordCounter {

        @Test
        void testLazilyRegistersLongCounter() {
            MetricRegistry registry = MetricRegistry.builder().build();

            registry.recordCounter("requests_total", GPT4_T1, 2L);
            registry.recordCounter("requests_total", LabelSet.of("tenant", "t1", "model", "gpt-4"), 3L);

            LongCounter counter = registry.getFamily(LongCounter.key("requests_total"));
            assertThat(counter.help()).isEmpty();
            assertThat(counter.labelNames()).containsExactly("model", "tenant");
            assertThat(counter.getOrCreate(GPT4_T1).get()).isEqualTo(5L);
        }

        @Test
        void testLazilyRegistersDoubleCounter() {
            MetricRegistry registry = MetricRegistry.builder().build();

            registry.recordCounter("cost_cents_total", GPT4_T1, 1.25);
            registry.recordCounter("cost_cents_total", GPT4_T1, 2L);

            assertThat(registry.containsFamily(DoubleCounter.key("cost_cents_total"))).isTrue();
            assertThat(doubleValue(registry.snapshot(), "cost_cents_total", GPT4_T1))
                    .isEqualTo(3.25);
        }

        @Test
        void testConcurrentIncrementsAreNotLost() throws InterruptedException {
            MetricRegistry registry = MetricRegistry.builder().build();

            ThreadUtils.runConcurrentAndWait(10, Duration.ofSeconds(5), i -> () -> {
                for (int j = 0; j < 10; j++) {
                    registry.recordCounter("requests_total", GPT4_T1, 1L);
                }
            });

            assertThat(new PrometheusTextWriter().render(registry.snapshot()))
                    .isEqualTo("# HELP requests_total \n"
                            + "# TYPE requests_total counter\n"
                            + "requests_total{model=\"gpt-4\",tenant=\"t1\"} 100\n");
        }

        @Test
        void testConcurrentDoubleIncrementsSumUp() throws InterruptedException {
            MetricRegistry registry = MetricRegistry.builder().build();

            ThreadUtils.runConcurrentAndWait(8, Duration.ofSeconds(5), i -> () -> {
                for (int j = 0; j < 1000; j++) {
                    registry.recordCounter("cost_total", LabelSet.empty(), 0.5);
                }
            });

            assertThat(doubleValue(registry.snapshot(), "cost_total", LabelSet.empty()))
                    .isEqualTo(4000.0);
        }

        @Test
        void testNegativeDeltaLeavesRegistryUnchanged() {
            MetricRegistry registry = MetricRegistry.builder().build();

            assertThatThrownBy(() -> registry.recordCounter("requests_total", GPT4_T1, -1L))
                    .isInstanceOf(InvalidDeltaException.class)
                    .hasMessageContaining("must be non-negative");
            assertThatThrownBy(() -> registry.recordCounter("requests_total", GPT4_T1, -0.5))
                    .isInstanceOf(InvalidDeltaException.class);
            assertThatThrownBy(() -> registry.recordCounter("requests_total", GPT4_T1, Double.NaN))
                    .isInstanceOf(InvalidDeltaException.class);

            assertThat(registry.families()).isEmpty();
        }

        @Test
        void testNegativeDeltaKeepsExistingValue() {
            MetricRegistry registry = MetricRegistry.builder().build();
            registry.recordCounter("requests_total", GPT4_T1, 4L);

            assertThatThrownBy(() -> registry.recordCounter("requests_total", GPT4_T1, -4L))
                    .isInstanceOfSatisfying(
                            InvalidDeltaException.class,
                            e -> assertThat(e.familyName()).isEqualTo("requests_total"));
            assertThat(longValue(registry.snapshot(), "requests_total", GPT4_T1)).isEqualTo(4L);
        }

        @Test
        void testLabelShapeMismatchLeavesRegistryUnchanged() {
            MetricRegistry registry = MetricRegistry.builder().build();
            registry.recordCounter("requests_total", GPT4_T1, 1L);
            MetricRegistrySnapshot before = registry.snapshot();

            assertThatThrownBy(() -> registry.recordCounter("requests_total", LabelSet.of("model", "gpt-4"), 1L))
                    .isInstanceOf(LabelShapeMismatchException.class)
                    .hasMessageContainingAll("[model]", "[model, tenant]", "requests_total");

            PrometheusTextWriter writer = new PrometheusTextWriter();
            assertThat(writer.render(registry.snapshot())).isEqualTo(writer.render(before));
            assertThat(registry.getFamily(LongCounter.key("requests_total")).seriesCount())
                    .isEqualTo(1);
        }

        @Test
        void testDeclaredLabelNamesAreEnforced() {
            MetricRegistry registry = MetricRegistry.builder().build();
            LongCounter counter = LongCounter.builder("requests_total")
                    .addLabelNames("tenant", "model")
                    .register(registry);

            assertThatThrownBy(() -> registry.recordCounter("requests_total", LabelSet.empty(), 1L))
                    .isInstanceOf(LabelShapeMismatchException.class);
            assertThat(counter.seriesCount()).isZero();
            assertThat(counter.labelNames()).containsExactly("model", "tenant");
        }

        @Test
        void testConcurrentFirstSeriesFixesOneShape() throws InterruptedException {
            MetricRegistry registry = MetricRegistry.builder().build();
            ConcurrentLinkedQueue<Throwable> failures = new ConcurrentLinkedQueue<>();

            ThreadUtils.runConcurrentAndWait(10, Duration.ofSeconds(5), i -> () -> {
                LabelSet labels = i % 2 == 0 ? LabelSet.of("a", "x" + i) : LabelSet.of("b", "x" + i);
                try {
                    registry.recordCounter("shape_total", labels, 1L);
                } catch (LabelShapeMismatchException e) {
                    failures.add(e);
                }
            });

            LongCounter counter = registry.getFamily(LongCounter.key("shape_total"));
            assertThat(counter.seriesCount()).isEqualTo(5);
            assertThat(failures).hasSize(5);
            assertThat(registry.snapshot().family("shape_total").series())
                    .allSatisfy(series -> assertThat(series.labels().names()).isEqualTo(counter.labelNames()));
        }

        @Test
        void testDoubleDeltaOnLongCounterThrows() {
            MetricRegistry registry = MetricRegistry.builder().build();
            registry.recordCounter("requests_total", GPT4_T1, 1L);

            assertThatThrownBy(() -> registry.recordCounter("requests_total", GPT4_T1, 1.5))
                    .isInstanceOf(IllegalArgumentException.class)
                    .isNotInstanceOf(MetricRecordingException.class)
                    .hasMessageContaining("use a long delta");
        }

        @Test
        void testCounterOnHistogramThrows() {
            MetricRegistry registry = MetricRegistry.builder().build();
            registry.register(Histogram.builder("latency_seconds"));

            assertThatThrownBy(() -> registry.recordCounter("latency_seconds", LabelSet.empty(), 1L))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("is not a counter");
        }

        @Test
        void testInvalidFamilyNameThrows() {
            MetricRegistry registry = MetricRegistry.builder().build();

            assertThatThrownBy(() -> registry.recordCounter("bad-name", LabelSet.empty(), 1L))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThat(registry.families()).isEmpty();
        }
    }

    @Nested
    class RecordHistogram {

        @Test
        void testObservationCountedInBuckets() {
            MetricRegistry registry = MetricRegistry.builder().build();
            Histogram.builder("latency_seconds")
                    .setBuckets(0.01, 0.1, 0.5)
                    .register(registry);

            registry.recordHistogramObservation("latency_seconds", LabelSet.empty(), 0.03);

            HistogramSeriesSnapshot series = (HistogramSeriesSnapshot)
                    registry.snapshot().family("latency_seconds").series(LabelSet.empty());
            assertThat(series.bucketBounds()).containsExactly(0.01, 0.1, 0.5, Double.POSITIVE_INFINITY);
            assertThat(series.cumulativeCounts()).containsExactly(0L, 1L, 1L, 1L);
            assertThat(series.sum()).isEqualTo(0.03);
            assertThat(series.count()).isEqualTo(1L);
        }

        @Test
        void testUnknownBucketsLeavesRegistryUnchanged() {
            MetricRegistry registry = MetricRegistry.builder().build();

            assertThatThrownBy(() -> registry.recordHistogramObservation("latency_seconds", LabelSet.empty(), 0.1))
                    .isInstanceOf(UnknownBucketsException.class)
                    .hasMessageContaining("latency_seconds");
            assertThat(registry.families()).isEmpty();
        }

        @Test
        void testObservationOnCounterThrowsUnknownBuckets() {
            MetricRegistry registry = MetricRegistry.builder().build();
            registry.recordCounter("requests_total", LabelSet.empty(), 1L);

            assertThatThrownBy(() -> registry.recordHistogramObservation("requests_total", LabelSet.empty(), 0.1))
                    .isInstanceOf(UnknownBucketsException.class);
        }

        @Test
        void testNaNObservationThrows() {
            MetricRegistry registry = MetricRegistry.builder().build();
            Histogram histogram = Histogram.builder("latency_seconds").register(registry);

            assertThatThrownBy(() ->
                            registry.recordHistogramObservation("latency_seconds", LabelSet.empty(), Double.NaN))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("NaN");
            assertThat(histogram.seriesCount()).isZero();
        }

        @Test
        void testBucketLabelRejected() {
            MetricRegistry registry = MetricRegistry.builder().build();
            Histogram histogram = Histogram.builder("latency_seconds").register(registry);

            assertThatThrownBy(() ->
                            registry.recordHistogramObservation("latency_seconds", LabelSet.of("le", "1"), 0.2))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("reserved");
            assertThat(histogram.seriesCount()).isZero();
            assertThat(histogram.hasLabelShape()).isFalse();
        }

        @Test
        void testLabelShapeMismatch() {
            MetricRegistry registry = MetricRegistry.builder().build();
            Histogram histogram =
                    Histogram.builder("latency_seconds").addLabelNames("model").register(registry);

            assertThatThrownBy(() -> registry.recordHistogramObservation("latency_seconds", GPT4_T1, 0.2))
                    .isInstanceOf(LabelShapeMismatchException.class);
            assertThat(histogram.seriesCount()).isZero();
        }
    }

    @Nested
    class Snapshot {

        @Test
        void testSnapshotIsImmutable() {
            MetricRegistry registry = MetricRegistry.builder().build();
            registry.recordCounter("requests_total", GPT4_T1, 1L);

            MetricRegistrySnapshot snapshot = registry.snapshot();
            registry.recordCounter("requests_total", GPT4_T1, 1L);
            registry.recordCounter("other_total", LabelSet.empty(), 1L);

            assertThat(snapshot.families()).hasSize(1);
            assertThat(longValue(snapshot, "requests_total", GPT4_T1)).isEqualTo(1L);
            assertThat(longValue(registry.snapshot(), "requests_total", GPT4_T1)).isEqualTo(2L);
        }

        @Test
        void testSeriesOrderedByLabels() {
            MetricRegistry registry = MetricRegistry.builder().build();
            registry.recordCounter("requests_total", LabelSet.of("model", "b"), 1L);
            registry.recordCounter("requests_total", LabelSet.of("model", "a"), 1L);
            registry.recordCounter("requests_total", LabelSet.of("model", "c"), 1L);

            assertThat(registry.snapshot().family("requests_total").series())
                    .extracting(series -> series.labels().get("model"))
                    .containsExactly("a", "b", "c");
        }

        @Test
        void testDerivedFamiliesSeeStoredFamilies() {
            MetricRegistry registry = MetricRegistry.builder().build();
            DerivedGauge.builder("requests_double")
                    .compute(stored -> {
                        long total = longValue(stored, "requests_total", LabelSet.empty());
                        return Map.of(LabelSet.empty(), 2.0 * total);
                    })
                    .register(registry);
            registry.recordCounter("requests_total", LabelSet.empty(), 21L);

            MetricRegistrySnapshot snapshot = registry.snapshot();

            assertThat(snapshot.families()).extracting(FamilySnapshot::name)
                    .containsExactly("requests_double", "requests_total");
            assertThat(doubleValue(snapshot, "requests_double", LabelSet.empty())).isEqualTo(42.0);
        }

        @Test
        void testEmptyRegistrySnapshot() {
            MetricRegistry registry = MetricRegistry.builder().build();

            assertThat(registry.snapshot().isEmpty()).isTrue();
            assertThat(registry.snapshot().family("anything")).isNull();
        }
    }
}
