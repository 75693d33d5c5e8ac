// SPDX-License-Identifier: Apache-2.0
package io.chittycan.metrics.exposition;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import io.chittycan.metrics.core.DoubleSeriesSnapshot;
import io.chittycan.metrics.core.FamilySnapshot;
import io.chittycan.metrics.core.HistogramSeriesSnapshot;
import io.chittycan.metrics.core.Label;
import io.chittycan.metrics.core.LabelSet;
import io.chittycan.metrics.core.LongSeriesSnapshot;
import io.chittycan.metrics.core.MetricRegistrySnapshot;
import io.chittycan.metrics.core.MetricType;
import io.chittycan.metrics.core.SeriesSnapshot;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.util.EnumMap;
import java.util.Objects;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * A writer that writes a {@link MetricRegistrySnapshot} in the Prometheus text exposition format, version 0.0.4.
 * <p>
 * Families are written in registration order and their series in {@link LabelSet} order, so the same snapshot
 * always produces the same bytes. Numbers are never written in scientific notation: integers are written as is,
 * floating values in their shortest decimal form, or with a fixed number of decimals when the family declares
 * {@link FamilySnapshot#fractionDigits()}.
 * <p>
 * This class is stateless and thread-safe.
 *
 * <p>See <a href="https://prometheus.io/docs/instrumenting/exposition_formats/">Exposition formats</a> for details.
 */
public final class PrometheusTextWriter {

    private static final Logger logger = LogManager.getLogger(PrometheusTextWriter.class);

    /** Content type of the produced text. */
    public static final String CONTENT_TYPE = "text/plain; version=0.0.4; charset=utf-8";

    private static final EnumMap<MetricType, byte[]> METRIC_TYPES = new EnumMap<>(MetricType.class);

    static {
        METRIC_TYPES.put(MetricType.COUNTER, "counter".getBytes(StandardCharsets.UTF_8));
        METRIC_TYPES.put(MetricType.GAUGE, "gauge".getBytes(StandardCharsets.UTF_8));
        METRIC_TYPES.put(MetricType.HISTOGRAM, "histogram".getBytes(StandardCharsets.UTF_8));
    }

    private static final byte COMMA = ',';
    private static final byte QUOTE = '"';
    private static final byte SPACE = ' ';
    private static final byte NEW_LINE = '\n';
    private static final byte OPEN_BRACKET = '{';
    private static final byte CLOSE_BRACKET = '}';
    private static final byte[] EQUALS_QUOTE = "=\"".getBytes(StandardCharsets.UTF_8);
    private static final byte[] LE_EQUALS_QUOTE = "le=\"".getBytes(StandardCharsets.UTF_8);

    private static final byte[] BUCKET_SUFFIX = "_bucket".getBytes(StandardCharsets.UTF_8);
    private static final byte[] SUM_SUFFIX = "_sum".getBytes(StandardCharsets.UTF_8);
    private static final byte[] COUNT_SUFFIX = "_count".getBytes(StandardCharsets.UTF_8);

    private static final byte[] TYPE = "# TYPE ".getBytes(StandardCharsets.UTF_8);
    private static final byte[] HELP = "# HELP ".getBytes(StandardCharsets.UTF_8);

    private static final String POSITIVE_INF = "+Inf";
    private static final String NEGATIVE_INF = "-Inf";
    private static final String NAN = "NaN";

    /**
     * Renders the snapshot to a string.
     *
     * @param registrySnapshot the snapshot to render
     * @return the exposition text, ending with a newline unless the snapshot is empty
     */
    @NonNull
    public String render(@NonNull MetricRegistrySnapshot registrySnapshot) {
        ByteArrayOutputStream output = new ByteArrayOutputStream(1024);
        try {
            write(registrySnapshot, output);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return output.toString(StandardCharsets.UTF_8);
    }

    /**
     * Writes the snapshot to the given output stream and flushes it. The stream is not closed.
     *
     * @param registrySnapshot the snapshot to write
     * @param output           the stream to write to
     * @throws IOException if writing to the stream fails
     */
    public void write(@NonNull MetricRegistrySnapshot registrySnapshot, @NonNull OutputStream output)
            throws IOException {
        Objects.requireNonNull(registrySnapshot, "registry snapshot must not be null");
        Objects.requireNonNull(output, "output must not be null");

        for (FamilySnapshot familySnapshot : registrySnapshot) {
            writeFamily(familySnapshot, output);
        }
        output.flush();
    }

    private void writeFamily(FamilySnapshot familySnapshot, OutputStream output) throws IOException {
        final byte[] nameBytes = familySnapshot.name().getBytes(StandardCharsets.UTF_8);
        writeFamilyMetadata(familySnapshot, nameBytes, output);

        final Integer fractionDigits = familySnapshot.fractionDigits();
        for (SeriesSnapshot series : familySnapshot) {
            if (series instanceof LongSeriesSnapshot longSeries) {
                writeSample(nameBytes, null, series.labels(), null, Long.toString(longSeries.value()), output);
            } else if (series instanceof DoubleSeriesSnapshot doubleSeries) {
                writeSample(
                        nameBytes, null, series.labels(), null, formatDouble(doubleSeries.value(), fractionDigits), output);
            } else if (series instanceof HistogramSeriesSnapshot histogramSeries) {
                writeHistogram(nameBytes, histogramSeries, fractionDigits, output);
            } else {
                logger.warn(
                        "Skipping unsupported series snapshot type: {}",
                        series.getClass().getName());
            }
        }
    }

    private void writeFamilyMetadata(FamilySnapshot familySnapshot, byte[] nameBytes, OutputStream output)
            throws IOException {
        output.write(HELP);
        output.write(nameBytes);
        output.write(SPACE);
        output.write(escapeHelp(familySnapshot.help()).getBytes(StandardCharsets.UTF_8));
        output.write(NEW_LINE);

        output.write(TYPE);
        output.write(nameBytes);
        output.write(SPACE);
        output.write(METRIC_TYPES.get(familySnapshot.type()));
        output.write(NEW_LINE);
    }

    private void writeHistogram(
            byte[] nameBytes, HistogramSeriesSnapshot series, Integer fractionDigits, OutputStream output)
            throws IOException {
        for (int i = 0; i < series.bucketCount(); i++) {
            writeSample(
                    nameBytes,
                    BUCKET_SUFFIX,
                    series.labels(),
                    formatDouble(series.bucketBound(i), null),
                    Long.toString(series.cumulativeCount(i)),
                    output);
        }
        writeSample(nameBytes, SUM_SUFFIX, series.labels(), null, formatDouble(series.sum(), fractionDigits), output);
        writeSample(nameBytes, COUNT_SUFFIX, series.labels(), null, Long.toString(series.count()), output);
    }

    private void writeSample(
            byte[] nameBytes,
            @Nullable byte[] suffix,
            LabelSet labels,
            @Nullable String bucketBound,
            String value,
            OutputStream output)
            throws IOException {
        output.write(nameBytes);
        if (suffix != null) {
            output.write(suffix);
        }

        if (!labels.isEmpty() || bucketBound != null) {
            output.write(OPEN_BRACKET);
            boolean first = true;
            for (Label label : labels) {
                if (!first) {
                    output.write(COMMA);
                }
                first = false;
                output.write(label.name().getBytes(StandardCharsets.UTF_8));
                output.write(EQUALS_QUOTE);
                output.write(escapeLabelValue(label.value()).getBytes(StandardCharsets.UTF_8));
                output.write(QUOTE);
            }
            // bucket bound always goes last
            if (bucketBound != null) {
                if (!first) {
                    output.write(COMMA);
                }
                output.write(LE_EQUALS_QUOTE);
                output.write(bucketBound.getBytes(StandardCharsets.UTF_8));
                output.write(QUOTE);
            }
            output.write(CLOSE_BRACKET);
        }

        output.write(SPACE);
        output.write(value.getBytes(StandardCharsets.UTF_8));
        output.write(NEW_LINE);
    }

    /**
     * Formats a floating value without scientific notation.
     *
     * @param value          the value
     * @param fractionDigits fixed number of decimals, or {@code null} for the shortest decimal form
     * @return the formatted value, {@code +Inf}, {@code -Inf} or {@code NaN} for non-finite values
     */
    @NonNull
    public static String formatDouble(double value, @Nullable Integer fractionDigits) {
        if (value == Double.POSITIVE_INFINITY) {
            return POSITIVE_INF;
        } else if (value == Double.NEGATIVE_INFINITY) {
            return NEGATIVE_INF;
        } else if (Double.isNaN(value)) {
            return NAN;
        } else if (fractionDigits != null) {
            return new BigDecimal(value).setScale(fractionDigits, RoundingMode.HALF_EVEN).toPlainString();
        } else if (value == 0.0) {
            return "0";
        } else {
            return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
        }
    }

    /**
     * Escape backslash {@code \}, double quote {@code "} and newline {@code \n} characters in label values.
     *
     * @param value the label value to escape
     * @return the escaped value
     */
    @NonNull
    public static String escapeLabelValue(@NonNull String value) {
        return value.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n");
    }

    /**
     * Reverses {@link #escapeLabelValue(String)}. Unknown escape sequences are kept as they are.
     *
     * @param escaped the escaped label value
     * @return the original value
     */
    @NonNull
    public static String unescapeLabelValue(@NonNull String escaped) {
        if (escaped.indexOf('\\') < 0) {
            return escaped;
        }
        StringBuilder sb = new StringBuilder(escaped.length());
        for (int i = 0; i < escaped.length(); i++) {
            char c = escaped.charAt(i);
            if (c == '\\' && i + 1 < escaped.length()) {
                char next = escaped.charAt(i + 1);
                switch (next) {
                    case '\\' -> sb.append('\\');
                    case '"' -> sb.append('"');
                    case 'n' -> sb.append('\n');
                    default -> sb.append(c).append(next);
                }
                i++;
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    /**
     * Escape backslash {@code \} and newline {@code \n} characters in help text.
     *
     * @param help the help text to escape
     * @return the escaped text
     */
    @NonNull
    public static String escapeHelp(@NonNull String help) {
        return help.replace("\\", "\\\\").replace("\n", "\\n");
    }
}
