// SPDX-License-Identifier: Apache-2.0
package io.chittycan.metrics.core;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Base class for all metric families.
 * <p>
 * A family is a named, typed group of series. It holds immutable metadata (name, type, help and
 * optional number of fraction digits used to render floating values) and the label-name shape its
 * series share. The shape is either declared by the builder via {@link Builder#addLabelNames(String...)}
 * or fixed by the first recorded series. A recording with different label names fails with
 * {@link LabelShapeMismatchException} and leaves the family unchanged.
 * <p>
 * Constructor of this class requires a {@link Builder} instance to initialize common metadata.
 * Subclasses extending this class must provide their own builder extending {@link Builder}.
 */
public abstract class MetricFamily {

    /** Maximum value accepted by {@link Builder#setFractionDigits(int)}. */
    public static final int MAX_FRACTION_DIGITS = 15;

    @NonNull
    private final MetricType type;

    @NonNull
    private final String name;

    @NonNull
    private final String help;

    @Nullable
    private final Integer fractionDigits;

    // null until the shape is declared or fixed by the first series
    private final AtomicReference<List<String>> labelNames;

    protected MetricFamily(@NonNull Builder<?, ?> builder) {
        type = builder.type;
        name = builder.key.name();
        help = builder.help;
        fractionDigits = builder.fractionDigits;

        if (builder.labelNames.isEmpty()) {
            labelNames = new AtomicReference<>();
        } else {
            labelNames = new AtomicReference<>(
                    builder.labelNames.stream().sorted().toList());
        }
    }

    @NonNull
    public final MetricType type() {
        return type;
    }

    @NonNull
    public final String name() {
        return name;
    }

    /**
     * @return help text, empty if none was given
     */
    @NonNull
    public final String help() {
        return help;
    }

    /**
     * @return fixed number of decimals to render floating values with, or {@code null} for natural formatting
     */
    @Nullable
    public final Integer fractionDigits() {
        return fractionDigits;
    }

    /**
     * @return sorted label names shared by all series of this family,
     * empty if the family is unlabeled or its shape is not established yet
     */
    @NonNull
    public final List<String> labelNames() {
        List<String> names = labelNames.get();
        return names == null ? List.of() : names;
    }

    /**
     * @return {@code true} if the label-name shape was declared or fixed by a recorded series
     */
    public final boolean hasLabelShape() {
        return labelNames.get() != null;
    }

    /**
     * @return {@code true} if the family is computed from other families at snapshot time and stores nothing
     */
    public boolean isDerived() {
        return false;
    }

    /**
     * Validates the label names of the given label set against the family's shape without changing it.
     *
     * @param labels labels of a recording
     * @throws LabelShapeMismatchException if the names differ from the established shape
     * @throws IllegalArgumentException    if the names are not allowed for this family
     */
    protected final void checkLabelShape(@NonNull LabelSet labels) {
        List<String> expected = labelNames.get();
        if (expected == null) {
            validateLabelNames(labels.names());
        } else if (!expected.equals(labels.names())) {
            throw new LabelShapeMismatchException(name, expected, labels.names());
        }
    }

    /**
     * Fixes the label-name shape to the names of the given label set, if it is not established yet.
     * Called when the first series is inserted.
     *
     * @param labels labels of the series being inserted
     * @throws LabelShapeMismatchException if another series established a different shape concurrently
     */
    protected final void fixLabelShape(@NonNull LabelSet labels) {
        if (!labelNames.compareAndSet(null, labels.names())) {
            checkLabelShape(labels);
        }
    }

    /**
     * Hook for subclasses to reject label names that conflict with names they generate.
     *
     * @param names sorted label names
     * @throws IllegalArgumentException if a name is not allowed
     */
    protected void validateLabelNames(@NonNull List<String> names) {}

    /**
     * Copies the series of this family.
     *
     * @param storedFamilies snapshot of all stored (non-derived) families, used by derived families
     * @return series snapshots in any order
     */
    @NonNull
    protected abstract List<? extends SeriesSnapshot> collectSeries(@NonNull MetricRegistrySnapshot storedFamilies);

    /**
     * Package private, called from {@link MetricRegistry#snapshot()}.
     */
    @NonNull
    final FamilySnapshot snapshot(@NonNull MetricRegistrySnapshot storedFamilies) {
        return new FamilySnapshot(this, collectSeries(storedFamilies));
    }

    @Override
    public final String toString() {
        StringBuilder sb = new StringBuilder();

        sb.append("type=").append(type);
        sb.append(", name='").append(name).append('\'');
        if (!help.isEmpty()) {
            sb.append(", help='").append(help).append('\'');
        }
        if (fractionDigits != null) {
            sb.append(", fractionDigits=").append(fractionDigits);
        }
        sb.append(", labelNames=").append(labelNames());

        return sb.toString();
    }

    /**
     * Base builder class for constructing {@link MetricFamily} instances.
     *
     * @param <B> the concrete builder type to return for method chaining
     * @param <F> the concrete family type to build
     */
    public abstract static class Builder<B extends MetricFamily.Builder<B, F>, F extends MetricFamily> {

        private final MetricType type;
        private final MetricKey<F> key;
        private String help = "";
        private Integer fractionDigits;

        private final Set<String> labelNames = new LinkedHashSet<>();

        /**
         * Constructor for a family builder.
         *
         * @param type the metric type, must not be {@code null}
         * @param key  the metric key, must not be {@code null}
         * @throws NullPointerException if any of the parameters is {@code null}
         */
        protected Builder(@NonNull MetricType type, @NonNull MetricKey<F> key) {
            this.type = Objects.requireNonNull(type, "type must not be null");
            this.key = Objects.requireNonNull(key, "key must not be null");
        }

        /**
         * @return the metric key, never {@code null}
         */
        @NonNull
        public final MetricKey<F> key() {
            return key;
        }

        /**
         * Sets the help text. {@code null} is treated as empty.
         *
         * @param help the help text
         * @return the builder instance
         */
        @NonNull
        public final B setHelp(@Nullable String help) {
            this.help = help == null ? "" : help;
            return self();
        }

        /**
         * Fixes the number of decimals used to render the family's floating values.
         *
         * @param fractionDigits number of decimals
         * @return the builder instance
         * @throws IllegalArgumentException if out of range {@code 0..}{@value #MAX_FRACTION_DIGITS}
         */
        @NonNull
        public final B setFractionDigits(int fractionDigits) {
            if (fractionDigits < 0 || fractionDigits > MAX_FRACTION_DIGITS) {
                throw new IllegalArgumentException("Fraction digits must be in range 0.." + MAX_FRACTION_DIGITS
                        + ", but was: " + fractionDigits);
            }
            this.fractionDigits = fractionDigits;
            return self();
        }

        /**
         * Declares label names of the family's series. Duplicates are ignored.
         * Without declared names the shape is fixed by the first recorded series.
         *
         * @param names label names
         * @return the builder instance
         * @throws NullPointerException     if any label name is {@code null}
         * @throws IllegalArgumentException if any label name doesn't match regex {@value MetricUtils#LABEL_NAME_REGEX}
         */
        @NonNull
        public final B addLabelNames(@NonNull String... names) {
            Objects.requireNonNull(names, "label names must not be null");
            for (String labelName : names) {
                MetricUtils.validateLabelNameCharacters(labelName);
                labelNames.add(labelName);
            }
            return self();
        }

        /**
         * @return declared label names in insertion order
         */
        @NonNull
        protected final List<String> labelNames() {
            return List.copyOf(labelNames);
        }

        /**
         * Builds the family instance.
         *
         * @return the built family instance, never {@code null}
         * @throws IllegalStateException if the builder is incomplete or inconsistent
         */
        @NonNull
        public final F build() {
            return buildFamily();
        }

        /**
         * Registers the built family with the provided registry.
         *
         * @param registry the registry to register with, must not be {@code null}
         * @return the registered family instance, never {@code null}
         * @throws IllegalArgumentException if a family with the same name is already registered
         */
        @NonNull
        public final F register(@NonNull MetricRegistry registry) {
            Objects.requireNonNull(registry, "registry must not be null");
            return registry.register(this);
        }

        /**
         * Builds the family instance. Subclasses must implement this method to create the specific family type.
         *
         * @return the built family instance, never {@code null}
         */
        @NonNull
        protected abstract F buildFamily();

        /**
         * @return the builder instance concrete type to support fluent API
         */
        @NonNull
        @SuppressWarnings("unchecked")
        protected final B self() {
            return (B) this;
        }
    }
}
