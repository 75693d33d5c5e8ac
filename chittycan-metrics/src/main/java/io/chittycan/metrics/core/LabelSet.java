// SPDX-License-Identifier: Apache-2.0
package io.chittycan.metrics.core;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.util.Arrays;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Canonical, immutable set of {@link Label}s identifying one series within a metric family.
 * <p>
 * Labels are kept sorted by name, so two label sets holding the same name/value pairs are equal
 * and have the same hash code regardless of the order the pairs were supplied in.
 * Label sets are {@link Comparable}, comparing the sorted pairs lexicographically, which gives
 * series a deterministic exposition order.
 */
public final class LabelSet implements Comparable<LabelSet>, Iterable<Label> {

    private static final LabelSet EMPTY = new LabelSet(new Label[0]);

    private final Label[] labels;
    private final List<String> names;

    private int hashCode = 0;

    private LabelSet(Label[] sortedLabels) {
        this.labels = sortedLabels;
        this.names = Arrays.stream(sortedLabels).map(Label::name).toList();
    }

    /**
     * @return the label set without labels
     */
    @NonNull
    public static LabelSet empty() {
        return EMPTY;
    }

    /**
     * Creates a label set from alternating label names and values,
     * e.g. {@code LabelSet.of("model", "gpt-4", "tenant", "t1")}.
     *
     * @param namesAndValues alternating label names and values
     * @return the label set
     * @throws NullPointerException     if the array, any name or any value is {@code null}
     * @throws IllegalArgumentException if names and values are not in pairs, a name is invalid or duplicated
     */
    @NonNull
    public static LabelSet of(@NonNull String... namesAndValues) {
        Objects.requireNonNull(namesAndValues, "Label names and values must not be null");
        if (namesAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("Label names and values must be in pairs");
        }
        Label[] labels = new Label[namesAndValues.length / 2];
        for (int i = 0; i < labels.length; i++) {
            labels[i] = new Label(namesAndValues[2 * i], namesAndValues[2 * i + 1]);
        }
        return create(labels);
    }

    /**
     * Creates a label set from the given labels.
     *
     * @param labels the labels
     * @return the label set
     * @throws NullPointerException     if the array or any label is {@code null}
     * @throws IllegalArgumentException if a label name is duplicated
     */
    @NonNull
    public static LabelSet of(@NonNull Label... labels) {
        Objects.requireNonNull(labels, "labels must not be null");
        return create(labels.clone());
    }

    /**
     * Creates a label set from a map of label names to values.
     *
     * @param labels the label names and values
     * @return the label set
     * @throws NullPointerException     if the map, any name or any value is {@code null}
     * @throws IllegalArgumentException if a label name is invalid
     */
    @NonNull
    public static LabelSet of(@NonNull Map<String, String> labels) {
        Objects.requireNonNull(labels, "labels must not be null");
        return create(labels.entrySet().stream()
                .map(entry -> new Label(entry.getKey(), entry.getValue()))
                .toArray(Label[]::new));
    }

    private static LabelSet create(Label[] labels) {
        if (labels.length == 0) {
            return EMPTY;
        }
        for (Label label : labels) {
            Objects.requireNonNull(label, "label must not be null");
        }
        Arrays.sort(labels);
        for (int i = 1; i < labels.length; i++) {
            if (labels[i - 1].name().equals(labels[i].name())) {
                throw new IllegalArgumentException("Duplicate label name: " + labels[i].name());
            }
        }
        return new LabelSet(labels);
    }

    /**
     * @return number of labels in this set
     */
    public int size() {
        return labels.length;
    }

    /**
     * @return {@code true} if this set holds no labels
     */
    public boolean isEmpty() {
        return labels.length == 0;
    }

    /**
     * @return label names in lexicographic order, never {@code null}
     */
    @NonNull
    public List<String> names() {
        return names;
    }

    /**
     * @param index index of the label in name order
     * @return the label at the given index
     */
    @NonNull
    public Label get(int index) {
        return labels[index];
    }

    /**
     * Returns the value of the label with the given name.
     *
     * @param name the label name
     * @return the value, or {@code null} if this set has no such label
     */
    @Nullable
    public String get(@NonNull String name) {
        Objects.requireNonNull(name, "label name must not be null");
        for (Label label : labels) {
            if (label.name().equals(name)) {
                return label.value();
            }
        }
        return null;
    }

    /**
     * Projects this label set on the given label names.
     * Names that are not part of this set are ignored.
     *
     * @param selectedNames the label names to keep
     * @return the projected label set
     */
    @NonNull
    public LabelSet select(@NonNull Collection<String> selectedNames) {
        Objects.requireNonNull(selectedNames, "selected names must not be null");
        if (selectedNames.containsAll(names)) {
            return this;
        }
        Label[] selected = Arrays.stream(labels)
                .filter(label -> selectedNames.contains(label.name()))
                .toArray(Label[]::new);
        return selected.length == 0 ? EMPTY : new LabelSet(selected);
    }

    @NonNull
    @Override
    public Iterator<Label> iterator() {
        return Arrays.asList(labels).iterator();
    }

    @Override
    public int compareTo(LabelSet other) {
        int common = Math.min(labels.length, other.labels.length);
        for (int i = 0; i < common; i++) {
            int cmp = labels[i].compareTo(other.labels[i]);
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(labels.length, other.labels.length);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        return other instanceof LabelSet that && Arrays.equals(labels, that.labels);
    }

    @Override
    public int hashCode() {
        int h = hashCode;
        if (h == 0) {
            h = Arrays.hashCode(labels);
            hashCode = h;
        }
        return h;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(labels.length * 16);
        sb.append('{');
        for (int i = 0; i < labels.length; i++) {
            if (i > 0) {
                sb.append(',');
            }
            sb.append(labels[i]);
        }
        return sb.append('}').toString();
    }
}
