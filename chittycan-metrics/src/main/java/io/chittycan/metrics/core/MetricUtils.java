// SPDX-License-Identifier: Apache-2.0
package io.chittycan.metrics.core;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.List;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.regex.Pattern;

/**
 * Utility class for metrics-related operations.
 */
public final class MetricUtils {

    /** Regex for validating metric family names. */
    public static final String METRIC_NAME_REGEX = "^[a-zA-Z_:][a-zA-Z0-9_:]*$";

    /** Regex for validating label names. */
    public static final String LABEL_NAME_REGEX = "^[a-zA-Z_][a-zA-Z0-9_]*$";

    /** Prefix of label names reserved for internal use by scrapers. */
    public static final String RESERVED_LABEL_PREFIX = "__";

    private static final Pattern METRIC_NAME_PATTERN = Pattern.compile(METRIC_NAME_REGEX);
    private static final Pattern LABEL_NAME_PATTERN = Pattern.compile(LABEL_NAME_REGEX);

    private MetricUtils() {}

    /**
     * Validates that the provided metric name adheres to the required character set. <br>
     * Pattern to validate is: {@value #METRIC_NAME_REGEX} <br>
     * Definition in ABNF (Augmented Backus-Naur Form):
     * <pre>
     *   name = name-initial-char *name-char
     *   name-initial-char = ALPHA / "_" / ":"
     *   name-char = name-initial-char / DIGIT
     * </pre>
     *
     * @param metricName the name to validate
     * @return the validated name
     * @throws NullPointerException if metric name is {@code null}
     * @throws IllegalArgumentException if metric name is blank or contains invalid characters
     */
    @NonNull
    public static String validateMetricNameCharacters(String metricName) {
        return validateNameCharacters(METRIC_NAME_PATTERN, metricName);
    }

    /**
     * Validates that the provided label name adheres to the required character set
     * and does not use the reserved {@value #RESERVED_LABEL_PREFIX} prefix. <br>
     * Pattern to validate is: {@value #LABEL_NAME_REGEX}
     *
     * @param labelName the label name to validate
     * @return the validated name
     * @throws NullPointerException if label name is {@code null}
     * @throws IllegalArgumentException if label name is blank, reserved or contains invalid characters
     */
    @NonNull
    public static String validateLabelNameCharacters(String labelName) {
        validateNameCharacters(LABEL_NAME_PATTERN, labelName);
        if (labelName.startsWith(RESERVED_LABEL_PREFIX)) {
            throw new IllegalArgumentException("Label name is reserved: " + labelName);
        }
        return labelName;
    }

    private static String validateNameCharacters(Pattern pattern, String name) {
        throwArgBlank(name, "name");
        if (!pattern.matcher(name).matches()) {
            throw new IllegalArgumentException(
                    "Name contains illegal character: " + name + ". Required pattern is " + pattern.pattern());
        }
        return name;
    }

    /**
     * Loads implementations of the specified class using Java's ServiceLoader mechanism.
     *
     * @param serviceType   the class of the implementations to load
     * @param <T>           the type of the implementation
     * @return a list of loaded implementations
     */
    @NonNull
    public static <T> List<T> load(@NonNull Class<T> serviceType) {
        ServiceLoader<T> serviceLoader = ServiceLoader.load(serviceType);
        return serviceLoader.stream().map(ServiceLoader.Provider::get).toList();
    }

    /**
     * Validates that provided argument is not null or blank.
     *
     * @param argument     the argument checked
     * @param argumentName the name of the argument
     * @return the argument
     * @throws NullPointerException of passed argument is {@code null}
     * @throws IllegalArgumentException of passed argument is blank using {@link String#isBlank()}
     */
    @NonNull
    public static String throwArgBlank(@NonNull final String argument, @NonNull final String argumentName) {
        Objects.requireNonNull(argument, argumentName + " cannot be null");
        if (argument.isBlank()) {
            throw new IllegalArgumentException(argumentName + " cannot be blank");
        }
        return argument;
    }
}
