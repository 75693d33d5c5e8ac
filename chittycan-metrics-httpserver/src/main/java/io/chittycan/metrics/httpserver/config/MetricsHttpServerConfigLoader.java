// SPDX-License-Identifier: Apache-2.0
package io.chittycan.metrics.httpserver.config;

import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.dataformat.javaprop.JavaPropsMapper;
import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Properties;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Loads {@link MetricsHttpServerConfig} from Java properties.
 * <p>
 * Only properties starting with {@value MetricsHttpServerConfig#PREFIX}{@code .} are read, for example
 * {@code metrics.exporter.http.port=9091}. Properties that are not set keep the values of
 * {@link MetricsHttpServerConfig#DEFAULT}; unknown properties under the prefix are rejected.
 */
public final class MetricsHttpServerConfigLoader {

    private static final Logger logger = LogManager.getLogger(MetricsHttpServerConfigLoader.class);

    private static final String PROPERTY_PREFIX = MetricsHttpServerConfig.PREFIX + ".";

    private static final JavaPropsMapper MAPPER = new JavaPropsMapper();

    private MetricsHttpServerConfigLoader() {}

    /**
     * Loads the config from an optional properties file, overridden by system properties.
     *
     * @param file properties file, or {@code null} to read system properties only
     * @return the loaded config
     * @throws IOException              if the file can not be read
     * @throws IllegalArgumentException if a property is unknown or has an invalid value
     */
    @NonNull
    public static MetricsHttpServerConfig load(@Nullable Path file) throws IOException {
        final Properties fileProperties = new Properties();
        if (file != null) {
            try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
                fileProperties.load(reader);
            }
            logger.info("Loaded metrics HTTP server config file: {}", file.toAbsolutePath());
        }
        return load(fileProperties, System.getProperties());
    }

    /**
     * Loads the config from the given sources. A property set in a later source overrides an earlier one.
     *
     * @param sources properties sources
     * @return the loaded config
     * @throws IllegalArgumentException if a property is unknown or has an invalid value
     */
    @NonNull
    public static MetricsHttpServerConfig load(@NonNull Properties... sources) {
        Objects.requireNonNull(sources, "sources must not be null");

        final Properties merged = new Properties();
        for (Properties source : sources) {
            Objects.requireNonNull(source, "source must not be null");
            for (String name : source.stringPropertyNames()) {
                if (name.startsWith(PROPERTY_PREFIX)) {
                    merged.setProperty(name.substring(PROPERTY_PREFIX.length()), source.getProperty(name));
                }
            }
        }

        if (merged.isEmpty()) {
            return MetricsHttpServerConfig.DEFAULT;
        }

        final Overrides overrides;
        try {
            overrides = MAPPER.readPropertiesAs(merged, Overrides.class);
        } catch (JsonMappingException e) {
            throw new IllegalArgumentException(
                    "Invalid configuration property " + propertyName(e) + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new IllegalArgumentException("Unable to read metrics HTTP server configuration", e);
        }

        final MetricsHttpServerConfig config = overrides.applyTo(MetricsHttpServerConfig.DEFAULT);
        logger.debug("Metrics HTTP server config: {}", config);
        return config;
    }

    private static String propertyName(JsonMappingException e) {
        return e.getPath().stream()
                .map(JsonMappingException.Reference::getFieldName)
                .filter(Objects::nonNull)
                .collect(Collectors.joining(".", PROPERTY_PREFIX, ""));
    }

    /**
     * Values read from properties, {@code null} when not set.
     */
    record Overrides(
            Boolean enabled,
            String hostname,
            Integer port,
            String metricsPath,
            String healthPath,
            Integer bufferSize,
            Integer threads) {

        MetricsHttpServerConfig applyTo(MetricsHttpServerConfig base) {
            return new MetricsHttpServerConfig(
                    enabled != null ? enabled : base.enabled(),
                    hostname != null ? hostname : base.hostname(),
                    port != null ? port : base.port(),
                    metricsPath != null ? metricsPath : base.metricsPath(),
                    healthPath != null ? healthPath : base.healthPath(),
                    bufferSize != null ? bufferSize : base.bufferSize(),
                    threads != null ? threads : base.threads());
        }
    }
}
