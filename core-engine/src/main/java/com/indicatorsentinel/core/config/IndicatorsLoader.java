package com.indicatorsentinel.core.config;

import com.indicatorsentinel.core.model.Indicator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Reads an {@code indicators:} YAML document into immutable {@link Indicator}
 * instances.
 *
 * <p>
 * Parsing rejects repeated keys within a definition. Every definition is then
 * converted and checked against its type's required fields; the errors of all
 * definitions, plus any reused indicator id, are reported together in a single
 * {@link IndicatorValidationException}. Nothing is returned unless the whole
 * file is valid, so the scheduler never sees a misconfigured indicator.
 * </p>
 *
 * @since 1.0.0
 */
public final class IndicatorsLoader {

    private static final Logger LOG = LoggerFactory.getLogger(IndicatorsLoader.class);

    /** Path to an indicators file, consulted by {@link #load()} before the classpath. */
    public static final String ENV_INDICATORS_PATH = "INDICATORS_CONFIG_PATH";

    /** Classpath resource used when no path is configured. */
    public static final String DEFAULT_RESOURCE = "indicators.yml";

    private IndicatorsLoader() {
        // utility class, not instantiable
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Load indicators using automatic resolution: {@code INDICATORS_CONFIG_PATH}
     * when set and the file exists, otherwise {@value #DEFAULT_RESOURCE} on the
     * classpath.
     *
     * @return indicators in file order; empty when none are defined
     * @throws IndicatorValidationException if any definition is invalid or an id repeats
     */
    public static List<Indicator> load() {
        String envPath = System.getenv(ENV_INDICATORS_PATH);
        if (envPath != null && !envPath.isBlank() && Files.exists(Path.of(envPath))) {
            LOG.info("Loading indicators from environment path: {}", envPath);
            return fromFile(envPath);
        }
        LOG.info("Loading indicators from classpath: {}", DEFAULT_RESOURCE);
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * @param path path to the YAML file; must not be {@code null}
     * @return indicators in file order; empty when none are defined
     * @throws IllegalArgumentException     if the file does not exist
     * @throws IllegalStateException        if reading fails
     * @throws IndicatorValidationException if any definition is invalid or an id repeats
     */
    public static List<Indicator> fromFile(String path) {
        Objects.requireNonNull(path, "Indicators file path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parseAndValidate(is);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Indicators file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read indicators file: " + path, e);
        }
    }

    /**
     * @param resource classpath resource name; must not be {@code null}
     * @return indicators in file order; empty when none are defined
     * @throws IllegalArgumentException     if the resource does not exist
     * @throws IllegalStateException        if reading fails
     * @throws IndicatorValidationException if any definition is invalid or an id repeats
     */
    public static List<Indicator> fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = IndicatorsLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parseAndValidate(is);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static List<Indicator> parseAndValidate(InputStream is) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(IndicatorsConfig.class, options));
        IndicatorsConfig config = yaml.load(is);

        if (config == null || config.getIndicators().isEmpty()) {
            LOG.warn("No indicators defined in configuration");
            return List.of();
        }

        List<Indicator> indicators = config.toIndicators();
        LOG.info("Loaded {} indicator(s), {} active", indicators.size(),
                indicators.stream().filter(Indicator::isActive).count());
        return indicators;
    }
}
