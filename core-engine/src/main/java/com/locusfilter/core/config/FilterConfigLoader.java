package com.locusfilter.core.config;

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
import java.util.Objects;

/**
 * Loads and validates {@link FilterConfig} from a YAML source.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Environment variable {@value #ENV_FILTERS_PATH} (file system path)</li>
 * <li>Explicit file system path passed to {@link #fromFile(String)}</li>
 * <li>Classpath resource via {@link #fromClasspath(String)}</li>
 * </ol>
 *
 * <h3>Validation</h3>
 * <p>
 * All {@code load*} methods call {@link FilterConfig#validate()} after
 * parsing so that the application <strong>fails fast</strong> on invalid
 * filters rather than producing undefined runtime behaviour.
 * </p>
 *
 * @since 1.0.0
 */
public final class FilterConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(FilterConfigLoader.class);

    /** Environment variable that can override the default config location. */
    public static final String ENV_FILTERS_PATH = "FILTERS_CONFIG_PATH";

    /** Classpath resource used when no path is configured. */
    public static final String DEFAULT_RESOURCE = "filters.yml";

    private FilterConfigLoader() {
        // utility class, not instantiable
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Load filters using automatic resolution.
     *
     * <ol>
     * <li>If {@code FILTERS_CONFIG_PATH} is set and the file exists, load from
     * there.</li>
     * <li>Otherwise, fall back to {@code filters.yml} on the classpath.</li>
     * </ol>
     *
     * @return parsed and validated filters configuration
     * @throws IllegalStateException if validation fails
     */
    public static FilterConfig load() {
        String envPath = System.getenv(ENV_FILTERS_PATH);
        if (envPath != null && !envPath.isBlank() && Files.exists(Path.of(envPath))) {
            LOG.info("Loading filters from environment path: {}", envPath);
            return fromFile(envPath);
        }
        LOG.info("Loading filters from classpath: {}", DEFAULT_RESOURCE);
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * Load filters from a file system path.
     *
     * @param path absolute or relative path to the YAML file; must not be
     *             {@code null}
     * @return parsed and validated filters configuration
     * @throws NullPointerException     if {@code path} is {@code null}
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading fails or validation fails
     */
    public static FilterConfig fromFile(String path) {
        Objects.requireNonNull(path, "Filters file path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parseAndValidate(is);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Filters file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read filters file: " + path, e);
        }
    }

    /**
     * Load filters from a classpath resource.
     *
     * @param resource classpath resource name; must not be {@code null}
     * @return parsed and validated filters configuration
     * @throws NullPointerException     if {@code resource} is {@code null}
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if reading fails or validation fails
     */
    public static FilterConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = FilterConfigLoader.class.getClassLoader().getResourceAsStream(resource);
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

    private static FilterConfig parseAndValidate(InputStream is) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(FilterConfig.class, options));
        FilterConfig config = yaml.load(is);

        if (config == null) {
            LOG.warn("Filters configuration is empty");
            config = new FilterConfig();
        }
        if (config.getFilters().isEmpty()) {
            LOG.warn("No filters defined in configuration");
        }
        // Fail fast if any filter or stream is misconfigured
        config.validate();

        LOG.info("Loaded {} filter(s) and {} stream(s)",
                config.getFilters().size(), config.getStreams().size());
        return config;
    }
}
