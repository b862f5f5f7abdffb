package com.spectralsentinel.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Loads and validates {@link DetectorConfig} from a YAML source.
 *
 * <p>
 * The loader does not consult the environment; callers pass the path they
 * resolved themselves (the batch job reads it from its own configuration).
 * {@link #load(String)} picks the source: a non-blank path is read from the
 * file system, otherwise {@value #DEFAULT_RESOURCE} is read from the
 * classpath.
 * </p>
 *
 * <p>
 * Every entry point calls {@link DetectorConfig#validate()} after parsing, so
 * a misconfigured detector fails before any series is read. Duplicate keys
 * are rejected rather than silently overriding each other.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectorConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(DetectorConfigLoader.class);

    /** Classpath resource used when no path is configured. */
    public static final String DEFAULT_RESOURCE = "detector.yml";

    private DetectorConfigLoader() {
        // utility class, not instantiable
    }

    /**
     * @param path YAML file to read, or {@code null} / blank for the bundled
     *             {@value #DEFAULT_RESOURCE}
     * @return parsed and validated configuration
     * @throws IllegalArgumentException if the file or resource does not exist
     * @throws IllegalStateException    if reading or validation fails
     */
    public static DetectorConfig load(String path) {
        if (path == null || path.isBlank()) {
            LOG.info("No detector config path given; using classpath resource {}", DEFAULT_RESOURCE);
            return fromClasspath(DEFAULT_RESOURCE);
        }
        LOG.info("Loading detector config from {}", path);
        return fromFile(path);
    }

    /**
     * Load the configuration from a file system path.
     *
     * @param path absolute or relative path to the YAML file; must not be
     *             {@code null}
     * @return parsed and validated configuration
     * @throws NullPointerException     if {@code path} is {@code null}
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading or validation fails
     */
    public static DetectorConfig fromFile(String path) {
        Objects.requireNonNull(path, "Detector config path must not be null");
        try (InputStream is = Files.newInputStream(Path.of(path))) {
            return parseAndValidate(is);
        } catch (NoSuchFileException e) {
            throw new IllegalArgumentException("Detector config file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read detector config file: " + path, e);
        }
    }

    /**
     * Load the configuration from a classpath resource.
     *
     * @param resource classpath resource name; must not be {@code null}
     * @return parsed and validated configuration
     * @throws NullPointerException     if {@code resource} is {@code null}
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if reading or validation fails
     */
    public static DetectorConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = DetectorConfigLoader.class.getClassLoader().getResourceAsStream(resource);
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

    private static DetectorConfig parseAndValidate(InputStream is) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(DetectorConfig.class, options));
        DetectorConfig config = yaml.load(is);

        if (config == null) {
            LOG.warn("Detector config is empty; using defaults");
            config = new DetectorConfig();
        }
        config.validate();

        LOG.info("Loaded {}", config);
        return config;
    }
}
