package com.seasonalesd.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.seasonalesd.core.model.DetectorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Reads detector profiles from YAML.
 *
 * <p>
 * A document has two top-level keys. {@code detectors} lists the profiles;
 * the optional {@code defaults} mapping holds S-H-ESD settings that every
 * profile inherits unless it sets the same key itself:
 * </p>
 *
 * <pre>
 * defaults:
 *   alpha: 0.01
 *   maxAnoms: 0.02
 * detectors:
 *   - name: hourly_traffic
 *     type: timeseries
 *   - name: sensor_vector
 *     type: vector
 *     period: 24
 *     maxAnoms: 0.05
 * </pre>
 *
 * <p>
 * SnakeYAML parses the document into plain maps; each merged profile is then
 * bound to a {@link DetectorConfig} with Jackson, so a misspelt key fails
 * instead of being ignored. The whole set is validated before it is
 * returned, which means a bad profile stops a run before any detector or
 * series is touched.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectorsLoader {

    private static final Logger LOG = LoggerFactory.getLogger(DetectorsLoader.class);

    /** Environment variable that can override the default config location. */
    public static final String ENV_DETECTORS_PATH = "DETECTORS_CONFIG_PATH";

    /** Classpath resource used when no path is configured. */
    public static final String DEFAULT_RESOURCE = "detectors.yml";

    static final String DEFAULTS_KEY = "defaults";
    static final String DETECTORS_KEY = "detectors";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private DetectorsLoader() {
    }

    /**
     * Load from {@value #ENV_DETECTORS_PATH} when it names an existing file,
     * from the classpath {@value #DEFAULT_RESOURCE} otherwise.
     */
    public static DetectorsConfig load() {
        return load(System.getenv(ENV_DETECTORS_PATH));
    }

    /**
     * @param path optional file system path; may be {@code null} or blank
     * @return the validated profiles
     */
    public static DetectorsConfig load(String path) {
        if (path != null && !path.isBlank()) {
            if (Files.isRegularFile(Path.of(path))) {
                return fromFile(path);
            }
            LOG.warn("Detectors file {} does not exist, falling back to classpath", path);
        }
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if the file cannot be read or holds an
     *                                  invalid profile
     */
    public static DetectorsConfig fromFile(String path) {
        Objects.requireNonNull(path, "Detectors file path must not be null");
        Path file = Path.of(path);
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return read(reader, file.toString());
        } catch (NoSuchFileException e) {
            throw new IllegalArgumentException("Detectors file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read detectors file: " + path, e);
        }
    }

    /**
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if the resource holds an invalid profile
     */
    public static DetectorsConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream in = DetectorsLoader.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            return read(reader, "classpath:" + resource);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    static DetectorsConfig read(Reader reader, String source) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Object document = new Yaml(new SafeConstructor(options)).load(reader);

        DetectorsConfig config = new DetectorsConfig();
        if (document == null) {
            LOG.warn("No detectors defined in {}", source);
            return config;
        }

        Map<String, Object> root = mapping(document, source);
        Set<String> unknown = new TreeSet<>(root.keySet());
        unknown.remove(DEFAULTS_KEY);
        unknown.remove(DETECTORS_KEY);
        if (!unknown.isEmpty()) {
            throw new IllegalStateException("Unknown top-level key(s) " + unknown + " in " + source
                    + ". Supported: " + DEFAULTS_KEY + ", " + DETECTORS_KEY);
        }

        Map<String, Object> defaults = root.get(DEFAULTS_KEY) == null
                ? Map.of()
                : mapping(root.get(DEFAULTS_KEY), source + " " + DEFAULTS_KEY);
        if (defaults.containsKey("name")) {
            throw new IllegalStateException("'name' cannot be set in " + DEFAULTS_KEY + " of " + source);
        }

        config.setDetectors(profiles(root.get(DETECTORS_KEY), defaults, source));
        if (config.getDetectors().isEmpty()) {
            LOG.warn("No detectors defined in {}", source);
            return config;
        }

        config.validate();
        for (DetectorConfig detector : config.getDetectors()) {
            LOG.debug("Profile '{}' ({}): maxAnoms={}, alpha={}, direction={}, threshold={}",
                    detector.getName(), detector.getType(), detector.getMaxAnoms(),
                    detector.getAlpha(), detector.getDirection(), detector.getThreshold());
        }
        LOG.info("Loaded {} detector(s) from {} ({} shared default(s))",
                config.getDetectors().size(), source, defaults.size());
        return config;
    }

    private static List<DetectorConfig> profiles(Object node, Map<String, Object> defaults, String source) {
        if (node == null) {
            return List.of();
        }
        if (!(node instanceof List<?> entries)) {
            throw new IllegalStateException("'" + DETECTORS_KEY + "' in " + source + " must be a list");
        }
        List<DetectorConfig> profiles = new ArrayList<>(entries.size());
        for (int i = 0; i < entries.size(); i++) {
            String where = source + " detector #" + (i + 1);
            Map<String, Object> merged = new LinkedHashMap<>(defaults);
            merged.putAll(mapping(entries.get(i), where));
            try {
                profiles.add(MAPPER.convertValue(merged, DetectorConfig.class));
            } catch (IllegalArgumentException e) {
                throw new IllegalStateException("Cannot bind " + where + ": " + e.getMessage(), e);
            }
        }
        return profiles;
    }

    private static Map<String, Object> mapping(Object node, String where) {
        if (!(node instanceof Map<?, ?> map)) {
            throw new IllegalStateException(where + " must be a mapping, got: "
                    + (node == null ? "nothing" : node.getClass().getSimpleName()));
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        map.forEach((key, value) -> copy.put(String.valueOf(key), value));
        return copy;
    }
}
