package com.driftsentinel.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.DoubleConsumer;
import java.util.function.Function;
import java.util.function.IntConsumer;

/**
 * Reads {@code monitoring.yml} and lays it over {@link MonitoringConfig#defaults()}.
 *
 * <p>
 * A document only needs the keys it changes. Each key present replaces the
 * default; everything else keeps its default value. {@code thresholds} is
 * merged tier by tier, so {@code thresholds: {high: 4.0}} keeps the default
 * {@code low} and {@code medium}. The keys a document overrode are logged
 * once at INFO so a deployment shows exactly where it departs from the
 * defaults.
 * </p>
 *
 * <p>
 * Unknown keys, misspelt tier names, values of the wrong type and duplicate
 * keys are all rejected in one {@link IllegalStateException} naming the
 * source, before {@link MonitoringConfig#validate()} checks the merged
 * values.
 * </p>
 *
 * <h3>Where the document comes from</h3>
 * <ol>
 * <li>{@value #ENV_CONFIG_PATH}, when set, must name a readable file.</li>
 * <li>Otherwise {@value #DEFAULT_RESOURCE} on the classpath.</li>
 * <li>Otherwise the built-in defaults.</li>
 * </ol>
 *
 * @since 1.0.0
 */
public final class MonitoringConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(MonitoringConfigLoader.class);

    /** Environment variable naming a monitoring config file. */
    public static final String ENV_CONFIG_PATH = "MONITORING_CONFIG_PATH";

    /** Classpath resource read when {@value #ENV_CONFIG_PATH} is unset. */
    public static final String DEFAULT_RESOURCE = "monitoring.yml";

    static final List<String> TOP_LEVEL_KEYS = List.of(
            "baselineName", "thresholds", "fallbackFloor", "errorFloor", "duplicateFloor",
            "healthyScore", "criticalHealthScore", "summaryWindowDays", "trendTolerance",
            "recentAlertCount");

    static final List<String> THRESHOLD_KEYS = List.of("low", "medium", "high");

    private MonitoringConfigLoader() {
        // utility class
    }

    // ---------------------------------------------------------------
    // Entry points
    // ---------------------------------------------------------------

    /**
     * Resolve and load the monitoring config for this process.
     *
     * @return merged and validated configuration
     * @throws IllegalArgumentException if {@value #ENV_CONFIG_PATH} names a missing file
     * @throws IllegalStateException    if the document is malformed or invalid
     */
    public static MonitoringConfig load() {
        return load(System::getenv);
    }

    static MonitoringConfig load(Function<String, String> env) {
        String envPath = env.apply(ENV_CONFIG_PATH);
        if (envPath != null && !envPath.isBlank()) {
            LOG.info("Loading monitoring config from {}={}", ENV_CONFIG_PATH, envPath);
            return fromFile(envPath);
        }
        if (MonitoringConfigLoader.class.getClassLoader().getResource(DEFAULT_RESOURCE) == null) {
            LOG.info("No {} on the classpath; monitoring with built-in defaults", DEFAULT_RESOURCE);
            return MonitoringConfig.defaults();
        }
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * @param path YAML file; must not be {@code null}
     * @return merged and validated configuration
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if the file cannot be read, or is malformed or invalid
     */
    public static MonitoringConfig fromFile(String path) {
        Objects.requireNonNull(path, "Monitoring config path must not be null");
        try (InputStream is = Files.newInputStream(Path.of(path))) {
            return fromStream(is, path);
        } catch (NoSuchFileException e) {
            throw new IllegalArgumentException("Monitoring config file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Could not read monitoring config file " + path, e);
        }
    }

    /**
     * @param resource classpath resource name; must not be {@code null}
     * @return merged and validated configuration
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if the resource is malformed or invalid
     */
    public static MonitoringConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Monitoring config resource must not be null");
        InputStream is = MonitoringConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Monitoring config resource not found on classpath: " + resource);
        }
        try (is) {
            return fromStream(is, "classpath:" + resource);
        } catch (IOException e) {
            throw new IllegalStateException("Could not read monitoring config resource " + resource, e);
        }
    }

    /**
     * Merge an in-memory YAML document over the defaults.
     *
     * @param yaml   document text; must not be {@code null}
     * @param origin label used in log lines and error messages
     * @return merged and validated configuration
     * @throws IllegalStateException if the document is malformed or invalid
     */
    public static MonitoringConfig fromString(String yaml, String origin) {
        Objects.requireNonNull(yaml, "yaml must not be null");
        return bind(parse(new StringReader(yaml), origin), origin);
    }

    // ---------------------------------------------------------------
    // Parsing and merging
    // ---------------------------------------------------------------

    private static MonitoringConfig fromStream(InputStream is, String origin) {
        return bind(parse(new InputStreamReader(is, StandardCharsets.UTF_8), origin), origin);
    }

    private static Object parse(Reader reader, String origin) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new SafeConstructor(options));
        try {
            return yaml.load(reader);
        } catch (YAMLException e) {
            throw new IllegalStateException("Malformed YAML in monitoring config " + origin + ": "
                    + e.getMessage(), e);
        }
    }

    private static MonitoringConfig bind(Object document, String origin) {
        MonitoringConfig config = MonitoringConfig.defaults();
        if (document == null) {
            LOG.info("Monitoring config {} is empty; monitoring with built-in defaults", origin);
            return config;
        }
        if (!(document instanceof Map)) {
            throw new IllegalStateException("Monitoring config " + origin
                    + " must be a mapping of keys, got: " + document.getClass().getSimpleName());
        }

        List<String> overridden = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        for (Map.Entry<?, ?> entry : ((Map<?, ?>) document).entrySet()) {
            String key = String.valueOf(entry.getKey());
            Object value = entry.getValue();
            switch (key) {
                case "baselineName" -> {
                    if (value instanceof String) {
                        config.setBaselineName((String) value);
                        overridden.add(key);
                    } else {
                        errors.add(typeError(key, "a string", value));
                    }
                }
                case "thresholds" -> mergeThresholds(config.getThresholds(), value, overridden, errors);
                case "fallbackFloor" -> applyDouble(key, value, config::setFallbackFloor, overridden, errors);
                case "errorFloor" -> applyDouble(key, value, config::setErrorFloor, overridden, errors);
                case "duplicateFloor" -> applyDouble(key, value, config::setDuplicateFloor, overridden, errors);
                case "healthyScore" -> applyDouble(key, value, config::setHealthyScore, overridden, errors);
                case "criticalHealthScore" ->
                        applyDouble(key, value, config::setCriticalHealthScore, overridden, errors);
                case "summaryWindowDays" -> applyInt(key, value, config::setSummaryWindowDays, overridden, errors);
                case "trendTolerance" -> applyDouble(key, value, config::setTrendTolerance, overridden, errors);
                case "recentAlertCount" -> applyInt(key, value, config::setRecentAlertCount, overridden, errors);
                default -> errors.add("unknown key '" + key + "' (expected one of " + TOP_LEVEL_KEYS + ")");
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException("Monitoring config " + origin + " is not usable:\n  - "
                    + String.join("\n  - ", errors));
        }
        config.validate();

        if (overridden.isEmpty()) {
            LOG.info("Monitoring config {} overrides nothing; using defaults", origin);
        } else {
            LOG.info("Monitoring config {} overrides {}: {}", origin, overridden, config);
        }
        return config;
    }

    private static void mergeThresholds(MonitoringConfig.Thresholds tiers, Object value,
            List<String> overridden, List<String> errors) {
        if (!(value instanceof Map)) {
            errors.add(typeError("thresholds", "a mapping of low/medium/high", value));
            return;
        }
        for (Map.Entry<?, ?> tier : ((Map<?, ?>) value).entrySet()) {
            String key = "thresholds." + tier.getKey();
            switch (String.valueOf(tier.getKey())) {
                case "low" -> applyDouble(key, tier.getValue(), tiers::setLow, overridden, errors);
                case "medium" -> applyDouble(key, tier.getValue(), tiers::setMedium, overridden, errors);
                case "high" -> applyDouble(key, tier.getValue(), tiers::setHigh, overridden, errors);
                default -> errors.add("unknown key '" + key + "' (expected one of " + THRESHOLD_KEYS + ")");
            }
        }
    }

    private static void applyDouble(String key, Object value, DoubleConsumer setter,
            List<String> overridden, List<String> errors) {
        if (value instanceof Number) {
            setter.accept(((Number) value).doubleValue());
            overridden.add(key);
        } else {
            errors.add(typeError(key, "a number", value));
        }
    }

    private static void applyInt(String key, Object value, IntConsumer setter,
            List<String> overridden, List<String> errors) {
        if ((value instanceof Integer || value instanceof Long)
                && ((Number) value).longValue() == ((Number) value).intValue()) {
            setter.accept(((Number) value).intValue());
            overridden.add(key);
        } else {
            errors.add(typeError(key, "a whole number", value));
        }
    }

    private static String typeError(String key, String expected, Object value) {
        return "'" + key + "' must be " + expected + ", got: " + value;
    }
}
