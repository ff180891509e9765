package de.bsommerfeld.feedengine.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Reads {@code config.yml} into a {@link GlobalConfig}.
 *
 * <p>
 * The YAML document is flattened into dotted keys ({@code store.path},
 * {@code enrichment.quality-tier}) and applied onto a default-initialized
 * config, so a missing file or a missing key simply keeps the default.
 * Unknown keys are logged and ignored.
 *
 * <p>
 * The database location can be overridden without touching the file, via the
 * {@code feeds.db.path} system property or the {@code FEEDS_DB_PATH}
 * environment variable (property wins). Tests use this to isolate stores.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    static final String DB_PATH_PROPERTY = "feeds.db.path";
    static final String DB_PATH_ENV = "FEEDS_DB_PATH";

    private ConfigLoader() {
    }

    /**
     * Loads the config at {@code path}. A non-existent file yields defaults.
     *
     * @throws IOException              if the file exists but cannot be read
     * @throws IllegalArgumentException if the YAML is malformed or a value has
     *                                  the wrong type
     */
    public static GlobalConfig load(Path path) throws IOException {
        Objects.requireNonNull(path, "path");
        GlobalConfig config = new GlobalConfig();

        if (Files.exists(path)) {
            LOG.info("Loading configuration from {}", path.toAbsolutePath());
            try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
                apply(config, flatten(new Yaml().load(reader)));
            } catch (YAMLException e) {
                throw new IllegalArgumentException("Failed to parse YAML config at " + path, e);
            }
        } else {
            LOG.info("No configuration at {}, using defaults", path.toAbsolutePath());
        }

        applyStoreOverride(config, System.getProperty(DB_PATH_PROPERTY), System.getenv(DB_PATH_ENV));
        return config;
    }

    /** Parses YAML text directly; used for embedded defaults and tests. */
    public static GlobalConfig parse(String yaml) {
        GlobalConfig config = new GlobalConfig();
        try {
            apply(config, flatten(new Yaml().load(yaml)));
        } catch (YAMLException e) {
            throw new IllegalArgumentException("Failed to parse YAML config", e);
        }
        return config;
    }

    static void applyStoreOverride(GlobalConfig config, String property, String env) {
        String override = property != null && !property.isBlank() ? property : env;
        if (override != null && !override.isBlank()) {
            LOG.info("Database path overridden: {}", override);
            config.getStore().setPath(override);
        }
    }

    // =====================================================================
    // Flattening
    // =====================================================================

    static Map<String, String> flatten(Object document) {
        Map<String, String> flat = new LinkedHashMap<>();
        if (document == null)
            return flat;
        if (!(document instanceof Map<?, ?> root))
            throw new IllegalArgumentException("Config root must be a mapping");
        flatten(root, "", flat);
        return flat;
    }

    private static void flatten(Map<?, ?> source, String prefix, Map<String, String> target) {
        for (Map.Entry<?, ?> entry : source.entrySet()) {
            if (!(entry.getKey() instanceof String key) || key.isBlank()) {
                throw new IllegalArgumentException("Config contains a non-string or blank key under '" + prefix + "'");
            }
            String composite = prefix.isEmpty() ? key : prefix + '.' + key;
            Object value = entry.getValue();
            if (value instanceof Map<?, ?> nested) {
                flatten(nested, composite, target);
            } else {
                target.put(composite.toLowerCase(Locale.ROOT), value == null ? "" : value.toString());
            }
        }
    }

    // =====================================================================
    // Binding
    // =====================================================================

    private static void apply(GlobalConfig config, Map<String, String> values) {
        for (Map.Entry<String, String> entry : values.entrySet()) {
            String key = entry.getKey();
            String value = entry.getValue().trim();
            switch (key) {
                case "store.path":
                    config.getStore().setPath(value);
                    break;
                case "http.timeout-seconds":
                    config.getHttp().setTimeoutSeconds(positiveInt(key, value));
                    break;
                case "http.user-agent":
                    config.getHttp().setUserAgent(value);
                    break;
                case "ingestion.fetch-concurrency":
                    config.getIngestion().setFetchConcurrency(positiveInt(key, value));
                    break;
                case "ingestion.hackernews-concurrency":
                    config.getIngestion().setHackerNewsConcurrency(positiveInt(key, value));
                    break;
                case "ingestion.default-limit":
                    config.getIngestion().setDefaultLimit(nonNegativeInt(key, value));
                    break;
                case "ingestion.content-policy":
                    config.getIngestion().setContentPolicy(contentPolicy(value));
                    break;
                case "enrichment.auto-transcribe":
                    config.getEnrichment().setAutoTranscribe(bool(key, value));
                    break;
                case "enrichment.quality-tier":
                    config.getEnrichment().setQualityTier(value);
                    break;
                case "enrichment.cache-dir":
                    config.getEnrichment().setCacheDir(value);
                    break;
                case "enrichment.max-per-cycle":
                    config.getEnrichment().setMaxPerCycle(positiveInt(key, value));
                    break;
                default:
                    LOG.warn("Ignoring unknown config key '{}'", key);
            }
        }
    }

    private static int positiveInt(String key, String value) {
        int parsed = integer(key, value);
        if (parsed <= 0)
            throw new IllegalArgumentException(key + " must be positive, got " + value);
        return parsed;
    }

    private static int nonNegativeInt(String key, String value) {
        int parsed = integer(key, value);
        if (parsed < 0)
            throw new IllegalArgumentException(key + " must not be negative, got " + value);
        return parsed;
    }

    private static int integer(String key, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer, got '" + value + "'", e);
        }
    }

    private static boolean bool(String key, String value) {
        if ("true".equalsIgnoreCase(value))
            return true;
        if ("false".equalsIgnoreCase(value))
            return false;
        throw new IllegalArgumentException(key + " must be true or false, got '" + value + "'");
    }

    private static ContentPolicy contentPolicy(String value) {
        try {
            return ContentPolicy.valueOf(value.toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("ingestion.content-policy must be summary-first or content-first", e);
        }
    }
}
