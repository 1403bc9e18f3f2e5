package org.fuzzdex.indexing.config;

import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Properties;

/**
 * Typed configuration of one index.
 *
 * <p>{@link #load()} reads {@code fuzzdex.properties} from the classpath, then overlays environment
 * variables. Only {@code index.fields} is required; every other key has a default. Missing or invalid
 * values fail fast with {@link IllegalStateException}.</p>
 *
 * <p>The field list is fixed once the config is built.</p>
 */
public record IndexConfig(
    List<String> fields,
    String idField,
    int gramSize,
    Weights weights,
    Search search
) {
    public static final String DEFAULT_ID_FIELD = "_id";
    public static final int DEFAULT_GRAM_SIZE = 3;
    public static final int DEFAULT_GRAM_WEIGHT = 1;
    public static final int DEFAULT_WORD_WEIGHT = 50;
    public static final double DEFAULT_PRUNE_RATIO = 0.5;
    public static final int DEFAULT_QUERY_HISTORY = 100;

    private static final String RESOURCE_NAME = "fuzzdex.properties";

    /** Posting weights assigned at indexing time. */
    public record Weights(int gram, int word) {}

    /** Query-side settings: coarse pruning ratio and how many query timings to keep. */
    public record Search(double pruneRatio, int queryHistory) {}

    public IndexConfig {
        Objects.requireNonNull(fields, "fields");
        Objects.requireNonNull(idField, "idField");
        Objects.requireNonNull(weights, "weights");
        Objects.requireNonNull(search, "search");
        fields = List.copyOf(fields);
    }

    /**
     * Builds a configuration with default settings for the given fields.
     */
    public static IndexConfig defaults(List<String> fields) {
        return new IndexConfig(
            fields,
            DEFAULT_ID_FIELD,
            DEFAULT_GRAM_SIZE,
            new Weights(DEFAULT_GRAM_WEIGHT, DEFAULT_WORD_WEIGHT),
            new Search(DEFAULT_PRUNE_RATIO, DEFAULT_QUERY_HISTORY)
        );
    }

    /**
     * Loads configuration from classpath properties plus environment variables.
     *
     * @return a fully-initialized {@link IndexConfig}
     */
    public static IndexConfig load() {
        Properties properties = loadProperties(RESOURCE_NAME);
        overlayEnvironment(properties);
        return from(properties);
    }

    /**
     * Builds a configuration from already-collected properties.
     */
    public static IndexConfig from(Properties p) {
        return new IndexConfig(
            splitCsv(requireString(p, "index.fields")),
            optionalString(p, "index.id.field", DEFAULT_ID_FIELD),
            optionalPositiveInt(p, "index.gram.size", DEFAULT_GRAM_SIZE),
            readWeights(p),
            readSearch(p)
        );
    }

    private static Weights readWeights(Properties p) {
        return new Weights(
            optionalPositiveInt(p, "index.weight.gram", DEFAULT_GRAM_WEIGHT),
            optionalPositiveInt(p, "index.weight.word", DEFAULT_WORD_WEIGHT)
        );
    }

    private static Search readSearch(Properties p) {
        return new Search(
            readRatio(p, "search.prune.ratio", DEFAULT_PRUNE_RATIO),
            optionalPositiveInt(p, "search.query.history", DEFAULT_QUERY_HISTORY)
        );
    }

    private static Properties loadProperties(String resourceName) {
        Properties properties = new Properties();
        try (InputStream in = IndexConfig.class.getClassLoader().getResourceAsStream(resourceName)) {
            if (in != null) {
                properties.load(in);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load " + resourceName, e);
        }
        return properties;
    }

    private static void overlayEnvironment(Properties properties) {
        properties.putAll(System.getenv());
    }

    private static List<String> splitCsv(String csv) {
        List<String> values = Arrays.stream(csv.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .toList();
        if (values.isEmpty()) {
            throw new IllegalStateException("Missing required configuration: index.fields");
        }
        return values;
    }

    private static double readRatio(Properties properties, String key, double defaultValue) {
        String value = trimToNull(properties.getProperty(key));
        if (value == null) {
            return defaultValue;
        }
        try {
            double ratio = Double.parseDouble(value);
            if (ratio < 0.0 || ratio > 1.0) {
                throw new IllegalStateException("Configuration '" + key + "' must be within [0, 1]: " + value);
            }
            return ratio;
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid number for configuration '" + key + "': '" + value + "'", e);
        }
    }

    private static String requireString(Properties properties, String key) {
        String value = trimToNull(properties.getProperty(key));
        if (value == null) {
            throw new IllegalStateException("Missing required configuration: " + key);
        }
        return value;
    }

    private static String optionalString(Properties properties, String key, String defaultValue) {
        String value = trimToNull(properties.getProperty(key));
        return value == null ? defaultValue : value;
    }

    private static int optionalPositiveInt(Properties properties, String key, int defaultValue) {
        String value = trimToNull(properties.getProperty(key));
        if (value == null) {
            return defaultValue;
        }
        try {
            int parsed = Integer.parseInt(value);
            if (parsed <= 0) {
                throw new IllegalStateException("Configuration '" + key + "' must be positive: " + value);
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid integer for configuration '" + key + "': '" + value + "'", e);
        }
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
