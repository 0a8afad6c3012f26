package jp.tradelog.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Configuration lookup: environment variable first, then system property, then default.
 */
public final class Env {
    private static final Logger log = LoggerFactory.getLogger(Env.class);

    public static String get(String key, String defaultValue) {
        return find(key).orElse(defaultValue);
    }

    /**
     * Integer setting. An unparsable value falls back to the default with a warning.
     */
    public static int getInt(String key, int defaultValue) {
        Optional<String> value = find(key);
        if (value.isEmpty()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.get().trim());
        } catch (NumberFormatException e) {
            log.warn("[CONFIG] {}={} is not an integer, using {}", key, value.get(), defaultValue);
            return defaultValue;
        }
    }

    /**
     * Value for {@code key}, empty when unset or blank.
     */
    public static Optional<String> find(String key) {
        String value = System.getenv(key);
        if (value == null || value.isBlank()) {
            value = System.getProperty(key);
        }
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value);
    }

    private Env() {}
}
