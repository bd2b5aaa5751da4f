package in.warmguard.util;

import java.time.Duration;

/**
 * Environment variable utilities.
 *
 * Lookup order: environment variable, then JVM system property, then the default.
 */
public final class Env {

    public static String get(String key, String defaultValue) {
        String value = System.getenv(key);
        if (value == null || value.isEmpty()) {
            value = System.getProperty(key);
        }
        return value != null && !value.isEmpty() ? value : defaultValue;
    }

    public static int getInt(String key, int defaultValue) {
        String value = get(key, null);
        if (value == null) return defaultValue;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    /**
     * Positive whole seconds; zero, negative or malformed values fall back to the default.
     */
    public static Duration getSeconds(String key, Duration defaultValue) {
        int seconds = getInt(key, -1);
        return seconds <= 0 ? defaultValue : Duration.ofSeconds(seconds);
    }

    public static Duration getMinutes(String key, Duration defaultValue) {
        int minutes = getInt(key, -1);
        return minutes <= 0 ? defaultValue : Duration.ofMinutes(minutes);
    }

    private Env() {}
}
