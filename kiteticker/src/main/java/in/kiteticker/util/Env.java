package in.kiteticker.util;

import java.time.Duration;

/**
 * Environment variable utilities.
 * A variable that is unset or empty falls back to the system property of the same name.
 */
public final class Env {

    public static String get(String key, String defaultValue) {
        String value = System.getenv(key);
        if (value == null || value.isEmpty()) {
            value = System.getProperty(key);
        }
        return value != null && !value.isEmpty() ? value : defaultValue;
    }

    /**
     * @throws IllegalStateException if the variable is not set
     */
    public static String require(String key) {
        String value = get(key, null);
        if (value == null) {
            throw new IllegalStateException("Missing required environment variable " + key);
        }
        return value;
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

    public static boolean getBool(String key, boolean defaultValue) {
        String value = get(key, null);
        if (value == null) return defaultValue;
        return "true".equalsIgnoreCase(value) || "1".equals(value);
    }

    /**
     * Duration given in whole seconds.
     */
    public static Duration getSeconds(String key, Duration defaultValue) {
        String value = get(key, null);
        if (value == null) return defaultValue;
        try {
            return Duration.ofSeconds(Long.parseLong(value.trim()));
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private Env() {}
}
