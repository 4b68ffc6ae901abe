package com.aegis.allocation.infra.config;

import java.util.Arrays;
import java.util.List;

/**
 * Reads deployment settings from environment variables, falling back to
 * system properties and then to a default.
 */
public final class EnvironmentConfig {

    private EnvironmentConfig() {
        throw new AssertionError("No instances");
    }

    /**
     * Get value from environment variable, falling back to the system property of the same name.
     */
    public static String get(String key, String defaultValue) {
        return get(key, key, defaultValue);
    }

    /**
     * Get value from the environment variable {@code envKey}, falling back to the system property
     * {@code propertyKey}.
     */
    public static String get(String envKey, String propertyKey, String defaultValue) {
        String value = System.getenv(envKey);
        if (value == null || value.isBlank()) {
            value = System.getProperty(propertyKey, defaultValue);
        }
        return value;
    }

    public static boolean getBoolean(String key, boolean defaultValue) {
        return Boolean.parseBoolean(get(key, String.valueOf(defaultValue)).trim());
    }

    public static int getInt(String envKey, String propertyKey, int defaultValue) {
        String value = get(envKey, propertyKey, null);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    String.format("%s must be an integer, got: %s", propertyKey, value), e);
        }
    }

    /**
     * Splits a comma-separated value, trimming entries and dropping empty ones.
     */
    public static List<String> splitList(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }
}
