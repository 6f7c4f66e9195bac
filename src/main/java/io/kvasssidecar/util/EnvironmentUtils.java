package io.kvasssidecar.util;

/**
 * Utility class for environment variable operations
 */
public final class EnvironmentUtils {

    private EnvironmentUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Get environment variable with default value
     *
     * @param name the environment variable name
     * @param defaultValue the default value to return if not set or blank
     * @return the trimmed environment variable value or default if not set
     */
    public static String getEnv(String name, String defaultValue) {
        String value = System.getenv(name);
        return value != null && !value.trim().isEmpty() ? value.trim() : defaultValue;
    }
}
