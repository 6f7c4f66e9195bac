package io.kvasssidecar.config;

/**
 * Application constants.
 */
public final class Constants {

    private Constants() {
        // Utility class
    }

    // Default configuration values
    public static final String DEFAULT_SIDECAR_ID = "kvass-sidecar";
    public static final String DEFAULT_STORE_PATH = "/prometheus/";
    public static final String DEFAULT_STORE_FILE_NAME = "kvass-shard.json";
    public static final String DEFAULT_LEGACY_STORE_FILE_NAME = "targets.json";

    // Environment variables
    public static final String ENV_CONFIG_FILE = "SIDECAR_CONFIG_FILE";
    public static final String ENV_SIDECAR_ID = "SIDECAR_ID";
}
