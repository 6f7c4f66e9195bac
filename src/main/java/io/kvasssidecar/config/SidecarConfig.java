package io.kvasssidecar.config;

import io.kvasssidecar.util.EnvironmentUtils;
import lombok.Data;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

import static io.kvasssidecar.config.Constants.*;

/**
 * Configuration for the sidecar's target store.
 * Loads configuration from application.yml with fallbacks to constants.
 * <p>
 * Every manager gets its own instance, so several managers with different store directories can live in
 * one process.
 */
@Slf4j
@Getter
public class SidecarConfig {

    private final String sidecarId;
    private final Path storeDir;
    private final String storeFileName;
    private final String legacyStoreFileName;

    // Default classpath location
    private static final String DEFAULT_CONFIG_FILE_CLASSPATH = "application.yml";

    public SidecarConfig() {
        this(EnvironmentUtils.getEnv(ENV_CONFIG_FILE, null));
    }

    SidecarConfig(String externalConfigPath) {
        ConfigModel config = loadYamlConfig(externalConfigPath);

        this.sidecarId = parseSidecarId(config);
        this.storeDir = parseStoreDir(config);
        this.storeFileName = parseStoreFileName(config);
        this.legacyStoreFileName = parseLegacyStoreFileName(config);

        log.info("Loaded sidecar config - id: {}, store: {}, file: {}, legacy file: {}",
                sidecarId, storeDir, storeFileName, legacyStoreFileName);
    }

    public SidecarConfig(String sidecarId, Path storeDir, String storeFileName, String legacyStoreFileName) {
        this.sidecarId = sidecarId;
        this.storeDir = storeDir;
        this.storeFileName = storeFileName;
        this.legacyStoreFileName = legacyStoreFileName;
    }

    public static SidecarConfig forStoreDir(Path storeDir) {
        return new SidecarConfig(DEFAULT_SIDECAR_ID, storeDir, DEFAULT_STORE_FILE_NAME, DEFAULT_LEGACY_STORE_FILE_NAME);
    }

    private ConfigModel loadYamlConfig(String externalConfigPath) {
        Yaml yaml = new Yaml(new Constructor(ConfigModel.class, new LoaderOptions()));
        InputStream inputStream = null;
        String loadedFrom = "";

        // 1. External config file named by the environment
        if (externalConfigPath != null && !externalConfigPath.trim().isEmpty()) {
            log.info("External config file path specified via {}: {}", ENV_CONFIG_FILE, externalConfigPath);
            try {
                if (Files.exists(Paths.get(externalConfigPath))) {
                    inputStream = new FileInputStream(externalConfigPath);
                    loadedFrom = "external file (" + externalConfigPath + ")";
                } else {
                    log.warn("External config file specified but not found at path: {}. Falling back.", externalConfigPath);
                }
            } catch (IOException e) {
                log.warn("Error opening external config file {}: {}. Falling back.", externalConfigPath, e.getMessage());
            }
        } else {
            log.debug("{} environment variable not set, looking for config on classpath.", ENV_CONFIG_FILE);
        }

        // 2. Classpath
        if (inputStream == null) {
            inputStream = getClass().getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE_CLASSPATH);
            loadedFrom = "classpath (" + DEFAULT_CONFIG_FILE_CLASSPATH + ")";
            if (inputStream == null) {
                log.warn("Config file not found on classpath: {}. Using defaults.", DEFAULT_CONFIG_FILE_CLASSPATH);
                return new ConfigModel();
            }
        }

        // 3. Parse
        try (InputStream in = inputStream) {
            ConfigModel config = yaml.load(in);
            log.info("Successfully loaded configuration from {}", loadedFrom);
            return config != null ? config : new ConfigModel();
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to parse configuration from {}: {}. Using defaults.", loadedFrom, e.getMessage());
            return new ConfigModel();
        }
    }

    private String parseSidecarId(ConfigModel config) {
        if (config.getSidecar() != null && config.getSidecar().getId() != null
                && !config.getSidecar().getId().isBlank()) {
            return config.getSidecar().getId();
        }
        return EnvironmentUtils.getEnv(ENV_SIDECAR_ID, DEFAULT_SIDECAR_ID);
    }

    private Path parseStoreDir(ConfigModel config) {
        if (config.getStore() != null && config.getStore().getPath() != null
                && !config.getStore().getPath().isBlank()) {
            return Paths.get(config.getStore().getPath());
        }
        return Paths.get(DEFAULT_STORE_PATH);
    }

    private String parseStoreFileName(ConfigModel config) {
        if (config.getStore() != null && config.getStore().getFile() != null
                && !config.getStore().getFile().isBlank()) {
            return config.getStore().getFile();
        }
        return DEFAULT_STORE_FILE_NAME;
    }

    private String parseLegacyStoreFileName(ConfigModel config) {
        if (config.getStore() != null && config.getStore().getLegacy_file() != null
                && !config.getStore().getLegacy_file().isBlank()) {
            return config.getStore().getLegacy_file();
        }
        return DEFAULT_LEGACY_STORE_FILE_NAME;
    }

    /**
     * Configuration model for the application.yml file.
     */
    @Data
    public static class ConfigModel {
        private Sidecar sidecar;
        private Store store;
        private Map<String, Object> logging; // Spring logging levels, not read here
    }

    @Data
    public static class Sidecar {
        private String id;
    }

    @Data
    public static class Store {
        private String path;
        private String file;
        private String legacy_file;
    }
}
