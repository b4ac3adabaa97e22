package com.panelkit.common.config;

import java.nio.file.Path;
import java.util.Map;

/**
 * Resolves the data directory and config file location.
 */
public final class ConfigPaths {

    private ConfigPaths() {
    }

    private static final String STATE_DIRNAME = ".panelkit";
    private static final String CONFIG_FILENAME = "panelkit.json";

    /**
     * Data directory for durable panel records and config.
     * Can be overridden via PANELKIT_DATA_DIR. Default: ~/.panelkit
     */
    public static Path resolveDataDir() {
        return resolveDataDir(System.getenv(), System.getProperty("user.home"));
    }

    public static Path resolveDataDir(Map<String, String> env, String homedir) {
        String override = trimmed(env.get("PANELKIT_DATA_DIR"));
        if (override != null) {
            return resolveUserPath(override, homedir);
        }
        return Path.of(homedir, STATE_DIRNAME);
    }

    /**
     * Config file path. PANELKIT_CONFIG_PATH wins over {@code <dataDir>/panelkit.json}.
     */
    public static Path resolveConfigPath() {
        return resolveConfigPath(System.getenv(), System.getProperty("user.home"));
    }

    public static Path resolveConfigPath(Map<String, String> env, String homedir) {
        String override = trimmed(env.get("PANELKIT_CONFIG_PATH"));
        if (override != null) {
            return resolveUserPath(override, homedir);
        }
        return resolveDataDir(env, homedir).resolve(CONFIG_FILENAME);
    }

    /**
     * Expand a leading {@code ~} to the given home directory.
     */
    public static Path resolveUserPath(String input, String homedir) {
        String trimmed = input.trim();
        if (trimmed.equals("~")) {
            return Path.of(homedir);
        }
        if (trimmed.startsWith("~/")) {
            return Path.of(homedir, trimmed.substring(2));
        }
        return Path.of(trimmed).toAbsolutePath().normalize();
    }

    private static String trimmed(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }
}
