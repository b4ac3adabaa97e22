package com.panelkit.common.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads and caches the PanelKit configuration file.
 */
@Slf4j
public class ConfigService {

    private static final Duration DEFAULT_CACHE_TTL = Duration.ofMillis(200);
    private static final Pattern ENV_VAR_PATTERN = Pattern.compile("\\$\\{([^}:]+)(?::-(.*?))?}");

    private final ObjectMapper objectMapper;
    private final Cache<String, PanelKitConfig> cache;
    private final Path configPath;
    private final Map<String, String> env;

    public ConfigService(Path configPath) {
        this(configPath, DEFAULT_CACHE_TTL, System.getenv());
    }

    public ConfigService(Path configPath, Duration cacheTtl, Map<String, String> env) {
        String pathStr = configPath.toString();
        if (pathStr.startsWith("~")) {
            configPath = ConfigPaths.resolveUserPath(pathStr, System.getProperty("user.home"));
        }
        this.configPath = configPath;
        this.env = env;
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(cacheTtl)
                .maximumSize(1)
                .build();
    }

    /**
     * Load config with caching.
     */
    public PanelKitConfig loadConfig() {
        return cache.get(configPath.toString(), key -> doLoadConfig());
    }

    /**
     * Force reload config, bypassing cache.
     */
    public PanelKitConfig reloadConfig() {
        cache.invalidateAll();
        return loadConfig();
    }

    /**
     * Write the config back to disk as pretty-printed JSON.
     */
    public void saveConfig(PanelKitConfig config) throws IOException {
        Path parent = configPath.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        Files.writeString(configPath, json);
        cache.invalidateAll();
        log.info("Config saved to: {}", configPath);
    }

    public Path getConfigPath() {
        return configPath;
    }

    private PanelKitConfig doLoadConfig() {
        PanelKitConfig config;
        if (!Files.exists(configPath)) {
            log.warn("Config file not found: {}, using defaults", configPath);
            config = new PanelKitConfig();
        } else {
            try {
                String raw = substituteEnvVars(Files.readString(configPath));
                config = objectMapper.readValue(raw, PanelKitConfig.class);
                log.info("Config loaded from: {}", configPath);
            } catch (IOException e) {
                log.error("Failed to load config from: {}", configPath, e);
                config = new PanelKitConfig();
            }
        }
        return applyDefaults(config);
    }

    /**
     * Fill sections left null by a partial file and clamp out-of-range values.
     */
    PanelKitConfig applyDefaults(PanelKitConfig config) {
        if (config.getNavigation() == null) {
            config.setNavigation(new PanelKitConfig.NavigationConfig());
        }
        if (config.getRouter() == null) {
            config.setRouter(new PanelKitConfig.RouterConfig());
        }
        if (config.getStorage() == null) {
            config.setStorage(new PanelKitConfig.StorageConfig());
        }
        if (config.getStorage().getDataDir() == null || config.getStorage().getDataDir().isBlank()) {
            config.getStorage().setDataDir(
                    ConfigPaths.resolveDataDir(env, System.getProperty("user.home")).toString());
        }
        if (config.getRecovery() == null) {
            config.setRecovery(new PanelKitConfig.RecoveryConfig());
        }
        if (config.getPermissions() == null) {
            config.setPermissions(new PanelKitConfig.PermissionsConfig());
        }
        if (config.getAdminPanel() == null) {
            config.setAdminPanel(new PanelKitConfig.AdminPanelConfig());
        }
        var adminPanel = config.getAdminPanel();
        adminPanel.setItemsPerPage(Math.max(1, Math.min(25, adminPanel.getItemsPerPage())));
        if (config.getWebMirror() == null) {
            config.setWebMirror(new PanelKitConfig.WebMirrorConfig());
        }
        if (config.getWebMirror().getRateLimit() == null) {
            config.getWebMirror().setRateLimit(new PanelKitConfig.RateLimitConfig());
        }
        if (config.getLogging() == null) {
            config.setLogging(new PanelKitConfig.LoggingConfig());
        }
        return config;
    }

    /**
     * Substitute ${VAR} and ${VAR:-default} patterns.
     */
    String substituteEnvVars(String raw) {
        Matcher matcher = ENV_VAR_PATTERN.matcher(raw);
        StringBuilder result = new StringBuilder();

        while (matcher.find()) {
            String varName = matcher.group(1);
            String defaultValue = matcher.group(2);
            String value = env.getOrDefault(varName,
                    defaultValue != null ? defaultValue : "");
            matcher.appendReplacement(result, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(result);
        return result.toString();
    }
}
