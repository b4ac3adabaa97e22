package com.panelkit.common.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Root configuration model, bound from {@code panelkit.json}.
 * Every section has usable defaults so a missing file yields a working config.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class PanelKitConfig {

    private NavigationConfig navigation = new NavigationConfig();
    private RouterConfig router = new RouterConfig();
    private StorageConfig storage = new StorageConfig();
    private RecoveryConfig recovery = new RecoveryConfig();
    private PermissionsConfig permissions = new PermissionsConfig();
    private AdminPanelConfig adminPanel = new AdminPanelConfig();
    private WebMirrorConfig webMirror = new WebMirrorConfig();
    private LoggingConfig logging = new LoggingConfig();

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class NavigationConfig {
        /** Entries older than this are evicted by the sweep. */
        private long ttlMs = 30L * 60 * 1000;
        private long sweepIntervalMs = 5L * 60 * 1000;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RouterConfig {
        /** Headroom inside the platform's ~3s acknowledgment window. */
        private long ackDeadlineMs = 2500;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class StorageConfig {
        private String dataDir;
        private long sessionExpiryMs = 24L * 60 * 60 * 1000;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RecoveryConfig {
        private boolean enabled = true;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PermissionsConfig {
        private List<String> devs = new ArrayList<>();
        private String mainGuildId;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class AdminPanelConfig {
        private int itemsPerPage = 10;
        private boolean enablePagination = true;
        private String defaultCategory = "General";
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class WebMirrorConfig {
        private boolean enabled = true;
        /** Shared secret the web client passes as {@code ?token=}; blank disables the check. */
        private String authToken;
        private RateLimitConfig rateLimit = new RateLimitConfig();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RateLimitConfig {
        private int bucketCapacity = 5;
        private long refillRateMs = 1000;
        private long cleanupAgeMs = 5L * 60 * 1000;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class LoggingConfig {
        private String level = "info";
        private List<String> subsystems = new ArrayList<>();
    }
}
