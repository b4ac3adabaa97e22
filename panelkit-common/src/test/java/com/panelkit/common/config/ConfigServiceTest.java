package com.panelkit.common.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConfigServiceTest {

    @TempDir
    Path tempDir;
    private Path configPath;

    @BeforeEach
    void setUp() {
        configPath = tempDir.resolve("panelkit.json");
    }

    private ConfigService service(Map<String, String> env) {
        return new ConfigService(configPath, Duration.ofMinutes(1), env);
    }

    @Test
    void loadConfig_validJson_returnsConfig() throws IOException {
        Files.writeString(configPath, """
                {
                  "navigation": { "ttlMs": 60000 },
                  "router": { "ackDeadlineMs": 1500 },
                  "permissions": { "devs": ["42"], "mainGuildId": "777" }
                }
                """);

        PanelKitConfig config = service(Map.of()).loadConfig();

        assertEquals(60_000, config.getNavigation().getTtlMs());
        assertEquals(5 * 60 * 1000, config.getNavigation().getSweepIntervalMs());
        assertEquals(1500, config.getRouter().getAckDeadlineMs());
        assertEquals(List.of("42"), config.getPermissions().getDevs());
        assertEquals("777", config.getPermissions().getMainGuildId());
    }

    @Test
    void loadConfig_missingFile_returnsDefaults() {
        PanelKitConfig config = service(Map.of("PANELKIT_DATA_DIR", tempDir.toString())).loadConfig();

        assertEquals(30 * 60 * 1000, config.getNavigation().getTtlMs());
        assertEquals(2500, config.getRouter().getAckDeadlineMs());
        assertEquals(24L * 60 * 60 * 1000, config.getStorage().getSessionExpiryMs());
        assertTrue(config.getRecovery().isEnabled());
        assertEquals(tempDir.toAbsolutePath().normalize().toString(), config.getStorage().getDataDir());
        assertEquals(5, config.getWebMirror().getRateLimit().getBucketCapacity());
    }

    @Test
    void loadConfig_unknownPropertiesIgnored() throws IOException {
        Files.writeString(configPath, """
                { "somethingElse": true, "adminPanel": { "defaultCategory": "Ops", "extra": 1 } }
                """);

        PanelKitConfig config = service(Map.of()).loadConfig();

        assertEquals("Ops", config.getAdminPanel().getDefaultCategory());
    }

    @Test
    void loadConfig_itemsPerPageIsClamped() throws IOException {
        Files.writeString(configPath, """
                { "adminPanel": { "itemsPerPage": 99 } }
                """);

        assertEquals(25, service(Map.of()).loadConfig().getAdminPanel().getItemsPerPage());
    }

    @Test
    void loadConfig_nullSectionFallsBackToDefault() throws IOException {
        Files.writeString(configPath, """
                { "navigation": null, "webMirror": { "rateLimit": null } }
                """);

        PanelKitConfig config = service(Map.of()).loadConfig();

        assertNotNull(config.getNavigation());
        assertEquals(1000, config.getWebMirror().getRateLimit().getRefillRateMs());
    }

    @Test
    void loadConfig_substitutesEnvVars() throws IOException {
        Files.writeString(configPath, """
                { "storage": { "dataDir": "${PANEL_HOME:-/tmp/fallback}" },
                  "permissions": { "mainGuildId": "${MAIN_GUILD}" } }
                """);

        PanelKitConfig config = service(Map.of("MAIN_GUILD", "123")).loadConfig();

        assertEquals("/tmp/fallback", config.getStorage().getDataDir());
        assertEquals("123", config.getPermissions().getMainGuildId());
    }

    @Test
    void substituteEnvVars_plainString_noChange() {
        assertEquals("hello", service(Map.of()).substituteEnvVars("hello"));
    }

    @Test
    void substituteEnvVars_missingWithoutDefault_empty() {
        assertEquals("x--y", service(Map.of()).substituteEnvVars("x-${NOPE}-y"));
    }

    @Test
    void loadConfig_isCached() throws IOException {
        Files.writeString(configPath, "{}");

        ConfigService service = service(Map.of());

        assertSame(service.loadConfig(), service.loadConfig());
    }

    @Test
    void reloadConfig_picksUpChanges() throws IOException {
        Files.writeString(configPath, "{ \"router\": { \"ackDeadlineMs\": 100 } }");
        ConfigService service = service(Map.of());
        assertEquals(100, service.loadConfig().getRouter().getAckDeadlineMs());

        Files.writeString(configPath, "{ \"router\": { \"ackDeadlineMs\": 200 } }");

        assertEquals(200, service.reloadConfig().getRouter().getAckDeadlineMs());
    }

    @Test
    void saveConfig_roundTripsThroughDisk() throws IOException {
        ConfigService service = service(Map.of());
        PanelKitConfig config = new PanelKitConfig();
        config.getAdminPanel().setItemsPerPage(7);

        service.saveConfig(config);

        assertTrue(Files.exists(configPath));
        assertEquals(7, service.loadConfig().getAdminPanel().getItemsPerPage());
    }

    @Test
    void loadConfig_malformedJson_returnsDefaults() throws IOException {
        Files.writeString(configPath, "{ not json");

        PanelKitConfig config = service(Map.of()).loadConfig();

        assertEquals(2500, config.getRouter().getAckDeadlineMs());
    }
}
