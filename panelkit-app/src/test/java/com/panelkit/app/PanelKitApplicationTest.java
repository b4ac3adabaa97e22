package com.panelkit.app;

import com.fasterxml.jackson.databind.JsonNode;
import com.panelkit.app.config.RecoveryBootstrap;
import com.panelkit.app.panels.CounterPanel;
import com.panelkit.app.panels.StatusBoardPanel;
import com.panelkit.common.config.ConfigService;
import com.panelkit.panel.broadcast.PanelBroadcaster;
import com.panelkit.panel.definition.PanelRegistry;
import com.panelkit.panel.model.AccessMethod;
import com.panelkit.panel.model.PanelInstance;
import com.panelkit.panel.navigation.NavigationContextStore;
import com.panelkit.panel.recovery.PanelRecoveryManager;
import com.panelkit.panel.store.PanelInstanceStore;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class PanelKitApplicationTest {

    private static Path dataDir;

    @Autowired
    private PanelRegistry registry;
    @Autowired
    private PanelBroadcaster broadcaster;
    @Autowired
    private NavigationContextStore navigation;
    @Autowired
    private PanelInstanceStore instanceStore;
    @Autowired
    private ConfigService configService;
    @Autowired
    private RecoveryBootstrap recoveryBootstrap;
    @Autowired
    private TestRestTemplate rest;

    @DynamicPropertySource
    static void panelkitConfig(DynamicPropertyRegistry properties) throws IOException {
        dataDir = Files.createTempDirectory("panelkit-app");
        Path config = AppTestSupport.writeConfig(dataDir, null);
        long now = System.currentTimeMillis();
        // standing message in a channel no transport can reach
        new PanelInstanceStore(dataDir).put(StatusBoardPanel.ID, PanelInstance.builder()
                .messageId("m-1")
                .channelId("c-1")
                .userId("dev-1")
                .createdAt(now)
                .lastUpdated(now)
                .state(PanelInstance.STATE_ACTIVE)
                .accessMethod(AccessMethod.SYSTEM_PANEL)
                .build(), null);
        properties.add("panelkit.config.path", config::toString);
    }

    @Test
    void context_wiresPanelCore() {
        assertEquals(dataDir.resolve("panelkit.json"), configService.getConfigPath());
        assertTrue(registry.get(CounterPanel.ID).isPresent());
        assertTrue(registry.get(StatusBoardPanel.ID).isPresent());
        assertTrue(navigation.isRunning());
        assertTrue(broadcaster.hasChannels(), "web mirror should be subscribed to live updates");
    }

    @Test
    void startupRecovery_keepsRecordsWhileTransportIsMissing() throws Exception {
        PanelRecoveryManager.RecoveryReport report = recoveryBootstrap.lastRun().get(5, TimeUnit.SECONDS);

        assertEquals(new PanelRecoveryManager.RecoveryReport(0, 0, 1), report);
        assertTrue(instanceStore.get(StatusBoardPanel.ID, null).isPresent());
    }

    @Test
    void health_reportsPanelRuntime() {
        JsonNode health = rest.getForObject("/health", JsonNode.class);

        assertEquals("ok", health.get("status").asText());
        assertEquals(2, health.get("panels").get("registered").asInt());
        assertEquals(1, health.get("panels").get("persistent").asInt());
        assertTrue(health.get("webMirror").get("liveUpdates").asBoolean());
    }
}
