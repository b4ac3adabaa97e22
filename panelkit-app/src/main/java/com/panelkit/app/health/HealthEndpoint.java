package com.panelkit.app.health;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.panelkit.gateway.websocket.PanelMirrorWebSocketHandler;
import com.panelkit.panel.broadcast.PanelBroadcaster;
import com.panelkit.panel.definition.PanelRegistry;
import com.panelkit.panel.navigation.NavigationContextStore;
import com.panelkit.panel.store.PanelInstanceStore;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.lang.management.ManagementFactory;

/**
 * Liveness check with a snapshot of the panel runtime.
 */
@RestController
public class HealthEndpoint {

    private final ObjectMapper mapper;
    private final PanelRegistry registry;
    private final NavigationContextStore navigation;
    private final PanelInstanceStore instanceStore;
    private final PanelBroadcaster broadcaster;
    private final ObjectProvider<PanelMirrorWebSocketHandler> mirror;

    public HealthEndpoint(ObjectMapper mapper, PanelRegistry registry, NavigationContextStore navigation,
            PanelInstanceStore instanceStore, PanelBroadcaster broadcaster,
            ObjectProvider<PanelMirrorWebSocketHandler> mirror) {
        this.mapper = mapper;
        this.registry = registry;
        this.navigation = navigation;
        this.instanceStore = instanceStore;
        this.broadcaster = broadcaster;
        this.mirror = mirror;
    }

    @GetMapping("/health")
    public ObjectNode health() {
        ObjectNode node = mapper.createObjectNode();
        node.put("status", "ok");
        node.put("uptime", ManagementFactory.getRuntimeMXBean().getUptime());

        ObjectNode panels = node.putObject("panels");
        panels.put("registered", registry.size());
        panels.put("navigationContexts", navigation.size());
        panels.put("sweeperRunning", navigation.isRunning());
        int standing = 0;
        for (String scope : instanceStore.listScopes()) {
            standing += instanceStore.list(scope).size();
        }
        panels.put("persistent", standing);

        ObjectNode web = node.putObject("webMirror");
        PanelMirrorWebSocketHandler handler = mirror.getIfAvailable();
        web.put("connections", handler != null ? handler.getConnectionCount() : 0);
        web.put("liveUpdates", broadcaster.hasChannels());
        return node;
    }
}
