package com.panelkit.panel.broadcast;

import com.fasterxml.jackson.databind.JsonNode;
import com.panelkit.common.logging.SubsystemLogger;
import com.panelkit.panel.response.PanelResponse;
import com.panelkit.panel.serialize.PanelSerializer;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Fans live panel updates out to every registered {@link LiveUpdateChannel}.
 * Having no channel or no subscriber is normal; a failing channel is logged
 * and does not affect the others or the caller.
 */
public class PanelBroadcaster {

    private static final SubsystemLogger log = SubsystemLogger.create("panel/broadcast");

    private final List<LiveUpdateChannel> channels = new CopyOnWriteArrayList<>();

    public PanelBroadcaster() {
    }

    public PanelBroadcaster(List<? extends LiveUpdateChannel> channels) {
        this.channels.addAll(channels);
    }

    public void addChannel(LiveUpdateChannel channel) {
        channels.add(channel);
    }

    public void removeChannel(LiveUpdateChannel channel) {
        channels.remove(channel);
    }

    public boolean hasChannels() {
        return !channels.isEmpty();
    }

    /**
     * Serialize {@code response} and push it.
     */
    public void broadcast(String panelId, PanelResponse response, String scopeId, String sessionId) {
        if (channels.isEmpty() || response == null) {
            return;
        }
        JsonNode document;
        try {
            document = PanelSerializer.serialize(response);
        } catch (RuntimeException e) {
            log.error("Failed to serialize live update", Map.of("panelId", panelId), e);
            return;
        }
        broadcastDocument(panelId, document, scopeId, sessionId);
    }

    public void broadcastDocument(String panelId, JsonNode document, String scopeId, String sessionId) {
        LiveUpdateMessage message = LiveUpdateMessage.of(panelId, scopeId, sessionId, document);
        for (LiveUpdateChannel channel : channels) {
            try {
                channel.send(message);
            } catch (Exception e) {
                log.warn("Live update delivery failed",
                        Map.of("panelId", panelId, "channel", channel.getClass().getSimpleName()), e);
            }
        }
    }
}
