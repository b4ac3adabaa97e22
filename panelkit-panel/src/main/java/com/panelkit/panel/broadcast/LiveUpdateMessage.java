package com.panelkit.panel.broadcast;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Inter-process live update: {@code {type: "panel:live_update", data: {panelId, guildId, sessionId, response}}}.
 * {@code guildId} carries the scope id and is null for the global scope.
 */
public record LiveUpdateMessage(String type, Data data) {

    public static final String TYPE = "panel:live_update";

    public record Data(String panelId, String guildId, String sessionId, JsonNode response) {
    }

    public static LiveUpdateMessage of(String panelId, String scopeId, String sessionId, JsonNode response) {
        return new LiveUpdateMessage(TYPE, new Data(panelId, scopeId, sessionId, response));
    }
}
