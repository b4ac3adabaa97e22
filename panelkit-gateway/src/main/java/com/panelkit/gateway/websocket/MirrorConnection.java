package com.panelkit.gateway.websocket;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.panelkit.gateway.protocol.MirrorFrames.EventFrame;
import com.panelkit.gateway.protocol.MirrorFrames.ResponseFrame;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One web client on the panel mirror socket and the panels it follows.
 */
@Slf4j
@Getter
public class MirrorConnection {

    /**
     * A followed panel. A null {@code guildId} or {@code sessionId} matches any value.
     */
    public record Subscription(String panelId, String guildId, String sessionId) {
    }

    private final String connectionId;
    private final WebSocketSession session;
    private final long connectedAt;
    private final Set<Subscription> subscriptions = ConcurrentHashMap.newKeySet();

    public MirrorConnection(String connectionId, WebSocketSession session) {
        this.connectionId = connectionId;
        this.session = session;
        this.connectedAt = System.currentTimeMillis();
    }

    public void subscribe(Subscription subscription) {
        subscriptions.add(subscription);
    }

    /**
     * Drop subscriptions to {@code panelId}, or all of them when it is null.
     *
     * @return how many were removed
     */
    public int unsubscribe(String panelId) {
        int before = subscriptions.size();
        if (panelId == null) {
            subscriptions.clear();
        } else {
            subscriptions.removeIf(s -> s.panelId().equals(panelId));
        }
        return before - subscriptions.size();
    }

    /**
     * Whether a live update for ({@code panelId}, {@code guildId}, {@code sessionId}) should reach
     * this client. Updates without a guild are global and reach every subscriber of the panel.
     */
    public boolean follows(String panelId, String guildId, String sessionId) {
        for (Subscription s : subscriptions) {
            if (!s.panelId().equals(panelId)) {
                continue;
            }
            boolean guildMatches = guildId == null || s.guildId() == null || Objects.equals(s.guildId(), guildId);
            boolean sessionMatches = sessionId == null || s.sessionId() == null
                    || Objects.equals(s.sessionId(), sessionId);
            if (guildMatches && sessionMatches) {
                return true;
            }
        }
        return false;
    }

    public boolean isOpen() {
        return session.isOpen();
    }

    public void sendResponse(ResponseFrame response, ObjectMapper mapper) {
        sendJson(response, mapper);
    }

    public void sendEvent(EventFrame event, ObjectMapper mapper) {
        sendJson(event, mapper);
    }

    private void sendJson(Object frame, ObjectMapper mapper) {
        try {
            String json = mapper.writeValueAsString(frame);
            if (session.isOpen()) {
                session.sendMessage(new TextMessage(json));
            }
        } catch (IOException e) {
            log.error("Failed to send to {}: {}", connectionId, e.getMessage());
        }
    }
}
