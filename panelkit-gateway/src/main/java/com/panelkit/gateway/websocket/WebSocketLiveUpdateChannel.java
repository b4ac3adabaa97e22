package com.panelkit.gateway.websocket;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.panelkit.gateway.protocol.MirrorFrames;
import com.panelkit.gateway.protocol.MirrorFrames.EventFrame;
import com.panelkit.panel.broadcast.LiveUpdateChannel;
import com.panelkit.panel.broadcast.LiveUpdateMessage;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Delivers panel live updates to the mirror clients subscribed to them.
 */
@Slf4j
public class WebSocketLiveUpdateChannel implements LiveUpdateChannel {

    private final Map<String, MirrorConnection> connections = new ConcurrentHashMap<>();
    private final ObjectMapper objectMapper;
    private final AtomicLong seq = new AtomicLong(0);

    public WebSocketLiveUpdateChannel(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public void addConnection(MirrorConnection connection) {
        connections.put(connection.getConnectionId(), connection);
    }

    public void removeConnection(String connectionId) {
        connections.remove(connectionId);
    }

    public int getConnectionCount() {
        return connections.size();
    }

    @Override
    public void send(LiveUpdateMessage message) {
        LiveUpdateMessage.Data data = message.data();
        EventFrame frame = EventFrame.of(MirrorFrames.LIVE_UPDATE_EVENT, data);
        frame.setSeq(seq.incrementAndGet());
        int delivered = 0;
        for (MirrorConnection conn : connections.values()) {
            if (!conn.isOpen() || !conn.follows(data.panelId(), data.guildId(), data.sessionId())) {
                continue;
            }
            try {
                conn.sendEvent(frame, objectMapper);
                delivered++;
            } catch (Exception e) {
                log.warn("Failed to deliver live update for {} to {}: {}",
                        data.panelId(), conn.getConnectionId(), e.getMessage());
            }
        }
        log.debug("Live update for {} delivered to {} client(s)", data.panelId(), delivered);
    }
}
