package com.panelkit.gateway.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.panelkit.gateway.protocol.MirrorFrames;
import com.panelkit.gateway.protocol.MirrorFrames.ErrorCodes;
import com.panelkit.gateway.protocol.MirrorFrames.EventFrame;
import com.panelkit.gateway.protocol.MirrorFrames.ResponseFrame;
import com.panelkit.gateway.ratelimit.TokenBucketRateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Panel mirror socket for the remote web client.
 *
 * <p>A client is accepted when the configured token is blank or matches the
 * {@code token} query parameter captured at handshake. Requests are dispatched
 * through {@link MirrorMethodRouter}; state-changing methods are rate limited per user.
 */
@Slf4j
public class PanelMirrorWebSocketHandler extends TextWebSocketHandler {

    public static final String TOKEN_ATTRIBUTE = "auth.token";
    static final String RATE_LIMITED_MESSAGE = "Rate limit exceeded. Please wait before trying again.";

    private static final int SEND_TIME_LIMIT_MS = 10_000;
    private static final int BUFFER_SIZE_LIMIT = 512 * 1024;

    private final ObjectMapper objectMapper;
    private final MirrorMethodRouter methodRouter;
    private final WebSocketLiveUpdateChannel liveUpdates;
    private final TokenBucketRateLimiter rateLimiter;
    private final Supplier<String> authToken;
    private final Map<String, MirrorConnection> connections = new ConcurrentHashMap<>();

    public PanelMirrorWebSocketHandler(ObjectMapper objectMapper, MirrorMethodRouter methodRouter,
            WebSocketLiveUpdateChannel liveUpdates, TokenBucketRateLimiter rateLimiter, Supplier<String> authToken) {
        this.objectMapper = objectMapper;
        this.methodRouter = methodRouter;
        this.liveUpdates = liveUpdates;
        this.rateLimiter = rateLimiter;
        this.authToken = authToken;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        String connId = session.getId();
        if (!isAuthorized((String) session.getAttributes().get(TOKEN_ATTRIBUTE))) {
            log.warn("ws:reject conn={} reason=unauthorized", connId);
            closeQuietly(session, CloseStatus.POLICY_VIOLATION.withReason("Unauthorized"));
            return;
        }
        WebSocketSession concurrent =
                new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT);
        MirrorConnection connection = new MirrorConnection(connId, concurrent);
        connections.put(connId, connection);
        liveUpdates.addConnection(connection);
        connection.sendEvent(EventFrame.of(MirrorFrames.CONNECTED_EVENT,
                Map.of("message", "Connected to panel mirror")), objectMapper);
        log.info("ws:open conn={} clients={}", connId, connections.size());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        String connId = session.getId();
        MirrorConnection connection = connections.get(connId);
        if (connection == null) {
            return;
        }

        JsonNode node;
        try {
            node = objectMapper.readTree(message.getPayload());
        } catch (JsonProcessingException e) {
            log.warn("parse error conn={}: {}", connId, e.getMessage());
            connection.sendResponse(
                    ResponseFrame.failure("invalid", ErrorCodes.INVALID_REQUEST, "parse error"), objectMapper);
            return;
        }

        String frameType = node.path("type").asText(null);
        String id = node.path("id").asText(null);
        String method = node.path("method").asText(null);
        if (!"req".equals(frameType) || id == null || id.isEmpty() || method == null || method.isEmpty()) {
            connection.sendResponse(ResponseFrame.failure(id != null ? id : "invalid",
                    ErrorCodes.INVALID_REQUEST, "invalid request frame"), objectMapper);
            return;
        }

        JsonNode params = node.get("params");
        log.debug("ws:in:req conn={} id={} method={}", connId, id, method);

        if (methodRouter.mutates(method) && !rateLimiter.tryConsume(PanelMirrorMethods.userId(params))) {
            connection.sendResponse(ResponseFrame.failure(id, ErrorCodes.RATE_LIMITED, RATE_LIMITED_MESSAGE),
                    objectMapper);
            return;
        }

        methodRouter.dispatch(method, params, connection)
                .thenAccept(result -> {
                    connection.sendResponse(ResponseFrame.success(id, result), objectMapper);
                    log.debug("ws:out:res conn={} id={} method={} ok=true", connId, id, method);
                })
                .exceptionally(ex -> {
                    Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
                    String errorCode;
                    if (cause instanceof UnsupportedOperationException) {
                        errorCode = ErrorCodes.NOT_FOUND;
                        log.debug("method not found: {}", method);
                    } else if (cause instanceof IllegalArgumentException) {
                        errorCode = ErrorCodes.INVALID_REQUEST;
                        log.debug("invalid params for {}: {}", method, cause.getMessage());
                    } else {
                        errorCode = ErrorCodes.UNAVAILABLE;
                        log.error("method {} failed: {}", method, cause.getMessage(), cause);
                    }
                    connection.sendResponse(ResponseFrame.failure(id, errorCode, cause.getMessage()), objectMapper);
                    return null;
                });
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        String connId = session.getId();
        if (connections.remove(connId) != null) {
            liveUpdates.removeConnection(connId);
        }
        log.info("ws:close conn={} code={} reason={}", connId, status.getCode(), status.getReason());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.error("ws:error conn={}: {}", session.getId(), exception.getMessage());
    }

    public int getConnectionCount() {
        return connections.size();
    }

    boolean isAuthorized(String provided) {
        String expected = authToken.get();
        if (expected == null || expected.isBlank()) {
            return true;
        }
        if (provided == null) {
            return false;
        }
        return MessageDigest.isEqual(expected.getBytes(StandardCharsets.UTF_8),
                provided.getBytes(StandardCharsets.UTF_8));
    }

    private void closeQuietly(WebSocketSession session, CloseStatus status) {
        try {
            if (session.isOpen()) {
                session.close(status);
            }
        } catch (Exception e) {
            log.debug("close error: {}", e.getMessage());
        }
    }
}
