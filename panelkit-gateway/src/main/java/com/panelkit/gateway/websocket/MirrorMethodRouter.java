package com.panelkit.gateway.websocket;

import com.fasterxml.jackson.databind.JsonNode;
import com.panelkit.gateway.protocol.MirrorFrames;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Table of the {@code panel.*} methods a mirror client may call.
 *
 * <p>An unknown method completes exceptionally with {@link UnsupportedOperationException},
 * which the socket answers as {@code NOT_FOUND}. Bad params surface as
 * {@link IllegalArgumentException} whether the method throws or fails its future.
 */
@Slf4j
public class MirrorMethodRouter {

    static final String METHOD_PREFIX = "panel.";

    @FunctionalInterface
    public interface MethodHandler {
        CompletableFuture<Object> handle(JsonNode params, MirrorConnection connection);
    }

    private final Map<String, MethodHandler> methods = new ConcurrentHashMap<>();

    /**
     * @throws IllegalArgumentException for a name outside {@code panel.*}
     * @throws IllegalStateException if the method is already registered
     */
    public void registerMethod(String method, MethodHandler handler) {
        if (method == null || !method.startsWith(METHOD_PREFIX) || method.length() == METHOD_PREFIX.length()) {
            throw new IllegalArgumentException("Mirror methods live under " + METHOD_PREFIX + ": " + method);
        }
        if (methods.putIfAbsent(method, handler) != null) {
            throw new IllegalStateException("Mirror method registered twice: " + method);
        }
        log.debug("mirror method {} ({})", method, mutates(method) ? "mutating" : "read-only");
    }

    /** Whether a call can change panel state, and so counts against the caller's rate limit. */
    public boolean mutates(String method) {
        return !MirrorFrames.READ_ONLY_METHODS.contains(method);
    }

    public CompletableFuture<Object> dispatch(String method, JsonNode params, MirrorConnection connection) {
        MethodHandler handler = methods.get(method);
        if (handler == null) {
            return CompletableFuture.failedFuture(new UnsupportedOperationException("Unknown method: " + method));
        }
        try {
            CompletableFuture<Object> result = handler.handle(params, connection);
            return result != null ? result : CompletableFuture.completedFuture(null);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    /** Registered names, sorted. */
    public Set<String> methods() {
        return new TreeSet<>(methods.keySet());
    }
}
