package com.panelkit.gateway.websocket;

import com.fasterxml.jackson.databind.JsonNode;
import com.panelkit.gateway.protocol.MirrorFrames;
import com.panelkit.panel.definition.DefaultPermissionEvaluator;
import com.panelkit.panel.model.PanelScope;
import com.panelkit.panel.web.PanelWebAdapter;
import com.panelkit.panel.web.WebRequest;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * The {@code panel.*} methods of the mirror socket, backed by {@link PanelWebAdapter}.
 *
 * <p>Panel calls answer with the adapter's {@code {success, data, error}} result as the
 * response payload; a frame only fails for malformed params or transport problems.
 */
@Slf4j
public class PanelMirrorMethods {

    private final PanelWebAdapter adapter;

    public PanelMirrorMethods(PanelWebAdapter adapter) {
        this.adapter = adapter;
    }

    public void registerAll(MirrorMethodRouter router) {
        router.registerMethod(MirrorFrames.PANEL_LIST, (params, conn) -> CompletableFuture.completedFuture(
                adapter.listPanels(scope(params), userId(params), text(params, "guildId"))));
        router.registerMethod(MirrorFrames.PANEL_OPEN, (params, conn) -> widen(
                adapter.open(request(params, conn))));
        router.registerMethod(MirrorFrames.PANEL_BUTTON, (params, conn) -> widen(
                adapter.button(request(params, conn), required(params, "buttonId"))));
        router.registerMethod(MirrorFrames.PANEL_DROPDOWN, (params, conn) -> widen(
                adapter.dropdown(request(params, conn), text(params, "dropdownId"), strings(params, "values"))));
        router.registerMethod(MirrorFrames.PANEL_MODAL, (params, conn) -> widen(
                adapter.modal(request(params, conn), required(params, "modalId"), fields(params))));
        router.registerMethod(MirrorFrames.PANEL_SUBSCRIBE, this::subscribe);
        router.registerMethod(MirrorFrames.PANEL_UNSUBSCRIBE, this::unsubscribe);
    }

    private CompletableFuture<Object> subscribe(JsonNode params, MirrorConnection connection) {
        MirrorConnection.Subscription subscription = new MirrorConnection.Subscription(
                required(params, "panelId"), text(params, "guildId"), text(params, "sessionId"));
        connection.subscribe(subscription);
        log.debug("conn={} subscribed to {}", connection.getConnectionId(), subscription);
        return CompletableFuture.completedFuture(Map.of("subscribed", true, "panelId", subscription.panelId()));
    }

    private CompletableFuture<Object> unsubscribe(JsonNode params, MirrorConnection connection) {
        int removed = connection.unsubscribe(text(params, "panelId"));
        return CompletableFuture.completedFuture(Map.of("removed", removed));
    }

    private static WebRequest request(JsonNode params, MirrorConnection connection) {
        return new WebRequest(
                required(params, "panelId"),
                userId(params),
                text(params, "guildId"),
                text(params, "channelId"),
                strings(params, "navigationStack"));
    }

    /**
     * The requesting user; an authenticated mirror client without one acts as the owner.
     */
    static String userId(JsonNode params) {
        String userId = text(params, "userId");
        return userId != null ? userId : DefaultPermissionEvaluator.WEB_UI_OWNER;
    }

    private static PanelScope scope(JsonNode params) {
        String scope = text(params, "scope");
        return scope != null ? PanelScope.parse(scope) : null;
    }

    static String text(JsonNode params, String field) {
        if (params == null) {
            return null;
        }
        JsonNode node = params.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        String value = node.asText();
        return value.isBlank() ? null : value;
    }

    static String required(JsonNode params, String field) {
        String value = text(params, field);
        if (value == null) {
            throw new IllegalArgumentException(field + " is required");
        }
        return value;
    }

    private static List<String> strings(JsonNode params, String field) {
        List<String> values = new ArrayList<>();
        JsonNode node = params != null ? params.get(field) : null;
        if (node != null && node.isArray()) {
            node.forEach(item -> values.add(item.asText()));
        }
        return values;
    }

    private static Map<String, String> fields(JsonNode params) {
        Map<String, String> fields = new LinkedHashMap<>();
        JsonNode node = params != null ? params.get("fields") : null;
        if (node != null && node.isObject()) {
            node.fields().forEachRemaining(entry -> fields.put(entry.getKey(), entry.getValue().asText()));
        }
        return fields;
    }

    private static CompletableFuture<Object> widen(CompletableFuture<?> future) {
        return future.thenApply(result -> result);
    }
}
