package com.panelkit.panel.web;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.panelkit.panel.broadcast.PanelBroadcaster;
import com.panelkit.panel.codec.ActionIdCodec;
import com.panelkit.panel.codec.ActionKind;
import com.panelkit.panel.codec.CompositeActionId;
import com.panelkit.panel.definition.Handlers;
import com.panelkit.panel.definition.PanelContext;
import com.panelkit.panel.definition.PanelDefinition;
import com.panelkit.panel.definition.PanelRegistry;
import com.panelkit.panel.definition.PanelResult;
import com.panelkit.panel.definition.PermissionEvaluator;
import com.panelkit.panel.directory.DirectoryEntry;
import com.panelkit.panel.directory.PanelDirectory;
import com.panelkit.panel.model.AccessMethod;
import com.panelkit.panel.model.PanelScope;
import com.panelkit.panel.persistent.PersistentPanelService;
import com.panelkit.panel.platform.ResolvedUser;
import com.panelkit.panel.render.NavigationControls;
import com.panelkit.panel.render.ResponseRenderer;
import com.panelkit.panel.response.PanelResponse;
import com.panelkit.panel.serialize.MentionResolver;
import com.panelkit.panel.serialize.PanelSerializer;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.BiFunction;
import java.util.function.Supplier;

/**
 * Runs panels for the remote web client.
 *
 * <p>There is no chat interaction here: the handler's result is serialized into
 * the neutral document and returned. Closing a panel tells the client to go back
 * to the list. Button, dropdown and modal results are also broadcast so other
 * viewers of the same panel stay in sync.
 */
@Slf4j
public class PanelWebAdapter {

    static final String PERMISSION_DENIED = "You do not have permission to access this panel";

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final PanelRegistry registry;
    private final PanelDirectory directory;
    private final PermissionEvaluator permissions;
    private final PanelBroadcaster broadcaster;
    private final MentionResolver mentions;

    public PanelWebAdapter(PanelRegistry registry, PanelDirectory directory, PermissionEvaluator permissions,
            PanelBroadcaster broadcaster, MentionResolver mentions) {
        this.registry = registry;
        this.directory = directory;
        this.permissions = permissions;
        this.broadcaster = broadcaster;
        this.mentions = mentions;
    }

    /**
     * Listing for the web client; both scopes when {@code scope} is null.
     */
    public List<DirectoryEntry> listPanels(PanelScope scope, String userId, String guildId) {
        PanelContext viewer = PanelContext.builder()
                .userId(userId)
                .guildId(guildId)
                .accessMethod(AccessMethod.WEB_UI)
                .build();
        if (scope != null) {
            return directory.list(scope, viewer);
        }
        List<DirectoryEntry> all = new ArrayList<>(directory.list(PanelScope.SYSTEM, viewer));
        all.addAll(directory.list(PanelScope.GUILD, viewer));
        return all;
    }

    public CompletableFuture<WebResult> open(WebRequest request) {
        return execute(request, request.navigationStack(), false, PanelDefinition::onRender);
    }

    /**
     * @param buttonId full composite id ({@code panel_x_btn_y}) or the bare button id
     */
    public CompletableFuture<WebResult> button(WebRequest request, String buttonId) {
        if (NavigationControls.WEB_UI_REFRESH.equals(buttonId)) {
            return CompletableFuture.completedFuture(WebResult.ok(returnToList(null)));
        }
        String parsed = bareActionId(buttonId, ActionKind.BUTTON, "btn_");
        List<String> stack = new ArrayList<>(request.navigationStack());
        stack.add(request.panelId());
        return execute(request, stack, true, (panel, context) -> panel.onButton(context, parsed));
    }

    public CompletableFuture<WebResult> dropdown(WebRequest request, String dropdownId, List<String> values) {
        String parsed = dropdownId == null ? null : bareActionId(dropdownId, ActionKind.DROPDOWN, "dropdown_");
        List<String> selected = values == null ? List.of() : List.copyOf(values);
        return execute(request, request.navigationStack(), true,
                (panel, context) -> panel.onDropdown(context, selected, parsed));
    }

    public CompletableFuture<WebResult> modal(WebRequest request, String modalId, Map<String, String> fields) {
        String parsed = bareActionId(modalId, ActionKind.MODAL, "modal_");
        Map<String, String> submitted = fields == null ? Map.of() : Map.copyOf(fields);
        return execute(request, request.navigationStack(), true,
                (panel, context) -> panel.onModal(context, parsed, submitted));
    }

    private CompletableFuture<WebResult> execute(WebRequest request, List<String> stack, boolean broadcast,
            BiFunction<PanelDefinition, PanelContext, CompletableFuture<PanelResult>> handler) {
        PanelDefinition panel = registry.get(request.panelId()).orElse(null);
        if (panel == null) {
            return CompletableFuture.completedFuture(WebResult.fail("Panel not found: " + request.panelId()));
        }
        PanelContext context = PanelContext.builder()
                .panelId(panel.id())
                .userId(request.userId())
                .guildId(request.guildId())
                .channelId(request.channelId())
                .accessMethod(AccessMethod.WEB_UI)
                .navigationStack(stack)
                .build();
        if (!permissions.isAllowed(panel, context)) {
            return CompletableFuture.completedFuture(WebResult.fail(PERMISSION_DENIED));
        }
        Supplier<CompletableFuture<PanelResult>> call = () -> handler.apply(panel, context);
        return Handlers.guard(call)
                .thenCompose(result -> complete(panel, context, result, broadcast))
                .exceptionally(error -> {
                    Throwable cause = Handlers.unwrap(error);
                    log.error("Web panel call failed for {}: {}", panel.id(), cause.getMessage(), cause);
                    return WebResult.fail(messageOf(cause));
                });
    }

    private CompletableFuture<WebResult> complete(PanelDefinition panel, PanelContext context, PanelResult result,
            boolean broadcast) {
        if (result instanceof PanelResult.ShowModal modal) {
            return CompletableFuture.completedFuture(
                    WebResult.ok(PanelSerializer.serializeModalResponse(modal.modal())));
        }
        if (result instanceof PanelResult.Failed failed) {
            log.error("Panel {} handler failed on web mirror: {}", panel.id(),
                    failed.error() != null ? failed.error().getMessage() : "unknown", failed.error());
            return CompletableFuture.completedFuture(WebResult.fail(messageOf(failed.error())));
        }
        if (result instanceof PanelResult.HandledDirectly) {
            // nothing to show; re-render current state
            return Handlers.guard(() -> panel.onRender(context))
                    .thenCompose(rendered -> rendered instanceof PanelResult.Render
                            ? complete(panel, context, rendered, false)
                            : CompletableFuture.completedFuture(WebResult.fail("Panel produced no response")));
        }

        PanelResponse response = ((PanelResult.Render) result).response();
        if (response.isClosePanel()) {
            return CompletableFuture.completedFuture(WebResult.ok(returnToList(response)));
        }
        PanelResponse injected = ResponseRenderer.inject(response, context);
        CompletableFuture<Map<String, ResolvedUser>> users = mentions != null
                ? mentions.resolve(injected)
                : CompletableFuture.completedFuture(Map.of());
        return users.thenApply(resolved -> {
            ObjectNode document = PanelSerializer.serialize(injected, resolved);
            if (broadcast) {
                broadcaster.broadcastDocument(panel.id(), document,
                        PersistentPanelService.scopeFor(panel, context.getGuildId()), null);
            }
            return WebResult.ok(document);
        });
    }

    private static ObjectNode returnToList(PanelResponse closing) {
        ObjectNode data = NODES.objectNode();
        data.put("returnToPanelList", true);
        if (closing != null && closing.getNotification() != null) {
            data.set("notification", PanelSerializer.notification(closing.getNotification()));
        }
        return data;
    }

    /**
     * The web client sends either the composite id or the bare action id.
     */
    static String bareActionId(String id, ActionKind kind, String marker) {
        if (id == null) {
            return null;
        }
        return ActionIdCodec.decode(id, kind)
                .map(CompositeActionId::actionId)
                .orElseGet(() -> {
                    int index = id.lastIndexOf(marker);
                    return id.startsWith(ActionIdCodec.PREFIX + "_") && index >= 0
                            ? id.substring(index + marker.length())
                            : id;
                });
    }

    private static String messageOf(Throwable error) {
        return error != null && error.getMessage() != null ? error.getMessage() : "Unknown error";
    }
}
