package com.panelkit.panel.router;

import com.panelkit.common.logging.SubsystemLogger;
import com.panelkit.panel.definition.Handlers;
import com.panelkit.panel.definition.PanelContext;
import com.panelkit.panel.definition.PanelDefinition;
import com.panelkit.panel.definition.PanelRegistry;
import com.panelkit.panel.definition.PanelResult;
import com.panelkit.panel.definition.PermissionEvaluator;
import com.panelkit.panel.persistent.PersistentPanelService;
import com.panelkit.panel.persistent.PersistentPanelWarning;
import com.panelkit.panel.platform.PanelInteraction;
import com.panelkit.panel.platform.PlatformErrorCode;
import com.panelkit.panel.platform.PlatformException;
import com.panelkit.panel.render.PanelResponses;
import com.panelkit.panel.response.PanelResponse;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Handles the confirm and cancel buttons of the persistent-panel confirmation.
 */
public class PersistentWarningHandler {

    static final String INVALID_CHANNEL_TEXT = "❌ Failed to create persistent panel - invalid channel";
    static final String OPEN_FAILED_TEXT = "❌ Failed to open persistent panel";

    private static final SubsystemLogger log = SubsystemLogger.create("panel/persistent").child("warning");

    private final PanelRegistry registry;
    private final PersistentPanelService persistent;
    private final PermissionEvaluator permissions;

    public PersistentWarningHandler(PanelRegistry registry, PersistentPanelService persistent,
            PermissionEvaluator permissions) {
        this.registry = registry;
        this.persistent = persistent;
        this.permissions = permissions;
    }

    public boolean handles(String customId) {
        return PersistentPanelWarning.isWarningId(customId);
    }

    public CompletableFuture<DispatchOutcome> handle(PanelInteraction interaction) {
        String customId = interaction.customId();
        if (!handles(customId)) {
            return CompletableFuture.completedFuture(DispatchOutcome.DROPPED);
        }
        InitialResponder responder = new InitialResponder(interaction);
        if (PersistentPanelWarning.isCancel(customId)) {
            return responder.defer()
                    .thenCompose(FollowUpResponder::deleteReply)
                    .thenApply(ignored -> DispatchOutcome.CLOSED);
        }

        Optional<PersistentPanelWarning.Confirmation> parsed = PersistentPanelWarning.parseConfirmation(customId);
        if (parsed.isEmpty()) {
            return CompletableFuture.completedFuture(DispatchOutcome.DROPPED);
        }
        PersistentPanelWarning.Confirmation confirmation = parsed.get();
        PanelDefinition panel = registry.get(confirmation.panelId()).orElse(null);
        if (panel == null) {
            return responder.update(PanelResponse.builder().content("❌ Panel not found").build())
                    .thenApply(ignored -> DispatchOutcome.NOT_FOUND);
        }

        PanelContext context = PanelContext.builder()
                .panelId(panel.id())
                .userId(interaction.userId())
                .guildId(interaction.guildId())
                .channelId(interaction.channelId())
                .accessMethod(confirmation.accessMethod())
                .navigationStack(List.of(panel.id()))
                .interaction(interaction)
                .build();
        if (!permissions.isAllowed(panel, context)) {
            return responder.update(PanelResponses.accessDenied())
                    .thenApply(ignored -> DispatchOutcome.DENIED);
        }

        return responder.defer().thenCompose(deferred -> render(panel, context)
                .thenCompose(response -> persistent.createPersistentPanel(panel, context, response, null))
                .thenCompose(message -> deferred.deleteReply())
                .thenApply(ignored -> DispatchOutcome.UPDATED)
                .exceptionallyCompose(error -> {
                    boolean invalidChannel = PlatformException.find(error)
                            .map(e -> e.getErrorCode() == PlatformErrorCode.UNKNOWN_CHANNEL)
                            .orElse(false);
                    log.error("Failed to open persistent panel", Map.of("panelId", panel.id()),
                            Handlers.unwrap(error));
                    PanelResponse failure = PanelResponse.builder()
                            .content(invalidChannel ? INVALID_CHANNEL_TEXT : OPEN_FAILED_TEXT)
                            .ephemeral(true)
                            .build();
                    return deferred.editReply(failure).thenApply(ignored -> DispatchOutcome.FAILED);
                }));
    }

    private CompletableFuture<PanelResponse> render(PanelDefinition panel, PanelContext context) {
        return Handlers.guard(() -> panel.onRender(context)).thenApply(result -> {
            if (result instanceof PanelResult.Render render) {
                return render.response();
            }
            if (result instanceof PanelResult.Failed failed) {
                throw new IllegalStateException("Render failed for panel " + panel.id(), failed.error());
            }
            throw new IllegalStateException("Persistent panel " + panel.id() + " did not render a response");
        });
    }
}
