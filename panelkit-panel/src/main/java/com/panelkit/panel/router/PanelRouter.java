package com.panelkit.panel.router;

import com.panelkit.common.logging.SubsystemLogger;
import com.panelkit.panel.codec.ActionIdCodec;
import com.panelkit.panel.codec.ActionKind;
import com.panelkit.panel.codec.CompositeActionId;
import com.panelkit.panel.definition.PanelContext;
import com.panelkit.panel.definition.Handlers;
import com.panelkit.panel.definition.PanelDefinition;
import com.panelkit.panel.definition.PanelRegistry;
import com.panelkit.panel.definition.PanelResult;
import com.panelkit.panel.definition.PermissionEvaluator;
import com.panelkit.panel.model.AccessMethod;
import com.panelkit.panel.model.PanelInstance;
import com.panelkit.panel.navigation.AccessMethodDetector;
import com.panelkit.panel.navigation.NavigationContext;
import com.panelkit.panel.navigation.NavigationContextStore;
import com.panelkit.panel.persistent.PersistentPanelService;
import com.panelkit.panel.persistent.PersistentPanelWarning;
import com.panelkit.panel.platform.InteractionType;
import com.panelkit.panel.platform.PanelInteraction;
import com.panelkit.panel.platform.PlatformMessage;
import com.panelkit.panel.render.PanelResponses;
import com.panelkit.panel.render.ResponseRenderer;
import com.panelkit.panel.response.Notification;
import com.panelkit.panel.response.PanelResponse;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Routes component interactions to panel handlers.
 *
 * <p>The platform must see an acknowledgment within a few seconds. The handler
 * is raced against {@code ackDeadlineMs}: a handler that answers in time may
 * still open a modal; a slow one gets the interaction deferred first and its
 * result delivered as an edit.
 */
public class PanelRouter {

    public static final long DEFAULT_ACK_DEADLINE_MS = 2500;

    private static final SubsystemLogger log = SubsystemLogger.create("panel/router");

    private final PanelRegistry registry;
    private final NavigationContextStore navigation;
    private final PersistentPanelService persistent;
    private final PermissionEvaluator permissions;
    private final long ackDeadlineMs;

    public PanelRouter(PanelRegistry registry, NavigationContextStore navigation,
            PersistentPanelService persistent, PermissionEvaluator permissions) {
        this(registry, navigation, persistent, permissions, DEFAULT_ACK_DEADLINE_MS);
    }

    public PanelRouter(PanelRegistry registry, NavigationContextStore navigation,
            PersistentPanelService persistent, PermissionEvaluator permissions, long ackDeadlineMs) {
        this.registry = registry;
        this.navigation = navigation;
        this.persistent = persistent;
        this.permissions = permissions;
        this.ackDeadlineMs = ackDeadlineMs;
    }

    /**
     * Handle a button press, select-menu choice or modal submission.
     * Interactions whose id does not decode as a panel action are ignored.
     */
    public CompletableFuture<DispatchOutcome> dispatch(PanelInteraction interaction) {
        ActionKind kind = kindOf(interaction.type());
        Optional<CompositeActionId> decoded = ActionIdCodec.decode(interaction.customId(), kind);
        if (decoded.isEmpty()) {
            log.debug("Ignoring non-panel interaction", Map.of("customId", String.valueOf(interaction.customId())));
            return CompletableFuture.completedFuture(DispatchOutcome.DROPPED);
        }
        CompositeActionId action = decoded.get();
        InitialResponder responder = new InitialResponder(interaction);

        CompletableFuture<DispatchOutcome> routed;
        try {
            routed = route(action, interaction, responder);
        } catch (RuntimeException e) {
            routed = CompletableFuture.failedFuture(e);
        }
        return routed.exceptionallyCompose(error -> reportFailure(error, action, responder));
    }

    /**
     * Render a panel for a fresh open (command, panel list or web mirror). Persistent panels
     * opened from chat answer with the confirmation step instead of rendering.
     */
    public CompletableFuture<PanelResult> openPanel(String panelId, PanelContext context) {
        PanelDefinition panel = registry.get(panelId).orElse(null);
        if (panel == null) {
            return CompletableFuture.completedFuture(PanelResult.render(PanelResponses.notFound(panelId)));
        }
        if (!permissions.isAllowed(panel, context)) {
            return CompletableFuture.completedFuture(PanelResult.render(PanelResponses.accessDenied()));
        }
        if (PersistentPanelWarning.shouldShow(panel, context)) {
            return CompletableFuture.completedFuture(PanelResult.render(
                    PersistentPanelWarning.create(panel, context.getAccessMethod())));
        }
        return Handlers.guard(() -> panel.onRender(context)).thenApply(result -> {
            if (result instanceof PanelResult.Render render) {
                return PanelResult.render(ResponseRenderer.inject(render.response(), context));
            }
            if (result instanceof PanelResult.Failed failed) {
                log.error("Panel render failed", Map.of("panelId", panelId), failed.error());
                return PanelResult.render(PanelResponses.error("Panel Error",
                        "An error occurred while opening this panel."));
            }
            return result;
        });
    }

    private CompletableFuture<DispatchOutcome> route(CompositeActionId action, PanelInteraction interaction,
            InitialResponder responder) {
        PanelDefinition panel = registry.get(action.panelId()).orElse(null);
        if (panel == null) {
            log.warn("Interaction for unknown panel", Map.of("panelId", action.panelId()));
            return responder.reply(PanelResponses.notFound(action.panelId()))
                    .thenApply(ignored -> DispatchOutcome.NOT_FOUND);
        }

        Optional<PlatformMessage> message = interaction.message();
        String messageId = message.map(PlatformMessage::id).orElse(null);
        String scopeId = PersistentPanelService.scopeFor(panel, interaction.guildId());

        if (panel.persistent() && panel.unique() && messageId != null
                && !persistent.store().isActiveInstance(panel.id(), messageId, scopeId, null)) {
            log.info("Rejected interaction on replaced panel instance",
                    Map.of("panelId", panel.id(), "messageId", messageId));
            return responder.reply(PanelResponses.staleInstance())
                    .thenApply(ignored -> DispatchOutcome.STALE);
        }

        PanelContext context = buildContext(panel, interaction, message.orElse(null), scopeId);
        if (!permissions.isAllowed(panel, context)) {
            return responder.reply(PanelResponses.accessDenied())
                    .thenApply(ignored -> DispatchOutcome.DENIED);
        }

        CompletableFuture<PanelResult> handled = invoke(panel, action, context, interaction);
        Executor delayed = CompletableFuture.delayedExecutor(ackDeadlineMs, TimeUnit.MILLISECONDS);
        CompletableFuture<Optional<PanelResult>> deadline =
                CompletableFuture.supplyAsync(() -> Optional.<PanelResult>empty(), delayed);
        Delivery delivery = new Delivery(panel, action, context, messageId, scopeId,
                interaction.type() != InteractionType.MODAL_SUBMIT);

        return handled.thenApply(Optional::of)
                .applyToEither(deadline, Function.identity())
                .thenCompose(early -> {
                    if (early.isPresent()) {
                        return settleEarly(early.get(), responder, delivery);
                    }
                    log.debug("Handler exceeded acknowledgment deadline, deferring",
                            Map.of("panelId", panel.id(), "deadlineMs", ackDeadlineMs));
                    return responder.defer().thenCompose(deferred ->
                            handled.thenCompose(result -> settle(result, deferred, delivery)));
                });
    }

    private PanelContext buildContext(PanelDefinition panel, PanelInteraction interaction,
            PlatformMessage message, String scopeId) {
        NavigationContext nav = message != null ? navigation.get(message.id()).orElse(null) : null;
        AccessMethod accessMethod = nav != null
                ? nav.accessMethod()
                : recoverAccessMethod(panel, scopeId, message);

        List<String> stack = new ArrayList<>(nav != null ? nav.navigationStack() : List.of());
        if (stack.isEmpty() || !panel.id().equals(stack.get(stack.size() - 1))) {
            stack.add(panel.id());
        }
        return PanelContext.builder()
                .panelId(panel.id())
                .userId(interaction.userId())
                .guildId(interaction.guildId())
                .channelId(interaction.channelId())
                .accessMethod(accessMethod)
                .navigationStack(stack)
                .sourceCategory(nav != null ? nav.sourceCategory() : null)
                .panelState(nav != null ? nav.panelState() : null)
                .interaction(interaction)
                .build();
    }

    /**
     * Access method for a message whose navigation context has expired: the durable
     * record first, then the controls already rendered on the message.
     */
    private AccessMethod recoverAccessMethod(PanelDefinition panel, String scopeId, PlatformMessage message) {
        if (panel.persistent()) {
            Optional<AccessMethod> stored = persistent.store().get(panel.id(), scopeId)
                    .map(PanelInstance::getAccessMethod)
                    .filter(Objects::nonNull);
            if (stored.isPresent()) {
                return stored.get();
            }
        }
        if (message != null) {
            Optional<AccessMethod> detected = AccessMethodDetector.detect(message.components());
            if (detected.isPresent()) {
                log.debug("Recovered access method from rendered controls",
                        Map.of("panelId", panel.id(), "accessMethod", detected.get().wireName()));
                return detected.get();
            }
        }
        return AccessMethod.DIRECT_COMMAND;
    }

    private CompletableFuture<PanelResult> invoke(PanelDefinition panel, CompositeActionId action,
            PanelContext context, PanelInteraction interaction) {
        return Handlers.guard(() -> switch (action.kind()) {
            case BUTTON -> panel.onButton(context, action.actionId());
            case DROPDOWN -> panel.onDropdown(context, interaction.values(), action.actionId());
            case MODAL -> panel.onModal(context, action.actionId(), interaction.fields());
        });
    }

    /**
     * The handler finished inside the deadline, so its result is the acknowledgment
     * itself. Closing and handled-directly results acknowledge without content.
     */
    private CompletableFuture<DispatchOutcome> settleEarly(PanelResult result, InitialResponder responder,
            Delivery delivery) {
        if (result instanceof PanelResult.ShowModal modal && delivery.modalAllowed()) {
            return responder.showModal(modal.modal()).thenApply(ignored -> DispatchOutcome.MODAL_SHOWN);
        }
        if (result instanceof PanelResult.ShowModal) {
            log.warn("Modal requested in answer to a modal submission, answering without it",
                    delivery.logMeta());
            return responder.reply(formUnavailable()).thenApply(ignored -> DispatchOutcome.UPDATED);
        }
        if (result instanceof PanelResult.Failed failed) {
            log.error("Panel handler failed", delivery.logMeta(), failed.error());
            return responder.reply(PanelResponses.handlerFailure(delivery.action().kind()))
                    .thenApply(ignored -> DispatchOutcome.FAILED);
        }
        if (result instanceof PanelResult.Render render && !render.response().isClosePanel()) {
            return answer(render.response(), responder, delivery);
        }
        return responder.defer().thenCompose(deferred -> settle(result, deferred, delivery));
    }

    private CompletableFuture<DispatchOutcome> answer(PanelResponse response, InitialResponder responder,
            Delivery delivery) {
        PanelContext context = delivery.context();
        PanelDefinition panel = delivery.panel();
        String messageId = delivery.messageId();

        CompletableFuture<FollowUpResponder> acknowledged;
        if (messageId == null) {
            acknowledged = responder.reply(ResponseRenderer.inject(response, context));
        } else if (panel.persistent() && !context.isWebUi()) {
            PanelInstance standing = persistent.store().get(panel.id(), delivery.scopeId())
                    .filter(instance -> messageId.equals(instance.getMessageId()))
                    .orElse(null);
            if (standing == null) {
                // the record points elsewhere; that message is edited remotely before answering
                return responder.defer().thenCompose(deferred -> deliver(response, deferred, delivery));
            }
            PanelResponse shown = persistent.standingResponse(standing, response);
            acknowledged = responder.update(shown).thenApply(followUps -> {
                persistent.recordUpdate(panel.id(), messageId, shown, delivery.scopeId(), null, null);
                return followUps;
            });
        } else {
            acknowledged = responder.update(ResponseRenderer.inject(response, context));
        }
        return acknowledged.thenCompose(followUps -> {
            rememberNavigation(delivery);
            return sendNotification(response.getNotification(), followUps);
        }).thenApply(ignored -> DispatchOutcome.UPDATED);
    }

    private CompletableFuture<DispatchOutcome> settle(PanelResult result, FollowUpResponder deferred,
            Delivery delivery) {
        if (result instanceof PanelResult.Render render) {
            return deliver(render.response(), deferred, delivery);
        }
        if (result instanceof PanelResult.Failed failed) {
            log.error("Panel handler failed", delivery.logMeta(), failed.error());
            return deferred.editReply(PanelResponses.handlerFailure(delivery.action().kind()))
                    .thenApply(ignored -> DispatchOutcome.FAILED);
        }
        if (result instanceof PanelResult.ShowModal) {
            log.warn("Modal requested after the interaction was acknowledged, answering without it",
                    delivery.logMeta());
            return rerender(delivery)
                    .thenCompose(current -> current.isPresent()
                            ? deferred.editReply(current.get())
                            : CompletableFuture.<Void>completedFuture(null))
                    .thenCompose(ignored -> deferred.followUp(formUnavailable()))
                    .thenApply(ignored -> DispatchOutcome.UPDATED);
        }
        return CompletableFuture.completedFuture(DispatchOutcome.HANDLED_DIRECTLY);
    }

    /**
     * Current view of the panel, used to settle a deferred message when the handler's
     * own answer cannot be shown.
     */
    private CompletableFuture<Optional<PanelResponse>> rerender(Delivery delivery) {
        return Handlers.guard(() -> delivery.panel().onRender(delivery.context()))
                .thenApply(result -> result instanceof PanelResult.Render render
                        ? Optional.of(ResponseRenderer.inject(render.response(), delivery.context()))
                        : Optional.<PanelResponse>empty());
    }

    private CompletableFuture<DispatchOutcome> deliver(PanelResponse response, FollowUpResponder deferred,
            Delivery delivery) {
        PanelContext context = delivery.context();
        PanelDefinition panel = delivery.panel();
        String messageId = delivery.messageId();

        if (response.isClosePanel()) {
            return sendNotification(response.getNotification(), deferred)
                    .thenCompose(ignored -> deferred.deleteReply())
                    .thenApply(ignored -> {
                        if (messageId != null) {
                            navigation.remove(messageId);
                            if (panel.persistent()) {
                                persistent.store().removeIfCurrent(panel.id(), messageId, delivery.scopeId(), null);
                            }
                        }
                        return DispatchOutcome.CLOSED;
                    });
        }

        PanelResponse injected = ResponseRenderer.inject(response, context);
        CompletableFuture<Void> edit;
        if (panel.persistent() && !context.isWebUi() && messageId != null) {
            edit = persistent.updatePersistentPanel(panel.id(), response, delivery.scopeId(), null, null)
                    .thenCompose(updated -> updated
                            ? CompletableFuture.<Void>completedFuture(null)
                            : deferred.editReply(injected));
        } else {
            edit = deferred.editReply(injected);
        }
        return edit.thenCompose(ignored -> {
            rememberNavigation(delivery);
            return sendNotification(response.getNotification(), deferred);
        }).thenApply(ignored -> DispatchOutcome.UPDATED);
    }

    private void rememberNavigation(Delivery delivery) {
        if (delivery.messageId() != null) {
            PanelContext context = delivery.context();
            navigation.put(delivery.messageId(), context.getNavigationStack(), context.getAccessMethod(),
                    context.getSourceCategory(), context.getPanelState());
        }
    }

    private CompletableFuture<Void> sendNotification(Notification notification, FollowUpResponder followUps) {
        if (notification == null || notification.silent()) {
            return CompletableFuture.completedFuture(null);
        }
        return followUps.followUp(PanelResponse.builder()
                .content(notification.toChatText())
                .ephemeral(true)
                .build());
    }

    private static PanelResponse formUnavailable() {
        return PanelResponses.warning("Form Unavailable", "This form could not be opened in time. Please try again.");
    }

    private CompletableFuture<DispatchOutcome> reportFailure(Throwable error, CompositeActionId action,
            InitialResponder responder) {
        log.error("Panel interaction failed", Map.of(
                "panelId", action.panelId(), "kind", action.kind().token()), Handlers.unwrap(error));
        PanelResponse failure = PanelResponses.handlerFailure(action.kind());
        CompletableFuture<Void> sent;
        Optional<FollowUpResponder> followUps = responder.followUps();
        if (followUps.isPresent()) {
            sent = followUps.get().isDeferred()
                    ? followUps.get().editReply(failure)
                    : followUps.get().followUp(failure);
        } else if (!responder.isAcknowledged()) {
            sent = responder.reply(failure).thenApply(ignored -> null);
        } else {
            sent = CompletableFuture.completedFuture(null);
        }
        return sent.handle((ignored, sendError) -> {
            if (sendError != null) {
                log.warn("Could not deliver failure notice", Map.of("panelId", action.panelId()), sendError);
            }
            return DispatchOutcome.FAILED;
        });
    }

    static ActionKind kindOf(InteractionType type) {
        return switch (type) {
            case BUTTON -> ActionKind.BUTTON;
            case SELECT_MENU -> ActionKind.DROPDOWN;
            case MODAL_SUBMIT -> ActionKind.MODAL;
        };
    }

    private record Delivery(PanelDefinition panel, CompositeActionId action, PanelContext context,
            String messageId, String scopeId, boolean modalAllowed) {

        Map<String, String> logMeta() {
            return Map.of("panelId", panel.id(), "kind", action.kind().token(),
                    "userId", String.valueOf(context.getUserId()));
        }
    }
}
