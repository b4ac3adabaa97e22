package com.panelkit.panel.persistent;

import com.panelkit.common.logging.SubsystemLogger;
import com.panelkit.panel.broadcast.PanelBroadcaster;
import com.panelkit.panel.definition.PanelContext;
import com.panelkit.panel.definition.PanelDefinition;
import com.panelkit.panel.model.PanelInstance;
import com.panelkit.panel.model.PanelScope;
import com.panelkit.panel.model.RenderTarget;
import com.panelkit.panel.navigation.NavigationContextStore;
import com.panelkit.panel.platform.PlatformClient;
import com.panelkit.panel.platform.PlatformErrorCode;
import com.panelkit.panel.platform.PlatformException;
import com.panelkit.panel.platform.PlatformMessage;
import com.panelkit.panel.render.PanelResponses;
import com.panelkit.panel.render.ResponseRenderer;
import com.panelkit.panel.response.PanelResponse;
import com.panelkit.panel.serialize.PanelSerializer;
import com.panelkit.panel.store.PanelInstanceStore;
import com.panelkit.panel.store.PanelStoreException;
import com.panelkit.panel.store.StoreResult;
import com.panelkit.panel.store.StoredPanel;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.LongSupplier;

/**
 * Lifecycle of standing panel messages: post, edit in place, retire, clean up.
 *
 * <p>Every chat-side change is mirrored to the live-update channels and, when
 * it succeeds, written through to the durable record.
 */
public class PersistentPanelService {

    public static final String DEFAULT_CLEANUP_REASON = "Panel timed out";

    private static final SubsystemLogger log = SubsystemLogger.create("panel/persistent");

    private final PlatformClient client;
    private final PanelInstanceStore store;
    private final NavigationContextStore navigation;
    private final PanelBroadcaster broadcaster;
    private final LongSupplier clock;

    public PersistentPanelService(PlatformClient client, PanelInstanceStore store,
            NavigationContextStore navigation, PanelBroadcaster broadcaster) {
        this(client, store, navigation, broadcaster, System::currentTimeMillis);
    }

    public PersistentPanelService(PlatformClient client, PanelInstanceStore store,
            NavigationContextStore navigation, PanelBroadcaster broadcaster, LongSupplier clock) {
        this.client = client;
        this.store = store;
        this.navigation = navigation;
        this.broadcaster = broadcaster;
        this.clock = clock;
    }

    /**
     * Durable-record scope for a panel: system panels live in the global scope.
     */
    public static String scopeFor(PanelDefinition panel, String guildId) {
        return panel.scope() == PanelScope.SYSTEM ? null : guildId;
    }

    public PanelInstanceStore store() {
        return store;
    }

    /**
     * Post {@code response} as a standing message in the context's channel and record it.
     * A record this one replaces is deleted (unique panels) or turned into an inactive notice.
     */
    public CompletableFuture<PlatformMessage> createPersistentPanel(PanelDefinition panel, PanelContext context,
            PanelResponse response, String sessionId) {
        if (context.getChannelId() == null) {
            return CompletableFuture.failedFuture(PlatformException.unknownChannel("<none>"));
        }
        PanelResponse injected = ResponseRenderer.inject(response, context.getAccessMethod())
                .toBuilder().ephemeral(false).build();
        String scopeId = scopeFor(panel, context.getGuildId());

        return client.fetchChannel(context.getChannelId())
                .thenCompose(channel -> channel.send(injected))
                .thenCompose(message -> {
                    long now = clock.getAsLong();
                    PanelInstance instance = PanelInstance.builder()
                            .messageId(message.id())
                            .channelId(message.channelId())
                            .userId(context.getUserId())
                            .guildId(context.getGuildId())
                            .createdAt(now)
                            .lastUpdated(now)
                            .state(PanelInstance.STATE_ACTIVE)
                            .sessionData(PanelSerializer.serialize(injected))
                            .accessMethod(context.getAccessMethod())
                            .build();
                    StoreResult result = store.put(panel.id(), instance, scopeId, sessionId,
                            panel.maxActiveInstances());
                    navigation.put(message.id(), List.of(), context.getAccessMethod(),
                            context.getSourceCategory(), null);
                    log.info("Persistent panel created", Map.of(
                            "panelId", panel.id(), "messageId", message.id(), "channelId", message.channelId()));

                    notifyCreated(panel, context, new RenderTarget(message.channelId(), message.id()));

                    CompletableFuture<?> retire = result.replacedInstance()
                            .filter(old -> !message.id().equals(old.getMessageId()))
                            .map(old -> panel.unique()
                                    ? deletePanelMessage(old)
                                    : convertToInactive(old, PanelResponses.REPLACED_MESSAGE))
                            .orElse(CompletableFuture.completedFuture(null));
                    return retire.thenApply(ignored -> message);
                });
    }

    /**
     * Edit the standing message of a recorded panel, mirror the change and store it.
     *
     * @return true when the message was edited (or there was nothing to do)
     */
    public CompletableFuture<Boolean> updatePersistentPanel(String panelId, PanelResponse response,
            String scopeId, String sessionId, String newState) {
        if (response == null) {
            return CompletableFuture.completedFuture(true);
        }
        PanelInstance instance = store.get(panelId, scopeId, sessionId).orElse(null);
        if (instance == null) {
            log.warn("No persistent record to update", Map.of("panelId", panelId));
            return CompletableFuture.completedFuture(false);
        }
        PanelResponse injected = standingResponse(instance, response);

        return client.fetchChannel(instance.getChannelId())
                .thenCompose(channel -> channel.fetchMessage(instance.getMessageId()))
                .thenCompose(message -> message.edit(injected))
                .thenApply(ignored -> {
                    recordUpdate(panelId, instance.getMessageId(), injected, scopeId, sessionId, newState);
                    return true;
                })
                .exceptionally(error -> {
                    if (PlatformException.isTargetGone(error)) {
                        log.info("Standing message is gone, dropping record", Map.of(
                                "panelId", panelId, "messageId", instance.getMessageId()));
                        store.removeIfCurrent(panelId, instance.getMessageId(), scopeId, sessionId);
                    } else {
                        log.error("Failed to update persistent panel", Map.of("panelId", panelId), error);
                    }
                    return false;
                });
    }

    /**
     * The response as the standing message shows it: navigation for the stored access
     * method, never ephemeral.
     */
    public PanelResponse standingResponse(PanelInstance instance, PanelResponse response) {
        return ResponseRenderer.inject(response, instance.accessMethodOrDefault())
                .toBuilder().ephemeral(false).build();
    }

    /**
     * Bookkeeping for an edit that has already reached the standing message: mirror it
     * to web viewers and keep the snapshot, unless the record moved to another message.
     */
    public void recordUpdate(String panelId, String messageId, PanelResponse injected, String scopeId,
            String sessionId, String newState) {
        broadcaster.broadcast(panelId, injected, scopeId, sessionId);
        store.updateIfCurrent(panelId, messageId, scopeId, sessionId,
                current -> current.toBuilder()
                        .sessionData(PanelSerializer.serialize(injected))
                        .state(newState != null ? newState : current.getState())
                        .build());
    }

    public void broadcastPanelUpdate(String panelId, PanelResponse response, String scopeId, String sessionId) {
        broadcaster.broadcast(panelId, response, scopeId, sessionId);
    }

    /**
     * Re-render from outside an interaction: the web mirror only receives a broadcast,
     * chat panels get their standing message edited.
     */
    public CompletableFuture<Boolean> updatePanelDynamic(PanelDefinition panel, PanelContext context,
            PanelResponse response, String sessionId) {
        String scopeId = scopeFor(panel, context.getGuildId());
        if (context.isWebUi()) {
            broadcaster.broadcast(panel.id(), ResponseRenderer.inject(response, context), scopeId, sessionId);
            return CompletableFuture.completedFuture(true);
        }
        return updatePersistentPanel(panel.id(), response, scopeId, sessionId, null);
    }

    /**
     * Turn the standing message into an inactive notice and forget the record.
     */
    public CompletableFuture<Void> cleanupPersistentPanel(String panelId, String scopeId, String sessionId,
            String reason) {
        PanelInstance instance = store.get(panelId, scopeId, sessionId).orElse(null);
        if (instance == null) {
            return CompletableFuture.completedFuture(null);
        }
        return convertToInactive(instance, reason != null ? reason : DEFAULT_CLEANUP_REASON)
                .thenRun(() -> {
                    store.remove(panelId, scopeId, sessionId);
                    navigation.remove(instance.getMessageId());
                    log.info("Persistent panel cleaned up", Map.of("panelId", panelId));
                });
    }

    /**
     * Delete a retired standing message. A message that is already gone counts as deleted.
     */
    public CompletableFuture<Boolean> deletePanelMessage(PanelInstance instance) {
        return client.fetchChannel(instance.getChannelId())
                .thenCompose(channel -> channel.fetchMessage(instance.getMessageId()))
                .thenCompose(PlatformMessage::delete)
                .thenApply(ignored -> {
                    navigation.remove(instance.getMessageId());
                    return true;
                })
                .exceptionally(error -> {
                    PlatformErrorCode code = PlatformException.find(error)
                            .map(PlatformException::getErrorCode)
                            .orElse(PlatformErrorCode.UNKNOWN);
                    if (code.isTargetGone()) {
                        navigation.remove(instance.getMessageId());
                        return true;
                    }
                    if (code == PlatformErrorCode.MISSING_PERMISSIONS) {
                        log.warn("Missing permission to delete replaced panel message",
                                Map.of("messageId", instance.getMessageId(), "channelId", instance.getChannelId()));
                    } else {
                        log.error("Failed to delete replaced panel message",
                                Map.of("messageId", instance.getMessageId()), error);
                    }
                    return false;
                });
    }

    /**
     * Replace a standing message's content with the inactive notice. Failures are logged only.
     */
    public CompletableFuture<Void> convertToInactive(PanelInstance instance, String reason) {
        return client.fetchChannel(instance.getChannelId())
                .thenCompose(channel -> channel.fetchMessage(instance.getMessageId()))
                .thenCompose(message -> message.edit(PanelResponses.inactive(reason)))
                .thenRun(() -> navigation.remove(instance.getMessageId()))
                .exceptionally(error -> {
                    if (PlatformException.isTargetGone(error)) {
                        log.debug("Replaced panel message already gone",
                                Map.of("messageId", instance.getMessageId()));
                    } else {
                        log.error("Failed to mark panel inactive",
                                Map.of("messageId", instance.getMessageId()), error);
                    }
                    return null;
                });
    }

    /**
     * Drop idle session records in every known scope.
     *
     * @return number of sessions removed
     */
    public int cleanupExpired(long maxIdleMs) {
        int removed = 0;
        for (String scopeId : store.listScopes()) {
            try {
                removed += store.cleanupExpired(scopeId, maxIdleMs);
            } catch (PanelStoreException e) {
                log.error("Expired-session cleanup failed", Map.of("scope", String.valueOf(scopeId)), e);
            }
        }
        if (removed > 0) {
            log.info("Expired panel sessions removed", Map.of("count", removed));
        }
        return removed;
    }

    /**
     * Drop records whose channel or message no longer exists. Transport failures keep the record.
     *
     * @return number of records removed
     */
    public CompletableFuture<Integer> cleanupInvalid() {
        AtomicInteger removed = new AtomicInteger();
        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (String scopeId : store.listScopes()) {
            for (StoredPanel stored : store.list(scopeId)) {
                chain = chain.thenCompose(ignored -> validate(stored, removed));
            }
        }
        return chain.thenApply(ignored -> {
            if (removed.get() > 0) {
                log.info("Invalid panel records removed", Map.of("count", removed.get()));
            }
            return removed.get();
        });
    }

    private CompletableFuture<Void> validate(StoredPanel stored, AtomicInteger removed) {
        PanelInstance instance = stored.instance();
        return client.fetchChannel(instance.getChannelId())
                .thenCompose(channel -> channel.fetchMessage(instance.getMessageId()))
                .<Void>thenApply(message -> null)
                .exceptionally(error -> {
                    if (PlatformException.isTargetGone(error)) {
                        try {
                            if (store.removeIfCurrent(stored.panelId(), instance.getMessageId(),
                                    stored.scopeId(), stored.sessionId())) {
                                removed.incrementAndGet();
                            }
                        } catch (PanelStoreException e) {
                            log.error("Failed to remove invalid panel record",
                                    Map.of("panelId", stored.panelId()), e);
                        }
                    } else {
                        log.warn("Could not validate panel record", Map.of(
                                "panelId", stored.panelId(), "error", String.valueOf(error.getMessage())));
                    }
                    return null;
                });
    }

    private void notifyCreated(PanelDefinition panel, PanelContext context, RenderTarget target) {
        try {
            panel.onPersistentCreated(context, target);
        } catch (RuntimeException e) {
            log.error("onPersistentCreated hook failed", Map.of("panelId", panel.id()), e);
        }
    }
}
