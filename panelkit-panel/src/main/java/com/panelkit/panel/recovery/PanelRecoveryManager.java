package com.panelkit.panel.recovery;

import com.panelkit.common.logging.SubsystemLogger;
import com.panelkit.panel.definition.PanelContext;
import com.panelkit.panel.definition.PanelDefinition;
import com.panelkit.panel.definition.PanelRefresh;
import com.panelkit.panel.definition.PanelRegistry;
import com.panelkit.panel.model.PanelInstance;
import com.panelkit.panel.navigation.NavigationContextStore;
import com.panelkit.panel.persistent.PersistentPanelService;
import com.panelkit.panel.platform.PlatformClient;
import com.panelkit.panel.platform.PlatformException;
import com.panelkit.panel.platform.PlatformMessage;
import com.panelkit.panel.response.Embed;
import com.panelkit.panel.response.PanelResponse;
import com.panelkit.panel.store.PanelInstanceStore;
import com.panelkit.panel.store.PanelStoreException;
import com.panelkit.panel.store.StoredPanel;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Re-attaches persistent panels to their standing messages after a restart.
 *
 * <p>Records are processed one at a time, global scope first. A record whose
 * channel or message is gone is pruned; any other failure is logged and the
 * record is kept for the next start.
 */
public class PanelRecoveryManager {

    public static final String RECOVERED_FOOTER_PREFIX = "Panel recovered after bot restart";

    private static final SubsystemLogger log = SubsystemLogger.create("panel/recovery");

    private final PlatformClient client;
    private final PersistentPanelService persistent;
    private final NavigationContextStore navigation;
    private final PanelRegistry registry;
    private final List<CompletableFuture<?>> refreshes = new CopyOnWriteArrayList<>();

    public PanelRecoveryManager(PlatformClient client, PersistentPanelService persistent,
            NavigationContextStore navigation, PanelRegistry registry) {
        this.client = client;
        this.persistent = persistent;
        this.navigation = navigation;
        this.registry = registry;
    }

    public record RecoveryReport(int recovered, int pruned, int failed) {

        RecoveryReport plus(Outcome outcome) {
            return switch (outcome) {
                case RECOVERED -> new RecoveryReport(recovered + 1, pruned, failed);
                case PRUNED -> new RecoveryReport(recovered, pruned + 1, failed);
                case FAILED -> new RecoveryReport(recovered, pruned, failed + 1);
            };
        }
    }

    enum Outcome {
        RECOVERED, PRUNED, FAILED
    }

    /**
     * Startup sequence: drop expired sessions, drop records pointing nowhere, then recover the rest.
     */
    public CompletableFuture<RecoveryReport> runStartup(long sessionExpiryMs) {
        return CompletableFuture.completedFuture(sessionExpiryMs)
                .thenApply(persistent::cleanupExpired)
                .exceptionally(error -> {
                    log.error("Expired-session cleanup failed", error);
                    return 0;
                })
                .thenCompose(expired -> persistent.cleanupInvalid())
                .exceptionally(error -> {
                    log.error("Invalid-record cleanup failed", error);
                    return 0;
                })
                .thenCompose(removed -> recoverAll());
    }

    public CompletableFuture<RecoveryReport> recoverAll() {
        refreshes.clear();
        PanelInstanceStore store = persistent.store();
        List<StoredPanel> records = new ArrayList<>();
        for (String scopeId : store.listScopes()) {
            records.addAll(store.list(scopeId));
        }
        log.info("Starting panel recovery", Map.of("records", records.size()));

        CompletableFuture<RecoveryReport> chain = CompletableFuture.completedFuture(new RecoveryReport(0, 0, 0));
        for (StoredPanel stored : records) {
            chain = chain.thenCompose(report -> recoverIsolated(stored).thenApply(report::plus));
        }
        return chain.thenApply(report -> {
            log.info("Panel recovery complete", Map.of(
                    "recovered", report.recovered(), "pruned", report.pruned(), "failed", report.failed()));
            return report;
        });
    }

    /**
     * Completes when every background refresh started by the last {@link #recoverAll()} has finished.
     */
    public CompletableFuture<Void> pendingRefreshes() {
        return CompletableFuture.allOf(refreshes.toArray(new CompletableFuture<?>[0]));
    }

    private CompletableFuture<Outcome> recoverIsolated(StoredPanel stored) {
        try {
            return recoverOne(stored);
        } catch (RuntimeException e) {
            log.error("Failed to recover panel", Map.of("panelId", stored.panelId()), e);
            return CompletableFuture.completedFuture(Outcome.FAILED);
        }
    }

    CompletableFuture<Outcome> recoverOne(StoredPanel stored) {
        PanelInstance instance = stored.instance();
        if (instance.getChannelId() == null || instance.getMessageId() == null) {
            return CompletableFuture.completedFuture(prune(stored));
        }
        return CompletableFuture.completedFuture(instance)
                .thenCompose(i -> client.fetchChannel(i.getChannelId()))
                .thenCompose(channel -> channel.fetchMessage(instance.getMessageId()))
                .thenCompose(message -> reattach(stored, message))
                .handle((outcome, error) -> {
                    if (error == null) {
                        return outcome;
                    }
                    if (PlatformException.isTargetGone(error)) {
                        return prune(stored);
                    }
                    log.error("Failed to recover panel", Map.of(
                            "panelId", stored.panelId(), "messageId", instance.getMessageId()), error);
                    return Outcome.FAILED;
                });
    }

    private CompletableFuture<Outcome> reattach(StoredPanel stored, PlatformMessage message) {
        return markRecovered(message).thenApply(ignored -> {
            navigation.put(message.id(), List.of(), stored.instance().accessMethodOrDefault());
            log.info("Recovered panel", Map.of(
                    "panelId", stored.panelId(),
                    "session", stored.sessionId() != null ? stored.sessionId() : "-",
                    "accessMethod", stored.instance().accessMethodOrDefault().wireName()));
            refreshes.add(refresh(stored));
            return Outcome.RECOVERED;
        });
    }

    /**
     * Stamp the first embed's footer. Messages without embeds are left untouched.
     */
    private CompletableFuture<Void> markRecovered(PlatformMessage message) {
        List<Embed> embeds = message.embeds();
        if (embeds == null || embeds.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }
        Embed first = embeds.get(0);
        String previous = first.getFooter() != null && first.getFooter().text() != null
                ? first.getFooter().text()
                : "";
        if (previous.startsWith(RECOVERED_FOOTER_PREFIX)) {
            int separator = previous.indexOf(" | ");
            previous = separator >= 0 ? previous.substring(separator + 3) : "";
        }
        String iconUrl = first.getFooter() != null ? first.getFooter().iconUrl() : null;
        Embed stamped = first.toBuilder()
                .footer(new Embed.Footer((RECOVERED_FOOTER_PREFIX + " | " + previous).trim(), iconUrl))
                .build();

        List<Embed> updated = new ArrayList<>(embeds);
        updated.set(0, stamped);
        return message.edit(PanelResponse.builder()
                .embeds(updated)
                .components(message.components() != null ? message.components() : List.of())
                .build());
    }

    private CompletableFuture<?> refresh(StoredPanel stored) {
        Optional<PanelDefinition> panel = registry.get(stored.panelId());
        if (panel.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }
        PanelInstance instance = stored.instance();
        PanelContext context = PanelContext.builder()
                .panelId(stored.panelId())
                .userId(instance.getUserId())
                .guildId(instance.getGuildId())
                .channelId(instance.getChannelId())
                .accessMethod(instance.accessMethodOrDefault())
                .navigationStack(List.of(stored.panelId()))
                .build();

        CompletableFuture<Optional<PanelRefresh>> hook;
        try {
            hook = panel.get().onRecovered(context);
        } catch (RuntimeException e) {
            hook = CompletableFuture.failedFuture(e);
        }
        if (hook == null) {
            hook = CompletableFuture.completedFuture(Optional.empty());
        }
        return hook
                .thenCompose(result -> result
                        .map(r -> persistent.updatePersistentPanel(stored.panelId(), r.response(),
                                stored.scopeId(), stored.sessionId(), r.state()))
                        .orElse(CompletableFuture.completedFuture(true)))
                .exceptionally(error -> {
                    log.error("Post-recovery refresh failed", Map.of("panelId", stored.panelId()), error);
                    return false;
                });
    }

    private Outcome prune(StoredPanel stored) {
        String messageId = stored.instance().getMessageId();
        try {
            if (messageId != null) {
                persistent.store().removeIfCurrent(stored.panelId(), messageId, stored.scopeId(), stored.sessionId());
            } else {
                persistent.store().remove(stored.panelId(), stored.scopeId(), stored.sessionId());
            }
        } catch (PanelStoreException e) {
            log.error("Failed to prune panel record", Map.of("panelId", stored.panelId()), e);
            return Outcome.FAILED;
        }
        log.info("Pruned panel record with missing target", Map.of("panelId", stored.panelId()));
        return Outcome.PRUNED;
    }
}
