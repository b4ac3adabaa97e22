package com.panelkit.panel.router;

import com.panelkit.panel.platform.PanelInteraction;
import com.panelkit.panel.response.Modal;
import com.panelkit.panel.response.PanelResponse;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Single-use acknowledgment of an interaction.
 *
 * <p>Exactly one of {@link #reply}, {@link #update}, {@link #showModal} or
 * {@link #defer} may be called. Follow-ups are only reachable through the
 * {@link FollowUpResponder} those calls complete with, so they cannot precede the
 * acknowledgment and a modal cannot follow one.
 */
public final class InitialResponder {

    private final PanelInteraction interaction;
    private final AtomicBoolean used = new AtomicBoolean();
    private volatile FollowUpResponder followUps;

    public InitialResponder(PanelInteraction interaction) {
        this.interaction = interaction;
    }

    public CompletableFuture<FollowUpResponder> reply(PanelResponse response) {
        claim("reply");
        return interaction.reply(response).thenApply(ignored -> acknowledged(false));
    }

    public CompletableFuture<FollowUpResponder> update(PanelResponse response) {
        claim("update");
        return interaction.update(response).thenApply(ignored -> acknowledged(false));
    }

    public CompletableFuture<Void> showModal(Modal modal) {
        claim("showModal");
        return interaction.showModal(modal);
    }

    /**
     * Acknowledge without content. A handler that already answered the interaction
     * itself is not deferred a second time.
     */
    public CompletableFuture<FollowUpResponder> defer() {
        claim("defer");
        if (interaction.isAcknowledged()) {
            return CompletableFuture.completedFuture(acknowledged(true));
        }
        return interaction.deferUpdate().thenApply(ignored -> acknowledged(true));
    }

    public boolean isAcknowledged() {
        return used.get() || interaction.isAcknowledged();
    }

    /** Present once an acknowledgment other than a modal has completed. */
    public Optional<FollowUpResponder> followUps() {
        return Optional.ofNullable(followUps);
    }

    private FollowUpResponder acknowledged(boolean deferred) {
        followUps = new FollowUpResponder(interaction, deferred);
        return followUps;
    }

    private void claim(String operation) {
        if (!used.compareAndSet(false, true)) {
            throw new IllegalStateException("Interaction already acknowledged, cannot " + operation);
        }
    }
}
