package com.panelkit.panel.router;

import com.panelkit.panel.platform.PanelInteraction;
import com.panelkit.panel.response.PanelResponse;

import java.util.concurrent.CompletableFuture;

/**
 * Operations on an interaction after its initial acknowledgment. There is no modal
 * here: the platform only accepts one as the first answer.
 */
public final class FollowUpResponder {

    private final PanelInteraction interaction;
    private final boolean deferred;

    FollowUpResponder(PanelInteraction interaction, boolean deferred) {
        this.interaction = interaction;
        this.deferred = deferred;
    }

    /** True when the acknowledgment carried no content and the reply is still a placeholder. */
    public boolean isDeferred() {
        return deferred;
    }

    public CompletableFuture<Void> editReply(PanelResponse response) {
        return interaction.editReply(response);
    }

    public CompletableFuture<Void> followUp(PanelResponse response) {
        return interaction.followUp(response);
    }

    public CompletableFuture<Void> deleteReply() {
        return interaction.deleteReply();
    }
}
