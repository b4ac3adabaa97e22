package com.panelkit.panel.platform;

import com.panelkit.panel.response.Modal;
import com.panelkit.panel.response.PanelResponse;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * An inbound component interaction with its raw acknowledgment primitives.
 *
 * <p>The platform accepts exactly one initial acknowledgment ({@link #reply},
 * {@link #update}, {@link #showModal} or {@link #deferUpdate}) within a short
 * window. The router never calls these directly; it goes through
 * {@code InitialResponder}, which enforces that ordering.
 */
public interface PanelInteraction {

    InteractionType type();

    String customId();

    String userId();

    /** Guild the interaction happened in, or {@code null} in direct messages. */
    String guildId();

    String channelId();

    /** The message the component lives on. Modal submissions from commands have none. */
    Optional<PlatformMessage> message();

    /** Selected values for select menus; empty otherwise. */
    default List<String> values() {
        return List.of();
    }

    /** Submitted text fields for modals, keyed by input custom id; empty otherwise. */
    default Map<String, String> fields() {
        return Map.of();
    }

    /** Whether any initial acknowledgment has been sent, by the router or by a handler. */
    boolean isAcknowledged();

    CompletableFuture<Void> reply(PanelResponse response);

    CompletableFuture<Void> update(PanelResponse response);

    CompletableFuture<Void> showModal(Modal modal);

    CompletableFuture<Void> deferUpdate();

    CompletableFuture<Void> editReply(PanelResponse response);

    CompletableFuture<Void> followUp(PanelResponse response);

    CompletableFuture<Void> deleteReply();
}
