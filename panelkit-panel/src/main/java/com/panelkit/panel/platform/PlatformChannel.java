package com.panelkit.panel.platform;

import com.panelkit.panel.response.PanelResponse;

import java.util.concurrent.CompletableFuture;

public interface PlatformChannel {

    String id();

    /**
     * Completes exceptionally with {@link PlatformErrorCode#UNKNOWN_MESSAGE} when the message is gone.
     */
    CompletableFuture<PlatformMessage> fetchMessage(String messageId);

    /**
     * Post a standing (non-ephemeral) message.
     */
    CompletableFuture<PlatformMessage> send(PanelResponse response);
}
