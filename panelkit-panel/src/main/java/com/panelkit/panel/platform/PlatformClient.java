package com.panelkit.panel.platform;

import java.util.concurrent.CompletableFuture;

/**
 * Entry point to the chat transport.
 */
public interface PlatformClient {

    /**
     * Completes exceptionally with {@link PlatformErrorCode#UNKNOWN_CHANNEL} when the channel is gone.
     */
    CompletableFuture<PlatformChannel> fetchChannel(String channelId);
}
