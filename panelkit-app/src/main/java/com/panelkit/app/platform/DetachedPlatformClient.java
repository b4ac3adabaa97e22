package com.panelkit.app.platform;

import com.panelkit.panel.platform.PlatformChannel;
import com.panelkit.panel.platform.PlatformClient;
import com.panelkit.panel.platform.PlatformErrorCode;
import com.panelkit.panel.platform.PlatformException;

import java.util.concurrent.CompletableFuture;

/**
 * Stand-in used when no chat transport bean is present. Every lookup fails with
 * {@link PlatformErrorCode#TRANSPORT_UNAVAILABLE}, so recovery keeps the durable
 * records instead of pruning them.
 */
public class DetachedPlatformClient implements PlatformClient {

    @Override
    public CompletableFuture<PlatformChannel> fetchChannel(String channelId) {
        return CompletableFuture.failedFuture(new PlatformException(PlatformErrorCode.TRANSPORT_UNAVAILABLE,
                "No chat transport connected (channel " + channelId + ")"));
    }
}
