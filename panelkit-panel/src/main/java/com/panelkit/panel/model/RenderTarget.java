package com.panelkit.panel.model;

import java.util.Objects;

/**
 * The channel + message a panel is displayed on.
 */
public record RenderTarget(String channelId, String messageId) {

    public RenderTarget {
        Objects.requireNonNull(channelId, "channelId");
        Objects.requireNonNull(messageId, "messageId");
    }
}
