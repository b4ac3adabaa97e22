package com.panelkit.panel.platform;

import com.panelkit.panel.response.Embed;
import com.panelkit.panel.response.PanelComponent;
import com.panelkit.panel.response.PanelResponse;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * A message as currently rendered on the platform.
 */
public interface PlatformMessage {

    String id();

    String channelId();

    List<Embed> embeds();

    List<PanelComponent> components();

    CompletableFuture<Void> edit(PanelResponse response);

    CompletableFuture<Void> delete();
}
