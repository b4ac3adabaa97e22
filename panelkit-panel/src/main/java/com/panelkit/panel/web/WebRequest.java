package com.panelkit.panel.web;

import java.util.List;

/**
 * Who is asking the web mirror for which panel, and from where.
 *
 * @param guildId         guild the panel runs against, null for global panels
 * @param channelId       target channel picked in the web client, if any
 * @param navigationStack panels visited before this one in the web client
 */
public record WebRequest(String panelId, String userId, String guildId, String channelId,
        List<String> navigationStack) {

    public WebRequest {
        navigationStack = navigationStack == null ? List.of() : List.copyOf(navigationStack);
    }

    public static WebRequest of(String panelId, String userId, String guildId) {
        return new WebRequest(panelId, userId, guildId, null, List.of());
    }
}
