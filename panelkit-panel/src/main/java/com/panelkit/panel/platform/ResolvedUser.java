package com.panelkit.panel.platform;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ResolvedUser(String id, String username, String displayName, String avatarURL) {

    public static ResolvedUser unknown(String id) {
        return new ResolvedUser(id, "Unknown", "Unknown User", null);
    }
}
