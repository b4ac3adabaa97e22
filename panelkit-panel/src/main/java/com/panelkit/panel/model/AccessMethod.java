package com.panelkit.panel.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * How a panel was reached. Drives which navigation controls are injected
 * and where "back" leads.
 */
public enum AccessMethod {
    SYSTEM_PANEL("system_panel"),
    GUILD_PANEL("guild_panel"),
    DIRECT_COMMAND("direct_command"),
    WEB_UI("web_ui");

    private final String wireName;

    AccessMethod(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isPanelList() {
        return this == SYSTEM_PANEL || this == GUILD_PANEL;
    }

    public static Optional<AccessMethod> fromWireName(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (AccessMethod method : values()) {
            if (method.wireName.equals(value)) {
                return Optional.of(method);
            }
        }
        return Optional.empty();
    }

    /**
     * Lenient parse used when reading durable records; unknown values fall back to direct access.
     */
    @JsonCreator
    public static AccessMethod parse(String value) {
        return fromWireName(value).orElse(DIRECT_COMMAND);
    }
}
