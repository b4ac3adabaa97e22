package com.panelkit.panel.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Which listing a panel belongs to. System panels are owner tooling and
 * persist in the global partition; guild panels persist per guild.
 */
public enum PanelScope {
    SYSTEM,
    GUILD;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static PanelScope parse(String value) {
        return "system".equalsIgnoreCase(value) ? SYSTEM : GUILD;
    }

    public AccessMethod listAccessMethod() {
        return this == SYSTEM ? AccessMethod.SYSTEM_PANEL : AccessMethod.GUILD_PANEL;
    }
}
