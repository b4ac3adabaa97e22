package com.panelkit.panel.response;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum NotificationType {
    ERROR("❌"),
    WARNING("⚠️"),
    SUCCESS("✅"),
    INFO("ℹ️");

    private final String emoji;

    NotificationType(String emoji) {
        this.emoji = emoji;
    }

    public String emoji() {
        return emoji;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
