package com.panelkit.panel.response;

public enum ButtonStyle {
    PRIMARY(1),
    SECONDARY(2),
    SUCCESS(3),
    DANGER(4),
    LINK(5);

    private final int value;

    ButtonStyle(int value) {
        this.value = value;
    }

    public int value() {
        return value;
    }
}
