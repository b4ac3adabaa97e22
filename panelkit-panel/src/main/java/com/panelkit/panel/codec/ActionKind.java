package com.panelkit.panel.codec;

import java.util.Optional;

/**
 * Interaction kinds that can appear in a composite action id, keyed by their reserved token.
 */
public enum ActionKind {
    BUTTON("btn"),
    DROPDOWN("dropdown"),
    MODAL("modal");

    private final String token;

    ActionKind(String token) {
        this.token = token;
    }

    public String token() {
        return token;
    }

    public static Optional<ActionKind> fromToken(String token) {
        for (ActionKind kind : values()) {
            if (kind.token.equals(token)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
