package com.panelkit.panel.codec;

import java.util.Objects;

/**
 * A decoded {@code panel_{panelId}_{kind}_{actionId}} identifier.
 *
 * @param panelId  panel id, may itself contain underscores
 * @param kind     which handler the action routes to
 * @param actionId everything after the kind token, may carry structured sub-parts
 */
public record CompositeActionId(String panelId, ActionKind kind, String actionId) {

    public CompositeActionId {
        Objects.requireNonNull(panelId, "panelId");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(actionId, "actionId");
    }

    public String encode() {
        return ActionIdCodec.encode(panelId, kind, actionId);
    }
}
