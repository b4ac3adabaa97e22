package com.panelkit.panel.router;

/**
 * How an inbound interaction was settled.
 */
public enum DispatchOutcome {
    /** Not a panel action id; left for other handlers. */
    DROPPED,
    NOT_FOUND,
    DENIED,
    /** Interaction on a replaced instance of a unique panel. */
    STALE,
    MODAL_SHOWN,
    UPDATED,
    CLOSED,
    HANDLED_DIRECTLY,
    FAILED
}
