package com.panelkit.panel.platform;

/**
 * Error classes reported by the chat transport. Numeric codes follow the platform's API.
 */
public enum PlatformErrorCode {
    UNKNOWN_CHANNEL(10003),
    UNKNOWN_MESSAGE(10008),
    MISSING_PERMISSIONS(50013),
    INTERACTION_EXPIRED(10062),
    TRANSPORT_UNAVAILABLE(-1),
    UNKNOWN(0);

    private final int code;

    PlatformErrorCode(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /**
     * Channel or message is gone for good; durable records pointing at it can be pruned.
     */
    public boolean isTargetGone() {
        return this == UNKNOWN_CHANNEL || this == UNKNOWN_MESSAGE;
    }

    public static PlatformErrorCode fromCode(int code) {
        for (PlatformErrorCode value : values()) {
            if (value.code == code) {
                return value;
            }
        }
        return UNKNOWN;
    }
}
