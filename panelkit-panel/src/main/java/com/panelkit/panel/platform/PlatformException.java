package com.panelkit.panel.platform;

import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Failure reported by the chat transport.
 */
public class PlatformException extends RuntimeException {

    private final PlatformErrorCode errorCode;

    public PlatformException(PlatformErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public PlatformException(PlatformErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public PlatformErrorCode getErrorCode() {
        return errorCode;
    }

    public static PlatformException unknownChannel(String channelId) {
        return new PlatformException(PlatformErrorCode.UNKNOWN_CHANNEL, "Unknown Channel: " + channelId);
    }

    public static PlatformException unknownMessage(String messageId) {
        return new PlatformException(PlatformErrorCode.UNKNOWN_MESSAGE, "Unknown Message: " + messageId);
    }

    /**
     * Find a platform failure in a (possibly wrapped) future failure.
     */
    public static Optional<PlatformException> find(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof PlatformException pe) {
                return Optional.of(pe);
            }
            if (!(current instanceof CompletionException) && !(current instanceof ExecutionException)) {
                return Optional.empty();
            }
            current = current.getCause();
        }
        return Optional.empty();
    }

    /**
     * True when the failure means the channel or message no longer exists.
     */
    public static boolean isTargetGone(Throwable error) {
        return find(error).map(pe -> pe.getErrorCode().isTargetGone()).orElse(false);
    }
}
