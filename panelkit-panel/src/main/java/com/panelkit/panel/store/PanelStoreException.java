package com.panelkit.panel.store;

/**
 * A durable panel document could not be read for a mutation, or could not be written.
 */
public class PanelStoreException extends RuntimeException {

    public PanelStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
