package com.panelkit.panel.broadcast;

/**
 * Transport for live updates to remote subscribers. Delivery is best-effort.
 */
@FunctionalInterface
public interface LiveUpdateChannel {

    void send(LiveUpdateMessage message) throws Exception;
}
