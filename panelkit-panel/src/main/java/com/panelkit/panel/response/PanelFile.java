package com.panelkit.panel.response;

/**
 * Attachment sent alongside a response.
 */
public record PanelFile(String name, String contentType, byte[] data) {
}
