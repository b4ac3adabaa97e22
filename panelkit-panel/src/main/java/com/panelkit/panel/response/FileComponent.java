package com.panelkit.panel.response;

/**
 * Reference to an attached file, e.g. {@code attachment://report.json}.
 */
public record FileComponent(String url, String filename) implements PanelComponent {
}
