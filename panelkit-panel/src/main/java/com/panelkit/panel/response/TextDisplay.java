package com.panelkit.panel.response;

public record TextDisplay(String content) implements PanelComponent {
}
