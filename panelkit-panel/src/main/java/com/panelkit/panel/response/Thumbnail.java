package com.panelkit.panel.response;

public record Thumbnail(String url, String description, boolean spoiler) implements PanelComponent {

    public static Thumbnail of(String url) {
        return new Thumbnail(url, null, false);
    }
}
