package com.panelkit.panel.response;

import java.util.List;

public record MediaGallery(List<Item> items) implements PanelComponent {

    public record Item(String url, String description) {
    }
}
