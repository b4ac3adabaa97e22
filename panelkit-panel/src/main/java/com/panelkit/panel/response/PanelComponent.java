package com.panelkit.panel.response;

import java.util.List;

/**
 * Node of a panel's component tree. Legacy layouts use {@link ActionRow}s at the
 * top level; modern layouts use {@link Container}s.
 */
public sealed interface PanelComponent
        permits ActionRow, Button, SelectMenu, TextInput, FileUpload,
        Container, Section, TextDisplay, Separator, Thumbnail, MediaGallery, FileComponent {

    /**
     * Direct children, used for recursive scans of the tree.
     */
    default List<PanelComponent> children() {
        return List.of();
    }
}
