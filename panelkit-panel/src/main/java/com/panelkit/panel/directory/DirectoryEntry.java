package com.panelkit.panel.directory;

import com.panelkit.panel.model.PanelScope;

/**
 * One row of the panel listing.
 */
public record DirectoryEntry(
        String id,
        String name,
        String description,
        String category,
        String icon,
        int order,
        PanelScope scope) {
}
