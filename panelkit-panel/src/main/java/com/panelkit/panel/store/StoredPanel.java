package com.panelkit.panel.store;

import com.panelkit.panel.model.PanelInstance;

/**
 * One record in a scope document, as seen by a full scan.
 *
 * @param scopeId   guild id, or {@code null} for the global partition
 * @param sessionId session key, or {@code null} for a single-instance record
 */
public record StoredPanel(String panelId, String scopeId, String sessionId, PanelInstance instance) {
}
