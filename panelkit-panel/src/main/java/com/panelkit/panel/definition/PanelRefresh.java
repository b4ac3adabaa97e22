package com.panelkit.panel.definition;

import com.panelkit.panel.response.PanelResponse;

/**
 * Re-rendered content for a recovered persistent panel, plus the state tag to record.
 */
public record PanelRefresh(PanelResponse response, String state) {
}
