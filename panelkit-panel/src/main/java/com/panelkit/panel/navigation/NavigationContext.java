package com.panelkit.panel.navigation;

import com.fasterxml.jackson.databind.JsonNode;
import com.panelkit.panel.model.AccessMethod;

import java.util.List;

/**
 * Transient navigation state for one rendered panel message.
 *
 * @param navigationStack panel ids visited, most recent last
 * @param accessMethod    how the panel was reached
 * @param sourceCategory  listing category the panel was opened from, if any
 * @param panelState      opaque snapshot owned by the panel (page number, view mode)
 * @param timestamp       last write, epoch millis
 */
public record NavigationContext(
        List<String> navigationStack,
        AccessMethod accessMethod,
        String sourceCategory,
        JsonNode panelState,
        long timestamp) {

    public NavigationContext {
        navigationStack = navigationStack == null ? List.of() : List.copyOf(navigationStack);
        accessMethod = accessMethod == null ? AccessMethod.DIRECT_COMMAND : accessMethod;
    }

    NavigationContext withPanelState(JsonNode state, long now) {
        return new NavigationContext(navigationStack, accessMethod, sourceCategory, state, now);
    }
}
