package com.panelkit.panel.definition;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registered panels by id.
 */
@Slf4j
public class PanelRegistry {

    private final Map<String, PanelDefinition> panels = new ConcurrentHashMap<>();

    /**
     * Register a panel, replacing any panel with the same id, and run its initialize hook.
     *
     * @throws IllegalArgumentException if the id is blank or the panel is unique but not persistent
     */
    public void register(PanelDefinition panel) {
        if (panel == null || panel.id() == null || panel.id().isBlank()) {
            throw new IllegalArgumentException("Panel must have an id");
        }
        if (panel.unique() && !panel.persistent()) {
            throw new IllegalArgumentException("Panel '" + panel.id() + "' is unique but not persistent");
        }
        if (panels.put(panel.id(), panel) != null) {
            log.warn("Panel '{}' already registered, overwriting", panel.id());
        }
        try {
            panel.initialize();
        } catch (RuntimeException e) {
            log.error("Error initializing panel {}: {}", panel.id(), e.getMessage(), e);
        }
    }

    public Optional<PanelDefinition> get(String panelId) {
        return Optional.ofNullable(panelId == null ? null : panels.get(panelId));
    }

    public List<PanelDefinition> list() {
        return new ArrayList<>(panels.values());
    }

    public int size() {
        return panels.size();
    }
}
