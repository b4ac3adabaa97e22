package com.panelkit.panel.store;

import com.panelkit.panel.model.PanelInstance;

import java.util.Optional;

/**
 * Outcome of {@link PanelInstanceStore#put}: the previous single instance, if one was displaced.
 */
public record StoreResult(PanelInstance replaced) {

    public static StoreResult none() {
        return new StoreResult(null);
    }

    public Optional<PanelInstance> replacedInstance() {
        return Optional.ofNullable(replaced);
    }
}
