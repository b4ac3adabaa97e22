package com.panelkit.panel.response;

import lombok.Builder;
import lombok.Data;
import lombok.Singular;

import java.util.ArrayList;
import java.util.List;

/**
 * Horizontal row of interactive components.
 */
@Data
@Builder(toBuilder = true)
public final class ActionRow implements PanelComponent {

    @Singular
    private List<PanelComponent> components;

    public static ActionRow of(PanelComponent... components) {
        return ActionRow.builder().components(List.of(components)).build();
    }

    @Override
    public List<PanelComponent> children() {
        return components != null ? components : new ArrayList<>();
    }
}
