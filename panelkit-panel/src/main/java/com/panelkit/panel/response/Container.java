package com.panelkit.panel.response;

import lombok.Builder;
import lombok.Data;
import lombok.Singular;

import java.util.ArrayList;
import java.util.List;

/**
 * Top-level block of a modern layout. Holds text displays, sections,
 * separators, action rows, galleries and files.
 */
@Data
@Builder(toBuilder = true)
public final class Container implements PanelComponent {

    private Integer accentColor;
    @Singular
    private List<PanelComponent> components;

    @Override
    public List<PanelComponent> children() {
        return components != null ? components : new ArrayList<>();
    }
}
