package com.panelkit.panel.response;

/**
 * Vertical gap between modern components. Spacing 1 is small, 2 is large.
 */
public record Separator(int spacing, boolean divider) implements PanelComponent {

    public static Separator small() {
        return new Separator(1, true);
    }

    public static Separator large() {
        return new Separator(2, true);
    }
}
