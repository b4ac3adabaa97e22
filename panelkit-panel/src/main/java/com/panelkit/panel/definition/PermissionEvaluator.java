package com.panelkit.panel.definition;

/**
 * Decides whether the caller in {@code context} may use {@code panel}.
 */
@FunctionalInterface
public interface PermissionEvaluator {

    boolean isAllowed(PanelDefinition panel, PanelContext context);
}
