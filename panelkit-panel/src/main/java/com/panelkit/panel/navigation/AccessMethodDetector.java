package com.panelkit.panel.navigation;

import com.panelkit.panel.model.AccessMethod;
import com.panelkit.panel.render.NavigationControls;
import com.panelkit.panel.response.Button;
import com.panelkit.panel.response.PanelComponent;

import java.util.List;
import java.util.Optional;

/**
 * Recovers how a panel was opened from the controls already rendered on its message,
 * for when the navigation context is gone (restart or expiry).
 */
public final class AccessMethodDetector {

    private AccessMethodDetector() {
    }

    /**
     * Depth-first scan for a list-navigation button. Any {@code admin_panel_system_*}
     * control means the system list, any {@code admin_panel_guild_*} the guild list.
     */
    public static Optional<AccessMethod> detect(List<PanelComponent> components) {
        if (components == null) {
            return Optional.empty();
        }
        for (PanelComponent component : components) {
            if (component instanceof Button button && button.getCustomId() != null) {
                String id = button.getCustomId();
                if (id.startsWith(NavigationControls.SYSTEM_PREFIX)) {
                    return Optional.of(AccessMethod.SYSTEM_PANEL);
                }
                if (id.startsWith(NavigationControls.GUILD_PREFIX)) {
                    return Optional.of(AccessMethod.GUILD_PANEL);
                }
            }
            Optional<AccessMethod> nested = detect(component.children());
            if (nested.isPresent()) {
                return nested;
            }
        }
        return Optional.empty();
    }
}
