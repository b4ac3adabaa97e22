package com.panelkit.panel.definition;

import com.panelkit.panel.model.AccessMethod;

import java.util.Set;
import java.util.function.Supplier;

/**
 * Access policy from panel flags:
 * <ul>
 *   <li>the web mirror's owner account is always allowed</li>
 *   <li>{@code devOnly} panels require a configured developer</li>
 *   <li>a non-empty {@code allowedUsers} set is a whitelist</li>
 *   <li>{@code mainGuildOnly} panels only open in the main guild (web mirror exempt)</li>
 * </ul>
 */
public class DefaultPermissionEvaluator implements PermissionEvaluator {

    public static final String WEB_UI_OWNER = "web-ui-owner";

    private final Supplier<Set<String>> devs;
    private final Supplier<String> mainGuildId;

    public DefaultPermissionEvaluator(Supplier<Set<String>> devs, Supplier<String> mainGuildId) {
        this.devs = devs;
        this.mainGuildId = mainGuildId;
    }

    @Override
    public boolean isAllowed(PanelDefinition panel, PanelContext context) {
        String userId = context.getUserId();
        if (WEB_UI_OWNER.equals(userId)) {
            return true;
        }
        if (panel.devOnly() && !devs.get().contains(userId)) {
            return false;
        }
        Set<String> allowed = panel.allowedUsers();
        if (allowed != null && !allowed.isEmpty() && !allowed.contains(userId)) {
            return false;
        }
        if (panel.mainGuildOnly() && context.getAccessMethod() != AccessMethod.WEB_UI) {
            String main = mainGuildId.get();
            return main != null && main.equals(context.getGuildId());
        }
        return true;
    }
}
