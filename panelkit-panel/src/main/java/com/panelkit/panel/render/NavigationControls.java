package com.panelkit.panel.render;

import com.panelkit.panel.model.AccessMethod;
import com.panelkit.panel.response.Button;
import com.panelkit.panel.response.ButtonStyle;
import com.panelkit.panel.response.Emoji;

import java.util.Optional;
import java.util.Set;

/**
 * Reserved ids and builders for the injected return/close controls.
 */
public final class NavigationControls {

    public static final String SYSTEM_BACK = "admin_panel_system_back";
    public static final String GUILD_BACK = "admin_panel_guild_back";
    public static final String WEB_UI_REFRESH = "web_ui_refresh";
    public static final String CLOSE = "admin_panel_close";
    public static final String SYSTEM_PREFIX = "admin_panel_system_";
    public static final String GUILD_PREFIX = "admin_panel_guild_";

    /** Platform limit on top-level action rows in a legacy message. */
    public static final int MAX_COMPONENT_ROWS = 5;

    public static final Set<String> RETURN_IDS = Set.of(SYSTEM_BACK, GUILD_BACK, WEB_UI_REFRESH);

    private NavigationControls() {
    }

    /**
     * The "return to list" button for an access method; none for direct access.
     */
    public static Optional<Button> returnButton(AccessMethod accessMethod) {
        return switch (accessMethod) {
            case SYSTEM_PANEL -> Optional.of(secondary(SYSTEM_BACK, "Return to System Panel Menu"));
            case GUILD_PANEL -> Optional.of(secondary(GUILD_BACK, "Return to Guild Panel Menu"));
            case WEB_UI -> Optional.of(secondary(WEB_UI_REFRESH, "Return to Panel List"));
            case DIRECT_COMMAND -> Optional.empty();
        };
    }

    /**
     * The injected close button, only for panels opened from a chat panel list.
     */
    public static Optional<Button> injectedCloseButton(AccessMethod accessMethod) {
        return accessMethod.isPanelList() ? Optional.of(closeButton()) : Optional.empty();
    }

    /**
     * Close button a panel renders itself. Only directly opened panels need one,
     * list-opened panels get it injected and the web client has its own.
     */
    public static Optional<Button> panelCloseButton(AccessMethod accessMethod) {
        return accessMethod == AccessMethod.DIRECT_COMMAND ? Optional.of(closeButton()) : Optional.empty();
    }

    private static Button closeButton() {
        return Button.builder()
                .customId(CLOSE)
                .label("Close")
                .style(ButtonStyle.DANGER)
                .emoji(Emoji.unicode("✖"))
                .build();
    }

    private static Button secondary(String customId, String label) {
        return Button.builder().customId(customId).label(label).style(ButtonStyle.SECONDARY).build();
    }
}
