package com.panelkit.panel.render;

import com.panelkit.panel.codec.ActionKind;
import com.panelkit.panel.response.Embed;
import com.panelkit.panel.response.Notification;
import com.panelkit.panel.response.NotificationType;
import com.panelkit.panel.response.PanelResponse;

import java.time.Instant;

/**
 * Standard responses: status embeds, notices and error replies.
 */
public final class PanelResponses {

    public static final int COLOR_ERROR = 0xE74C3C;
    public static final int COLOR_SUCCESS = 0x2ECC71;
    public static final int COLOR_WARNING = 0xF39C12;
    public static final int COLOR_INFO = 0x3498DB;
    public static final int COLOR_INACTIVE = 0xED4245;

    public static final String STALE_INSTANCE_NOTICE =
            "⚠️ This panel is no longer active. A newer instance has been opened.";
    public static final String REPLACED_MESSAGE =
            "A new instance of this panel has been opened. This panel is now inactive.";

    private PanelResponses() {
    }

    public static PanelResponse error(String title, String message) {
        return status("❌", COLOR_ERROR, title, message, null);
    }

    public static PanelResponse error(String title, String message, String details) {
        return status("❌", COLOR_ERROR, title, message, details);
    }

    public static PanelResponse success(String title, String message) {
        return status("✅", COLOR_SUCCESS, title, message, null);
    }

    public static PanelResponse warning(String title, String message) {
        return status("⚠️", COLOR_WARNING, title, message, null);
    }

    public static PanelResponse info(String title, String message) {
        return status("ℹ️", COLOR_INFO, title, message, null);
    }

    public static PanelResponse notFound(String panelId) {
        return error("Panel Not Found", "The panel '" + panelId + "' could not be found.");
    }

    public static PanelResponse accessDenied() {
        return error("Access Denied", "You do not have permission to use this panel.");
    }

    public static PanelResponse staleInstance() {
        return PanelResponse.builder().content(STALE_INSTANCE_NOTICE).ephemeral(true).build();
    }

    /**
     * Generic reply when a handler failed; never carries the failure's details.
     */
    public static PanelResponse handlerFailure(ActionKind kind) {
        String what = switch (kind) {
            case BUTTON -> "the button interaction";
            case DROPDOWN -> "the dropdown interaction";
            case MODAL -> "the modal submission";
        };
        return PanelResponse.builder()
                .content("❌ An error occurred while processing " + what + ".")
                .ephemeral(true)
                .build();
    }

    /**
     * Replacement content for a standing message that is no longer the live instance.
     */
    public static PanelResponse inactive(String reason) {
        return PanelResponse.builder()
                .embed(Embed.builder()
                        .title("⚠️ Panel Inactive")
                        .description(reason)
                        .color(COLOR_INACTIVE)
                        .timestamp(Instant.now())
                        .footer(Embed.Footer.of("This panel is no longer active"))
                        .build())
                .build();
    }

    public static PanelResponse withNotification(PanelResponse response, NotificationType type,
            String message, String title) {
        return response.toBuilder().notification(new Notification(type, message, title, false)).build();
    }

    public static PanelResponse closeWithSuccess(String message, String title, boolean silent) {
        return PanelResponse.close(new Notification(NotificationType.SUCCESS, message, title, silent));
    }

    private static PanelResponse status(String emoji, int color, String title, String message, String details) {
        Embed.EmbedBuilder embed = Embed.builder()
                .title(emoji + " " + title)
                .description(message)
                .color(color)
                .timestamp(Instant.now());
        if (details != null) {
            embed.field(Embed.Field.of("Details", details));
        }
        return PanelResponse.builder().embed(embed.build()).ephemeral(true).build();
    }
}
