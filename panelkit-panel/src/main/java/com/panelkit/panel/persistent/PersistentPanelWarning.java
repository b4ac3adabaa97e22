package com.panelkit.panel.persistent;

import com.panelkit.panel.definition.PanelContext;
import com.panelkit.panel.definition.PanelDefinition;
import com.panelkit.panel.model.AccessMethod;
import com.panelkit.panel.response.ActionRow;
import com.panelkit.panel.response.Button;
import com.panelkit.panel.response.ButtonStyle;
import com.panelkit.panel.response.Embed;
import com.panelkit.panel.response.Emoji;
import com.panelkit.panel.response.PanelResponse;

import java.util.Optional;

/**
 * Confirmation step shown before a persistent panel is posted to a channel.
 *
 * <p>Button ids: {@code persistent_warning_<panelId>_<accessMethod>} to confirm,
 * {@code persistent_warning_cancel} to dismiss.
 */
public final class PersistentPanelWarning {

    public static final String PREFIX = "persistent_warning_";
    public static final String CANCEL_ID = PREFIX + "cancel";
    public static final int COLOR = 0xFEE75C;
    public static final String DEFAULT_MESSAGE = "This panel will be visible to everyone in this channel "
            + "and will persist even after you close Discord.";

    private PersistentPanelWarning() {
    }

    /** A parsed confirm button. */
    public record Confirmation(String panelId, AccessMethod accessMethod) {
    }

    /**
     * Whether opening {@code panel} should go through the confirmation first. Re-renders
     * from the panel's own buttons and web mirror opens never do.
     */
    public static boolean shouldShow(PanelDefinition panel, PanelContext context) {
        if (!panel.persistent() || context.isWebUi()) {
            return false;
        }
        if (context.getInteraction() == null) {
            return true;
        }
        String customId = context.getInteraction().customId();
        return customId == null || !customId.contains("panel_" + panel.id() + "_");
    }

    public static PanelResponse create(PanelDefinition panel, AccessMethod accessMethod) {
        String message = panel.persistentWarningMessage() != null
                ? panel.persistentWarningMessage()
                : DEFAULT_MESSAGE;
        Embed embed = Embed.builder()
                .title("⚠️ Persistent Panel Warning")
                .description(message)
                .color(COLOR)
                .field(Embed.Field.of("Panel Information",
                        "**Name:** " + panel.name() + "\n**Description:** " + panel.description()))
                .footer(Embed.Footer.of("Click the button below to open the persistent panel"))
                .build();
        ActionRow row = ActionRow.of(
                Button.builder()
                        .customId(PREFIX + panel.id() + "_" + accessMethod.wireName())
                        .label("Open Persistent Panel")
                        .style(ButtonStyle.PRIMARY)
                        .emoji(Emoji.unicode("📋"))
                        .build(),
                Button.builder()
                        .customId(CANCEL_ID)
                        .label("Cancel")
                        .style(ButtonStyle.SECONDARY)
                        .build());
        return PanelResponse.builder()
                .embed(embed)
                .component(row)
                .ephemeral(true)
                .build();
    }

    public static boolean isWarningId(String customId) {
        return customId != null && customId.startsWith(PREFIX);
    }

    public static boolean isCancel(String customId) {
        return CANCEL_ID.equals(customId);
    }

    /**
     * Parse a confirm id. Panel ids may themselves contain underscores, so the access
     * method is matched as a suffix; without one the open counts as a direct command.
     */
    public static Optional<Confirmation> parseConfirmation(String customId) {
        if (!isWarningId(customId) || isCancel(customId)) {
            return Optional.empty();
        }
        String rest = customId.substring(PREFIX.length());
        for (AccessMethod method : AccessMethod.values()) {
            String suffix = "_" + method.wireName();
            if (rest.endsWith(suffix) && rest.length() > suffix.length()) {
                return Optional.of(new Confirmation(rest.substring(0, rest.length() - suffix.length()), method));
            }
        }
        return rest.isEmpty() ? Optional.empty() : Optional.of(new Confirmation(rest, AccessMethod.DIRECT_COMMAND));
    }
}
