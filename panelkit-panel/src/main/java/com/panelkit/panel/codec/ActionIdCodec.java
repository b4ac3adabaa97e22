package com.panelkit.panel.codec;

import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;
import java.util.Optional;

/**
 * Encodes and decodes composite action ids of the form
 * {@code panel_{panelId}_{btn|dropdown|modal}_{actionId}}.
 *
 * <p>Decoding splits on {@code _} and looks for the first part equal to the
 * kind token, so a panel id containing that token as a bare part (for example
 * {@code my_btn_panel}) does not round-trip. Callers choosing ids must avoid it.
 */
@Slf4j
public final class ActionIdCodec {

    public static final String PREFIX = "panel";
    private static final String SEPARATOR = "_";

    private ActionIdCodec() {
    }

    public static String encode(String panelId, ActionKind kind, String actionId) {
        return PREFIX + SEPARATOR + panelId + SEPARATOR + kind.token() + SEPARATOR + actionId;
    }

    public static String button(String panelId, String buttonId) {
        return encode(panelId, ActionKind.BUTTON, buttonId);
    }

    public static String dropdown(String panelId, String dropdownId) {
        return encode(panelId, ActionKind.DROPDOWN, dropdownId);
    }

    public static String modal(String panelId, String modalId) {
        return encode(panelId, ActionKind.MODAL, modalId);
    }

    /**
     * Decode an id, expecting the given kind. Never throws.
     */
    public static Optional<CompositeActionId> decode(String customId, ActionKind kind) {
        if (customId == null || kind == null) {
            return Optional.empty();
        }
        String[] parts = customId.split(SEPARATOR, -1);
        if (parts.length < 4 || !PREFIX.equals(parts[0])) {
            log.debug("Not a panel action id: {}", customId);
            return Optional.empty();
        }
        int kindIndex = -1;
        for (int i = 1; i < parts.length; i++) {
            if (kind.token().equals(parts[i])) {
                kindIndex = i;
                break;
            }
        }
        if (kindIndex == -1 || kindIndex == parts.length - 1) {
            log.debug("No '{}' token or nothing after it in: {}", kind.token(), customId);
            return Optional.empty();
        }
        String panelId = String.join(SEPARATOR, Arrays.copyOfRange(parts, 1, kindIndex));
        String actionId = String.join(SEPARATOR, Arrays.copyOfRange(parts, kindIndex + 1, parts.length));
        if (panelId.isEmpty() || actionId.isEmpty()) {
            log.debug("Empty panel or action id in: {}", customId);
            return Optional.empty();
        }
        return Optional.of(new CompositeActionId(panelId, kind, actionId));
    }

    /**
     * Decode an id of any kind, picking the kind whose token appears first.
     */
    public static Optional<CompositeActionId> decode(String customId) {
        if (customId == null || !customId.startsWith(PREFIX + SEPARATOR)) {
            return Optional.empty();
        }
        String[] parts = customId.split(SEPARATOR, -1);
        for (int i = 1; i < parts.length; i++) {
            Optional<ActionKind> kind = ActionKind.fromToken(parts[i]);
            if (kind.isPresent()) {
                return decode(customId, kind.get());
            }
        }
        return Optional.empty();
    }

    public static boolean isPanelAction(String customId) {
        return customId != null && customId.startsWith(PREFIX + SEPARATOR);
    }
}
