package com.panelkit.panel.render;

import com.panelkit.panel.definition.PanelContext;
import com.panelkit.panel.model.AccessMethod;
import com.panelkit.panel.response.ActionRow;
import com.panelkit.panel.response.Button;
import com.panelkit.panel.response.Container;
import com.panelkit.panel.response.PanelComponent;
import com.panelkit.panel.response.PanelResponse;
import com.panelkit.panel.response.Separator;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Adds the return/close navigation row to panels reached through a list or the web mirror.
 *
 * <p>Legacy layouts get a new action row, unless one already carries a return
 * control or the row limit is reached. Modern layouts get a separator and the
 * row appended to their last container. The input response is never mutated.
 */
@Slf4j
public final class ResponseRenderer {

    private ResponseRenderer() {
    }

    public static PanelResponse inject(PanelResponse response, PanelContext context) {
        return inject(response, context.getAccessMethod());
    }

    public static PanelResponse inject(PanelResponse response, AccessMethod accessMethod) {
        if (response == null || accessMethod == null || accessMethod == AccessMethod.DIRECT_COMMAND) {
            return response;
        }
        Optional<ActionRow> navRow = navigationRow(accessMethod);
        if (navRow.isEmpty()) {
            return response;
        }
        return response.isModern()
                ? injectModern(response, navRow.get())
                : injectLegacy(response, navRow.get());
    }

    private static PanelResponse injectLegacy(PanelResponse response, ActionRow navRow) {
        List<PanelComponent> rows = response.getComponents();
        boolean present = rows.stream()
                .filter(ActionRow.class::isInstance)
                .anyMatch(ResponseRenderer::hasReturnControl);
        if (present) {
            return response;
        }
        if (rows.size() >= NavigationControls.MAX_COMPONENT_ROWS) {
            log.warn("Cannot add return button - component limit reached ({} rows)",
                    NavigationControls.MAX_COMPONENT_ROWS);
            return response;
        }
        return response.toBuilder().component(navRow).build();
    }

    private static PanelResponse injectModern(PanelResponse response, ActionRow navRow) {
        List<PanelComponent> top = response.getComponents();
        if (!(top.get(top.size() - 1) instanceof Container last)) {
            return response;
        }
        boolean present = last.children().stream()
                .filter(ActionRow.class::isInstance)
                .anyMatch(ResponseRenderer::hasReturnControl);
        if (present) {
            return response;
        }
        Container extended = last.toBuilder()
                .component(Separator.small())
                .component(navRow)
                .build();
        List<PanelComponent> replaced = new ArrayList<>(top);
        replaced.set(replaced.size() - 1, extended);
        return response.toBuilder().clearComponents().components(replaced).build();
    }

    private static Optional<ActionRow> navigationRow(AccessMethod accessMethod) {
        List<PanelComponent> buttons = new ArrayList<>();
        NavigationControls.returnButton(accessMethod).ifPresent(buttons::add);
        NavigationControls.injectedCloseButton(accessMethod).ifPresent(buttons::add);
        if (buttons.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(ActionRow.builder().components(buttons).build());
    }

    private static boolean hasReturnControl(PanelComponent row) {
        return row.children().stream()
                .anyMatch(c -> c instanceof Button b
                        && b.getCustomId() != null
                        && NavigationControls.RETURN_IDS.contains(b.getCustomId()));
    }
}
