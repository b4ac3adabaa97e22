package com.panelkit.app.panels;

import com.panelkit.panel.codec.ActionIdCodec;
import com.panelkit.panel.definition.PanelContext;
import com.panelkit.panel.definition.PanelDefinition;
import com.panelkit.panel.definition.PanelResult;
import com.panelkit.panel.response.ActionRow;
import com.panelkit.panel.response.Button;
import com.panelkit.panel.response.ButtonStyle;
import com.panelkit.panel.response.Embed;
import com.panelkit.panel.response.Modal;
import com.panelkit.panel.response.Notification;
import com.panelkit.panel.response.NotificationType;
import com.panelkit.panel.response.PanelResponse;
import com.panelkit.panel.response.SelectMenu;
import com.panelkit.panel.response.SelectOption;
import com.panelkit.panel.response.TextInput;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Shared counter per guild. Shows buttons, a dropdown and a modal on one panel.
 */
@Slf4j
@Component
public class CounterPanel implements PanelDefinition {

    public static final String ID = "counter";

    static final String INCREMENT = "increment";
    static final String RESET = "reset";
    static final String RENAME = "rename";
    static final String STEP = "step";
    static final String LABEL_FIELD = "label";

    private static final String GLOBAL = "global";

    private final Map<String, Tally> tallies = new ConcurrentHashMap<>();

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String name() {
        return "Counter";
    }

    @Override
    public String description() {
        return "A shared counter for this server";
    }

    @Override
    public String category() {
        return "Examples";
    }

    @Override
    public String icon() {
        return "🔢";
    }

    @Override
    public int adminPanelOrder() {
        return 10;
    }

    @Override
    public CompletableFuture<PanelResult> onRender(PanelContext context) {
        return CompletableFuture.completedFuture(PanelResult.render(render(tally(context))));
    }

    @Override
    public CompletableFuture<PanelResult> onButton(PanelContext context, String buttonId) {
        Tally tally = tally(context);
        switch (buttonId) {
            case INCREMENT:
                tally.add(tally.step());
                break;
            case RESET:
                tally.reset();
                return done(render(tally).toBuilder()
                        .notification(Notification.of(NotificationType.INFO, "Counter reset"))
                        .build());
            case RENAME:
                return CompletableFuture.completedFuture(PanelResult.modal(renameModal(tally)));
            default:
                log.debug("Unknown counter button: {}", buttonId);
                break;
        }
        return done(render(tally));
    }

    @Override
    public CompletableFuture<PanelResult> onDropdown(PanelContext context, List<String> values, String dropdownId) {
        Tally tally = tally(context);
        if (STEP.equals(dropdownId) && !values.isEmpty()) {
            try {
                tally.step(Integer.parseInt(values.get(0)));
            } catch (NumberFormatException e) {
                return done(render(tally).toBuilder()
                        .notification(Notification.of(NotificationType.ERROR, "Invalid step: " + values.get(0)))
                        .build());
            }
        }
        return done(render(tally));
    }

    @Override
    public CompletableFuture<PanelResult> onModal(PanelContext context, String modalId, Map<String, String> fields) {
        Tally tally = tally(context);
        String label = fields.get(LABEL_FIELD);
        if (!RENAME.equals(modalId) || label == null || label.isBlank()) {
            return done(render(tally).toBuilder()
                    .notification(Notification.of(NotificationType.WARNING, "Label unchanged"))
                    .build());
        }
        tally.label(label.trim());
        return done(render(tally).toBuilder()
                .notification(Notification.of(NotificationType.SUCCESS, "Renamed to " + label.trim()))
                .build());
    }

    int value(String guildId) {
        Tally tally = tallies.get(guildId != null ? guildId : GLOBAL);
        return tally != null ? tally.value() : 0;
    }

    private Tally tally(PanelContext context) {
        String key = context.getGuildId() != null ? context.getGuildId() : GLOBAL;
        return tallies.computeIfAbsent(key, k -> new Tally());
    }

    private static PanelResponse render(Tally tally) {
        return PanelResponse.builder()
                .embed(Embed.builder()
                        .title("🔢 " + tally.label())
                        .description("Current value: **" + tally.value() + "**")
                        .field(Embed.Field.of("Step", String.valueOf(tally.step())))
                        .color(0x5865F2)
                        .build())
                .component(ActionRow.of(
                        button(INCREMENT, "+" + tally.step(), ButtonStyle.PRIMARY),
                        button(RESET, "Reset", ButtonStyle.DANGER),
                        button(RENAME, "Rename", ButtonStyle.SECONDARY)))
                .component(ActionRow.of(SelectMenu.builder()
                        .customId(ActionIdCodec.dropdown(ID, STEP))
                        .placeholder("Step size")
                        .option(step(1, tally))
                        .option(step(5, tally))
                        .option(step(10, tally))
                        .build()))
                .build();
    }

    private static Modal renameModal(Tally tally) {
        return Modal.builder()
                .customId(ActionIdCodec.modal(ID, RENAME))
                .title("Rename counter")
                .component(ActionRow.of(TextInput.builder()
                        .customId(LABEL_FIELD)
                        .label("Label")
                        .value(tally.label())
                        .maxLength(64)
                        .build()))
                .build();
    }

    private static Button button(String action, String label, ButtonStyle style) {
        return Button.builder().customId(ActionIdCodec.button(ID, action)).label(label).style(style).build();
    }

    private static SelectOption step(int size, Tally tally) {
        return SelectOption.builder()
                .label("Step " + size)
                .value(String.valueOf(size))
                .selectedByDefault(tally.step() == size)
                .build();
    }

    private static CompletableFuture<PanelResult> done(PanelResponse response) {
        return CompletableFuture.completedFuture(PanelResult.render(response));
    }

    private static final class Tally {
        private int value;
        private int step = 1;
        private String label = "Counter";

        synchronized int value() {
            return value;
        }

        synchronized void add(int amount) {
            value += amount;
        }

        synchronized void reset() {
            value = 0;
        }

        synchronized int step() {
            return step;
        }

        synchronized void step(int size) {
            if (size <= 0) {
                throw new NumberFormatException("step must be positive");
            }
            step = size;
        }

        synchronized String label() {
            return label;
        }

        synchronized void label(String text) {
            label = text;
        }
    }
}
