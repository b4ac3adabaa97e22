package com.panelkit.app.panels;

import com.panelkit.panel.codec.ActionIdCodec;
import com.panelkit.panel.definition.PanelContext;
import com.panelkit.panel.definition.PanelDefinition;
import com.panelkit.panel.definition.PanelRefresh;
import com.panelkit.panel.definition.PanelRegistry;
import com.panelkit.panel.definition.PanelResult;
import com.panelkit.panel.model.PanelScope;
import com.panelkit.panel.model.RenderTarget;
import com.panelkit.panel.response.ActionRow;
import com.panelkit.panel.response.Button;
import com.panelkit.panel.response.ButtonStyle;
import com.panelkit.panel.response.Container;
import com.panelkit.panel.response.PanelResponse;
import com.panelkit.panel.response.Separator;
import com.panelkit.panel.response.TextDisplay;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.LongSupplier;

/**
 * Standing status message: one per deployment, survives restarts.
 */
@Slf4j
@Component
public class StatusBoardPanel implements PanelDefinition {

    public static final String ID = "status_board";
    public static final String RECOVERED_STATE = "checked";

    static final String REFRESH = "refresh";

    private final ObjectProvider<PanelRegistry> registry;
    private final LongSupplier clock;
    private final long startedAt;
    private final AtomicInteger refreshes = new AtomicInteger();

    @Autowired
    public StatusBoardPanel(ObjectProvider<PanelRegistry> registry) {
        this(registry, System::currentTimeMillis);
    }

    StatusBoardPanel(ObjectProvider<PanelRegistry> registry, LongSupplier clock) {
        this.registry = registry;
        this.clock = clock;
        this.startedAt = clock.getAsLong();
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String name() {
        return "Status Board";
    }

    @Override
    public String description() {
        return "Standing status message that refreshes after restarts";
    }

    @Override
    public String category() {
        return "Monitoring";
    }

    @Override
    public String icon() {
        return "📡";
    }

    @Override
    public PanelScope scope() {
        return PanelScope.SYSTEM;
    }

    @Override
    public boolean persistent() {
        return true;
    }

    @Override
    public boolean unique() {
        return true;
    }

    @Override
    public boolean devOnly() {
        return true;
    }

    @Override
    public CompletableFuture<PanelResult> onRender(PanelContext context) {
        return CompletableFuture.completedFuture(PanelResult.render(render("Live")));
    }

    @Override
    public CompletableFuture<PanelResult> onButton(PanelContext context, String buttonId) {
        if (REFRESH.equals(buttonId)) {
            refreshes.incrementAndGet();
        }
        return CompletableFuture.completedFuture(PanelResult.render(render("Live")));
    }

    @Override
    public CompletableFuture<Optional<PanelRefresh>> onRecovered(PanelContext context) {
        log.info("Status board recovered in channel {}", context.getChannelId());
        return CompletableFuture.completedFuture(
                Optional.of(new PanelRefresh(render("Recovered after restart"), RECOVERED_STATE)));
    }

    @Override
    public void onPersistentCreated(PanelContext context, RenderTarget target) {
        log.info("Status board posted as message {} in channel {}", target.messageId(), target.channelId());
    }

    int refreshCount() {
        return refreshes.get();
    }

    PanelResponse render(String status) {
        long uptimeSeconds = Math.max(0, clock.getAsLong() - startedAt) / 1000;
        PanelRegistry panels = registry.getIfAvailable();
        int panelCount = panels != null ? panels.size() : 0;
        return PanelResponse.builder()
                .component(Container.builder()
                        .accentColor(0x57F287)
                        .component(new TextDisplay("## 📡 Status Board"))
                        .component(new TextDisplay("**Status:** " + status))
                        .component(Separator.small())
                        .component(new TextDisplay("**Uptime:** " + formatUptime(uptimeSeconds)
                                + "\n**Panels:** " + panelCount
                                + "\n**Manual refreshes:** " + refreshes.get()))
                        .component(ActionRow.of(Button.builder()
                                .customId(ActionIdCodec.button(ID, REFRESH))
                                .label("Refresh")
                                .style(ButtonStyle.SECONDARY)
                                .build()))
                        .build())
                .build();
    }

    static String formatUptime(long seconds) {
        long hours = seconds / 3600;
        long minutes = (seconds % 3600) / 60;
        return hours > 0 ? hours + "h " + minutes + "m" : minutes + "m " + (seconds % 60) + "s";
    }
}
