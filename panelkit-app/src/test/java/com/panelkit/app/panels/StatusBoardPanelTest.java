package com.panelkit.app.panels;

import com.panelkit.panel.definition.PanelContext;
import com.panelkit.panel.definition.PanelRefresh;
import com.panelkit.panel.definition.PanelRegistry;
import com.panelkit.panel.definition.PanelResult;
import com.panelkit.panel.model.PanelScope;
import com.panelkit.panel.response.Container;
import com.panelkit.panel.response.PanelResponse;
import com.panelkit.panel.response.TextDisplay;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.support.StaticListableBeanFactory;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class StatusBoardPanelTest {

    private final AtomicLong now = new AtomicLong(1_000_000L);
    private StatusBoardPanel panel;

    @BeforeEach
    void setUp() {
        StaticListableBeanFactory beans = new StaticListableBeanFactory();
        PanelRegistry registry = new PanelRegistry();
        beans.addBean("panelRegistry", registry);
        panel = new StatusBoardPanel(beans.getBeanProvider(PanelRegistry.class), now::get);
        registry.register(panel);
    }

    private static String text(PanelResponse response, int index) {
        Container container = (Container) response.getComponents().get(0);
        return ((TextDisplay) container.getComponents().get(index)).content();
    }

    @Test
    void registersAsStandingSystemPanel() {
        assertEquals(PanelScope.SYSTEM, panel.scope());
        assertTrue(panel.persistent());
        assertTrue(panel.unique());
        assertTrue(panel.devOnly());
    }

    @Test
    void render_showsUptimeAndPanelCount() {
        now.addAndGet(3_725_000L);

        PanelResponse response = ((PanelResult.Render) panel.onRender(PanelContext.builder().build()).join())
                .response();

        assertTrue(response.isModern());
        assertEquals("**Status:** Live", text(response, 1));
        assertTrue(text(response, 3).startsWith("**Uptime:** 1h 2m\n**Panels:** 1"));
    }

    @Test
    void refreshButton_countsManualRefreshes() {
        panel.onButton(PanelContext.builder().build(), StatusBoardPanel.REFRESH).join();
        panel.onButton(PanelContext.builder().build(), "other").join();

        assertEquals(1, panel.refreshCount());
    }

    @Test
    void onRecovered_rerendersWithCheckedState() {
        Optional<PanelRefresh> refresh = panel.onRecovered(PanelContext.builder().channelId("c1").build()).join();

        assertTrue(refresh.isPresent());
        assertEquals(StatusBoardPanel.RECOVERED_STATE, refresh.get().state());
        assertEquals("**Status:** Recovered after restart", text(refresh.get().response(), 1));
    }

    @Test
    void formatUptime_switchesToHoursAfterAnHour() {
        assertEquals("0m 59s", StatusBoardPanel.formatUptime(59));
        assertEquals("2m 5s", StatusBoardPanel.formatUptime(125));
        assertEquals("1h 0m", StatusBoardPanel.formatUptime(3600));
    }
}
