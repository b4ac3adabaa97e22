package com.panelkit.panel.web;

import com.fasterxml.jackson.databind.JsonNode;
import com.panelkit.common.config.PanelKitConfig;
import com.panelkit.panel.broadcast.LiveUpdateMessage;
import com.panelkit.panel.codec.ActionKind;
import com.panelkit.panel.definition.DefaultPermissionEvaluator;
import com.panelkit.panel.definition.PanelResult;
import com.panelkit.panel.directory.DirectoryEntry;
import com.panelkit.panel.directory.PanelDirectory;
import com.panelkit.panel.model.AccessMethod;
import com.panelkit.panel.model.PanelScope;
import com.panelkit.panel.response.Modal;
import com.panelkit.panel.response.Notification;
import com.panelkit.panel.response.NotificationType;
import com.panelkit.panel.response.PanelResponse;
import com.panelkit.panel.testing.PanelHarness;
import com.panelkit.panel.testing.TestPanel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

class PanelWebAdapterTest {

    @TempDir
    Path tempDir;

    private PanelHarness harness;
    private PanelWebAdapter adapter;

    @BeforeEach
    void setUp() {
        harness = new PanelHarness(tempDir);
        PanelDirectory directory = new PanelDirectory(harness.registry, harness.permissions,
                new PanelKitConfig.AdminPanelConfig());
        adapter = new PanelWebAdapter(harness.registry, directory, harness.permissions, harness.broadcaster, null);
    }

    @Test
    void listPanels_bothScopesWhenUnscoped() {
        harness.register(new TestPanel("sys").scope(PanelScope.SYSTEM));
        harness.register(new TestPanel("guild"));
        harness.register(new TestPanel("hidden").hidden());

        List<String> all = adapter.listPanels(null, "user-1", "guild-1").stream().map(DirectoryEntry::id).toList();
        List<String> guildOnly = adapter.listPanels(PanelScope.GUILD, "user-1", "guild-1").stream()
                .map(DirectoryEntry::id).toList();

        assertEquals(List.of("sys", "guild"), all);
        assertEquals(List.of("guild"), guildOnly);
    }

    @Test
    void open_serializesRenderWithWebControls_withoutBroadcast() {
        TestPanel panel = harness.register(new TestPanel("stats"));

        WebResult result = adapter.open(WebRequest.of("stats", "user-1", "guild-1")).join();

        assertTrue(result.success());
        assertEquals("render stats", result.data().path("content").asText());
        assertTrue(result.data().toString().contains("web_ui_refresh"));
        assertEquals(AccessMethod.WEB_UI, panel.lastContext().getAccessMethod());
        assertTrue(harness.broadcasts.isEmpty());
    }

    @Test
    void open_persistentPanel_rendersWithoutConfirmation() {
        harness.register(new TestPanel("board").persistent(true).unique(true));

        WebResult result = adapter.open(WebRequest.of("board", "user-1", "guild-1")).join();

        assertEquals("render board", result.data().path("content").asText());
    }

    @Test
    void open_unknownPanel_fails() {
        WebResult result = adapter.open(WebRequest.of("ghost", "user-1", "guild-1")).join();

        assertFalse(result.success());
        assertEquals("Panel not found: ghost", result.error());
    }

    @Test
    void open_denied_failsWithPermissionMessage() {
        harness.register(new TestPanel("secret").allowedUsers(Set.of("someone-else")));

        WebResult result = adapter.open(WebRequest.of("secret", "user-1", "guild-1")).join();

        assertFalse(result.success());
        assertEquals(PanelWebAdapter.PERMISSION_DENIED, result.error());
    }

    @Test
    void open_webOwnerBypassesRestrictions() {
        harness.register(new TestPanel("secret").devOnly(true));

        WebResult result = adapter.open(
                WebRequest.of("secret", DefaultPermissionEvaluator.WEB_UI_OWNER, "guild-1")).join();

        assertTrue(result.success());
    }

    @Test
    void button_parsesCompositeId_appendsStack_andBroadcastsToScope() {
        TestPanel panel = harness.register(new TestPanel("stats"));

        WebResult result = adapter.button(WebRequest.of("stats", "user-1", "guild-1"),
                "panel_stats_btn_refresh").join();

        assertTrue(result.success());
        assertEquals(List.of("refresh"), panel.actionIds);
        assertEquals(List.of("stats"), panel.lastContext().getNavigationStack());
        assertEquals(1, harness.broadcasts.size());
        LiveUpdateMessage.Data data = harness.broadcasts.get(0).data();
        assertEquals("stats", data.panelId());
        assertEquals("guild-1", data.guildId());
        assertEquals("button stats", data.response().path("content").asText());
    }

    @Test
    void button_systemPanel_broadcastsGlobally() {
        harness.register(new TestPanel("sys").scope(PanelScope.SYSTEM));

        adapter.button(WebRequest.of("sys", "user-1", "guild-1"), "refresh").join();

        assertNull(harness.broadcasts.get(0).data().guildId());
    }

    @Test
    void button_webRefresh_returnsToPanelList() {
        TestPanel panel = harness.register(new TestPanel("stats"));

        WebResult result = adapter.button(WebRequest.of("stats", "user-1", "guild-1"), "web_ui_refresh").join();

        assertTrue(result.data().path("returnToPanelList").asBoolean());
        assertTrue(panel.calls.isEmpty());
    }

    @Test
    void button_closeResponse_returnsToListWithNotification() {
        harness.register(new TestPanel("stats").onButton(ctx -> TestPanel.done(
                PanelResponse.close(Notification.of(NotificationType.SUCCESS, "Saved")))));

        WebResult result = adapter.button(WebRequest.of("stats", "user-1", "guild-1"), "save").join();

        JsonNode data = result.data();
        assertTrue(data.path("returnToPanelList").asBoolean());
        assertEquals("success", data.path("notification").path("type").asText());
        assertEquals("Saved", data.path("notification").path("message").asText());
        assertTrue(harness.broadcasts.isEmpty());
    }

    @Test
    void button_modalResult_returnsModalDocument() {
        Modal modal = Modal.builder().customId("panel_stats_modal_edit").title("Edit").build();
        harness.register(new TestPanel("stats")
                .onButton(ctx -> CompletableFuture.completedFuture(PanelResult.modal(modal))));

        WebResult result = adapter.button(WebRequest.of("stats", "user-1", "guild-1"), "edit").join();

        assertEquals("Edit", result.data().path("modal").path("title").asText());
        assertEquals("panel_stats_modal_edit", result.data().path("modal").path("customId").asText());
    }

    @Test
    void button_handlerThrows_fails() {
        harness.register(new TestPanel("stats").onButton(ctx -> {
            throw new IllegalStateException("boom");
        }));

        WebResult result = adapter.button(WebRequest.of("stats", "user-1", "guild-1"), "x").join();

        assertFalse(result.success());
        assertEquals("boom", result.error());
    }

    @Test
    void button_handledDirectly_rerendersCurrentState() {
        TestPanel panel = harness.register(new TestPanel("stats")
                .onButton(ctx -> CompletableFuture.completedFuture(PanelResult.handledDirectly())));

        WebResult result = adapter.button(WebRequest.of("stats", "user-1", "guild-1"), "x").join();

        assertEquals(List.of("button", "render"), panel.calls);
        assertEquals("render stats", result.data().path("content").asText());
    }

    @Test
    void dropdown_passesValues() {
        TestPanel panel = harness.register(new TestPanel("stats"));

        WebResult result = adapter.dropdown(WebRequest.of("stats", "user-1", "guild-1"),
                "panel_stats_dropdown_period", List.of("week")).join();

        assertTrue(result.success());
        assertEquals(List.of("period"), panel.actionIds);
        assertEquals(List.of(List.of("week")), panel.dropdownValues);
    }

    @Test
    void modal_passesFields() {
        TestPanel panel = harness.register(new TestPanel("stats"));

        adapter.modal(WebRequest.of("stats", "user-1", "guild-1"), "panel_stats_modal_edit",
                Map.of("name", "Ada")).join();

        assertEquals(List.of("edit"), panel.actionIds);
        assertEquals(List.of(Map.of("name", "Ada")), panel.modalFields);
    }

    @Test
    void bareActionId_acceptsCompositeOrBare() {
        assertEquals("go", PanelWebAdapter.bareActionId("panel_x_btn_go", ActionKind.BUTTON, "btn_"));
        assertEquals("go", PanelWebAdapter.bareActionId("go", ActionKind.BUTTON, "btn_"));
        assertNull(PanelWebAdapter.bareActionId(null, ActionKind.BUTTON, "btn_"));
    }
}
