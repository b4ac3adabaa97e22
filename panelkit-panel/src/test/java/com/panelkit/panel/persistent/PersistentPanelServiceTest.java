package com.panelkit.panel.persistent;

import com.panelkit.panel.definition.PanelContext;
import com.panelkit.panel.model.AccessMethod;
import com.panelkit.panel.model.PanelInstance;
import com.panelkit.panel.model.PanelScope;
import com.panelkit.panel.platform.PlatformErrorCode;
import com.panelkit.panel.platform.PlatformException;
import com.panelkit.panel.platform.PlatformMessage;
import com.panelkit.panel.render.NavigationControls;
import com.panelkit.panel.render.PanelResponses;
import com.panelkit.panel.response.Button;
import com.panelkit.panel.response.PanelResponse;
import com.panelkit.panel.testing.FakePlatform;
import com.panelkit.panel.testing.PanelHarness;
import com.panelkit.panel.testing.TestPanel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

class PersistentPanelServiceTest {

    @TempDir
    Path tempDir;

    private PanelHarness harness;
    private PersistentPanelService service;
    private FakePlatform.FakeChannel channel;

    @BeforeEach
    void setUp() {
        harness = new PanelHarness(tempDir);
        service = harness.persistent;
        channel = harness.platform.channel("chan-1");
    }

    private static PanelContext context(AccessMethod accessMethod) {
        return PanelContext.builder()
                .userId("user-1")
                .guildId("guild-1")
                .channelId("chan-1")
                .accessMethod(accessMethod)
                .build();
    }

    @Test
    void scopeFor_systemPanelsAreGlobal() {
        assertNull(PersistentPanelService.scopeFor(new TestPanel("a").scope(PanelScope.SYSTEM), "guild-1"));
        assertEquals("guild-1", PersistentPanelService.scopeFor(new TestPanel("a"), "guild-1"));
    }

    @Test
    void createPersistentPanel_postsRecordsAndRegistersNavigation() {
        TestPanel panel = new TestPanel("board").persistent(true);

        PlatformMessage message = service.createPersistentPanel(panel, context(AccessMethod.GUILD_PANEL),
                PanelResponse.builder().content("Board").ephemeral(true).build(), null).join();

        FakePlatform.FakeMessage posted = channel.message(message.id());
        assertFalse(posted.current().isEphemeral());
        assertTrue(posted.current().getComponents().get(0).children().stream()
                .anyMatch(c -> NavigationControls.GUILD_BACK.equals(((Button) c).getCustomId())));
        PanelInstance stored = harness.store.get("board", "guild-1").orElseThrow();
        assertEquals(message.id(), stored.getMessageId());
        assertEquals("chan-1", stored.getChannelId());
        assertEquals(PanelInstance.STATE_ACTIVE, stored.getState());
        assertEquals(AccessMethod.GUILD_PANEL, stored.getAccessMethod());
        assertEquals("Board", stored.getSessionData().get("content").asText());
        assertEquals(AccessMethod.GUILD_PANEL, harness.navigation.get(message.id()).orElseThrow().accessMethod());
        assertEquals(1, panel.createdTargets.size());
        assertEquals(message.id(), panel.createdTargets.get(0).messageId());
    }

    @Test
    void createPersistentPanel_uniqueReplacement_deletesOldMessage() {
        TestPanel panel = new TestPanel("board").persistent(true).unique(true);
        PlatformMessage first = service.createPersistentPanel(panel, context(AccessMethod.DIRECT_COMMAND),
                PanelResponse.ofContent("v1"), null).join();

        PlatformMessage second = service.createPersistentPanel(panel, context(AccessMethod.DIRECT_COMMAND),
                PanelResponse.ofContent("v2"), null).join();

        assertFalse(channel.hasMessage(first.id()));
        assertTrue(channel.hasMessage(second.id()));
        assertEquals(second.id(), harness.store.get("board", "guild-1").orElseThrow().getMessageId());
        assertTrue(harness.navigation.get(first.id()).isEmpty());
    }

    @Test
    void createPersistentPanel_nonUniqueReplacement_marksOldInactive() {
        TestPanel panel = new TestPanel("notes").persistent(true);
        PlatformMessage first = service.createPersistentPanel(panel, context(AccessMethod.DIRECT_COMMAND),
                PanelResponse.ofContent("v1"), null).join();

        service.createPersistentPanel(panel, context(AccessMethod.DIRECT_COMMAND),
                PanelResponse.ofContent("v2"), null).join();

        PanelResponse old = channel.message(first.id()).current();
        assertEquals("⚠️ Panel Inactive", old.getEmbeds().get(0).getTitle());
        assertEquals(PanelResponses.REPLACED_MESSAGE, old.getEmbeds().get(0).getDescription());
    }

    @Test
    void createPersistentPanel_replacementDeleteFails_stillCompletes() {
        TestPanel panel = new TestPanel("board").persistent(true).unique(true);
        harness.store.put("board", PanelInstance.builder()
                .messageId("m-elsewhere").channelId("chan-missing").build(), "guild-1");

        PlatformMessage message = service.createPersistentPanel(panel, context(AccessMethod.DIRECT_COMMAND),
                PanelResponse.ofContent("v1"), null).join();

        assertEquals(message.id(), harness.store.get("board", "guild-1").orElseThrow().getMessageId());
    }

    @Test
    void createPersistentPanel_sessions_keepBothInstances() {
        TestPanel panel = new TestPanel("ticket").persistent(true);

        PlatformMessage a = service.createPersistentPanel(panel, context(AccessMethod.DIRECT_COMMAND),
                PanelResponse.ofContent("a"), "s1").join();
        PlatformMessage b = service.createPersistentPanel(panel, context(AccessMethod.DIRECT_COMMAND),
                PanelResponse.ofContent("b"), "s2").join();

        assertTrue(channel.hasMessage(a.id()));
        assertEquals("a", channel.message(a.id()).current().getContent());
        assertEquals(b.id(), harness.store.get("ticket", "guild-1", "s2").orElseThrow().getMessageId());
    }

    @Test
    void createPersistentPanel_unknownChannel_fails() {
        TestPanel panel = new TestPanel("board").persistent(true);
        PanelContext ctx = context(AccessMethod.DIRECT_COMMAND).toBuilder().channelId("nowhere").build();

        CompletionException error = assertThrows(CompletionException.class,
                () -> service.createPersistentPanel(panel, ctx, PanelResponse.ofContent("x"), null).join());

        assertEquals(PlatformErrorCode.UNKNOWN_CHANNEL,
                PlatformException.find(error).orElseThrow().getErrorCode());
        assertTrue(harness.store.get("board", "guild-1").isEmpty());
    }

    @Test
    void updatePersistentPanel_editsBroadcastsAndStoresState() {
        TestPanel panel = new TestPanel("board").persistent(true);
        PlatformMessage message = service.createPersistentPanel(panel, context(AccessMethod.SYSTEM_PANEL),
                PanelResponse.ofContent("v1"), null).join();
        harness.clock.addAndGet(1000);

        boolean updated = service.updatePersistentPanel("board", PanelResponse.ofContent("v2"),
                "guild-1", null, "checked").join();

        assertTrue(updated);
        assertEquals("v2", channel.message(message.id()).current().getContent());
        assertEquals(1, harness.broadcasts.size());
        assertEquals("v2", harness.broadcasts.get(0).data().response().get("content").asText());
        PanelInstance stored = harness.store.get("board", "guild-1").orElseThrow();
        assertEquals("checked", stored.getState());
        assertEquals("v2", stored.getSessionData().get("content").asText());
        assertEquals(harness.clock.get(), stored.getLastUpdated());
    }

    @Test
    void updatePersistentPanel_noRecord_returnsFalse() {
        assertFalse(service.updatePersistentPanel("ghost", PanelResponse.ofContent("x"), "g", null, null).join());
        assertTrue(service.updatePersistentPanel("ghost", null, "g", null, null).join());
    }

    @Test
    void updatePersistentPanel_messageGone_prunesRecord() {
        TestPanel panel = new TestPanel("board").persistent(true);
        PlatformMessage message = service.createPersistentPanel(panel, context(AccessMethod.DIRECT_COMMAND),
                PanelResponse.ofContent("v1"), null).join();
        channel.message(message.id()).delete().join();

        assertFalse(service.updatePersistentPanel("board", PanelResponse.ofContent("v2"), "guild-1", null, null)
                .join());
        assertTrue(harness.store.get("board", "guild-1").isEmpty());
        assertTrue(harness.broadcasts.isEmpty());
    }

    @Test
    void updatePersistentPanel_transportDown_keepsRecord() {
        TestPanel panel = new TestPanel("board").persistent(true);
        service.createPersistentPanel(panel, context(AccessMethod.DIRECT_COMMAND),
                PanelResponse.ofContent("v1"), null).join();
        harness.platform.setUnavailable(true);

        assertFalse(service.updatePersistentPanel("board", PanelResponse.ofContent("v2"), "guild-1", null, null)
                .join());
        assertTrue(harness.store.get("board", "guild-1").isPresent());
    }

    @Test
    void updatePanelDynamic_webUi_onlyBroadcasts() {
        TestPanel panel = new TestPanel("board").persistent(true);

        assertTrue(service.updatePanelDynamic(panel, context(AccessMethod.WEB_UI),
                PanelResponse.ofContent("live"), null).join());

        assertEquals(1, harness.broadcasts.size());
        assertTrue(channel.sent().isEmpty());
    }

    @Test
    void cleanupPersistentPanel_marksInactiveAndForgets() {
        TestPanel panel = new TestPanel("board").persistent(true);
        PlatformMessage message = service.createPersistentPanel(panel, context(AccessMethod.DIRECT_COMMAND),
                PanelResponse.ofContent("v1"), null).join();

        service.cleanupPersistentPanel("board", "guild-1", null, null).join();

        PanelResponse shown = channel.message(message.id()).current();
        assertEquals(PersistentPanelService.DEFAULT_CLEANUP_REASON, shown.getEmbeds().get(0).getDescription());
        assertTrue(harness.store.get("board", "guild-1").isEmpty());
        assertTrue(harness.navigation.get(message.id()).isEmpty());
    }

    @Test
    void deletePanelMessage_alreadyGone_countsAsDeleted() {
        FakePlatform.FakeMessage message = channel.addMessage("m1", PanelResponse.ofContent("x"));
        PanelInstance instance = PanelInstance.builder().messageId("m1").channelId("chan-1").build();

        assertTrue(service.deletePanelMessage(instance).join());
        assertTrue(message.isDeleted());
        assertTrue(service.deletePanelMessage(instance).join());
    }

    @Test
    void deletePanelMessage_missingPermissions_returnsFalse() {
        FakePlatform.FakeMessage message = channel.addMessage("m1", PanelResponse.ofContent("x"));
        message.failDeletesWith(new PlatformException(PlatformErrorCode.MISSING_PERMISSIONS, "Missing Permissions"));
        PanelInstance instance = PanelInstance.builder().messageId("m1").channelId("chan-1").build();

        assertFalse(service.deletePanelMessage(instance).join());
        assertFalse(message.isDeleted());
    }

    @Test
    void cleanupInvalid_prunesOnlyTargetGoneRecords() {
        channel.addMessage("m-live", PanelResponse.ofContent("x"));
        harness.store.put("live", PanelInstance.builder().messageId("m-live").channelId("chan-1").build(), "guild-1");
        harness.store.put("gone", PanelInstance.builder().messageId("m-gone").channelId("chan-1").build(), "guild-1");
        harness.store.put("nochan", PanelInstance.builder().messageId("m-x").channelId("chan-x").build(), null);

        assertEquals(2, service.cleanupInvalid().join());

        assertTrue(harness.store.get("live", "guild-1").isPresent());
        assertTrue(harness.store.get("gone", "guild-1").isEmpty());
        assertTrue(harness.store.get("nochan", null).isEmpty());
    }

    @Test
    void cleanupInvalid_transportDown_keepsEverything() {
        harness.store.put("a", PanelInstance.builder().messageId("m1").channelId("chan-1").build(), "guild-1");
        harness.platform.setUnavailable(true);

        assertEquals(0, service.cleanupInvalid().join());
        assertTrue(harness.store.get("a", "guild-1").isPresent());
    }

    @Test
    void cleanupExpired_removesIdleSessionsAcrossScopes() {
        harness.store.put("t", PanelInstance.builder().messageId("m1").channelId("c").build(), "guild-1", "s1", 1);
        harness.store.put("t", PanelInstance.builder().messageId("m2").channelId("c").build(), null, "s2", 1);
        harness.clock.addAndGet(10_000);

        assertEquals(2, service.cleanupExpired(5_000));
        assertEquals(List.of(), harness.store.list("guild-1"));
    }
}
