package com.panelkit.panel.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.panelkit.panel.model.AccessMethod;
import com.panelkit.panel.model.PanelInstance;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class PanelInstanceStoreTest {

    @TempDir
    Path tempDir;

    private final AtomicLong now = new AtomicLong(10_000);
    private PanelInstanceStore store;

    @BeforeEach
    void setUp() {
        store = new PanelInstanceStore(tempDir, now::get);
    }

    private static PanelInstance instance(String messageId) {
        return PanelInstance.builder()
                .messageId(messageId)
                .channelId("c1")
                .userId("u1")
                .guildId("g1")
                .createdAt(1)
                .state(PanelInstance.STATE_ACTIVE)
                .accessMethod(AccessMethod.GUILD_PANEL)
                .build();
    }

    @Test
    void put_thenGet_roundTripsAndStampsLastUpdated() {
        store.put("status", instance("m1"), "g1");

        PanelInstance stored = store.get("status", "g1").orElseThrow();
        assertEquals("m1", stored.getMessageId());
        assertEquals(AccessMethod.GUILD_PANEL, stored.getAccessMethod());
        assertEquals(10_000, stored.getLastUpdated());
        assertTrue(Files.exists(tempDir.resolve("g1").resolve(PanelInstanceStore.FILE_NAME)));
    }

    @Test
    void put_globalScope_usesGlobalDirectory() {
        store.put("sys", instance("m1"), null);

        assertEquals(tempDir.resolve("global").resolve(PanelInstanceStore.FILE_NAME), store.pathFor(null));
        assertTrue(store.get("sys", null).isPresent());
        assertTrue(store.get("sys", "g1").isEmpty());
    }

    @Test
    void put_overSingleRecord_returnsReplaced() {
        store.put("status", instance("m1"), "g1");

        StoreResult result = store.put("status", instance("m2"), "g1", null, 1);

        assertEquals("m1", result.replacedInstance().orElseThrow().getMessageId());
        assertEquals("m2", store.get("status", "g1").orElseThrow().getMessageId());
    }

    @Test
    void put_withMaxInstancesAboveOne_reportsNoReplacement() {
        store.put("status", instance("m1"), "g1");

        assertTrue(store.put("status", instance("m2"), "g1", null, 3).replacedInstance().isEmpty());
    }

    @Test
    void put_sessions_keepsEachSession() {
        store.put("ticket", instance("m1"), "g1", "s1", 1);
        store.put("ticket", instance("m2"), "g1", "s2", 1);

        assertEquals("m1", store.get("ticket", "g1", "s1").orElseThrow().getMessageId());
        assertEquals("m2", store.get("ticket", "g1", "s2").orElseThrow().getMessageId());
        assertTrue(store.get("ticket", "g1").isEmpty());
        assertEquals(2, store.list("g1").size());
    }

    @Test
    void remove_lastSession_removesPanelEntry() throws IOException {
        store.put("ticket", instance("m1"), "g1", "s1", 1);

        assertTrue(store.remove("ticket", "g1", "s1"));
        assertFalse(store.remove("ticket", "g1", "s1"));
        JsonNode document = new ObjectMapper().readTree(store.pathFor("g1").toFile());
        assertFalse(document.has("ticket"));
    }

    @Test
    void updateState_mergesSessionData() {
        store.put("status", instance("m1").toBuilder()
                .sessionData(JsonNodeFactory.instance.objectNode().put("a", 1)).build(), "g1");
        now.set(20_000);

        assertTrue(store.updateState("status", "refreshed",
                JsonNodeFactory.instance.objectNode().put("b", 2), "g1", null));

        PanelInstance stored = store.get("status", "g1").orElseThrow();
        assertEquals("refreshed", stored.getState());
        assertEquals(1, stored.getSessionData().get("a").asInt());
        assertEquals(2, stored.getSessionData().get("b").asInt());
        assertEquals(20_000, stored.getLastUpdated());
        assertFalse(store.updateState("missing", "x", "g1", null));
    }

    @Test
    void updateIfCurrent_otherMessage_leavesRecordAlone() {
        store.put("status", instance("m2"), "g1");

        boolean updated = store.updateIfCurrent("status", "m1", "g1", null,
                current -> current.toBuilder().state("stale").build());

        assertFalse(updated);
        assertEquals(PanelInstance.STATE_ACTIVE, store.get("status", "g1").orElseThrow().getState());
    }

    @Test
    void updateIfCurrent_sameMessage_appliesChange() {
        store.put("status", instance("m1"), "g1");
        now.set(30_000);

        assertTrue(store.updateIfCurrent("status", "m1", "g1", null,
                current -> current.toBuilder().state("checked").build()));

        PanelInstance stored = store.get("status", "g1").orElseThrow();
        assertEquals("checked", stored.getState());
        assertEquals("c1", stored.getChannelId());
        assertEquals(30_000, stored.getLastUpdated());
    }

    @Test
    void removeIfCurrent_onlyMatchingMessage() {
        store.put("status", instance("m2"), "g1");

        assertFalse(store.removeIfCurrent("status", "m1", "g1", null));
        assertTrue(store.removeIfCurrent("status", "m2", "g1", null));
        assertTrue(store.get("status", "g1").isEmpty());
    }

    @Test
    void isActiveInstance_comparesMessageId() {
        store.put("status", instance("m1"), "g1");

        assertTrue(store.isActiveInstance("status", "m1", "g1", null));
        assertFalse(store.isActiveInstance("status", "m0", "g1", null));
        assertFalse(store.isActiveInstance("other", "m1", "g1", null));
    }

    @Test
    void listScopes_globalFirstThenGuildsWithDocuments() throws IOException {
        store.put("a", instance("m1"), "g2");
        store.put("b", instance("m2"), "g1");
        store.put("c", instance("m3"), null);
        Files.createDirectories(tempDir.resolve("empty-guild"));

        assertEquals(Arrays.asList(null, "g1", "g2"), store.listScopes());
    }

    @Test
    void cleanupExpired_removesIdleSessionsOnly() {
        store.put("single", instance("m0"), "g1");
        store.put("ticket", instance("m1"), "g1", "old", 1);
        now.set(50_000);
        store.put("ticket", instance("m2"), "g1", "fresh", 1);
        now.set(60_000);

        assertEquals(1, store.cleanupExpired("g1", 20_000));

        assertTrue(store.get("ticket", "g1", "old").isEmpty());
        assertTrue(store.get("ticket", "g1", "fresh").isPresent());
        assertTrue(store.get("single", "g1").isPresent());
    }

    @Test
    void list_skipsMalformedRecords() throws IOException {
        Path path = store.pathFor("g1");
        Files.createDirectories(path.getParent());
        Files.writeString(path, """
                {
                  "good": { "messageId": "m1", "channelId": "c1", "createdAt": 1 },
                  "bad": { "messageId": "m2", "createdAt": "not-a-number" }
                }
                """);

        List<StoredPanel> stored = store.list("g1");

        assertEquals(1, stored.size());
        assertEquals("good", stored.get(0).panelId());
    }

    @Test
    void removeIf_malformedRecordInScope_isSkippedAndKept() throws IOException {
        Path path = store.pathFor("g1");
        Files.createDirectories(path.getParent());
        Files.writeString(path, """
                {
                  "bad": { "messageId": "m2", "createdAt": "not-a-number" },
                  "good": { "messageId": "m1", "channelId": "c1", "createdAt": 1 },
                  "ticket": { "sessions": {
                    "s1": { "messageId": "m3", "lastUpdated": "yesterday" },
                    "s2": { "messageId": "m4", "lastUpdated": 1 }
                  } }
                }
                """);
        now.set(100_000);

        assertTrue(store.removeIfCurrent("good", "m1", "g1", null));
        assertEquals(1, store.cleanupExpired("g1", 1_000));

        JsonNode document = new ObjectMapper().readTree(Files.readString(path));
        assertTrue(document.has("bad"));
        assertFalse(document.has("good"));
        assertTrue(document.path("ticket").path("sessions").has("s1"));
        assertFalse(document.path("ticket").path("sessions").has("s2"));
    }

    @Test
    void put_unreadableDocument_throwsStoreException() throws IOException {
        Path path = store.pathFor("g1");
        Files.createDirectories(path.getParent());
        Files.writeString(path, "[1, 2, 3]");

        assertThrows(PanelStoreException.class, () -> store.put("status", instance("m1"), "g1"));
        assertTrue(store.get("status", "g1").isEmpty());
    }

    @Test
    void read_unknownAccessMethod_fallsBackToDirect() throws IOException {
        Path path = store.pathFor(null);
        Files.createDirectories(path.getParent());
        Files.writeString(path, """
                { "sys": { "messageId": "m1", "channelId": "c1", "accessMethod": "carrier_pigeon" } }
                """);

        assertEquals(AccessMethod.DIRECT_COMMAND, store.get("sys", null).orElseThrow().getAccessMethod());
    }

    @Test
    void scopeDirName_sanitizesIds() {
        assertEquals("global", PanelInstanceStore.scopeDirName(" "));
        assertEquals("a_b", PanelInstanceStore.scopeDirName("a/b"));
        assertEquals("123", PanelInstanceStore.scopeDirName("123"));
    }
}
