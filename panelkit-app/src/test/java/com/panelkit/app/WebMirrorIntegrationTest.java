package com.panelkit.app;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.panelkit.app.panels.CounterPanel;
import com.panelkit.gateway.protocol.MirrorFrames;
import com.panelkit.gateway.websocket.WebSocketConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Drives the panel mirror socket end to end: token check, request/response frames
 * and live updates between two clients.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class WebMirrorIntegrationTest {

    private static final String TOKEN = "it-secret";

    @LocalServerPort
    private int port;

    private final ObjectMapper mapper = new ObjectMapper();
    private final List<WebSocketSession> sessions = new ArrayList<>();

    @DynamicPropertySource
    static void panelkitConfig(DynamicPropertyRegistry properties) throws IOException {
        Path config = AppTestSupport.writeConfig(Files.createTempDirectory("panelkit-mirror"), TOKEN);
        properties.add("panelkit.config.path", config::toString);
    }

    @AfterEach
    void disconnect() throws Exception {
        for (WebSocketSession session : sessions) {
            if (session.isOpen()) {
                session.close();
            }
        }
    }

    private static final class Client extends TextWebSocketHandler {
        final ArrayBlockingQueue<String> messages = new ArrayBlockingQueue<>(50);
        final CompletableFuture<CloseStatus> closed = new CompletableFuture<>();
        WebSocketSession session;

        @Override
        protected void handleTextMessage(WebSocketSession s, TextMessage message) {
            messages.add(message.getPayload());
        }

        @Override
        public void afterConnectionClosed(WebSocketSession s, CloseStatus status) {
            closed.complete(status);
        }
    }

    private Client connect(String query) throws Exception {
        Client client = new Client();
        URI uri = URI.create("ws://127.0.0.1:" + port + WebSocketConfig.PATH + query);
        client.session = new StandardWebSocketClient()
                .execute(client, new WebSocketHttpHeaders(), uri)
                .get(5, TimeUnit.SECONDS);
        sessions.add(client.session);
        return client;
    }

    private Client connectAuthenticated() throws Exception {
        Client client = connect("?token=" + TOKEN);
        JsonNode hello = await(client, frame -> "event".equals(frame.path("type").asText()));
        assertEquals(MirrorFrames.CONNECTED_EVENT, hello.get("event").asText());
        return client;
    }

    private JsonNode call(Client client, String id, String method, Map<String, Object> params) throws Exception {
        String frame = mapper.writeValueAsString(Map.of("type", "req", "id", id, "method", method, "params", params));
        client.session.sendMessage(new TextMessage(frame));
        return await(client, node -> "res".equals(node.path("type").asText()) && id.equals(node.path("id").asText()));
    }

    private JsonNode await(Client client, Predicate<JsonNode> match) throws Exception {
        long deadline = System.currentTimeMillis() + 5000;
        while (System.currentTimeMillis() < deadline) {
            String raw = client.messages.poll(100, TimeUnit.MILLISECONDS);
            if (raw == null) {
                continue;
            }
            JsonNode node = mapper.readTree(raw);
            if (match.test(node)) {
                return node;
            }
        }
        fail("No matching frame within 5s");
        return null;
    }

    private static String description(JsonNode document) {
        return document.get("embeds").get(0).get("description").asText();
    }

    @Test
    void connectWithoutToken_isRejected() throws Exception {
        Client client = connect("");

        CloseStatus status = client.closed.get(5, TimeUnit.SECONDS);

        assertEquals(CloseStatus.POLICY_VIOLATION.getCode(), status.getCode());
    }

    @Test
    void listAndOpen_overTheSocket() throws Exception {
        Client client = connectAuthenticated();

        JsonNode listing = call(client, "1", MirrorFrames.PANEL_LIST, Map.of());
        JsonNode opened = call(client, "2", MirrorFrames.PANEL_OPEN,
                Map.of("panelId", CounterPanel.ID, "guildId", "g-open"));

        assertTrue(listing.get("ok").asBoolean());
        boolean listed = false;
        for (JsonNode entry : listing.get("payload")) {
            listed |= CounterPanel.ID.equals(entry.get("id").asText());
        }
        assertTrue(listed, "counter should be listed");
        assertTrue(opened.get("payload").get("success").asBoolean());
        assertEquals("Current value: **0**", description(opened.get("payload").get("data")));
    }

    @Test
    void buttonClick_updatesSubscribedViewer() throws Exception {
        Client clicker = connectAuthenticated();
        Client viewer = connectAuthenticated();
        JsonNode subscribed = call(viewer, "s", MirrorFrames.PANEL_SUBSCRIBE,
                Map.of("panelId", CounterPanel.ID, "guildId", "g-live"));
        assertTrue(subscribed.get("payload").get("subscribed").asBoolean());

        JsonNode clicked = call(clicker, "b", MirrorFrames.PANEL_BUTTON, Map.of(
                "panelId", CounterPanel.ID,
                "buttonId", "panel_counter_btn_increment",
                "guildId", "g-live"));

        assertEquals("Current value: **1**", description(clicked.get("payload").get("data")));
        JsonNode update = await(viewer, frame -> MirrorFrames.LIVE_UPDATE_EVENT.equals(frame.path("event").asText()));
        assertEquals(CounterPanel.ID, update.get("payload").get("panelId").asText());
        assertEquals("g-live", update.get("payload").get("guildId").asText());
        assertEquals("Current value: **1**", description(update.get("payload").get("response")));
    }

    @Test
    void unknownMethod_reportsNotFound() throws Exception {
        Client client = connectAuthenticated();

        JsonNode res = call(client, "x", "panel.explode", Map.of());

        assertFalse(res.get("ok").asBoolean());
        assertEquals(MirrorFrames.ErrorCodes.NOT_FOUND, res.get("error").get("code").asText());
    }
}
