package com.panelkit.panel.testing;

import com.panelkit.panel.platform.InteractionType;
import com.panelkit.panel.platform.PanelInteraction;
import com.panelkit.panel.platform.PlatformMessage;
import com.panelkit.panel.response.Modal;
import com.panelkit.panel.response.PanelResponse;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Records every acknowledgment call in order. Edits and deletes of the reply
 * act on the backing message when there is one, as they do on the platform.
 */
public class FakeInteraction implements PanelInteraction {

    private final InteractionType type;
    private final String customId;
    private final String userId;
    private final String guildId;
    private final String channelId;
    private final FakePlatform.FakeMessage message;
    private List<String> values = List.of();
    private Map<String, String> fields = Map.of();

    public final List<String> calls = new CopyOnWriteArrayList<>();
    public final List<PanelResponse> replies = new CopyOnWriteArrayList<>();
    public final List<PanelResponse> edits = new CopyOnWriteArrayList<>();
    public final List<PanelResponse> followUps = new CopyOnWriteArrayList<>();
    public volatile Modal shownModal;
    private volatile boolean acknowledged;

    public FakeInteraction(InteractionType type, String customId, String userId, String guildId,
            String channelId, FakePlatform.FakeMessage message) {
        this.type = type;
        this.customId = customId;
        this.userId = userId;
        this.guildId = guildId;
        this.channelId = channelId;
        this.message = message;
    }

    public static FakeInteraction button(String customId, FakePlatform.FakeMessage message) {
        return new FakeInteraction(InteractionType.BUTTON, customId, "user-1", "guild-1",
                message != null ? message.channelId() : "chan-1", message);
    }

    public FakeInteraction withValues(List<String> values) {
        this.values = values;
        return this;
    }

    public FakeInteraction withFields(Map<String, String> fields) {
        this.fields = fields;
        return this;
    }

    @Override
    public InteractionType type() {
        return type;
    }

    @Override
    public String customId() {
        return customId;
    }

    @Override
    public String userId() {
        return userId;
    }

    @Override
    public String guildId() {
        return guildId;
    }

    @Override
    public String channelId() {
        return channelId;
    }

    @Override
    public Optional<PlatformMessage> message() {
        return Optional.ofNullable(message);
    }

    @Override
    public List<String> values() {
        return values;
    }

    @Override
    public Map<String, String> fields() {
        return fields;
    }

    @Override
    public boolean isAcknowledged() {
        return acknowledged;
    }

    @Override
    public CompletableFuture<Void> reply(PanelResponse response) {
        calls.add("reply");
        acknowledged = true;
        replies.add(response);
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> update(PanelResponse response) {
        calls.add("update");
        acknowledged = true;
        replies.add(response);
        return message != null ? message.edit(response) : CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> showModal(Modal modal) {
        calls.add("showModal");
        acknowledged = true;
        shownModal = modal;
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> deferUpdate() {
        calls.add("deferUpdate");
        acknowledged = true;
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> editReply(PanelResponse response) {
        calls.add("editReply");
        edits.add(response);
        return message != null ? message.edit(response) : CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> followUp(PanelResponse response) {
        calls.add("followUp");
        followUps.add(response);
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> deleteReply() {
        calls.add("deleteReply");
        return message != null && !message.isDeleted()
                ? message.delete()
                : CompletableFuture.completedFuture(null);
    }
}
