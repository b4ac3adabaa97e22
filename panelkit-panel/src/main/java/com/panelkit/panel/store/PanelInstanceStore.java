package com.panelkit.panel.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.panelkit.common.infra.JsonFile;
import com.panelkit.panel.model.PanelInstance;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.LongSupplier;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;
import java.util.stream.Stream;

/**
 * Durable record store for persistent panels, one JSON document per scope.
 *
 * <p>Document shape:
 * <pre>
 * {
 *   "status_board": { "messageId": "...", "channelId": "...", ... },
 *   "ticket_view":  { "sessions": { "s1": { ... }, "s2": { ... } } }
 * }
 * </pre>
 *
 * Every mutation reads the whole document, changes it and writes it back via
 * temp file + atomic rename. A per-scope lock serializes these cycles inside
 * the process; writers in other processes still race last-writer-wins.
 */
@Slf4j
public class PanelInstanceStore {

    public static final String FILE_NAME = "persistent-panels.json";
    public static final String GLOBAL_DIR = "global";
    private static final String SESSIONS = "sessions";

    private final Path dataDir;
    private final LongSupplier clock;
    private final ObjectMapper mapper = JsonFile.mapper();
    private final Map<String, ReentrantLock> scopeLocks = new ConcurrentHashMap<>();

    public PanelInstanceStore(Path dataDir) {
        this(dataDir, System::currentTimeMillis);
    }

    public PanelInstanceStore(Path dataDir, LongSupplier clock) {
        this.dataDir = dataDir;
        this.clock = clock;
    }

    /**
     * Document path for a scope: {@code <dataDir>/global/...} or {@code <dataDir>/<guildId>/...}.
     */
    public Path pathFor(String scopeId) {
        return dataDir.resolve(scopeDirName(scopeId)).resolve(FILE_NAME);
    }

    public Optional<PanelInstance> get(String panelId, String scopeId, String sessionId) {
        ObjectNode document = readForQuery(scopeId);
        JsonNode entry = document.get(panelId);
        if (entry == null || !entry.isObject()) {
            return Optional.empty();
        }
        if (sessionId != null) {
            JsonNode session = entry.path(SESSIONS).get(sessionId);
            return session != null && session.isObject() ? Optional.of(toInstance(session)) : Optional.empty();
        }
        if (entry.hasNonNull("messageId")) {
            return Optional.of(toInstance(entry));
        }
        return Optional.empty();
    }

    public Optional<PanelInstance> get(String panelId, String scopeId) {
        return get(panelId, scopeId, null);
    }

    /**
     * Store an instance. With a session id the instance joins the panel's session
     * collection. Without one it overwrites the single record, and when
     * {@code maxInstances == 1} the overwritten record is handed back for retirement.
     */
    public StoreResult put(String panelId, PanelInstance instance, String scopeId, String sessionId, int maxInstances) {
        return mutate(scopeId, document -> {
            PanelInstance stamped = instance.toBuilder().lastUpdated(clock.getAsLong()).build();
            if (sessionId != null) {
                JsonNode entry = document.get(panelId);
                ObjectNode sessions;
                if (entry != null && entry.get(SESSIONS) instanceof ObjectNode s) {
                    sessions = s;
                } else {
                    sessions = document.putObject(panelId).putObject(SESSIONS);
                }
                sessions.set(sessionId, mapper.valueToTree(stamped));
                return StoreResult.none();
            }
            PanelInstance replaced = null;
            JsonNode existing = document.get(panelId);
            if (maxInstances == 1 && existing != null && existing.hasNonNull("messageId")) {
                replaced = toInstance(existing);
            }
            document.set(panelId, mapper.valueToTree(stamped));
            return new StoreResult(replaced);
        });
    }

    public StoreResult put(String panelId, PanelInstance instance, String scopeId) {
        return put(panelId, instance, scopeId, null, 1);
    }

    /**
     * Set the state tag and shallow-merge {@code extraSessionData} into the stored session data.
     *
     * @return false if no such record exists
     */
    public boolean updateState(String panelId, String state, ObjectNode extraSessionData,
            String scopeId, String sessionId) {
        return mutate(scopeId, document -> {
            ObjectNode record = locate(document, panelId, sessionId);
            if (record == null) {
                return false;
            }
            record.put("state", state);
            record.put("lastUpdated", clock.getAsLong());
            if (extraSessionData != null) {
                JsonNode current = record.get("sessionData");
                ObjectNode merged = current instanceof ObjectNode obj ? obj : record.putObject("sessionData");
                merged.setAll(extraSessionData);
                record.set("sessionData", merged);
            }
            return true;
        });
    }

    public boolean updateState(String panelId, String state, String scopeId, String sessionId) {
        return updateState(panelId, state, null, scopeId, sessionId);
    }

    /**
     * Apply {@code change} to a record only while it still points at {@code messageId}.
     *
     * @return false if the record is gone or now belongs to another message
     */
    public boolean updateIfCurrent(String panelId, String messageId, String scopeId, String sessionId,
            UnaryOperator<PanelInstance> change) {
        return mutate(scopeId, document -> {
            ObjectNode record = locate(document, panelId, sessionId);
            if (record == null || !messageId.equals(record.path("messageId").asText(null))) {
                return false;
            }
            PanelInstance updated = change.apply(toInstance(record)).toBuilder()
                    .lastUpdated(clock.getAsLong())
                    .build();
            ObjectNode replacement = mapper.valueToTree(updated);
            record.removeAll();
            record.setAll(replacement);
            return true;
        });
    }

    /**
     * Remove a record only while it still points at {@code messageId}.
     */
    public boolean removeIfCurrent(String panelId, String messageId, String scopeId, String sessionId) {
        return removeIf(scopeId, stored -> stored.panelId().equals(panelId)
                && Objects.equals(stored.sessionId(), sessionId)
                && messageId.equals(stored.instance().getMessageId())) > 0;
    }

    /**
     * Remove a record. Removing the last session removes the panel entry.
     */
    public boolean remove(String panelId, String scopeId, String sessionId) {
        return mutate(scopeId, document -> {
            if (sessionId != null) {
                JsonNode entry = document.get(panelId);
                if (entry != null && entry.get(SESSIONS) instanceof ObjectNode sessions
                        && sessions.has(sessionId)) {
                    sessions.remove(sessionId);
                    if (sessions.isEmpty()) {
                        document.remove(panelId);
                    }
                    return true;
                }
                return false;
            }
            return document.remove(panelId) != null;
        });
    }

    public boolean remove(String panelId, String scopeId) {
        return remove(panelId, scopeId, null);
    }

    /**
     * True when the single-instance record for the panel points at {@code messageId}.
     */
    public boolean isActiveInstance(String panelId, String messageId, String scopeId, String sessionId) {
        return get(panelId, scopeId, sessionId)
                .map(instance -> instance.getMessageId() != null && instance.getMessageId().equals(messageId))
                .orElse(false);
    }

    /**
     * Every record in a scope, sessions flattened.
     */
    public List<StoredPanel> list(String scopeId) {
        ObjectNode document = readForQuery(scopeId);
        List<StoredPanel> result = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = document.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode entry = field.getValue();
            if (entry.get(SESSIONS) instanceof ObjectNode sessions) {
                sessions.fields().forEachRemaining(session ->
                        addIfReadable(result, field.getKey(), scopeId, session.getKey(), session.getValue()));
            } else if (entry.hasNonNull("messageId")) {
                addIfReadable(result, field.getKey(), scopeId, null, entry);
            }
        }
        return result;
    }

    private void addIfReadable(List<StoredPanel> result, String panelId, String scopeId,
            String sessionId, JsonNode node) {
        readable(panelId, scopeId, sessionId, node).ifPresent(result::add);
    }

    /**
     * Empty for a record that no longer maps onto {@link PanelInstance}; such records are
     * left in the document untouched.
     */
    private Optional<StoredPanel> readable(String panelId, String scopeId, String sessionId, JsonNode node) {
        try {
            return Optional.of(new StoredPanel(panelId, scopeId, sessionId, toInstance(node)));
        } catch (PanelStoreException e) {
            log.warn("Skipping malformed panel record {} in scope {}: {}",
                    panelId, scopeId == null ? GLOBAL_DIR : scopeId, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Known scopes: {@code null} for global first, then one per guild directory that holds a document.
     */
    public List<String> listScopes() {
        List<String> scopes = new ArrayList<>();
        scopes.add(null);
        if (!Files.isDirectory(dataDir)) {
            return scopes;
        }
        try (Stream<Path> dirs = Files.list(dataDir)) {
            dirs.filter(Files::isDirectory)
                    .filter(dir -> !GLOBAL_DIR.equals(dir.getFileName().toString()))
                    .filter(dir -> Files.exists(dir.resolve(FILE_NAME)))
                    .map(dir -> dir.getFileName().toString())
                    .sorted()
                    .forEach(scopes::add);
        } catch (IOException e) {
            log.error("Failed to list panel scopes under {}: {}", dataDir, e.getMessage(), e);
        }
        return scopes;
    }

    /**
     * Drop session records idle longer than {@code maxIdleMs}. Single-instance records are kept.
     *
     * @return number of sessions removed
     */
    public int cleanupExpired(String scopeId, long maxIdleMs) {
        long now = clock.getAsLong();
        return removeSessionsIf(scopeId, instance -> now - instance.getLastUpdated() > maxIdleMs);
    }

    /**
     * Remove every record (single or session) matching the predicate. Malformed records
     * are never offered to the predicate.
     *
     * @return number of records removed
     */
    public int removeIf(String scopeId, Predicate<StoredPanel> predicate) {
        return mutate(scopeId, document -> {
            int removed = 0;
            Iterator<Map.Entry<String, JsonNode>> fields = document.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                JsonNode entry = field.getValue();
                if (entry.get(SESSIONS) instanceof ObjectNode sessions) {
                    Iterator<Map.Entry<String, JsonNode>> it = sessions.fields();
                    while (it.hasNext()) {
                        Map.Entry<String, JsonNode> session = it.next();
                        Optional<StoredPanel> stored = readable(field.getKey(), scopeId, session.getKey(),
                                session.getValue());
                        if (stored.isPresent() && predicate.test(stored.get())) {
                            it.remove();
                            removed++;
                        }
                    }
                    if (sessions.isEmpty()) {
                        fields.remove();
                    }
                } else if (entry.hasNonNull("messageId")) {
                    Optional<StoredPanel> stored = readable(field.getKey(), scopeId, null, entry);
                    if (stored.isPresent() && predicate.test(stored.get())) {
                        fields.remove();
                        removed++;
                    }
                }
            }
            return removed;
        });
    }

    private int removeSessionsIf(String scopeId, Predicate<PanelInstance> predicate) {
        return removeIf(scopeId, stored -> stored.sessionId() != null && predicate.test(stored.instance()));
    }

    private ObjectNode locate(ObjectNode document, String panelId, String sessionId) {
        JsonNode entry = document.get(panelId);
        if (entry == null) {
            return null;
        }
        if (sessionId != null) {
            return entry.path(SESSIONS).get(sessionId) instanceof ObjectNode session ? session : null;
        }
        return entry instanceof ObjectNode obj && obj.hasNonNull("messageId") ? obj : null;
    }

    private <T> T mutate(String scopeId, Function<ObjectNode, T> change) {
        Path path = pathFor(scopeId);
        ReentrantLock lock = scopeLocks.computeIfAbsent(path.toString(), k -> new ReentrantLock());
        lock.lock();
        try {
            ObjectNode document;
            try {
                document = JsonFile.readObject(path);
            } catch (IOException e) {
                throw new PanelStoreException("Unreadable panel document " + path, e);
            }
            String before = document.toString();
            T result = change.apply(document);
            if (!before.equals(document.toString())) {
                try {
                    JsonFile.writeAtomic(path, document);
                } catch (IOException e) {
                    log.error("Failed to write panel document {}: {}", path, e.getMessage(), e);
                    throw new PanelStoreException("Failed to write panel document " + path, e);
                }
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    private ObjectNode readForQuery(String scopeId) {
        Path path = pathFor(scopeId);
        try {
            return JsonFile.readObject(path);
        } catch (IOException e) {
            log.error("Failed to read panel document {}: {}", path, e.getMessage(), e);
            return mapper.createObjectNode();
        }
    }

    private PanelInstance toInstance(JsonNode node) {
        try {
            return mapper.treeToValue(node, PanelInstance.class);
        } catch (JsonProcessingException e) {
            throw new PanelStoreException("Malformed panel record: " + e.getOriginalMessage(), e);
        }
    }

    static String scopeDirName(String scopeId) {
        if (scopeId == null || scopeId.isBlank()) {
            return GLOBAL_DIR;
        }
        return scopeId.trim().replaceAll("[^a-zA-Z0-9_-]+", "_");
    }
}
