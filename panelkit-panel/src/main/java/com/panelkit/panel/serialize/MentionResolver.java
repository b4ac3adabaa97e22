package com.panelkit.panel.serialize;

import com.panelkit.panel.platform.ResolvedUser;
import com.panelkit.panel.platform.UserDirectory;
import com.panelkit.panel.response.PanelResponse;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Resolves user mentions in a response so the web mirror can show names instead of raw ids.
 * Lookups that fail fall back to a placeholder user.
 */
@Slf4j
public class MentionResolver {

    private final UserDirectory directory;

    public MentionResolver(UserDirectory directory) {
        this.directory = directory;
    }

    public CompletableFuture<Map<String, ResolvedUser>> resolve(PanelResponse response) {
        Set<String> ids = PanelSerializer.extractUserIds(response);
        if (ids.isEmpty() || directory == null) {
            return CompletableFuture.completedFuture(Map.of());
        }
        List<CompletableFuture<ResolvedUser>> lookups = ids.stream()
                .map(this::lookupOrPlaceholder)
                .toList();
        return CompletableFuture.allOf(lookups.toArray(CompletableFuture[]::new))
                .thenApply(done -> {
                    Map<String, ResolvedUser> resolved = new LinkedHashMap<>();
                    lookups.forEach(f -> {
                        ResolvedUser user = f.join();
                        resolved.put(user.id(), user);
                    });
                    return resolved;
                });
    }

    private CompletableFuture<ResolvedUser> lookupOrPlaceholder(String id) {
        CompletableFuture<ResolvedUser> lookup;
        try {
            lookup = directory.lookup(id);
        } catch (RuntimeException e) {
            lookup = CompletableFuture.failedFuture(e);
        }
        return lookup.handle((user, error) -> {
            if (error != null || user == null) {
                log.debug("Could not resolve user {}: {}", id, error != null ? error.getMessage() : "not found");
                return ResolvedUser.unknown(id);
            }
            return user;
        });
    }
}
