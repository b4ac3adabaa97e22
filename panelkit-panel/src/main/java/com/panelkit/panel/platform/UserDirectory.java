package com.panelkit.panel.platform;

import java.util.concurrent.CompletableFuture;

/**
 * Looks up display data for user mentions shown on the web mirror.
 */
@FunctionalInterface
public interface UserDirectory {

    CompletableFuture<ResolvedUser> lookup(String userId);
}
