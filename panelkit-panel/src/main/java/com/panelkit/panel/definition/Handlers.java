package com.panelkit.panel.definition;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;

/**
 * Helpers for invoking panel handlers.
 */
public final class Handlers {

    private Handlers() {
    }

    /**
     * Run a handler so that thrown exceptions, failed futures and null futures all end up
     * as a {@link PanelResult}. A null result means the handler answered the interaction itself.
     */
    public static CompletableFuture<PanelResult> guard(Supplier<CompletableFuture<PanelResult>> call) {
        CompletableFuture<PanelResult> future;
        try {
            future = call.get();
        } catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }
        if (future == null) {
            future = CompletableFuture.completedFuture(null);
        }
        return future.handle((result, error) -> {
            if (error != null) {
                return PanelResult.failed(unwrap(error));
            }
            return result != null ? result : PanelResult.handledDirectly();
        });
    }

    /**
     * Strip the completion wrappers futures put around a failure.
     */
    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
