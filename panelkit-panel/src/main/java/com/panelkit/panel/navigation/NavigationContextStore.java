package com.panelkit.panel.navigation;

import com.fasterxml.jackson.databind.JsonNode;
import com.panelkit.panel.model.AccessMethod;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.LongSupplier;

/**
 * Process-local map from rendered message id to {@link NavigationContext}.
 *
 * <p>Entries are evicted by a periodic sweep once {@code now - timestamp > ttl}.
 * Reads never refresh an entry and never evict it, so a read may return an
 * expired entry the sweep has not reached yet. Writes reset the timestamp.
 */
@Slf4j
public class NavigationContextStore implements AutoCloseable {

    public static final long DEFAULT_TTL_MS = 30L * 60 * 1000;
    public static final long DEFAULT_SWEEP_INTERVAL_MS = 5L * 60 * 1000;

    private final Map<String, NavigationContext> contexts = new ConcurrentHashMap<>();
    private final long ttlMs;
    private final long sweepIntervalMs;
    private final LongSupplier clock;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> sweepTask;

    public NavigationContextStore() {
        this(DEFAULT_TTL_MS, DEFAULT_SWEEP_INTERVAL_MS, System::currentTimeMillis);
    }

    public NavigationContextStore(long ttlMs, long sweepIntervalMs, LongSupplier clock) {
        this.ttlMs = ttlMs;
        this.sweepIntervalMs = Math.max(1000, sweepIntervalMs);
        this.clock = clock;
    }

    public void put(String handle, List<String> navigationStack, AccessMethod accessMethod,
            String sourceCategory, JsonNode panelState) {
        contexts.put(handle, new NavigationContext(
                navigationStack, accessMethod, sourceCategory, panelState, clock.getAsLong()));
    }

    public void put(String handle, List<String> navigationStack, AccessMethod accessMethod) {
        put(handle, navigationStack, accessMethod, null, null);
    }

    public Optional<NavigationContext> get(String handle) {
        if (handle == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(contexts.get(handle));
    }

    /**
     * Replace only the panel state. Creates a minimal direct-access entry if none exists.
     */
    public void updateState(String handle, JsonNode panelState) {
        long now = clock.getAsLong();
        contexts.compute(handle, (key, existing) -> existing != null
                ? existing.withPanelState(panelState, now)
                : new NavigationContext(List.of(), AccessMethod.DIRECT_COMMAND, null, panelState, now));
    }

    public void remove(String handle) {
        contexts.remove(handle);
    }

    public int size() {
        return contexts.size();
    }

    /**
     * Evict every entry older than the TTL.
     *
     * @return number of evicted entries
     */
    public int sweep() {
        long now = clock.getAsLong();
        int before = contexts.size();
        contexts.entrySet().removeIf(entry -> now - entry.getValue().timestamp() > ttlMs);
        int evicted = before - contexts.size();
        if (evicted > 0) {
            log.debug("Evicted {} navigation contexts", evicted);
        }
        return Math.max(evicted, 0);
    }

    public synchronized void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "navigation-sweep");
            t.setDaemon(true);
            return t;
        });
        sweepTask = scheduler.scheduleAtFixedRate(this::sweepSafely,
                sweepIntervalMs, sweepIntervalMs, TimeUnit.MILLISECONDS);
        log.info("Navigation context sweep started (ttl: {}ms, interval: {}ms)", ttlMs, sweepIntervalMs);
    }

    public boolean isRunning() {
        return running.get();
    }

    private void sweepSafely() {
        try {
            sweep();
        } catch (RuntimeException e) {
            log.error("Navigation context sweep failed: {}", e.getMessage(), e);
        }
    }

    @Override
    public synchronized void close() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        sweepTask.cancel(false);
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            scheduler.shutdownNow();
        }
        log.info("Navigation context sweep stopped");
    }
}
