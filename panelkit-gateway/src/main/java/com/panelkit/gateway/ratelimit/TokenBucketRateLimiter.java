package com.panelkit.gateway.ratelimit;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.panelkit.common.config.PanelKitConfig;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.function.LongSupplier;

/**
 * Per-key token bucket. Each key starts full; one token comes back every
 * {@code refillRateMs} up to {@code bucketCapacity}. Buckets idle longer than
 * {@code cleanupAgeMs} are dropped.
 */
@Slf4j
public class TokenBucketRateLimiter {

    private final int capacity;
    private final long refillRateMs;
    private final LongSupplier clock;
    private final Cache<String, Bucket> buckets;

    public TokenBucketRateLimiter(PanelKitConfig.RateLimitConfig config) {
        this(config, System::currentTimeMillis);
    }

    public TokenBucketRateLimiter(PanelKitConfig.RateLimitConfig config, LongSupplier clock) {
        this.capacity = Math.max(1, config.getBucketCapacity());
        this.refillRateMs = Math.max(1, config.getRefillRateMs());
        this.clock = clock;
        this.buckets = Caffeine.newBuilder()
                .expireAfterAccess(Duration.ofMillis(Math.max(1, config.getCleanupAgeMs())))
                .ticker(() -> clock.getAsLong() * 1_000_000L)
                .build();
    }

    /**
     * Take one token for {@code key}.
     *
     * @return false when the bucket is empty
     */
    public boolean tryConsume(String key) {
        long now = clock.getAsLong();
        Bucket bucket = buckets.get(key, k -> new Bucket(capacity, now));
        boolean allowed = bucket.tryConsume(now, capacity, refillRateMs);
        if (!allowed) {
            log.warn("Rate limit exceeded for {}", key);
        }
        return allowed;
    }

    public int trackedKeys() {
        buckets.cleanUp();
        return (int) buckets.estimatedSize();
    }

    private static final class Bucket {
        private int tokens;
        private long lastRefill;

        Bucket(int tokens, long lastRefill) {
            this.tokens = tokens;
            this.lastRefill = lastRefill;
        }

        synchronized boolean tryConsume(long now, int capacity, long refillRateMs) {
            long elapsed = now - lastRefill;
            long refill = elapsed / refillRateMs;
            if (refill > 0) {
                tokens = (int) Math.min(capacity, tokens + refill);
                // keep the partial interval
                lastRefill = now - (elapsed % refillRateMs);
            }
            if (tokens > 0) {
                tokens--;
                return true;
            }
            return false;
        }
    }
}
