package com.customer.matching.cache;

import java.time.Duration;
import java.util.Objects;

/**
 * Configuration for an expiring store.
 *
 * @param maxSize maximum number of entries before size-based eviction
 * @param ttl     time-to-live of each entry, measured from its last write
 * @param enabled whether caching is enabled
 */
public record CacheConfig(int maxSize, Duration ttl, boolean enabled) {

    public CacheConfig {
        Objects.requireNonNull(ttl, "ttl is required");
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        if (ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be > 0");
        }
    }

    /**
     * Default configuration: 10,000 entries, 5 minute TTL, enabled.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(10_000, Duration.ofMinutes(5), true);
    }

    /**
     * Disabled configuration.
     */
    public static CacheConfig disabled() {
        return new CacheConfig(1, Duration.ofSeconds(1), false);
    }

    public CacheConfig withTtl(Duration ttl) {
        return new CacheConfig(maxSize, ttl, enabled);
    }

    public CacheConfig withMaxSize(int maxSize) {
        return new CacheConfig(maxSize, ttl, enabled);
    }
}
