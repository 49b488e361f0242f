package com.customer.matching.health;

import com.customer.matching.cache.CacheStats;
import com.customer.matching.cache.ExpiringStore;

import java.util.Objects;

/**
 * Reports utilization of a local match cache.
 * A full cache is DEGRADED: it still works, but evicts entries that may be needed again.
 */
public class MatchCacheHealthCheck implements HealthCheck {

    private static final double DEGRADED_THRESHOLD = 1.0;

    private final String name;
    private final ExpiringStore<?> store;

    public MatchCacheHealthCheck(String name, ExpiringStore<?> store) {
        this.name = Objects.requireNonNull(name, "name is required");
        this.store = Objects.requireNonNull(store, "store is required");
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public HealthStatus check() {
        try {
            CacheStats stats = store.stats();
            HealthStatus base = stats.maxSize() > 0 && stats.utilization() >= DEGRADED_THRESHOLD
                    ? HealthStatus.degraded("Cache at capacity: " + stats.size() + " entries")
                    : HealthStatus.up();
            return base
                    .withDetail("size", stats.size())
                    .withDetail("maxSize", stats.maxSize())
                    .withDetail("hitRate", Math.round(stats.hitRate() * 1000.0) / 1000.0)
                    .withDetail("evictions", stats.evictionCount());
        } catch (RuntimeException e) {
            return HealthStatus.down("Cache check failed: " + e.getMessage());
        }
    }
}
