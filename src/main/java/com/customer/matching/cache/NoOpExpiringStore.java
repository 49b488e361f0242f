package com.customer.matching.cache;

import java.util.Optional;
import java.util.function.Predicate;

/**
 * Store that retains nothing. Used when caching is disabled.
 */
public class NoOpExpiringStore<V> implements ExpiringStore<V> {

    @Override
    public Optional<V> get(String key) {
        return Optional.empty();
    }

    @Override
    public void set(String key, V value) {
        // no-op
    }

    @Override
    public void delete(String key) {
        // no-op
    }

    @Override
    public int deleteMatching(Predicate<String> keyPredicate) {
        return 0;
    }

    @Override
    public void clear() {
        // no-op
    }

    @Override
    public long size() {
        return 0;
    }

    @Override
    public CacheStats stats() {
        return CacheStats.empty();
    }
}
