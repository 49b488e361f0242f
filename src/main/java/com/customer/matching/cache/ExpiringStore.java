package com.customer.matching.cache;

import com.github.benmanes.caffeine.cache.Ticker;

import java.util.Optional;
import java.util.function.Predicate;

/**
 * Key/value store whose entries expire a fixed time after they were written.
 *
 * <p>Reads never throw: a missing or expired entry is reported as
 * {@link Optional#empty()}. Expired entries are dropped lazily when read;
 * there is no background sweep. Every write replaces the entry wholesale.</p>
 *
 * @param <V> value type
 */
public interface ExpiringStore<V> {

    /**
     * Returns the value stored under {@code key} if it has not yet expired.
     */
    Optional<V> get(String key);

    /**
     * Stores a value, overwriting any previous entry and stamping the current time.
     */
    void set(String key, V value);

    /**
     * Removes the entry for {@code key}, if any.
     */
    void delete(String key);

    /**
     * Removes every entry whose key matches the predicate.
     *
     * @return the number of entries removed
     */
    int deleteMatching(Predicate<String> keyPredicate);

    /**
     * Removes all entries.
     */
    void clear();

    /**
     * Returns the number of live entries. Diagnostic only.
     */
    long size();

    CacheStats stats();

    /**
     * Creates a store for the given configuration using the system ticker.
     */
    static <V> ExpiringStore<V> create(String name, CacheConfig config) {
        return create(name, config, Ticker.systemTicker());
    }

    /**
     * Creates a store for the given configuration and time source.
     * A disabled configuration yields a store that never retains anything.
     */
    static <V> ExpiringStore<V> create(String name, CacheConfig config, Ticker ticker) {
        if (!config.enabled()) {
            return new NoOpExpiringStore<>();
        }
        return new CaffeineExpiringStore<>(name, config, ticker);
    }
}
