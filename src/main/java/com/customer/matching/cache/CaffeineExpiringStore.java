package com.customer.matching.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Predicate;

/**
 * Caffeine-backed {@link ExpiringStore}.
 *
 * <p>Entries expire {@link CacheConfig#ttl()} after their last write. Caffeine
 * hides expired entries from reads and removes them during its amortized
 * maintenance, so no sweeper thread is started. The store is also bounded by
 * {@link CacheConfig#maxSize()}; beyond that Caffeine evicts the entries least
 * likely to be used again.</p>
 *
 * <p>All mutations are whole-value replacements on a concurrent map, so the
 * store can be shared by concurrent callers without external locking.</p>
 */
public class CaffeineExpiringStore<V> implements ExpiringStore<V> {
    private static final Logger log = LoggerFactory.getLogger(CaffeineExpiringStore.class);

    private final String name;
    private final int maxSize;
    private final Cache<String, V> cache;

    public CaffeineExpiringStore(String name, CacheConfig config, Ticker ticker) {
        this.name = Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(config, "config is required");
        this.maxSize = config.maxSize();
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(config.ttl())
                .ticker(Objects.requireNonNull(ticker, "ticker is required"))
                // maintenance on the caller's thread; keeps eviction deterministic
                .executor(Runnable::run)
                .recordStats()
                .build();
        log.info("Expiring store '{}' initialized: maxSize={}, ttl={}", name, config.maxSize(), config.ttl());
    }

    @Override
    public Optional<V> get(String key) {
        if (key == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(cache.getIfPresent(key));
    }

    @Override
    public void set(String key, V value) {
        Objects.requireNonNull(key, "key is required");
        Objects.requireNonNull(value, "value is required");
        cache.put(key, value);
    }

    @Override
    public void delete(String key) {
        if (key != null) {
            cache.invalidate(key);
        }
    }

    @Override
    public int deleteMatching(Predicate<String> keyPredicate) {
        ConcurrentMap<String, V> view = cache.asMap();
        int removed = 0;
        for (String key : view.keySet()) {
            if (keyPredicate.test(key) && view.remove(key) != null) {
                removed++;
            }
        }
        log.debug("Store '{}' invalidated {} entries", name, removed);
        return removed;
    }

    @Override
    public void clear() {
        cache.invalidateAll();
        log.debug("Store '{}' cleared", name);
    }

    @Override
    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    @Override
    public CacheStats stats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats caffeineStats = cache.stats();
        return new CacheStats(
                caffeineStats.hitCount(),
                caffeineStats.missCount(),
                caffeineStats.evictionCount(),
                size(),
                maxSize
        );
    }

    public String getName() {
        return name;
    }
}
