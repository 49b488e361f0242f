package com.customer.matching.cache;

/**
 * Point-in-time statistics of an expiring store.
 *
 * @param hitCount      number of reads that found a fresh entry
 * @param missCount     number of reads that found nothing or an expired entry
 * @param evictionCount number of entries dropped by expiry or size bound
 * @param size          current number of entries
 * @param maxSize       configured capacity
 */
public record CacheStats(long hitCount, long missCount, long evictionCount, long size, long maxSize) {

    /**
     * Returns the hit rate (0.0 to 1.0).
     */
    public double hitRate() {
        long total = hitCount + missCount;
        return total == 0 ? 0.0 : (double) hitCount / total;
    }

    /**
     * Returns the fraction of capacity in use (0.0 to 1.0).
     */
    public double utilization() {
        return maxSize <= 0 ? 0.0 : Math.min(1.0, (double) size / maxSize);
    }

    public static CacheStats empty() {
        return new CacheStats(0, 0, 0, 0, 0);
    }
}
