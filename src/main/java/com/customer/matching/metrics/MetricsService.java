package com.customer.matching.metrics;

import com.customer.matching.health.HealthState;

import java.time.Duration;

/**
 * Interface for recording matching metrics.
 * Implementations can integrate with Micrometer, Prometheus, or other metrics systems.
 * The default {@link NoOpMetricsService} does nothing, so the library works
 * without any metrics dependencies on the classpath.
 */
public interface MetricsService {

    void recordResolveDuration(Duration duration, boolean degraded);

    void recordBatchSize(int size);

    void recordCacheHit(String store);

    void recordCacheMiss(String store);

    void recordRemoteCall(String operation, boolean success);

    void recordFallbackResults(int count);

    void recordSimilarityScore(double score);

    void recordHealthTransition(HealthState from, HealthState to);
}
