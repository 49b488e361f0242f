package com.customer.matching.metrics;

import com.customer.matching.health.HealthState;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordResolveDuration(Duration duration, boolean degraded) {
    }

    @Override
    public void recordBatchSize(int size) {
    }

    @Override
    public void recordCacheHit(String store) {
    }

    @Override
    public void recordCacheMiss(String store) {
    }

    @Override
    public void recordRemoteCall(String operation, boolean success) {
    }

    @Override
    public void recordFallbackResults(int count) {
    }

    @Override
    public void recordSimilarityScore(double score) {
    }

    @Override
    public void recordHealthTransition(HealthState from, HealthState to) {
    }
}
