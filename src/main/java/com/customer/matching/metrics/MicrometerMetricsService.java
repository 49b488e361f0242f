package com.customer.matching.metrics;

import com.customer.matching.health.HealthState;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code matching.resolve.duration}: Timer (tag: degraded)</li>
 *   <li>{@code matching.batch.size}: DistributionSummary</li>
 *   <li>{@code matching.cache.hit} / {@code matching.cache.miss}: Counter (tag: store)</li>
 *   <li>{@code matching.remote.calls}: Counter (tags: operation, outcome)</li>
 *   <li>{@code matching.fallback.results}: Counter</li>
 *   <li>{@code matching.similarity.score}: DistributionSummary</li>
 *   <li>{@code matching.health.transitions}: Counter (tags: from, to)</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final DistributionSummary batchSizeSummary;
    private final DistributionSummary similarityScoreSummary;
    private final Counter fallbackCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.batchSizeSummary = DistributionSummary.builder("matching.batch.size")
                .description("Number of candidates per resolve call")
                .register(registry);
        this.similarityScoreSummary = DistributionSummary.builder("matching.similarity.score")
                .description("Distribution of returned match scores")
                .register(registry);
        this.fallbackCounter = Counter.builder("matching.fallback.results")
                .description("Number of match results estimated locally")
                .register(registry);
    }

    @Override
    public void recordResolveDuration(Duration duration, boolean degraded) {
        String key = "resolve:" + degraded;
        Timer timer = timerCache.computeIfAbsent(key, k ->
                Timer.builder("matching.resolve.duration")
                        .description("Duration of customer-employee resolve calls")
                        .tag("degraded", String.valueOf(degraded))
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void recordBatchSize(int size) {
        batchSizeSummary.record(size);
    }

    @Override
    public void recordCacheHit(String store) {
        counter("hit:" + store, "matching.cache.hit", "Number of cache hits", "store", store).increment();
    }

    @Override
    public void recordCacheMiss(String store) {
        counter("miss:" + store, "matching.cache.miss", "Number of cache misses", "store", store).increment();
    }

    @Override
    public void recordRemoteCall(String operation, boolean success) {
        String outcome = success ? "success" : "failure";
        String key = "remote:" + operation + ":" + outcome;
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("matching.remote.calls")
                        .description("Calls to the remote matching service")
                        .tag("operation", operation)
                        .tag("outcome", outcome)
                        .register(registry));
        counter.increment();
    }

    @Override
    public void recordFallbackResults(int count) {
        fallbackCounter.increment(count);
    }

    @Override
    public void recordSimilarityScore(double score) {
        if (!Double.isNaN(score)) {
            similarityScoreSummary.record(score);
        }
    }

    @Override
    public void recordHealthTransition(HealthState from, HealthState to) {
        String key = "health:" + from + ":" + to;
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("matching.health.transitions")
                        .description("Health gate state transitions")
                        .tag("from", from.name())
                        .tag("to", to.name())
                        .register(registry));
        counter.increment();
    }

    private Counter counter(String key, String name, String description, String tagKey, String tagValue) {
        return counterCache.computeIfAbsent(key, k ->
                Counter.builder(name)
                        .description(description)
                        .tag(tagKey, tagValue)
                        .register(registry));
    }
}
