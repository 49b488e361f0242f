package com.customer.matching.api;

import com.customer.matching.cache.EntityKeyDeriver;
import com.customer.matching.cache.ExpiringStore;
import com.customer.matching.core.model.Customer;
import com.customer.matching.core.model.Employee;
import com.customer.matching.core.model.MatchResult;
import com.customer.matching.health.HealthCheckRegistry;
import com.customer.matching.health.HealthGate;
import com.customer.matching.health.HealthStatus;
import com.customer.matching.health.MatchCacheHealthCheck;
import com.customer.matching.health.MatchingServiceHealthCheck;
import com.customer.matching.logging.LogContext;
import com.customer.matching.metrics.MetricsService;
import com.customer.matching.metrics.NoOpMetricsService;
import com.customer.matching.remote.HttpSemanticMatchingClient;
import com.customer.matching.remote.SemanticMatchingClient;
import com.customer.matching.similarity.FallbackSimilarity;
import com.customer.matching.similarity.SimilarityScore;
import com.fasterxml.jackson.databind.JsonNode;
import com.github.benmanes.caffeine.cache.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

/**
 * Entry point for customer-to-employee matching.
 *
 * <p>Wires the remote client, the health gate, the pairwise and text-pair caches and the
 * local fallback together. Matching and similarity calls never fail because the remote
 * service is down; they degrade to local estimates instead.</p>
 *
 * Usage:
 * <pre>
 * CustomerMatchingService service = CustomerMatchingService.builder()
 *     .options(MatchingOptions.load())
 *     .build();
 * service.preloadModel();
 * List&lt;MatchResult&gt; ranked = service.matchCustomerToEmployees(customer, employees);
 * </pre>
 */
public class CustomerMatchingService {
    private static final Logger log = LoggerFactory.getLogger(CustomerMatchingService.class);

    static final String PAIR_STORE = BatchResolver.PAIR_STORE;
    static final String TEXT_STORE = "text";
    static final String TEXT_SEPARATOR = "|||";
    static final String SIMILARITY_OPERATION = "semantic-similarity";

    private final MatchingOptions options;
    private final SemanticMatchingClient client;
    private final MetricsService metrics;
    private final HealthGate gate;
    private final ExpiringStore<MatchResult> pairCache;
    private final ExpiringStore<SimilarityScore> similarityCache;
    private final FallbackSimilarity fallback;
    private final BatchResolver resolver;
    private final HealthCheckRegistry healthChecks;

    private CustomerMatchingService(Builder builder) {
        this.options = builder.options != null ? builder.options : MatchingOptions.defaults();
        this.client = builder.client != null
                ? builder.client
                : HttpSemanticMatchingClient.builder().baseUrl(options.getBaseUrl()).build();
        this.metrics = builder.metrics != null ? builder.metrics : new NoOpMetricsService();
        Ticker ticker = builder.ticker != null ? builder.ticker : Ticker.systemTicker();
        Executor executor = builder.executor != null ? builder.executor : ForkJoinPool.commonPool();
        this.fallback = builder.fallback != null ? builder.fallback : new FallbackSimilarity();

        this.gate = HealthGate.builder(client)
                .probeTimeout(options.getProbeTimeout())
                .reprobeInterval(options.getReprobeInterval())
                .ticker(ticker)
                .executor(executor)
                .metrics(metrics)
                .build();
        this.pairCache = ExpiringStore.create(PAIR_STORE, options.getPairCache(), ticker);
        this.similarityCache = ExpiringStore.create(TEXT_STORE, options.getSimilarityCache(), ticker);
        this.resolver = BatchResolver.builder()
                .pairCache(pairCache)
                .gate(gate)
                .client(client)
                .fallback(fallback)
                .metrics(metrics)
                .defaultDeadline(options.getRequestTimeout())
                .executor(executor)
                .build();

        this.healthChecks = new HealthCheckRegistry();
        healthChecks.register(new MatchingServiceHealthCheck(gate));
        healthChecks.register(new MatchCacheHealthCheck("pairCache", pairCache));
        healthChecks.register(new MatchCacheHealthCheck("similarityCache", similarityCache));

        log.info("Customer matching initialized against {}", client.getServiceName());
    }

    /**
     * Ranks employees for a customer, highest score first.
     */
    public List<MatchResult> matchCustomerToEmployees(Customer customer, List<Employee> employees) {
        return resolver.resolve(customer, employees);
    }

    public List<MatchResult> matchCustomerToEmployees(Customer customer, List<Employee> employees,
                                                      Duration deadline) {
        return resolver.resolve(customer, employees, deadline);
    }

    public CompletableFuture<List<MatchResult>> matchCustomerToEmployeesAsync(Customer customer,
                                                                              List<Employee> employees) {
        return resolver.resolveAsync(customer, employees);
    }

    /**
     * Similarity between two free texts. Served from the text-pair cache when possible,
     * otherwise from the remote service when it is usable, otherwise estimated locally.
     * Local estimates are not cached.
     */
    public SimilarityScore calculateSimilarity(String text1, String text2) {
        String key = String.valueOf(text1) + TEXT_SEPARATOR + text2;
        Optional<SimilarityScore> cached = similarityCache.get(key);
        if (cached.isPresent()) {
            metrics.recordCacheHit(TEXT_STORE);
            return cached.get();
        }
        metrics.recordCacheMiss(TEXT_STORE);

        gate.probeIfDue();
        if (gate.isUsable() && text1 != null && text2 != null) {
            try {
                SimilarityScore score = client.semanticSimilarity(text1, text2, options.getRequestTimeout());
                metrics.recordRemoteCall(SIMILARITY_OPERATION, true);
                similarityCache.set(key, score);
                return score;
            } catch (RuntimeException e) {
                metrics.recordRemoteCall(SIMILARITY_OPERATION, false);
                gate.reportFailure(e);
                log.warn("Semantic similarity call failed, estimating locally: {}", e.getMessage());
            }
        }
        metrics.recordFallbackResults(1);
        return fallback.similarity(text1, text2);
    }

    /**
     * Drops every cached pair involving the customer.
     *
     * @return the number of entries removed
     */
    public int invalidateCustomer(Customer customer) {
        String customerKey = EntityKeyDeriver.deriveKey(customer);
        int removed = pairCache.deleteMatching(key -> EntityKeyDeriver.isCustomerOf(key, customerKey));
        log.debug("Invalidated {} cached pairs for customer {}", removed, LogContext.loggableKey(customerKey));
        return removed;
    }

    /**
     * Drops every cached pair involving the employee.
     *
     * @return the number of entries removed
     */
    public int invalidateEmployee(Employee employee) {
        String employeeKey = EntityKeyDeriver.deriveKey(employee);
        int removed = pairCache.deleteMatching(key -> EntityKeyDeriver.isEmployeeOf(key, employeeKey));
        log.debug("Invalidated {} cached pairs for employee {}", removed, LogContext.loggableKey(employeeKey));
        return removed;
    }

    /**
     * Clears both local caches. The remote service's cache is left alone.
     */
    public void clearLocalCache() {
        pairCache.clear();
        similarityCache.clear();
        log.info("Local match caches cleared");
    }

    /**
     * Number of live entries across both local caches.
     */
    public long localCacheSize() {
        return pairCache.size() + similarityCache.size();
    }

    /**
     * Clears the remote service's cache, then the local caches.
     * Local caches are kept if the remote clear fails.
     *
     * @return the service's response, or empty if the call failed
     */
    public Optional<JsonNode> clearCache() {
        try {
            JsonNode response = client.clearCache(options.getRequestTimeout());
            metrics.recordRemoteCall("cache-clear", true);
            clearLocalCache();
            return Optional.ofNullable(response);
        } catch (RuntimeException e) {
            metrics.recordRemoteCall("cache-clear", false);
            log.warn("Could not clear matching service cache: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Fetches the remote service's cache statistics.
     *
     * @return the statistics, or empty if the call failed
     */
    public Optional<JsonNode> remoteCacheStats() {
        try {
            JsonNode stats = client.cacheStats(options.getRequestTimeout());
            metrics.recordRemoteCall("cache-stats", true);
            return Optional.ofNullable(stats);
        } catch (RuntimeException e) {
            metrics.recordRemoteCall("cache-stats", false);
            log.warn("Could not fetch matching service cache stats: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Aggregated health of the remote service and both local caches.
     */
    public HealthStatus healthCheck() {
        return healthChecks.checkAll();
    }

    /**
     * Fire-and-forget model warm-up. The future always completes normally.
     */
    public CompletableFuture<Void> preloadModel() {
        return gate.preload();
    }

    /**
     * Probes until the service is ready, using the configured attempts and interval.
     */
    public boolean awaitReady() {
        return gate.awaitReady(options.getReadyAttempts(), options.getReadyInterval());
    }

    public HealthGate getHealthGate() {
        return gate;
    }

    public MatchingOptions getOptions() {
        return options;
    }

    ExpiringStore<MatchResult> pairCache() {
        return pairCache;
    }

    ExpiringStore<SimilarityScore> similarityCache() {
        return similarityCache;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private MatchingOptions options;
        private SemanticMatchingClient client;
        private MetricsService metrics;
        private FallbackSimilarity fallback;
        private Ticker ticker;
        private Executor executor;

        public Builder options(MatchingOptions options) {
            this.options = Objects.requireNonNull(options, "options is required");
            return this;
        }

        /**
         * Overrides the HTTP client built from {@link MatchingOptions#getBaseUrl()}.
         */
        public Builder client(SemanticMatchingClient client) {
            this.client = client;
            return this;
        }

        public Builder metrics(MetricsService metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder fallback(FallbackSimilarity fallback) {
            this.fallback = fallback;
            return this;
        }

        public Builder ticker(Ticker ticker) {
            this.ticker = ticker;
            return this;
        }

        public Builder executor(Executor executor) {
            this.executor = executor;
            return this;
        }

        public CustomerMatchingService build() {
            return new CustomerMatchingService(this);
        }
    }
}
