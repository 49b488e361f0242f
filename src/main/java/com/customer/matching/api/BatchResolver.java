package com.customer.matching.api;

import com.customer.matching.cache.EntityKeyDeriver;
import com.customer.matching.cache.ExpiringStore;
import com.customer.matching.core.model.Customer;
import com.customer.matching.core.model.Employee;
import com.customer.matching.core.model.MatchResult;
import com.customer.matching.core.model.MatchSource;
import com.customer.matching.health.HealthGate;
import com.customer.matching.logging.LogContext;
import com.customer.matching.metrics.MetricsService;
import com.customer.matching.metrics.NoOpMetricsService;
import com.customer.matching.remote.RemoteMatch;
import com.customer.matching.remote.SemanticMatchingClient;
import com.customer.matching.similarity.FallbackSimilarity;
import com.customer.matching.similarity.ProfileText;
import com.customer.matching.similarity.SimilarityScore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

/**
 * Ranks candidate employees for one customer.
 *
 * <p>Resolution steps:</p>
 * <ol>
 *   <li>Look every (customer, employee) pair up in the pairwise cache.</li>
 *   <li>Send only the uncached pairs to the remote matcher, in one call, if the
 *       {@link HealthGate} reports it usable. Fresh remote results are cached.</li>
 *   <li>Estimate pairs locally with {@link FallbackSimilarity} when the remote matcher is
 *       not usable, the call fails, or the response omits a pair. Estimates are not cached,
 *       so a recovered service is used again as soon as it is back.</li>
 *   <li>Merge and sort by score, highest first; missing scores last; ties keep input order.</li>
 * </ol>
 *
 * <p>{@link #resolve} never throws. Failures only lower the quality of the results,
 * which is visible through {@link MatchResult#source()} and {@link MatchResult#confidence()}.</p>
 */
public class BatchResolver {
    private static final Logger log = LoggerFactory.getLogger(BatchResolver.class);

    static final String PAIR_STORE = "pair";
    static final String MATCH_OPERATION = "customer-employee-match";

    /**
     * Highest score first; results without a score last.
     * Used with a stable sort, so equal scores keep their input order.
     */
    static final Comparator<MatchResult> BY_SCORE_DESC = (a, b) -> {
        if (!a.hasScore() || !b.hasScore()) {
            return Boolean.compare(!a.hasScore(), !b.hasScore());
        }
        return Double.compare(b.score(), a.score());
    };

    private final ExpiringStore<MatchResult> pairCache;
    private final HealthGate gate;
    private final SemanticMatchingClient client;
    private final FallbackSimilarity fallback;
    private final MetricsService metrics;
    private final Duration defaultDeadline;
    private final Executor executor;

    private BatchResolver(Builder builder) {
        this.pairCache = Objects.requireNonNull(builder.pairCache, "pairCache is required");
        this.gate = Objects.requireNonNull(builder.gate, "gate is required");
        this.client = Objects.requireNonNull(builder.client, "client is required");
        this.fallback = builder.fallback != null ? builder.fallback : new FallbackSimilarity();
        this.metrics = builder.metrics != null ? builder.metrics : new NoOpMetricsService();
        this.defaultDeadline = builder.defaultDeadline != null ? builder.defaultDeadline : Duration.ofSeconds(30);
        this.executor = builder.executor != null ? builder.executor : ForkJoinPool.commonPool();
    }

    /**
     * Ranks the candidates for a customer using the default deadline.
     */
    public List<MatchResult> resolve(Customer customer, List<Employee> candidates) {
        return resolve(customer, candidates, defaultDeadline);
    }

    /**
     * Ranks the candidates for a customer.
     *
     * @param deadline time budget for the remote call; cache and fallback work always completes.
     *                 A zero or negative deadline skips the remote call.
     * @return one result per non-null candidate, highest score first
     */
    public List<MatchResult> resolve(Customer customer, List<Employee> candidates, Duration deadline) {
        if (candidates == null || candidates.isEmpty()) {
            return List.of();
        }
        long startNanos = System.nanoTime();
        String customerKey = EntityKeyDeriver.deriveKey(customer);

        try (LogContext ctx = LogContext.forResolve(LogContext.generateCorrelationId(),
                LogContext.loggableKey(customerKey))) {
            List<Employee> employees = new ArrayList<>(candidates.size());
            for (Employee candidate : candidates) {
                if (candidate != null) {
                    employees.add(candidate);
                }
            }
            metrics.recordBatchSize(employees.size());

            int n = employees.size();
            MatchResult[] results = new MatchResult[n];
            String[] employeeKeys = new String[n];
            List<Integer> misses = new ArrayList<>();

            for (int i = 0; i < n; i++) {
                Employee employee = employees.get(i);
                employeeKeys[i] = EntityKeyDeriver.deriveKey(employee);
                String pairKey = customerKey + pairSeparator() + employeeKeys[i];
                MatchResult cached = pairCache.get(pairKey).orElse(null);
                if (cached != null) {
                    results[i] = cached.fromCache(employee);
                    metrics.recordCacheHit(PAIR_STORE);
                } else {
                    misses.add(i);
                    metrics.recordCacheMiss(PAIR_STORE);
                }
            }

            log.debug("Resolving {} candidates: {} cached, {} uncached", n, n - misses.size(), misses.size());

            int estimated = 0;
            if (!misses.isEmpty()) {
                Map<String, RemoteMatch> remote = fetchRemote(customer, employees, misses, deadline);
                for (int i : misses) {
                    Employee employee = employees.get(i);
                    RemoteMatch match = remote != null ? remote.get(employeeKeys[i]) : null;
                    if (match != null) {
                        MatchResult fresh = new MatchResult(
                                employee, match.score(), match.confidenceBand(), MatchSource.REMOTE);
                        pairCache.set(customerKey + pairSeparator() + employeeKeys[i], fresh);
                        results[i] = fresh;
                    } else {
                        results[i] = estimate(customer, employee);
                        estimated++;
                    }
                }
                if (remote != null && estimated > 0) {
                    log.warn("Matching service omitted {} of {} requested pairs; estimated locally",
                            estimated, misses.size());
                }
            }

            List<MatchResult> ranked = new ArrayList<>(n);
            for (MatchResult result : results) {
                ranked.add(result);
                metrics.recordSimilarityScore(result.score());
            }
            ranked.sort(BY_SCORE_DESC);

            metrics.recordFallbackResults(estimated);
            metrics.recordResolveDuration(Duration.ofNanos(System.nanoTime() - startNanos), estimated > 0);
            log.debug("Resolved {} candidates ({} estimated locally)", n, estimated);
            return List.copyOf(ranked);
        }
    }

    /**
     * Runs {@link #resolve(Customer, List, Duration)} on the resolver's executor.
     * The future completes with the ranked list; it does not complete exceptionally
     * unless the caller cancels it.
     */
    public CompletableFuture<List<MatchResult>> resolveAsync(Customer customer, List<Employee> candidates,
                                                             Duration deadline) {
        return CompletableFuture.supplyAsync(() -> resolve(customer, candidates, deadline), executor);
    }

    public CompletableFuture<List<MatchResult>> resolveAsync(Customer customer, List<Employee> candidates) {
        return resolveAsync(customer, candidates, defaultDeadline);
    }

    /**
     * Computes the local estimate for one pair.
     */
    MatchResult estimate(Customer customer, Employee employee) {
        SimilarityScore score = fallback.similarity(ProfileText.of(customer), ProfileText.of(employee));
        return MatchResult.fallback(employee, score.similarity(), score.confidence());
    }

    /**
     * Fetches the uncached pairs in one call.
     *
     * @return matches keyed by employee cache key, or null if the remote matcher was not used
     *         or failed
     */
    private Map<String, RemoteMatch> fetchRemote(Customer customer, List<Employee> employees,
                                                 List<Integer> misses, Duration deadline) {
        if (customer == null || deadline == null || deadline.isZero() || deadline.isNegative()) {
            log.debug("No customer or no time budget for a remote call; estimating locally");
            return null;
        }
        gate.probeIfDue(deadline);
        if (!gate.isUsable()) {
            log.info("Matching service {}, estimating {} pairs locally", gate.state(), misses.size());
            return null;
        }

        List<Employee> request = new ArrayList<>(misses.size());
        for (int i : misses) {
            request.add(employees.get(i));
        }

        try {
            List<RemoteMatch> matches = client.matchCustomerToEmployees(customer, request, deadline);
            metrics.recordRemoteCall(MATCH_OPERATION, true);
            Map<String, RemoteMatch> byEmployee = new HashMap<>();
            for (RemoteMatch match : matches) {
                if (match != null && match.employee() != null) {
                    byEmployee.putIfAbsent(EntityKeyDeriver.deriveKey(match.employee()), match);
                }
            }
            return byEmployee;
        } catch (RuntimeException e) {
            metrics.recordRemoteCall(MATCH_OPERATION, false);
            gate.reportFailure(e);
            log.warn("Matching service call failed, estimating {} pairs locally: {}", misses.size(), e.getMessage());
            return null;
        }
    }

    private static String pairSeparator() {
        return EntityKeyDeriver.PAIR_SEPARATOR;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private ExpiringStore<MatchResult> pairCache;
        private HealthGate gate;
        private SemanticMatchingClient client;
        private FallbackSimilarity fallback;
        private MetricsService metrics;
        private Duration defaultDeadline;
        private Executor executor;

        public Builder pairCache(ExpiringStore<MatchResult> pairCache) {
            this.pairCache = pairCache;
            return this;
        }

        public Builder gate(HealthGate gate) {
            this.gate = gate;
            return this;
        }

        public Builder client(SemanticMatchingClient client) {
            this.client = client;
            return this;
        }

        public Builder fallback(FallbackSimilarity fallback) {
            this.fallback = fallback;
            return this;
        }

        public Builder metrics(MetricsService metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder defaultDeadline(Duration defaultDeadline) {
            this.defaultDeadline = defaultDeadline;
            return this;
        }

        public Builder executor(Executor executor) {
            this.executor = executor;
            return this;
        }

        public BatchResolver build() {
            return new BatchResolver(this);
        }
    }
}
