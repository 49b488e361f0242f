package com.customer.matching.api;

import com.customer.matching.cache.CacheConfig;
import com.customer.matching.cache.EntityKeyDeriver;
import com.customer.matching.cache.ExpiringStore;
import com.customer.matching.core.model.Confidence;
import com.customer.matching.core.model.Customer;
import com.customer.matching.core.model.Employee;
import com.customer.matching.core.model.MatchResult;
import com.customer.matching.core.model.MatchSource;
import com.customer.matching.health.HealthGate;
import com.customer.matching.health.HealthState;
import com.customer.matching.metrics.MicrometerMetricsService;
import com.customer.matching.remote.HealthReport;
import com.customer.matching.remote.RemoteMatch;
import com.customer.matching.remote.SemanticMatchingClient;
import com.customer.matching.support.FakeTicker;
import com.customer.matching.support.StubMatchingClient;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class BatchResolverTest {

    private static final Duration REPROBE = Duration.ofSeconds(2);

    private final Customer customer = Customer.builder().id("c1").name("Acme Bank").industry("finance").build();
    private final Employee ada = Employee.builder().id(1).name("Ada").role("banking analyst").build();
    private final Employee bob = Employee.builder().id(2).name("Bob").role("graphic designer").build();
    private final Employee cy = Employee.builder().id(3).name("Cy").role("investment accountant").build();

    private FakeTicker ticker;
    private StubMatchingClient client;
    private HealthGate gate;
    private ExpiringStore<MatchResult> pairCache;
    private BatchResolver resolver;

    @BeforeEach
    void setUp() {
        ticker = new FakeTicker();
        client = new StubMatchingClient().score("Ada", 0.9).score("Bob", 0.3).score("Cy", 0.6);
        resolver = newResolver(client);
    }

    private BatchResolver newResolver(SemanticMatchingClient matchingClient) {
        gate = HealthGate.builder(matchingClient)
                .reprobeInterval(REPROBE)
                .ticker(ticker)
                .executor(Runnable::run)
                .build();
        pairCache = ExpiringStore.create("pair", CacheConfig.defaults(), ticker);
        return BatchResolver.builder()
                .pairCache(pairCache)
                .gate(gate)
                .client(matchingClient)
                .executor(Runnable::run)
                .build();
    }

    private static List<String> names(List<MatchResult> results) {
        List<String> names = new ArrayList<>();
        for (MatchResult result : results) {
            names.add(result.employee().getName());
        }
        return names;
    }

    @Nested
    @DisplayName("Remote matching")
    class RemoteTests {

        @Test
        @DisplayName("Should rank remote scores highest first")
        void remoteRanking() {
            List<MatchResult> results = resolver.resolve(customer, List.of(bob, ada, cy));

            assertEquals(List.of("Ada", "Cy", "Bob"), names(results));
            assertTrue(results.stream().allMatch(r -> r.source() == MatchSource.REMOTE));
            assertEquals(Confidence.HIGH, results.get(0).confidence());
            assertEquals(1, client.healthCalls.get());
            assertEquals(1, client.matchCalls.get());
        }

        @Test
        @DisplayName("Should return the caller's employee instances")
        void callerInstances() {
            List<MatchResult> results = resolver.resolve(customer, List.of(ada));
            assertSame(ada, results.get(0).employee());
        }

        @Test
        @DisplayName("Should cache remote results per pair")
        void cachesRemoteResults() {
            resolver.resolve(customer, List.of(ada, bob));

            assertEquals(2, pairCache.size());
            assertTrue(pairCache.get(EntityKeyDeriver.pairKey(customer, ada)).isPresent());
        }

        @Test
        @DisplayName("Should request only uncached pairs")
        void onlyUncachedPairsRequested() {
            resolver.resolve(customer, List.of(ada));
            List<MatchResult> results = resolver.resolve(customer, List.of(ada, bob));

            assertEquals(2, client.matchCalls.get());
            assertEquals(List.of(bob), client.matchRequests.get(1));
            MatchResult adaResult = results.get(0);
            assertEquals("Ada", adaResult.employee().getName());
            assertEquals(MatchSource.CACHE, adaResult.source());
            assertEquals(0.9, adaResult.score(), 0.0001);
            assertEquals(MatchSource.REMOTE, results.get(1).source());
        }

        @Test
        @DisplayName("Should not call the service when every pair is cached")
        void fullyCached() {
            resolver.resolve(customer, List.of(ada, bob));
            List<MatchResult> results = resolver.resolve(customer, List.of(ada, bob));

            assertEquals(1, client.matchCalls.get());
            assertTrue(results.stream().allMatch(r -> r.source() == MatchSource.CACHE));
        }

        @Test
        @DisplayName("A cache hit should be bound to the caller's employee instance")
        void cacheHitRebinds() {
            resolver.resolve(customer, List.of(ada));
            Employee sameAda = Employee.builder().id(1).name("Ada").role("senior banking analyst").build();

            MatchResult result = resolver.resolve(customer, List.of(sameAda)).get(0);

            assertSame(sameAda, result.employee());
            assertEquals(MatchSource.CACHE, result.source());
        }

        @Test
        @DisplayName("Should refetch pairs whose cache entry expired")
        void expiredPairsRefetched() {
            resolver.resolve(customer, List.of(ada));
            ticker.advance(CacheConfig.defaults().ttl().plusMillis(1));

            MatchResult result = resolver.resolve(customer, List.of(ada)).get(0);

            assertEquals(MatchSource.REMOTE, result.source());
            assertEquals(2, client.matchCalls.get());
        }

        @Test
        @DisplayName("Should estimate pairs the service omitted, without caching them")
        void omittedPairs() {
            Employee dee = Employee.builder().id(4).name("Dee").role("bank teller").build();

            List<MatchResult> results = resolver.resolve(customer, List.of(dee, ada));

            assertEquals(MatchSource.REMOTE, results.get(0).source());
            MatchResult deeResult = results.get(1);
            assertSame(dee, deeResult.employee());
            assertEquals(MatchSource.FALLBACK, deeResult.source());
            assertEquals(1, pairCache.size());
            assertEquals(HealthState.READY, gate.state());
        }
    }

    @Nested
    @DisplayName("Fallback")
    class FallbackTests {

        @Test
        @DisplayName("Should score the finance example locally when the service is down")
        void financeExample() {
            client.failHealth(true);
            Customer financeCustomer = Customer.builder().industry("finance").build();
            Employee analyst = Employee.builder().id(1).role("banking analyst").build();
            Employee designer = Employee.builder().id(2).role("graphic designer").build();

            List<MatchResult> results = resolver.resolve(financeCustomer, List.of(designer, analyst));

            assertEquals(2, results.size());
            assertSame(analyst, results.get(0).employee());
            assertSame(designer, results.get(1).employee());
            assertTrue(results.get(0).score() > results.get(1).score());
            assertTrue(results.stream().allMatch(MatchResult::isEstimated));
            assertEquals(0, client.matchCalls.get());
        }

        @Test
        @DisplayName("Should make no remote calls while forced unavailable")
        void forcedUnavailable() {
            gate.markUnavailable("maintenance");

            List<MatchResult> results = resolver.resolve(customer, List.of(ada, bob));

            assertEquals(0, client.remoteCalls());
            assertEquals(2, results.size());
            assertTrue(results.stream().allMatch(MatchResult::isEstimated));
        }

        @Test
        @DisplayName("Should not probe or call while the model is loading")
        void modelLoading() {
            client.health(HealthReport.loading());

            resolver.resolve(customer, List.of(ada));
            resolver.resolve(customer, List.of(ada));

            assertEquals(1, client.healthCalls.get());
            assertEquals(0, client.matchCalls.get());
            assertEquals(HealthState.MODEL_LOADING, gate.state());
        }

        @Test
        @DisplayName("A failed call should degrade to fallback and mark the service unavailable")
        void remoteFailure() {
            client.failMatching(true);

            List<MatchResult> results = resolver.resolve(customer, List.of(ada, bob));

            assertTrue(results.stream().allMatch(MatchResult::isEstimated));
            assertEquals(HealthState.UNAVAILABLE, gate.state());
            assertEquals(0, pairCache.size());
        }

        @Test
        @DisplayName("Should return to the service once it recovers and the interval passes")
        void recovery() {
            client.failMatching(true);
            resolver.resolve(customer, List.of(ada));
            client.failMatching(false);

            MatchResult stillEstimated = resolver.resolve(customer, List.of(ada)).get(0);
            ticker.advance(REPROBE);
            MatchResult recovered = resolver.resolve(customer, List.of(ada)).get(0);

            assertEquals(MatchSource.FALLBACK, stillEstimated.source());
            assertEquals(MatchSource.REMOTE, recovered.source());
            assertEquals(2, client.matchCalls.get());
        }

        @Test
        @DisplayName("A short deadline should also bound the health probe")
        void shortDeadlineBoundsProbe() {
            SemanticMatchingClient mockClient = mock(SemanticMatchingClient.class);
            when(mockClient.getServiceName()).thenReturn("mock");
            when(mockClient.checkHealth(any())).thenReturn(HealthReport.loading());
            BatchResolver mockResolver = newResolver(mockClient);

            List<MatchResult> results = mockResolver.resolve(customer, List.of(ada), Duration.ofMillis(100));

            verify(mockClient).checkHealth(Duration.ofMillis(100));
            assertTrue(results.get(0).isEstimated());
        }

        @Test
        @DisplayName("A zero deadline should skip the remote call")
        void zeroDeadline() {
            List<MatchResult> results = resolver.resolve(customer, List.of(ada), Duration.ZERO);

            assertEquals(0, client.remoteCalls());
            assertTrue(results.get(0).isEstimated());
        }
    }

    @Nested
    @DisplayName("Ordering and edge cases")
    class OrderingTests {

        @Test
        @DisplayName("Missing scores should sort last and ties should keep input order")
        void nanLastStableTies() {
            Employee a = Employee.builder().id("a").name("A").build();
            Employee b = Employee.builder().id("b").name("B").build();
            Employee c = Employee.builder().id("c").name("C").build();
            Employee d = Employee.builder().id("d").name("D").build();
            SemanticMatchingClient mockClient = mock(SemanticMatchingClient.class);
            when(mockClient.getServiceName()).thenReturn("mock");
            when(mockClient.checkHealth(any())).thenReturn(HealthReport.ready());
            when(mockClient.matchCustomerToEmployees(any(), any(), any())).thenReturn(List.of(
                    RemoteMatch.of(d, 0.7, "high"),
                    new RemoteMatch(b, null, null, null, null, null, null, null, null),
                    RemoteMatch.of(c, 0.5, "medium"),
                    RemoteMatch.of(a, 0.5, "medium")));
            BatchResolver mockResolver = newResolver(mockClient);

            List<MatchResult> results = mockResolver.resolve(customer, List.of(a, b, c, d));

            assertEquals(List.of("D", "A", "C", "B"), names(results));
            assertFalse(results.get(3).hasScore());
            assertEquals(MatchSource.REMOTE, results.get(3).source());
        }

        @Test
        @DisplayName("Empty candidates should return an empty list without remote calls")
        void emptyCandidates() {
            assertTrue(resolver.resolve(customer, List.of()).isEmpty());
            assertTrue(resolver.resolve(customer, null).isEmpty());
            assertEquals(0, client.remoteCalls());
        }

        @Test
        @DisplayName("Null candidates should be skipped")
        void nullCandidates() {
            List<MatchResult> results = resolver.resolve(customer, Arrays.asList(ada, null, bob));
            assertEquals(List.of("Ada", "Bob"), names(results));
        }

        @Test
        @DisplayName("resolveAsync should complete with the ranked list")
        void async() throws Exception {
            List<MatchResult> results = resolver.resolveAsync(customer, List.of(bob, ada)).get(1, TimeUnit.SECONDS);
            assertEquals(List.of("Ada", "Bob"), names(results));
        }

        @Test
        @DisplayName("The returned list should be immutable")
        void immutableResult() {
            List<MatchResult> results = resolver.resolve(customer, List.of(ada));
            assertThrows(UnsupportedOperationException.class, results::clear);
        }
    }

    @Nested
    @DisplayName("Concurrent resolves")
    class ConcurrencyTests {

        private static final int THREADS = 8;

        @Test
        @DisplayName("Callers sharing one cache and gate should each get complete, ranked results")
        void sharedResolver() throws Exception {
            gate.probe();
            ExecutorService pool = Executors.newFixedThreadPool(THREADS);
            CountDownLatch start = new CountDownLatch(1);
            try {
                List<Future<List<MatchResult>>> futures = new ArrayList<>();
                for (int i = 0; i < THREADS; i++) {
                    futures.add(pool.submit(() -> {
                        start.await();
                        return resolver.resolve(customer, List.of(bob, cy, ada));
                    }));
                }
                start.countDown();

                for (Future<List<MatchResult>> future : futures) {
                    List<MatchResult> results = future.get(5, TimeUnit.SECONDS);
                    assertEquals(List.of("Ada", "Cy", "Bob"), names(results));
                    assertEquals(0.9, results.get(0).score(), 0.0001);
                    assertTrue(results.stream().noneMatch(MatchResult::isEstimated));
                    assertTrue(results.stream().allMatch(
                            r -> r.source() == MatchSource.REMOTE || r.source() == MatchSource.CACHE));
                }
            } finally {
                pool.shutdownNow();
            }

            assertEquals(1, client.healthCalls.get());
            assertTrue(client.matchCalls.get() >= 1 && client.matchCalls.get() <= THREADS);
            assertEquals(3, pairCache.size());
            assertEquals(HealthState.READY, gate.state());
        }
    }

    @Test
    @DisplayName("Should record cache, remote and fallback metrics")
    void metrics() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        BatchResolver metered = BatchResolver.builder()
                .pairCache(pairCache)
                .gate(gate)
                .client(client)
                .metrics(new MicrometerMetricsService(registry))
                .build();
        Employee dee = Employee.builder().id(4).name("Dee").build();

        metered.resolve(customer, List.of(ada, dee));
        metered.resolve(customer, List.of(ada));

        assertEquals(1.0, registry.get("matching.cache.hit").tag("store", "pair").counter().count());
        assertEquals(2.0, registry.get("matching.cache.miss").tag("store", "pair").counter().count());
        assertEquals(1.0, registry.get("matching.remote.calls")
                .tags("operation", "customer-employee-match", "outcome", "success").counter().count());
        assertEquals(1.0, registry.get("matching.fallback.results").counter().count());
        assertEquals(1, registry.get("matching.resolve.duration").tag("degraded", "true").timer().count());
    }
}
