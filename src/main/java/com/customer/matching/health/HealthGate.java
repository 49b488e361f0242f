package com.customer.matching.health;

import com.customer.matching.logging.LogContext;
import com.customer.matching.metrics.MetricsService;
import com.customer.matching.metrics.NoOpMetricsService;
import com.customer.matching.remote.HealthReport;
import com.customer.matching.remote.SemanticMatchingClient;
import com.github.benmanes.caffeine.cache.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Tracks whether the remote matching service may be called.
 *
 * <p>State machine:</p>
 * <pre>
 * UNKNOWN ──probe──▶ CHECKING ──healthy, model loaded────▶ READY
 *                        │    ──healthy, model loading───▶ MODEL_LOADING
 *                        └────failure / other status─────▶ UNAVAILABLE
 * MODEL_LOADING, UNAVAILABLE ──probe──▶ CHECKING
 * READY ──reportFailure──▶ UNAVAILABLE
 * </pre>
 *
 * <p>Probes never move a {@link HealthState#READY} gate; only a failed remote call does.</p>
 *
 * <p>Only {@link HealthState#READY} is usable. State and the time it was entered are
 * published together as one immutable {@link Snapshot}, so readers never observe a
 * half-applied transition. Concurrent probes are safe; the last one to finish wins.</p>
 */
public class HealthGate {
    private static final Logger log = LoggerFactory.getLogger(HealthGate.class);

    private static final Duration DEFAULT_PROBE_TIMEOUT = Duration.ofSeconds(5);
    private static final Duration DEFAULT_REPROBE_INTERVAL = Duration.ofSeconds(2);
    static final String PRELOAD_TEXT_1 = "preload";
    static final String PRELOAD_TEXT_2 = "initialization";

    /**
     * Committed gate state.
     *
     * @param state      current state
     * @param sinceNanos ticker reading when the state was entered
     * @param detail     short reason for the last transition
     */
    public record Snapshot(HealthState state, long sinceNanos, String detail) {
        public Snapshot {
            Objects.requireNonNull(state, "state is required");
        }
    }

    private final SemanticMatchingClient client;
    private final Duration probeTimeout;
    private final Duration reprobeInterval;
    private final Ticker ticker;
    private final Executor executor;
    private final MetricsService metrics;
    private final AtomicReference<Snapshot> current;

    private HealthGate(Builder builder) {
        this.client = Objects.requireNonNull(builder.client, "client is required");
        this.probeTimeout = builder.probeTimeout != null ? builder.probeTimeout : DEFAULT_PROBE_TIMEOUT;
        this.reprobeInterval = builder.reprobeInterval != null ? builder.reprobeInterval : DEFAULT_REPROBE_INTERVAL;
        if (reprobeInterval.isNegative()) {
            throw new IllegalArgumentException("reprobeInterval must be >= 0");
        }
        this.ticker = builder.ticker != null ? builder.ticker : Ticker.systemTicker();
        this.executor = builder.executor != null ? builder.executor : ForkJoinPool.commonPool();
        this.metrics = builder.metrics != null ? builder.metrics : new NoOpMetricsService();
        this.current = new AtomicReference<>(new Snapshot(HealthState.UNKNOWN, ticker.read(), "not probed"));
    }

    /**
     * Returns true only when the service is {@link HealthState#READY}.
     */
    public boolean isUsable() {
        return current.get().state() == HealthState.READY;
    }

    public HealthState state() {
        return current.get().state();
    }

    public Snapshot snapshot() {
        return current.get();
    }

    /**
     * Performs one health check and commits its outcome. A ready gate is returned
     * as is, without calling the service.
     *
     * @return the state after the probe
     */
    public HealthState probe() {
        while (true) {
            Snapshot observed = current.get();
            if (observed.state() == HealthState.READY) {
                return HealthState.READY;
            }
            Snapshot checking = new Snapshot(HealthState.CHECKING, ticker.read(), "probe started");
            if (current.compareAndSet(observed, checking)) {
                onTransition(observed.state(), HealthState.CHECKING, "probe started");
                return runProbe(probeTimeout);
            }
        }
    }

    /**
     * Probes only if the gate has never been probed, or has been
     * {@link HealthState#UNAVAILABLE} or {@link HealthState#MODEL_LOADING} for at
     * least the re-probe interval. A ready gate, or one already being probed,
     * is left alone.
     *
     * @return true if this call performed a probe
     */
    public boolean probeIfDue() {
        return probeIfDue(probeTimeout);
    }

    /**
     * Same as {@link #probeIfDue()}, but the health check waits at most
     * {@code budget} or the probe timeout, whichever is shorter.
     */
    public boolean probeIfDue(Duration budget) {
        Objects.requireNonNull(budget, "budget is required");
        Duration timeout = budget.compareTo(probeTimeout) < 0 ? budget : probeTimeout;
        if (timeout.isZero() || timeout.isNegative()) {
            return false;
        }
        Snapshot observed = current.get();
        if (!isDue(observed)) {
            return false;
        }
        Snapshot checking = new Snapshot(HealthState.CHECKING, ticker.read(), "probe started");
        if (!current.compareAndSet(observed, checking)) {
            // another caller changed the state first
            return false;
        }
        onTransition(observed.state(), HealthState.CHECKING, "probe started");
        runProbe(timeout);
        return true;
    }

    /**
     * Records that a remote call failed. The next caller re-probes once the
     * re-probe interval has passed.
     */
    public void reportFailure(Throwable cause) {
        String detail = "remote call failed: " + (cause != null ? cause.getMessage() : "unknown");
        commit(HealthState.UNAVAILABLE, detail);
    }

    /**
     * Forces the gate into {@link HealthState#UNAVAILABLE}.
     */
    public void markUnavailable(String reason) {
        commit(HealthState.UNAVAILABLE, reason != null ? reason : "marked unavailable");
    }

    /**
     * Sends a warm-up request so a cold service starts loading its model.
     * The outcome is ignored; the returned future always completes normally.
     */
    public CompletableFuture<Void> preload() {
        return CompletableFuture.runAsync(this::warmUp, executor)
                .exceptionally(e -> {
                    log.debug("Preload could not be scheduled: {}", e.getMessage());
                    return null;
                });
    }

    /**
     * Probes until the service is ready, triggering a model warm-up if it is not.
     * Waits {@code interval} between attempts; the caller owns the total wait.
     *
     * @param attempts number of re-probes after the first one
     * @param interval pause before each re-probe
     * @return true if the gate ended up {@link HealthState#READY}
     */
    public boolean awaitReady(int attempts, Duration interval) {
        if (attempts < 0) {
            throw new IllegalArgumentException("attempts must be >= 0");
        }
        Objects.requireNonNull(interval, "interval is required");

        if (isUsable()) {
            return true;
        }
        if (probe() == HealthState.READY) {
            return true;
        }
        log.info("Matching service not ready ({}), triggering model warm-up", state());
        warmUp();

        for (int attempt = 1; attempt <= attempts; attempt++) {
            if (!pause(interval)) {
                break;
            }
            if (probe() == HealthState.READY) {
                log.info("Matching service ready after {} re-probe(s)", attempt);
                return true;
            }
        }
        log.warn("Matching service still {} after {} re-probe(s); local fallback will be used", state(), attempts);
        return isUsable();
    }

    public Duration getReprobeInterval() {
        return reprobeInterval;
    }

    public String getServiceName() {
        return client.getServiceName();
    }

    private boolean isDue(Snapshot snapshot) {
        switch (snapshot.state()) {
            case UNKNOWN:
                return true;
            case UNAVAILABLE:
            case MODEL_LOADING:
                return ticker.read() - snapshot.sinceNanos() >= reprobeInterval.toNanos();
            default:
                return false;
        }
    }

    private HealthState runProbe(Duration timeout) {
        HealthState outcome;
        String detail;
        try (LogContext ctx = LogContext.forProbe(client.getServiceName())) {
            try {
                HealthReport report = client.checkHealth(timeout);
                metrics.recordRemoteCall("health", true);
                if (report == null || !report.isHealthy()) {
                    outcome = HealthState.UNAVAILABLE;
                    detail = "status=" + (report != null ? report.status() : null);
                } else if (report.modelLoaded()) {
                    outcome = HealthState.READY;
                    detail = "model loaded";
                } else {
                    outcome = HealthState.MODEL_LOADING;
                    detail = "service healthy, model still loading";
                }
            } catch (RuntimeException e) {
                metrics.recordRemoteCall("health", false);
                outcome = HealthState.UNAVAILABLE;
                detail = "probe failed: " + e.getMessage();
                log.warn("Matching service health probe failed: {}", e.getMessage());
            }
            commit(outcome, detail);
        }
        return outcome;
    }

    private void warmUp() {
        try {
            client.semanticSimilarity(PRELOAD_TEXT_1, PRELOAD_TEXT_2, probeTimeout);
            log.debug("Model warm-up request answered");
        } catch (RuntimeException e) {
            // a loading model is expected to reject the warm-up
            log.debug("Model warm-up request sent: {}", e.getMessage());
        }
    }

    private boolean pause(Duration interval) {
        if (interval.isZero() || interval.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(interval.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void commit(HealthState next, String detail) {
        Snapshot previous = current.getAndSet(new Snapshot(next, ticker.read(), detail));
        onTransition(previous.state(), next, detail);
    }

    private void onTransition(HealthState from, HealthState to, String detail) {
        if (from == to) {
            return;
        }
        metrics.recordHealthTransition(from, to);
        if (to == HealthState.CHECKING) {
            log.debug("Matching service health {} -> {}", from, to);
        } else {
            log.info("Matching service health {} -> {} ({})", from, to, detail);
        }
    }

    public static Builder builder(SemanticMatchingClient client) {
        return new Builder().client(client);
    }

    public static class Builder {
        private SemanticMatchingClient client;
        private Duration probeTimeout;
        private Duration reprobeInterval;
        private Ticker ticker;
        private Executor executor;
        private MetricsService metrics;

        public Builder client(SemanticMatchingClient client) {
            this.client = client;
            return this;
        }

        public Builder probeTimeout(Duration probeTimeout) {
            this.probeTimeout = probeTimeout;
            return this;
        }

        public Builder reprobeInterval(Duration reprobeInterval) {
            this.reprobeInterval = reprobeInterval;
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

        public Builder metrics(MetricsService metrics) {
            this.metrics = metrics;
            return this;
        }

        public HealthGate build() {
            return new HealthGate(this);
        }
    }
}
