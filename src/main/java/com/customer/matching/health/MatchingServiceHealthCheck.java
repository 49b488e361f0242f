package com.customer.matching.health;

import java.util.Objects;

/**
 * Reports the remote matching service as seen by the {@link HealthGate}.
 * Reads the last committed gate state; never probes.
 */
public class MatchingServiceHealthCheck implements HealthCheck {

    private final HealthGate gate;

    public MatchingServiceHealthCheck(HealthGate gate) {
        this.gate = Objects.requireNonNull(gate, "gate is required");
    }

    @Override
    public String getName() {
        return "semanticMatching";
    }

    @Override
    public HealthStatus check() {
        HealthGate.Snapshot snapshot = gate.snapshot();
        HealthStatus base;
        switch (snapshot.state()) {
            case READY:
                base = HealthStatus.up();
                break;
            case UNAVAILABLE:
                base = HealthStatus.down("Matching service unavailable, using local fallback");
                break;
            case MODEL_LOADING:
                base = HealthStatus.degraded("Matching service model still loading");
                break;
            default:
                base = HealthStatus.degraded("Matching service not yet confirmed ready");
                break;
        }
        return base
                .withDetail("state", snapshot.state().name())
                .withDetail("detail", String.valueOf(snapshot.detail()))
                .withDetail("service", gate.getServiceName());
    }
}
