package com.customer.matching.health;

/**
 * A single component health check (remote service, cache, ...).
 */
public interface HealthCheck {

    /**
     * Returns the name of this health check.
     */
    String getName();

    /**
     * Evaluates the component and returns its current status. Must not throw.
     */
    HealthStatus check();
}
