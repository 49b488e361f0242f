package com.customer.matching.health;

/**
 * Reachability and readiness of the remote matching service.
 */
public enum HealthState {
    /**
     * Never probed.
     */
    UNKNOWN,

    /**
     * A probe is in flight.
     */
    CHECKING,

    /**
     * The service is up but its model is still loading; not yet serving matches.
     */
    MODEL_LOADING,

    /**
     * The service is up and serving matches.
     */
    READY,

    /**
     * The last probe or remote call failed.
     */
    UNAVAILABLE
}
