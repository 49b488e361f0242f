package com.customer.matching.core.model;

/**
 * Where a match score came from.
 */
public enum MatchSource {
    /**
     * Computed by the remote semantic matcher during this call.
     */
    REMOTE,

    /**
     * Served from the pairwise cache (first computed remotely).
     */
    CACHE,

    /**
     * Estimated locally because the remote matcher could not be used.
     */
    FALLBACK
}
