package com.customer.matching.core.model;

import java.util.Objects;

/**
 * Score relating one customer to one candidate employee.
 *
 * The employee is the caller's own instance; results never copy or own it.
 * A missing score is represented as {@link Double#NaN}.
 */
public record MatchResult(
        Employee employee,
        double score,
        Confidence confidence,
        MatchSource source
) {
    public MatchResult {
        Objects.requireNonNull(employee, "employee is required");
        Objects.requireNonNull(source, "source is required");
    }

    /**
     * Creates a fallback result from a local similarity score.
     */
    public static MatchResult fallback(Employee employee, double score, Confidence confidence) {
        return new MatchResult(employee, score, confidence, MatchSource.FALLBACK);
    }

    /**
     * Returns a copy tagged as served from the cache and bound to the given employee instance.
     */
    public MatchResult fromCache(Employee caller) {
        return new MatchResult(caller, score, confidence, MatchSource.CACHE);
    }

    public boolean hasScore() {
        return !Double.isNaN(score);
    }

    /**
     * Returns true if the result is a local estimate rather than a remote score.
     */
    public boolean isEstimated() {
        return source == MatchSource.FALLBACK;
    }
}
