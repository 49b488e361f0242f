package com.customer.matching.health;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health of one matching component, or of the matching client as a whole.
 *
 * <p>DEGRADED means matching still answers, but with reduced quality
 * (local estimates, or a cache that is evicting entries).</p>
 */
public record HealthStatus(Status status, String message, Map<String, Object> details) {

    /**
     * Ordered from best to worst.
     */
    public enum Status {
        UP,
        DEGRADED,
        DOWN;

        public Status worseOf(Status other) {
            return other != null && other.ordinal() > ordinal() ? other : this;
        }
    }

    public HealthStatus {
        if (status == null) {
            status = Status.DOWN;
        }
        message = message != null ? message : status.name();
        details = details != null ? Collections.unmodifiableMap(new LinkedHashMap<>(details)) : Map.of();
    }

    public static HealthStatus up() {
        return new HealthStatus(Status.UP, "OK", Map.of());
    }

    public static HealthStatus up(String message) {
        return new HealthStatus(Status.UP, message, Map.of());
    }

    public static HealthStatus degraded(String reason) {
        return new HealthStatus(Status.DEGRADED, reason, Map.of());
    }

    public static HealthStatus down(String reason) {
        return new HealthStatus(Status.DOWN, reason, Map.of());
    }

    public HealthStatus withDetail(String key, Object value) {
        Map<String, Object> merged = new LinkedHashMap<>(details);
        merged.put(key, value);
        return new HealthStatus(status, message, merged);
    }

    /**
     * Returns true if matching still answers: UP or DEGRADED.
     */
    public boolean isServing() {
        return status != Status.DOWN;
    }

    public boolean isUp() {
        return status == Status.UP;
    }

    public boolean isDegraded() {
        return status == Status.DEGRADED;
    }

    public boolean isDown() {
        return status == Status.DOWN;
    }
}
