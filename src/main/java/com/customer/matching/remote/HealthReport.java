package com.customer.matching.remote;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of the matching service's {@code GET /health} response.
 *
 * @param status      {@code "healthy"} when the process is serving
 * @param modelLoaded whether the similarity model has finished loading
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record HealthReport(
        String status,
        @JsonProperty("model_loaded") boolean modelLoaded
) {
    public static final String HEALTHY = "healthy";

    public static HealthReport ready() {
        return new HealthReport(HEALTHY, true);
    }

    public static HealthReport loading() {
        return new HealthReport(HEALTHY, false);
    }

    public boolean isHealthy() {
        return HEALTHY.equals(status);
    }
}
