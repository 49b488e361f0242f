package com.customer.matching.remote;

import com.customer.matching.core.model.Customer;
import com.customer.matching.core.model.Employee;
import com.customer.matching.similarity.SimilarityScore;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;

/**
 * Client used when no matching service is configured.
 * Every call fails, so all matching runs on the local fallback.
 */
public class NoOpSemanticMatchingClient implements SemanticMatchingClient {
    private static final Logger log = LoggerFactory.getLogger(NoOpSemanticMatchingClient.class);

    @Override
    public HealthReport checkHealth(Duration timeout) {
        throw unavailable("health");
    }

    @Override
    public List<RemoteMatch> matchCustomerToEmployees(Customer customer, List<Employee> employees, Duration timeout) {
        throw unavailable("customer-employee-match");
    }

    @Override
    public SimilarityScore semanticSimilarity(String text1, String text2, Duration timeout) {
        throw unavailable("semantic-similarity");
    }

    @Override
    public JsonNode cacheStats(Duration timeout) {
        throw unavailable("cache/stats");
    }

    @Override
    public JsonNode clearCache(Duration timeout) {
        throw unavailable("cache/clear");
    }

    @Override
    public String getServiceName() {
        return "NoOp";
    }

    private MatchingServiceException unavailable(String operation) {
        log.debug("NoOp matching client called for {}", operation);
        return new MatchingServiceException("No matching service configured");
    }
}
