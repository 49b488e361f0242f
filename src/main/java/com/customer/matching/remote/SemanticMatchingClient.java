package com.customer.matching.remote;

import com.customer.matching.core.model.Customer;
import com.customer.matching.core.model.Employee;
import com.customer.matching.similarity.SimilarityScore;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.util.List;

/**
 * Client for the remote semantic matching service.
 *
 * Every call blocks for at most the given timeout and reports any failure
 * (transport error, non-success status, malformed body) as a
 * {@link MatchingServiceException}.
 */
public interface SemanticMatchingClient {

    /**
     * Calls {@code GET /health}.
     */
    HealthReport checkHealth(Duration timeout);

    /**
     * Calls {@code POST /customer-employee-match} for one customer and the given employees.
     *
     * @return the returned matches, in the order the service sent them
     */
    List<RemoteMatch> matchCustomerToEmployees(Customer customer, List<Employee> employees, Duration timeout);

    /**
     * Calls {@code POST /semantic-similarity} for two texts.
     */
    SimilarityScore semanticSimilarity(String text1, String text2, Duration timeout);

    /**
     * Calls {@code GET /cache/stats}.
     */
    JsonNode cacheStats(Duration timeout);

    /**
     * Calls {@code POST /cache/clear}.
     */
    JsonNode clearCache(Duration timeout);

    /**
     * Returns a human-readable name for logs and health details.
     */
    String getServiceName();
}
