package com.customer.matching.remote;

import com.customer.matching.core.model.Confidence;
import com.customer.matching.core.model.Customer;
import com.customer.matching.core.model.Employee;
import com.customer.matching.similarity.SimilarityScore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * {@link SemanticMatchingClient} talking JSON over HTTP to the matching service
 * (default: http://localhost:7002).
 *
 * Usage:
 * <pre>
 * SemanticMatchingClient client = HttpSemanticMatchingClient.builder()
 *     .baseUrl("http://matcher:7002")
 *     .connectTimeout(Duration.ofSeconds(5))
 *     .build();
 * </pre>
 */
public class HttpSemanticMatchingClient implements SemanticMatchingClient {
    private static final Logger log = LoggerFactory.getLogger(HttpSemanticMatchingClient.class);

    public static final String DEFAULT_BASE_URL = "http://localhost:7002";
    private static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(5);

    private final String baseUrl;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    private HttpSemanticMatchingClient(Builder builder) {
        String url = builder.baseUrl != null ? builder.baseUrl : DEFAULT_BASE_URL;
        this.baseUrl = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
        this.httpClient = builder.httpClient != null
                ? builder.httpClient
                : HttpClient.newBuilder()
                        .connectTimeout(builder.connectTimeout != null ? builder.connectTimeout : DEFAULT_CONNECT_TIMEOUT)
                        .build();
        this.objectMapper = builder.objectMapper != null ? builder.objectMapper : new ObjectMapper();
    }

    @Override
    public HealthReport checkHealth(Duration timeout) {
        HttpRequest request = newRequest("/health", timeout).GET().build();
        return read(send(request), HealthReport.class);
    }

    @Override
    public List<RemoteMatch> matchCustomerToEmployees(Customer customer, List<Employee> employees, Duration timeout) {
        Objects.requireNonNull(customer, "customer is required");
        Objects.requireNonNull(employees, "employees is required");
        log.debug("Requesting {} customer-employee pairs from {}", employees.size(), baseUrl);

        HttpRequest request = postJson("/customer-employee-match", new MatchRequest(customer, employees), timeout);
        MatchResponse response = read(send(request), MatchResponse.class);
        if (response.matches() == null) {
            throw new MatchingServiceException("Malformed match response: 'matches' is missing");
        }
        return response.matches();
    }

    @Override
    public SimilarityScore semanticSimilarity(String text1, String text2, Duration timeout) {
        HttpRequest request = postJson("/semantic-similarity", new SimilarityRequest(text1, text2), timeout);
        SimilarityResponse response = read(send(request), SimilarityResponse.class);
        Double similarity = response.similarity();
        if (similarity == null || similarity.isNaN() || similarity < 0.0 || similarity > 1.0) {
            throw new MatchingServiceException("Malformed similarity response: similarity=" + similarity);
        }
        Confidence confidence = Confidence.fromWireName(response.confidence());
        return new SimilarityScore(similarity, confidence != null ? confidence : Confidence.forSimilarity(similarity));
    }

    @Override
    public JsonNode cacheStats(Duration timeout) {
        HttpRequest request = newRequest("/cache/stats", timeout).GET().build();
        return readTree(send(request));
    }

    @Override
    public JsonNode clearCache(Duration timeout) {
        HttpRequest request = newRequest("/cache/clear", timeout)
                .POST(HttpRequest.BodyPublishers.noBody())
                .build();
        return readTree(send(request));
    }

    @Override
    public String getServiceName() {
        return "SemanticMatching/" + baseUrl;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    private HttpRequest.Builder newRequest(String path, Duration timeout) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .header("Accept", "application/json");
        if (timeout != null && !timeout.isZero() && !timeout.isNegative()) {
            builder.timeout(timeout);
        }
        return builder;
    }

    private HttpRequest postJson(String path, Object body, Duration timeout) {
        String requestBody;
        try {
            requestBody = objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new MatchingServiceException("Could not serialize request for " + path, e);
        }
        return newRequest(path, timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(requestBody))
                .build();
    }

    private HttpResponse<String> send(HttpRequest request) {
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new MatchingServiceException(request.uri().getPath() + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MatchingServiceException(request.uri().getPath() + " interrupted", e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new MatchingServiceException(
                    request.uri().getPath() + " returned status " + status, status, null);
        }
        return response;
    }

    private <T> T read(HttpResponse<String> response, Class<T> type) {
        try {
            T value = objectMapper.readValue(response.body(), type);
            if (value == null) {
                throw new MatchingServiceException("Empty response body from " + response.uri().getPath());
            }
            return value;
        } catch (JsonProcessingException e) {
            throw new MatchingServiceException(
                    "Malformed response from " + response.uri().getPath() + ": " + e.getOriginalMessage(), e);
        }
    }

    private JsonNode readTree(HttpResponse<String> response) {
        try {
            return objectMapper.readTree(response.body());
        } catch (JsonProcessingException e) {
            throw new MatchingServiceException(
                    "Malformed response from " + response.uri().getPath() + ": " + e.getOriginalMessage(), e);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a client for the default local service.
     */
    public static HttpSemanticMatchingClient createDefault() {
        return builder().build();
    }

    public static class Builder {
        private String baseUrl;
        private Duration connectTimeout;
        private HttpClient httpClient;
        private ObjectMapper objectMapper;

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        public HttpSemanticMatchingClient build() {
            return new HttpSemanticMatchingClient(this);
        }
    }

    // Request/Response DTOs for the matching service API
    private record MatchRequest(Customer customer, List<Employee> employees) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record MatchResponse(List<RemoteMatch> matches) {}

    private record SimilarityRequest(String text1, String text2) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record SimilarityResponse(Double similarity, String confidence) {}
}
