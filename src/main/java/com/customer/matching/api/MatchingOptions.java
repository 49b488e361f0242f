package com.customer.matching.api;

import com.customer.matching.cache.CacheConfig;
import com.customer.matching.remote.HttpSemanticMatchingClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;

/**
 * Options for the matching client: remote endpoint, timeouts, health re-probing
 * and the two local caches.
 *
 * <p>Options can be built in code or read from properties:</p>
 * <pre>
 * semantic-matching.base-url=http://matcher:7002
 * semantic-matching.request-timeout-ms=30000
 * semantic-matching.probe-timeout-ms=5000
 * semantic-matching.reprobe-interval-ms=2000
 * semantic-matching.ready-attempts=2
 * semantic-matching.ready-interval-ms=2000
 * semantic-matching.pair-cache.max-size=10000
 * semantic-matching.pair-cache.ttl-seconds=300
 * semantic-matching.pair-cache.enabled=true
 * semantic-matching.similarity-cache.max-size=10000
 * semantic-matching.similarity-cache.ttl-seconds=300
 * semantic-matching.similarity-cache.enabled=true
 * </pre>
 */
public class MatchingOptions {
    private static final Logger log = LoggerFactory.getLogger(MatchingOptions.class);

    public static final String PROPERTIES_RESOURCE = "semantic-matching.properties";
    public static final String BASE_URL_ENV = "SEMANTIC_MATCHING_API_URL";
    static final String PREFIX = "semantic-matching.";

    private static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);
    private static final Duration DEFAULT_PROBE_TIMEOUT = Duration.ofSeconds(5);
    private static final Duration DEFAULT_REPROBE_INTERVAL = Duration.ofSeconds(2);
    private static final int DEFAULT_READY_ATTEMPTS = 2;
    private static final Duration DEFAULT_READY_INTERVAL = Duration.ofSeconds(2);

    private final String baseUrl;
    private final Duration requestTimeout;
    private final Duration probeTimeout;
    private final Duration reprobeInterval;
    private final int readyAttempts;
    private final Duration readyInterval;
    private final CacheConfig pairCache;
    private final CacheConfig similarityCache;

    private MatchingOptions(Builder builder) {
        this.baseUrl = builder.baseUrl;
        this.requestTimeout = builder.requestTimeout;
        this.probeTimeout = builder.probeTimeout;
        this.reprobeInterval = builder.reprobeInterval;
        this.readyAttempts = builder.readyAttempts;
        this.readyInterval = builder.readyInterval;
        this.pairCache = builder.pairCache;
        this.similarityCache = builder.similarityCache;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    /**
     * Default deadline for one remote matching or similarity call.
     */
    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public Duration getProbeTimeout() {
        return probeTimeout;
    }

    /**
     * Minimum time an unavailable or loading service is left alone before it is re-probed.
     */
    public Duration getReprobeInterval() {
        return reprobeInterval;
    }

    public int getReadyAttempts() {
        return readyAttempts;
    }

    public Duration getReadyInterval() {
        return readyInterval;
    }

    public CacheConfig getPairCache() {
        return pairCache;
    }

    public CacheConfig getSimilarityCache() {
        return similarityCache;
    }

    public static MatchingOptions defaults() {
        return builder().build();
    }

    /**
     * Loads options from {@value #PROPERTIES_RESOURCE} on the classpath (if present),
     * then applies the {@value #BASE_URL_ENV} environment variable.
     */
    public static MatchingOptions load() {
        return load(System.getenv());
    }

    static MatchingOptions load(Map<String, String> environment) {
        Properties properties = new Properties();
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = MatchingOptions.class.getClassLoader();
        }
        try (InputStream in = loader.getResourceAsStream(PROPERTIES_RESOURCE)) {
            if (in != null) {
                properties.load(in);
                log.debug("Loaded matching options from {}", PROPERTIES_RESOURCE);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read " + PROPERTIES_RESOURCE, e);
        }
        String envUrl = environment.get(BASE_URL_ENV);
        if (envUrl != null && !envUrl.isBlank()) {
            properties.setProperty(PREFIX + "base-url", envUrl.trim());
        }
        return fromProperties(properties);
    }

    /**
     * Builds options from {@code semantic-matching.*} properties; absent keys keep their defaults.
     *
     * @throws IllegalArgumentException if a value cannot be parsed or is out of range
     */
    public static MatchingOptions fromProperties(Properties properties) {
        Builder builder = builder();
        String baseUrl = properties.getProperty(PREFIX + "base-url");
        if (baseUrl != null && !baseUrl.isBlank()) {
            builder.baseUrl(baseUrl.trim());
        }
        builder.requestTimeout(millis(properties, "request-timeout-ms", DEFAULT_REQUEST_TIMEOUT));
        builder.probeTimeout(millis(properties, "probe-timeout-ms", DEFAULT_PROBE_TIMEOUT));
        builder.reprobeInterval(millis(properties, "reprobe-interval-ms", DEFAULT_REPROBE_INTERVAL));
        builder.readyAttempts(integer(properties, "ready-attempts", DEFAULT_READY_ATTEMPTS));
        builder.readyInterval(millis(properties, "ready-interval-ms", DEFAULT_READY_INTERVAL));
        builder.pairCache(cacheConfig(properties, "pair-cache."));
        builder.similarityCache(cacheConfig(properties, "similarity-cache."));
        return builder.build();
    }

    private static CacheConfig cacheConfig(Properties properties, String section) {
        CacheConfig defaults = CacheConfig.defaults();
        int maxSize = integer(properties, section + "max-size", defaults.maxSize());
        long ttlSeconds = integer(properties, section + "ttl-seconds", (int) defaults.ttl().toSeconds());
        boolean enabled = Boolean.parseBoolean(
                properties.getProperty(PREFIX + section + "enabled", String.valueOf(defaults.enabled())).trim());
        return new CacheConfig(maxSize, Duration.ofSeconds(ttlSeconds), enabled);
    }

    private static Duration millis(Properties properties, String key, Duration defaultValue) {
        return Duration.ofMillis(integer(properties, key, (int) defaultValue.toMillis()));
    }

    private static int integer(Properties properties, String key, int defaultValue) {
        String value = properties.getProperty(PREFIX + key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(PREFIX + key + " must be an integer, was '" + value + "'", e);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String baseUrl = HttpSemanticMatchingClient.DEFAULT_BASE_URL;
        private Duration requestTimeout = DEFAULT_REQUEST_TIMEOUT;
        private Duration probeTimeout = DEFAULT_PROBE_TIMEOUT;
        private Duration reprobeInterval = DEFAULT_REPROBE_INTERVAL;
        private int readyAttempts = DEFAULT_READY_ATTEMPTS;
        private Duration readyInterval = DEFAULT_READY_INTERVAL;
        private CacheConfig pairCache = CacheConfig.defaults();
        private CacheConfig similarityCache = CacheConfig.defaults();

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl is required");
            return this;
        }

        public Builder requestTimeout(Duration requestTimeout) {
            this.requestTimeout = positive(requestTimeout, "requestTimeout");
            return this;
        }

        public Builder probeTimeout(Duration probeTimeout) {
            this.probeTimeout = positive(probeTimeout, "probeTimeout");
            return this;
        }

        public Builder reprobeInterval(Duration reprobeInterval) {
            this.reprobeInterval = nonNegative(reprobeInterval, "reprobeInterval");
            return this;
        }

        public Builder readyAttempts(int readyAttempts) {
            if (readyAttempts < 0) {
                throw new IllegalArgumentException("readyAttempts must be >= 0");
            }
            this.readyAttempts = readyAttempts;
            return this;
        }

        public Builder readyInterval(Duration readyInterval) {
            this.readyInterval = nonNegative(readyInterval, "readyInterval");
            return this;
        }

        public Builder pairCache(CacheConfig pairCache) {
            this.pairCache = Objects.requireNonNull(pairCache, "pairCache is required");
            return this;
        }

        public Builder similarityCache(CacheConfig similarityCache) {
            this.similarityCache = Objects.requireNonNull(similarityCache, "similarityCache is required");
            return this;
        }

        public MatchingOptions build() {
            return new MatchingOptions(this);
        }

        private static Duration positive(Duration value, String name) {
            Objects.requireNonNull(value, name + " is required");
            if (value.isZero() || value.isNegative()) {
                throw new IllegalArgumentException(name + " must be > 0");
            }
            return value;
        }

        private static Duration nonNegative(Duration value, String name) {
            Objects.requireNonNull(value, name + " is required");
            if (value.isNegative()) {
                throw new IllegalArgumentException(name + " must be >= 0");
            }
            return value;
        }
    }
}
