package com.customer.matching.logging;

import org.slf4j.MDC;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and removes them on close.
 *
 * <p>Usage with try-with-resources:</p>
 * <pre>
 * try (LogContext ctx = LogContext.forResolve(correlationId, customerKey)) {
 *     log.info("match.resolved candidates={} remote={}", candidates, remote);
 * } // MDC entries are cleared here
 * </pre>
 */
public class LogContext implements AutoCloseable {

    static final int MAX_ID_KEY_LENGTH = 64;
    private static final int DIGEST_HEX_LENGTH = 16;

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for a customer-employee resolve call.
     */
    public static LogContext forResolve(String correlationId, String customerKey) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("customerKey", customerKey);
        ctx.put("operation", "resolve");
        return ctx;
    }

    /**
     * Creates a log context for a health probe.
     */
    public static LogContext forProbe(String serviceName) {
        LogContext ctx = new LogContext();
        ctx.put("service", serviceName);
        ctx.put("operation", "probe");
        return ctx;
    }

    /**
     * Generates a unique correlation ID.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Shortens an entity cache key for log output. Id keys are kept (capped in length);
     * content keys are replaced by their kind and a SHA-256 prefix so record fields
     * never reach the logs.
     */
    public static String loggableKey(String key) {
        if (key == null) {
            return "null";
        }
        if (key.startsWith("id:")) {
            return key.length() <= MAX_ID_KEY_LENGTH ? key : key.substring(0, MAX_ID_KEY_LENGTH);
        }
        int colon = key.indexOf(':');
        String kind = colon > 0 && colon < 8 ? key.substring(0, colon) : "key";
        return kind + ":#" + digest(key);
    }

    private static String digest(String text) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] hash = md.digest(text.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash).substring(0, DIGEST_HEX_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }

    /**
     * Adds an additional key-value pair to this log context.
     */
    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        keys.add(key);
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (String key : keys) {
            MDC.remove(key);
        }
        keys.clear();
    }
}
