package com.customer.matching.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LogContext Tests")
class LogContextTest {

    @AfterEach
    void cleanupMDC() {
        MDC.clear();
    }

    @Test
    @DisplayName("forResolve should set correlationId, customerKey and operation in MDC")
    void forResolveSetsMDC() {
        try (LogContext ctx = LogContext.forResolve("corr-123", "id:c1")) {
            assertEquals("corr-123", MDC.get("correlationId"));
            assertEquals("id:c1", MDC.get("customerKey"));
            assertEquals("resolve", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("forProbe should set service and operation in MDC")
    void forProbeSetsMDC() {
        try (LogContext ctx = LogContext.forProbe("SemanticMatching/http://localhost:7002")) {
            assertEquals("SemanticMatching/http://localhost:7002", MDC.get("service"));
            assertEquals("probe", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("close should remove every key it added")
    void closeClearsMDC() {
        try (LogContext ctx = LogContext.forResolve("corr-1", "id:c1").with("batch", "7")) {
            assertEquals("7", MDC.get("batch"));
        }
        assertNull(MDC.get("correlationId"));
        assertNull(MDC.get("customerKey"));
        assertNull(MDC.get("operation"));
        assertNull(MDC.get("batch"));
    }

    @Test
    @DisplayName("close should leave unrelated MDC keys alone")
    void closeKeepsOtherKeys() {
        MDC.put("requestId", "r-1");
        try (LogContext ctx = LogContext.forProbe("svc")) {
            assertEquals("r-1", MDC.get("requestId"));
        }
        assertEquals("r-1", MDC.get("requestId"));
    }

    @Test
    @DisplayName("loggableKey should keep short id keys")
    void loggableIdKey() {
        assertEquals("id:c1", LogContext.loggableKey("id:c1"));
        String longId = "id:" + "x".repeat(200);
        assertEquals(LogContext.MAX_ID_KEY_LENGTH, LogContext.loggableKey(longId).length());
    }

    @Test
    @DisplayName("loggableKey should hide the content of json keys")
    void loggableJsonKey() {
        String key = "json:{\"industry\":\"finance\",\"name\":\"Acme Bank\",\"sales\":1200000}";

        String logged = LogContext.loggableKey(key);

        assertTrue(logged.startsWith("json:#"));
        assertEquals("json:#".length() + 16, logged.length());
        assertFalse(logged.contains("Acme"));
        assertEquals(logged, LogContext.loggableKey(key));
        assertNotEquals(logged, LogContext.loggableKey(key.replace("Acme", "Apex")));
        assertEquals("null", LogContext.loggableKey(null));
    }

    @Test
    @DisplayName("generateCorrelationId should produce unique ids")
    void uniqueCorrelationIds() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 100; i++) {
            ids.add(LogContext.generateCorrelationId());
        }
        assertEquals(100, ids.size());
    }
}
