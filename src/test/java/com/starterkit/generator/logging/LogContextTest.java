package com.starterkit.generator.logging;

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
    @DisplayName("forGeneration should set correlationId, orderNumber, tier and operation in MDC")
    void forGenerationSetsMDC() {
        try (LogContext ctx = LogContext.forGeneration("corr-123", "ORD-2024-0001", "pro")) {
            assertEquals("corr-123", MDC.get("correlationId"));
            assertEquals("ORD-2024-0001", MDC.get("orderNumber"));
            assertEquals("pro", MDC.get("tier"));
            assertEquals("generate", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("MDC should be cleared on close")
    void mdcClearedOnClose() {
        LogContext ctx = LogContext.forGeneration("corr-123", "ORD-1", "starter");
        assertNotNull(MDC.get("correlationId"));

        ctx.close();

        assertNull(MDC.get("correlationId"));
        assertNull(MDC.get("orderNumber"));
        assertNull(MDC.get("tier"));
        assertNull(MDC.get("operation"));
    }

    @Test
    @DisplayName("with() should add additional keys to MDC")
    void withAddsKeys() {
        try (LogContext ctx = LogContext.forGeneration("corr-123", "ORD-1", "pro").with("stage", "stream")) {
            assertEquals("stream", MDC.get("stage"));
        }
        assertNull(MDC.get("stage"));
        assertNull(MDC.get("correlationId"));
    }

    @Test
    @DisplayName("Keys set outside the context survive its close")
    void unrelatedKeysSurvive() {
        MDC.put("requestId", "req-9");
        try (LogContext ctx = LogContext.forGeneration("corr-123", "ORD-1", "pro")) {
            assertEquals("req-9", MDC.get("requestId"));
        }
        assertEquals("req-9", MDC.get("requestId"));
    }

    @Test
    @DisplayName("generateCorrelationId should return unique UUIDs")
    void generateCorrelationIdReturnsUniqueIds() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 100; i++) {
            ids.add(LogContext.generateCorrelationId());
        }
        assertEquals(100, ids.size());
        assertTrue(ids.iterator().next().matches("[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}"));
    }
}
