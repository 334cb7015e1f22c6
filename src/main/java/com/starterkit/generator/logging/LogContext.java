package com.starterkit.generator.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and automatically removes them on close.
 *
 * <p>Usage with try-with-resources:</p>
 * <pre>
 * try (LogContext ctx = LogContext.forGeneration(correlationId, "ORD-2024-001", "pro")) {
 *     log.info("generate.completed entries={}", entries);
 * } // MDC entries are automatically cleared
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for one project generation.
     */
    public static LogContext forGeneration(String correlationId, String orderNumber, String tier) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("orderNumber", orderNumber);
        ctx.put("tier", tier);
        ctx.put("operation", "generate");
        return ctx;
    }

    /**
     * Generates a unique correlation ID.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString();
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
