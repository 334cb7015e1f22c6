package com.starterkit.generator.tracing;

import java.util.Map;

/**
 * One traced stage of a generation. Closing the span ends it, so stages are
 * written as try-with-resources blocks:
 *
 * <pre>
 * try (Span span = tracingService.startSpan("generator.resolve")) {
 *     span.setAttribute("features.resolved", resolved.size());
 *     span.setStatus(SpanStatus.OK);
 * }
 * </pre>
 */
public interface Span extends AutoCloseable {

    void setAttribute(String key, String value);

    void setAttribute(String key, long value);

    void setStatus(SpanStatus status);

    void recordException(Throwable t);

    /**
     * Starts a span for one stage of this operation, parented explicitly rather than through
     * the calling thread's context, so a stage may run and end on another thread.
     */
    Span startChild(String operationName, Map<String, String> attributes);

    /**
     * Marks the span failed and records the exception in one call.
     */
    default void fail(Throwable t) {
        recordException(t);
        setStatus(SpanStatus.ERROR);
    }

    @Override
    void close();

    enum SpanStatus { OK, ERROR }
}
