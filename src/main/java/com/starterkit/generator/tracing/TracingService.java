package com.starterkit.generator.tracing;

import java.util.Map;

/**
 * Tracing seam for the generation pipeline.
 * Each generation opens a root span {@code generator.generate}; its stages
 * ({@code generator.resolve}, {@code generator.merge}, {@code generator.archive}) are started
 * with {@link Span#startChild}. A streamed generation ends its root span on the writer thread.
 * {@link NoOpTracingService} is used unless a tracing backend is configured.
 */
public interface TracingService {

    Span startSpan(String operationName);

    Span startSpan(String operationName, Map<String, String> attributes);
}
