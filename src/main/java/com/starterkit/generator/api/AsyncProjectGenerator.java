package com.starterkit.generator.api;

import com.starterkit.generator.core.model.Order;

import java.io.OutputStream;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Async interface for project generation.
 * All methods return {@link CompletableFuture} and complete exceptionally on failure or timeout.
 */
public interface AsyncProjectGenerator extends AutoCloseable {

    /**
     * Asynchronously generates the archive for an order into the sink.
     */
    CompletableFuture<GenerationResult> generateAsync(Order order, OutputStream sink);

    /**
     * Generates a batch of archives in parallel, bounded by the pool size.
     */
    CompletableFuture<List<GenerationResult>> generateBatchAsync(List<GenerationRequest> requests);

    /**
     * Generates a batch of archives with at most {@code maxConcurrency} running at once.
     */
    CompletableFuture<List<GenerationResult>> generateBatchAsync(List<GenerationRequest> requests,
                                                                 int maxConcurrency);

    @Override
    void close();
}
