package com.starterkit.generator.api;

import com.starterkit.generator.core.model.Order;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.OutputStream;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Thread-pool implementation of {@link AsyncProjectGenerator}.
 * Pool size and timeout come from {@link GenerationOptions}.
 */
public class AsyncProjectGeneratorImpl implements AsyncProjectGenerator {
    private static final Logger log = LoggerFactory.getLogger(AsyncProjectGeneratorImpl.class);

    private final ProjectGenerator generator;
    private final ExecutorService executor;
    private final long timeoutMs;

    public AsyncProjectGeneratorImpl(ProjectGenerator generator, GenerationOptions options) {
        this(generator, options.getAsyncThreads(), options.getAsyncTimeoutMs());
    }

    public AsyncProjectGeneratorImpl(ProjectGenerator generator, int threads, long timeoutMs) {
        this.generator = generator;
        this.executor = Executors.newFixedThreadPool(threads, new GeneratorThreads("project-generator-async"));
        this.timeoutMs = timeoutMs;
    }

    @Override
    public CompletableFuture<GenerationResult> generateAsync(Order order, OutputStream sink) {
        return CompletableFuture.supplyAsync(
                () -> generator.generate(order, sink),
                executor
        ).orTimeout(timeoutMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public CompletableFuture<List<GenerationResult>> generateBatchAsync(List<GenerationRequest> requests) {
        List<CompletableFuture<GenerationResult>> futures = requests.stream()
                .map(req -> generateAsync(req.order(), req.sink()))
                .toList();

        return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .thenApply(v -> futures.stream()
                        .map(CompletableFuture::join)
                        .toList());
    }

    @Override
    public CompletableFuture<List<GenerationResult>> generateBatchAsync(List<GenerationRequest> requests,
                                                                        int maxConcurrency) {
        if (maxConcurrency <= 0) {
            throw new IllegalArgumentException("maxConcurrency must be > 0");
        }

        Semaphore semaphore = new Semaphore(maxConcurrency);

        List<CompletableFuture<GenerationResult>> futures = requests.stream()
                .map(req -> CompletableFuture.supplyAsync(() -> {
                    try {
                        semaphore.acquire();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        throw new CompletionException(e);
                    }
                    try {
                        return generator.generate(req.order(), req.sink());
                    } finally {
                        semaphore.release();
                    }
                }, executor).orTimeout(timeoutMs, TimeUnit.MILLISECONDS))
                .toList();

        log.debug("generate.batchSubmitted requests={} maxConcurrency={}", requests.size(), maxConcurrency);
        return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .thenApply(v -> futures.stream()
                        .map(CompletableFuture::join)
                        .toList());
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
