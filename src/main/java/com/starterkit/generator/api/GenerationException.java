package com.starterkit.generator.api;

/**
 * Base class for fatal generation failures.
 * When a generation fails, the caller must discard anything already written to the sink.
 */
public class GenerationException extends RuntimeException {

    public GenerationException(String message) {
        super(message);
    }

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
