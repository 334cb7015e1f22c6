package com.starterkit.generator.api;

import com.starterkit.generator.core.model.Order;

import java.io.OutputStream;
import java.util.Objects;

/**
 * An order paired with the sink its archive is written to.
 */
public record GenerationRequest(Order order, OutputStream sink) {

    public GenerationRequest {
        Objects.requireNonNull(order, "order is required");
        Objects.requireNonNull(sink, "sink is required");
    }
}
