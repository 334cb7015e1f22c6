package com.starterkit.generator.core.model;

import java.util.Objects;

/**
 * Named data-model fragment contributed by a feature.
 *
 * @param model  name of the model the fragment introduces
 * @param source path of the schema fragment file
 */
public record SchemaMapping(String model, String source) {

    public SchemaMapping {
        Objects.requireNonNull(model, "model is required");
        Objects.requireNonNull(source, "source is required");
    }
}
