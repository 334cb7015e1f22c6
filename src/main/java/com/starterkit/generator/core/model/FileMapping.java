package com.starterkit.generator.core.model;

import java.util.Objects;

/**
 * Copies a file or directory from the template repository into the generated project.
 *
 * @param source      source path; {@code modules/} and {@code core/} prefixes resolve against the
 *                    repository root, anything else against the base template root
 * @param destination destination path relative to the generated project root
 */
public record FileMapping(String source, String destination) {

    public FileMapping {
        Objects.requireNonNull(source, "source is required");
        Objects.requireNonNull(destination, "destination is required");
    }
}
