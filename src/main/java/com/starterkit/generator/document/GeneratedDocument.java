package com.starterkit.generator.document;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * A file produced by the generator rather than copied from disk.
 *
 * @param path    archive path relative to the project root folder
 * @param content UTF-8 text content
 */
public record GeneratedDocument(String path, String content) {

    public GeneratedDocument {
        Objects.requireNonNull(path, "path is required");
        Objects.requireNonNull(content, "content is required");
    }

    public byte[] bytes() {
        return content.getBytes(StandardCharsets.UTF_8);
    }
}
