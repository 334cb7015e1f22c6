package com.starterkit.generator.document;

/**
 * Produces one generated file of the project archive.
 * Implementations are stateless and safe to share between concurrent generations.
 */
public interface DocumentGenerator {

    /**
     * Archive path of the produced file, relative to the project root folder.
     */
    String path();

    GeneratedDocument generate(DocumentContext context);
}
