package com.starterkit.generator.template;

import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/**
 * Read access to the base template directory and to the feature module sources
 * that overlays and schema fragments point at.
 */
public interface BaseTemplate {

    /**
     * Root directory of the base template tree.
     */
    Path getRoot();

    /**
     * Reads a UTF-8 file relative to the template root.
     *
     * @return the content, or empty if the file does not exist
     * @throws BaseTemplateException if the file exists but cannot be read
     */
    Optional<String> readFile(String relativePath);

    /**
     * Resolves a mapping source path. Sources under {@code modules/} or {@code core/}
     * resolve against the repository root; anything else resolves against the template root.
     *
     * @throws BaseTemplateException if the source escapes its root
     */
    Path resolveSource(String source);

    /**
     * Reads a mapping source as UTF-8 text.
     *
     * @return the content, or empty if the source does not exist
     * @throws BaseTemplateException if the source exists but cannot be read
     */
    Optional<String> readSource(String source);

    /**
     * Lists the regular files under a directory, keyed by forward-slash path relative to it,
     * in sorted walk order. Excluded directories are not descended into.
     *
     * @throws BaseTemplateException if the directory cannot be walked
     */
    Map<String, Path> listFiles(Path directory, PathFilter filter);
}
