package com.starterkit.generator.template;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Name-based exclusion rules applied while walking the base template.
 * Rules match a single path segment, so an excluded directory is pruned at any depth.
 * File rules may be globs such as {@code *.log}.
 */
public final class PathFilter {

    public static final Set<String> DEFAULT_EXCLUDED_DIRECTORIES = Set.of(
            "node_modules", ".git", "dist", "build", ".next", ".turbo",
            "coverage", ".nyc_output", "_preview");

    public static final Set<String> DEFAULT_EXCLUDED_FILES = Set.of(
            ".env", ".env.local", ".env.development", ".env.production",
            ".DS_Store", "Thumbs.db", "*.log",
            "preview-banner.tsx", "preview-wrapper.tsx", "preview-context.tsx");

    private static final PathFilter ACCEPT_ALL = new PathFilter(Set.of(), Set.of());

    private final Set<String> excludedDirectories;
    private final Set<String> excludedFileNames;
    private final List<PathMatcher> excludedFilePatterns;

    private PathFilter(Collection<String> excludedDirectories, Collection<String> excludedFiles) {
        this.excludedDirectories = Set.copyOf(excludedDirectories);
        Set<String> names = new LinkedHashSet<>();
        List<PathMatcher> patterns = new ArrayList<>();
        for (String rule : excludedFiles) {
            if (rule.indexOf('*') >= 0 || rule.indexOf('?') >= 0) {
                patterns.add(FileSystems.getDefault().getPathMatcher("glob:" + rule));
            } else {
                names.add(rule);
            }
        }
        this.excludedFileNames = Set.copyOf(names);
        this.excludedFilePatterns = List.copyOf(patterns);
    }

    public static PathFilter of(Collection<String> excludedDirectories, Collection<String> excludedFiles) {
        return new PathFilter(excludedDirectories, excludedFiles);
    }

    public static PathFilter defaults() {
        return new PathFilter(DEFAULT_EXCLUDED_DIRECTORIES, DEFAULT_EXCLUDED_FILES);
    }

    public static PathFilter acceptAll() {
        return ACCEPT_ALL;
    }

    public boolean isExcludedDirectory(String name) {
        return excludedDirectories.contains(name);
    }

    public boolean isExcludedFile(String name) {
        if (excludedFileNames.contains(name)) {
            return true;
        }
        Path fileName = Path.of(name);
        for (PathMatcher matcher : excludedFilePatterns) {
            if (matcher.matches(fileName)) {
                return true;
            }
        }
        return false;
    }
}
