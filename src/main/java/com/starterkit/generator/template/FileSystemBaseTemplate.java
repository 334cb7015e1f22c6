package com.starterkit.generator.template;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * {@link BaseTemplate} backed by a directory on the local filesystem.
 *
 * <p>The repository root holds {@code modules/} and {@code core/}; the template root is
 * the base project copied into every archive, usually {@code core/base-template}
 * inside the repository.</p>
 */
public class FileSystemBaseTemplate implements BaseTemplate {
    private static final Logger log = LoggerFactory.getLogger(FileSystemBaseTemplate.class);

    private static final List<String> REPOSITORY_PREFIXES = List.of("modules/", "core/");

    private final Path repositoryRoot;
    private final Path templateRoot;

    public FileSystemBaseTemplate(Path repositoryRoot, Path templateRoot) {
        this.repositoryRoot = Objects.requireNonNull(repositoryRoot, "repositoryRoot is required")
                .toAbsolutePath().normalize();
        this.templateRoot = Objects.requireNonNull(templateRoot, "templateRoot is required")
                .toAbsolutePath().normalize();
    }

    /**
     * Template at {@code core/base-template} inside the given repository.
     */
    public static FileSystemBaseTemplate inRepository(Path repositoryRoot) {
        return new FileSystemBaseTemplate(repositoryRoot, repositoryRoot.resolve("core").resolve("base-template"));
    }

    @Override
    public Path getRoot() {
        return templateRoot;
    }

    public Path getRepositoryRoot() {
        return repositoryRoot;
    }

    @Override
    public Optional<String> readFile(String relativePath) {
        return read(PathSanitizer.resolveWithin(templateRoot, relativePath, "template path"));
    }

    @Override
    public Path resolveSource(String source) {
        String normalized = source == null ? null : source.replace('\\', '/');
        if (normalized != null && REPOSITORY_PREFIXES.stream().anyMatch(normalized::startsWith)) {
            return PathSanitizer.resolveWithin(repositoryRoot, normalized, "mapping source");
        }
        return PathSanitizer.resolveWithin(templateRoot, normalized, "mapping source");
    }

    @Override
    public Optional<String> readSource(String source) {
        return read(resolveSource(source));
    }

    @Override
    public Map<String, Path> listFiles(Path directory, PathFilter filter) {
        // Sorted by relative name so entry order is stable across filesystems
        Map<String, Path> files = new TreeMap<>();
        try {
            Files.walkFileTree(directory, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (!dir.equals(directory) && filter.isExcludedDirectory(dir.getFileName().toString())) {
                        log.trace("template.pruned directory={}", dir);
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isSymbolicLink() && !isFileLinkWithinRepository(file)) {
                        log.debug("template.skipped link={}", file);
                        return FileVisitResult.CONTINUE;
                    }
                    if (!attrs.isRegularFile() && !attrs.isSymbolicLink()) {
                        log.debug("template.skipped special={}", file);
                        return FileVisitResult.CONTINUE;
                    }
                    if (filter.isExcludedFile(file.getFileName().toString())) {
                        log.trace("template.skipped file={}", file);
                        return FileVisitResult.CONTINUE;
                    }
                    files.put(relativeName(directory, file), file);
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            throw new BaseTemplateException("Failed to walk template directory " + directory, e);
        }
        log.debug("template.walked directory={} files={}", directory, files.size());
        return new LinkedHashMap<>(files);
    }

    /**
     * Links are listed only when they resolve to a regular file inside the repository.
     * Linked directories are never followed.
     */
    private boolean isFileLinkWithinRepository(Path link) {
        try {
            Path target = link.toRealPath();
            return Files.isRegularFile(target) && target.startsWith(repositoryRoot.toRealPath());
        } catch (IOException e) {
            log.debug("template.brokenLink link={} reason={}", link, e.getMessage());
            return false;
        }
    }

    private static String relativeName(Path root, Path file) {
        return root.relativize(file).toString().replace('\\', '/');
    }

    private static Optional<String> read(Path path) {
        try {
            return Optional.of(Files.readString(path, StandardCharsets.UTF_8));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new BaseTemplateException("Could not read " + path, e);
        }
    }
}
