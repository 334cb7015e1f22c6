package com.starterkit.generator.archive;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * The complete, validated list of entries to write, computed before the archive stream opens.
 * Exactly one entry per path.
 *
 * @param rootFolder the top-level folder every entry is written under
 * @param entries    entries in write order
 */
public record ArchivePlan(String rootFolder, List<Entry> entries) {

    public ArchivePlan {
        Objects.requireNonNull(rootFolder, "rootFolder is required");
        entries = entries != null ? List.copyOf(entries) : List.of();
    }

    public int count(Origin origin) {
        return (int) entries.stream().filter(e -> e.origin() == origin).count();
    }

    public enum Origin { BASE, OVERLAY, GENERATED }

    /**
     * One file of the archive: either a file on disk or generated content.
     *
     * @param path    path relative to the root folder
     * @param origin  where the content comes from
     * @param source  file to copy, null for generated content
     * @param content generated content, null for copied files
     */
    public record Entry(String path, Origin origin, Path source, byte[] content) {

        public Entry {
            Objects.requireNonNull(path, "path is required");
            Objects.requireNonNull(origin, "origin is required");
            if ((source == null) == (content == null)) {
                throw new IllegalArgumentException("Exactly one of source or content is required for " + path);
            }
        }

        static Entry file(String path, Origin origin, Path source) {
            return new Entry(path, origin, source, null);
        }

        static Entry generated(String path, byte[] content) {
            return new Entry(path, Origin.GENERATED, null, content);
        }
    }
}
