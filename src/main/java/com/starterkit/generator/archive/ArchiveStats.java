package com.starterkit.generator.archive;

/**
 * Summary of one written archive.
 *
 * @param rootFolder        name of the single top-level folder
 * @param entries           number of entries written, directory entry included
 * @param bytesWritten      compressed bytes written to the sink
 * @param uncompressedBytes total size of the file contents
 * @param baseFiles         files copied from the base template
 * @param overlayFiles      files copied from feature overlays
 * @param generatedFiles    generated documents
 */
public record ArchiveStats(
        String rootFolder,
        long entries,
        long bytesWritten,
        long uncompressedBytes,
        int baseFiles,
        int overlayFiles,
        int generatedFiles
) {
}
