package com.starterkit.generator.archive;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Streaming writer for a compressed archive. Entries are written in call order
 * and a name is written at most once.
 *
 * <p>{@link #close()} without a prior {@link #finish()} abandons the archive: nothing more is
 * written to the sink, which is left holding an incomplete archive. The sink itself is never closed.</p>
 */
public interface ArchiveWriter extends Closeable {

    /**
     * Writes a directory entry; the name must end with {@code /}.
     *
     * @return false if an entry with this name was already written
     */
    boolean addDirectory(String name) throws IOException;

    /**
     * Streams a file from disk into a new entry.
     *
     * @return false if an entry with this name was already written
     */
    boolean addFile(String name, Path source) throws IOException;

    /**
     * Writes in-memory content into a new entry.
     *
     * @return false if an entry with this name was already written
     */
    boolean addBytes(String name, byte[] content) throws IOException;

    /**
     * Completes the archive and flushes the sink.
     */
    void finish() throws IOException;

    long getEntryCount();

    long getBytesWritten();

    long getUncompressedBytes();
}
