package com.starterkit.generator.archive;

import com.starterkit.generator.api.GenerationException;

/**
 * I/O failure while streaming the archive, including a sink that was closed by the client.
 * The archive written so far is incomplete and must be discarded.
 */
public class ArchiveWriteException extends GenerationException {

    private final String entryName;

    public ArchiveWriteException(String message, String entryName, Throwable cause) {
        super(message, cause);
        this.entryName = entryName;
    }

    /**
     * Name of the entry being written when the failure occurred, or null if it happened outside an entry.
     */
    public String getEntryName() {
        return entryName;
    }
}
