package com.starterkit.generator.archive;

import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;
import java.util.zip.Deflater;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * {@link ArchiveWriter} producing a ZIP archive on the caller's output stream.
 *
 * <p>File content is copied through a fixed-size buffer, so memory use does not depend on file
 * sizes. Writes block while the sink is not accepting data.</p>
 */
public class ZipArchiveWriter implements ArchiveWriter {

    public static final int DEFAULT_BUFFER_SIZE = 8192;

    private final CountingOutputStream counter;
    private final ZipOutputStream zip;
    private final byte[] buffer;
    private final Set<String> names = new HashSet<>();
    private long entryCount;
    private long uncompressedBytes;
    private boolean finished;

    public ZipArchiveWriter(OutputStream sink) {
        this(sink, Deflater.BEST_COMPRESSION, DEFAULT_BUFFER_SIZE);
    }

    public ZipArchiveWriter(OutputStream sink, int compressionLevel, int bufferSize) {
        Objects.requireNonNull(sink, "sink is required");
        if (compressionLevel < Deflater.NO_COMPRESSION || compressionLevel > Deflater.BEST_COMPRESSION) {
            throw new IllegalArgumentException("compressionLevel must be between 0 and 9, got " + compressionLevel);
        }
        if (bufferSize <= 0) {
            throw new IllegalArgumentException("bufferSize must be positive, got " + bufferSize);
        }
        this.counter = new CountingOutputStream(sink);
        this.zip = new ZipOutputStream(counter);
        this.zip.setLevel(compressionLevel);
        this.buffer = new byte[bufferSize];
    }

    @Override
    public boolean addDirectory(String name) throws IOException {
        if (!name.endsWith("/")) {
            throw new IllegalArgumentException("Directory entry name must end with '/': " + name);
        }
        if (!names.add(name)) {
            return false;
        }
        zip.putNextEntry(new ZipEntry(name));
        zip.closeEntry();
        entryCount++;
        return true;
    }

    @Override
    public boolean addFile(String name, Path source) throws IOException {
        if (!names.add(name)) {
            return false;
        }
        ZipEntry entry = new ZipEntry(name);
        entry.setLastModifiedTime(Files.getLastModifiedTime(source));
        zip.putNextEntry(entry);
        try (InputStream in = Files.newInputStream(source)) {
            int read;
            while ((read = in.read(buffer)) != -1) {
                zip.write(buffer, 0, read);
                uncompressedBytes += read;
            }
        }
        zip.closeEntry();
        entryCount++;
        return true;
    }

    @Override
    public boolean addBytes(String name, byte[] content) throws IOException {
        if (!names.add(name)) {
            return false;
        }
        zip.putNextEntry(new ZipEntry(name));
        zip.write(content);
        zip.closeEntry();
        uncompressedBytes += content.length;
        entryCount++;
        return true;
    }

    @Override
    public void finish() throws IOException {
        zip.finish();
        zip.flush();
        finished = true;
    }

    @Override
    public long getEntryCount() {
        return entryCount;
    }

    @Override
    public long getBytesWritten() {
        return counter.count;
    }

    @Override
    public long getUncompressedBytes() {
        return uncompressedBytes;
    }

    @Override
    public void close() throws IOException {
        if (!finished) {
            counter.discarding = true;
        }
        // Releases the deflater; the sink stays open
        zip.close();
    }

    /**
     * Counts bytes on their way to the sink. Never closes the sink; once discarding,
     * drops all further output so an abandoned archive is not completed.
     */
    private static final class CountingOutputStream extends FilterOutputStream {
        private long count;
        private boolean discarding;

        CountingOutputStream(OutputStream out) {
            super(out);
        }

        @Override
        public void write(int b) throws IOException {
            if (discarding) {
                return;
            }
            out.write(b);
            count++;
        }

        @Override
        public void write(byte[] b, int off, int len) throws IOException {
            if (discarding) {
                return;
            }
            out.write(b, off, len);
            count += len;
        }

        @Override
        public void flush() throws IOException {
            if (!discarding) {
                out.flush();
            }
        }

        @Override
        public void close() throws IOException {
            flush();
        }
    }
}
