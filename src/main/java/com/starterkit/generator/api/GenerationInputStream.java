package com.starterkit.generator.api;

import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;

/**
 * Read side of a streamed generation. A failure on the writing thread is rethrown
 * to the reader as an {@link IOException} instead of a silent end of stream.
 */
final class GenerationInputStream extends FilterInputStream {

    private volatile Throwable failure;

    GenerationInputStream(InputStream in) {
        super(in);
    }

    void fail(Throwable t) {
        this.failure = t;
    }

    @Override
    public int read() throws IOException {
        int b;
        try {
            b = super.read();
        } catch (IOException e) {
            throw failureOr(e);
        }
        if (b == -1) {
            checkFailure();
        }
        return b;
    }

    @Override
    public int read(byte[] buffer, int off, int len) throws IOException {
        int n;
        try {
            n = super.read(buffer, off, len);
        } catch (IOException e) {
            throw failureOr(e);
        }
        if (n == -1) {
            checkFailure();
        }
        return n;
    }

    private void checkFailure() throws IOException {
        Throwable t = failure;
        if (t != null) {
            throw new IOException("Project generation failed: " + t.getMessage(), t);
        }
    }

    private IOException failureOr(IOException e) {
        Throwable t = failure;
        if (t == null) {
            return e;
        }
        IOException wrapped = new IOException("Project generation failed: " + t.getMessage(), t);
        wrapped.addSuppressed(e);
        return wrapped;
    }
}
