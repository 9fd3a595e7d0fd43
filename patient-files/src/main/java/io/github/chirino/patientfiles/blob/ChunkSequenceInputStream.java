package io.github.chirino.patientfiles.blob;

import java.io.InputStream;
import java.util.Iterator;
import java.util.Objects;

/** Presents the chunks of a {@link ChunkReadHandle} as one byte stream. */
public class ChunkSequenceInputStream extends InputStream {

    private final ChunkReadHandle handle;
    private final Iterator<byte[]> chunks;
    private byte[] current;
    private int pos;

    public ChunkSequenceInputStream(ChunkReadHandle handle) {
        this.handle = handle;
        this.chunks = handle.chunks();
    }

    @Override
    public int read() {
        if (!fill()) {
            return -1;
        }
        return current[pos++] & 0xff;
    }

    @Override
    public int read(byte[] b, int off, int len) {
        Objects.checkFromIndexSize(off, len, b.length);
        if (len == 0) {
            return 0;
        }
        if (!fill()) {
            return -1;
        }
        int n = Math.min(len, current.length - pos);
        System.arraycopy(current, pos, b, off, n);
        pos += n;
        return n;
    }

    @Override
    public int available() {
        return current == null ? 0 : current.length - pos;
    }

    @Override
    public void close() {
        handle.close();
    }

    private boolean fill() {
        while (current == null || pos >= current.length) {
            if (!chunks.hasNext()) {
                current = null;
                return false;
            }
            current = chunks.next();
            pos = 0;
        }
        return true;
    }
}
