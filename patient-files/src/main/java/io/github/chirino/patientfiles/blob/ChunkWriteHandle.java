package io.github.chirino.patientfiles.blob;

import io.github.chirino.patientfiles.store.BlobStorageException;
import io.github.chirino.patientfiles.store.ChunkStore;
import io.github.chirino.patientfiles.store.ChunkedObjectInfo;
import io.github.chirino.patientfiles.store.ObjectDescriptor;
import java.io.OutputStream;
import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * Write side of one chunked object. Bytes are buffered until a full chunk is available and then
 * flushed to the store with the next sequence index, so at most one chunk is held in memory.
 *
 * <p>Not thread-safe: one producer per object. After a store failure the handle refuses further
 * writes; chunks flushed before the failure stay in the store.
 */
public class ChunkWriteHandle extends OutputStream {

    private final ChunkStore store;
    private final String objectId;
    private final ObjectDescriptor descriptor;
    private final int chunkSize;
    private final long maxSize;
    private final byte[] buffer;

    private int buffered;
    private int nextIndex;
    private long length;
    private Instant uploadDate;
    private boolean finished;
    private boolean failed;

    ChunkWriteHandle(
            ChunkStore store,
            String objectId,
            ObjectDescriptor descriptor,
            int chunkSize,
            long maxSize) {
        this.store = store;
        this.objectId = objectId;
        this.descriptor = descriptor;
        this.chunkSize = chunkSize;
        this.maxSize = maxSize;
        this.buffer = new byte[chunkSize];
    }

    @Override
    public void write(int b) {
        write(new byte[] {(byte) b}, 0, 1);
    }

    @Override
    public void write(byte[] bytes, int off, int len) {
        Objects.checkFromIndexSize(off, len, bytes.length);
        checkWritable();
        if (length + len > maxSize) {
            failed = true;
            throw BlobStorageException.sizeExceeded(maxSize, length + len);
        }
        while (len > 0) {
            int n = Math.min(len, chunkSize - buffered);
            System.arraycopy(bytes, off, buffer, buffered, n);
            buffered += n;
            length += n;
            off += n;
            len -= n;
            if (buffered == chunkSize) {
                flushChunk();
            }
        }
    }

    /**
     * Flushes the partial last chunk and records the object's metadata. Calling it again returns
     * the same id without touching the store.
     */
    public String finish() {
        if (finished) {
            return objectId;
        }
        checkWritable();
        if (buffered > 0) {
            flushChunk();
        }
        uploadDate = Instant.now();
        try {
            store.finalizeObject(
                    new ChunkedObjectInfo(
                            objectId,
                            descriptor.fileName(),
                            descriptor.contentType(),
                            length,
                            chunkSize,
                            uploadDate,
                            descriptor.metadata()));
        } catch (RuntimeException e) {
            failed = true;
            throw e;
        }
        finished = true;
        return objectId;
    }

    /** Same as {@link #finish()}, so the handle works with try-with-resources. */
    @Override
    public void close() {
        if (!failed) {
            finish();
        }
    }

    private void flushChunk() {
        try {
            store.appendChunk(objectId, nextIndex, Arrays.copyOf(buffer, buffered));
        } catch (RuntimeException e) {
            failed = true;
            throw e;
        }
        nextIndex++;
        buffered = 0;
    }

    private void checkWritable() {
        if (failed) {
            throw new IllegalStateException("Write to object " + objectId + " already failed");
        }
        if (finished) {
            throw new IllegalStateException("Object " + objectId + " is already finished");
        }
    }

    public String getObjectId() {
        return objectId;
    }

    public long getLength() {
        return length;
    }

    /** Chunks flushed to the store so far. */
    public int getChunkCount() {
        return nextIndex;
    }

    public Instant getUploadDate() {
        return uploadDate;
    }

    public boolean isFinished() {
        return finished;
    }

    public boolean isFailed() {
        return failed;
    }
}
