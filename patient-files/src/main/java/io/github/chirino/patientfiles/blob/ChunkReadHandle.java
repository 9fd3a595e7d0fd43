package io.github.chirino.patientfiles.blob;

import io.github.chirino.patientfiles.store.BlobStorageException;
import io.github.chirino.patientfiles.store.Chunk;
import io.github.chirino.patientfiles.store.ChunkCursor;
import io.github.chirino.patientfiles.store.ChunkStore;
import io.github.chirino.patientfiles.store.ChunkedObjectInfo;
import java.io.Closeable;
import java.util.Iterator;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Read side of one chunked object. Chunks are pulled lazily from the store in ascending order and
 * checked against the recorded length and chunk size while they stream by: a gap, a duplicate, an
 * extra chunk or a chunk of the wrong size fails with {@link
 * BlobStorageException#CHUNK_SEQUENCE_ERROR} instead of producing truncated output.
 */
public class ChunkReadHandle implements Closeable {

    private final ChunkStore store;
    private final ChunkedObjectInfo info;
    private ChunkCursor cursor;
    private boolean started;
    private boolean closed;

    ChunkReadHandle(ChunkStore store, ChunkedObjectInfo info) {
        this.store = store;
        this.info = info;
    }

    public ChunkedObjectInfo getInfo() {
        return info;
    }

    /** The chunk payloads in order. Single pass: a second call fails. */
    public Iterator<byte[]> chunks() {
        if (started) {
            throw new IllegalStateException(
                    "Chunks of object " + info.objectId() + " were already read");
        }
        started = true;
        return new VerifyingIterator();
    }

    @Override
    public void close() {
        closed = true;
        if (cursor != null) {
            cursor.close();
            cursor = null;
        }
    }

    private final class VerifyingIterator implements Iterator<byte[]> {

        private final int expectedCount = info.expectedChunkCount();
        private int nextIndex;
        private long bytesRead;
        private boolean done;

        @Override
        public boolean hasNext() {
            if (done || closed) {
                return false;
            }
            if (cursor == null) {
                cursor = store.openChunks(info.objectId());
            }
            if (cursor.hasNext()) {
                return true;
            }
            done = true;
            close();
            if (nextIndex < expectedCount || bytesRead != info.length()) {
                throw error(
                        "missing chunk " + nextIndex + " of " + expectedCount,
                        Map.of("expectedIndex", nextIndex, "bytesRead", bytesRead));
            }
            return false;
        }

        @Override
        public byte[] next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            Chunk chunk = cursor.next();
            int index = chunk.sequenceIndex();
            if (index != nextIndex) {
                fail(
                        index < nextIndex
                                ? "duplicate chunk " + index
                                : "missing chunk " + nextIndex + " (next stored chunk is " + index
                                        + ")",
                        Map.of("expectedIndex", nextIndex, "actualIndex", index));
            }
            if (index >= expectedCount) {
                fail(
                        "unexpected chunk " + index + " beyond the " + expectedCount + " expected",
                        Map.of("actualIndex", index, "expectedCount", expectedCount));
            }
            long expectedLength =
                    index == expectedCount - 1
                            ? info.length() - (long) index * info.chunkSize()
                            : info.chunkSize();
            if (chunk.length() != expectedLength) {
                fail(
                        "chunk " + index + " has " + chunk.length() + " bytes, expected "
                                + expectedLength,
                        Map.of("index", index, "length", chunk.length()));
            }
            nextIndex++;
            bytesRead += chunk.length();
            return chunk.bytes();
        }

        private void fail(String message, Map<String, Object> details) {
            done = true;
            close();
            throw error(message, details);
        }

        private BlobStorageException error(String message, Map<String, Object> details) {
            return BlobStorageException.chunkSequenceError(info.objectId(), message, details);
        }
    }
}
