package io.github.chirino.patientfiles.blob;

import io.github.chirino.patientfiles.config.BlobStorageConfig;
import io.github.chirino.patientfiles.config.ChunkStoreSelector;
import io.github.chirino.patientfiles.store.ChunkStore;
import io.github.chirino.patientfiles.store.ObjectDescriptor;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

@ApplicationScoped
public class ChunkedBlobWriter {

    private static final Logger LOG = Logger.getLogger(ChunkedBlobWriter.class);

    private final ChunkStore chunkStore;
    private final BlobStorageConfig config;

    @Inject
    public ChunkedBlobWriter(ChunkStoreSelector chunkStoreSelector, BlobStorageConfig config) {
        this(chunkStoreSelector.getChunkStore(), config);
    }

    public ChunkedBlobWriter(ChunkStore chunkStore, BlobStorageConfig config) {
        this.chunkStore = chunkStore;
        this.config = config;
    }

    public ChunkWriteHandle open(ObjectDescriptor descriptor) {
        return new ChunkWriteHandle(
                chunkStore,
                chunkStore.newObjectId(),
                descriptor,
                config.getChunkSize(),
                config.getMaxSize());
    }

    public void write(ChunkWriteHandle handle, byte[] bytes) {
        handle.write(bytes, 0, bytes.length);
    }

    public String finish(ChunkWriteHandle handle) {
        String objectId = handle.finish();
        LOG.debugf(
                "Finished object %s: %d bytes in %d chunks",
                objectId, handle.getLength(), handle.getChunkCount());
        return objectId;
    }

    /**
     * Best-effort removal of what a handle has flushed so far, for uploads rejected after writing
     * started. Failures are logged; the chunks are then left for the orphan sweep.
     */
    public void discard(ChunkWriteHandle handle) {
        if (handle.getChunkCount() == 0 && !handle.isFinished()) {
            return;
        }
        try {
            chunkStore.deleteObject(handle.getObjectId());
        } catch (RuntimeException e) {
            LOG.warnf(
                    "Failed to discard chunks of object %s: %s",
                    handle.getObjectId(), e.getMessage());
        }
    }

    public int chunkSize() {
        return config.getChunkSize();
    }

    public long maxSize() {
        return config.getMaxSize();
    }

    public String storeName() {
        return chunkStore.storeName();
    }
}
