package io.github.chirino.patientfiles.blob;

import io.github.chirino.patientfiles.config.ChunkStoreSelector;
import io.github.chirino.patientfiles.model.ChunkedReference;
import io.github.chirino.patientfiles.store.ChunkStore;
import io.github.chirino.patientfiles.store.ChunkedObjectInfo;
import io.github.chirino.patientfiles.store.ResourceNotFoundException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.io.InputStream;
import java.util.Iterator;

@ApplicationScoped
public class ChunkedBlobReader {

    private final ChunkStore chunkStore;

    @Inject
    public ChunkedBlobReader(ChunkStoreSelector chunkStoreSelector) {
        this(chunkStoreSelector.getChunkStore());
    }

    public ChunkedBlobReader(ChunkStore chunkStore) {
        this.chunkStore = chunkStore;
    }

    /**
     * Opens the object a stage file entry points at.
     *
     * @throws ResourceNotFoundException if the reference names another store or the object is gone
     */
    public ChunkReadHandle open(ChunkedReference reference) {
        if (!chunkStore.storeName().equals(reference.storeName())) {
            throw new ResourceNotFoundException(
                    "chunked object", reference.storeName() + "/" + reference.objectId());
        }
        return open(reference.objectId());
    }

    /** @throws ResourceNotFoundException if the store has no such object */
    public ChunkReadHandle open(String objectId) {
        return new ChunkReadHandle(chunkStore, info(objectId));
    }

    public Iterator<byte[]> read(ChunkReadHandle handle) {
        return handle.chunks();
    }

    public InputStream openStream(String objectId) {
        return new ChunkSequenceInputStream(open(objectId));
    }

    public ChunkedObjectInfo info(String objectId) {
        return chunkStore
                .findObject(objectId)
                .orElseThrow(() -> new ResourceNotFoundException("chunked object", objectId));
    }
}
