package io.github.chirino.patientfiles.store;

import java.util.Optional;

/**
 * External store of ordered binary segments addressed by object id and sequence index.
 *
 * <p>Implementations translate transport failures into {@link BlobStorageException} with code
 * {@link BlobStorageException#STORAGE_UNAVAILABLE}.
 */
public interface ChunkStore {

    /** Name recorded in {@code ChunkedReference.storeName} for objects of this store. */
    String storeName();

    /** Allocates an opaque identifier for a new object. Nothing is written yet. */
    String newObjectId();

    void appendChunk(String objectId, int sequenceIndex, byte[] bytes);

    /**
     * Records the metadata of a fully written object. Idempotent: finalizing the same object again
     * replaces the record with identical content.
     */
    void finalizeObject(ChunkedObjectInfo info);

    Optional<ChunkedObjectInfo> findObject(String objectId);

    ChunkCursor openChunks(String objectId);

    /** Removes every chunk of the object and its metadata. Unknown objects are ignored. */
    void deleteObject(String objectId);
}
