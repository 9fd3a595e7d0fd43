package io.github.chirino.patientfiles.store;

import java.time.Instant;
import java.util.Map;

/** Metadata the chunk store keeps for a finalized object. */
public record ChunkedObjectInfo(
        String objectId,
        String fileName,
        String contentType,
        long length,
        int chunkSize,
        Instant uploadDate,
        Map<String, Object> metadata) {

    public ChunkedObjectInfo {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    /** Number of chunks an object of this length must have. */
    public int expectedChunkCount() {
        if (length == 0) {
            return 0;
        }
        return (int) ((length + chunkSize - 1) / chunkSize);
    }
}
