package io.github.chirino.patientfiles.model;

import java.util.Objects;

/**
 * Pointer from a stage file entry to an object in the chunk store. The relation is weak: the
 * object may be deleted independently, so holders must not assume it still exists.
 */
public record ChunkedReference(String storeName, String objectId) {

    public ChunkedReference {
        Objects.requireNonNull(storeName, "storeName");
        Objects.requireNonNull(objectId, "objectId");
    }
}
