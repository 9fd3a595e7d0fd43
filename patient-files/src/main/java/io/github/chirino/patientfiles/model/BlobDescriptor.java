package io.github.chirino.patientfiles.model;

import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Describes one stored file. Exactly one of {@code inlinePayload} and {@code chunkedReference} is
 * set, matching {@code storageMode}.
 */
public record BlobDescriptor(
        String fileId,
        StorageMode storageMode,
        String contentType,
        String fileName,
        long size,
        Instant uploadDate,
        Map<String, Object> metadata,
        byte[] inlinePayload,
        ChunkedReference chunkedReference) {

    public BlobDescriptor {
        Objects.requireNonNull(fileId, "fileId");
        Objects.requireNonNull(storageMode, "storageMode");
        if (size < 0) {
            throw new IllegalArgumentException("size must not be negative: " + size);
        }
        switch (storageMode) {
            case INLINE -> {
                if (inlinePayload == null || chunkedReference != null) {
                    throw new IllegalArgumentException(
                            "Inline file " + fileId + " must carry a payload and no reference");
                }
            }
            case CHUNKED -> {
                if (chunkedReference == null || inlinePayload != null) {
                    throw new IllegalArgumentException(
                            "Chunked file " + fileId + " must carry a reference and no payload");
                }
            }
        }
        inlinePayload = inlinePayload == null ? null : inlinePayload.clone();
        metadata =
                metadata == null
                        ? Map.of()
                        : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static BlobDescriptor inline(
            String fileId,
            String contentType,
            String fileName,
            Instant uploadDate,
            Map<String, Object> metadata,
            byte[] payload) {
        return new BlobDescriptor(
                fileId,
                StorageMode.INLINE,
                contentType,
                fileName,
                payload.length,
                uploadDate,
                metadata,
                payload,
                null);
    }

    public static BlobDescriptor chunked(
            String fileId,
            String contentType,
            String fileName,
            long size,
            Instant uploadDate,
            Map<String, Object> metadata,
            ChunkedReference reference) {
        return new BlobDescriptor(
                fileId,
                StorageMode.CHUNKED,
                contentType,
                fileName,
                size,
                uploadDate,
                metadata,
                null,
                reference);
    }

    /** A copy of the embedded bytes, or null for a chunked file. */
    @Override
    public byte[] inlinePayload() {
        return inlinePayload == null ? null : inlinePayload.clone();
    }

    public boolean isInline() {
        return storageMode == StorageMode.INLINE;
    }

    /** Same file with its metadata replaced; payload and reference are untouched. */
    public BlobDescriptor withMetadata(Map<String, Object> newMetadata) {
        return new BlobDescriptor(
                fileId,
                storageMode,
                contentType,
                fileName,
                size,
                uploadDate,
                newMetadata,
                inlinePayload,
                chunkedReference);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof BlobDescriptor other)) {
            return false;
        }
        return size == other.size
                && fileId.equals(other.fileId)
                && storageMode == other.storageMode
                && Objects.equals(contentType, other.contentType)
                && Objects.equals(fileName, other.fileName)
                && Objects.equals(uploadDate, other.uploadDate)
                && metadata.equals(other.metadata)
                && Arrays.equals(inlinePayload, other.inlinePayload)
                && Objects.equals(chunkedReference, other.chunkedReference);
    }

    @Override
    public int hashCode() {
        int result =
                Objects.hash(
                        fileId,
                        storageMode,
                        contentType,
                        fileName,
                        size,
                        uploadDate,
                        metadata,
                        chunkedReference);
        return 31 * result + Arrays.hashCode(inlinePayload);
    }

    @Override
    public String toString() {
        return "BlobDescriptor[fileId="
                + fileId
                + ", storageMode="
                + storageMode
                + ", contentType="
                + contentType
                + ", fileName="
                + fileName
                + ", size="
                + size
                + (chunkedReference != null ? ", ref=" + chunkedReference.objectId() : "")
                + "]";
    }
}
