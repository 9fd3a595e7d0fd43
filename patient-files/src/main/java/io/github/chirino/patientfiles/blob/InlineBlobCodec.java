package io.github.chirino.patientfiles.blob;

import io.github.chirino.patientfiles.model.BlobDescriptor;
import jakarta.enterprise.context.ApplicationScoped;
import java.time.Instant;
import java.util.Arrays;
import java.util.Map;

/**
 * Wraps small payloads for embedding in the patient record. Enforces no size limit; keeping inline
 * payloads small is the job of {@link StorageStrategySelector}.
 */
@ApplicationScoped
public class InlineBlobCodec {

    public BlobDescriptor encode(
            String fileId,
            byte[] bytes,
            String contentType,
            String fileName,
            Map<String, Object> metadata) {
        return encode(fileId, bytes, contentType, fileName, metadata, Instant.now());
    }

    BlobDescriptor encode(
            String fileId,
            byte[] bytes,
            String contentType,
            String fileName,
            Map<String, Object> metadata,
            Instant uploadDate) {
        return BlobDescriptor.inline(
                fileId,
                contentType,
                fileName,
                uploadDate,
                metadata,
                Arrays.copyOf(bytes, bytes.length));
    }

    public byte[] decode(BlobDescriptor descriptor) {
        if (!descriptor.isInline()) {
            throw new IllegalArgumentException(
                    "File " + descriptor.fileId() + " is not stored inline");
        }
        return descriptor.inlinePayload();
    }
}
