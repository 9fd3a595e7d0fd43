package io.github.chirino.patientfiles.blob;

import io.github.chirino.patientfiles.model.BlobDescriptor;
import io.github.chirino.patientfiles.model.ChunkedReference;
import java.util.Objects;

/** A file found in a stage: inline files carry their bytes, chunked ones a reference. */
public record ResolvedFile(BlobDescriptor descriptor) {

    public ResolvedFile {
        Objects.requireNonNull(descriptor, "descriptor");
    }

    public boolean isInline() {
        return descriptor.isInline();
    }

    public byte[] inlineBytes() {
        return descriptor.inlinePayload();
    }

    public ChunkedReference reference() {
        return descriptor.chunkedReference();
    }
}
