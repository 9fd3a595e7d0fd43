package io.github.chirino.patientfiles.blob;

import io.github.chirino.patientfiles.model.StorageMode;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;

/** The payload of a fetched file. Chunked content streams from the store and must be closed. */
public record FileContent(
        InputStream stream, String contentType, String fileName, long size, StorageMode mode)
        implements Closeable {

    public byte[] readAllBytes() throws IOException {
        try (InputStream in = stream) {
            return in.readAllBytes();
        }
    }

    @Override
    public void close() throws IOException {
        stream.close();
    }
}
