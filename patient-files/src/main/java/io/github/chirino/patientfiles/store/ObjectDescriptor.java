package io.github.chirino.patientfiles.store;

import java.util.Map;

/** What a chunked object is about to hold, known before its first byte is written. */
public record ObjectDescriptor(String fileName, String contentType, Map<String, Object> metadata) {

    public ObjectDescriptor {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}
