package io.github.chirino.patientfiles.store;

/** One ordered segment of a chunked object. */
public record Chunk(String objectId, int sequenceIndex, byte[] bytes) {

    public int length() {
        return bytes.length;
    }
}
