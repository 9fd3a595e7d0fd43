package io.github.chirino.patientfiles.model;

/** How an uploaded payload reaches the engine. */
public enum SourceEncoding {
    /** Already decoded binary (multipart upload, byte stream). */
    RAW,
    /** Base64 text embedded in a JSON document; the decoded size is only estimated up front. */
    BASE64
}
