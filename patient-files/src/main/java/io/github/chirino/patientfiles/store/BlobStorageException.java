package io.github.chirino.patientfiles.store;

import java.util.Map;

/**
 * Exception thrown by the blob engine and its store collaborators. Carries an error code, HTTP
 * status, and optional details map so an HTTP layer can forward errors to API users without
 * branching on types.
 */
public class BlobStorageException extends RuntimeException {

    /** Payload exceeds the maximum the chunked path accepts. Suggested HTTP status: 413. */
    public static final String FILE_TOO_LARGE = "file_too_large";

    /** Malformed base64 alphabet or padding. Suggested HTTP status: 400. */
    public static final String DECODE_ERROR = "decode_error";

    /** Store unreachable or a write failed mid-stream. Suggested HTTP status: 503. */
    public static final String STORAGE_UNAVAILABLE = "storage_unavailable";

    /** Stored chunks do not reassemble into the recorded object. Suggested HTTP status: 500. */
    public static final String CHUNK_SEQUENCE_ERROR = "chunk_sequence_error";

    private final String code;
    private final int httpStatus;
    private final Map<String, Object> details;

    public BlobStorageException(String code, int httpStatus, String message) {
        this(code, httpStatus, message, Map.of(), null);
    }

    public BlobStorageException(
            String code,
            int httpStatus,
            String message,
            Map<String, Object> details,
            Throwable cause) {
        super(message, cause);
        this.code = code;
        this.httpStatus = httpStatus;
        this.details = details != null ? details : Map.of();
    }

    public static BlobStorageException sizeExceeded(long maxBytes, long actualBytes) {
        return new BlobStorageException(
                FILE_TOO_LARGE,
                413,
                "File too large: "
                        + actualBytes
                        + " bytes exceeds maximum of "
                        + maxBytes
                        + " bytes",
                Map.of("maxBytes", maxBytes, "actualBytes", actualBytes),
                null);
    }

    public static BlobStorageException decodeError(String message, Throwable cause) {
        return new BlobStorageException(DECODE_ERROR, 400, message, Map.of(), cause);
    }

    public static BlobStorageException storageUnavailable(String message, Throwable cause) {
        return new BlobStorageException(STORAGE_UNAVAILABLE, 503, message, Map.of(), cause);
    }

    public static BlobStorageException chunkSequenceError(
            String objectId, String message, Map<String, Object> details) {
        return new BlobStorageException(
                CHUNK_SEQUENCE_ERROR,
                500,
                "Cannot reassemble object " + objectId + ": " + message,
                details,
                null);
    }

    public String getCode() {
        return code;
    }

    public int getHttpStatus() {
        return httpStatus;
    }

    public Map<String, Object> getDetails() {
        return details;
    }
}
