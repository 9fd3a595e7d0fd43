package io.github.chirino.patientfiles.store;

/**
 * Caller mistake detected before any store mutation: a missing identifier, a disallowed content
 * type or malformed upload metadata. Never retried.
 */
public class ValidationException extends RuntimeException {

    public static final String VALIDATION_ERROR = "validation_error";

    /** Content type outside the allowed set. Suggested HTTP status: 415. */
    public static final String UNSUPPORTED_MEDIA_TYPE = "unsupported_media_type";

    private final String code;

    public ValidationException(String message) {
        this(VALIDATION_ERROR, message);
    }

    public ValidationException(String code, String message) {
        super(message);
        this.code = code;
    }

    public static ValidationException unsupportedMediaType(String contentType) {
        return new ValidationException(
                UNSUPPORTED_MEDIA_TYPE,
                "Invalid file type "
                        + contentType
                        + ". Only PDF, JPEG, PNG, GIF allowed.");
    }

    public String getCode() {
        return code;
    }
}
