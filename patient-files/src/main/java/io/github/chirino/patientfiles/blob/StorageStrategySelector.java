package io.github.chirino.patientfiles.blob;

import io.github.chirino.patientfiles.config.BlobStorageConfig;
import io.github.chirino.patientfiles.model.SourceEncoding;
import io.github.chirino.patientfiles.model.StorageMode;
import io.github.chirino.patientfiles.store.ValidationException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.Locale;

/**
 * Chooses inline or chunked storage from the payload size. Sizes at or below the threshold of the
 * upload path stay inline. Raw uploads and base64 uploads have separate thresholds; for base64 the
 * size is the estimate {@code length * 3 / 4}.
 */
@ApplicationScoped
public class StorageStrategySelector {

    private final BlobStorageConfig config;

    @Inject
    public StorageStrategySelector(BlobStorageConfig config) {
        this.config = config;
    }

    public StorageMode decide(long payloadSizeBytes, SourceEncoding sourceEncoding) {
        if (payloadSizeBytes < 0) {
            throw new IllegalArgumentException("payload size must not be negative");
        }
        return payloadSizeBytes <= thresholdFor(sourceEncoding)
                ? StorageMode.INLINE
                : StorageMode.CHUNKED;
    }

    public long thresholdFor(SourceEncoding sourceEncoding) {
        return switch (sourceEncoding) {
            case RAW -> config.getInlineThreshold();
            case BASE64 -> config.getBase64InlineThreshold();
        };
    }

    /** Fails with {@link ValidationException#UNSUPPORTED_MEDIA_TYPE} for disallowed types. */
    public void validateContentType(String contentType) {
        if (!isAllowed(contentType)) {
            throw ValidationException.unsupportedMediaType(contentType);
        }
    }

    public boolean isAllowed(String contentType) {
        String normalized = normalize(contentType);
        return normalized != null && config.getAllowedContentTypes().contains(normalized);
    }

    // "image/PNG; charset=binary" -> "image/png"
    static String normalize(String contentType) {
        if (contentType == null) {
            return null;
        }
        int semicolon = contentType.indexOf(';');
        String base = semicolon >= 0 ? contentType.substring(0, semicolon) : contentType;
        base = base.trim().toLowerCase(Locale.ROOT);
        return base.isEmpty() ? null : base;
    }
}
