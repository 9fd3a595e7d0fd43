package io.github.chirino.patientfiles.blob;

import io.github.chirino.patientfiles.store.ValidationException;
import java.lang.reflect.Array;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Checks caller-supplied file metadata. Keys are non-blank and usable as document field names;
 * values are strings, numbers, booleans, dates or lists of those. Dates become {@link Instant}s
 * and arrays become lists.
 */
final class UploadMetadata {

    static final String UPLOADED_BY = "uploadedBy";
    static final String UPLOAD_DATE = "uploadDate";
    static final String DEFAULT_UPLOADER = "system";

    private UploadMetadata() {}

    /** Normalized metadata with {@code uploadedBy} and {@code uploadDate} filled in if absent. */
    static Map<String, Object> forUpload(Map<String, Object> metadata, Instant now) {
        Map<String, Object> result = normalize(metadata);
        result.putIfAbsent(UPLOADED_BY, DEFAULT_UPLOADER);
        result.putIfAbsent(UPLOAD_DATE, now);
        return result;
    }

    static Map<String, Object> normalize(Map<String, Object> metadata) {
        Map<String, Object> result = new LinkedHashMap<>();
        if (metadata == null) {
            return result;
        }
        for (Map.Entry<String, Object> entry : metadata.entrySet()) {
            String key = entry.getKey();
            checkKey(key);
            result.put(key, normalizeValue(key, entry.getValue()));
        }
        return result;
    }

    private static void checkKey(String key) {
        if (key == null || key.isBlank()) {
            throw new ValidationException("Metadata keys must not be blank");
        }
        if (key.startsWith("$") || key.contains(".")) {
            throw new ValidationException("Invalid metadata key: " + key);
        }
    }

    private static Object normalizeValue(String key, Object value) {
        if (value instanceof Collection<?> collection) {
            List<Object> list = new ArrayList<>(collection.size());
            for (Object item : collection) {
                list.add(normalizeScalar(key, item));
            }
            return List.copyOf(list);
        }
        if (value != null && value.getClass().isArray() && !(value instanceof byte[])) {
            int length = Array.getLength(value);
            List<Object> list = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                list.add(normalizeScalar(key, Array.get(value, i)));
            }
            return List.copyOf(list);
        }
        return normalizeScalar(key, value);
    }

    private static Object normalizeScalar(String key, Object value) {
        if (value instanceof String || value instanceof Number || value instanceof Boolean) {
            return value;
        }
        if (value instanceof Instant) {
            return value;
        }
        if (value instanceof Date date) {
            return date.toInstant();
        }
        throw new ValidationException(
                "Unsupported value for metadata key "
                        + key
                        + ": "
                        + (value == null ? "null" : value.getClass().getSimpleName()));
    }
}
