package io.github.chirino.patientfiles.blob;

import io.github.chirino.patientfiles.store.ValidationException;
import java.util.Map;

public record UploadRequest(
        String fileId, String contentType, String fileName, Map<String, Object> metadata) {

    public UploadRequest {
        if (fileId == null || fileId.isBlank()) {
            throw new ValidationException("fileId is required");
        }
        if (contentType == null || contentType.isBlank()) {
            throw new ValidationException("contentType is required");
        }
        if (fileName == null || fileName.isBlank()) {
            fileName = fileId;
        }
    }

    public static UploadRequest of(String fileId, String contentType, String fileName) {
        return new UploadRequest(fileId, contentType, fileName, null);
    }
}
