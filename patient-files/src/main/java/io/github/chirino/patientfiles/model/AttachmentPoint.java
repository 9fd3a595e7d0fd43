package io.github.chirino.patientfiles.model;

import io.github.chirino.patientfiles.store.ValidationException;

/** The (patient, episode, stage) coordinate of the stage that owns a file list. */
public record AttachmentPoint(String patientId, String episodeId, String stageId) {

    public AttachmentPoint {
        requireId("patientId", patientId);
        requireId("episodeId", episodeId);
        requireId("stageId", stageId);
    }

    public static AttachmentPoint of(String patientId, String episodeId, String stageId) {
        return new AttachmentPoint(patientId, episodeId, stageId);
    }

    static void requireId(String name, String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(name + " is required");
        }
    }

    @Override
    public String toString() {
        return patientId + "/" + episodeId + "/" + stageId;
    }
}
