package io.github.chirino.patientfiles.store;

import io.github.chirino.patientfiles.model.AttachmentPoint;
import io.github.chirino.patientfiles.model.BlobDescriptor;
import io.github.chirino.patientfiles.model.Stage;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Parent document store holding the patient, episode, stage and file tree. Every mutating method
 * must be a single atomic conditional update on the patient record.
 */
public interface PatientRecordStore {

    boolean stageExists(AttachmentPoint point);

    /**
     * Appends the file to the stage's file list unless a file with the same id is already there.
     *
     * @return the stage after the update, or empty when nothing matched
     */
    Optional<Stage> pushFile(AttachmentPoint point, BlobDescriptor file);

    Optional<BlobDescriptor> findFile(AttachmentPoint point, String fileId);

    /** @return true if a file entry was removed */
    boolean pullFile(AttachmentPoint point, String fileId);

    /** Merges keys into the metadata of one file entry. @return true if the entry existed */
    boolean mergeFileMetadata(AttachmentPoint point, String fileId, Map<String, Object> metadata);

    /** Every file of the patient across episodes and stages, in document order. */
    List<BlobDescriptor> findFilesByPatient(String patientId);
}
