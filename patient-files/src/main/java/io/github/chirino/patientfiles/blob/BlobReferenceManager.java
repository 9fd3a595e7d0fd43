package io.github.chirino.patientfiles.blob;

import io.github.chirino.patientfiles.config.ChunkStoreSelector;
import io.github.chirino.patientfiles.model.AttachmentPoint;
import io.github.chirino.patientfiles.model.BlobDescriptor;
import io.github.chirino.patientfiles.model.ChunkedReference;
import io.github.chirino.patientfiles.model.Stage;
import io.github.chirino.patientfiles.store.ChunkStore;
import io.github.chirino.patientfiles.store.PatientRecordStore;
import io.github.chirino.patientfiles.store.ResourceConflictException;
import io.github.chirino.patientfiles.store.ResourceNotFoundException;
import io.github.chirino.patientfiles.store.ValidationException;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.jboss.logging.Logger;

/**
 * Attaches file descriptors to patient stages and removes them again. All changes to a stage's
 * file list go through single conditional updates of the patient record.
 */
@ApplicationScoped
public class BlobReferenceManager {

    private static final Logger LOG = Logger.getLogger(BlobReferenceManager.class);

    static final String DELETE_FAILURES_METRIC = "patient.files.chunk.delete.failures";

    private final PatientRecordStore records;
    private final ChunkStore chunkStore;
    private final MeterRegistry registry;

    @Inject
    public BlobReferenceManager(
            PatientRecordStore records,
            ChunkStoreSelector chunkStoreSelector,
            MeterRegistry registry) {
        this(records, chunkStoreSelector.getChunkStore(), registry);
    }

    public BlobReferenceManager(
            PatientRecordStore records, ChunkStore chunkStore, MeterRegistry registry) {
        this.records = records;
        this.chunkStore = chunkStore;
        this.registry = registry;
    }

    /**
     * @throws ResourceNotFoundException if the stage does not exist
     * @throws ResourceConflictException if the stage already has a file with the same id
     */
    public Stage attach(AttachmentPoint point, BlobDescriptor descriptor) {
        Optional<Stage> stage = records.pushFile(point, descriptor);
        if (stage.isPresent()) {
            LOG.debugf("Attached %s to stage %s", descriptor, point);
            return stage.get();
        }
        // the conditional push matched nothing: tell a missing stage from a duplicate id
        if (!records.stageExists(point)) {
            throw new ResourceNotFoundException("stage", point.toString());
        }
        throw duplicateFile(point, descriptor.fileId());
    }

    public ResolvedFile resolve(AttachmentPoint point, String fileId) {
        return records.findFile(point, fileId)
                .map(ResolvedFile::new)
                .orElseThrow(() -> new ResourceNotFoundException("file", fileId));
    }

    /**
     * Deletes the file's chunks, if any, and then removes its descriptor from the stage. A failed
     * chunk delete is logged and counted under {@code patient.files.chunk.delete.failures}; it
     * does not keep the descriptor.
     *
     * @return false if the stage has no such file
     */
    public boolean detach(AttachmentPoint point, String fileId) {
        Optional<BlobDescriptor> file = records.findFile(point, fileId);
        if (file.isEmpty()) {
            return false;
        }
        if (!file.get().isInline()) {
            discardChunks(file.get().chunkedReference());
        }
        boolean removed = records.pullFile(point, fileId);
        if (removed) {
            LOG.infof("Removed file %s from stage %s", fileId, point);
        }
        return removed;
    }

    public List<BlobDescriptor> listByPatient(String patientId) {
        if (patientId == null || patientId.isBlank()) {
            throw new ValidationException("patientId is required");
        }
        return records.findFilesByPatient(patientId);
    }

    /** Merges metadata keys into a file entry. @return false if the stage has no such file */
    public boolean updateMetadata(
            AttachmentPoint point, String fileId, Map<String, Object> metadata) {
        return records.mergeFileMetadata(point, fileId, metadata);
    }

    public boolean stageExists(AttachmentPoint point) {
        return records.stageExists(point);
    }

    public boolean containsFile(AttachmentPoint point, String fileId) {
        return records.findFile(point, fileId).isPresent();
    }

    /**
     * Best-effort delete of a chunked object. Failures leave an orphan for the sweep.
     *
     * @return false if the object was left in place
     */
    public boolean discardChunks(ChunkedReference reference) {
        if (!chunkStore.storeName().equals(reference.storeName())) {
            LOG.warnf(
                    "Object %s belongs to store %s, not %s; leaving it in place",
                    reference.objectId(), reference.storeName(), chunkStore.storeName());
            return false;
        }
        try {
            chunkStore.deleteObject(reference.objectId());
            return true;
        } catch (RuntimeException e) {
            LOG.warnf(
                    "Failed to delete chunks of object %s: %s",
                    reference.objectId(), e.getMessage());
            registry.counter(DELETE_FAILURES_METRIC, "store", reference.storeName()).increment();
            return false;
        }
    }

    static ResourceConflictException duplicateFile(AttachmentPoint point, String fileId) {
        return new ResourceConflictException(
                "file", fileId, "File " + fileId + " already exists in stage " + point);
    }
}
