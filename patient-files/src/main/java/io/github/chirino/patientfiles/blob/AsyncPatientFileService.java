package io.github.chirino.patientfiles.blob;

import io.github.chirino.patientfiles.model.AttachmentPoint;
import io.github.chirino.patientfiles.model.BlobDescriptor;
import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * {@link PatientFileService} for reactive callers. Each operation subscribes on the Mutiny default
 * executor, since the underlying store calls block.
 */
@ApplicationScoped
public class AsyncPatientFileService {

    private final PatientFileService files;
    private final Executor executor;

    @Inject
    public AsyncPatientFileService(PatientFileService files) {
        this(files, Infrastructure.getDefaultExecutor());
    }

    AsyncPatientFileService(PatientFileService files, Executor executor) {
        this.files = files;
        this.executor = executor;
    }

    public Uni<BlobDescriptor> storeFile(
            AttachmentPoint point, FileSource source, UploadRequest request) {
        return blocking(() -> files.storeFile(point, source, request));
    }

    public Uni<FileContent> fetchFile(AttachmentPoint point, String fileId) {
        return blocking(() -> files.fetchFile(point, fileId));
    }

    public Uni<Boolean> removeFile(AttachmentPoint point, String fileId) {
        return blocking(() -> files.removeFile(point, fileId));
    }

    public Uni<List<BlobDescriptor>> listFiles(String patientId) {
        return blocking(() -> files.listFiles(patientId));
    }

    public Uni<Boolean> updateFileMetadata(
            AttachmentPoint point, String fileId, Map<String, Object> metadata) {
        return blocking(() -> files.updateFileMetadata(point, fileId, metadata));
    }

    private <T> Uni<T> blocking(Supplier<T> operation) {
        return Uni.createFrom().item(operation).runSubscriptionOn(executor);
    }
}
