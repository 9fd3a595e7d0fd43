package io.github.chirino.patientfiles.store;

import io.github.chirino.patientfiles.model.AttachmentPoint;
import io.github.chirino.patientfiles.model.BlobDescriptor;
import io.github.chirino.patientfiles.model.Stage;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/** {@link PatientRecordStore} over plain collections; every method is synchronized. */
public class InMemoryPatientRecordStore implements PatientRecordStore {

    private final Map<String, Map<AttachmentPoint, List<BlobDescriptor>>> patients =
            new LinkedHashMap<>();
    private final AtomicInteger mutations = new AtomicInteger();

    /** Creates the stage (and its patient) with an empty file list. */
    public synchronized void addStage(AttachmentPoint point) {
        patients.computeIfAbsent(point.patientId(), k -> new LinkedHashMap<>())
                .putIfAbsent(point, new ArrayList<>());
    }

    @Override
    public synchronized boolean stageExists(AttachmentPoint point) {
        return files(point) != null;
    }

    @Override
    public synchronized Optional<Stage> pushFile(AttachmentPoint point, BlobDescriptor file) {
        List<BlobDescriptor> files = files(point);
        if (files == null || files.stream().anyMatch(f -> f.fileId().equals(file.fileId()))) {
            return Optional.empty();
        }
        files.add(file);
        mutations.incrementAndGet();
        return Optional.of(new Stage(point, null, files));
    }

    @Override
    public synchronized Optional<BlobDescriptor> findFile(AttachmentPoint point, String fileId) {
        List<BlobDescriptor> files = files(point);
        if (files == null) {
            return Optional.empty();
        }
        return files.stream().filter(f -> f.fileId().equals(fileId)).findFirst();
    }

    @Override
    public synchronized boolean pullFile(AttachmentPoint point, String fileId) {
        List<BlobDescriptor> files = files(point);
        boolean removed = files != null && files.removeIf(f -> f.fileId().equals(fileId));
        if (removed) {
            mutations.incrementAndGet();
        }
        return removed;
    }

    @Override
    public synchronized boolean mergeFileMetadata(
            AttachmentPoint point, String fileId, Map<String, Object> metadata) {
        List<BlobDescriptor> files = files(point);
        if (files == null) {
            return false;
        }
        for (int i = 0; i < files.size(); i++) {
            BlobDescriptor file = files.get(i);
            if (file.fileId().equals(fileId)) {
                Map<String, Object> merged = new LinkedHashMap<>(file.metadata());
                merged.putAll(metadata);
                files.set(i, file.withMetadata(merged));
                mutations.incrementAndGet();
                return true;
            }
        }
        return false;
    }

    @Override
    public synchronized List<BlobDescriptor> findFilesByPatient(String patientId) {
        Map<AttachmentPoint, List<BlobDescriptor>> stages = patients.get(patientId);
        if (stages == null) {
            return List.of();
        }
        List<BlobDescriptor> result = new ArrayList<>();
        stages.values().forEach(result::addAll);
        return result;
    }

    public synchronized List<BlobDescriptor> filesOf(AttachmentPoint point) {
        List<BlobDescriptor> files = files(point);
        return files == null ? List.of() : List.copyOf(files);
    }

    /** Successful mutating calls so far. */
    public int mutationCount() {
        return mutations.get();
    }

    private List<BlobDescriptor> files(AttachmentPoint point) {
        Map<AttachmentPoint, List<BlobDescriptor>> stages = patients.get(point.patientId());
        return stages == null ? null : stages.get(point);
    }
}
