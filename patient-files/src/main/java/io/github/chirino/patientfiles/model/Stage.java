package io.github.chirino.patientfiles.model;

import java.util.List;
import java.util.Optional;

/** A stage of a patient episode together with the files attached to it, in upload order. */
public record Stage(AttachmentPoint point, String name, List<BlobDescriptor> files) {

    public Stage {
        files = files == null ? List.of() : List.copyOf(files);
    }

    public Optional<BlobDescriptor> findFile(String fileId) {
        return files.stream().filter(f -> f.fileId().equals(fileId)).findFirst();
    }
}
