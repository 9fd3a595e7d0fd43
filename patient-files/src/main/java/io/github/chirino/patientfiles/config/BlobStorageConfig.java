package io.github.chirino.patientfiles.config;

import io.quarkus.runtime.configuration.MemorySize;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.List;
import java.util.Locale;
import org.eclipse.microprofile.config.inject.ConfigProperty;

@ApplicationScoped
public class BlobStorageConfig {

    /** Largest raw upload embedded in the patient record. */
    @ConfigProperty(name = "patient-files.storage.inline-threshold", defaultValue = "1M")
    MemorySize inlineThreshold;

    /**
     * Largest base64 upload (estimated decoded size) embedded in the patient record. Kept apart
     * from {@link #inlineThreshold}: the two ingestion paths historically used different cutoffs.
     */
    @ConfigProperty(name = "patient-files.storage.base64-inline-threshold", defaultValue = "10M")
    MemorySize base64InlineThreshold;

    @ConfigProperty(name = "patient-files.storage.chunk-size", defaultValue = "255K")
    MemorySize chunkSize;

    @ConfigProperty(name = "patient-files.storage.max-size", defaultValue = "512M")
    MemorySize maxSize;

    @ConfigProperty(name = "patient-files.storage.bucket", defaultValue = "patient_files")
    String bucket;

    @ConfigProperty(
            name = "patient-files.storage.allowed-content-types",
            defaultValue = "application/pdf,image/jpeg,image/jpg,image/png,image/gif")
    List<String> allowedContentTypes;

    @ConfigProperty(name = "patient-files.mongodb.database", defaultValue = "patient")
    String database;

    @ConfigProperty(name = "patient-files.mongodb.collection", defaultValue = "patients")
    String collection;

    public long getInlineThreshold() {
        return inlineThreshold.asLongValue();
    }

    public long getBase64InlineThreshold() {
        return base64InlineThreshold.asLongValue();
    }

    public int getChunkSize() {
        long size = chunkSize.asLongValue();
        if (size <= 0 || size > Integer.MAX_VALUE) {
            throw new IllegalStateException(
                    "Unsupported patient-files.storage.chunk-size: " + chunkSize);
        }
        return (int) size;
    }

    public long getMaxSize() {
        return maxSize.asLongValue();
    }

    public String getBucket() {
        return bucket;
    }

    public List<String> getAllowedContentTypes() {
        return allowedContentTypes.stream()
                .map(t -> t.trim().toLowerCase(Locale.ROOT))
                .filter(t -> !t.isEmpty())
                .toList();
    }

    public String getDatabase() {
        return database;
    }

    public String getCollection() {
        return collection;
    }
}
