package io.github.chirino.patientfiles.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.Test;

class BlobStorageConfigTest {

    @Test
    void defaultsMatchShippedValues() {
        BlobStorageConfig config = TestBlobStorageConfig.defaults();

        assertEquals(1048576, config.getInlineThreshold());
        assertEquals(10485760, config.getBase64InlineThreshold());
        assertEquals(261120, config.getChunkSize());
        assertEquals(536870912, config.getMaxSize());
    }

    @Test
    void allowedContentTypesAreTrimmedAndLowercased() {
        BlobStorageConfig config = TestBlobStorageConfig.defaults();
        config.allowedContentTypes = List.of(" Application/PDF", "image/png ", "");

        assertEquals(List.of("application/pdf", "image/png"), config.getAllowedContentTypes());
    }

    @Test
    void rejectsZeroChunkSize() {
        BlobStorageConfig config = TestBlobStorageConfig.create(1, 1, 0, 1);
        assertThrows(IllegalStateException.class, config::getChunkSize);
    }
}
