package io.github.chirino.patientfiles.blob;

import static io.github.chirino.patientfiles.config.TestBlobStorageConfig.MIB;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.chirino.patientfiles.config.TestBlobStorageConfig;
import io.github.chirino.patientfiles.model.SourceEncoding;
import io.github.chirino.patientfiles.model.StorageMode;
import io.github.chirino.patientfiles.store.ValidationException;
import org.junit.jupiter.api.Test;

class StorageStrategySelectorTest {

    private final StorageStrategySelector selector =
            new StorageStrategySelector(TestBlobStorageConfig.defaults());

    @Test
    void rawThresholdIsInclusive() {
        assertEquals(StorageMode.INLINE, selector.decide(0, SourceEncoding.RAW));
        assertEquals(StorageMode.INLINE, selector.decide(MIB, SourceEncoding.RAW));
        assertEquals(StorageMode.CHUNKED, selector.decide(MIB + 1, SourceEncoding.RAW));
    }

    @Test
    void base64UsesItsOwnThreshold() {
        assertEquals(StorageMode.INLINE, selector.decide(5 * MIB, SourceEncoding.BASE64));
        assertEquals(StorageMode.INLINE, selector.decide(10 * MIB, SourceEncoding.BASE64));
        assertEquals(StorageMode.CHUNKED, selector.decide(10 * MIB + 1, SourceEncoding.BASE64));
        assertEquals(StorageMode.CHUNKED, selector.decide(5 * MIB, SourceEncoding.RAW));
    }

    @Test
    void rejectsNegativeSize() {
        assertThrows(IllegalArgumentException.class, () -> selector.decide(-1, SourceEncoding.RAW));
    }

    @Test
    void allowsConfiguredContentTypesIgnoringCaseAndParameters() {
        assertTrue(selector.isAllowed("application/pdf"));
        assertTrue(selector.isAllowed("image/jpg"));
        assertTrue(selector.isAllowed("IMAGE/PNG"));
        assertTrue(selector.isAllowed("image/png; charset=binary"));
        assertFalse(selector.isAllowed("text/plain"));
        assertFalse(selector.isAllowed(""));
        assertFalse(selector.isAllowed(null));
    }

    @Test
    void unsupportedContentTypeFailsValidation() {
        ValidationException e =
                assertThrows(
                        ValidationException.class,
                        () -> selector.validateContentType("text/plain"));
        assertEquals(ValidationException.UNSUPPORTED_MEDIA_TYPE, e.getCode());
        assertTrue(e.getMessage().contains("text/plain"));
    }

    @Test
    void normalizesContentType() {
        assertEquals("image/png", StorageStrategySelector.normalize(" Image/PNG ; q=1"));
        assertEquals(null, StorageStrategySelector.normalize(" ; x=y"));
    }
}
