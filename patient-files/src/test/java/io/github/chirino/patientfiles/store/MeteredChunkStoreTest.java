package io.github.chirino.patientfiles.store;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MeteredChunkStoreTest {

    private SimpleMeterRegistry registry;
    private InMemoryChunkStore delegate;
    private MeteredChunkStore store;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        delegate = new InMemoryChunkStore();
        store = new MeteredChunkStore(registry, delegate);
    }

    @Test
    void recordsTimerPerOperation() {
        String id = store.newObjectId();
        store.appendChunk(id, 0, new byte[] {1, 2, 3});
        store.appendChunk(id, 1, new byte[] {4});
        store.finalizeObject(
                new ChunkedObjectInfo(
                        id, "a.pdf", "application/pdf", 4, 3, Instant.now(), Map.of()));
        assertTrue(store.findObject(id).isPresent());
        try (ChunkCursor cursor = store.openChunks(id)) {
            assertTrue(cursor.hasNext());
        }
        store.deleteObject(id);

        assertEquals(2, timer("appendChunk").count());
        assertEquals(1, timer("finalizeObject").count());
        assertEquals(1, timer("findObject").count());
        assertEquals(1, timer("openChunks").count());
        assertEquals(1, timer("deleteObject").count());
        assertEquals(4.0, registry.get("patient.files.chunk.bytes.written").counter().count());
    }

    @Test
    void failuresAreTimedAndRethrown() {
        delegate.failOnAppend(1);

        assertThrows(BlobStorageException.class, () -> store.appendChunk("x", 0, new byte[1]));

        assertEquals(1, timer("appendChunk").count());
    }

    @Test
    void delegatesNaming() {
        assertEquals("patient_files", store.storeName());
        assertSame(delegate, store.getDelegate());
    }

    private Timer timer(String operation) {
        return registry.get(MeteredChunkStore.METRIC).tag("operation", operation).timer();
    }
}
