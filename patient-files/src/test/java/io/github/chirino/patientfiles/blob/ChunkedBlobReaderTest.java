package io.github.chirino.patientfiles.blob;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.github.chirino.patientfiles.config.TestBlobStorageConfig;
import io.github.chirino.patientfiles.store.BlobStorageException;
import io.github.chirino.patientfiles.store.Chunk;
import io.github.chirino.patientfiles.store.InMemoryChunkStore;
import io.github.chirino.patientfiles.store.ObjectDescriptor;
import io.github.chirino.patientfiles.store.ResourceNotFoundException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ChunkedBlobReaderTest {

    private static final byte[] DATA = "0123456789".getBytes();

    private InMemoryChunkStore store;
    private ChunkedBlobReader reader;
    private String objectId;

    @BeforeEach
    void setUp() {
        store = new InMemoryChunkStore();
        ChunkedBlobWriter writer =
                new ChunkedBlobWriter(store, TestBlobStorageConfig.create(8, 8, 4, 1024));
        reader = new ChunkedBlobReader(store);

        ChunkWriteHandle handle =
                writer.open(new ObjectDescriptor("a.pdf", "application/pdf", Map.of()));
        writer.write(handle, DATA);
        objectId = writer.finish(handle);
    }

    @Test
    void reassemblesChunksInOrder() throws Exception {
        try (InputStream in = reader.openStream(objectId)) {
            assertArrayEquals(DATA, in.readAllBytes());
        }
    }

    @Test
    void iteratesChunks() {
        try (ChunkReadHandle handle = reader.open(objectId)) {
            List<Integer> lengths = new ArrayList<>();
            reader.read(handle).forEachRemaining(chunk -> lengths.add(chunk.length));
            assertEquals(List.of(4, 4, 2), lengths);
        }
    }

    @Test
    void chunksCanOnlyBeReadOnce() {
        ChunkReadHandle handle = reader.open(objectId);
        reader.read(handle);
        assertThrows(IllegalStateException.class, () -> reader.read(handle));
    }

    @Test
    void unknownObjectIsNotFound() {
        ResourceNotFoundException e =
                assertThrows(ResourceNotFoundException.class, () -> reader.open("missing"));
        assertEquals("missing", e.getId());
    }

    @Test
    void exposesObjectInfo() {
        assertEquals(10, reader.info(objectId).length());
        assertEquals("a.pdf", reader.info(objectId).fileName());
    }

    @Test
    void gapInSequenceFails() {
        List<Chunk> chunks = new ArrayList<>(store.chunksOf(objectId));
        chunks.remove(1);
        store.replaceChunks(objectId, chunks);

        assertSequenceError();
    }

    @Test
    void missingLastChunkFails() {
        List<Chunk> chunks = new ArrayList<>(store.chunksOf(objectId));
        chunks.remove(2);
        store.replaceChunks(objectId, chunks);

        assertSequenceError();
    }

    @Test
    void duplicateChunkFails() {
        List<Chunk> chunks = new ArrayList<>(store.chunksOf(objectId));
        chunks.add(1, chunks.get(0));
        store.replaceChunks(objectId, chunks);

        assertSequenceError();
    }

    @Test
    void extraChunkFails() {
        List<Chunk> chunks = new ArrayList<>(store.chunksOf(objectId));
        chunks.add(new Chunk(objectId, 3, new byte[] {1}));
        store.replaceChunks(objectId, chunks);

        assertSequenceError();
    }

    @Test
    void shortMiddleChunkFails() {
        List<Chunk> chunks = new ArrayList<>(store.chunksOf(objectId));
        chunks.set(1, new Chunk(objectId, 1, new byte[] {1, 2}));
        store.replaceChunks(objectId, chunks);

        assertSequenceError();
    }

    @Test
    void errorEndsIteration() {
        List<Chunk> chunks = new ArrayList<>(store.chunksOf(objectId));
        chunks.remove(0);
        store.replaceChunks(objectId, chunks);

        Iterator<byte[]> it = reader.read(reader.open(objectId));
        assertThrows(BlobStorageException.class, it::next);
        assertFalse(it.hasNext());
    }

    private void assertSequenceError() {
        BlobStorageException e =
                assertThrows(
                        BlobStorageException.class,
                        () -> {
                            try (InputStream in = reader.openStream(objectId)) {
                                in.readAllBytes();
                            }
                        });
        assertEquals(BlobStorageException.CHUNK_SEQUENCE_ERROR, e.getCode());
        assertEquals(500, e.getHttpStatus());
    }
}
