package io.github.chirino.patientfiles.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import io.github.chirino.patientfiles.blob.ChunkedBlobReader;
import io.github.chirino.patientfiles.blob.ChunkedBlobWriter;
import io.github.chirino.patientfiles.model.ChunkedReference;
import io.github.chirino.patientfiles.mongo.GridFsChunkStore;
import io.github.chirino.patientfiles.store.ChunkStore;
import io.github.chirino.patientfiles.store.MeteredChunkStore;
import io.github.chirino.patientfiles.store.ResourceNotFoundException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import jakarta.enterprise.inject.Instance;
import org.junit.jupiter.api.Test;

class ChunkStoreSelectorTest {

    private final GridFsChunkStore gridFs = mock(GridFsChunkStore.class);

    @SuppressWarnings("unchecked")
    private ChunkStoreSelector createSelector(String type) {
        Instance<GridFsChunkStore> instance = mock(Instance.class);
        when(instance.get()).thenReturn(gridFs);
        ChunkStoreSelector selector = new ChunkStoreSelector();
        selector.gridFsChunkStore = instance;
        selector.meterRegistry = new SimpleMeterRegistry();
        selector.storeType = type;
        return selector;
    }

    @Test
    void selects_gridfs_for_mongo_aliases() {
        for (String type : new String[] {"gridfs", "mongo", "MongoDB", " gridfs "}) {
            ChunkStoreSelector selector = createSelector(type);
            selector.init();

            ChunkStore selected = selector.getChunkStore();
            MeteredChunkStore metered = assertInstanceOf(MeteredChunkStore.class, selected);
            assertSame(gridFs, metered.getDelegate());
        }
    }

    @Test
    void consumers_use_the_selected_store() {
        when(gridFs.storeName()).thenReturn("patient_files");
        ChunkStoreSelector selector = createSelector("gridfs");
        selector.init();

        ChunkedBlobWriter writer =
                new ChunkedBlobWriter(selector, TestBlobStorageConfig.defaults());
        assertEquals("patient_files", writer.storeName());

        ChunkedBlobReader reader = new ChunkedBlobReader(selector);
        assertThrows(
                ResourceNotFoundException.class,
                () -> reader.open(new ChunkedReference("legacy_bucket", "obj")));
    }

    @Test
    void rejects_unknown_store_type() {
        ChunkStoreSelector selector = createSelector("s3");
        assertThrows(IllegalStateException.class, selector::init);
    }
}
