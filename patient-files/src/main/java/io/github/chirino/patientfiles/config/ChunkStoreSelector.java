package io.github.chirino.patientfiles.config;

import io.github.chirino.patientfiles.mongo.GridFsChunkStore;
import io.github.chirino.patientfiles.store.ChunkStore;
import io.github.chirino.patientfiles.store.MeteredChunkStore;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;

@ApplicationScoped
public class ChunkStoreSelector {

    @ConfigProperty(name = "patient-files.chunk-store.type", defaultValue = "gridfs")
    String storeType;

    @Inject Instance<GridFsChunkStore> gridFsChunkStore;

    @Inject MeterRegistry meterRegistry;

    private ChunkStore selected;

    @PostConstruct
    void init() {
        selected = new MeteredChunkStore(meterRegistry, selectDelegate());
    }

    public ChunkStore getChunkStore() {
        return selected;
    }

    ChunkStore selectDelegate() {
        String type = storeType == null ? "gridfs" : storeType.trim().toLowerCase();
        if ("gridfs".equals(type) || "mongo".equals(type) || "mongodb".equals(type)) {
            return gridFsChunkStore.get();
        }
        throw new IllegalStateException("Unsupported patient-files.chunk-store.type: " + storeType);
    }
}
