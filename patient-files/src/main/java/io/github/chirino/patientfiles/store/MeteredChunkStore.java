package io.github.chirino.patientfiles.store;

import io.micrometer.core.instrument.MeterRegistry;
import java.util.Optional;

/**
 * Decorator that wraps a ChunkStore implementation with timing metrics. All operations are
 * recorded using Micrometer timers with the metric name "patient.files.chunk.operation" and an
 * "operation" tag identifying the method.
 */
public class MeteredChunkStore implements ChunkStore {

    static final String METRIC = "patient.files.chunk.operation";

    private final MeterRegistry registry;
    private final ChunkStore delegate;

    public MeteredChunkStore(MeterRegistry registry, ChunkStore delegate) {
        this.registry = registry;
        this.delegate = delegate;
    }

    public ChunkStore getDelegate() {
        return delegate;
    }

    @Override
    public String storeName() {
        return delegate.storeName();
    }

    @Override
    public String newObjectId() {
        return delegate.newObjectId();
    }

    @Override
    public void appendChunk(String objectId, int sequenceIndex, byte[] bytes) {
        registry.timer(METRIC, "operation", "appendChunk")
                .record(() -> delegate.appendChunk(objectId, sequenceIndex, bytes));
        registry.counter("patient.files.chunk.bytes.written").increment(bytes.length);
    }

    @Override
    public void finalizeObject(ChunkedObjectInfo info) {
        registry.timer(METRIC, "operation", "finalizeObject")
                .record(() -> delegate.finalizeObject(info));
    }

    @Override
    public Optional<ChunkedObjectInfo> findObject(String objectId) {
        return registry.timer(METRIC, "operation", "findObject")
                .record(() -> delegate.findObject(objectId));
    }

    @Override
    public ChunkCursor openChunks(String objectId) {
        return registry.timer(METRIC, "operation", "openChunks")
                .record(() -> delegate.openChunks(objectId));
    }

    @Override
    public void deleteObject(String objectId) {
        registry.timer(METRIC, "operation", "deleteObject")
                .record(() -> delegate.deleteObject(objectId));
    }
}
