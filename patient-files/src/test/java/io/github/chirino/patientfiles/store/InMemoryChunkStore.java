package io.github.chirino.patientfiles.store;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link ChunkStore} kept in maps, for unit tests. Can be told to fail the n-th chunk append and
 * lets tests tamper with stored chunks.
 */
public class InMemoryChunkStore implements ChunkStore {

    private final Map<String, List<Chunk>> chunks = new ConcurrentHashMap<>();
    private final Map<String, ChunkedObjectInfo> objects = new ConcurrentHashMap<>();
    private final AtomicInteger ids = new AtomicInteger();
    private final AtomicInteger appends = new AtomicInteger();
    private final AtomicInteger finalizeCalls = new AtomicInteger();
    private final List<String> deleted = new CopyOnWriteArrayList<>();

    private int failOnAppend = -1;
    private boolean failDeletes;

    @Override
    public String storeName() {
        return "patient_files";
    }

    @Override
    public String newObjectId() {
        return String.format("obj-%04d", ids.incrementAndGet());
    }

    @Override
    public void appendChunk(String objectId, int sequenceIndex, byte[] bytes) {
        if (appends.incrementAndGet() == failOnAppend) {
            throw BlobStorageException.storageUnavailable(
                    "chunk store unreachable", new RuntimeException("connection reset"));
        }
        chunks.computeIfAbsent(objectId, k -> new CopyOnWriteArrayList<>())
                .add(new Chunk(objectId, sequenceIndex, bytes.clone()));
    }

    @Override
    public void finalizeObject(ChunkedObjectInfo info) {
        finalizeCalls.incrementAndGet();
        objects.put(info.objectId(), info);
    }

    @Override
    public Optional<ChunkedObjectInfo> findObject(String objectId) {
        return Optional.ofNullable(objects.get(objectId));
    }

    @Override
    public ChunkCursor openChunks(String objectId) {
        List<Chunk> sorted = new ArrayList<>(chunks.getOrDefault(objectId, List.of()));
        sorted.sort(Comparator.comparingInt(Chunk::sequenceIndex));
        return new ChunkCursor() {
            private int pos;
            private boolean closed;

            @Override
            public boolean hasNext() {
                return !closed && pos < sorted.size();
            }

            @Override
            public Chunk next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                return sorted.get(pos++);
            }

            @Override
            public void close() {
                closed = true;
            }
        };
    }

    @Override
    public void deleteObject(String objectId) {
        if (failDeletes) {
            throw BlobStorageException.storageUnavailable("delete failed", null);
        }
        deleted.add(objectId);
        objects.remove(objectId);
        chunks.remove(objectId);
    }

    /** Makes the n-th append (1-based, counted across objects) fail as unreachable. */
    public void failOnAppend(int n) {
        this.failOnAppend = n;
    }

    public void failDeletes(boolean fail) {
        this.failDeletes = fail;
    }

    public List<Chunk> chunksOf(String objectId) {
        return List.copyOf(chunks.getOrDefault(objectId, List.of()));
    }

    /** Replaces the stored chunk list of an object as is. */
    public void replaceChunks(String objectId, List<Chunk> replacement) {
        chunks.put(objectId, new CopyOnWriteArrayList<>(replacement));
    }

    public int objectCount() {
        return objects.size();
    }

    public int chunkCount() {
        return chunks.values().stream().mapToInt(List::size).sum();
    }

    public int finalizeCalls() {
        return finalizeCalls.get();
    }

    public List<String> deletedObjects() {
        return List.copyOf(deleted);
    }
}
