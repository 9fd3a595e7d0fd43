package io.github.chirino.patientfiles.mongo;

import com.mongodb.MongoException;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoCursor;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.IndexOptions;
import com.mongodb.client.model.Indexes;
import com.mongodb.client.model.ReplaceOptions;
import com.mongodb.client.model.Sorts;
import io.github.chirino.patientfiles.config.BlobStorageConfig;
import io.github.chirino.patientfiles.store.BlobStorageException;
import io.github.chirino.patientfiles.store.Chunk;
import io.github.chirino.patientfiles.store.ChunkCursor;
import io.github.chirino.patientfiles.store.ChunkStore;
import io.github.chirino.patientfiles.store.ChunkedObjectInfo;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.Date;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import org.bson.Document;
import org.bson.types.Binary;
import org.bson.types.ObjectId;
import org.jboss.logging.Logger;

/**
 * Chunk store on MongoDB using the GridFS collection layout ({@code <bucket>.files} and
 * {@code <bucket>.chunks}), so objects written here stay readable by standard GridFS tooling.
 *
 * <p>Chunks are written by the engine one at a time instead of through a GridFS upload stream:
 * the engine owns buffering and sequence numbering, and a failure between chunks leaves the
 * already-written chunks behind without a files document (an orphan for the sweep).
 */
@ApplicationScoped
public class GridFsChunkStore implements ChunkStore {

    private static final Logger LOG = Logger.getLogger(GridFsChunkStore.class);

    // keeps a download cursor to a few chunks in memory
    static final int READ_BATCH_SIZE = 4;

    private final MongoClient mongoClient;
    private final BlobStorageConfig config;
    private final FileDocumentMapper mapper;

    @Inject
    public GridFsChunkStore(
            MongoClient mongoClient, BlobStorageConfig config, FileDocumentMapper mapper) {
        this.mongoClient = mongoClient;
        this.config = config;
        this.mapper = mapper;
    }

    @PostConstruct
    void ensureIndexes() {
        try {
            chunks().createIndex(
                            Indexes.ascending("files_id", "n"), new IndexOptions().unique(true));
            files().createIndex(Indexes.ascending("filename", "uploadDate"));
        } catch (MongoException e) {
            LOG.warnf("GridFS index setup for bucket %s skipped: %s", storeName(), e.getMessage());
        }
    }

    private MongoCollection<Document> files() {
        return mongoClient.getDatabase(config.getDatabase()).getCollection(storeName() + ".files");
    }

    private MongoCollection<Document> chunks() {
        return mongoClient.getDatabase(config.getDatabase()).getCollection(storeName() + ".chunks");
    }

    @Override
    public String storeName() {
        return config.getBucket();
    }

    @Override
    public String newObjectId() {
        return new ObjectId().toHexString();
    }

    @Override
    public void appendChunk(String objectId, int sequenceIndex, byte[] bytes) {
        try {
            chunks().insertOne(
                            new Document("files_id", toObjectId(objectId))
                                    .append("n", sequenceIndex)
                                    .append("data", new Binary(bytes)));
        } catch (MongoException e) {
            throw BlobStorageException.storageUnavailable(
                    "Failed to write chunk " + sequenceIndex + " of object " + objectId, e);
        }
        LOG.debugf("Wrote chunk %d (%d bytes) of object %s", sequenceIndex, bytes.length, objectId);
    }

    @Override
    public void finalizeObject(ChunkedObjectInfo info) {
        ObjectId id = toObjectId(info.objectId());
        Document doc =
                new Document("_id", id)
                        .append("length", info.length())
                        .append("chunkSize", info.chunkSize())
                        .append("uploadDate", Date.from(info.uploadDate()))
                        .append("filename", info.fileName())
                        .append("contentType", info.contentType())
                        .append("metadata", mapper.toBson(info.metadata()));
        try {
            files().replaceOne(Filters.eq("_id", id), doc, new ReplaceOptions().upsert(true));
        } catch (MongoException e) {
            throw BlobStorageException.storageUnavailable(
                    "Failed to finalize object " + info.objectId(), e);
        }
    }

    @Override
    public Optional<ChunkedObjectInfo> findObject(String objectId) {
        if (!ObjectId.isValid(objectId)) {
            return Optional.empty();
        }
        Document doc;
        try {
            doc = files().find(Filters.eq("_id", new ObjectId(objectId))).first();
        } catch (MongoException e) {
            throw BlobStorageException.storageUnavailable(
                    "Failed to look up object " + objectId, e);
        }
        if (doc == null) {
            return Optional.empty();
        }
        Number length = doc.get("length", Number.class);
        Number chunkSize = doc.get("chunkSize", Number.class);
        Date uploadDate = doc.getDate("uploadDate");
        Document metadata = doc.get("metadata", Document.class);
        String contentType = doc.getString("contentType");
        if (contentType == null && metadata != null) {
            // newer GridFS drivers keep contentType under metadata
            contentType = metadata.getString("contentType");
        }
        return Optional.of(
                new ChunkedObjectInfo(
                        objectId,
                        doc.getString("filename"),
                        contentType,
                        length != null ? length.longValue() : 0L,
                        chunkSize != null ? chunkSize.intValue() : config.getChunkSize(),
                        uploadDate != null ? uploadDate.toInstant() : null,
                        metadata != null ? mapper.fromBson(metadata) : Map.of()));
    }

    @Override
    public ChunkCursor openChunks(String objectId) {
        try {
            MongoCursor<Document> cursor =
                    chunks().find(Filters.eq("files_id", toObjectId(objectId)))
                            .sort(Sorts.ascending("n"))
                            .batchSize(READ_BATCH_SIZE)
                            .iterator();
            return new MongoChunkCursor(objectId, cursor);
        } catch (MongoException e) {
            throw BlobStorageException.storageUnavailable(
                    "Failed to open chunks of object " + objectId, e);
        }
    }

    @Override
    public void deleteObject(String objectId) {
        if (!ObjectId.isValid(objectId)) {
            return;
        }
        ObjectId id = new ObjectId(objectId);
        try {
            // Same order as GridFS: a crash in between leaves chunks without a files document.
            files().deleteOne(Filters.eq("_id", id));
            long removed = chunks().deleteMany(Filters.eq("files_id", id)).getDeletedCount();
            LOG.debugf("Deleted object %s (%d chunks)", objectId, removed);
        } catch (MongoException e) {
            throw BlobStorageException.storageUnavailable(
                    "Failed to delete object " + objectId, e);
        }
    }

    private static ObjectId toObjectId(String objectId) {
        if (!ObjectId.isValid(objectId)) {
            throw new IllegalArgumentException("Not a GridFS object id: " + objectId);
        }
        return new ObjectId(objectId);
    }

    private static final class MongoChunkCursor implements ChunkCursor {

        private final String objectId;
        private final MongoCursor<Document> cursor;

        MongoChunkCursor(String objectId, MongoCursor<Document> cursor) {
            this.objectId = objectId;
            this.cursor = cursor;
        }

        @Override
        public boolean hasNext() {
            try {
                return cursor.hasNext();
            } catch (MongoException e) {
                throw BlobStorageException.storageUnavailable(
                        "Failed to read chunks of object " + objectId, e);
            }
        }

        @Override
        public Chunk next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            Document doc;
            try {
                doc = cursor.next();
            } catch (MongoException e) {
                throw BlobStorageException.storageUnavailable(
                        "Failed to read chunks of object " + objectId, e);
            }
            Number n = doc.get("n", Number.class);
            Binary data = doc.get("data", Binary.class);
            return new Chunk(
                    objectId,
                    n != null ? n.intValue() : -1,
                    data != null ? data.getData() : new byte[0]);
        }

        @Override
        public void close() {
            cursor.close();
        }
    }
}
