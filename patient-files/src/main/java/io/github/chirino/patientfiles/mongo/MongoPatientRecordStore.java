package io.github.chirino.patientfiles.mongo;

import com.mongodb.MongoException;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.FindOneAndUpdateOptions;
import com.mongodb.client.model.Projections;
import com.mongodb.client.model.ReturnDocument;
import com.mongodb.client.model.UpdateOptions;
import com.mongodb.client.model.Updates;
import com.mongodb.client.result.UpdateResult;
import io.github.chirino.patientfiles.config.BlobStorageConfig;
import io.github.chirino.patientfiles.model.AttachmentPoint;
import io.github.chirino.patientfiles.model.BlobDescriptor;
import io.github.chirino.patientfiles.model.Stage;
import io.github.chirino.patientfiles.store.BlobStorageException;
import io.github.chirino.patientfiles.store.PatientRecordStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.bson.Document;
import org.bson.conversions.Bson;

/**
 * Patient records in MongoDB. File entries live in {@code episodes[].stages[].files[]} and are
 * mutated only through single-document updates with array filters, so two uploads to the same
 * stage never overwrite each other.
 */
@ApplicationScoped
public class MongoPatientRecordStore implements PatientRecordStore {

    static final String FILES_PATH = "episodes.$[ep].stages.$[st].files";
    static final String FILE_PATH = FILES_PATH + ".$[f]";

    private final MongoClient mongoClient;
    private final BlobStorageConfig config;
    private final FileDocumentMapper mapper;

    @Inject
    public MongoPatientRecordStore(
            MongoClient mongoClient, BlobStorageConfig config, FileDocumentMapper mapper) {
        this.mongoClient = mongoClient;
        this.config = config;
        this.mapper = mapper;
    }

    private MongoCollection<Document> collection() {
        return mongoClient.getDatabase(config.getDatabase()).getCollection(config.getCollection());
    }

    @Override
    public boolean stageExists(AttachmentPoint point) {
        try {
            return collection()
                            .find(stageFilter(point, null))
                            .projection(Projections.include("_id"))
                            .first()
                    != null;
        } catch (MongoException e) {
            throw BlobStorageException.storageUnavailable("Failed to look up stage " + point, e);
        }
    }

    @Override
    public Optional<Stage> pushFile(AttachmentPoint point, BlobDescriptor file) {
        Bson filter = stageFilter(point, Filters.ne("files.fileId", file.fileId()));
        try {
            Document updated =
                    collection()
                            .findOneAndUpdate(
                                    filter,
                                    Updates.push(FILES_PATH, mapper.toDocument(file)),
                                    new FindOneAndUpdateOptions()
                                            .arrayFilters(stageArrayFilters(point))
                                            .projection(episodeProjection(point))
                                            .returnDocument(ReturnDocument.AFTER));
            return updated == null ? Optional.empty() : mapper.toStage(updated, point);
        } catch (MongoException e) {
            throw BlobStorageException.storageUnavailable(
                    "Failed to attach file " + file.fileId() + " to " + point, e);
        }
    }

    @Override
    public Optional<BlobDescriptor> findFile(AttachmentPoint point, String fileId) {
        Document patient;
        try {
            patient =
                    collection()
                            .find(stageFilter(point, Filters.eq("files.fileId", fileId)))
                            .projection(episodeProjection(point))
                            .first();
        } catch (MongoException e) {
            throw BlobStorageException.storageUnavailable(
                    "Failed to look up file " + fileId + " in " + point, e);
        }
        if (patient == null) {
            return Optional.empty();
        }
        return mapper.toStage(patient, point).flatMap(stage -> stage.findFile(fileId));
    }

    @Override
    public boolean pullFile(AttachmentPoint point, String fileId) {
        try {
            UpdateResult result =
                    collection()
                            .updateOne(
                                    stageFilter(point, Filters.eq("files.fileId", fileId)),
                                    Updates.pull(FILES_PATH, new Document("fileId", fileId)),
                                    new UpdateOptions().arrayFilters(stageArrayFilters(point)));
            return result.getModifiedCount() > 0;
        } catch (MongoException e) {
            throw BlobStorageException.storageUnavailable(
                    "Failed to detach file " + fileId + " from " + point, e);
        }
    }

    @Override
    public boolean mergeFileMetadata(
            AttachmentPoint point, String fileId, Map<String, Object> metadata) {
        List<Bson> sets = new ArrayList<>();
        metadata.forEach(
                (k, v) ->
                        sets.add(
                                Updates.set(FILE_PATH + ".metadata." + k, mapper.toBsonValue(v))));
        if (sets.isEmpty()) {
            return findFile(point, fileId).isPresent();
        }
        List<Bson> arrayFilters = new ArrayList<>(stageArrayFilters(point));
        arrayFilters.add(Filters.eq("f.fileId", fileId));
        try {
            UpdateResult result =
                    collection()
                            .updateOne(
                                    stageFilter(point, Filters.eq("files.fileId", fileId)),
                                    Updates.combine(sets),
                                    new UpdateOptions().arrayFilters(arrayFilters));
            return result.getMatchedCount() > 0;
        } catch (MongoException e) {
            throw BlobStorageException.storageUnavailable(
                    "Failed to update metadata of file " + fileId + " in " + point, e);
        }
    }

    @Override
    public List<BlobDescriptor> findFilesByPatient(String patientId) {
        Document patient;
        try {
            patient = collection().find(Filters.eq("patientId", patientId)).first();
        } catch (MongoException e) {
            throw BlobStorageException.storageUnavailable(
                    "Failed to list files of patient " + patientId, e);
        }
        return patient == null ? List.of() : mapper.allFiles(patient);
    }

    /**
     * Matches the patient whose episode {@code episodeId} contains stage {@code stageId}. The
     * episode and stage conditions sit in nested {@code $elemMatch} clauses so they must hold for
     * the same array element, not for any two elements.
     */
    static Bson stageFilter(AttachmentPoint point, Bson stageCondition) {
        Bson stage =
                stageCondition == null
                        ? Filters.eq("id", point.stageId())
                        : Filters.and(Filters.eq("id", point.stageId()), stageCondition);
        return Filters.and(
                Filters.eq("patientId", point.patientId()),
                Filters.elemMatch(
                        "episodes",
                        Filters.and(
                                Filters.eq("episodeId", point.episodeId()),
                                Filters.elemMatch("stages", stage))));
    }

    static List<Bson> stageArrayFilters(AttachmentPoint point) {
        return List.of(
                Filters.eq("ep.episodeId", point.episodeId()),
                Filters.eq("st.id", point.stageId()));
    }

    private static Bson episodeProjection(AttachmentPoint point) {
        return Projections.fields(
                Projections.include("patientId"),
                Projections.elemMatch("episodes", Filters.eq("episodeId", point.episodeId())));
    }
}
