package io.github.chirino.patientfiles.mongo;

import io.github.chirino.patientfiles.model.AttachmentPoint;
import io.github.chirino.patientfiles.model.BlobDescriptor;
import io.github.chirino.patientfiles.model.ChunkedReference;
import io.github.chirino.patientfiles.model.Stage;
import io.github.chirino.patientfiles.model.StorageMode;
import jakarta.enterprise.context.ApplicationScoped;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.bson.Document;
import org.bson.types.Binary;
import org.bson.types.ObjectId;
import org.jboss.logging.Logger;

/**
 * Converts stage file entries between {@link BlobDescriptor} and the BSON layout stored in the
 * patients collection.
 *
 * <p>Besides the current layout (with an explicit {@code storageMode}) it reads the two older
 * shapes still found in patient records: inline entries that only carry {@code binaryData}, and
 * chunked entries that only carry a {@code fileRef} or a {@code binaryData.gridFSId}.
 */
@ApplicationScoped
public class FileDocumentMapper {

    private static final Logger LOG = Logger.getLogger(FileDocumentMapper.class);

    public Document toDocument(BlobDescriptor file) {
        Date uploadDate = toDate(file.uploadDate());
        Document doc =
                new Document("fileId", file.fileId())
                        .append("storageMode", file.storageMode().getValue())
                        .append("fileType", file.contentType())
                        .append("fileName", file.fileName())
                        .append("fileSize", file.size())
                        .append("uploadDate", uploadDate);
        if (file.isInline()) {
            doc.append(
                    "binaryData",
                    new Document("data", new Binary(file.inlinePayload()))
                            .append("contentType", file.contentType())
                            .append("fileName", file.fileName())
                            .append("size", file.size())
                            .append("uploadDate", uploadDate));
        } else {
            ChunkedReference ref = file.chunkedReference();
            doc.append(
                    "fileRef",
                    new Document("collection", ref.storeName())
                            .append("fileId", toObjectIdValue(ref.objectId())));
        }
        doc.append("metadata", toBson(file.metadata()));
        return doc;
    }

    public Optional<BlobDescriptor> fromDocument(Document doc) {
        String fileId = stringOf(doc, "fileId");
        if (fileId == null) {
            return Optional.empty();
        }
        Document binaryData = subDocument(doc, "binaryData");
        Document fileRef = subDocument(doc, "fileRef");
        Map<String, Object> metadata = fromBson(subDocument(doc, "metadata"));

        String contentType =
                firstNonNull(stringOf(doc, "fileType"), stringOf(binaryData, "contentType"));
        String fileName =
                firstNonNull(stringOf(doc, "fileName"), stringOf(binaryData, "fileName"));
        Instant uploadDate =
                firstNonNull(
                        toInstant(doc.get("uploadDate")),
                        binaryData != null ? toInstant(binaryData.get("uploadDate")) : null,
                        toInstant(metadata.get("uploadDate")));

        StorageMode mode = storageModeOf(doc, binaryData, fileRef);
        if (mode == null) {
            LOG.debugf("Skipping file entry %s without a usable storage mode", fileId);
            return Optional.empty();
        }
        if (mode == StorageMode.INLINE) {
            Object data = binaryData != null ? binaryData.get("data") : null;
            if (!(data instanceof Binary binary)) {
                LOG.debugf("Skipping inline file entry %s without binary data", fileId);
                return Optional.empty();
            }
            return Optional.of(
                    BlobDescriptor.inline(
                            fileId, contentType, fileName, uploadDate, metadata, binary.getData()));
        }

        ChunkedReference ref = chunkedReferenceOf(fileRef, binaryData);
        if (ref == null) {
            LOG.debugf("Skipping chunked file entry %s without an object reference", fileId);
            return Optional.empty();
        }
        long size =
                Math.max(
                        0L,
                        firstNonNull(
                                toLong(doc.get("fileSize")),
                                binaryData != null ? toLong(binaryData.get("size")) : null,
                                0L));
        return Optional.of(
                BlobDescriptor.chunked(
                        fileId, contentType, fileName, size, uploadDate, metadata, ref));
    }

    /** Builds the stage addressed by {@code point} out of a patient document (or a projection). */
    public Optional<Stage> toStage(Document patient, AttachmentPoint point) {
        for (Document episode : subDocuments(patient, "episodes")) {
            if (!point.episodeId().equals(stringOf(episode, "episodeId"))) {
                continue;
            }
            for (Document stage : subDocuments(episode, "stages")) {
                if (point.stageId().equals(stringOf(stage, "id"))) {
                    return Optional.of(new Stage(point, stringOf(stage, "name"), toFiles(stage)));
                }
            }
        }
        return Optional.empty();
    }

    public List<BlobDescriptor> allFiles(Document patient) {
        List<BlobDescriptor> result = new ArrayList<>();
        for (Document episode : subDocuments(patient, "episodes")) {
            for (Document stage : subDocuments(episode, "stages")) {
                result.addAll(toFiles(stage));
            }
        }
        return result;
    }

    List<BlobDescriptor> toFiles(Document stage) {
        List<BlobDescriptor> files = new ArrayList<>();
        for (Document file : subDocuments(stage, "files")) {
            fromDocument(file).ifPresent(files::add);
        }
        return files;
    }

    public Document toBson(Map<String, Object> values) {
        Document doc = new Document();
        values.forEach((k, v) -> doc.append(k, toBsonValue(v)));
        return doc;
    }

    public Object toBsonValue(Object value) {
        if (value instanceof Instant instant) {
            return Date.from(instant);
        }
        if (value instanceof List<?> list) {
            return list.stream().map(this::toBsonValue).toList();
        }
        return value;
    }

    Map<String, Object> fromBson(Document doc) {
        Map<String, Object> result = new LinkedHashMap<>();
        if (doc == null) {
            return result;
        }
        doc.forEach((k, v) -> result.put(k, fromBsonValue(v)));
        return result;
    }

    private Object fromBsonValue(Object value) {
        if (value instanceof Date date) {
            return date.toInstant();
        }
        if (value instanceof ObjectId oid) {
            return oid.toHexString();
        }
        if (value instanceof Document nested) {
            return fromBson(nested);
        }
        if (value instanceof List<?> list) {
            return list.stream().map(this::fromBsonValue).toList();
        }
        return value;
    }

    private static StorageMode storageModeOf(Document doc, Document binaryData, Document fileRef) {
        Object explicit = doc.get("storageMode");
        if (explicit != null) {
            try {
                return StorageMode.fromValue(explicit.toString());
            } catch (IllegalArgumentException e) {
                LOG.debugf("File entry %s: %s", stringOf(doc, "fileId"), e.getMessage());
                return null;
            }
        }
        if (fileRef != null) {
            return StorageMode.CHUNKED;
        }
        if (binaryData != null) {
            return binaryData.get("gridFSId") != null ? StorageMode.CHUNKED : StorageMode.INLINE;
        }
        return null;
    }

    private static ChunkedReference chunkedReferenceOf(Document fileRef, Document binaryData) {
        Object objectId;
        String storeName = null;
        if (fileRef != null) {
            objectId = fileRef.get("fileId");
            storeName = stringOf(fileRef, "collection");
        } else {
            objectId = binaryData != null ? binaryData.get("gridFSId") : null;
        }
        if (objectId == null) {
            return null;
        }
        return new ChunkedReference(
                firstNonNull(storeName, "patient_files"), String.valueOf(objectId));
    }

    private static Document subDocument(Document parent, String field) {
        return parent.get(field) instanceof Document d ? d : null;
    }

    private static List<Document> subDocuments(Document parent, String field) {
        Object value = parent.get(field);
        if (value instanceof List<?> list) {
            List<Document> result = new ArrayList<>(list.size());
            for (Object item : list) {
                if (item instanceof Document d) {
                    result.add(d);
                }
            }
            return result;
        }
        return List.of();
    }

    static Object toObjectIdValue(String objectId) {
        return ObjectId.isValid(objectId) ? new ObjectId(objectId) : objectId;
    }

    private static String stringOf(Document doc, String field) {
        return doc != null && doc.get(field) instanceof String s ? s : null;
    }

    private static Date toDate(Instant instant) {
        return instant == null ? null : Date.from(instant);
    }

    private static Instant toInstant(Object value) {
        if (value instanceof Date date) {
            return date.toInstant();
        }
        if (value instanceof Instant instant) {
            return instant;
        }
        return null;
    }

    // fileSize was a string in early records
    private static Long toLong(Object value) {
        if (value instanceof Number n) {
            return n.longValue();
        }
        if (value instanceof String s) {
            try {
                return (long) Double.parseDouble(s);
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    @SafeVarargs
    private static <T> T firstNonNull(T... values) {
        for (T v : values) {
            if (v != null) {
                return v;
            }
        }
        return null;
    }
}
