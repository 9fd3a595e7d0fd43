package io.github.chirino.patientfiles.blob;

import io.github.chirino.patientfiles.model.AttachmentPoint;
import io.github.chirino.patientfiles.model.BlobDescriptor;
import io.github.chirino.patientfiles.model.ChunkedReference;
import io.github.chirino.patientfiles.model.SourceEncoding;
import io.github.chirino.patientfiles.model.StorageMode;
import io.github.chirino.patientfiles.store.BlobStorageException;
import io.github.chirino.patientfiles.store.ChunkedObjectInfo;
import io.github.chirino.patientfiles.store.ObjectDescriptor;
import io.github.chirino.patientfiles.store.ResourceConflictException;
import io.github.chirino.patientfiles.store.ResourceNotFoundException;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jboss.logging.Logger;

/**
 * Stores, fetches and removes patient files. Small payloads are embedded in the patient record,
 * large ones go to the chunk store and the record keeps a reference.
 *
 * <p>Uploads are checked before anything is written: identifiers, content type, metadata, the
 * target stage and the file id. A chunked upload that is rejected later (a bad base64 segment, the
 * size limit, the stage disappearing before attach) removes the chunks it wrote. A store failure
 * does not: those chunks are left for the orphan sweep.
 */
@ApplicationScoped
public class PatientFileService {

    private static final Logger LOG = Logger.getLogger(PatientFileService.class);

    static final String UPLOADS_METRIC = "patient.files.uploads";

    private final StorageStrategySelector strategy;
    private final InlineBlobCodec inlineCodec;
    private final ChunkedBlobWriter writer;
    private final ChunkedBlobReader reader;
    private final BlobReferenceManager references;
    private final MeterRegistry registry;

    @Inject
    public PatientFileService(
            StorageStrategySelector strategy,
            InlineBlobCodec inlineCodec,
            ChunkedBlobWriter writer,
            ChunkedBlobReader reader,
            BlobReferenceManager references,
            MeterRegistry registry) {
        this.strategy = strategy;
        this.inlineCodec = inlineCodec;
        this.writer = writer;
        this.reader = reader;
        this.references = references;
        this.registry = registry;
    }

    /**
     * Stores a file and attaches it to the stage at {@code point}.
     *
     * @throws io.github.chirino.patientfiles.store.ValidationException for a disallowed content
     *     type or malformed metadata
     * @throws ResourceNotFoundException if the stage does not exist
     * @throws ResourceConflictException if the stage already has a file with this id
     * @throws BlobStorageException on decode errors, oversized payloads or store failures
     */
    public BlobDescriptor storeFile(
            AttachmentPoint point, FileSource source, UploadRequest request) {
        strategy.validateContentType(request.contentType());
        Map<String, Object> metadata = UploadMetadata.forUpload(request.metadata(), Instant.now());
        if (!references.stageExists(point)) {
            throw new ResourceNotFoundException("stage", point.toString());
        }
        if (references.containsFile(point, request.fileId())) {
            throw BlobReferenceManager.duplicateFile(point, request.fileId());
        }

        BlobDescriptor descriptor;
        if (source instanceof FileSource.RawBytes raw) {
            descriptor = storeBytes(point, request, metadata, raw.bytes());
        } else if (source instanceof FileSource.RawStream stream) {
            descriptor = storeStream(point, request, metadata, stream);
        } else if (source instanceof FileSource.Base64Text base64) {
            descriptor = storeBase64(point, request, metadata, base64.text());
        } else {
            throw new IllegalArgumentException("Unsupported file source: " + source);
        }
        registry.counter(UPLOADS_METRIC, "mode", descriptor.storageMode().getValue()).increment();
        return descriptor;
    }

    private BlobDescriptor storeBytes(
            AttachmentPoint point,
            UploadRequest request,
            Map<String, Object> metadata,
            byte[] bytes) {
        checkMaxSize(bytes.length);
        if (strategy.decide(bytes.length, SourceEncoding.RAW) == StorageMode.INLINE) {
            return attachInline(point, request, metadata, bytes);
        }
        logLargeFile(request, bytes.length);
        return storeChunked(
                point, request, metadata, handle -> handle.write(bytes, 0, bytes.length));
    }

    private BlobDescriptor storeStream(
            AttachmentPoint point,
            UploadRequest request,
            Map<String, Object> metadata,
            FileSource.RawStream source) {
        if (source.declaredLength() >= 0) {
            checkMaxSize(source.declaredLength());
        }
        InputStream in = source.stream();
        byte[] head = readHead(in, request);
        if (strategy.decide(head.length, SourceEncoding.RAW) == StorageMode.INLINE) {
            return attachInline(point, request, metadata, head);
        }
        logLargeFile(request, source.declaredLength());
        return storeChunked(
                point,
                request,
                metadata,
                handle -> {
                    handle.write(head, 0, head.length);
                    in.transferTo(handle);
                });
    }

    // never buffers more than threshold + 1 bytes before the decision
    private byte[] readHead(InputStream in, UploadRequest request) {
        long threshold = strategy.thresholdFor(SourceEncoding.RAW);
        try {
            return in.readNBytes((int) Math.min(threshold + 1, Integer.MAX_VALUE - 8));
        } catch (IOException e) {
            throw BlobStorageException.storageUnavailable(
                    "Failed to read upload of file " + request.fileId(), e);
        }
    }

    private BlobDescriptor storeBase64(
            AttachmentPoint point,
            UploadRequest request,
            Map<String, Object> metadata,
            CharSequence text) {
        long estimated = Base64ChunkDecoder.estimateDecodedSize(text.length());
        checkMaxSize(estimated);
        Base64ChunkDecoder decoder = new Base64ChunkDecoder(text, writer.chunkSize());
        if (strategy.decide(estimated, SourceEncoding.BASE64) == StorageMode.INLINE) {
            ByteArrayOutputStream decoded = new ByteArrayOutputStream((int) estimated);
            decoder.forEachRemaining(decoded::writeBytes);
            return attachInline(point, request, metadata, decoded.toByteArray());
        }
        logLargeFile(request, estimated);
        return storeChunked(
                point,
                request,
                metadata,
                handle -> {
                    while (decoder.hasNext()) {
                        byte[] chunk = decoder.next();
                        handle.write(chunk, 0, chunk.length);
                    }
                });
    }

    private BlobDescriptor attachInline(
            AttachmentPoint point,
            UploadRequest request,
            Map<String, Object> metadata,
            byte[] bytes) {
        BlobDescriptor descriptor =
                inlineCodec.encode(
                        request.fileId(),
                        bytes,
                        request.contentType(),
                        request.fileName(),
                        metadata);
        references.attach(point, descriptor);
        return descriptor;
    }

    private BlobDescriptor storeChunked(
            AttachmentPoint point,
            UploadRequest request,
            Map<String, Object> metadata,
            ChunkBody body) {
        Map<String, Object> objectMetadata = new LinkedHashMap<>(metadata);
        objectMetadata.put("patientId", point.patientId());
        objectMetadata.put("episodeId", point.episodeId());
        objectMetadata.put("stageId", point.stageId());
        objectMetadata.put("fileId", request.fileId());

        ChunkWriteHandle handle =
                writer.open(
                        new ObjectDescriptor(
                                request.fileName(), request.contentType(), objectMetadata));
        try {
            body.writeTo(handle);
            writer.finish(handle);
        } catch (IOException e) {
            writer.discard(handle);
            throw BlobStorageException.storageUnavailable(
                    "Failed to read upload of file " + request.fileId(), e);
        } catch (BlobStorageException e) {
            if (!BlobStorageException.STORAGE_UNAVAILABLE.equals(e.getCode())) {
                writer.discard(handle);
            }
            throw e;
        }

        BlobDescriptor descriptor =
                BlobDescriptor.chunked(
                        request.fileId(),
                        request.contentType(),
                        request.fileName(),
                        handle.getLength(),
                        handle.getUploadDate(),
                        metadata,
                        new ChunkedReference(writer.storeName(), handle.getObjectId()));
        try {
            references.attach(point, descriptor);
        } catch (ResourceNotFoundException | ResourceConflictException e) {
            writer.discard(handle);
            throw e;
        }
        LOG.infof(
                "Stored file %s in %d chunks as object %s",
                request.fileId(), handle.getChunkCount(), handle.getObjectId());
        return descriptor;
    }

    public FileContent fetchFile(AttachmentPoint point, String fileId) {
        BlobDescriptor descriptor = references.resolve(point, fileId).descriptor();
        if (descriptor.isInline()) {
            byte[] bytes = inlineCodec.decode(descriptor);
            return new FileContent(
                    new ByteArrayInputStream(bytes),
                    descriptor.contentType(),
                    descriptor.fileName(),
                    bytes.length,
                    StorageMode.INLINE);
        }
        ChunkReadHandle handle = reader.open(descriptor.chunkedReference());
        ChunkedObjectInfo info = handle.getInfo();
        return new FileContent(
                new ChunkSequenceInputStream(handle),
                info.contentType() != null ? info.contentType() : descriptor.contentType(),
                info.fileName() != null ? info.fileName() : descriptor.fileName(),
                info.length(),
                StorageMode.CHUNKED);
    }

    /** @return false if the stage has no such file */
    public boolean removeFile(AttachmentPoint point, String fileId) {
        return references.detach(point, fileId);
    }

    public List<BlobDescriptor> listFiles(String patientId) {
        return references.listByPatient(patientId);
    }

    /** Merges metadata keys into a stored file. @return false if the stage has no such file */
    public boolean updateFileMetadata(
            AttachmentPoint point, String fileId, Map<String, Object> metadata) {
        Map<String, Object> normalized = UploadMetadata.normalize(metadata);
        if (normalized.isEmpty()) {
            return references.containsFile(point, fileId);
        }
        return references.updateMetadata(point, fileId, normalized);
    }

    private void checkMaxSize(long size) {
        long max = writer.maxSize();
        if (size > max) {
            throw BlobStorageException.sizeExceeded(max, size);
        }
    }

    private static void logLargeFile(UploadRequest request, long size) {
        if (size >= 0) {
            LOG.infof(
                    "Large file detected (%d bytes), storing %s in chunks",
                    size, request.fileId());
        } else {
            LOG.infof("Large file detected, storing %s in chunks", request.fileId());
        }
    }

    @FunctionalInterface
    private interface ChunkBody {
        void writeTo(ChunkWriteHandle handle) throws IOException;
    }
}
