package io.github.chirino.patientfiles.blob;

import io.github.chirino.patientfiles.store.BlobStorageException;
import java.util.Base64;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Decodes base64 text into binary chunks one segment at a time, so the decoded payload is never
 * held in memory as a whole.
 *
 * <p>Segments are cut on 4-character boundaries, so no base64 quantum is split across two chunks.
 * Each chunk holds at most {@code floor(targetChunkBytes / 3) * 3} bytes; only the last one may be
 * shorter. The iterator is single pass. A malformed segment (characters outside the alphabet,
 * padding before the end, a dangling character) fails with {@link
 * BlobStorageException#DECODE_ERROR} and ends the sequence; nothing is returned for that segment.
 */
public class Base64ChunkDecoder implements Iterator<byte[]> {

    private static final Base64.Decoder DECODER = Base64.getDecoder();

    private final CharSequence encoded;
    private final int segmentLength;
    private int position;
    private boolean failed;

    public Base64ChunkDecoder(CharSequence encoded, int targetChunkBytes) {
        if (targetChunkBytes <= 0) {
            throw new IllegalArgumentException("targetChunkBytes must be positive");
        }
        this.encoded = encoded;
        this.segmentLength = Math.max(1, targetChunkBytes / 3) * 4;
    }

    /** Decoded size estimate used before decoding: {@code encodedLength * 3 / 4}. */
    public static long estimateDecodedSize(long encodedLength) {
        return encodedLength * 3 / 4;
    }

    /** Bytes per full chunk this decoder produces. */
    public int decodedChunkLength() {
        return segmentLength / 4 * 3;
    }

    @Override
    public boolean hasNext() {
        return !failed && position < encoded.length();
    }

    @Override
    public byte[] next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        int end = Math.min(position + segmentLength, encoded.length());
        String segment = encoded.subSequence(position, end).toString();
        if (end < encoded.length() && segment.indexOf('=') >= 0) {
            failed = true;
            throw BlobStorageException.decodeError(
                    "Malformed base64: padding before end of input near offset "
                            + (position + segment.indexOf('=')),
                    null);
        }
        byte[] chunk;
        try {
            chunk = DECODER.decode(segment);
        } catch (IllegalArgumentException e) {
            failed = true;
            throw BlobStorageException.decodeError(
                    "Malformed base64 in segment at offset " + position + ": " + e.getMessage(), e);
        }
        position = end;
        return chunk;
    }
}
