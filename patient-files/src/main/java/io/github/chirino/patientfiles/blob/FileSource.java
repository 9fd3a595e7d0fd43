package io.github.chirino.patientfiles.blob;

import java.io.InputStream;
import java.util.Objects;

/** Where the bytes of an upload come from. */
public sealed interface FileSource
        permits FileSource.RawBytes, FileSource.RawStream, FileSource.Base64Text {

    /** Length used for the early size check, or -1 when unknown. */
    long declaredLength();

    static FileSource ofBytes(byte[] bytes) {
        return new RawBytes(bytes);
    }

    static FileSource ofStream(InputStream stream) {
        return new RawStream(stream, -1);
    }

    static FileSource ofStream(InputStream stream, long length) {
        return new RawStream(stream, length);
    }

    static FileSource ofBase64(CharSequence text) {
        return new Base64Text(text);
    }

    record RawBytes(byte[] bytes) implements FileSource {

        public RawBytes {
            Objects.requireNonNull(bytes, "bytes");
        }

        @Override
        public long declaredLength() {
            return bytes.length;
        }
    }

    /** A stream read exactly once. The caller keeps ownership and closes it. */
    record RawStream(InputStream stream, long length) implements FileSource {

        public RawStream {
            Objects.requireNonNull(stream, "stream");
        }

        @Override
        public long declaredLength() {
            return length >= 0 ? length : -1;
        }
    }

    record Base64Text(CharSequence text) implements FileSource {

        public Base64Text {
            Objects.requireNonNull(text, "text");
        }

        /** Estimated decoded length. */
        @Override
        public long declaredLength() {
            return Base64ChunkDecoder.estimateDecodedSize(text.length());
        }
    }
}
