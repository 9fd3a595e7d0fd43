package io.github.chirino.patientfiles.store;

import java.io.Closeable;
import java.util.Iterator;

/**
 * Forward-only iteration over the chunks of one object in ascending sequence order. Holds a
 * store-side cursor, so callers must close it.
 */
public interface ChunkCursor extends Iterator<Chunk>, Closeable {

    @Override
    void close();
}
