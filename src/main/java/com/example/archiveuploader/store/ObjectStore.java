package com.example.archiveuploader.store;

import java.io.InputStream;

/**
 * Hierarchical object store addressed by absolute slash separated paths.
 */
public interface ObjectStore extends AutoCloseable {
    /**
     * Uploads one object. Missing-parent failures are raised before any byte
     * of {@code body} is consumed, so the caller may replay the same stream.
     */
    void put(String path, InputStream body, PutOptions options) throws StoreException;

    /**
     * Creates {@code path} and all of its ancestors. Succeeds when the
     * directory already exists.
     */
    void mkdirp(String path) throws StoreException;

    @Override
    default void close() {
        // no-op
    }

    static String parentOf(String path) {
        int slash = path.lastIndexOf('/');
        return slash <= 0 ? "/" : path.substring(0, slash);
    }
}
