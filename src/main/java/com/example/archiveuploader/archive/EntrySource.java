package com.example.archiveuploader.archive;

import java.io.Closeable;
import java.io.IOException;

/**
 * A single pass over an archive, yielding entries in archive order.
 */
public interface EntrySource extends Closeable {
    /**
     * Returns the next entry, or {@code null} once the archive is exhausted.
     *
     * @throws ArchiveDecodeException if the archive is malformed at this point
     */
    ArchiveEntry next() throws IOException;
}
