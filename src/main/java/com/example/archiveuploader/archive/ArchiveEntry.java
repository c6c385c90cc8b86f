package com.example.archiveuploader.archive;

import java.io.InputStream;

/**
 * One named blob read from an archive. The body is positioned at the entry's
 * bytes and is only readable until the owning scan advances.
 */
public record ArchiveEntry(
        String path,
        long size,
        InputStream body
) {
    public ArchiveEntry {
        if (size < 0) {
            throw new IllegalArgumentException("Entry size must not be negative: " + size);
        }
    }
}
