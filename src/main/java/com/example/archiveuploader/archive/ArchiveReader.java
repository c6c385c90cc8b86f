package com.example.archiveuploader.archive;

import java.io.IOException;

@FunctionalInterface
public interface ArchiveReader {
    /**
     * Starts a new scan from the beginning of the archive. Scans share no
     * decoding state and each holds its own file handle until closed.
     */
    EntrySource openScan() throws IOException;
}
