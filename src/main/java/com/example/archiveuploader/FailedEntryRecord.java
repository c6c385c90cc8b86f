package com.example.archiveuploader;

import com.example.archiveuploader.store.StoreException;

import java.util.List;

/**
 * Final failure of one archive entry, with the error of every upload attempt.
 */
public class FailedEntryRecord {
    private final String entryPath;
    private final String destination;
    private final StoreException.Kind kind;
    private final String lastError;
    private final List<UploadAttempt> attempts;

    public FailedEntryRecord(String entryPath,
                             String destination,
                             StoreException.Kind kind,
                             String lastError,
                             List<UploadAttempt> attempts) {
        this.entryPath = entryPath;
        this.destination = destination;
        this.kind = kind;
        this.lastError = lastError;
        this.attempts = List.copyOf(attempts);
    }

    public String getEntryPath() {
        return entryPath;
    }

    public String getDestination() {
        return destination;
    }

    public StoreException.Kind getKind() {
        return kind;
    }

    public String getLastError() {
        return lastError;
    }

    public List<UploadAttempt> getAttempts() {
        return attempts;
    }
}
