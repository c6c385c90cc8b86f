package com.example.archiveuploader;

import com.example.archiveuploader.archive.ArchiveEntry;
import com.example.archiveuploader.store.ObjectStore;
import com.example.archiveuploader.store.PutOptions;
import com.example.archiveuploader.store.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Uploads claimed entries. A put that fails because the parent directory is
 * missing creates the directory through the shared {@link DirectoryCreator}
 * and is retried exactly once.
 */
public final class UploadDispatcher {
    private static final Logger LOGGER = LoggerFactory.getLogger(UploadDispatcher.class);

    private final ObjectStore store;
    private final DirectoryCreator directories;
    private final ContentTypeResolver contentTypes;
    private final String destinationPrefix;
    private final int copies;
    private final Map<String, String> headers;

    public UploadDispatcher(ObjectStore store,
                            DirectoryCreator directories,
                            ContentTypeResolver contentTypes,
                            String destinationPrefix,
                            int copies,
                            Map<String, String> headers) {
        this.store = store;
        this.directories = directories;
        this.contentTypes = contentTypes;
        this.destinationPrefix = destinationPrefix;
        this.copies = copies;
        this.headers = Map.copyOf(headers);
    }

    public UploadOutcome upload(ArchiveEntry entry) {
        String destination = destinationFor(entry.path());
        PutOptions options = optionsFor(entry);
        List<UploadAttempt> attempts = new ArrayList<>();
        if (escapesPrefix(entry.path())) {
            return failed(entry, destination, new StoreException(StoreException.Kind.OTHER, destination,
                    "Entry name " + entry.path() + " escapes the destination prefix"), attempts);
        }

        try {
            store.put(destination, entry.body(), options);
            return UploadOutcome.success(destination, 1);
        } catch (StoreException ex) {
            attempts.add(new UploadAttempt(1, Instant.now(), ex.getMessage()));
            if (!ex.isMissingParent()) {
                return failed(entry, destination, ex, attempts);
            }
            LOGGER.debug("Parent of {} is missing: {}", destination, ex.getMessage());
        }

        String parent = ObjectStore.parentOf(destination);
        try {
            directories.ensureDirectory(parent);
        } catch (StoreException ex) {
            return failed(entry, destination, ex, attempts);
        }

        try {
            store.put(destination, entry.body(), options);
            return UploadOutcome.success(destination, 2);
        } catch (StoreException ex) {
            attempts.add(new UploadAttempt(2, Instant.now(), ex.getMessage()));
            if (ex.isMissingParent()) {
                directories.forget(parent);
            }
            return failed(entry, destination, ex, attempts);
        }
    }

    String destinationFor(String entryPath) {
        return destinationPrefix + "/" + entryPath;
    }

    static boolean escapesPrefix(String entryPath) {
        for (String segment : entryPath.split("/")) {
            if (segment.equals("..")) {
                return true;
            }
        }
        return false;
    }

    private PutOptions optionsFor(ArchiveEntry entry) {
        Map<String, String> entryHeaders = new HashMap<>(headers);
        entryHeaders.computeIfAbsent(PutOptions.CONTENT_TYPE, ignored -> contentTypes.resolve(entry.path()));
        return new PutOptions(copies, entry.size(), entryHeaders);
    }

    private UploadOutcome failed(ArchiveEntry entry,
                                 String destination,
                                 StoreException cause,
                                 List<UploadAttempt> attempts) {
        LOGGER.debug("Upload of {} failed after {} attempt(s)", destination, attempts.size(), cause);
        return UploadOutcome.failure(new FailedEntryRecord(
                entry.path(),
                destination,
                cause.kind(),
                cause.getMessage(),
                attempts
        ));
    }
}
