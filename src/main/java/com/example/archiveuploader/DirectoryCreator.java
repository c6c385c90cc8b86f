package com.example.archiveuploader;

import com.example.archiveuploader.store.ObjectStore;
import com.example.archiveuploader.store.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Coalesces concurrent requests to create the same directory. The first caller
 * for a path issues {@link ObjectStore#mkdirp}; callers arriving while that
 * request is in flight wait for it and share its outcome.
 */
public final class DirectoryCreator {
    private static final Logger LOGGER = LoggerFactory.getLogger(DirectoryCreator.class);

    private final ObjectStore store;
    private final Object lock = new Object();
    // guarded by lock
    private final Map<String, PendingCreation> pending = new HashMap<>();
    // guarded by lock
    private final Set<String> created = new HashSet<>();

    public DirectoryCreator(ObjectStore store) {
        this.store = store;
    }

    /**
     * Blocks until {@code path} exists, or throws the creation failure shared
     * by every caller that waited on the same request.
     */
    public void ensureDirectory(String path) throws StoreException {
        PendingCreation creation;
        boolean owner = false;
        synchronized (lock) {
            if (created.contains(path)) {
                return;
            }
            creation = pending.get(path);
            if (creation == null) {
                creation = new PendingCreation();
                pending.put(path, creation);
                owner = true;
            }
            creation.waiters.incrementAndGet();
        }

        if (owner) {
            StoreException failure = null;
            boolean completed = false;
            try {
                LOGGER.debug("Creating directory {}", path);
                store.mkdirp(path);
                completed = true;
            } catch (StoreException ex) {
                failure = ex;
                completed = true;
            } catch (RuntimeException ex) {
                failure = new StoreException(StoreException.Kind.OTHER, path, "Failed to create " + path, ex);
                completed = true;
            } finally {
                if (!completed) {
                    failure = new StoreException(StoreException.Kind.OTHER, path, "Creation of " + path + " aborted");
                }
                resolve(path, creation, failure);
            }
        }
        await(creation);
    }

    /**
     * Drops {@code path} from the directories known to exist, so the next
     * discovery issues a fresh creation request.
     */
    public void forget(String path) {
        synchronized (lock) {
            if (created.remove(path)) {
                LOGGER.debug("Directory {} reported missing after creation", path);
            }
        }
    }

    boolean isKnown(String path) {
        synchronized (lock) {
            return created.contains(path);
        }
    }

    /**
     * Number of callers currently waiting on an in-flight creation of {@code path}.
     */
    int waitersFor(String path) {
        synchronized (lock) {
            PendingCreation creation = pending.get(path);
            return creation == null ? 0 : creation.waiters.get();
        }
    }

    boolean isPending(String path) {
        synchronized (lock) {
            return pending.containsKey(path);
        }
    }

    private void resolve(String path, PendingCreation creation, StoreException failure) {
        synchronized (lock) {
            if (failure == null) {
                created.add(path);
                creation.result.complete(null);
            } else {
                LOGGER.warn("Failed to create directory {} for {} waiting uploads", path, creation.waiters.get());
                creation.result.completeExceptionally(failure);
            }
            pending.remove(path);
        }
    }

    private static void await(PendingCreation creation) throws StoreException {
        try {
            creation.result.join();
        } catch (CompletionException ex) {
            if (ex.getCause() instanceof StoreException storeException) {
                throw storeException;
            }
            throw ex;
        }
    }

    private static final class PendingCreation {
        private final CompletableFuture<Void> result = new CompletableFuture<>();
        private final AtomicInteger waiters = new AtomicInteger();
    }
}
