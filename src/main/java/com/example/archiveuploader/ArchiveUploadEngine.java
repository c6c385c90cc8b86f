package com.example.archiveuploader;

import com.example.archiveuploader.archive.ArchiveEntry;
import com.example.archiveuploader.archive.ArchiveReader;
import com.example.archiveuploader.archive.EntrySource;
import com.example.archiveuploader.store.ObjectStore;
import com.example.archiveuploader.store.StoreException;
import org.apache.tika.Tika;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Uploads an archive with several independent scanners. Every scanner reads
 * the whole archive from the start; the shared {@link ClaimCounter} decides
 * which scanner uploads each entry, so no entry is uploaded twice and none
 * is dropped.
 */
public final class ArchiveUploadEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(ArchiveUploadEngine.class);

    private final UploaderConfig config;
    private final ArchiveReader reader;
    private final UploadDispatcher dispatcher;
    private final UploadListener listener;

    public ArchiveUploadEngine(UploaderConfig config,
                               ArchiveReader reader,
                               ObjectStore store,
                               UploadListener listener) {
        this(config, reader, new UploadDispatcher(
                store,
                new DirectoryCreator(store),
                new ContentTypeResolver(new Tika()),
                config.destinationPrefix(),
                config.copies(),
                config.headers()
        ), listener);
    }

    ArchiveUploadEngine(UploaderConfig config,
                        ArchiveReader reader,
                        UploadDispatcher dispatcher,
                        UploadListener listener) {
        this.config = config;
        this.reader = reader;
        this.dispatcher = dispatcher;
        this.listener = listener;
    }

    /**
     * Runs {@code parallelism} scanners to completion. Individual entry and
     * scan failures never stop the other scanners; they are collected in the
     * returned report.
     */
    public UploadReport run() throws InterruptedException {
        Instant startedAt = Instant.now();
        int parallelism = config.parallelism();
        LOGGER.info("Uploading {} to {} with {} scanners", config.archiveFile(), config.destinationPrefix(), parallelism);

        ClaimCounter claims = new ClaimCounter();
        Queue<String> uploaded = new ConcurrentLinkedQueue<>();
        Queue<FailedEntryRecord> failures = new ConcurrentLinkedQueue<>();
        Queue<String> scanErrors = new ConcurrentLinkedQueue<>();

        AtomicInteger threadIds = new AtomicInteger();
        ExecutorService scanners = Executors.newFixedThreadPool(parallelism,
                runnable -> new Thread(runnable, "scanner-" + threadIds.incrementAndGet()));
        List<Integer> claimsPerScanner = new ArrayList<>(parallelism);
        try {
            List<Callable<Integer>> tasks = new ArrayList<>(parallelism);
            for (int i = 0; i < parallelism; i++) {
                int scannerId = i;
                tasks.add(() -> scan(scannerId, claims, uploaded, failures, scanErrors));
            }
            for (Future<Integer> result : scanners.invokeAll(tasks)) {
                claimsPerScanner.add(claimsOf(result));
            }
        } finally {
            scanners.shutdownNow();
        }

        UploadReport report = new UploadReport(
                config.archiveFile().toString(),
                config.destinationPrefix(),
                parallelism,
                startedAt,
                Instant.now(),
                claims.claimed(),
                List.copyOf(claimsPerScanner),
                List.copyOf(uploaded),
                List.copyOf(failures),
                List.copyOf(scanErrors)
        );
        LOGGER.info("Upload finished: {} uploaded, {} failed, {} scan errors",
                report.uploaded().size(), report.failures().size(), report.scanErrors().size());
        return report;
    }

    private int scan(int scannerId,
                     ClaimCounter claims,
                     Queue<String> uploaded,
                     Queue<FailedEntryRecord> failures,
                     Queue<String> scanErrors) {
        long localIndex = 0;
        int claimed = 0;
        try (EntrySource source = reader.openScan()) {
            ArchiveEntry entry;
            while ((entry = source.next()) != null) {
                // Directory markers carry no payload and are never claimed.
                if (entry.size() == 0) {
                    continue;
                }
                boolean mine = claims.tryClaim(localIndex);
                localIndex++;
                if (!mine) {
                    continue;
                }
                claimed++;
                UploadOutcome outcome = dispatch(entry);
                if (outcome.isSuccess()) {
                    uploaded.add(outcome.getDestination());
                    listener.uploaded(outcome.getDestination());
                } else {
                    failures.add(outcome.getFailure());
                    listener.failed(outcome.getFailure());
                }
            }
        } catch (IOException ex) {
            LOGGER.warn("Scanner {} stopped after {} entries", scannerId, localIndex, ex);
            scanErrors.add("scanner " + scannerId + ": " + ex.getMessage());
        }
        LOGGER.debug("Scanner {} finished with {} claimed entries", scannerId, claimed);
        return claimed;
    }

    private UploadOutcome dispatch(ArchiveEntry entry) {
        try {
            return dispatcher.upload(entry);
        } catch (RuntimeException ex) {
            String destination = dispatcher.destinationFor(entry.path());
            LOGGER.warn("Unexpected failure uploading {}", destination, ex);
            return UploadOutcome.failure(new FailedEntryRecord(
                    entry.path(),
                    destination,
                    StoreException.Kind.OTHER,
                    String.valueOf(ex.getMessage()),
                    List.of(new UploadAttempt(1, Instant.now(), String.valueOf(ex.getMessage())))
            ));
        }
    }

    private static int claimsOf(Future<Integer> result) throws InterruptedException {
        try {
            return result.get();
        } catch (ExecutionException ex) {
            throw new IllegalStateException("Scanner failed unexpectedly", ex.getCause());
        }
    }
}
