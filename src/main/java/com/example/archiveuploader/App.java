package com.example.archiveuploader;

import com.example.archiveuploader.archive.TarArchiveReader;
import com.example.archiveuploader.store.LocalDirectoryStore;
import com.example.archiveuploader.store.ObjectStore;
import com.example.archiveuploader.store.S3ObjectStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

public final class App {
    private static final Logger LOGGER = LoggerFactory.getLogger(App.class);

    private App() {
    }

    public static void main(String[] args) throws Exception {
        // Basic CLI contract: a single JSON config file path is required.
        if (args.length < 1) {
            LOGGER.error("Usage: java -jar archive-uploader.jar <config.json>");
            System.exit(1);
        }
        UploaderConfig config;
        try {
            config = new ConfigLoader().load(Path.of(args[0]));
        } catch (IllegalArgumentException ex) {
            LOGGER.error("Invalid configuration: {}", ex.getMessage());
            System.exit(1);
            return;
        }
        System.exit(run(config));
    }

    static int run(UploaderConfig config) throws Exception {
        UploadReport report;
        try (ObjectStore store = openStore(config)) {
            ArchiveUploadEngine engine = new ArchiveUploadEngine(
                    config,
                    new TarArchiveReader(config.archiveFile()),
                    store,
                    UploadListener.console(System.out)
            );
            report = engine.run();
        }
        if (config.reportFile().isPresent()) {
            ReportWriter writer = new ReportWriter(config.reportFile().get());
            writer.save(report);
            LOGGER.info("Wrote report to {}", writer.path());
        }
        return report.succeeded() ? 0 : 1;
    }

    private static ObjectStore openStore(UploaderConfig config) {
        switch (config.storeType()) {
            case S3:
                return S3ObjectStore.create(config.s3Bucket().orElseThrow(), config.s3Region(), config.s3Endpoint());
            case LOCAL:
            default:
                return new LocalDirectoryStore(config.localRoot().orElseThrow());
        }
    }
}
