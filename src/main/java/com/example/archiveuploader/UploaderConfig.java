package com.example.archiveuploader;

import com.example.archiveuploader.store.StoreType;

import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable runtime settings for one upload run.
 */
public record UploaderConfig(
        Path archiveFile,
        String destinationPrefix,
        int parallelism,
        int copies,
        Map<String, String> headers,
        StoreType storeType,
        Optional<Path> localRoot,
        Optional<String> s3Bucket,
        Optional<String> s3Region,
        Optional<String> s3Endpoint,
        Optional<Path> reportFile
) {
}
