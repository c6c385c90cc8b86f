package com.example.archiveuploader;

import java.time.Instant;

/**
 * One put request issued for an entry and the error it reported.
 */
public record UploadAttempt(
        int attempt,
        Instant timestamp,
        String error
) {
}
