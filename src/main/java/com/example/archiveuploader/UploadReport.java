package com.example.archiveuploader;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Summary of one upload run, serialized as the optional JSON report.
 */
public record UploadReport(
        String archive,
        String destinationPrefix,
        int parallelism,
        Instant startedAt,
        Instant finishedAt,
        long entriesClaimed,
        List<Integer> claimsPerScanner,
        List<String> uploaded,
        List<FailedEntryRecord> failures,
        List<String> scanErrors
) {
    @JsonProperty("succeeded")
    public boolean succeeded() {
        return failures.isEmpty() && scanErrors.isEmpty();
    }
}
