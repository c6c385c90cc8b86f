package com.example.archiveuploader;

public class UploadOutcome {
    private final String destination;
    private final FailedEntryRecord failure;
    private final int attempts;

    private UploadOutcome(String destination, FailedEntryRecord failure, int attempts) {
        this.destination = destination;
        this.failure = failure;
        this.attempts = attempts;
    }

    public static UploadOutcome success(String destination, int attempts) {
        return new UploadOutcome(destination, null, attempts);
    }

    public static UploadOutcome failure(FailedEntryRecord failure) {
        return new UploadOutcome(failure.getDestination(), failure, failure.getAttempts().size());
    }

    public boolean isSuccess() {
        return failure == null;
    }

    public String getDestination() {
        return destination;
    }

    public FailedEntryRecord getFailure() {
        return failure;
    }

    /**
     * Number of put requests issued for the entry (one, or two after a retry).
     */
    public int getAttempts() {
        return attempts;
    }
}
