package com.example.archiveuploader;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;

/**
 * Receives per-entry results as scanners finish them. Called concurrently from
 * every scanner thread.
 */
public interface UploadListener {
    void uploaded(String destination);

    void failed(FailedEntryRecord failure);

    static UploadListener noop() {
        return new UploadListener() {
            @Override
            public void uploaded(String destination) {
            }

            @Override
            public void failed(FailedEntryRecord failure) {
            }
        };
    }

    /**
     * Prints each uploaded path on its own line and logs one error per failed entry.
     */
    static UploadListener console(PrintStream out) {
        Logger logger = LoggerFactory.getLogger(UploadListener.class);
        return new UploadListener() {
            @Override
            public void uploaded(String destination) {
                out.println(destination);
            }

            @Override
            public void failed(FailedEntryRecord failure) {
                logger.error("{}: {}", failure.getDestination(), failure.getLastError());
            }
        };
    }
}
