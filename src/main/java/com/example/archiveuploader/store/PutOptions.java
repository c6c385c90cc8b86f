package com.example.archiveuploader.store;

import java.util.Map;

/**
 * Per-object upload settings.
 */
public record PutOptions(
        int copies,
        long size,
        Map<String, String> headers
) {
    public static final String CONTENT_TYPE = "content-type";

    public PutOptions {
        headers = Map.copyOf(headers);
    }

    public String contentType() {
        return headers.getOrDefault(CONTENT_TYPE, "application/octet-stream");
    }
}
