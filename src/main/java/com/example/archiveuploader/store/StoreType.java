package com.example.archiveuploader.store;

import java.util.Locale;

public enum StoreType {
    LOCAL,
    S3;

    public static StoreType parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return LOCAL;
        }
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unknown storeType '" + raw + "', expected local or s3.", ex);
        }
    }
}
