package com.example.archiveuploader.archive;

import java.io.IOException;

public class ArchiveDecodeException extends IOException {
    public ArchiveDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
