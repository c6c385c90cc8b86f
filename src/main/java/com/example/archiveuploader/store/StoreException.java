package com.example.archiveuploader.store;

/**
 * Failure reported by an {@link ObjectStore}. The kind tells missing-parent
 * failures, which callers may repair, apart from everything else.
 */
public class StoreException extends Exception {
    public enum Kind {
        PARENT_NOT_DIRECTORY,
        DIRECTORY_DOES_NOT_EXIST,
        OTHER
    }

    private final Kind kind;
    private final String path;

    public StoreException(Kind kind, String path, String message) {
        this(kind, path, message, null);
    }

    public StoreException(Kind kind, String path, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.path = path;
    }

    public Kind kind() {
        return kind;
    }

    public String path() {
        return path;
    }

    public boolean isMissingParent() {
        return kind == Kind.PARENT_NOT_DIRECTORY || kind == Kind.DIRECTORY_DOES_NOT_EXIST;
    }
}
