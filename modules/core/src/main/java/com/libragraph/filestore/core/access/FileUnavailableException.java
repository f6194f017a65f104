package com.libragraph.filestore.core.access;

/**
 * A file cannot be served to this caller. The message is the same for every
 * {@link Reason} so callers cannot tell a private file from a missing one;
 * the reason is for logs only.
 */
public class FileUnavailableException extends RuntimeException {

    public static final String MESSAGE = "File Not Found";

    public enum Reason {
        INVALID_NAME,
        NO_RECORD,
        DENIED,
        NO_BLOB
    }

    private final String storageName;
    private final Reason reason;

    public FileUnavailableException(String storageName, Reason reason) {
        super(MESSAGE);
        this.storageName = storageName;
        this.reason = reason;
    }

    public String storageName() {
        return storageName;
    }

    public Reason reason() {
        return reason;
    }
}
