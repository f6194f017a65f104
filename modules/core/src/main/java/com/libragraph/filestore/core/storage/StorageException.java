package com.libragraph.filestore.core.storage;

/**
 * A blob store call failed or ran past {@code filestore.io.timeout}.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }

    public StorageException(String message) {
        super(message);
    }
}
