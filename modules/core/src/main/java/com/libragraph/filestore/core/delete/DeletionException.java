package com.libragraph.filestore.core.delete;

/**
 * A delete batch could not be carried out at all; no partial report is available.
 */
public class DeletionException extends RuntimeException {

    public DeletionException(String message, Throwable cause) {
        super(message, cause);
    }
}
