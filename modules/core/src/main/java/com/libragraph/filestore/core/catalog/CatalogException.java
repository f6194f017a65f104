package com.libragraph.filestore.core.catalog;

/**
 * The metadata catalog failed as a whole (unreachable, batch rejected, timed out).
 */
public class CatalogException extends RuntimeException {

    public CatalogException(String message, Throwable cause) {
        super(message, cause);
    }

    public CatalogException(String message) {
        super(message);
    }
}
