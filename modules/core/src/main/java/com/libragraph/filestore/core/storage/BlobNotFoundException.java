package com.libragraph.filestore.core.storage;

/**
 * Thrown when a read or delete targets a blob that does not exist.
 */
public class BlobNotFoundException extends RuntimeException {

    private final String storageName;

    public BlobNotFoundException(String storageName) {
        super("Blob not found: " + storageName);
        this.storageName = storageName;
    }

    public String storageName() {
        return storageName;
    }
}
