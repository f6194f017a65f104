package com.libragraph.filestore.core.storage;

public class BlobAlreadyExistsException extends StorageException {

    public BlobAlreadyExistsException(String storageName) {
        super("Blob already exists: " + storageName);
    }
}
