package com.libragraph.filestore.core.catalog;

public class RecordNotFoundException extends RuntimeException {

    private final String storageName;

    public RecordNotFoundException(String storageName) {
        super("File record not found: " + storageName);
        this.storageName = storageName;
    }

    public String storageName() {
        return storageName;
    }
}
