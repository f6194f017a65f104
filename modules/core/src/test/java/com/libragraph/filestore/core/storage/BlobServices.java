package com.libragraph.filestore.core.storage;

import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.ExecutorService;

/**
 * Wires storage beans by hand for tests that run without a container.
 */
public final class BlobServices {

    private BlobServices() {}

    public static FilesystemBlobStore filesystem(Path root) {
        FilesystemBlobStore store = new FilesystemBlobStore();
        store.root = root.toString();
        return store;
    }

    public static BlobService over(BlobStore store, ExecutorService executor) {
        return over(store, executor, Duration.ofSeconds(5));
    }

    public static BlobService over(BlobStore store, ExecutorService executor, Duration timeout) {
        BlobService service = new BlobService();
        service.store = store;
        service.executor = executor;
        service.timeout = timeout;
        return service;
    }
}
