package com.libragraph.filestore.core.storage;

import io.smallrye.mutiny.Uni;

import java.time.Duration;

/**
 * A commit ran past {@code filestore.io.timeout}. The write may still be in
 * progress and may yet land; {@link #settled()} completes once it has finished
 * either way.
 */
public class CommitTimeoutException extends StorageException {

    private final String storageName;
    private final transient Uni<Void> settled;

    public CommitTimeoutException(String storageName, Duration timeout, Uni<Void> settled) {
        super("Timed out after " + timeout + ": commit " + storageName);
        this.storageName = storageName;
        this.settled = settled;
    }

    public String storageName() {
        return storageName;
    }

    /**
     * Emits null once the abandoned write has completed or failed. Never fails.
     */
    public Uni<Void> settled() {
        return settled;
    }
}
